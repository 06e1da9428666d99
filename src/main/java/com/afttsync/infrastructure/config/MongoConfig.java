package com.afttsync.infrastructure.config;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

/**
 * MongoDB configuration shared by the entity store and the task ledger.
 */
@Configuration
public class MongoConfig {

    @Value("${mongodb.uri:mongodb://localhost:27017/?connectTimeoutMS=5000&serverSelectionTimeoutMS=5000}")
    private String mongoUri;

    @Value("${mongodb.database:aftt}")
    private String database;

    @Bean(destroyMethod = "close")
    public MongoClient mongoClient() {
        ConnectionString connectionString = new ConnectionString(mongoUri);
        MongoClientSettings settings = MongoClientSettings.builder()
            .applyConnectionString(connectionString)
            .build();
        return MongoClients.create(settings);
    }

    @Bean
    public MongoTemplate mongoTemplate(MongoClient mongoClient) {
        return new MongoTemplate(mongoClient, database);
    }

    @Bean
    public String mongoDatabaseName() {
        return database;
    }
}
