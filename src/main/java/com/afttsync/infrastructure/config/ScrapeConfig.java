package com.afttsync.infrastructure.config;

import com.afttsync.application.usecase.CompetitionsPlan;
import com.afttsync.application.usecase.FullScrapePlan;
import com.afttsync.application.usecase.OrganizationsPlan;
import com.afttsync.application.usecase.ProfilesPlan;
import com.afttsync.application.usecase.ScrapeSettings;
import com.afttsync.application.usecase.ScrapeTaskOrchestrator;
import com.afttsync.application.usecase.TaskRegistry;
import com.afttsync.domain.merge.NonRegressionMerger;
import com.afttsync.domain.merge.RegionDerivation;
import com.afttsync.domain.model.CompetitionType;
import com.afttsync.domain.model.TaskKind;
import com.afttsync.infrastructure.extraction.CompetitionEntriesExtractor;
import com.afttsync.infrastructure.extraction.CompetitionListExtractor;
import com.afttsync.infrastructure.extraction.CompetitionSeriesExtractor;
import com.afttsync.infrastructure.extraction.EntityExtractor;
import com.afttsync.infrastructure.extraction.MemberDirectoryExtractor;
import com.afttsync.infrastructure.extraction.OrganizationListExtractor;
import com.afttsync.infrastructure.extraction.ProfileExtractor;
import com.afttsync.infrastructure.persistence.MongoEntityStore;
import com.afttsync.infrastructure.persistence.MongoTaskLedger;
import com.afttsync.infrastructure.upstream.AfttCatalogRequests;
import com.afttsync.infrastructure.upstream.HttpClientTransport;
import com.afttsync.infrastructure.upstream.RetryPolicy;
import com.afttsync.infrastructure.upstream.Sleeper;
import com.afttsync.infrastructure.upstream.UpstreamClient;
import com.mongodb.client.MongoClient;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the upstream client, extractor, stores and orchestrator.
 */
@Configuration
public class ScrapeConfig {

    @Bean
    public RetryPolicy retryPolicy(@Value("${upstream.retry.max-attempts:3}") int maxAttempts,
                                   @Value("${upstream.retry.base-delay-ms:2000}") long baseDelayMs,
                                   @Value("${upstream.retry.multiplier:2.0}") double multiplier) {
        return new RetryPolicy(maxAttempts, Duration.ofMillis(baseDelayMs), multiplier);
    }

    @Bean(destroyMethod = "close")
    public CloseableHttpClient upstreamHttpClient() {
        return HttpClients.createDefault();
    }

    @Bean
    public UpstreamClient upstreamClient(CloseableHttpClient upstreamHttpClient, RetryPolicy retryPolicy) {
        return new UpstreamClient(new HttpClientTransport(upstreamHttpClient), retryPolicy, Sleeper.SYSTEM);
    }

    @Bean
    public AfttCatalogRequests catalogRequests(
            @Value("${upstream.data-base-url:https://data.aftt.be}") String dataBaseUrl,
            @Value("${upstream.results-base-url:https://resultats.aftt.be}") String resultsBaseUrl,
            @Value("${upstream.timeout-seconds:30}") long timeoutSeconds) {
        return new AfttCatalogRequests(dataBaseUrl, resultsBaseUrl, Duration.ofSeconds(timeoutSeconds));
    }

    @Bean
    public EntityExtractor entityExtractor() {
        return new EntityExtractor(List.of(
            new OrganizationListExtractor(),
            new MemberDirectoryExtractor(),
            new ProfileExtractor(CompetitionType.MEN),
            new ProfileExtractor(CompetitionType.WOMEN),
            new CompetitionListExtractor(),
            new CompetitionSeriesExtractor(),
            new CompetitionEntriesExtractor()));
    }

    @Bean
    public NonRegressionMerger nonRegressionMerger() {
        return new NonRegressionMerger(List.of(new RegionDerivation()));
    }

    @Bean
    public MongoEntityStore entityStore(MongoClient mongoClient, String mongoDatabaseName,
                                        NonRegressionMerger nonRegressionMerger) {
        return new MongoEntityStore(mongoClient, mongoDatabaseName, nonRegressionMerger);
    }

    @Bean
    public MongoTaskLedger taskLedger(MongoTemplate mongoTemplate) {
        return new MongoTaskLedger(mongoTemplate);
    }

    @Bean
    public ScrapeSettings scrapeSettings(@Value("${scrape.pacing-delay-ms:300}") long pacingDelayMs,
                                         @Value("${scrape.profile-pacing-delay-ms:300}") long profilePacingDelayMs,
                                         @Value("${scrape.log-capacity:1000}") int logCapacity) {
        return new ScrapeSettings(Duration.ofMillis(pacingDelayMs), Duration.ofMillis(profilePacingDelayMs),
            logCapacity);
    }

    /** One worker per task kind, so every kind can run at the same time. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService scrapeExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "scrape-task-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(TaskKind.values().length, threadFactory);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ScrapeTaskOrchestrator scrapeTaskOrchestrator(UpstreamClient upstreamClient, EntityExtractor entityExtractor,
                                                         AfttCatalogRequests catalogRequests,
                                                         MongoEntityStore entityStore, MongoTaskLedger taskLedger,
                                                         ScrapeSettings scrapeSettings, ExecutorService scrapeExecutor,
                                                         Clock clock) {
        return new ScrapeTaskOrchestrator(
            List.of(new OrganizationsPlan(), new ProfilesPlan(), new CompetitionsPlan(), new FullScrapePlan()),
            new TaskRegistry(), taskLedger, entityStore, upstreamClient, entityExtractor, catalogRequests,
            scrapeSettings, scrapeExecutor, clock);
    }
}
