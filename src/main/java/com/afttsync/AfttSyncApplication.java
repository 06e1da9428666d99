package com.afttsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main Spring Boot application for the AFTT catalog synchronisation service.
 */
@SpringBootApplication
@EnableScheduling
public class AfttSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(AfttSyncApplication.class, args);
    }
}
