package com.quikdb.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * QuikDB Rewards Engine
 *
 * Settles operator rewards behind rate limiting, circuit breakers,
 * emergency pauses and time-locked administration.
 */
@SpringBootApplication(scanBasePackages = "com.quikdb")
@EntityScan(basePackages = "com.quikdb.core.domain")
@EnableJpaRepositories(basePackages = "com.quikdb.core.repository")
public class QuikdbApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(QuikdbApiApplication.class, args);
    }
}
