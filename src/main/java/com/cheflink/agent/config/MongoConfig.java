package com.cheflink.agent.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.config.EnableMongoAuditing;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

/**
 * Auditing fills {@code @CreatedDate} on run traces.
 */
@Configuration
@EnableMongoAuditing
@EnableMongoRepositories(basePackages = "com.cheflink.agent.observability")
public class MongoConfig {
}
