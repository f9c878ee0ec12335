package com.deepansh.salesagent.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.config.EnableMongoAuditing;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

/** Auditing fills @CreatedDate on run traces. */
@Configuration
@EnableMongoAuditing
@EnableMongoRepositories(basePackages = "com.deepansh.salesagent.observability")
public class MongoConfig {
}
