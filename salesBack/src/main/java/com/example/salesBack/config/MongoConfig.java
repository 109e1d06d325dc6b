package com.example.salesBack.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.config.EnableMongoAuditing;

// Kept apart from the application class so web slice tests do not need a Mongo context
@Configuration
@EnableMongoAuditing
public class MongoConfig {
}
