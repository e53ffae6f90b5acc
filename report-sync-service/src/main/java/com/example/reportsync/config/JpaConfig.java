package com.example.reportsync.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

/**
 * Enables JPA auditing for the created_at / updated_at columns of BaseEntity.
 * Kept off the application class so web slice tests do not need a JPA context.
 */
@Configuration
@EnableJpaAuditing
public class JpaConfig {
}
