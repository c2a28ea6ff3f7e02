package com.lendora.lending.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

/**
 * JPA Auditing Configuration
 *
 * Populates created/updated timestamps of loans and collateral positions. Kept out of the
 * application class so web slice tests do not need a JPA metamodel.
 */
@Configuration
@EnableJpaAuditing
public class JpaAuditingConfig {
}
