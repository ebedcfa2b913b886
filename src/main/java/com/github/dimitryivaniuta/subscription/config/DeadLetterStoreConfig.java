package com.github.dimitryivaniuta.subscription.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.subscription.persistence.InMemoryPoisonEventStore;
import com.github.dimitryivaniuta.subscription.persistence.JdbcPoisonEventStore;
import com.github.dimitryivaniuta.subscription.persistence.PoisonEventStore;
import com.github.dimitryivaniuta.subscription.reliability.lock.DistributedLock;
import com.github.dimitryivaniuta.subscription.reliability.lock.InMemoryDistributedLock;
import com.github.dimitryivaniuta.subscription.reliability.lock.PostgresAdvisoryLock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * Quarantine store and retry lock. PostgreSQL unless {@code app.dead-letter.store} /
 * {@code app.dead-letter.lock} say {@code in-memory}.
 */
@Configuration
public class DeadLetterStoreConfig {

    @Bean
    @ConditionalOnProperty(prefix = "app.dead-letter", name = "store", havingValue = "jdbc", matchIfMissing = true)
    public PoisonEventStore jdbcPoisonEventStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        return new JdbcPoisonEventStore(jdbcTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.dead-letter", name = "store", havingValue = "in-memory")
    public PoisonEventStore inMemoryPoisonEventStore() {
        return new InMemoryPoisonEventStore();
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.dead-letter", name = "lock", havingValue = "postgres", matchIfMissing = true)
    public DistributedLock postgresAdvisoryLock(DataSource dataSource, DeadLetterProperties properties) {
        return new PostgresAdvisoryLock(dataSource, properties.getLockPollInterval());
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.dead-letter", name = "lock", havingValue = "in-memory")
    public DistributedLock inMemoryDistributedLock() {
        return new InMemoryDistributedLock();
    }
}
