package com.tasksmith.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Spring {@link Configuration} that provides the {@link PlanStore} bean.
 * <p>
 * By default a {@link JdbcPlanStore} persists plans to the SQLite database configured as the
 * application {@link DataSource}. With {@code tasksmith.store.type=memory} an
 * {@link InMemoryPlanStore} is used instead; suitable for trials and testing but not durable
 * across restarts, so stale-run recovery has nothing to reconcile.
 */
@Configuration
public class StoreConfig {

    private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

    @Bean
    @ConditionalOnProperty(prefix = "tasksmith.store", name = "type", havingValue = "jdbc", matchIfMissing = true)
    public PlanStore jdbcPlanStore(DataSource dataSource, ObjectMapper objectMapper,
                                   StoreProperties properties) throws IOException {
        Path directory = Path.of(properties.getDirectory());
        Files.createDirectories(directory);
        log.info("Configuring JDBC plan store (SQLite under {})", directory.toAbsolutePath());
        var store = new JdbcPlanStore(dataSource, objectMapper);
        store.createTables();
        return store;
    }

    @Bean
    @ConditionalOnProperty(prefix = "tasksmith.store", name = "type", havingValue = "memory")
    public PlanStore memoryPlanStore() {
        log.info("Using in-memory plan store (state will not persist across restarts)");
        return new InMemoryPlanStore();
    }
}
