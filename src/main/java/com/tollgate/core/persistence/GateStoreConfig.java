package com.tollgate.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tollgate.core.config.TollgateProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.sql.SQLException;

/**
 * Provides the {@link GateConfigStore}.
 * <p>
 * When a {@link DataSource} is available (the {@code postgres} profile), a
 * {@link JdbcGateConfigStore} is created and its tables ensured. Otherwise an
 * {@link InMemoryGateConfigStore} is used, which does not survive restarts.
 */
@Configuration
public class GateStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(GateStoreConfig.class);

    @Bean
    public GateConfigStore gateConfigStore(ObjectProvider<DataSource> dataSource,
                                           ObjectMapper objectMapper,
                                           TollgateProperties properties) throws SQLException {
        DataSource ds = dataSource.getIfAvailable();
        if (ds == null) {
            log.info("No DataSource available; using in-memory gate store (state will not persist across restarts)");
            return new InMemoryGateConfigStore();
        }
        log.info("Configuring JDBC gate store");
        var store = new JdbcGateConfigStore(ds, objectMapper);
        if (properties.isSchemaInit()) {
            store.createTables();
        }
        return store;
    }
}
