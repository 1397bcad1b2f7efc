package teranet.mapdev.listings.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Builds the connection pool of the optional relational sink.
 *
 * The sink is off by default, so no DataSource bean is registered at startup; a pool
 * is created for a single load and closed by the caller afterwards.
 */
@Component
public class DatabaseConfig {

    private static final Logger logger = LoggerFactory.getLogger(DatabaseConfig.class);

    private final EtlProperties properties;

    public DatabaseConfig(EtlProperties properties) {
        this.properties = properties;
    }

    public HikariDataSource createDataSource() {
        EtlProperties.Database database = properties.getLoading().getDatabase();

        String jdbcUrl = database.getJdbcUrl();
        if (jdbcUrl == null || jdbcUrl.isBlank()) {
            throw new IllegalStateException("etl.loading.database.connection-string is required when the database sink is enabled");
        }

        HikariConfig config = new HikariConfig();

        // Basic connection settings
        config.setJdbcUrl(jdbcUrl);
        if (database.getUsername() != null) {
            config.setUsername(database.getUsername());
        }
        if (database.getPassword() != null) {
            config.setPassword(database.getPassword());
        }

        // One load per run, so a small pool is enough
        config.setMaximumPoolSize(database.getPoolSize());
        config.setMinimumIdle(1);
        config.setConnectionTimeout(30000);
        config.setValidationTimeout(5000);

        config.setPoolName("Listings-Sink-Pool");

        logger.debug("Creating connection pool for {}", jdbcUrl);
        return new HikariDataSource(config);
    }

    public JdbcTemplate createJdbcTemplate(HikariDataSource dataSource) {
        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        jdbcTemplate.setQueryTimeout(300); // 5 minutes for the bulk load
        return jdbcTemplate;
    }
}
