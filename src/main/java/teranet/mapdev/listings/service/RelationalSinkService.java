package teranet.mapdev.listings.service;

import com.zaxxer.hikari.HikariDataSource;
import org.postgresql.copy.CopyManager;
import org.postgresql.core.BaseConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import teranet.mapdev.listings.config.DatabaseConfig;
import teranet.mapdev.listings.config.EtlProperties;
import teranet.mapdev.listings.exception.PersistenceException;
import teranet.mapdev.listings.model.ColumnType;
import teranet.mapdev.listings.model.DatabaseLoadResult;
import teranet.mapdev.listings.model.Table;

import java.io.IOException;
import java.io.StringReader;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Mirrors the enriched table into a relational database, replacing any previous copy.
 *
 * The table is dropped, recreated from the inferred column types and loaded in one
 * transaction:
 * - PostgreSQL: COPY FROM STDIN through the driver's CopyManager
 * - any other JDBC database: batched INSERT statements
 *
 * The sink is optional. A failure is logged and reported in the returned result;
 * it never aborts the run.
 */
@Service
public class RelationalSinkService {

    private static final Logger logger = LoggerFactory.getLogger(RelationalSinkService.class);

    private static final DateTimeFormatter COPY_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final DatabaseConfig databaseConfig;
    private final TableNamingService tableNamingService;
    private final EtlProperties properties;

    public RelationalSinkService(DatabaseConfig databaseConfig,
                                 TableNamingService tableNamingService,
                                 EtlProperties properties) {
        this.databaseConfig = databaseConfig;
        this.tableNamingService = tableNamingService;
        this.properties = properties;
    }

    /**
     * Replace {baseName}_table with the contents of the table.
     *
     * @return LOADED with the row count, FAILED with the error message, or DISABLED
     */
    public DatabaseLoadResult load(Table table, String baseName) {
        if (!properties.getLoading().getDatabase().isEnabled()) {
            logger.debug("Database sink disabled");
            return DatabaseLoadResult.disabled();
        }

        String tableName = tableNamingService.generateTableName(baseName);
        logger.info("Loading {} rows into database table {}", table.rowCount(), tableName);

        try (HikariDataSource dataSource = databaseConfig.createDataSource()) {
            JdbcTemplate jdbcTemplate = databaseConfig.createJdbcTemplate(dataSource);
            TransactionTemplate transactionTemplate =
                    new TransactionTemplate(new DataSourceTransactionManager(dataSource));

            Long loaded = transactionTemplate.execute(status -> replaceTable(jdbcTemplate, table, tableName));
            long rows = loaded != null ? loaded : 0L;

            logger.info("Database table {} replaced with {} rows", tableName, rows);
            return DatabaseLoadResult.loaded(tableName, rows);

        } catch (RuntimeException e) {
            PersistenceException failure = new PersistenceException("database",
                    "Failed to load table " + tableName + ": " + e.getMessage(), e);
            logger.error(failure.getMessage(), failure);
            return DatabaseLoadResult.failed(tableName, e.getMessage());
        }
    }

    private long replaceTable(JdbcTemplate jdbcTemplate, Table table, String tableName) {
        List<String> identifiers = tableNamingService.toColumnIdentifiers(table.getColumns());
        Map<String, ColumnType> types = table.schema();

        jdbcTemplate.execute("DROP TABLE IF EXISTS " + quote(tableName));
        jdbcTemplate.execute(buildCreateTableSql(tableName, table.getColumns(), identifiers, types));

        if (table.rowCount() == 0) {
            return 0L;
        }

        Long loaded = jdbcTemplate.execute((ConnectionCallback<Long>) connection -> {
            if (connection.isWrapperFor(BaseConnection.class)) {
                return executeCopy(connection.unwrap(BaseConnection.class), table, tableName, identifiers);
            }
            return null;
        });
        if (loaded != null) {
            return loaded;
        }
        return executeBatchInsert(jdbcTemplate, table, tableName, identifiers);
    }

    /**
     * CREATE TABLE statement with one column per table column, typed from the inferred type.
     */
    public String buildCreateTableSql(String tableName, List<String> columns,
                                      List<String> identifiers, Map<String, ColumnType> types) {
        StringBuilder sql = new StringBuilder("CREATE TABLE ").append(quote(tableName)).append(" (");
        for (int i = 0; i < columns.size(); i++) {
            if (i > 0) sql.append(", ");
            sql.append(quote(identifiers.get(i))).append(' ').append(sqlType(types.get(columns.get(i))));
        }
        return sql.append(')').toString();
    }

    /**
     * Build PostgreSQL COPY command for the sink table.
     *
     * - COPY FROM STDIN for streaming input
     * - FORMAT CSV with tab delimiter
     * - NULL '' so unquoted empty fields load as NULL
     */
    public String buildCopyCommand(String tableName, List<String> identifiers) {
        StringBuilder copyCommand = new StringBuilder();
        copyCommand.append("COPY ").append(quote(tableName));
        copyCommand.append(" (");

        for (int i = 0; i < identifiers.size(); i++) {
            if (i > 0) copyCommand.append(", ");
            copyCommand.append(quote(identifiers.get(i)));
        }

        copyCommand.append(") FROM STDIN WITH (FORMAT CSV, DELIMITER E'\\t', NULL '')");
        return copyCommand.toString();
    }

    private long executeCopy(BaseConnection connection, Table table, String tableName,
                             List<String> identifiers) throws SQLException {
        String copyCommand = buildCopyCommand(tableName, identifiers);
        logger.info("Using COPY command: {}", copyCommand);

        CopyManager copyManager = new CopyManager(connection);
        try {
            long recordCount = copyManager.copyIn(copyCommand, new StringReader(toCopyData(table)));
            logger.info("COPY command inserted {} records into table {}", recordCount, tableName);
            return recordCount;
        } catch (IOException e) {
            throw new SQLException("COPY into " + tableName + " failed", e);
        }
    }

    /**
     * Tab-delimited CSV body for COPY. NULL is an unquoted empty field; empty text is
     * quoted so it stays an empty string.
     */
    String toCopyData(Table table) {
        StringBuilder data = new StringBuilder();
        List<String> columns = table.getColumns();
        for (Map<String, Object> row : table.getRows()) {
            for (int i = 0; i < columns.size(); i++) {
                if (i > 0) data.append('\t');
                data.append(toCopyField(row.get(columns.get(i))));
            }
            data.append('\n');
        }
        return data.toString();
    }

    private String toCopyField(Object value) {
        if (value == null) {
            return "";
        }
        String text = value instanceof LocalDateTime
                ? COPY_TIMESTAMP.format((LocalDateTime) value)
                : value.toString();
        if (text.isEmpty() || text.indexOf('\t') >= 0 || text.indexOf('"') >= 0
                || text.indexOf('\n') >= 0 || text.indexOf('\r') >= 0) {
            return '"' + text.replace("\"", "\"\"") + '"';
        }
        return text;
    }

    private long executeBatchInsert(JdbcTemplate jdbcTemplate, Table table, String tableName,
                                    List<String> identifiers) {
        StringBuilder sql = new StringBuilder("INSERT INTO ").append(quote(tableName)).append(" (");
        StringBuilder placeholders = new StringBuilder();
        for (int i = 0; i < identifiers.size(); i++) {
            if (i > 0) {
                sql.append(", ");
                placeholders.append(", ");
            }
            sql.append(quote(identifiers.get(i)));
            placeholders.append('?');
        }
        sql.append(") VALUES (").append(placeholders).append(')');

        List<String> columns = table.getColumns();
        List<Object[]> batchArgs = new ArrayList<>(table.rowCount());
        for (Map<String, Object> row : table.getRows()) {
            Object[] args = new Object[columns.size()];
            for (int i = 0; i < columns.size(); i++) {
                Object value = row.get(columns.get(i));
                args[i] = value instanceof LocalDateTime ? Timestamp.valueOf((LocalDateTime) value) : value;
            }
            batchArgs.add(args);
        }

        int batchSize = properties.getLoading().getDatabase().getBatchSize();
        long inserted = 0;
        for (int start = 0; start < batchArgs.size(); start += batchSize) {
            List<Object[]> batch = batchArgs.subList(start, Math.min(start + batchSize, batchArgs.size()));
            jdbcTemplate.batchUpdate(sql.toString(), batch);
            inserted += batch.size();
        }
        logger.info("Inserted {} records into table {}", inserted, tableName);
        return inserted;
    }

    private String sqlType(ColumnType type) {
        switch (type) {
            case LONG:
                return "BIGINT";
            case DOUBLE:
                return "DOUBLE PRECISION";
            case BOOLEAN:
                return "BOOLEAN";
            case DATETIME:
                return "TIMESTAMP";
            default:
                return "VARCHAR";
        }
    }

    private String quote(String identifier) {
        return '"' + identifier + '"';
    }
}
