package org.hastats.migrations.source.jdbc;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.hastats.migrations.pipeline.error.SourceReadException;
import org.hastats.migrations.pipeline.ir.EntityDescriptor;
import org.hastats.migrations.pipeline.ir.RawRecord;
import org.hastats.migrations.pipeline.ir.SeriesTier;
import org.hastats.migrations.pipeline.source.RecordPageRequest;
import org.hastats.migrations.pipeline.source.StatisticsSource;

import lombok.extern.slf4j.Slf4j;
import org.sqlite.SQLiteConfig;

/**
 * Reads a recorder SQLite database through a single read-only connection.
 *
 * The connection is opened once and held until {@link #close()}. Statements are serialized on
 * this instance; the pipeline never issues two at a time anyway.
 */
@Slf4j
public class JdbcStatisticsSource implements StatisticsSource {

    private static final int BUSY_TIMEOUT_MILLIS = 30_000;

    private final Path databasePath;
    private final Connection connection;
    private final String metadataQuery;

    JdbcStatisticsSource(Path databasePath, Connection connection) throws SQLException {
        this.databasePath = databasePath;
        this.connection = connection;

        var tables = listTables(connection);
        var missing = RecorderSchema.REQUIRED_TABLES.stream().filter(t -> !tables.contains(t)).toList();
        if (!missing.isEmpty()) {
            throw new SourceReadException("Database " + databasePath + " is missing required tables " + missing);
        }
        boolean hasName = listColumns(connection, "statistics_meta").contains("name");
        if (tables.containsAll(RecorderSchema.ATTRIBUTE_TABLES)) {
            this.metadataQuery = RecorderSchema.metadataWithAttributes(hasName);
            log.info("Opened {}: friendly names and device classes come from the latest state attributes",
                databasePath);
        } else {
            this.metadataQuery = RecorderSchema.metadataOnly(hasName);
            log.warn("Opened {}: states_meta, states or state_attributes missing, using basic metadata only",
                databasePath);
        }
    }

    /**
     * Open the database read-only and check that the statistics tables exist.
     *
     * @throws SourceReadException when the file is missing, unreadable or not a recorder database
     */
    public static JdbcStatisticsSource open(Path databasePath) {
        if (!Files.isRegularFile(databasePath)) {
            throw new SourceReadException("Database file not found: " + databasePath);
        }
        var config = new SQLiteConfig();
        config.setReadOnly(true);
        config.setBusyTimeout(BUSY_TIMEOUT_MILLIS);
        Connection connection = null;
        try {
            connection = DriverManager.getConnection("jdbc:sqlite:" + databasePath, config.toProperties());
            return new JdbcStatisticsSource(databasePath, connection);
        } catch (SQLException | RuntimeException e) {
            closeAfterFailure(connection, e);
            if (e instanceof SourceReadException sourceReadException) {
                throw sourceReadException;
            }
            throw new SourceReadException("Failed to open database " + databasePath, e);
        }
    }

    @Override
    public synchronized long approximateEntityCount() {
        try (var statement = connection.prepareStatement(RecorderSchema.APPROXIMATE_COUNT);
             var rs = statement.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0;
        } catch (SQLException e) {
            throw new SourceReadException("Failed to estimate entity count in " + databasePath, e);
        }
    }

    @Override
    public synchronized List<EntityDescriptor> readEntityPage(long offset, int limit) {
        try (var statement = connection.prepareStatement(metadataQuery)) {
            statement.setInt(1, limit);
            statement.setLong(2, offset);
            var page = new ArrayList<EntityDescriptor>(Math.min(limit, 10_000));
            try (var rs = statement.executeQuery()) {
                while (rs.next()) {
                    page.add(EntityDescriptor.fromMetadata(
                        rs.getInt("id"),
                        rs.getString("statistic_id"),
                        rs.getString("unit_of_measurement"),
                        rs.getString("source"),
                        rs.getString("name"),
                        rs.getString("friendly_name"),
                        rs.getString("device_class"),
                        rs.getString("state_class")));
                }
            }
            return page;
        } catch (SQLException e) {
            throw new SourceReadException("Failed to read statistics_meta at offset " + offset, e);
        }
    }

    @Override
    public synchronized List<RawRecord> readRecordPage(SeriesTier tier, RecordPageRequest request) {
        var keys = request.isFiltered() ? List.copyOf(request.entityKeys()) : List.<Integer>of();
        var sql = RecorderSchema.recordPage(tier, keys.size(), request.after() != null);
        try (var statement = connection.prepareStatement(sql)) {
            bindRecordPage(statement, keys, request);
            var rows = new ArrayList<RawRecord>(request.limit());
            try (var rs = statement.executeQuery()) {
                while (rs.next()) {
                    rows.add(new RawRecord(rs.getInt(1), rs.getDouble(2), valueOf(rs), tier));
                }
            }
            return rows;
        } catch (SQLException e) {
            throw new SourceReadException("Failed to read " + tier.tableName() + " after " + request.after(), e);
        }
    }

    @Override
    public synchronized void close() throws SQLException {
        connection.close();
        log.debug("Closed {}", databasePath);
    }

    /** {@code state}, or {@code mean} when the state is absent or not a finite number. */
    static Double valueOf(ResultSet rs) throws SQLException {
        Double state = nullableDouble(rs, 3);
        if (state != null && Double.isFinite(state)) {
            return state;
        }
        Double mean = nullableDouble(rs, 4);
        return mean != null ? mean : state;
    }

    private static Double nullableDouble(ResultSet rs, int column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    private static void bindRecordPage(PreparedStatement statement, List<Integer> keys, RecordPageRequest request)
        throws SQLException {
        int index = 1;
        for (Integer key : keys) {
            statement.setInt(index++, key);
        }
        if (request.after() != null) {
            statement.setInt(index++, request.after().entityKey());
            statement.setInt(index++, request.after().entityKey());
            statement.setDouble(index++, request.after().timestamp());
        }
        statement.setInt(index, request.limit());
    }

    private static Set<String> listTables(Connection connection) throws SQLException {
        var tables = new HashSet<String>();
        try (var statement = connection.createStatement();
             var rs = statement.executeQuery("SELECT name FROM sqlite_master WHERE type = 'table'")) {
            while (rs.next()) {
                tables.add(rs.getString(1));
            }
        }
        return tables;
    }

    private static Set<String> listColumns(Connection connection, String table) throws SQLException {
        var columns = new HashSet<String>();
        try (var statement = connection.createStatement();
             var rs = statement.executeQuery("PRAGMA table_info(" + table + ")")) {
            while (rs.next()) {
                columns.add(rs.getString("name"));
            }
        }
        return columns;
    }

    private static void closeAfterFailure(Connection connection, Exception failure) {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException closeFailure) {
            failure.addSuppressed(closeFailure);
        }
    }
}
