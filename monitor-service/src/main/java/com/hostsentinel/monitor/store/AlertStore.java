package com.hostsentinel.monitor.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.hostsentinel.core.model.Alert;
import com.hostsentinel.core.model.AlertLevel;
import com.hostsentinel.core.model.Device;
import com.hostsentinel.core.model.DeviceStatus;
import com.hostsentinel.monitor.telemetry.TelemetrySnapshot;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * SQLite persistence for devices, metric samples and alerts.
 *
 * <h3>Schema</h3>
 * <ul>
 *   <li>{@code devices}: one row per device id, written with {@code INSERT OR REPLACE};
 *       {@code hardware_info} and {@code services} are JSON objects</li>
 *   <li>{@code metrics}: append-only samples, indexed by {@code (device_id, timestamp)}</li>
 *   <li>{@code alerts}: one row per alert key, written with {@code INSERT OR REPLACE},
 *       indexed by {@code (device_id, resolved)}</li>
 * </ul>
 *
 * <p>
 * Timestamps are stored as fixed-width UTC ISO-8601 text with millisecond
 * precision, so text order is time order.
 * </p>
 *
 * <p>
 * Every operation throws {@link PersistenceException} on failure.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertStore implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AlertStore.class);

    static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter
            .ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'")
            .withZone(ZoneOffset.UTC);

    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, Double>> DOUBLE_MAP = new TypeReference<>() {
    };

    private static final String[] SCHEMA = {
            "CREATE TABLE IF NOT EXISTS devices ("
                    + "id TEXT PRIMARY KEY, "
                    + "ip TEXT, "
                    + "hostname TEXT, "
                    + "os_type TEXT, "
                    + "status TEXT NOT NULL, "
                    + "monitoring_enabled INTEGER NOT NULL DEFAULT 0, "
                    + "last_seen TEXT, "
                    + "hardware_info TEXT, "
                    + "services TEXT, "
                    + "connection_errors INTEGER NOT NULL DEFAULT 0)",
            "CREATE TABLE IF NOT EXISTS metrics ("
                    + "id INTEGER PRIMARY KEY AUTOINCREMENT, "
                    + "device_id TEXT NOT NULL, "
                    + "timestamp TEXT NOT NULL, "
                    + "cpu_percent REAL, "
                    + "memory_percent REAL, "
                    + "disk_percent REAL, "
                    + "network_bytes_sent INTEGER, "
                    + "network_bytes_recv INTEGER, "
                    + "load_avg_1 REAL, "
                    + "FOREIGN KEY (device_id) REFERENCES devices (id))",
            "CREATE TABLE IF NOT EXISTS alerts ("
                    + "id TEXT PRIMARY KEY, "
                    + "device_id TEXT NOT NULL, "
                    + "metric TEXT NOT NULL, "
                    + "level TEXT NOT NULL, "
                    + "value REAL NOT NULL, "
                    + "threshold_value REAL NOT NULL, "
                    + "timestamp TEXT NOT NULL, "
                    + "acknowledged INTEGER NOT NULL DEFAULT 0, "
                    + "resolved INTEGER NOT NULL DEFAULT 0, "
                    + "message TEXT)",
            "CREATE INDEX IF NOT EXISTS idx_metrics_device_time ON metrics (device_id, timestamp)",
            "CREATE INDEX IF NOT EXISTS idx_alerts_device_resolved ON alerts (device_id, resolved)"
    };

    private final ConnectionPool pool;
    private final ObjectMapper mapper;
    private final Clock clock;

    /**
     * Wrap an open pool and create the schema if needed.
     *
     * @throws PersistenceException if the schema cannot be created
     */
    public AlertStore(ConnectionPool pool, ObjectMapper mapper, Clock clock) {
        this.pool = Objects.requireNonNull(pool, "pool must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        initSchema();
    }

    /**
     * Open a pool of {@code connections} to {@code databasePath} and wrap it.
     *
     * @throws PersistenceException if the database cannot be opened
     */
    public static AlertStore open(String databasePath, int connections, Clock clock) {
        return open(databasePath, connections, clock, null);
    }

    /**
     * Same as {@link #open(String, int, Clock)}, publishing Hikari's pool
     * meters to {@code meterRegistry} when it is not {@code null}.
     */
    public static AlertStore open(String databasePath, int connections, Clock clock, MeterRegistry meterRegistry) {
        ConnectionPool pool = new ConnectionPool(databasePath, connections, meterRegistry);
        try {
            return new AlertStore(pool, defaultMapper(), clock);
        } catch (PersistenceException e) {
            pool.close();
            throw e;
        }
    }

    /**
     * Mapper used for the JSON columns. Dates inside hardware info are written
     * as ISO-8601 text.
     */
    public static ObjectMapper defaultMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        return mapper;
    }

    private void initSchema() {
        pool.withConnection(conn -> {
            try (Statement stmt = conn.createStatement()) {
                for (String ddl : SCHEMA) {
                    stmt.execute(ddl);
                }
            }
            return null;
        });
        LOG.debug("Database schema ready");
    }

    // ---------------------------------------------------------------
    // Devices
    // ---------------------------------------------------------------

    public void saveDevice(Device device) {
        String hardwareJson = toJson(device.getHardwareInfo());
        String servicesJson = toJson(device.getServices());
        pool.withConnection(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT OR REPLACE INTO devices (id, ip, hostname, os_type, status, monitoring_enabled, "
                            + "last_seen, hardware_info, services, connection_errors) "
                            + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
                ps.setString(1, device.getId());
                ps.setString(2, device.getIp());
                ps.setString(3, device.getHostname());
                ps.setString(4, device.getOsType());
                ps.setString(5, device.getStatus().name());
                ps.setBoolean(6, device.isMonitoringEnabled());
                ps.setString(7, formatTimestamp(device.getLastUpdate()));
                ps.setString(8, hardwareJson);
                ps.setString(9, servicesJson);
                ps.setInt(10, device.getConnectionErrors());
                return ps.executeUpdate();
            }
        });
    }

    /**
     * @return every stored device keyed by id, in id order
     */
    public Map<String, Device> loadDevices() {
        return pool.withConnection(conn -> {
            Map<String, Device> devices = new LinkedHashMap<>();
            try (Statement stmt = conn.createStatement();
                    ResultSet rs = stmt.executeQuery(
                            "SELECT id, ip, hostname, os_type, status, monitoring_enabled, last_seen, "
                                    + "hardware_info, services, connection_errors FROM devices ORDER BY id")) {
                while (rs.next()) {
                    Device device = readDevice(rs);
                    devices.put(device.getId(), device);
                }
            }
            return devices;
        });
    }

    private Device readDevice(ResultSet rs) throws SQLException {
        Device device = new Device(rs.getString("id"));
        device.setIp(rs.getString("ip"));
        device.setHostname(rs.getString("hostname"));
        device.setOsType(rs.getString("os_type"));
        device.setStatus(DeviceStatus.fromString(rs.getString("status")));
        device.setMonitoringEnabled(rs.getBoolean("monitoring_enabled"));
        device.setLastUpdate(parseTimestamp(rs.getString("last_seen")));
        device.setHardwareInfo(fromJson(rs.getString("hardware_info"), OBJECT_MAP, device.getId()));
        device.setServices(fromJson(rs.getString("services"), DOUBLE_MAP, device.getId()));
        device.setConnectionErrors(rs.getInt("connection_errors"));
        return device;
    }

    // ---------------------------------------------------------------
    // Metrics
    // ---------------------------------------------------------------

    /**
     * Append a metrics row stamped with the snapshot's own timestamp, or now
     * if it has none.
     */
    public void saveMetrics(String deviceId, TelemetrySnapshot snapshot) {
        saveMetrics(deviceId, snapshot.getTimestamp().orElseGet(clock::instant), snapshot);
    }

    /**
     * Append a metrics row for the device.
     *
     * @throws IllegalArgumentException if cpu, memory or disk is missing
     */
    public void saveMetrics(String deviceId, Instant timestamp, TelemetrySnapshot snapshot) {
        double cpu = required(snapshot, TelemetrySnapshot.CPU);
        double memory = required(snapshot, TelemetrySnapshot.MEMORY);
        double disk = required(snapshot, TelemetrySnapshot.DISK);
        pool.withConnection(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT INTO metrics (device_id, timestamp, cpu_percent, memory_percent, disk_percent, "
                            + "network_bytes_sent, network_bytes_recv, load_avg_1) "
                            + "VALUES (?, ?, ?, ?, ?, ?, ?, ?)")) {
                ps.setString(1, deviceId);
                ps.setString(2, formatTimestamp(timestamp));
                ps.setDouble(3, cpu);
                ps.setDouble(4, memory);
                ps.setDouble(5, disk);
                setNullableLong(ps, 6, snapshot.getNetworkBytesSent().orElse(null));
                setNullableLong(ps, 7, snapshot.getNetworkBytesReceived().orElse(null));
                Double load1 = snapshot.getLoadAverage().map(load -> load[0]).orElse(null);
                if (load1 == null) {
                    ps.setNull(8, Types.REAL);
                } else {
                    ps.setDouble(8, load1);
                }
                return ps.executeUpdate();
            }
        });
    }

    /**
     * @return up to {@code limit} most recent rows for the device, newest first
     */
    public List<MetricRecord> loadMetrics(String deviceId, int limit) {
        if (limit < 1) {
            return Collections.emptyList();
        }
        return pool.withConnection(conn -> {
            List<MetricRecord> records = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(
                    "SELECT device_id, timestamp, cpu_percent, memory_percent, disk_percent, "
                            + "network_bytes_sent, network_bytes_recv, load_avg_1 FROM metrics "
                            + "WHERE device_id = ? ORDER BY timestamp DESC, id DESC LIMIT ?")) {
                ps.setString(1, deviceId);
                ps.setInt(2, limit);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        records.add(new MetricRecord(
                                rs.getString("device_id"),
                                parseTimestamp(rs.getString("timestamp")),
                                rs.getDouble("cpu_percent"),
                                rs.getDouble("memory_percent"),
                                rs.getDouble("disk_percent"),
                                getNullableLong(rs, "network_bytes_sent"),
                                getNullableLong(rs, "network_bytes_recv"),
                                getNullableDouble(rs, "load_avg_1")));
                    }
                }
            }
            return records;
        });
    }

    // ---------------------------------------------------------------
    // Alerts
    // ---------------------------------------------------------------

    public void saveAlert(Alert alert) {
        pool.withConnection(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT OR REPLACE INTO alerts (id, device_id, metric, level, value, threshold_value, "
                            + "timestamp, acknowledged, resolved, message) "
                            + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
                ps.setString(1, alert.getId());
                ps.setString(2, alert.getDeviceId());
                ps.setString(3, alert.getMetric());
                ps.setString(4, alert.getLevel().storageName());
                ps.setDouble(5, alert.getValue());
                ps.setDouble(6, alert.getThreshold());
                ps.setString(7, formatTimestamp(alert.getTimestamp()));
                ps.setBoolean(8, alert.isAcknowledged());
                ps.setBoolean(9, alert.isResolved());
                ps.setString(10, alert.getMessage());
                return ps.executeUpdate();
            }
        });
    }

    /**
     * @param unresolvedOnly {@code true} to skip resolved alerts
     * @return stored alerts, oldest first
     */
    public List<Alert> loadAlerts(boolean unresolvedOnly) {
        String sql = "SELECT device_id, metric, level, value, threshold_value, timestamp, acknowledged, "
                + "resolved, message FROM alerts"
                + (unresolvedOnly ? " WHERE resolved = 0" : "")
                + " ORDER BY timestamp, id";
        return pool.withConnection(conn -> {
            List<Alert> alerts = new ArrayList<>();
            try (Statement stmt = conn.createStatement(); ResultSet rs = stmt.executeQuery(sql)) {
                while (rs.next()) {
                    Alert alert = readAlert(rs);
                    if (alert != null) {
                        alerts.add(alert);
                    }
                }
            }
            return alerts;
        });
    }

    private Alert readAlert(ResultSet rs) throws SQLException {
        String deviceId = rs.getString("device_id");
        String metric = rs.getString("metric");
        Instant timestamp = parseTimestamp(rs.getString("timestamp"));
        AlertLevel level;
        try {
            level = AlertLevel.fromString(rs.getString("level"));
        } catch (IllegalArgumentException e) {
            LOG.warn("Skipping alert row {} with unknown level: {}", Alert.keyOf(deviceId, metric), e.getMessage());
            return null;
        }
        if (timestamp == null) {
            LOG.warn("Skipping alert row {} without a timestamp", Alert.keyOf(deviceId, metric));
            return null;
        }
        return Alert.builder()
                .deviceId(deviceId)
                .metric(metric)
                .level(level)
                .value(rs.getDouble("value"))
                .threshold(rs.getDouble("threshold_value"))
                .timestamp(timestamp)
                .acknowledged(rs.getBoolean("acknowledged"))
                .resolved(rs.getBoolean("resolved"))
                .message(rs.getString("message"))
                .build();
    }

    /**
     * Delete resolved alerts last changed before {@code olderThan}.
     *
     * @return rows deleted
     */
    public int pruneResolvedAlerts(Instant olderThan) {
        int deleted = pool.withConnection(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "DELETE FROM alerts WHERE resolved = 1 AND timestamp < ?")) {
                ps.setString(1, formatTimestamp(olderThan));
                return ps.executeUpdate();
            }
        });
        if (deleted > 0) {
            LOG.info("Pruned {} resolved alert(s) older than {}", deleted, olderThan);
        }
        return deleted;
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    public ConnectionPool getPool() {
        return pool;
    }

    @Override
    public void close() {
        pool.close();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    static String formatTimestamp(Instant instant) {
        return instant == null ? null : TIMESTAMP_FORMAT.format(instant);
    }

    private static Instant parseTimestamp(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            LOG.warn("Ignoring unparseable timestamp '{}'", text);
            return null;
        }
    }

    private String toJson(Map<String, ?> value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialise JSON column: " + e.getMessage(), e);
        }
    }

    private <T> Map<String, T> fromJson(String json, TypeReference<Map<String, T>> type, String deviceId) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            Map<String, T> parsed = mapper.readValue(json, type);
            return parsed == null ? Collections.emptyMap() : parsed;
        } catch (JsonProcessingException e) {
            LOG.warn("Ignoring malformed JSON column for device {}: {}", deviceId, e.getOriginalMessage());
            return Collections.emptyMap();
        }
    }

    private static double required(TelemetrySnapshot snapshot, String metric) {
        return snapshot.getMetric(metric)
                .orElseThrow(() -> new IllegalArgumentException("snapshot has no " + metric + " value"));
    }

    private static void setNullableLong(PreparedStatement ps, int index, Long value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setLong(index, value);
        }
    }

    private static Long getNullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static Double getNullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }
}
