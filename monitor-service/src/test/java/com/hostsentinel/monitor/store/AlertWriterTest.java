package com.hostsentinel.monitor.store;

import com.hostsentinel.core.alert.AlertManager;
import com.hostsentinel.core.config.MonitorConfig;
import com.hostsentinel.core.model.Alert;
import com.hostsentinel.monitor.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AlertWriter}.
 */
class AlertWriterTest {

    private static final String DEVICE = "dev1";
    private static final String CPU_ALERT = Alert.keyOf(DEVICE, "cpu");

    @TempDir
    Path dir;

    private MutableClock clock;
    private AlertManager alertManager;
    private AlertStore store;
    private AlertWriter writer;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        alertManager = AlertManager.fromConfig(new MonitorConfig(), clock);
        store = AlertStore.open(databasePath(), 2, clock);
        writer = new AlertWriter(alertManager, store);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    @DisplayName("Should keep a resolution when a stale acknowledgement write finishes last")
    void shouldWriteCurrentRecordRegardlessOfCallOrder() {
        alertManager.evaluate(DEVICE, "cpu", 97);
        writer.write(CPU_ALERT);

        alertManager.acknowledgeAlert(CPU_ALERT);
        clock.advance(Duration.ofSeconds(5));
        alertManager.evaluate(DEVICE, "cpu", 10);
        writer.write(CPU_ALERT);
        writer.write(CPU_ALERT);

        Alert stored = storedCpuAlert();
        assertThat(stored.isResolved()).isTrue();
        assertThat(stored.isAcknowledged()).isTrue();
        assertThat(store.loadAlerts(true)).isEmpty();
    }

    @Test
    @DisplayName("Should converge on the in-memory record under concurrent acknowledge and resolve")
    void shouldConvergeUnderConcurrentWriters() throws Exception {
        alertManager.evaluate(DEVICE, "cpu", 97);
        writer.write(CPU_ALERT);

        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch go = new CountDownLatch(1);
        try {
            Future<?> poller = pool.submit(() -> {
                go.await();
                for (int i = 0; i < 50; i++) {
                    alertManager.evaluate(DEVICE, "cpu", i % 2 == 0 ? 10 : 97);
                    writer.write(CPU_ALERT);
                }
                return null;
            });
            Future<?> operator = pool.submit(() -> {
                go.await();
                for (int i = 0; i < 50; i++) {
                    alertManager.acknowledgeAlert(CPU_ALERT);
                    writer.write(CPU_ALERT);
                }
                return null;
            });
            go.countDown();
            poller.get(30, TimeUnit.SECONDS);
            operator.get(30, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        Alert inMemory = alertManager.getAlert(CPU_ALERT).orElseThrow();
        Alert stored = storedCpuAlert();
        assertThat(stored.isResolved()).isEqualTo(inMemory.isResolved());
        assertThat(stored.isAcknowledged()).isEqualTo(inMemory.isAcknowledged());
        assertThat(stored.getLevel()).isEqualTo(inMemory.getLevel());
    }

    @Test
    @DisplayName("Should keep a failed write pending until a later write succeeds")
    void shouldTrackPendingWrites() {
        alertManager.evaluate(DEVICE, "cpu", 97);
        dropAlertsTable();

        assertThatThrownBy(() -> writer.write(CPU_ALERT)).isInstanceOf(PersistenceException.class);
        assertThat(writer.isPending(CPU_ALERT)).isTrue();
        assertThat(writer.getPendingCount()).isEqualTo(1);

        AlertStore.open(databasePath(), 1, clock).close();

        assertThat(writer.write(CPU_ALERT)).isTrue();
        assertThat(writer.isPending(CPU_ALERT)).isFalse();
        assertThat(storedCpuAlert().isResolved()).isFalse();
    }

    @Test
    @DisplayName("Should skip ids with no record in memory")
    void shouldSkipUnknownIds() {
        assertThat(writer.write("nope_cpu")).isFalse();
        assertThat(store.loadAlerts(false)).isEmpty();
    }

    // ---- Helpers

    private String databasePath() {
        return dir.resolve("writer.db").toString();
    }

    private Alert storedCpuAlert() {
        List<Alert> all = store.loadAlerts(false);
        assertThat(all).extracting(Alert::getId).containsExactly(CPU_ALERT);
        return all.get(0);
    }

    private void dropAlertsTable() {
        store.getPool().withConnection(conn -> {
            try (Statement stmt = conn.createStatement()) {
                return stmt.executeUpdate("DROP TABLE alerts");
            }
        });
    }
}
