package com.hostsentinel.monitor.store;

import com.hostsentinel.core.alert.AlertManager;
import com.hostsentinel.core.model.Alert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Writes alert records from {@link AlertManager} to the {@link AlertStore}.
 *
 * <h3>Ordering</h3>
 * <p>
 * Callers pass an alert id, never a snapshot. Under a lock for that id the
 * writer reads the manager's current record and upserts it, so the write that
 * finishes last always carries the newest state, whatever order the poller and
 * operator actions ran in.
 * </p>
 *
 * <h3>Failed writes</h3>
 * <p>
 * An id whose write failed stays pending until a later write of the same id
 * succeeds. The poller re-writes pending ids of every metric it evaluates,
 * even when the alert did not change in that pass.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertWriter {

    private static final Logger LOG = LoggerFactory.getLogger(AlertWriter.class);

    private final AlertManager alertManager;
    private final AlertStore store;
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Set<String> pending = ConcurrentHashMap.newKeySet();

    public AlertWriter(AlertManager alertManager, AlertStore store) {
        this.alertManager = Objects.requireNonNull(alertManager, "alertManager must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    /**
     * Persist the current record of {@code alertId}. Ids with no record in
     * memory, such as pruned alerts, are skipped.
     *
     * @return {@code true} if a row was written
     * @throws PersistenceException if the write fails; the id stays pending
     */
    public boolean write(String alertId) {
        ReentrantLock lock = locks.computeIfAbsent(alertId, k -> new ReentrantLock());
        lock.lock();
        try {
            Optional<Alert> current = alertManager.getAlert(alertId);
            if (current.isEmpty()) {
                pending.remove(alertId);
                return false;
            }
            store.saveAlert(current.get());
            if (pending.remove(alertId)) {
                LOG.info("Wrote previously failed alert {}", alertId);
            }
            return true;
        } catch (PersistenceException e) {
            pending.add(alertId);
            throw e;
        } finally {
            lock.unlock();
        }
    }

    public boolean isPending(String alertId) {
        return pending.contains(alertId);
    }

    public int getPendingCount() {
        return pending.size();
    }
}
