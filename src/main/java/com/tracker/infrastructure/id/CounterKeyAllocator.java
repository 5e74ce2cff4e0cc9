package com.tracker.infrastructure.id;

import com.tracker.adapter.out.persistence.JdbcCounterStore;
import com.tracker.application.port.out.KeyAllocator;
import com.tracker.application.port.out.MetricsPort;
import com.tracker.domain.model.IssueKey;
import com.tracker.infrastructure.config.AppProperties;
import com.tracker.infrastructure.persistence.ConnectionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Allocates keys from a single persisted counter shared by all prefixes.
 *
 * <p>The read-increment-write runs in one transaction with the counter row locked
 * ({@code SELECT ... FOR UPDATE}) while the connection manager holds exclusive use of the
 * connection, so concurrent allocations never observe the same value. Any failure rolls the
 * transaction back and leaves the counter untouched.
 */
@Component
public class CounterKeyAllocator implements KeyAllocator {

    private static final Logger log = LoggerFactory.getLogger(CounterKeyAllocator.class);

    private final ConnectionManager connectionManager;
    private final JdbcCounterStore counterStore;
    private final AppProperties appProperties;
    private final MetricsPort metrics;

    public CounterKeyAllocator(
            ConnectionManager connectionManager,
            JdbcCounterStore counterStore,
            AppProperties appProperties,
            MetricsPort metrics) {
        this.connectionManager = connectionManager;
        this.counterStore = counterStore;
        this.appProperties = appProperties;
        this.metrics = metrics;
    }

    @Override
    public String allocate(String prefix) {
        IssueKey.requireValidPrefix(prefix);
        String counterName = appProperties.getKeys().getCounterName();

        try {
            connectionManager.execute(connection -> {
                counterStore.ensureSchema(connection);
                return null;
            });

            long next = connectionManager.inTransaction(connection -> {
                long current = counterStore.readForUpdate(connection, counterName).orElse(0L);
                long incremented = current + 1;
                counterStore.write(connection, counterName, incremented);
                return incremented;
            });

            String key = IssueKey.of(prefix, next).format();
            metrics.incrementKeysAllocated();
            log.debug("Allocated key={} from counter={}", key, counterName);
            return key;
        } catch (RuntimeException e) {
            log.error("Failed to allocate key for prefix={}: {}", prefix, e.getMessage());
            throw e;
        }
    }

    /**
     * Current persisted counter value; an absent counter reads as 0.
     */
    public long currentValue() {
        String counterName = appProperties.getKeys().getCounterName();
        return connectionManager.execute(connection -> {
            counterStore.ensureSchema(connection);
            return counterStore.read(connection, counterName).orElse(0L);
        });
    }
}
