package dk.cloudcreate.eventcore.bus.postgresql;

import java.time.Duration;
import java.util.Objects;

import static dk.cloudcreate.eventcore.common.persistence.SqlIdentifiers.requireValidSqlIdentifier;

public final class PostgresqlEventBusConfiguration {
    public static final String DEFAULT_SUBSCRIPTIONS_TABLE_NAME = "event_bus_subscriptions";
    public static final String DEFAULT_DELIVERIES_TABLE_NAME    = "event_bus_deliveries";
    public static final int    DEFAULT_REPLAY_BATCH_SIZE        = 100;

    public final String   subscriptionsTableName;
    public final String   deliveriesTableName;
    /**
     * How often a subscriber worker looks for pending deliveries when it isn't woken by a publish in this process
     */
    public final Duration pollingInterval;
    /**
     * Number of events read from the event store per query when queuing the history for a new or replayed subscriber
     */
    public final int      replayBatchSize;

    public PostgresqlEventBusConfiguration(String subscriptionsTableName,
                                           String deliveriesTableName,
                                           Duration pollingInterval,
                                           int replayBatchSize) {
        this.subscriptionsTableName = requireValidSqlIdentifier(subscriptionsTableName);
        this.deliveriesTableName = requireValidSqlIdentifier(deliveriesTableName);
        this.pollingInterval = Objects.requireNonNull(pollingInterval, "No pollingInterval provided");
        if (pollingInterval.isNegative() || pollingInterval.isZero()) {
            throw new IllegalArgumentException("pollingInterval must be positive");
        }
        if (replayBatchSize < 1) {
            throw new IllegalArgumentException("replayBatchSize must be 1 or larger");
        }
        this.replayBatchSize = replayBatchSize;
    }

    public static PostgresqlEventBusConfiguration defaultConfiguration() {
        return new PostgresqlEventBusConfiguration(DEFAULT_SUBSCRIPTIONS_TABLE_NAME,
                                                   DEFAULT_DELIVERIES_TABLE_NAME,
                                                   Duration.ofMillis(500),
                                                   DEFAULT_REPLAY_BATCH_SIZE);
    }

    public PostgresqlEventBusConfiguration withPollingInterval(Duration pollingInterval) {
        return new PostgresqlEventBusConfiguration(subscriptionsTableName, deliveriesTableName, pollingInterval, replayBatchSize);
    }

    public PostgresqlEventBusConfiguration withReplayBatchSize(int replayBatchSize) {
        return new PostgresqlEventBusConfiguration(subscriptionsTableName, deliveriesTableName, pollingInterval, replayBatchSize);
    }

    public PostgresqlEventBusConfiguration withTableNames(String subscriptionsTableName, String deliveriesTableName) {
        return new PostgresqlEventBusConfiguration(subscriptionsTableName, deliveriesTableName, pollingInterval, replayBatchSize);
    }

    @Override
    public String toString() {
        return "PostgresqlEventBusConfiguration{" +
                "subscriptionsTableName='" + subscriptionsTableName + '\'' +
                ", deliveriesTableName='" + deliveriesTableName + '\'' +
                ", pollingInterval=" + pollingInterval +
                ", replayBatchSize=" + replayBatchSize +
                '}';
    }
}
