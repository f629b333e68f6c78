package dk.cloudcreate.eventcore.eventstore.postgresql.outbox;

import dk.cloudcreate.eventcore.common.delivery.RedeliveryPolicy;

import java.time.Duration;
import java.util.Objects;

import static dk.cloudcreate.eventcore.common.persistence.SqlIdentifiers.requireValidSqlIdentifier;

public final class OutboxRelayConfiguration {
    public static final String DEFAULT_RELAY_NAME         = "default";
    public static final String DEFAULT_CURSOR_TABLE_NAME  = "event_outbox_relay_cursors";
    public static final int    DEFAULT_BATCH_SIZE         = 100;

    /**
     * Key of the relay's cursor row. Relays with different names relay the outbox independently of each other
     */
    public final String           relayName;
    public final String           cursorTableName;
    /**
     * Max number of events published per batch
     */
    public final int              batchSize;
    /**
     * How often the relay looks for new events when it isn't woken by a local commit
     */
    public final Duration         pollingInterval;
    /**
     * Backoff used when publishing a batch fails. Once exhausted the batch is marked {@link OutboxEntryStatus#FAILED},
     * an alert is logged and the relay keeps retrying with {@link RedeliveryPolicy#maximumFollowupRedeliveryThreshold} between attempts
     */
    public final RedeliveryPolicy publishRedeliveryPolicy;

    public OutboxRelayConfiguration(String relayName,
                                    String cursorTableName,
                                    int batchSize,
                                    Duration pollingInterval,
                                    RedeliveryPolicy publishRedeliveryPolicy) {
        this.relayName = Objects.requireNonNull(relayName, "No relayName provided");
        if (relayName.isBlank()) {
            throw new IllegalArgumentException("relayName must not be blank");
        }
        this.cursorTableName = requireValidSqlIdentifier(cursorTableName);
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be 1 or larger");
        }
        this.batchSize = batchSize;
        this.pollingInterval = Objects.requireNonNull(pollingInterval, "No pollingInterval provided");
        if (pollingInterval.isNegative() || pollingInterval.isZero()) {
            throw new IllegalArgumentException("pollingInterval must be positive");
        }
        this.publishRedeliveryPolicy = Objects.requireNonNull(publishRedeliveryPolicy, "No publishRedeliveryPolicy provided");
    }

    public static OutboxRelayConfiguration defaultConfiguration() {
        return new OutboxRelayConfiguration(DEFAULT_RELAY_NAME,
                                            DEFAULT_CURSOR_TABLE_NAME,
                                            DEFAULT_BATCH_SIZE,
                                            Duration.ofMillis(500),
                                            RedeliveryPolicy.exponentialBackoff(Duration.ofMillis(100),
                                                                                Duration.ofMillis(200),
                                                                                2.0d,
                                                                                Duration.ofSeconds(30),
                                                                                10));
    }

    public OutboxRelayConfiguration withRelayName(String relayName) {
        return new OutboxRelayConfiguration(relayName, cursorTableName, batchSize, pollingInterval, publishRedeliveryPolicy);
    }

    public OutboxRelayConfiguration withBatchSize(int batchSize) {
        return new OutboxRelayConfiguration(relayName, cursorTableName, batchSize, pollingInterval, publishRedeliveryPolicy);
    }

    public OutboxRelayConfiguration withPollingInterval(Duration pollingInterval) {
        return new OutboxRelayConfiguration(relayName, cursorTableName, batchSize, pollingInterval, publishRedeliveryPolicy);
    }

    public OutboxRelayConfiguration withPublishRedeliveryPolicy(RedeliveryPolicy publishRedeliveryPolicy) {
        return new OutboxRelayConfiguration(relayName, cursorTableName, batchSize, pollingInterval, publishRedeliveryPolicy);
    }

    @Override
    public String toString() {
        return "OutboxRelayConfiguration{" +
                "relayName='" + relayName + '\'' +
                ", cursorTableName='" + cursorTableName + '\'' +
                ", batchSize=" + batchSize +
                ", pollingInterval=" + pollingInterval +
                ", publishRedeliveryPolicy=" + publishRedeliveryPolicy +
                '}';
    }
}
