package dk.cloudcreate.eventcore.eventstore.postgresql.bus;

/**
 * The {@link dk.cloudcreate.eventcore.common.transaction.UnitOfWork} stage at which {@link PersistedEvents} are published
 */
public enum CommitStage {
    /**
     * Inside the transaction, before it's committed. Subscribers may still fail the commit
     */
    BeforeCommit,
    /**
     * The transaction was committed and the events are durable
     */
    AfterCommit,
    /**
     * The transaction was rolled back and the events were discarded
     */
    AfterRollback
}
