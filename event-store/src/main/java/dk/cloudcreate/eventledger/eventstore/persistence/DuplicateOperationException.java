package dk.cloudcreate.eventledger.eventstore.persistence;

import dk.cloudcreate.eventledger.common.types.SourceId;
import dk.cloudcreate.eventledger.eventstore.EventStoreException;

/**
 * Thrown by an {@link EventPersistence} that {@link EventPersistence#detectsDuplicateSourceIds() detects duplicate source ids}
 * when a batch with a {@link SourceId} that has already been committed for the same aggregate is committed again
 */
public class DuplicateOperationException extends EventStoreException {
    private final SourceId sourceId;

    public DuplicateOperationException(String message, SourceId sourceId) {
        super(message);
        this.sourceId = sourceId;
    }

    public SourceId getSourceId() {
        return sourceId;
    }
}
