package dk.cloudcreate.eventledger.eventstore.persistence;

import dk.cloudcreate.eventledger.eventstore.EventStoreException;

/**
 * Thrown by an {@link EventPersistence} when the events being committed conflict with events that another writer
 * has already committed for the same aggregate (i.e. one of the aggregate sequence numbers is already taken).<br>
 * No events from the rejected batch are persisted.
 */
public class OptimisticConcurrencyException extends EventStoreException {
    public OptimisticConcurrencyException(String message) {
        super(message);
    }

    public OptimisticConcurrencyException(String message, Throwable cause) {
        super(message, cause);
    }
}
