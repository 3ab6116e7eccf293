package dk.cloudcreate.eventledger.eventstore.aggregates;

import dk.cloudcreate.eventledger.eventstore.EventStoreException;

/**
 * Thrown when an aggregate can't be created, hydrated or can't apply an event
 */
public class AggregateException extends EventStoreException {
    public AggregateException() {
    }

    public AggregateException(String message) {
        super(message);
    }

    public AggregateException(String message, Throwable cause) {
        super(message, cause);
    }

    public AggregateException(Throwable cause) {
        super(cause);
    }

    public AggregateException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
