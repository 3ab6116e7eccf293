package dk.cloudcreate.eventledger.eventstore.upgrade;

import dk.cloudcreate.eventledger.eventstore.EventStoreException;

/**
 * Thrown when an event couldn't be upgraded to the latest known version of its event type
 */
public class EventUpgradeException extends EventStoreException {
    public EventUpgradeException(String message) {
        super(message);
    }

    public EventUpgradeException(String message, Throwable cause) {
        super(message, cause);
    }
}
