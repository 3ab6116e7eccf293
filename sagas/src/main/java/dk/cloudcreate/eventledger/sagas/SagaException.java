package dk.cloudcreate.eventledger.sagas;

import dk.cloudcreate.eventledger.eventstore.EventStoreException;

public class SagaException extends EventStoreException {
    public SagaException(String message) {
        super(message);
    }

    public SagaException(String message, Throwable cause) {
        super(message, cause);
    }
}
