package dk.cloudcreate.eventledger.eventstore.serializer;

import dk.cloudcreate.eventledger.eventstore.EventStoreException;

public class EventDeserializationException extends EventStoreException {
    public EventDeserializationException(String message) {
        super(message);
    }

    public EventDeserializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
