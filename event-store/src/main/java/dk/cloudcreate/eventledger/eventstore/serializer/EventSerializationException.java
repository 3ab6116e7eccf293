package dk.cloudcreate.eventledger.eventstore.serializer;

import dk.cloudcreate.eventledger.eventstore.EventStoreException;

public class EventSerializationException extends EventStoreException {
    public EventSerializationException(String message) {
        super(message);
    }

    public EventSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
