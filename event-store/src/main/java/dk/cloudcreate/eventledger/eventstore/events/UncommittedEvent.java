package dk.cloudcreate.eventledger.eventstore.events;

import dk.cloudcreate.eventledger.eventstore.aggregates.AggregateEvent;
import dk.cloudcreate.eventledger.eventstore.metadata.Metadata;

import static org.apache.commons.lang3.Validate.notNull;

/**
 * An event that has been emitted by an aggregate, but not yet committed to the event store
 */
public final class UncommittedEvent {
    private final AggregateEvent<?, ?> aggregateEvent;
    private final Metadata             metadata;

    public UncommittedEvent(AggregateEvent<?, ?> aggregateEvent, Metadata metadata) {
        this.aggregateEvent = notNull(aggregateEvent, "You must provide an aggregateEvent");
        this.metadata = notNull(metadata, "You must provide metadata");
    }

    public static UncommittedEvent of(AggregateEvent<?, ?> aggregateEvent, Metadata metadata) {
        return new UncommittedEvent(aggregateEvent, metadata);
    }

    public AggregateEvent<?, ?> aggregateEvent() {
        return aggregateEvent;
    }

    public Metadata metadata() {
        return metadata;
    }

    @Override
    public String toString() {
        return "UncommittedEvent{" +
                "aggregateEvent=" + aggregateEvent.getClass().getSimpleName() +
                ", metadata=" + metadata +
                '}';
    }
}
