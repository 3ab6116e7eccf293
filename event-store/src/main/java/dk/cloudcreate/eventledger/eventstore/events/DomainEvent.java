package dk.cloudcreate.eventledger.eventstore.events;

import dk.cloudcreate.eventledger.common.types.Identity;
import dk.cloudcreate.eventledger.eventstore.aggregates.*;
import dk.cloudcreate.eventledger.eventstore.metadata.Metadata;
import dk.cloudcreate.eventledger.eventstore.types.*;

import java.time.OffsetDateTime;
import java.util.Objects;

import static org.apache.commons.lang3.Validate.*;

/**
 * A committed, typed, event: the event payload together with its aggregate identity, aggregate sequence number,
 * global position and metadata
 *
 * @param <A>  the aggregate type
 * @param <ID> the aggregate identity type
 * @param <E>  the event payload type
 */
public interface DomainEvent<A extends Aggregate<A, ID>, ID extends Identity<ID>, E extends AggregateEvent<A, ID>> {
    Class<A> aggregateType();

    @SuppressWarnings("unchecked")
    default Class<E> eventType() {
        return (Class<E>) aggregateEvent().getClass();
    }

    E aggregateEvent();

    Metadata metadata();

    ID aggregateIdentity();

    /**
     * The 1-based position of the event within its aggregate
     */
    long aggregateSequenceNumber();

    /**
     * The position of the event in the global commit order
     */
    GlobalPosition globalPosition();

    default OffsetDateTime timestamp() {
        return metadata().timestamp();
    }

    default EventId eventId() {
        return metadata().eventId();
    }

    /**
     * Create a copy of this domain event where the payload has been replaced, e.g. by an upgraded version of the event.
     * The metadata is retained as is
     *
     * @param upgradedEvent the new event payload
     * @return the new domain event
     */
    <E2 extends AggregateEvent<A, ID>> DomainEvent<A, ID, E2> withAggregateEvent(E2 upgradedEvent);

    /**
     * Create a copy of this domain event with different metadata
     */
    DomainEvent<A, ID, E> withMetadata(Metadata metadata);

    static <A extends Aggregate<A, ID>, ID extends Identity<ID>, E extends AggregateEvent<A, ID>> DomainEvent<A, ID, E> of(Class<A> aggregateType,
                                                                                                                        ID aggregateIdentity,
                                                                                                                        E aggregateEvent,
                                                                                                                        long aggregateSequenceNumber,
                                                                                                                        GlobalPosition globalPosition,
                                                                                                                        Metadata metadata) {
        return new DefaultDomainEvent<>(aggregateType, aggregateIdentity, aggregateEvent, aggregateSequenceNumber, globalPosition, metadata);
    }

    final class DefaultDomainEvent<A extends Aggregate<A, ID>, ID extends Identity<ID>, E extends AggregateEvent<A, ID>> implements DomainEvent<A, ID, E> {
        private final Class<A>       aggregateType;
        private final ID             aggregateIdentity;
        private final E              aggregateEvent;
        private final long           aggregateSequenceNumber;
        private final GlobalPosition globalPosition;
        private final Metadata       metadata;

        private DefaultDomainEvent(Class<A> aggregateType, ID aggregateIdentity, E aggregateEvent, long aggregateSequenceNumber, GlobalPosition globalPosition, Metadata metadata) {
            this.aggregateType = notNull(aggregateType, "You must provide an aggregateType");
            this.aggregateIdentity = notNull(aggregateIdentity, "You must provide an aggregateIdentity");
            this.aggregateEvent = notNull(aggregateEvent, "You must provide an aggregateEvent");
            isTrue(aggregateSequenceNumber > 0, "aggregateSequenceNumber must be positive, was %d", aggregateSequenceNumber);
            this.aggregateSequenceNumber = aggregateSequenceNumber;
            this.globalPosition = notNull(globalPosition, "You must provide a globalPosition");
            this.metadata = notNull(metadata, "You must provide metadata");
        }

        @Override
        public Class<A> aggregateType() {
            return aggregateType;
        }

        @Override
        public E aggregateEvent() {
            return aggregateEvent;
        }

        @Override
        public Metadata metadata() {
            return metadata;
        }

        @Override
        public ID aggregateIdentity() {
            return aggregateIdentity;
        }

        @Override
        public long aggregateSequenceNumber() {
            return aggregateSequenceNumber;
        }

        @Override
        public GlobalPosition globalPosition() {
            return globalPosition;
        }

        @Override
        public <E2 extends AggregateEvent<A, ID>> DomainEvent<A, ID, E2> withAggregateEvent(E2 upgradedEvent) {
            return new DefaultDomainEvent<>(aggregateType, aggregateIdentity, upgradedEvent, aggregateSequenceNumber, globalPosition, metadata);
        }

        @Override
        public DomainEvent<A, ID, E> withMetadata(Metadata metadata) {
            return new DefaultDomainEvent<>(aggregateType, aggregateIdentity, aggregateEvent, aggregateSequenceNumber, globalPosition, metadata);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof DefaultDomainEvent)) return false;
            var that = (DefaultDomainEvent<?, ?, ?>) o;
            return aggregateSequenceNumber == that.aggregateSequenceNumber &&
                    aggregateType.equals(that.aggregateType) &&
                    aggregateIdentity.equals(that.aggregateIdentity) &&
                    aggregateEvent.equals(that.aggregateEvent) &&
                    globalPosition.equals(that.globalPosition) &&
                    metadata.equals(that.metadata);
        }

        @Override
        public int hashCode() {
            return Objects.hash(aggregateType, aggregateIdentity, aggregateSequenceNumber);
        }

        @Override
        public String toString() {
            return "DomainEvent{" +
                    "aggregateType=" + aggregateType.getSimpleName() +
                    ", aggregateIdentity=" + aggregateIdentity +
                    ", aggregateSequenceNumber=" + aggregateSequenceNumber +
                    ", globalPosition=" + globalPosition +
                    ", eventType=" + aggregateEvent.getClass().getSimpleName() +
                    '}';
        }
    }
}
