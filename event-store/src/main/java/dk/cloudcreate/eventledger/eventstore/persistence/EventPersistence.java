package dk.cloudcreate.eventledger.eventstore.persistence;

import dk.cloudcreate.eventledger.common.types.Identity;
import dk.cloudcreate.eventledger.eventstore.serializer.SerializedEvent;
import dk.cloudcreate.eventledger.eventstore.types.GlobalPosition;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * The storage backend of the event store.<br>
 * Implementations must commit a batch of events for one aggregate atomically: either all events are committed, in order,
 * or none are. Aggregate sequence numbers are gapless: the first event of a batch must have the sequence number following
 * the last committed event of the aggregate (1 for a new aggregate) and the following events must be consecutive.
 * Otherwise, whether the sequence number is already taken or lies beyond the next one, the commit must fail with an
 * {@link OptimisticConcurrencyException} and persist nothing.
 */
public interface EventPersistence {
    /**
     * Atomically commit the serialized events for the given aggregate
     *
     * @param id               the aggregate identity
     * @param serializedEvents the events, in aggregate sequence number order
     * @return the committed events in the same order
     * @throws OptimisticConcurrencyException (as Mono error) if the first sequence number doesn't follow the last committed one or the batch isn't consecutive
     * @throws DuplicateOperationException    (as Mono error) if {@link #detectsDuplicateSourceIds()} and the source id has already been committed for this aggregate
     */
    Mono<List<CommittedDomainEvent>> commitEvents(Identity<?> id, List<SerializedEvent> serializedEvents);

    /**
     * Load the committed events of an aggregate with a sequence number &gt;= <code>fromSequenceNumber</code>, in sequence number order
     */
    Mono<List<CommittedDomainEvent>> loadCommittedEvents(Identity<?> id, long fromSequenceNumber);

    /**
     * Load the committed events of an aggregate with <code>fromSequenceNumber</code> &lt;= sequence number &lt;= <code>toSequenceNumber</code>,
     * in sequence number order
     */
    Mono<List<CommittedDomainEvent>> loadCommittedEvents(Identity<?> id, long fromSequenceNumber, long toSequenceNumber);

    /**
     * Load at most <code>pageSize</code> committed events across all aggregates, in global commit order, starting at <code>globalPosition</code>
     */
    Mono<AllCommittedEventsPage> loadAllCommittedEvents(GlobalPosition globalPosition, int pageSize);

    /**
     * Delete all events of an aggregate. Deleting an aggregate without events is a no-op
     */
    Mono<Void> deleteEvents(Identity<?> id);

    /**
     * Does this persistence reject a commit whose source id has already been committed for the same aggregate
     */
    default boolean detectsDuplicateSourceIds() {
        return false;
    }
}
