package dk.cloudcreate.eventledger.eventstore;

import dk.cloudcreate.eventledger.common.types.*;
import dk.cloudcreate.eventledger.eventstore.aggregates.Aggregate;
import dk.cloudcreate.eventledger.eventstore.events.*;
import dk.cloudcreate.eventledger.eventstore.persistence.*;
import dk.cloudcreate.eventledger.eventstore.types.GlobalPosition;
import dk.cloudcreate.eventledger.eventstore.upgrade.*;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * The Event Store is the single entry point for appending events to, and reading events from, the event log of
 * aggregates.<br>
 * Argument errors ({@link NullPointerException}, {@link IllegalArgumentException} and {@link InvalidEventRangeException})
 * are thrown synchronously when an operation is called, before any I/O is started.
 * All other failures are signalled through the returned {@link Mono}.
 */
public interface EventStore {
    long FIRST_AGGREGATE_SEQUENCE_NUMBER = 1;

    /**
     * Store (commit) the uncommitted events of an aggregate as one atomic batch.<br>
     * All events in the batch get the same, newly generated, batch id and the <code>sourceId</code> attached to their metadata.
     *
     * @param aggregateType      the aggregate type
     * @param id                 the aggregate identity
     * @param uncommittedEvents  the events to commit, in order. When empty nothing is committed and an empty list is returned
     * @param sourceId           the source id of the operation that produced the events, must not be {@link SourceId#NONE}
     * @return the committed domain events, in the same order as the uncommitted events (not upgraded)
     * @throws OptimisticConcurrencyException (as Mono error) if another writer committed conflicting events first
     */
    <A extends Aggregate<A, ID>, ID extends Identity<ID>> Mono<List<DomainEvent<A, ID, ?>>> store(Class<A> aggregateType,
                                                                                                 ID id,
                                                                                                 List<UncommittedEvent> uncommittedEvents,
                                                                                                 SourceId sourceId);

    /**
     * Load all events of an aggregate, upgraded to their latest version
     */
    default <A extends Aggregate<A, ID>, ID extends Identity<ID>> Mono<List<DomainEvent<A, ID, ?>>> loadEvents(Class<A> aggregateType, ID id) {
        return loadEvents(aggregateType, id, FIRST_AGGREGATE_SEQUENCE_NUMBER);
    }

    /**
     * Load the events of an aggregate with an aggregate sequence number &gt;= <code>fromSequenceNumber</code>, upgraded to their latest version
     *
     * @throws InvalidEventRangeException if <code>fromSequenceNumber</code> is less than 1
     */
    <A extends Aggregate<A, ID>, ID extends Identity<ID>> Mono<List<DomainEvent<A, ID, ?>>> loadEvents(Class<A> aggregateType, ID id, long fromSequenceNumber);

    /**
     * Load the events of an aggregate with <code>fromSequenceNumber</code> &lt;= aggregate sequence number &lt;= <code>toSequenceNumber</code>,
     * upgraded to their latest version
     *
     * @throws InvalidEventRangeException if <code>fromSequenceNumber</code> is less than 1 or <code>toSequenceNumber</code> isn't greater
     *                                    than <code>fromSequenceNumber</code>
     */
    <A extends Aggregate<A, ID>, ID extends Identity<ID>> Mono<List<DomainEvent<A, ID, ?>>> loadEvents(Class<A> aggregateType, ID id, long fromSequenceNumber, long toSequenceNumber);

    /**
     * Load one page of events across all aggregates, in global commit order, upgraded to their latest version
     *
     * @param globalPosition the position to read from, {@link GlobalPosition#START} for the start of the store
     * @param pageSize       the maximum number of events to return
     * @param context        upgrade context, which can be reused across the pages of one scan
     * @throws InvalidEventRangeException if <code>pageSize</code> isn't positive
     */
    Mono<AllEventsPage> loadAllEvents(GlobalPosition globalPosition, int pageSize, EventUpgradeContext context);

    default Mono<AllEventsPage> loadAllEvents(GlobalPosition globalPosition, int pageSize) {
        return loadAllEvents(globalPosition, pageSize, EventUpgradeContext.newContext());
    }

    /**
     * Delete all events of an aggregate
     */
    <A extends Aggregate<A, ID>, ID extends Identity<ID>> Mono<Void> deleteAggregate(Class<A> aggregateType, ID id);
}
