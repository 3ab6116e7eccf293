package dk.cloudcreate.eventledger.eventstore.aggregates;

import dk.cloudcreate.eventledger.common.types.Identity;

/**
 * Marker interface that every event payload implements. The type parameters bind the event to the aggregate type
 * (and identity type) that emits it
 *
 * @param <A>  the aggregate type
 * @param <ID> the aggregate identity type
 */
public interface AggregateEvent<A extends Aggregate<A, ID>, ID extends Identity<ID>> {
}
