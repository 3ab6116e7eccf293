package dk.cloudcreate.eventledger.eventstore.aggregates;

import dk.cloudcreate.eventledger.common.types.Identity;

/**
 * Creates new, empty, aggregate instances for a given aggregate type and identity
 */
public interface AggregateFactory {
    /**
     * Create a new aggregate instance with no events applied
     *
     * @param aggregateType the aggregate type
     * @param id            the aggregate identity
     * @param <A>           the aggregate type
     * @param <ID>          the aggregate identity type
     * @return the new aggregate instance
     * @throws AggregateException in case the aggregate couldn't be created
     */
    <A extends Aggregate<A, ID>, ID extends Identity<ID>> A createNewAggregate(Class<A> aggregateType, ID id);
}
