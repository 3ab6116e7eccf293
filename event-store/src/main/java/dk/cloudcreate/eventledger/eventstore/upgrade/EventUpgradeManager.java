package dk.cloudcreate.eventledger.eventstore.upgrade;

import dk.cloudcreate.eventledger.common.types.Identity;
import dk.cloudcreate.eventledger.eventstore.aggregates.Aggregate;
import dk.cloudcreate.eventledger.eventstore.events.DomainEvent;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Upgrades loaded events to the latest version of their event type.<br>
 * The result always has the same length and order as the input, and every event in the result carries the latest
 * known version of its event type. An empty input results in an empty output.
 */
public interface EventUpgradeManager {
    /**
     * Upgrade a batch of events that may belong to different aggregate types
     *
     * @throws EventUpgradeException (as Mono error) if an event couldn't be upgraded to the latest version
     */
    Mono<List<DomainEvent<?, ?, ?>>> upgrade(List<DomainEvent<?, ?, ?>> domainEvents, EventUpgradeContext context);

    /**
     * Upgrade a batch of events of a single aggregate
     *
     * @throws EventUpgradeException (as Mono error) if an event couldn't be upgraded to the latest version
     */
    <A extends Aggregate<A, ID>, ID extends Identity<ID>> Mono<List<DomainEvent<A, ID, ?>>> upgrade(Class<A> aggregateType,
                                                                                                   List<DomainEvent<A, ID, ?>> domainEvents,
                                                                                                   EventUpgradeContext context);
}
