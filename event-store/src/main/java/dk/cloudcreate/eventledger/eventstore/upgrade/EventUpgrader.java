package dk.cloudcreate.eventledger.eventstore.upgrade;

import dk.cloudcreate.eventledger.common.types.Identity;
import dk.cloudcreate.eventledger.eventstore.aggregates.Aggregate;
import dk.cloudcreate.eventledger.eventstore.events.DomainEvent;

/**
 * Upgrades events of one aggregate type from an older event version to a newer one.<br>
 * An upgrader receives every loaded event of its aggregate type and must return the event unchanged when it doesn't
 * apply to it. Upgraders of the same aggregate type are applied in registration order, so an upgrader from V1 to V2
 * registered before an upgrader from V2 to V3 upgrades a V1 event all the way to V3.
 * <pre>{@code
 * EventUpgrader<Order, OrderId> upgrader = (event, context) -> {
 *     if (event.aggregateEvent() instanceof OrderPlaced) {
 *         var placed = (OrderPlaced) event.aggregateEvent();
 *         return event.withAggregateEvent(new OrderPlacedV2(placed.orderNumber(), Currency.DKK));
 *     }
 *     return event;
 * };
 * }</pre>
 *
 * @param <A>  the aggregate type
 * @param <ID> the aggregate identity type
 */
@FunctionalInterface
public interface EventUpgrader<A extends Aggregate<A, ID>, ID extends Identity<ID>> {
    /**
     * @param domainEvent the event to upgrade
     * @param context     the context of the current upgrade run
     * @return the upgraded event, or the same event if this upgrader doesn't apply to it. Never null
     */
    DomainEvent<A, ID, ?> upgrade(DomainEvent<A, ID, ?> domainEvent, EventUpgradeContext context);
}
