package dk.cloudcreate.eventledger.eventstore.upgrade;

import java.util.*;
import java.util.concurrent.*;
import java.util.function.Function;

/**
 * State shared by the upgrade of a batch of events, e.g. all the pages of one scan through
 * {@link dk.cloudcreate.eventledger.eventstore.EventStore#loadAllEvents}.<br>
 * Caches the upgraders resolved per aggregate type, so they are only looked up once per context.
 */
public final class EventUpgradeContext {
    private final ConcurrentMap<Class<?>, List<EventUpgrader<?, ?>>> upgradersByAggregateType = new ConcurrentHashMap<>();

    public static EventUpgradeContext newContext() {
        return new EventUpgradeContext();
    }

    /**
     * Get the upgraders for the aggregate type, resolving them with the resolver the first time they're requested
     */
    public List<EventUpgrader<?, ?>> upgradersFor(Class<?> aggregateType, Function<Class<?>, List<EventUpgrader<?, ?>>> resolver) {
        return upgradersByAggregateType.computeIfAbsent(aggregateType, resolver);
    }

    int numberOfCachedAggregateTypes() {
        return upgradersByAggregateType.size();
    }
}
