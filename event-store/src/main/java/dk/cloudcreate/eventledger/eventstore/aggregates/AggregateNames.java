package dk.cloudcreate.eventledger.eventstore.aggregates;

import java.util.concurrent.*;

import static org.apache.commons.lang3.Validate.notNull;

/**
 * Resolves (and caches) the name of aggregate types
 */
public final class AggregateNames {
    private static final ConcurrentMap<Class<?>, String> NAMES = new ConcurrentHashMap<>();

    private AggregateNames() {
    }

    /**
     * The value of the {@link AggregateName} annotation on the aggregate type, or the simple class name if not annotated
     */
    public static String nameOf(Class<?> aggregateType) {
        notNull(aggregateType, "You must provide an aggregateType");
        return NAMES.computeIfAbsent(aggregateType, type -> {
            var annotation = type.getAnnotation(AggregateName.class);
            return annotation != null ? annotation.value() : type.getSimpleName();
        });
    }
}
