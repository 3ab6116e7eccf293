package dk.cloudcreate.eventledger.aggregates;

import dk.cloudcreate.eventledger.common.types.Identity;
import dk.cloudcreate.eventledger.eventstore.aggregates.*;

import java.lang.reflect.*;
import java.util.Arrays;
import java.util.concurrent.*;

import static dk.cloudcreate.eventledger.common.Messages.msg;
import static org.apache.commons.lang3.Validate.notNull;

/**
 * {@link AggregateFactory} that creates aggregates by calling their constructor that takes the aggregate identity as its only argument
 */
public final class ConstructorAggregateFactory implements AggregateFactory {
    private final ConcurrentMap<Class<?>, Constructor<?>> constructors = new ConcurrentHashMap<>();

    @SuppressWarnings("unchecked")
    @Override
    public <A extends Aggregate<A, ID>, ID extends Identity<ID>> A createNewAggregate(Class<A> aggregateType, ID id) {
        notNull(aggregateType, "You must provide an aggregateType");
        notNull(id, "You must provide an id");
        var constructor = constructors.computeIfAbsent(aggregateType, type -> resolveConstructor(type, id.getClass()));
        try {
            return (A) constructor.newInstance(id);
        } catch (InvocationTargetException e) {
            throw new AggregateException(msg("Constructor of aggregate '{}' failed", aggregateType.getName()), e.getCause());
        } catch (ReflectiveOperationException | IllegalArgumentException e) {
            throw new AggregateException(msg("Failed to create aggregate '{}' with id '{}'", aggregateType.getName(), id), e);
        }
    }

    private static Constructor<?> resolveConstructor(Class<?> aggregateType, Class<?> identityType) {
        if (Modifier.isAbstract(aggregateType.getModifiers())) {
            throw new AggregateException(msg("Aggregate type '{}' is abstract", aggregateType.getName()));
        }
        var constructor = Arrays.stream(aggregateType.getDeclaredConstructors())
                                .filter(candidate -> candidate.getParameterCount() == 1 && candidate.getParameterTypes()[0].isAssignableFrom(identityType))
                                .findFirst()
                                .orElseThrow(() -> new AggregateException(msg("Aggregate type '{}' doesn't have a constructor that takes a single '{}' argument",
                                                                              aggregateType.getName(), identityType.getName())));
        constructor.setAccessible(true);
        return constructor;
    }
}
