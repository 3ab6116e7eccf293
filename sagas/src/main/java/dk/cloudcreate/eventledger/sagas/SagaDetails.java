package dk.cloudcreate.eventledger.sagas;

import dk.cloudcreate.eventledger.eventstore.aggregates.AggregateEvent;

import java.util.*;

import static dk.cloudcreate.eventledger.common.Messages.msg;
import static org.apache.commons.lang3.Validate.notNull;

/**
 * Immutable details about a saga type: the event types that start it, all the event types it reacts to and
 * the {@link SagaLocator} that resolves the saga instance for an event
 */
public final class SagaDetails {
    private final Class<? extends AggregateSaga<?, ?>>        sagaType;
    private final Set<Class<? extends AggregateEvent<?, ?>>> startedBy;
    private final List<Class<? extends AggregateEvent<?, ?>>> aggregateEventTypes;
    private final SagaLocator                                sagaLocator;

    private SagaDetails(Class<? extends AggregateSaga<?, ?>> sagaType,
                        Set<Class<? extends AggregateEvent<?, ?>>> startedBy,
                        List<Class<? extends AggregateEvent<?, ?>>> aggregateEventTypes,
                        SagaLocator sagaLocator) {
        this.sagaType = sagaType;
        this.startedBy = startedBy;
        this.aggregateEventTypes = aggregateEventTypes;
        this.sagaLocator = sagaLocator;
    }

    /**
     * Create the {@link SagaDetails} from a {@link SagaDeclaration}
     *
     * @throws SagaException if the declaration doesn't name any event type that starts the saga or doesn't have a {@link SagaLocator}
     */
    public static SagaDetails from(SagaDeclaration<?> declaration) {
        notNull(declaration, "You must provide a declaration");
        if (declaration.startedBy().isEmpty()) {
            throw new SagaException(msg("Saga type '{}' must be started by at least one event type", declaration.sagaType().getName()));
        }
        var sagaLocator = declaration.sagaLocator()
                                     .orElseThrow(() -> new SagaException(msg("Saga type '{}' doesn't have a saga locator", declaration.sagaType().getName())));
        var aggregateEventTypes = new LinkedHashSet<Class<? extends AggregateEvent<?, ?>>>(declaration.startedBy());
        aggregateEventTypes.addAll(declaration.handles());
        return new SagaDetails(declaration.sagaType(),
                               Set.copyOf(declaration.startedBy()),
                               List.copyOf(aggregateEventTypes),
                               sagaLocator);
    }

    public Class<? extends AggregateSaga<?, ?>> sagaType() {
        return sagaType;
    }

    /**
     * All the event types the saga reacts to, the event types that start it first
     */
    public List<Class<? extends AggregateEvent<?, ?>>> aggregateEventTypes() {
        return aggregateEventTypes;
    }

    public boolean isStartedBy(Class<?> aggregateEventType) {
        return startedBy.contains(aggregateEventType);
    }

    public SagaLocator sagaLocator() {
        return sagaLocator;
    }

    @Override
    public String toString() {
        return "SagaDetails{" +
                "sagaType=" + sagaType.getSimpleName() +
                ", aggregateEventTypes=" + aggregateEventTypes +
                '}';
    }
}
