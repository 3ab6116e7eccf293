package dk.cloudcreate.eventledger.sagas;

import dk.cloudcreate.eventledger.eventstore.aggregates.AggregateEvent;

import java.util.*;

import static org.apache.commons.lang3.Validate.*;

/**
 * Declares which aggregate event types a saga type reacts to and how the saga instance is located.<br>
 * Events the saga is {@link #startedBy(Class[]) started by} are also handled by the saga. Events it only
 * {@link #handles(Class[]) handles} are ignored until the saga has been started:
 * <pre>{@code
 * var declaration = SagaDeclaration.of(OrderFulfillmentSaga.class)
 *                                  .startedBy(OrderPlaced.class)
 *                                  .handles(PaymentReceived.class, OrderShipped.class)
 *                                  .locatedBy(event -> Mono.just(OrderFulfillmentSagaId.of(...)));
 * }</pre>
 *
 * @param <SAGA> the saga type
 */
public final class SagaDeclaration<SAGA extends AggregateSaga<?, ?>> {
    private final Class<SAGA>                               sagaType;
    private final Set<Class<? extends AggregateEvent<?, ?>>> startedBy;
    private final Set<Class<? extends AggregateEvent<?, ?>>> handles;
    private final SagaLocator                               sagaLocator;

    private SagaDeclaration(Class<SAGA> sagaType,
                            Set<Class<? extends AggregateEvent<?, ?>>> startedBy,
                            Set<Class<? extends AggregateEvent<?, ?>>> handles,
                            SagaLocator sagaLocator) {
        this.sagaType = notNull(sagaType, "You must provide a sagaType");
        this.startedBy = Collections.unmodifiableSet(startedBy);
        this.handles = Collections.unmodifiableSet(handles);
        this.sagaLocator = sagaLocator;
    }

    public static <SAGA extends AggregateSaga<?, ?>> SagaDeclaration<SAGA> of(Class<SAGA> sagaType) {
        return new SagaDeclaration<>(sagaType, new LinkedHashSet<>(), new LinkedHashSet<>(), null);
    }

    /**
     * Add event types that start the saga
     */
    @SafeVarargs
    public final SagaDeclaration<SAGA> startedBy(Class<? extends AggregateEvent<?, ?>>... eventTypes) {
        notNull(eventTypes, "You must provide eventTypes");
        noNullElements(eventTypes, "eventTypes contains a null element at index %d");
        var newStartedBy = new LinkedHashSet<>(startedBy);
        newStartedBy.addAll(Arrays.asList(eventTypes));
        return new SagaDeclaration<>(sagaType, newStartedBy, new LinkedHashSet<>(handles), sagaLocator);
    }

    /**
     * Add event types that the saga processes once it has been started
     */
    @SafeVarargs
    public final SagaDeclaration<SAGA> handles(Class<? extends AggregateEvent<?, ?>>... eventTypes) {
        notNull(eventTypes, "You must provide eventTypes");
        noNullElements(eventTypes, "eventTypes contains a null element at index %d");
        var newHandles = new LinkedHashSet<>(handles);
        newHandles.addAll(Arrays.asList(eventTypes));
        return new SagaDeclaration<>(sagaType, new LinkedHashSet<>(startedBy), newHandles, sagaLocator);
    }

    public SagaDeclaration<SAGA> locatedBy(SagaLocator sagaLocator) {
        return new SagaDeclaration<>(sagaType, new LinkedHashSet<>(startedBy), new LinkedHashSet<>(handles), notNull(sagaLocator, "You must provide a sagaLocator"));
    }

    public Class<SAGA> sagaType() {
        return sagaType;
    }

    public Set<Class<? extends AggregateEvent<?, ?>>> startedBy() {
        return startedBy;
    }

    public Set<Class<? extends AggregateEvent<?, ?>>> handles() {
        return handles;
    }

    public Optional<SagaLocator> sagaLocator() {
        return Optional.ofNullable(sagaLocator);
    }

    @Override
    public String toString() {
        return "SagaDeclaration{" +
                "sagaType=" + sagaType.getSimpleName() +
                ", startedBy=" + startedBy +
                ", handles=" + handles +
                '}';
    }
}
