package dk.cloudcreate.eventledger.sagas;

import dk.cloudcreate.eventledger.aggregates.AggregateRoot;
import dk.cloudcreate.eventledger.common.types.Identity;
import dk.cloudcreate.eventledger.eventstore.events.DomainEvent;

import static dk.cloudcreate.eventledger.common.Messages.msg;

/**
 * A saga that is persisted as an event sourced aggregate.<br>
 * The saga reacts to domain events in {@link #process(DomainEvent)} by emitting its own events. The
 * {@link #state()} of the saga must be changed from the event handlers, using {@link #start()} and {@link #complete()},
 * so the state is restored when the saga is loaded:
 * <pre>{@code
 * @Override
 * protected void initialize() {
 *     register(FulfillmentStarted.class, e -> start());
 *     register(FulfillmentCompleted.class, e -> complete());
 * }
 * }</pre>
 *
 * @param <SAGA> the concrete saga type
 * @param <ID>   the saga identity type
 */
public abstract class AggregateSaga<SAGA extends AggregateSaga<SAGA, ID>, ID extends Identity<ID>> extends AggregateRoot<SAGA, ID> {
    private SagaState state;

    protected AggregateSaga(ID sagaId) {
        super(sagaId);
    }

    /**
     * React to a domain event the saga has been declared to handle
     *
     * @param domainEvent the domain event
     */
    public abstract void process(DomainEvent<?, ?, ?> domainEvent);

    public SagaState state() {
        return state != null ? state : SagaState.NEW;
    }

    /**
     * Mark the saga as {@link SagaState#RUNNING}
     */
    protected final void start() {
        if (state() == SagaState.COMPLETED) {
            throw new SagaException(msg("Saga {} '{}' has already been completed", getClass().getSimpleName(), aggregateId()));
        }
        state = SagaState.RUNNING;
    }

    /**
     * Mark the saga as {@link SagaState#COMPLETED}
     */
    protected final void complete() {
        state = SagaState.COMPLETED;
    }
}
