package dk.cloudcreate.eventledger.sagas;

import dk.cloudcreate.eventledger.common.types.*;
import dk.cloudcreate.eventledger.eventstore.AggregateLoader;
import dk.cloudcreate.eventledger.eventstore.events.DomainEvent;
import org.slf4j.*;
import reactor.core.publisher.*;

import java.util.List;

import static org.apache.commons.lang3.Validate.notNull;

/**
 * Routes domain events to the sagas interested in them.<br>
 * For each event the interested sagas are looked up in the {@link SagaDefinitionService}, located using their
 * {@link SagaLocator} and loaded through the {@link AggregateLoader}. A saga processes the event when it is running, or when
 * it is new and the event is one of the events that start it. Completed sagas ignore all events.<br>
 * The events emitted by the saga are committed with a {@link SourceId} equal to the event id of the processed event,
 * which lets an event persistence that detects duplicate source ids reject a saga processing the same event twice.
 */
public final class DispatchToSagas {
    private static final Logger log = LoggerFactory.getLogger(DispatchToSagas.class);

    private final SagaDefinitionService sagaDefinitionService;
    private final AggregateLoader       aggregateLoader;

    public DispatchToSagas(SagaDefinitionService sagaDefinitionService, AggregateLoader aggregateLoader) {
        this.sagaDefinitionService = notNull(sagaDefinitionService, "You must provide a sagaDefinitionService");
        this.aggregateLoader = notNull(aggregateLoader, "You must provide an aggregateLoader");
    }

    /**
     * Dispatch the events, one at a time and in order, to the interested sagas
     */
    public Mono<Void> processEvents(List<? extends DomainEvent<?, ?, ?>> domainEvents) {
        notNull(domainEvents, "You must provide domainEvents");
        return Flux.fromIterable(domainEvents)
                   .concatMap(this::processEvent)
                   .then();
    }

    public Mono<Void> processEvent(DomainEvent<?, ?, ?> domainEvent) {
        notNull(domainEvent, "You must provide a domainEvent");
        var sagaDetails = sagaDefinitionService.getSagaDetails(domainEvent.eventType());
        if (sagaDetails.isEmpty()) {
            log.trace("No sagas are interested in event '{}'", domainEvent.eventType().getSimpleName());
            return Mono.empty();
        }
        return Flux.fromIterable(sagaDetails)
                   .concatMap(details -> processSaga(details, domainEvent))
                   .then();
    }

    private Mono<Void> processSaga(SagaDetails sagaDetails, DomainEvent<?, ?, ?> domainEvent) {
        return Mono.<Identity<?>>defer(() -> sagaDetails.sagaLocator().locateSaga(domainEvent))
                   .flatMap(sagaId -> loadSaga(sagaDetails, sagaId))
                   .flatMap(saga -> {
                       var eventName = domainEvent.eventType().getSimpleName();
                       if (saga.state() == SagaState.COMPLETED) {
                           log.debug("Saga {} '{}' is completed, skipping event '{}'", sagaDetails.sagaType().getSimpleName(), saga.aggregateId(), eventName);
                           return Mono.empty();
                       }
                       if (saga.state() == SagaState.NEW && !sagaDetails.isStartedBy(domainEvent.eventType())) {
                           log.debug("Saga {} '{}' isn't started by event '{}', skipping it", sagaDetails.sagaType().getSimpleName(), saga.aggregateId(), eventName);
                           return Mono.empty();
                       }
                       log.debug("Saga {} '{}' in state {} is processing event '{}'", sagaDetails.sagaType().getSimpleName(), saga.aggregateId(), saga.state(), eventName);
                       saga.process(domainEvent);
                       return saga.commit(aggregateLoader.getEventStore(),
                                          aggregateLoader.getSnapshotStore(),
                                          SourceId.of(domainEvent.eventId().value()))
                                  .then();
                   });
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private Mono<AggregateSaga<?, ?>> loadSaga(SagaDetails sagaDetails, Identity<?> sagaId) {
        return (Mono) aggregateLoader.loadAggregate((Class) sagaDetails.sagaType(), (Identity) sagaId);
    }
}
