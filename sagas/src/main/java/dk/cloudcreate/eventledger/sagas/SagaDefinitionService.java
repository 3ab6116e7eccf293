package dk.cloudcreate.eventledger.sagas;

import org.slf4j.*;

import java.util.*;
import java.util.concurrent.*;

import static org.apache.commons.lang3.Validate.notNull;

/**
 * Registry of the saga types and the aggregate event types each of them reacts to.<br>
 * Sagas are typically registered during startup using {@link #loadSagas(SagaDeclaration[])}, after which the registry is
 * used to look up the sagas interested in an event using {@link #getSagaDetails(Class)}.
 * Lookups can run concurrently with registrations: the list of {@link SagaDetails} for an event type is immutable and is
 * replaced atomically when a saga is added, so a lookup sees either the old or the new list.
 * A lookup made while a registration is in progress isn't guaranteed to see that registration.
 */
public final class SagaDefinitionService {
    private static final Logger log = LoggerFactory.getLogger(SagaDefinitionService.class);

    /**
     * Returned by {@link #getSagaDetails(Class)} when no saga is interested in the event type
     */
    public static final List<SagaDetails> EMPTY = List.of();

    private final ConcurrentMap<Class<?>, SagaDetails>       sagaDetailsBySagaType           = new ConcurrentHashMap<>();
    private final ConcurrentMap<Class<?>, List<SagaDetails>> sagaDetailsByAggregateEventType = new ConcurrentHashMap<>();

    public SagaDefinitionService() {
    }

    public SagaDefinitionService(Collection<? extends SagaDeclaration<?>> sagaDeclarations) {
        loadSagas(sagaDeclarations);
    }

    public SagaDefinitionService loadSagas(SagaDeclaration<?>... sagaDeclarations) {
        notNull(sagaDeclarations, "You must provide sagaDeclarations");
        return loadSagas(Arrays.asList(sagaDeclarations));
    }

    /**
     * Register the saga types. A saga type that has already been registered is skipped
     *
     * @param sagaDeclarations the saga declarations
     * @return this instance
     * @throws SagaException if a declaration is invalid, in which case the declarations before it are registered
     */
    public SagaDefinitionService loadSagas(Collection<? extends SagaDeclaration<?>> sagaDeclarations) {
        notNull(sagaDeclarations, "You must provide sagaDeclarations");
        for (var sagaDeclaration : sagaDeclarations) {
            notNull(sagaDeclaration, "sagaDeclarations contains a null element");
            var sagaType = sagaDeclaration.sagaType();
            if (sagaDetailsBySagaType.containsKey(sagaType)) {
                log.warn("Saga type {} has already been added, skipping it this time", sagaType.getName());
                continue;
            }

            var sagaDetails = SagaDetails.from(sagaDeclaration);
            if (sagaDetailsBySagaType.putIfAbsent(sagaType, sagaDetails) != null) {
                log.warn("Saga type {} has already been added, skipping it this time", sagaType.getName());
                continue;
            }
            for (var aggregateEventType : sagaDetails.aggregateEventTypes()) {
                sagaDetailsByAggregateEventType.compute(aggregateEventType, (eventType, existing) -> {
                    if (existing == null) {
                        return List.of(sagaDetails);
                    }
                    var updated = new ArrayList<SagaDetails>(existing.size() + 1);
                    updated.addAll(existing);
                    updated.add(sagaDetails);
                    return Collections.unmodifiableList(updated);
                });
            }
            log.info("Added saga type {} reacting to {} event type(s)", sagaType.getName(), sagaDetails.aggregateEventTypes().size());
        }
        return this;
    }

    /**
     * Get the details of the sagas interested in the given aggregate event type
     *
     * @param aggregateEventType the aggregate event type
     * @return the immutable list of saga details in registration order, or {@link #EMPTY}
     */
    public List<SagaDetails> getSagaDetails(Class<?> aggregateEventType) {
        notNull(aggregateEventType, "You must provide an aggregateEventType");
        return sagaDetailsByAggregateEventType.getOrDefault(aggregateEventType, EMPTY);
    }

    public Optional<SagaDetails> getSagaDetailsForSagaType(Class<?> sagaType) {
        notNull(sagaType, "You must provide a sagaType");
        return Optional.ofNullable(sagaDetailsBySagaType.get(sagaType));
    }
}
