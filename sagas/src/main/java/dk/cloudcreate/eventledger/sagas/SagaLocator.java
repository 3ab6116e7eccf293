package dk.cloudcreate.eventledger.sagas;

import dk.cloudcreate.eventledger.common.types.Identity;
import dk.cloudcreate.eventledger.eventstore.events.DomainEvent;
import reactor.core.publisher.Mono;

/**
 * Resolves the identity of the saga instance that should process a domain event
 */
@FunctionalInterface
public interface SagaLocator {
    /**
     * @param domainEvent the domain event
     * @return the saga identity, or an empty {@link Mono} if no saga instance should process the event
     */
    Mono<? extends Identity<?>> locateSaga(DomainEvent<?, ?, ?> domainEvent);
}
