package dk.cloudcreate.eventledger.eventstore.upgrade;

import dk.cloudcreate.eventledger.common.types.Identity;
import dk.cloudcreate.eventledger.eventstore.aggregates.Aggregate;
import dk.cloudcreate.eventledger.eventstore.events.*;
import dk.cloudcreate.eventledger.eventstore.metadata.MetadataKeys;
import org.slf4j.*;
import reactor.core.publisher.Mono;

import java.util.*;
import java.util.concurrent.*;
import java.util.stream.Collectors;

import static dk.cloudcreate.eventledger.common.Messages.msg;
import static org.apache.commons.lang3.Validate.notNull;

/**
 * {@link EventUpgradeManager} that applies the {@link EventUpgrader}s registered for each event's aggregate type,
 * in registration order, and afterwards verifies that the event is at the latest version registered in the
 * {@link EventDefinitionService}
 */
public final class DefaultEventUpgradeManager implements EventUpgradeManager {
    private static final Logger log = LoggerFactory.getLogger(DefaultEventUpgradeManager.class);

    private final EventDefinitionService                                  eventDefinitionService;
    private final ConcurrentMap<Class<?>, List<EventUpgrader<?, ?>>>      upgradersByAggregateType = new ConcurrentHashMap<>();

    public DefaultEventUpgradeManager(EventDefinitionService eventDefinitionService) {
        this.eventDefinitionService = notNull(eventDefinitionService, "You must provide an eventDefinitionService");
    }

    /**
     * Register an upgrader for the aggregate type. Upgraders are applied in registration order
     */
    public <A extends Aggregate<A, ID>, ID extends Identity<ID>> DefaultEventUpgradeManager addUpgrader(Class<A> aggregateType, EventUpgrader<A, ID> upgrader) {
        notNull(aggregateType, "You must provide an aggregateType");
        notNull(upgrader, "You must provide an upgrader");
        upgradersByAggregateType.compute(aggregateType, (type, existing) -> {
            var upgraders = existing != null ? new ArrayList<>(existing) : new ArrayList<EventUpgrader<?, ?>>();
            upgraders.add(upgrader);
            return List.copyOf(upgraders);
        });
        log.debug("Added upgrader '{}' for aggregate type '{}'", upgrader.getClass().getName(), aggregateType.getName());
        return this;
    }

    @Override
    public Mono<List<DomainEvent<?, ?, ?>>> upgrade(List<DomainEvent<?, ?, ?>> domainEvents, EventUpgradeContext context) {
        notNull(domainEvents, "You must provide domainEvents");
        notNull(context, "You must provide a context");
        return Mono.fromCallable(() -> {
            var upgraded = domainEvents.stream()
                                       .map(domainEvent -> upgradeEvent(domainEvent, context))
                                       .collect(Collectors.<DomainEvent<?, ?, ?>>toList());
            log.debug("Upgraded {} event(s)", upgraded.size());
            return upgraded;
        });
    }

    @SuppressWarnings("unchecked")
    @Override
    public <A extends Aggregate<A, ID>, ID extends Identity<ID>> Mono<List<DomainEvent<A, ID, ?>>> upgrade(Class<A> aggregateType,
                                                                                                          List<DomainEvent<A, ID, ?>> domainEvents,
                                                                                                          EventUpgradeContext context) {
        notNull(aggregateType, "You must provide an aggregateType");
        notNull(domainEvents, "You must provide domainEvents");
        notNull(context, "You must provide a context");
        return Mono.fromCallable(() -> {
            var upgraded = new ArrayList<DomainEvent<A, ID, ?>>(domainEvents.size());
            for (var domainEvent : domainEvents) {
                upgraded.add((DomainEvent<A, ID, ?>) upgradeEvent(domainEvent, context));
            }
            log.debug("Upgraded {} event(s) of aggregate type '{}'", upgraded.size(), aggregateType.getName());
            return upgraded;
        });
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private DomainEvent<?, ?, ?> upgradeEvent(DomainEvent<?, ?, ?> domainEvent, EventUpgradeContext context) {
        var          upgraders = context.upgradersFor(domainEvent.aggregateType(), type -> upgradersByAggregateType.getOrDefault(type, List.of()));
        DomainEvent  current   = domainEvent;
        for (EventUpgrader upgrader : upgraders) {
            var upgraded = (DomainEvent) upgrader.upgrade(current, context);
            if (upgraded == null) {
                throw new EventUpgradeException(msg("Upgrader '{}' returned null for event {} of aggregate '{}'",
                                                    upgrader.getClass().getName(), domainEvent.aggregateSequenceNumber(), domainEvent.aggregateIdentity()));
            }
            if (upgraded.aggregateSequenceNumber() != domainEvent.aggregateSequenceNumber() || !upgraded.aggregateIdentity().equals(domainEvent.aggregateIdentity())) {
                throw new EventUpgradeException(msg("Upgrader '{}' changed the identity or sequence number of event {} of aggregate '{}'",
                                                    upgrader.getClass().getName(), domainEvent.aggregateSequenceNumber(), domainEvent.aggregateIdentity()));
            }
            current = upgraded;
        }
        return verifyLatestVersion(current);
    }

    private DomainEvent<?, ?, ?> verifyLatestVersion(DomainEvent<?, ?, ?> domainEvent) {
        var definition = eventDefinitionService.findDefinition(domainEvent.eventType())
                                               .orElseThrow(() -> new EventUpgradeException(msg("Event type '{}' hasn't been registered with the EventDefinitionService",
                                                                                                domainEvent.eventType().getName())));
        var latestVersion = eventDefinitionService.latestVersionOf(definition.name()).orElse(definition.version());
        if (definition.version() < latestVersion) {
            throw new EventUpgradeException(msg("Event {} of aggregate '{}' is '{}' version {}, but the latest version is {} and no upgrader upgraded it",
                                                domainEvent.aggregateSequenceNumber(), domainEvent.aggregateIdentity(), definition.name(), definition.version(), latestVersion));
        }
        var metadata = domainEvent.metadata();
        if (metadata.get(MetadataKeys.EVENT_NAME).filter(definition.name()::equals).isPresent() &&
                metadata.get(MetadataKeys.EVENT_VERSION).filter(Integer.toString(definition.version())::equals).isPresent()) {
            return domainEvent;
        }
        return domainEvent.withMetadata(metadata.with(MetadataKeys.EVENT_NAME, definition.name())
                                                .with(MetadataKeys.EVENT_VERSION, Integer.toString(definition.version())));
    }
}
