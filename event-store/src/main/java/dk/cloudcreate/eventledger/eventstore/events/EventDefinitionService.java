package dk.cloudcreate.eventledger.eventstore.events;

import dk.cloudcreate.eventledger.common.types.Identity;
import dk.cloudcreate.eventledger.eventstore.aggregates.*;
import org.slf4j.*;

import java.util.*;
import java.util.concurrent.*;
import java.util.function.Function;
import java.util.regex.Pattern;

import static dk.cloudcreate.eventledger.common.Messages.msg;
import static org.apache.commons.lang3.Validate.notNull;

/**
 * Registry of the aggregate types and the event payload types known to the event store.<br>
 * Every event type is registered with a stable (name, version) pair, which is what is persisted alongside the event,
 * so payload classes can be renamed or moved without breaking stored events. The registry also knows the latest version
 * of every event name, which the upgrade pipeline uses to verify that loaded events have been fully upgraded.
 * <pre>{@code
 * var definitions = new EventDefinitionService()
 *         .addAggregateType(Order.class, OrderId::of)
 *         .addEventTypes(Order.class, OrderPlaced.class, OrderShipped.class);
 * }</pre>
 */
public final class EventDefinitionService {
    private static final Logger  log              = LoggerFactory.getLogger(EventDefinitionService.class);
    private static final Pattern NAME_AND_VERSION = Pattern.compile("^(?:Old)?(?<name>[\\p{L}\\p{Nd}_$]+?)(?:V(?<version>[0-9]+))?$");

    private final ConcurrentMap<Class<?>, EventDefinition>                  definitionsByEventType      = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, EventDefinition>                    definitionsByNameAndVersion = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Integer>                            latestVersionByName         = new ConcurrentHashMap<>();
    private final ConcurrentMap<Class<?>, AggregateTypeDefinition<?, ?>>    aggregateTypesByType        = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, AggregateTypeDefinition<?, ?>>      aggregateTypesByName        = new ConcurrentHashMap<>();

    /**
     * Register an aggregate type
     *
     * @param aggregateType   the aggregate type
     * @param identityFactory creates an identity instance from a persisted identity value, e.g. <code>OrderId::of</code>
     * @return this service instance
     */
    public <A extends Aggregate<A, ID>, ID extends Identity<ID>> EventDefinitionService addAggregateType(Class<A> aggregateType, Function<String, ID> identityFactory) {
        var definition = new AggregateTypeDefinition<>(aggregateType, identityFactory);
        var existing = aggregateTypesByName.putIfAbsent(definition.name(), definition);
        if (existing != null && !existing.aggregateType().equals(aggregateType)) {
            throw new IllegalArgumentException(msg("Aggregate name '{}' of '{}' is already used by '{}'",
                                                   definition.name(), aggregateType.getName(), existing.aggregateType().getName()));
        }
        aggregateTypesByType.putIfAbsent(aggregateType, definition);
        log.debug("Added aggregate type '{}' with name '{}'", aggregateType.getName(), definition.name());
        return this;
    }

    /**
     * Register an event type, where the name and version are resolved from the {@link EventVersion} annotation or from the class name
     */
    public <A extends Aggregate<A, ID>, ID extends Identity<ID>> EventDefinitionService addEventType(Class<A> aggregateType, Class<? extends AggregateEvent<A, ID>> eventType) {
        notNull(eventType, "You must provide an eventType");
        var annotation = eventType.getAnnotation(EventVersion.class);
        var derived    = deriveNameAndVersion(eventType);
        if (annotation != null) {
            var name = annotation.name().isBlank() ? derived.name() : annotation.name();
            return addEventType(aggregateType, eventType, name, annotation.version());
        }
        return addEventType(aggregateType, eventType, derived.name(), derived.version());
    }

    @SafeVarargs
    public final <A extends Aggregate<A, ID>, ID extends Identity<ID>> EventDefinitionService addEventTypes(Class<A> aggregateType, Class<? extends AggregateEvent<A, ID>>... eventTypes) {
        notNull(eventTypes, "You must provide eventTypes");
        for (var eventType : eventTypes) {
            addEventType(aggregateType, eventType);
        }
        return this;
    }

    /**
     * Register an event type with an explicit name and version
     */
    public <A extends Aggregate<A, ID>, ID extends Identity<ID>> EventDefinitionService addEventType(Class<A> aggregateType,
                                                                                                    Class<? extends AggregateEvent<A, ID>> eventType,
                                                                                                    String name,
                                                                                                    int version) {
        var definition = new EventDefinition(name, version, eventType, aggregateType);
        var key        = key(definition.name(), definition.version());
        var existing   = definitionsByNameAndVersion.putIfAbsent(key, definition);
        if (existing != null && !existing.eventType().equals(eventType)) {
            throw new IllegalArgumentException(msg("Event name '{}' version {} of '{}' is already used by '{}'",
                                                   name, version, eventType.getName(), existing.eventType().getName()));
        }
        var existingForType = definitionsByEventType.putIfAbsent(eventType, definition);
        if (existingForType != null && !existingForType.equals(definition)) {
            throw new IllegalArgumentException(msg("Event type '{}' is already registered as '{}'", eventType.getName(), existingForType));
        }
        latestVersionByName.merge(definition.name(), definition.version(), Math::max);
        log.debug("Added {}", definition);
        return this;
    }

    public Optional<EventDefinition> findDefinition(Class<?> eventType) {
        return Optional.ofNullable(definitionsByEventType.get(eventType));
    }

    public Optional<EventDefinition> findDefinition(String name, int version) {
        return Optional.ofNullable(definitionsByNameAndVersion.get(key(name, version)));
    }

    /**
     * @throws IllegalArgumentException if the event type hasn't been registered
     */
    public EventDefinition getDefinition(Class<?> eventType) {
        return findDefinition(eventType).orElseThrow(() -> new IllegalArgumentException(msg("Event type '{}' hasn't been registered", eventType.getName())));
    }

    /**
     * The latest version registered for the given event name
     */
    public OptionalInt latestVersionOf(String name) {
        var latest = latestVersionByName.get(name);
        return latest != null ? OptionalInt.of(latest) : OptionalInt.empty();
    }

    public Optional<AggregateTypeDefinition<?, ?>> findAggregateType(String aggregateName) {
        return Optional.ofNullable(aggregateTypesByName.get(aggregateName));
    }

    @SuppressWarnings("unchecked")
    public <A extends Aggregate<A, ID>, ID extends Identity<ID>> Optional<AggregateTypeDefinition<A, ID>> findAggregateType(Class<A> aggregateType) {
        return Optional.ofNullable((AggregateTypeDefinition<A, ID>) aggregateTypesByType.get(aggregateType));
    }

    private static String key(String name, int version) {
        return name + "/" + version;
    }

    static NameAndVersion deriveNameAndVersion(Class<?> eventType) {
        var matcher = NAME_AND_VERSION.matcher(eventType.getSimpleName());
        if (!matcher.matches()) {
            return new NameAndVersion(eventType.getSimpleName(), 1);
        }
        var version = matcher.group("version");
        return new NameAndVersion(matcher.group("name"), version != null ? Integer.parseInt(version) : 1);
    }

    static final class NameAndVersion {
        private final String name;
        private final int    version;

        NameAndVersion(String name, int version) {
            this.name = name;
            this.version = version;
        }

        String name() {
            return name;
        }

        int version() {
            return version;
        }
    }
}
