package dk.cloudcreate.eventledger.eventstore.events;

import dk.cloudcreate.eventledger.eventstore.aggregates.AggregateEvent;

import java.util.Objects;

import static org.apache.commons.lang3.Validate.*;

/**
 * Maps an event payload type to its stable (name, version) pair and the aggregate type that emits it
 */
public final class EventDefinition {
    private final String                                 name;
    private final int                                    version;
    private final Class<? extends AggregateEvent<?, ?>>  eventType;
    private final Class<?>                               aggregateType;

    public EventDefinition(String name, int version, Class<? extends AggregateEvent<?, ?>> eventType, Class<?> aggregateType) {
        this.name = notBlank(name, "You must provide an event name");
        isTrue(version > 0, "Event version must be positive, was %d", version);
        this.version = version;
        this.eventType = notNull(eventType, "You must provide an eventType");
        this.aggregateType = notNull(aggregateType, "You must provide an aggregateType");
    }

    public String name() {
        return name;
    }

    public int version() {
        return version;
    }

    public Class<? extends AggregateEvent<?, ?>> eventType() {
        return eventType;
    }

    public Class<?> aggregateType() {
        return aggregateType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventDefinition)) return false;
        var that = (EventDefinition) o;
        return version == that.version && name.equals(that.name) && eventType.equals(that.eventType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, version, eventType);
    }

    @Override
    public String toString() {
        return "EventDefinition{" +
                "name='" + name + '\'' +
                ", version=" + version +
                ", eventType=" + eventType.getName() +
                ", aggregateType=" + aggregateType.getName() +
                '}';
    }
}
