package dk.cloudcreate.eventledger.eventstore;

import dk.cloudcreate.eventledger.eventstore.events.DomainEvent;
import dk.cloudcreate.eventledger.eventstore.types.GlobalPosition;

import java.util.List;

import static org.apache.commons.lang3.Validate.notNull;

/**
 * One page of (upgraded) domain events across all aggregates, in global commit order
 */
public final class AllEventsPage {
    private final GlobalPosition              nextGlobalPosition;
    private final List<DomainEvent<?, ?, ?>>  domainEvents;

    public AllEventsPage(GlobalPosition nextGlobalPosition, List<DomainEvent<?, ?, ?>> domainEvents) {
        this.nextGlobalPosition = notNull(nextGlobalPosition, "You must provide a nextGlobalPosition");
        this.domainEvents = List.copyOf(notNull(domainEvents, "You must provide domainEvents"));
    }

    /**
     * The position to pass to {@link EventStore#loadAllEvents} to read the next page
     */
    public GlobalPosition nextGlobalPosition() {
        return nextGlobalPosition;
    }

    public List<DomainEvent<?, ?, ?>> domainEvents() {
        return domainEvents;
    }

    @Override
    public String toString() {
        return "AllEventsPage{" +
                "nextGlobalPosition=" + nextGlobalPosition +
                ", domainEvents=" + domainEvents.size() +
                '}';
    }
}
