package dk.cloudcreate.eventledger.eventstore.persistence;

import dk.cloudcreate.eventledger.eventstore.types.GlobalPosition;

import java.util.List;

import static org.apache.commons.lang3.Validate.notNull;

/**
 * One page of committed events across all aggregates, in global commit order
 */
public final class AllCommittedEventsPage {
    private final GlobalPosition             nextGlobalPosition;
    private final List<CommittedDomainEvent> committedDomainEvents;

    public AllCommittedEventsPage(GlobalPosition nextGlobalPosition, List<CommittedDomainEvent> committedDomainEvents) {
        this.nextGlobalPosition = notNull(nextGlobalPosition, "You must provide a nextGlobalPosition");
        this.committedDomainEvents = List.copyOf(notNull(committedDomainEvents, "You must provide committedDomainEvents"));
    }

    /**
     * The position to continue reading from when requesting the next page
     */
    public GlobalPosition nextGlobalPosition() {
        return nextGlobalPosition;
    }

    public List<CommittedDomainEvent> committedDomainEvents() {
        return committedDomainEvents;
    }
}
