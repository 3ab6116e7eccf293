package dk.cloudcreate.eventledger.sagas.test_data;

import com.fasterxml.jackson.annotation.*;
import dk.cloudcreate.eventledger.eventstore.aggregates.AggregateEvent;
import dk.cloudcreate.eventledger.eventstore.events.DomainEvent;
import dk.cloudcreate.eventledger.sagas.*;
import dk.cloudcreate.eventledger.sagas.test_data.Thingy.*;
import reactor.core.publisher.Mono;

import java.util.*;

public class ThingySaga extends AggregateSaga<ThingySaga, ThingySagaId> {
    public static final SagaDeclaration<ThingySaga> DECLARATION = SagaDeclaration.of(ThingySaga.class)
                                                                                  .startedBy(ThingySagaStartRequested.class)
                                                                                  .handles(ThingyPinged.class, ThingySagaCompleteRequested.class)
                                                                                  .locatedBy(event -> Mono.just(ThingySagaId.forThingy((ThingyId) event.aggregateIdentity())));

    private List<String> pingIdsSinceStarted;

    public ThingySaga(ThingySagaId id) {
        super(id);
    }

    @Override
    protected void initialize() {
        register(ThingySagaStarted.class, e -> start());
        register(ThingySagaPingReceived.class, e -> pingIdsSinceStarted().add(e.pingId()));
        register(ThingySagaCompleted.class, e -> complete());
    }

    @Override
    public void process(DomainEvent<?, ?, ?> domainEvent) {
        var event = domainEvent.aggregateEvent();
        if (event instanceof ThingySagaStartRequested) {
            emit(new ThingySagaStarted());
        } else if (event instanceof ThingyPinged) {
            emit(new ThingySagaPingReceived(((ThingyPinged) event).pingId()));
        } else if (event instanceof ThingySagaCompleteRequested) {
            emit(new ThingySagaCompleted());
        }
    }

    public List<String> pingIdsSinceStarted() {
        if (pingIdsSinceStarted == null) {
            pingIdsSinceStarted = new ArrayList<>();
        }
        return pingIdsSinceStarted;
    }

    public static final class ThingySagaStarted implements AggregateEvent<ThingySaga, ThingySagaId> {
        @JsonCreator
        public ThingySagaStarted() {
        }
    }

    public static final class ThingySagaPingReceived implements AggregateEvent<ThingySaga, ThingySagaId> {
        private final String pingId;

        @JsonCreator
        public ThingySagaPingReceived(@JsonProperty("pingId") String pingId) {
            this.pingId = pingId;
        }

        public String pingId() {
            return pingId;
        }
    }

    public static final class ThingySagaCompleted implements AggregateEvent<ThingySaga, ThingySagaId> {
        @JsonCreator
        public ThingySagaCompleted() {
        }
    }
}
