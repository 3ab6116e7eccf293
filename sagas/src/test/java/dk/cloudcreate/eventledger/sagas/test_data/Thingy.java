package dk.cloudcreate.eventledger.sagas.test_data;

import com.fasterxml.jackson.annotation.*;
import dk.cloudcreate.eventledger.aggregates.AggregateRoot;
import dk.cloudcreate.eventledger.eventstore.aggregates.AggregateEvent;

import java.util.*;

public class Thingy extends AggregateRoot<Thingy, ThingyId> {
    private List<String> pingsReceived;

    public Thingy(ThingyId id) {
        super(id);
    }

    @Override
    protected void initialize() {
        register(ThingyPinged.class, e -> pingsReceived().add(e.pingId()));
        register(ThingySagaStartRequested.class, e -> {});
        register(ThingySagaCompleteRequested.class, e -> {});
    }

    public void ping(String pingId) {
        emit(new ThingyPinged(pingId));
    }

    public void requestSagaStart() {
        emit(new ThingySagaStartRequested());
    }

    public void requestSagaComplete() {
        emit(new ThingySagaCompleteRequested());
    }

    public List<String> pingsReceived() {
        if (pingsReceived == null) {
            pingsReceived = new ArrayList<>();
        }
        return pingsReceived;
    }

    public static final class ThingyPinged implements AggregateEvent<Thingy, ThingyId> {
        private final String pingId;

        @JsonCreator
        public ThingyPinged(@JsonProperty("pingId") String pingId) {
            this.pingId = pingId;
        }

        public String pingId() {
            return pingId;
        }
    }

    public static final class ThingySagaStartRequested implements AggregateEvent<Thingy, ThingyId> {
        @JsonCreator
        public ThingySagaStartRequested() {
        }
    }

    public static final class ThingySagaCompleteRequested implements AggregateEvent<Thingy, ThingyId> {
        @JsonCreator
        public ThingySagaCompleteRequested() {
        }
    }
}
