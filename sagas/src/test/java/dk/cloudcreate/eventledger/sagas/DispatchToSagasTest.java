package dk.cloudcreate.eventledger.sagas;

import dk.cloudcreate.eventledger.aggregates.ConstructorAggregateFactory;
import dk.cloudcreate.eventledger.common.types.SourceId;
import dk.cloudcreate.eventledger.eventstore.*;
import dk.cloudcreate.eventledger.eventstore.events.DomainEvent;
import dk.cloudcreate.eventledger.eventstore.persistence.DuplicateOperationException;
import dk.cloudcreate.eventledger.eventstore.snapshots.NoSnapshotStore;
import dk.cloudcreate.eventledger.sagas.test_data.*;
import dk.cloudcreate.eventledger.sagas.test_data.ThingySaga.*;
import org.junit.jupiter.api.*;
import reactor.test.StepVerifier;

import java.util.*;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.*;

class DispatchToSagasTest {
    private EventStore       eventStore;
    private NoSnapshotStore  snapshotStore;
    private AggregateLoader  aggregateLoader;
    private DispatchToSagas  dispatchToSagas;
    private ThingyId         thingyId;

    @BeforeEach
    void setup() {
        eventStore = SagaTestSupport.inMemoryEventStore(true);
        snapshotStore = new NoSnapshotStore();
        aggregateLoader = new AggregateLoader(new ConstructorAggregateFactory(), eventStore, snapshotStore);
        dispatchToSagas = new DispatchToSagas(new SagaDefinitionService().loadSagas(ThingySaga.DECLARATION), aggregateLoader);
        thingyId = ThingyId.newId();
    }

    @Test
    void verify_that_a_saga_that_has_never_received_events_is_new() {
        var saga = loadSaga();

        assertThat(saga.state()).isEqualTo(SagaState.NEW);
        assertThat(saga.version()).isEqualTo(0L);
    }

    @Test
    void verify_that_events_that_do_not_start_the_saga_are_ignored_while_it_is_new() {
        // When
        publish(thingy -> {
            thingy.ping("a");
            thingy.ping("b");
        });

        // Then
        var saga = loadSaga();
        assertThat(saga.state()).isEqualTo(SagaState.NEW);
        assertThat(saga.version()).isEqualTo(0L);
        assertThat(saga.pingIdsSinceStarted()).isEmpty();
    }

    @Test
    void verify_that_completing_a_saga_that_has_not_been_started_is_ignored() {
        publish(Thingy::requestSagaComplete);

        assertThat(loadSaga().state()).isEqualTo(SagaState.NEW);
    }

    @Test
    void verify_that_a_start_event_makes_the_saga_running() {
        // When
        publish(Thingy::requestSagaStart);

        // Then
        var saga = loadSaga();
        assertThat(saga.state()).isEqualTo(SagaState.RUNNING);
        assertThat(saga.version()).isEqualTo(1L);
    }

    @Test
    void verify_that_a_started_saga_can_be_completed() {
        publish(thingy -> {
            thingy.requestSagaStart();
            thingy.requestSagaComplete();
        });

        assertThat(loadSaga().state()).isEqualTo(SagaState.COMPLETED);
    }

    @Test
    void verify_that_only_events_received_while_the_saga_is_running_are_processed() {
        // Given
        publish(thingy -> {
            thingy.ping("before-start");
            thingy.requestSagaStart();
            thingy.ping("while-running-1");
        });

        // When
        publish(thingy -> {
            thingy.ping("while-running-2");
            thingy.requestSagaComplete();
            thingy.ping("after-completion");
        });

        // Then
        var saga = loadSaga();
        assertThat(saga.state()).isEqualTo(SagaState.COMPLETED);
        assertThat(saga.pingIdsSinceStarted()).containsExactly("while-running-1", "while-running-2");
    }

    @Test
    void verify_that_the_saga_events_are_committed_with_the_event_id_of_the_processed_event_as_source_id() {
        // Given
        var committed = publish(Thingy::requestSagaStart);

        // When
        var sagaEvents = eventStore.loadEvents(ThingySaga.class, ThingySagaId.forThingy(thingyId)).block();

        // Then
        assertThat(sagaEvents).hasSize(1);
        assertThat(sagaEvents.get(0).aggregateEvent()).isInstanceOf(ThingySagaStarted.class);
        assertThat(sagaEvents.get(0).metadata().sourceId()).isEqualTo(SourceId.of(committed.get(0).eventId().value()));
    }

    @Test
    void verify_that_processing_the_same_event_twice_is_rejected_when_duplicate_source_ids_are_detected() {
        // Given
        publish(Thingy::requestSagaStart);
        var ping = publish(thingy -> thingy.ping("once"));

        // When
        StepVerifier.create(dispatchToSagas.processEvents(ping))
                    .expectError(DuplicateOperationException.class)
                    .verify();

        // Then
        assertThat(loadSaga().pingIdsSinceStarted()).containsExactly("once");
    }

    @Test
    void verify_that_events_without_interested_sagas_complete_without_touching_the_event_store() {
        var emptyDispatch = new DispatchToSagas(new SagaDefinitionService(), aggregateLoader);
        var thingy        = new Thingy(thingyId);
        thingy.requestSagaStart();
        var committed = thingy.commit(eventStore, snapshotStore, SourceId.newRandom()).block();

        StepVerifier.create(emptyDispatch.processEvents(committed))
                    .verifyComplete();
        assertThat(loadSaga().version()).isEqualTo(0L);
    }

    @Test
    void verify_that_an_event_the_locator_does_not_resolve_is_skipped() {
        var dispatch = new DispatchToSagas(new SagaDefinitionService().loadSagas(PingAuditSaga.DECLARATION), aggregateLoader);
        var thingy   = new Thingy(thingyId);
        thingy.ping("unlocated");
        var committed = thingy.commit(eventStore, snapshotStore, SourceId.newRandom()).block();

        StepVerifier.create(dispatch.processEvents(committed))
                    .verifyComplete();
    }

    private List<DomainEvent<Thingy, ThingyId, ?>> publish(Consumer<Thingy> commands) {
        var thingy = aggregateLoader.loadAggregate(Thingy.class, thingyId).block();
        commands.accept(thingy);
        var committed = thingy.commit(eventStore, snapshotStore, SourceId.newRandom()).block();
        dispatchToSagas.processEvents(committed).block();
        return committed;
    }

    private ThingySaga loadSaga() {
        return aggregateLoader.loadAggregate(ThingySaga.class, ThingySagaId.forThingy(thingyId)).block();
    }
}
