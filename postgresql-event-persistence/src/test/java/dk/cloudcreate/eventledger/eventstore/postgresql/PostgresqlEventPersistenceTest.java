package dk.cloudcreate.eventledger.eventstore.postgresql;

import dk.cloudcreate.eventledger.common.types.*;
import dk.cloudcreate.eventledger.eventstore.*;
import dk.cloudcreate.eventledger.eventstore.aggregates.*;
import dk.cloudcreate.eventledger.eventstore.events.*;
import dk.cloudcreate.eventledger.eventstore.metadata.*;
import dk.cloudcreate.eventledger.eventstore.persistence.*;
import dk.cloudcreate.eventledger.eventstore.postgresql.test_data.*;
import dk.cloudcreate.eventledger.eventstore.postgresql.test_data.Product.*;
import dk.cloudcreate.eventledger.eventstore.serializer.*;
import dk.cloudcreate.eventledger.eventstore.snapshots.NoSnapshotStore;
import dk.cloudcreate.eventledger.eventstore.types.GlobalPosition;
import dk.cloudcreate.eventledger.eventstore.upgrade.DefaultEventUpgradeManager;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.postgres.PostgresPlugin;
import org.junit.jupiter.api.*;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.*;
import reactor.test.StepVerifier;

import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

@Testcontainers(disabledWithoutDocker = true)
class PostgresqlEventPersistenceTest {
    @Container
    private static final PostgreSQLContainer<?> postgreSQLContainer = new PostgreSQLContainer<>("postgres:latest")
            .withDatabaseName("event-store")
            .withUsername("test-user")
            .withPassword("secret-password");

    private Jdbi                       jdbi;
    private PostgresqlEventPersistence eventPersistence;
    private EventStore                 eventStore;

    @BeforeEach
    void setup() {
        jdbi = Jdbi.create(postgreSQLContainer.getJdbcUrl(),
                           postgreSQLContainer.getUsername(),
                           postgreSQLContainer.getPassword());
        jdbi.installPlugin(new PostgresPlugin());
        eventPersistence = new PostgresqlEventPersistence(jdbi);
        eventPersistence.resetStorage();
        eventStore = eventStoreUsing(eventPersistence);
    }

    private static EventStore eventStoreUsing(EventPersistence eventPersistence) {
        var definitions = Product.eventDefinitions();
        return new DefaultEventStore(new JacksonEventJsonSerializer(definitions),
                                     new DefaultEventUpgradeManager(definitions),
                                     List.of(),
                                     eventPersistence);
    }

    private static UncommittedEvent uncommitted(AggregateEvent<Product, ProductId> event, long aggregateSequenceNumber) {
        return UncommittedEvent.of(event,
                                   Metadata.of(MetadataKeys.AGGREGATE_SEQUENCE_NUMBER, Long.toString(aggregateSequenceNumber)));
    }

    @Test
    void verify_that_stored_events_can_be_loaded_again() {
        // Given
        var productId = ProductId.newId();
        var sourceId  = SourceId.newRandom();

        // When
        var stored = eventStore.store(Product.class,
                                      productId,
                                      List.of(uncommitted(new ProductCreated("Pen"), 1),
                                              uncommitted(new ProductRenamed("Fountain pen"), 2),
                                              uncommitted(new ProductRenamed("Ink pen"), 3)),
                                      sourceId)
                               .block();

        // Then
        assertThat(stored).hasSize(3);
        assertThat(stored.stream().map(e -> e.aggregateSequenceNumber()).collect(Collectors.toList())).containsExactly(1L, 2L, 3L);
        assertThat(stored.get(0).globalPosition()).isNotEqualTo(GlobalPosition.START);

        var loaded = eventStore.loadEvents(Product.class, productId).block();
        assertThat(loaded).hasSize(3);
        assertThat(loaded.get(0).aggregateEvent()).isInstanceOf(ProductCreated.class);
        assertThat(((ProductCreated) loaded.get(0).aggregateEvent()).name()).isEqualTo("Pen");
        assertThat(loaded.get(0).metadata().sourceId()).isEqualTo(sourceId);
        assertThat(loaded.get(0).metadata().aggregateName()).isEqualTo("Product");
        assertThat(loaded.get(0).metadata().batchId()).isEqualTo(loaded.get(2).metadata().batchId());
        assertThat(loaded.get(2).globalPosition()).isEqualTo(stored.get(2).globalPosition());

        var range = eventStore.loadEvents(Product.class, productId, 2, 3).block();
        assertThat(range.stream().map(e -> e.aggregateSequenceNumber()).collect(Collectors.toList())).containsExactly(2L, 3L);
        var tail = eventStore.loadEvents(Product.class, productId, 3).block();
        assertThat(((ProductRenamed) tail.get(0).aggregateEvent()).name()).isEqualTo("Ink pen");
    }

    @Test
    void verify_that_an_aggregate_can_be_loaded_through_the_aggregate_loader() {
        // Given
        var productId = ProductId.newId();
        eventStore.store(Product.class, productId, List.of(uncommitted(new ProductCreated("Cup"), 1)), SourceId.newRandom()).block();
        eventStore.store(Product.class, productId, List.of(uncommitted(new ProductRenamed("Mug"), 2)), SourceId.newRandom()).block();
        var aggregateLoader = new AggregateLoader(new AggregateFactory() {
            @SuppressWarnings("unchecked")
            @Override
            public <A extends Aggregate<A, ID>, ID extends Identity<ID>> A createNewAggregate(Class<A> aggregateType, ID id) {
                return (A) new Product((ProductId) id);
            }
        }, eventStore, new NoSnapshotStore());

        // When
        var product = aggregateLoader.loadAggregate(Product.class, productId).block();

        // Then
        assertThat(product.version()).isEqualTo(2L);
        assertThat(product.productName()).isEqualTo("Mug");
    }

    @Test
    void verify_that_a_conflicting_commit_fails_without_persisting_any_of_its_events() {
        // Given
        var productId = ProductId.newId();
        eventStore.store(Product.class, productId,
                         List.of(uncommitted(new ProductCreated("Pen"), 1),
                                 uncommitted(new ProductRenamed("Pencil"), 2)),
                         SourceId.newRandom()).block();

        // When
        var conflictingCommit = eventStore.store(Product.class, productId,
                                                 List.of(uncommitted(new ProductRenamed("Marker"), 2),
                                                         uncommitted(new ProductRenamed("Crayon"), 3)),
                                                 SourceId.newRandom());

        // Then
        StepVerifier.create(conflictingCommit)
                    .expectError(OptimisticConcurrencyException.class)
                    .verify();
        var loaded = eventStore.loadEvents(Product.class, productId).block();
        assertThat(loaded).hasSize(2);
        assertThat(((ProductRenamed) loaded.get(1).aggregateEvent()).name()).isEqualTo("Pencil");
    }

    @Test
    void verify_that_a_commit_starting_beyond_the_next_sequence_number_is_rejected() {
        // Given
        var productId = ProductId.newId();
        eventStore.store(Product.class, productId, List.of(uncommitted(new ProductCreated("Pen"), 1)), SourceId.newRandom()).block();

        // When
        var commitWithGap = eventStore.store(Product.class, productId,
                                             List.of(uncommitted(new ProductRenamed("Marker"), 3)),
                                             SourceId.newRandom());

        // Then
        StepVerifier.create(commitWithGap)
                    .expectErrorSatisfies(e -> assertThat(e).isInstanceOf(OptimisticConcurrencyException.class)
                                                            .hasMessageContaining("Expected aggregate sequence number 2"))
                    .verify();
        assertThat(eventStore.loadEvents(Product.class, productId).block())
                .extracting(DomainEvent::aggregateSequenceNumber)
                .containsExactly(1L);
    }

    @Test
    void verify_that_the_first_commit_of_a_new_aggregate_must_start_at_sequence_number_one() {
        var productId = ProductId.newId();

        StepVerifier.create(eventPersistence.commitEvents(productId, List.of(new SerializedEvent("{}", "{}", 2, Metadata.empty()))))
                    .expectError(OptimisticConcurrencyException.class)
                    .verify();
        assertThat(eventPersistence.loadCommittedEvents(productId, 1).block()).isEmpty();
    }

    @Test
    void verify_that_only_one_of_several_concurrent_first_commits_succeeds() throws Exception {
        // Given
        var productId = ProductId.newId();
        var writers   = 6;
        var executor  = Executors.newFixedThreadPool(writers);
        var start     = new CountDownLatch(1);
        var succeeded = new AtomicInteger();
        var conflicts = new AtomicInteger();

        // When
        try {
            var futures = new ArrayList<Future<?>>();
            for (var writer = 0; writer < writers; writer++) {
                var name = "Product " + writer;
                futures.add(executor.submit(() -> {
                    start.await();
                    try {
                        eventStore.store(Product.class, productId, List.of(uncommitted(new ProductCreated(name), 1)), SourceId.newRandom()).block();
                        succeeded.incrementAndGet();
                    } catch (OptimisticConcurrencyException e) {
                        conflicts.incrementAndGet();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (var future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        // Then
        assertThat(succeeded.get()).isEqualTo(1);
        assertThat(conflicts.get()).isEqualTo(writers - 1);
        assertThat(eventStore.loadEvents(Product.class, productId).block()).hasSize(1);
    }

    @Test
    void verify_that_all_events_can_be_paged_in_global_order() {
        // Given
        var productId1 = ProductId.newId();
        var productId2 = ProductId.newId();
        eventStore.store(Product.class, productId1, List.of(uncommitted(new ProductCreated("A"), 1)), SourceId.newRandom()).block();
        eventStore.store(Product.class, productId2, List.of(uncommitted(new ProductCreated("B"), 1)), SourceId.newRandom()).block();
        eventStore.store(Product.class, productId1, List.of(uncommitted(new ProductRenamed("A2"), 2)), SourceId.newRandom()).block();

        // When
        var firstPage  = eventStore.loadAllEvents(GlobalPosition.START, 2).block();
        var secondPage = eventStore.loadAllEvents(firstPage.nextGlobalPosition(), 2).block();
        var emptyPage  = eventStore.loadAllEvents(secondPage.nextGlobalPosition(), 2).block();

        // Then
        assertThat(firstPage.domainEvents()).hasSize(2);
        assertThat(firstPage.domainEvents().get(0).aggregateIdentity()).isEqualTo(productId1);
        assertThat(firstPage.domainEvents().get(1).aggregateIdentity()).isEqualTo(productId2);
        assertThat(secondPage.domainEvents()).hasSize(1);
        assertThat(secondPage.domainEvents().get(0).aggregateIdentity()).isEqualTo(productId1);
        assertThat(secondPage.domainEvents().get(0).aggregateSequenceNumber()).isEqualTo(2L);
        assertThat(emptyPage.domainEvents()).isEmpty();
        assertThat(emptyPage.nextGlobalPosition()).isEqualTo(secondPage.nextGlobalPosition());
    }

    @Test
    void verify_that_deleting_an_aggregate_removes_only_its_events() {
        // Given
        var deletedId = ProductId.newId();
        var keptId    = ProductId.newId();
        eventStore.store(Product.class, deletedId, List.of(uncommitted(new ProductCreated("Gone"), 1)), SourceId.newRandom()).block();
        eventStore.store(Product.class, keptId, List.of(uncommitted(new ProductCreated("Kept"), 1)), SourceId.newRandom()).block();

        // When
        eventStore.deleteAggregate(Product.class, deletedId).block();

        // Then
        assertThat(eventStore.loadEvents(Product.class, deletedId).block()).isEmpty();
        assertThat(eventStore.loadEvents(Product.class, keptId).block()).hasSize(1);
        assertThat(eventStore.loadAllEvents(GlobalPosition.START, 10).block().domainEvents()).hasSize(1);
        StepVerifier.create(eventStore.deleteAggregate(Product.class, deletedId)).verifyComplete();
    }

    @Test
    void verify_that_a_replayed_source_id_is_rejected_when_duplicate_detection_is_enabled() {
        // Given
        var persistence = new PostgresqlEventPersistence(jdbi, PostgresqlEventPersistenceConfiguration.standard()
                                                                                                      .withEventsTableName("deduplicated_events")
                                                                                                      .withJsonColumnType(JSONColumnType.JSON)
                                                                                                      .withDuplicateSourceIdDetection(true));
        persistence.resetStorage();
        var store     = eventStoreUsing(persistence);
        var productId = ProductId.newId();
        var sourceId  = SourceId.newRandom();
        store.store(Product.class, productId, List.of(uncommitted(new ProductCreated("Pen"), 1)), sourceId).block();

        // When
        var replay = store.store(Product.class, productId, List.of(uncommitted(new ProductRenamed("Pen"), 2)), sourceId);

        // Then
        assertThat(persistence.detectsDuplicateSourceIds()).isTrue();
        StepVerifier.create(replay)
                    .expectErrorSatisfies(e -> {
                        assertThat(e).isInstanceOf(DuplicateOperationException.class);
                        assertThat(((DuplicateOperationException) e).getSourceId()).isEqualTo(sourceId);
                    })
                    .verify();
        assertThat(store.loadEvents(Product.class, productId).block()).hasSize(1);
        // Another aggregate may use the same source id
        StepVerifier.create(store.store(Product.class, ProductId.newId(), List.of(uncommitted(new ProductCreated("Ink"), 1)), sourceId))
                    .assertNext(events -> assertThat(events).hasSize(1))
                    .verifyComplete();
    }

    @Test
    void verify_that_the_events_table_is_only_created_once() {
        var productId = ProductId.newId();
        eventStore.store(Product.class, productId, List.of(uncommitted(new ProductCreated("Pen"), 1)), SourceId.newRandom()).block();

        // Creating another instance against the same table keeps the existing events
        var otherStore = eventStoreUsing(new PostgresqlEventPersistence(jdbi));

        assertThat(otherStore.loadEvents(Product.class, productId).block()).hasSize(1);
    }
}
