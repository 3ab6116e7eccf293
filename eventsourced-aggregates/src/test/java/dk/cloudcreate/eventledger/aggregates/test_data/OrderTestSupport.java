package dk.cloudcreate.eventledger.aggregates.test_data;

import dk.cloudcreate.eventledger.aggregates.test_data.OrderEvents.*;
import dk.cloudcreate.eventledger.eventstore.*;
import dk.cloudcreate.eventledger.eventstore.events.EventDefinitionService;
import dk.cloudcreate.eventledger.eventstore.persistence.inmemory.InMemoryEventPersistence;
import dk.cloudcreate.eventledger.eventstore.serializer.JacksonEventJsonSerializer;
import dk.cloudcreate.eventledger.eventstore.upgrade.DefaultEventUpgradeManager;

import java.util.List;

public final class OrderTestSupport {
    private OrderTestSupport() {
    }

    public static EventDefinitionService eventDefinitions() {
        return new EventDefinitionService()
                .addAggregateType(Order.class, OrderId::of)
                .addEventTypes(Order.class, OrderPlaced.class, ProductAdded.class, OrderShipped.class, OrderAudited.class)
                .addAggregateType(SnapshottingOrder.class, OrderId::of)
                .addEventTypes(SnapshottingOrder.class, SnapshottingOrderEvents.ProductOrdered.class);
    }

    public static EventStore inMemoryEventStore() {
        var definitions = eventDefinitions();
        return new DefaultEventStore(new JacksonEventJsonSerializer(definitions),
                                     new DefaultEventUpgradeManager(definitions),
                                     List.of(),
                                     new InMemoryEventPersistence());
    }
}
