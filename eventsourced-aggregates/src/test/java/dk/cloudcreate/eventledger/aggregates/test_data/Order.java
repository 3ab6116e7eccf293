package dk.cloudcreate.eventledger.aggregates.test_data;

import dk.cloudcreate.eventledger.aggregates.AggregateRoot;
import dk.cloudcreate.eventledger.aggregates.test_data.OrderEvents.*;
import dk.cloudcreate.eventledger.eventstore.metadata.Metadata;

import java.util.*;

public class Order extends AggregateRoot<Order, OrderId> {
    private Map<String, Integer> productQuantities;
    private boolean              shipped;
    private long                 orderNumber;

    public Order(OrderId id) {
        super(id);
    }

    @Override
    protected void initialize() {
        productQuantities = new HashMap<>();
        register(OrderPlaced.class, e -> orderNumber = e.orderNumber());
        register(ProductAdded.class, e -> productQuantities.merge(e.product(), e.quantity(), Integer::sum));
        register(OrderShipped.class, e -> shipped = true);
    }

    public void place(long orderNumber) {
        if (!isNew()) {
            throw new IllegalStateException("Order already placed");
        }
        emit(new OrderPlaced(orderNumber), Metadata.of("channel", "web"));
    }

    public void addProduct(String product, int quantity) {
        if (shipped) {
            throw new IllegalStateException("Order already shipped");
        }
        emit(new ProductAdded(product, quantity));
    }

    public void ship() {
        if (!shipped) {
            emit(new OrderShipped());
        }
    }

    public void audit() {
        emit(new OrderAudited());
    }

    public Map<String, Integer> productQuantities() {
        return productQuantities != null ? productQuantities : Map.of();
    }

    public boolean isShipped() {
        return shipped;
    }

    public long orderNumber() {
        return orderNumber;
    }
}
