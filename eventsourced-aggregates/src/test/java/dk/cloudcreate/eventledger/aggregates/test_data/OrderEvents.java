package dk.cloudcreate.eventledger.aggregates.test_data;

import com.fasterxml.jackson.annotation.*;
import dk.cloudcreate.eventledger.eventstore.aggregates.AggregateEvent;

import java.util.Objects;

public final class OrderEvents {
    private OrderEvents() {
    }

    public static final class OrderPlaced implements AggregateEvent<Order, OrderId> {
        private final long orderNumber;

        @JsonCreator
        public OrderPlaced(@JsonProperty("orderNumber") long orderNumber) {
            this.orderNumber = orderNumber;
        }

        public long orderNumber() {
            return orderNumber;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof OrderPlaced && ((OrderPlaced) o).orderNumber == orderNumber;
        }

        @Override
        public int hashCode() {
            return Long.hashCode(orderNumber);
        }
    }

    public static final class ProductAdded implements AggregateEvent<Order, OrderId> {
        private final String product;
        private final int    quantity;

        @JsonCreator
        public ProductAdded(@JsonProperty("product") String product, @JsonProperty("quantity") int quantity) {
            this.product = product;
            this.quantity = quantity;
        }

        public String product() {
            return product;
        }

        public int quantity() {
            return quantity;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof ProductAdded)) return false;
            var that = (ProductAdded) o;
            return quantity == that.quantity && Objects.equals(product, that.product);
        }

        @Override
        public int hashCode() {
            return Objects.hash(product, quantity);
        }
    }

    public static final class OrderShipped implements AggregateEvent<Order, OrderId> {
        @JsonCreator
        public OrderShipped() {
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof OrderShipped;
        }

        @Override
        public int hashCode() {
            return OrderShipped.class.hashCode();
        }
    }

    /**
     * An event no aggregate has a handler for
     */
    public static final class OrderAudited implements AggregateEvent<Order, OrderId> {
        @JsonCreator
        public OrderAudited() {
        }
    }
}
