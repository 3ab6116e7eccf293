package dk.cloudcreate.eventledger.eventstore.postgresql.test_data;

import dk.cloudcreate.eventledger.common.types.Identity;

public final class ProductId extends Identity<ProductId> {
    private ProductId(CharSequence value) {
        super(value);
    }

    public static ProductId of(CharSequence value) {
        return new ProductId(value);
    }

    public static ProductId newId() {
        return new ProductId(Identity.newValueFor(ProductId.class));
    }
}
