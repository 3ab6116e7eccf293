package dk.cloudcreate.eventledger.eventstore.test_data;

import dk.cloudcreate.eventledger.common.types.Identity;

public final class ThingyId extends Identity<ThingyId> {
    private ThingyId(CharSequence value) {
        super(value);
    }

    public static ThingyId of(CharSequence value) {
        return new ThingyId(value);
    }

    public static ThingyId newId() {
        return new ThingyId(Identity.newValueFor(ThingyId.class));
    }
}
