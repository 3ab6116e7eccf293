package dk.cloudcreate.eventledger.common.types;

public class ThingyId extends Identity<ThingyId> {
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
