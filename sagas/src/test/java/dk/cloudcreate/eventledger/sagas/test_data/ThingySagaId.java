package dk.cloudcreate.eventledger.sagas.test_data;

import dk.cloudcreate.eventledger.common.types.Identity;

import java.util.UUID;

public final class ThingySagaId extends Identity<ThingySagaId> {
    private static final UUID NAMESPACE = UUID.fromString("0b6a5c1e-5d0b-4a6c-9a43-2f3bb0b5a0f1");

    private ThingySagaId(CharSequence value) {
        super(value);
    }

    public static ThingySagaId of(CharSequence value) {
        return new ThingySagaId(value);
    }

    /**
     * The saga of a thingy always has the same id
     */
    public static ThingySagaId forThingy(ThingyId thingyId) {
        return new ThingySagaId(Identity.newDeterministicValueFor(ThingySagaId.class, NAMESPACE, thingyId.value()));
    }
}
