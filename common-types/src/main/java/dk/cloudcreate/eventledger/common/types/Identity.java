package dk.cloudcreate.eventledger.common.types;

import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.concurrent.*;

import static dk.cloudcreate.eventledger.common.Messages.msg;
import static org.apache.commons.lang3.Validate.*;

/**
 * Immutable, type tagged identifier that names exactly one aggregate instance.<br>
 * The value has the format <code>{name}-{uuid}</code>, where <code>name</code> is the lower-cased simple class name
 * of the concrete identity type without a trailing <code>Id</code>, e.g. a <code>ThingyId</code> has values like
 * <code>thingy-8a7c3b7e-3c1e-4f0b-9d15-8f3a5b0d8e61</code>.<br>
 * Example:
 * <pre>{@code
 * public class OrderId extends Identity<OrderId> {
 *     private OrderId(CharSequence value) {
 *         super(value);
 *     }
 *
 *     public static OrderId of(CharSequence value) {
 *         return new OrderId(value);
 *     }
 *
 *     public static OrderId newId() {
 *         return new OrderId(Identity.newValueFor(OrderId.class));
 *     }
 * }
 * }</pre>
 *
 * @param <SELF> the concrete identity type
 */
public abstract class Identity<SELF extends Identity<SELF>> extends StringValueType<SELF> {
    private static final ConcurrentMap<Class<?>, String> NAMES = new ConcurrentHashMap<>();

    protected Identity(CharSequence value) {
        super(notBlank(value, "You must provide an identity value"));
        var name   = nameOf(getClass());
        var prefix = name + "-";
        if (!value().startsWith(prefix)) {
            throw new IllegalArgumentException(msg("Identity '{}' of type '{}' doesn't start with '{}'", value(), getClass().getSimpleName(), prefix));
        }
        try {
            UUID.fromString(value().substring(prefix.length()));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(msg("Identity '{}' of type '{}' doesn't end with a valid UUID", value(), getClass().getSimpleName()), e);
        }
    }

    /**
     * The name part of the identity value, e.g. <code>thingy</code> for a <code>ThingyId</code>
     */
    public String name() {
        return nameOf(getClass());
    }

    /**
     * Generate a new random identity value for the given identity type
     *
     * @param identityType the concrete identity type
     * @return a new random identity value
     */
    public static String newValueFor(Class<? extends Identity<?>> identityType) {
        return nameOf(identityType) + "-" + UUID.randomUUID();
    }

    /**
     * Generate a deterministic identity value, based on a namespace and a name, for the given identity type.
     * The same namespace and name always result in the same identity value
     *
     * @param identityType the concrete identity type
     * @param namespace    the namespace uuid
     * @param name         the name within the namespace
     * @return the deterministic identity value
     */
    public static String newDeterministicValueFor(Class<? extends Identity<?>> identityType, UUID namespace, String name) {
        notNull(namespace, "You must provide a namespace");
        notNull(name, "You must provide a name");
        var bytes = (namespace + ":" + name).getBytes(StandardCharsets.UTF_8);
        return nameOf(identityType) + "-" + UUID.nameUUIDFromBytes(bytes);
    }

    static String nameOf(Class<?> identityType) {
        return NAMES.computeIfAbsent(identityType, type -> {
            var name = type.getSimpleName();
            if (name.endsWith("Id") && name.length() > 2) {
                name = name.substring(0, name.length() - 2);
            }
            return name.toLowerCase(Locale.ROOT);
        });
    }
}
