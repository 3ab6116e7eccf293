package dk.cloudcreate.eventledger.eventstore.events;

import java.lang.annotation.*;

/**
 * Declares the stable name and the version of an event payload type.<br>
 * Without the annotation the name and version are derived from the class name: an optional <code>V{n}</code>
 * suffix is the version (default 1) and the rest of the simple class name is the name, e.g. <code>ThingyPingEventV2</code>
 * has name <code>ThingyPingEvent</code> and version 2.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
@Documented
public @interface EventVersion {
    /**
     * The event name. An empty name means the name is derived from the class name
     */
    String name() default "";

    int version() default 1;
}
