package dk.cloudcreate.eventledger.eventstore.aggregates;

import java.lang.annotation.*;

/**
 * Overrides the name of an aggregate type. Without the annotation the simple class name is used, see {@link AggregateNames}
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
@Documented
public @interface AggregateName {
    String value();
}
