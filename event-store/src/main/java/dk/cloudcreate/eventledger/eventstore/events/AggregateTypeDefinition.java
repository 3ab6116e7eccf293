package dk.cloudcreate.eventledger.eventstore.events;

import dk.cloudcreate.eventledger.common.types.Identity;
import dk.cloudcreate.eventledger.eventstore.aggregates.*;

import java.util.function.Function;

import static org.apache.commons.lang3.Validate.notNull;

/**
 * Maps an aggregate type to its name and to the factory that recreates its identity from a persisted identity value
 *
 * @param <A>  the aggregate type
 * @param <ID> the aggregate identity type
 */
public final class AggregateTypeDefinition<A extends Aggregate<A, ID>, ID extends Identity<ID>> {
    private final Class<A>              aggregateType;
    private final String                name;
    private final Function<String, ID>  identityFactory;

    public AggregateTypeDefinition(Class<A> aggregateType, Function<String, ID> identityFactory) {
        this.aggregateType = notNull(aggregateType, "You must provide an aggregateType");
        this.identityFactory = notNull(identityFactory, "You must provide an identityFactory");
        this.name = AggregateNames.nameOf(aggregateType);
    }

    public Class<A> aggregateType() {
        return aggregateType;
    }

    public String name() {
        return name;
    }

    public ID identityOf(String identityValue) {
        return identityFactory.apply(identityValue);
    }

    @Override
    public String toString() {
        return "AggregateTypeDefinition{" +
                "aggregateType=" + aggregateType.getName() +
                ", name='" + name + '\'' +
                '}';
    }
}
