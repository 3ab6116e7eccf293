package dk.cloudcreate.eventledger.aggregates;

import dk.cloudcreate.eventledger.common.types.Identity;
import dk.cloudcreate.eventledger.eventstore.aggregates.*;
import org.objenesis.*;
import org.objenesis.instantiator.ObjectInstantiator;

import java.util.concurrent.*;

import static dk.cloudcreate.eventledger.common.Messages.msg;
import static org.apache.commons.lang3.Validate.notNull;

/**
 * {@link AggregateFactory} that uses {@link Objenesis} to create aggregate instances without calling any constructor.<br>
 * <b>Objenesis doesn't initialize fields nor call any constructors</b>, so only {@link AggregateRoot} subclasses that don't
 * depend on field initializers or constructor logic are supported. The aggregate identity is assigned after instantiation.
 */
public final class ObjenesisAggregateFactory implements AggregateFactory {
    private final Objenesis                                      objenesis       = new ObjenesisStd();
    private final ConcurrentMap<Class<?>, ObjectInstantiator<?>> instantiatorMap = new ConcurrentHashMap<>();

    @SuppressWarnings({"unchecked", "rawtypes"})
    @Override
    public <A extends Aggregate<A, ID>, ID extends Identity<ID>> A createNewAggregate(Class<A> aggregateType, ID id) {
        notNull(aggregateType, "You must provide an aggregateType");
        notNull(id, "You must provide an id");
        if (!AggregateRoot.class.isAssignableFrom(aggregateType)) {
            throw new AggregateException(msg("Aggregate type '{}' must extend '{}' to be created by Objenesis",
                                             aggregateType.getName(), AggregateRoot.class.getSimpleName()));
        }
        var aggregate = (A) instantiatorMap.computeIfAbsent(aggregateType, objenesis::getInstantiatorOf)
                                           .newInstance();
        ((AggregateRoot) aggregate).initializeIdentity(id);
        return aggregate;
    }
}
