package dk.cloudcreate.eventledger.eventstore.metadata;

import dk.cloudcreate.eventledger.common.types.Identity;
import dk.cloudcreate.eventledger.eventstore.aggregates.AggregateEvent;
import org.slf4j.*;

import java.net.*;
import java.util.*;

import static org.apache.commons.lang3.Validate.notNull;

/**
 * Adds the name of the machine that stored the event under {@link MetadataKeys#MACHINE_NAME}
 */
public final class AddMachineNameMetadataProvider implements MetadataProvider {
    private static final Logger log = LoggerFactory.getLogger(AddMachineNameMetadataProvider.class);

    private final String machineName;

    public AddMachineNameMetadataProvider() {
        this(resolveMachineName());
    }

    public AddMachineNameMetadataProvider(String machineName) {
        this.machineName = notNull(machineName, "You must provide a machineName");
    }

    @Override
    public Map<String, String> provideMetadata(Class<?> aggregateType, Identity<?> id, AggregateEvent<?, ?> aggregateEvent, Metadata existingMetadata) {
        return Map.of(MetadataKeys.MACHINE_NAME, machineName);
    }

    private static String resolveMachineName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.debug("Failed to resolve the local host name, falling back to the HOSTNAME environment variable", e);
            return Optional.ofNullable(System.getenv("HOSTNAME")).orElse("unknown");
        }
    }
}
