package dk.cloudcreate.eventledger.common;

import org.slf4j.helpers.MessageFormatter;

/**
 * Formats messages using the same <code>{}</code> placeholder syntax as the SLF4J log statements, so exception
 * messages and log messages in this project read the same way.<br>
 * Example:
 * <pre>{@code
 * throw new EventStoreException(msg("Failed to append {} events to aggregate '{}'", events.size(), aggregateId));
 * }</pre>
 */
public final class Messages {
    private Messages() {
    }

    /**
     * Replace each <code>{}</code> placeholder in the <code>message</code> with the matching argument
     *
     * @param message   the message containing zero or more <code>{}</code> placeholders
     * @param arguments the arguments, in placeholder order
     * @return the formatted message
     */
    public static String msg(String message, Object... arguments) {
        if (message == null) {
            return null;
        }
        return MessageFormatter.arrayFormat(message, arguments, null).getMessage();
    }
}
