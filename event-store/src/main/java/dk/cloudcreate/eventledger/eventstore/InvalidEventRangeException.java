package dk.cloudcreate.eventledger.eventstore;

/**
 * Thrown when an event range or page size is invalid, e.g. a <code>fromSequenceNumber</code> less than 1,
 * a <code>toSequenceNumber</code> that isn't greater than the <code>fromSequenceNumber</code> or a non positive page size
 */
public class InvalidEventRangeException extends IllegalArgumentException {
    public InvalidEventRangeException(String message) {
        super(message);
    }
}
