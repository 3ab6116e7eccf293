package dk.cloudcreate.eventledger.sagas;

public enum SagaState {
    /**
     * The saga hasn't been started
     */
    NEW,
    RUNNING,
    COMPLETED
}
