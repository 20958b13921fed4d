package leadflow.workflow.service;

/**
 * Thrown when an operation names a record that does not exist.
 */
public class RecordNotFoundException extends RuntimeException {

    public RecordNotFoundException(String recordId) {
        super("Record not found: " + recordId);
    }
}
