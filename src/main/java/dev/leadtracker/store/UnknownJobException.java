package dev.leadtracker.store;

/**
 * A job id that does not exist in the store was used for a mutation.
 */
public class UnknownJobException extends IllegalStateException {

    public UnknownJobException(String jobId) {
        super("No job with id " + jobId);
    }
}
