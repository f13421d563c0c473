package dev.schemaeval.run;

/** The engine could not execute or record a run. Drives the run to FAILED. */
public class RunSystemException extends RuntimeException {
    public RunSystemException(String message) {
        super(message);
    }

    public RunSystemException(String message, Throwable cause) {
        super(message, cause);
    }
}
