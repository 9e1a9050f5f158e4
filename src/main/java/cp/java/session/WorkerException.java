package cp.java.session;

/**
 * A worker thread ended with an error. Further failures from other workers
 * are attached as suppressed exceptions.
 */
public class WorkerException extends Exception {

    private static final long serialVersionUID = 1L;

    public WorkerException(String message, Throwable cause) {
        super(message, cause);
    }
}
