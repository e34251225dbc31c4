package app.sage.core.sync.client;

/**
 * Transient failure of the remote scheduler: transport error, HTTP error or an unsuccessful response.
 */
public class RemoteSchedulerException extends RuntimeException {

    public RemoteSchedulerException(String message) {
        super(message);
    }

    public RemoteSchedulerException(String message, Throwable cause) {
        super(message, cause);
    }
}
