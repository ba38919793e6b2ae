package os.db.lock;

/**
 * An advisory lock request failed at the protocol or transport level. Not retried.
 */
public class SessionException extends DbLockException {

    public SessionException(String message) {
        super(message);
    }

    public SessionException(String message, Throwable cause) {
        super(message, cause);
    }
}
