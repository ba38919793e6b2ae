package os.db.lock;

/**
 * The session could not be opened or is no longer usable. Every further lock operation
 * on the same {@link DbLock} fails; a new one has to be created.
 */
public class ConnectionException extends SessionException {

    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
