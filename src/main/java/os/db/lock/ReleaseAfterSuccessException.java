package os.db.lock;

public class ReleaseAfterSuccessException extends SessionException {

    private final long lockId;

    public ReleaseAfterSuccessException(long lockId, SessionException cause) {
        super(String.format("Releasing lock %d after the critical section completed failed", lockId), cause);
        this.lockId = lockId;
    }

    public long lockId() {
        return lockId;
    }

    /**
     * @return true if the release failed because the session connection was lost
     */
    public boolean sessionLost() {
        return getCause() instanceof ConnectionException;
    }
}
