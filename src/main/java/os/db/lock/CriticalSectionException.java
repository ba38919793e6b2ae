package os.db.lock;

/**
 * Thrown by {@link DbLock#executeUnderLock(long, DbLock.CriticalSection)} when the critical section
 * failed. The lock has already been released when this is thrown; a failed release shows up as a
 * suppressed exception.
 */
public class CriticalSectionException extends DbLockException {

    private final long lockId;

    public CriticalSectionException(long lockId, Exception cause) {
        super(String.format("Critical section for lock %d failed: %s", lockId, cause.getMessage()), cause);
        this.lockId = lockId;
    }

    public long lockId() {
        return lockId;
    }

    public LockOutcome outcome() {
        return LockOutcome.EXECUTION_FAILED;
    }
}
