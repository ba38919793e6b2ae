package os.db.lock;

public enum LockOutcome {

    /** Another session holds the lock; the critical section did not run. */
    NOT_ACQUIRED,
    EXECUTED,
    /** Only ever seen through {@link CriticalSectionException#outcome()}. */
    EXECUTION_FAILED;

    public boolean acquired() {
        return this != NOT_ACQUIRED;
    }
}
