package os.db.lock;

import org.slf4j.MDC;

/**
 * Puts the lock id into the SLF4J MDC for the duration of one lock operation.
 *
 * <pre>
 * try (LockLogContext ctx = LockLogContext.forLock(lockId, "acquire")) {
 *     log.info("Lock {} acquired", lockId);
 * }
 * </pre>
 */
final class LockLogContext implements AutoCloseable {

    static final String LOCK_ID = "lockId";
    static final String OPERATION = "operation";

    private LockLogContext() {
    }

    static LockLogContext forLock(long lockId, String operation) {
        MDC.put(LOCK_ID, Long.toString(lockId));
        MDC.put(OPERATION, operation);
        return new LockLogContext();
    }

    @Override
    public void close() {
        MDC.remove(LOCK_ID);
        MDC.remove(OPERATION);
    }
}
