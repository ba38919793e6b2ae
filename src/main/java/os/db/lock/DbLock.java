package os.db.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Cluster wide mutual exclusion through the advisory locks of a shared database.
 *
 * <p>A {@code DbLock} owns one session for its whole life. Every lock it grants is scoped to that session,
 * so the database releases them all when the session ends, including on a crash of this process.</p>
 *
 * <pre>
 * try (DbLock dbLock = new DbLock("Host=db;Database=app;Username=app;Password=secret")) {
 *     LockOutcome outcome = dbLock.executeUnderLock(42L, () -&gt; rebuildIndex());
 * }
 * </pre>
 *
 * <p>Not thread safe. Requests go out one after another on the single session, so concurrent callers
 * either use one {@code DbLock} each or serialize their calls.</p>
 */
public class DbLock implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DbLock.class);

    private final Session session;
    private final LockRepository lockRepository;
    // lock id -> grants held by this session; advisory locks stack on the same session
    private final Map<Long, Integer> heldLocks = new HashMap<>();

    public DbLock(String connectionString) {
        this(ConnectionTarget.parse(connectionString));
    }

    public DbLock(ConnectionTarget target) {
        this(target, target.dialect());
    }

    /**
     * @param dialect the advisory lock dialect, or null to detect it from the database
     */
    public DbLock(ConnectionTarget target, Dialect dialect) {
        this(Session.open(target), dialect);
    }

    /**
     * Borrows one connection from the data source and keeps it until {@link #close()}.
     */
    public DbLock(DataSource dataSource) {
        this(dataSource, null);
    }

    public DbLock(DataSource dataSource, Dialect dialect) {
        this(Session.open(dataSource, ConnectionTarget.DEFAULT_VALIDATION_TIMEOUT_SECONDS), dialect);
    }

    private DbLock(Session session, Dialect dialect) {
        this(session, new LockRepository(session, resolveDialect(session, dialect), new QueryRunner()));
    }

    DbLock(Session session, LockRepository lockRepository) {
        this.session = session;
        this.lockRepository = lockRepository;
    }

    /**
     * Asks the database for the lock without waiting.
     *
     * @return true if the lock was granted to this session, false if another session holds it
     * @throws SessionException if the request itself failed; a {@link ConnectionException} if the session is gone
     */
    public boolean tryAcquire(long lockId) {
        try (LockLogContext ctx = LockLogContext.forLock(lockId, "acquire")) {
            log.info("Trying to acquire session lock {}", lockId);

            boolean acquired;
            try {
                acquired = lockRepository.tryLock(lockId);
            } catch (ConnectionException e) {
                forgetAll();
                throw e;
            }

            if (acquired) {
                heldLocks.merge(lockId, 1, Integer::sum);
                log.info("Lock {} acquired", lockId);
            } else {
                log.info("Lock {} rejected", lockId);
            }
            return acquired;
        }
    }

    /**
     * Runs the critical section if, and only if, the lock can be acquired right away. The lock is released
     * before this method returns or throws, whatever the critical section did.
     *
     * <p>When both the critical section and the release fail, the {@link CriticalSectionException} is thrown
     * and the release failure is attached to it as suppressed exception. A release failure after a successful
     * critical section is thrown as {@link ReleaseAfterSuccessException}. If that release failed because the
     * connection was lost, the {@link ConnectionException} is its cause and
     * {@link ReleaseAfterSuccessException#sessionLost()} is true; the {@code DbLock} is then unusable.</p>
     *
     * @return {@link LockOutcome#NOT_ACQUIRED} or {@link LockOutcome#EXECUTED}
     * @throws CriticalSectionException wrapping whatever exception the critical section threw
     * @throws ReleaseAfterSuccessException if the critical section completed but the release failed
     */
    public LockOutcome executeUnderLock(long lockId, CriticalSection section) {
        Objects.requireNonNull(section, "section");

        if (!tryAcquire(lockId)) {
            return LockOutcome.NOT_ACQUIRED;
        }

        try (LockLogContext ctx = LockLogContext.forLock(lockId, "execute")) {
            section.run();
        } catch (InterruptedException e) {
            CriticalSectionException failure = releaseAfterFailure(lockId, new CriticalSectionException(lockId, e));
            Thread.currentThread().interrupt();
            throw failure;
        } catch (Exception e) {
            throw releaseAfterFailure(lockId, new CriticalSectionException(lockId, e));
        } catch (Error e) {
            throw releaseAfterFailure(lockId, e);
        }

        try {
            release(lockId);
        } catch (SessionException e) {
            throw new ReleaseAfterSuccessException(lockId, e);
        }
        return LockOutcome.EXECUTED;
    }

    /**
     * Gives back one grant of the lock.
     *
     * @return false if the database reports that this session did not hold the lock
     * @throws SessionException if the request itself failed; a {@link ConnectionException} if the session is gone
     */
    public boolean release(long lockId) {
        try (LockLogContext ctx = LockLogContext.forLock(lockId, "release")) {
            log.info("Releasing session lock {}", lockId);

            boolean released;
            try {
                released = lockRepository.unlock(lockId);
            } catch (ConnectionException e) {
                forgetAll();
                throw e;
            }

            if (released) {
                heldLocks.computeIfPresent(lockId, (id, grants) -> grants > 1 ? grants - 1 : null);
            } else {
                heldLocks.remove(lockId);
                log.warn("Lock {} was not held by this session", lockId);
            }
            return released;
        }
    }

    /**
     * @return the ids this session believes it holds; empty once the session was lost
     */
    public Set<Long> heldLocks() {
        return Set.copyOf(heldLocks.keySet());
    }

    public boolean isOpen() {
        return session.isUsable();
    }

    public Dialect dialect() {
        return lockRepository.dialect();
    }

    /**
     * Ends the session, which releases every lock still held. Calling it again does nothing.
     */
    @Override
    public void close() {
        if (session.isClosed()) {
            return;
        }

        SessionException releaseFailure = null;
        if (!heldLocks.isEmpty() && session.isUsable()) {
            log.info("Closing session while holding locks {}", heldLocks.keySet());
            try {
                lockRepository.unlockAll();
            } catch (SessionException e) {
                releaseFailure = e;
            }
        }
        forgetAll();

        try {
            session.close();
        } catch (ConnectionException e) {
            if (releaseFailure != null) {
                e.addSuppressed(releaseFailure);
            }
            throw e;
        }

        if (releaseFailure != null) {
            throw releaseFailure;
        }
    }

    private <T extends Throwable> T releaseAfterFailure(long lockId, T failure) {
        try {
            release(lockId);
        } catch (RuntimeException e) {
            failure.addSuppressed(e);
        }
        return failure;
    }

    private void forgetAll() {
        heldLocks.clear();
    }

    private static Dialect resolveDialect(Session session, Dialect dialect) {
        if (dialect != null) {
            return dialect;
        }

        try {
            String product = session.execute(connection -> connection.getMetaData().getDatabaseProductName());
            Dialect detected = Dialect.detect(product);
            if (detected == null) {
                throw new ConnectionException(String.format("%s has no supported advisory locks, pass a Dialect explicitly", product));
            }
            return detected;
        } catch (SessionException e) {
            try {
                session.close();
            } catch (ConnectionException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
    }

    @FunctionalInterface
    public interface CriticalSection {
        void run() throws Exception;
    }
}
