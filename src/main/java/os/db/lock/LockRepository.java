package os.db.lock;

class LockRepository {

    private final Session session;
    private final Dialect dialect;
    private final QueryRunner queryRunner;

    LockRepository(Session session, Dialect dialect, QueryRunner queryRunner) {
        this.session = session;
        this.dialect = dialect;
        this.queryRunner = queryRunner;
    }

    boolean tryLock(long lockId) {
        Boolean granted = session.execute(connection ->
                queryRunner.selectOne(connection, dialect.tryLockSql(), dialect::granted, dialect.lockKey(lockId)));
        return Boolean.TRUE.equals(granted);
    }

    boolean unlock(long lockId) {
        Boolean released = session.execute(connection ->
                queryRunner.selectOne(connection, dialect.unlockSql(), dialect::released, dialect.lockKey(lockId)));
        return Boolean.TRUE.equals(released);
    }

    void unlockAll() {
        session.execute(connection -> {
            queryRunner.execute(connection, dialect.unlockAllSql());
            return null;
        });
    }

    Dialect dialect() {
        return dialect;
    }
}
