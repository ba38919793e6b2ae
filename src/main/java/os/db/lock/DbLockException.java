package os.db.lock;

public class DbLockException extends RuntimeException {

    public DbLockException(String message) {
        super(message);
    }

    public DbLockException(String message, Throwable cause) {
        super(message, cause);
    }
}
