package in.optiontick.repository;

import java.sql.SQLException;

/**
 * Exception thrown when the tick store rejects a read or write.
 */
public class TickStorageException extends RuntimeException {

    private static final int SQLITE_BUSY = 5;
    private static final int SQLITE_LOCKED = 6;

    private final String operation;
    private final int rows;

    public TickStorageException(String operation, int rows, String message) {
        super(String.format("[STORE:%s] %s (rows=%d)", operation, message, rows));
        this.operation = operation;
        this.rows = rows;
    }

    public TickStorageException(String operation, int rows, String message, Throwable cause) {
        super(String.format("[STORE:%s] %s (rows=%d)", operation, message, rows), cause);
        this.operation = operation;
        this.rows = rows;
    }

    public String getOperation() {
        return operation;
    }

    public int getRows() {
        return rows;
    }

    /**
     * True when the store was busy or locked by another connection.
     */
    public boolean isContention() {
        for (Throwable t = getCause(); t != null; t = t.getCause()) {
            if (t instanceof SQLException) {
                SQLException e = (SQLException) t;
                int primary = e.getErrorCode() & 0xff;
                if (primary == SQLITE_BUSY || primary == SQLITE_LOCKED) {
                    return true;
                }
                // batch failures keep the driver's result code only in the message
                String message = e.getMessage();
                if (message != null && (message.contains("[SQLITE_BUSY") || message.contains("[SQLITE_LOCKED"))) {
                    return true;
                }
            }
        }
        return false;
    }
}
