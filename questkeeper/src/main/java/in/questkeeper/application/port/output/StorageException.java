package in.questkeeper.application.port.output;

/**
 * Raised by repositories when the backing store fails or a version check loses.
 */
public class StorageException extends RuntimeException {

    private final boolean conflict;

    public StorageException(String message, Throwable cause) {
        super(message, cause);
        this.conflict = false;
    }

    private StorageException(String message, boolean conflict) {
        super(message);
        this.conflict = conflict;
    }

    /**
     * Stored version no longer matches the one the change was computed from.
     */
    public static StorageException conflict(String id, int expectedVersion) {
        return new StorageException("Version conflict on " + id + " (expected version " + expectedVersion + ")", true);
    }

    public boolean isConflict() {
        return conflict;
    }
}
