package com.malwa.record_store.store.exception;

/**
 * Thrown when the store could not be brought to the requested schema version.
 * The stored version is left at the last version that was fully applied.
 */
public class MigrationFailureException extends StoreException {

    private final int storedVersion;
    private final int targetVersion;

    public MigrationFailureException(String collection, int storedVersion, int targetVersion,
                                     String message, Throwable cause) {
        super(ErrorKind.MIGRATION_FAILURE, collection, null,
            String.format("Migration from version %d to %d failed: %s", storedVersion, targetVersion, message),
            cause);
        this.storedVersion = storedVersion;
        this.targetVersion = targetVersion;
    }

    public int getStoredVersion() {
        return storedVersion;
    }

    public int getTargetVersion() {
        return targetVersion;
    }
}
