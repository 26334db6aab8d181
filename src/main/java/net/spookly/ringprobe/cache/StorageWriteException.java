package net.spookly.ringprobe.cache;

/**
 * Raised when a registry snapshot could not be persisted.
 */
public class StorageWriteException extends RuntimeException {
    public StorageWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
