package net.spookly.ringprobe.directory;

/**
 * The directory service could not be read this time.
 */
public class DirectorySyncException extends Exception {
    public DirectorySyncException(String message) {
        super(message);
    }

    public DirectorySyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
