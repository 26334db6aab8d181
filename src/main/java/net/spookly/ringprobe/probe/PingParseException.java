package net.spookly.ringprobe.probe;

/**
 * Raised when ping output does not have the expected summary lines.
 */
public class PingParseException extends Exception {
    public PingParseException(String message) {
        super(message);
    }
}
