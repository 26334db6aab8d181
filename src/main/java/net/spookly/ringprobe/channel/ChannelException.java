package net.spookly.ringprobe.channel;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Raised when a channel cannot be opened or is not usable for a command.
 */
@Getter
@Accessors(fluent = true)
public class ChannelException extends RuntimeException {
    private final ChannelError error;
    private final String pointId;

    public ChannelException(ChannelError error, String pointId, String message) {
        super(message);
        this.error = error;
        this.pointId = pointId;
    }

    public ChannelException(ChannelError error, String pointId, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
        this.pointId = pointId;
    }
}
