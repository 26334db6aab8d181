package net.spookly.ringprobe.probe;

/**
 * Why a probe from one vantage point failed.
 */
public enum ProbeError {
    /**
     * The probe command did not finish within its bound.
     */
    TIMEOUT,
    /**
     * No healthy channel to the point, or ssh itself failed (exit 255).
     */
    CHANNEL_UNAVAILABLE,
    /**
     * The probe command exited nonzero, including ping receiving no replies.
     */
    NONZERO_EXIT,
    /**
     * The command succeeded but its output could not be read.
     */
    UNPARSEABLE_OUTPUT
}
