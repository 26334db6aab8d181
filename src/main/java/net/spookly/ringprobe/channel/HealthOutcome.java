package net.spookly.ringprobe.channel;

/**
 * Result of one health check against an existing channel.
 */
public enum HealthOutcome {
    /**
     * The remote command succeeded; the failure counter was reset.
     */
    HEALTHY,
    /**
     * The check failed but the channel is still below the demotion threshold.
     */
    FAILED,
    /**
     * The check failed and pushed the channel to unhealthy; teardown is scheduled.
     */
    DEMOTED,
    /**
     * No healthy channel existed to check.
     */
    UNAVAILABLE
}
