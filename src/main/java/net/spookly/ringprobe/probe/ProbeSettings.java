package net.spookly.ringprobe.probe;

import java.time.Duration;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;
import net.spookly.ringprobe.config.RingProbeConfig;

/**
 * Ping parameters and probe pool size, resolved from the {@code probe} config section.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public final class ProbeSettings {
    private final int count;
    private final int waitSeconds;
    private final int workers;
    private final Duration perPointTimeout;

    public static ProbeSettings fromConfig(RingProbeConfig config) {
        int count = 10;
        int waitSeconds = 5;
        int workers = 100;
        if (config.probe != null) {
            if (config.probe.count != null) {
                count = config.probe.count;
            }
            if (config.probe.waitSeconds != null) {
                waitSeconds = config.probe.waitSeconds;
            }
            if (config.probe.workers != null) {
                workers = config.probe.workers;
            }
        }
        int timeoutSeconds = 15;
        if (config.ssh != null && config.ssh.commandTimeoutSeconds != null) {
            timeoutSeconds = config.ssh.commandTimeoutSeconds;
        }
        return new ProbeSettings(count, waitSeconds, workers, Duration.ofSeconds(timeoutSeconds));
    }

    /**
     * Remote command line for probing {@code target}.
     *
     * @throws IllegalArgumentException when the target is not a plain host name or IP literal
     */
    public String pingCommand(String target) {
        TargetValidator.checkShellSafe(target);
        return "ping -c" + count + " -W" + waitSeconds + " " + target;
    }
}
