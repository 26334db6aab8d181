package net.spookly.ringprobe.channel;

import java.nio.file.Path;
import java.time.Duration;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;
import net.spookly.ringprobe.config.ConfigDefaults;
import net.spookly.ringprobe.config.RingProbeConfig;

/**
 * SSH channel tuning, resolved from the {@code ssh} config section.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public final class ChannelSettings {
    private final String username;
    private final Path keyPath;
    private final String controlPathTemplate;
    private final Duration connectTimeout;
    private final Duration commandTimeout;
    private final int maxConcurrentOpens;
    private final int failureThreshold;
    private final Duration cooldown;

    /**
     * Build settings from config, filling gaps with built-in defaults.
     */
    public static ChannelSettings fromConfig(RingProbeConfig config) {
        RingProbeConfig.SshConfig ssh = config.ssh;
        if (ssh == null) {
            throw new IllegalArgumentException("ssh config is required");
        }
        String username = ssh.username == null || ssh.username.isBlank() ? "rise" : ssh.username.trim();
        String controlPath = ssh.controlPath == null || ssh.controlPath.isBlank()
                ? ConfigDefaults.DEFAULT_CONTROL_PATH
                : ssh.controlPath.trim();
        int connectSeconds = ssh.connectTimeoutSeconds != null ? ssh.connectTimeoutSeconds : 5;
        int commandSeconds = ssh.commandTimeoutSeconds != null ? ssh.commandTimeoutSeconds : 15;
        int maxOpens = ssh.maxConcurrentOpens != null ? ssh.maxConcurrentOpens : 50;
        int threshold = ssh.failureThreshold != null ? ssh.failureThreshold : 3;
        int cooldownSeconds = ssh.cooldownSeconds != null ? ssh.cooldownSeconds : 120;
        return new ChannelSettings(
                username,
                ssh.keyPath == null ? null : Path.of(ssh.keyPath),
                controlPath,
                Duration.ofSeconds(connectSeconds),
                Duration.ofSeconds(commandSeconds),
                maxOpens,
                threshold,
                Duration.ofSeconds(cooldownSeconds)
        );
    }
}
