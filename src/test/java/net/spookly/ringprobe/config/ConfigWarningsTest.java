package net.spookly.ringprobe.config;

import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigWarningsTest {
    @Test
    void warnsOnGroupReadableKey(@TempDir Path tempDir) throws Exception {
        Path keyFile = tempDir.resolve("ring_key");
        Files.writeString(keyFile, "dummy");
        PosixFileAttributeView view = Files.getFileAttributeView(keyFile, PosixFileAttributeView.class);
        Assumptions.assumeTrue(view != null, "POSIX permissions not supported");
        Set<PosixFilePermission> perms = EnumSet.of(
                PosixFilePermission.OWNER_READ,
                PosixFilePermission.OWNER_WRITE,
                PosixFilePermission.GROUP_READ
        );
        Files.setPosixFilePermissions(keyFile, perms);

        RingProbeConfig config = new RingProbeConfig();
        config.ssh = new RingProbeConfig.SshConfig();
        config.ssh.keyPath = keyFile.toString();

        List<String> warnings = ConfigWarnings.collect(config);
        assertTrue(warnings.stream().anyMatch(message -> message.contains("ssh.keyPath")));
    }

    @Test
    void warnsWhenCooldownOutlastsInterval() {
        RingProbeConfig config = new RingProbeConfig();
        config.ssh = new RingProbeConfig.SshConfig();
        config.ssh.cooldownSeconds = 600;
        config.reconcile = new RingProbeConfig.ReconcileConfig();
        config.reconcile.intervalSeconds = 20;

        List<String> warnings = ConfigWarnings.collect(config);

        assertTrue(warnings.stream().anyMatch(message -> message.contains("reconcile.intervalSeconds below 30")));
        assertTrue(warnings.stream().anyMatch(message -> message.contains("ssh.cooldownSeconds exceeds")));
    }
}
