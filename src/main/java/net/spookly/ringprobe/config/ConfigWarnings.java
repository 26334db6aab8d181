package net.spookly.ringprobe.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Collects non-fatal configuration warnings (for example, an SSH key that ssh will refuse to use).
 */
public final class ConfigWarnings {
    private static final Set<PosixFilePermission> LOOSE_KEY_PERMISSIONS = EnumSet.of(
            PosixFilePermission.GROUP_READ,
            PosixFilePermission.GROUP_WRITE,
            PosixFilePermission.GROUP_EXECUTE,
            PosixFilePermission.OTHERS_READ,
            PosixFilePermission.OTHERS_WRITE,
            PosixFilePermission.OTHERS_EXECUTE
    );

    private ConfigWarnings() {
    }

    public static List<String> collect(RingProbeConfig config) {
        List<String> warnings = new ArrayList<>();
        if (config == null) {
            return warnings;
        }
        if (config.ssh != null) {
            warnIfLoosePermissions(warnings, "ssh.keyPath", config.ssh.keyPath);
        }
        if (config.reconcile != null && config.reconcile.intervalSeconds != null
                && config.reconcile.intervalSeconds < 30) {
            warnings.add("reconcile.intervalSeconds below 30 re-checks every channel very often: "
                    + config.reconcile.intervalSeconds);
        }
        if (config.ssh != null && config.ssh.cooldownSeconds != null && config.reconcile != null
                && config.reconcile.intervalSeconds != null
                && config.ssh.cooldownSeconds > config.reconcile.intervalSeconds) {
            warnings.add("ssh.cooldownSeconds exceeds reconcile.intervalSeconds, demoted channels skip whole cycles");
        }
        return warnings;
    }

    private static void warnIfLoosePermissions(List<String> warnings, String label, String value) {
        if (value == null || value.trim().isEmpty()) {
            return;
        }
        Path resolved;
        try {
            resolved = Paths.get(value.trim());
        } catch (InvalidPathException e) {
            return;
        }
        if (!Files.isRegularFile(resolved)) {
            return;
        }
        PosixFileAttributeView view = Files.getFileAttributeView(resolved, PosixFileAttributeView.class);
        if (view == null) {
            return;
        }
        try {
            Set<PosixFilePermission> permissions = view.readAttributes().permissions();
            for (PosixFilePermission permission : permissions) {
                if (LOOSE_KEY_PERMISSIONS.contains(permission)) {
                    warnings.add(label + " is accessible by group or others, ssh may refuse it: " + resolved);
                    return;
                }
            }
        } catch (IOException ignored) {
            // Permission read failures are not worth a warning.
        }
    }
}
