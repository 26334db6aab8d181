package net.spookly.ringprobe.probe;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.regex.Pattern;

/**
 * Accepts host names and IP literals that are safe to pass to a remote shell and that resolve.
 */
public final class TargetValidator {
    private static final Pattern ALLOWED = Pattern.compile("[A-Za-z0-9.:-]+");
    private static final int MAX_LENGTH = 253;

    /**
     * Name resolution hook.
     */
    @FunctionalInterface
    public interface Resolver {
        void resolve(String host) throws UnknownHostException;
    }

    private final Resolver resolver;

    public TargetValidator() {
        this(InetAddress::getAllByName);
    }

    public TargetValidator(Resolver resolver) {
        this.resolver = resolver;
    }

    /**
     * @return the trimmed target
     * @throws IllegalArgumentException when the target is missing, malformed or does not resolve
     */
    public String validate(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            throw new IllegalArgumentException("target is required");
        }
        String target = raw.trim();
        checkShellSafe(target);
        try {
            resolver.resolve(target);
        } catch (UnknownHostException e) {
            throw new IllegalArgumentException("target does not resolve: " + target);
        }
        return target;
    }

    /**
     * Reject targets that could not be passed verbatim as a single argument to a remote shell.
     *
     * @throws IllegalArgumentException when the target is empty, too long, starts with {@code -} or
     *                                  contains characters outside host names and IP literals
     */
    public static void checkShellSafe(String target) {
        if (target == null || target.isEmpty() || target.length() > MAX_LENGTH
                || !ALLOWED.matcher(target).matches() || target.startsWith("-")) {
            throw new IllegalArgumentException("invalid target: " + target);
        }
    }
}
