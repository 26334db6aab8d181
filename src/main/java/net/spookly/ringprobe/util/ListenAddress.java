package net.spookly.ringprobe.util;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

import java.net.InetSocketAddress;

/**
 * Host and port the HTTP boundary binds to, parsed from {@code host:port} or a bare {@code :port}.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ListenAddress {
    private static final String ANY_HOST = "0.0.0.0";

    private final String host;
    private final int port;

    public static ListenAddress parse(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            throw new IllegalArgumentException("listen address is required");
        }
        String value = raw.trim();
        int lastColon = value.lastIndexOf(':');
        if (lastColon < 0 || lastColon == value.length() - 1) {
            throw new IllegalArgumentException("listen address must be host:port: " + raw);
        }
        String host = value.substring(0, lastColon).trim();
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        if (host.isEmpty()) {
            host = ANY_HOST;
        }
        String portRaw = value.substring(lastColon + 1).trim();
        int port;
        try {
            port = Integer.parseInt(portRaw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("listen port must be numeric: " + portRaw, e);
        }
        // Port 0 asks the OS for an ephemeral port.
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("listen port must be between 0 and 65535: " + port);
        }
        return new ListenAddress(host, port);
    }

    public InetSocketAddress toSocketAddress() {
        return new InetSocketAddress(host, port);
    }

    @Override
    public String toString() {
        return host + ":" + port;
    }
}
