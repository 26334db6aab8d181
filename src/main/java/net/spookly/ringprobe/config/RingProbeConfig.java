package net.spookly.ringprobe.config;

public class RingProbeConfig {
    public ServerConfig server;
    public DirectoryConfig directory;
    public SshConfig ssh;
    public ProbeConfig probe;
    public ReconcileConfig reconcile;
    public CacheConfig cache;
    public LoggingConfig logging;

    public static class ServerConfig {
        public String listen;
        public Integer threads;
    }

    public static class DirectoryConfig {
        public String nodesUrl;
        public String participantsUrl;
        public Integer timeoutSeconds;
        /**
         * Only keep nodes the directory reports alive on both IPv4 and IPv6.
         */
        public Boolean requireDualStack;
    }

    public static class SshConfig {
        public String username;
        public String keyPath;
        /**
         * OpenSSH ControlPath template; %r, %h and %p expand to user, host and port.
         */
        public String controlPath;
        public Integer connectTimeoutSeconds;
        public Integer commandTimeoutSeconds;
        public Integer maxConcurrentOpens;
        public Integer failureThreshold;
        public Integer cooldownSeconds;
    }

    public static class ProbeConfig {
        public Integer count;
        public Integer waitSeconds;
        public Integer workers;
    }

    public static class ReconcileConfig {
        public Integer intervalSeconds;
        public Integer workers;
    }

    public static class CacheConfig {
        public String path;
    }

    public static class LoggingConfig {
        public String level;
    }
}
