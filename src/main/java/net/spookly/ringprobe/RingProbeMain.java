package net.spookly.ringprobe;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.CountDownLatch;

import ch.qos.logback.classic.Level;
import net.spookly.ringprobe.cache.CacheStore;
import net.spookly.ringprobe.channel.ChannelManager;
import net.spookly.ringprobe.channel.ChannelSettings;
import net.spookly.ringprobe.channel.ProcessCommandRunner;
import net.spookly.ringprobe.config.ConfigException;
import net.spookly.ringprobe.config.ConfigLoader;
import net.spookly.ringprobe.config.ConfigPrinter;
import net.spookly.ringprobe.config.ConfigWarnings;
import net.spookly.ringprobe.config.RingProbeConfig;
import net.spookly.ringprobe.directory.ContinentLookup;
import net.spookly.ringprobe.directory.RingApiDirectory;
import net.spookly.ringprobe.http.ProbeServer;
import net.spookly.ringprobe.node.NodeRegistry;
import net.spookly.ringprobe.node.RegistryAuditLogger;
import net.spookly.ringprobe.probe.ProbeExecutor;
import net.spookly.ringprobe.probe.ProbeService;
import net.spookly.ringprobe.probe.ProbeSettings;
import net.spookly.ringprobe.reconcile.Reconciler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Standalone entry point for the ringprobe process.
 */
public final class RingProbeMain {
    private static final Logger log = LoggerFactory.getLogger(RingProbeMain.class);

    private static final String DEFAULT_CONFIG = "config/ringprobe.yaml";

    private RingProbeMain() {
    }

    /**
     * Load config, restore state, start the reconciler and the HTTP boundary.
     */
    public static void main(String[] args) {
        CliOptions options = parseArgs(args);
        Path configPath = options.configPath;
        RingProbeConfig config;
        try {
            config = ConfigLoader.load(configPath);
        } catch (ConfigException e) {
            log.error("{}", e.getMessage(), e.getCause());
            System.exit(2);
            return;
        }
        applyLogLevel(config);
        emitWarnings(config);
        if (options.printEffectiveConfig) {
            System.out.println(ConfigPrinter.toYaml(config));
            return;
        }
        if (options.dryRun) {
            System.out.println("Config OK (--dry-run).");
            return;
        }
        log.info("ringprobe config loaded: user={} key={} cache={}",
                config.ssh.username, config.ssh.keyPath, config.cache.path);

        NodeRegistry registry = new NodeRegistry(RegistryAuditLogger.INSTANCE);
        ChannelManager channels = new ChannelManager(ChannelSettings.fromConfig(config), new ProcessCommandRunner(), registry);
        ProbeExecutor executor = new ProbeExecutor(channels, ProbeSettings.fromConfig(config));
        ProbeService service = new ProbeService(registry, channels, executor);
        CacheStore cacheStore = new CacheStore(Paths.get(config.cache.path));
        Reconciler reconciler = Reconciler.fromConfig(
                config,
                RingApiDirectory.fromConfig(config),
                ContinentLookup.fromClasspath(),
                registry,
                channels,
                cacheStore
        );
        ProbeServer server = ProbeServer.fromConfig(config, service, reconciler::lastCycle);
        server.start();
        reconciler.start();

        CountDownLatch latch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down, closing {} channels", channels.size());
            reconciler.stop();
            server.stop();
            executor.close();
            channels.close();
            latch.countDown();
        }, "ringprobe-shutdown"));

        try {
            latch.await();
        } catch (InterruptedException ignored) {
            Thread.currentThread().interrupt();
        }
    }

    private static CliOptions parseArgs(String[] args) {
        Path configPath = Paths.get(DEFAULT_CONFIG);
        boolean dryRun = false;
        boolean printEffectiveConfig = false;
        if (args == null) {
            return new CliOptions(configPath, dryRun, printEffectiveConfig);
        }
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--config".equals(arg) || "-c".equals(arg)) {
                if (i + 1 < args.length) {
                    configPath = Paths.get(args[++i]);
                    continue;
                }
            }
            if ("--dry-run".equals(arg)) {
                dryRun = true;
                continue;
            }
            if ("--print-effective-config".equals(arg)) {
                printEffectiveConfig = true;
            }
        }
        return new CliOptions(configPath, dryRun, printEffectiveConfig);
    }

    private static void applyLogLevel(RingProbeConfig config) {
        if (config.logging == null || config.logging.level == null) {
            return;
        }
        Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) root).setLevel(Level.toLevel(config.logging.level, Level.INFO));
        }
    }

    private static void emitWarnings(RingProbeConfig config) {
        for (String warning : ConfigWarnings.collect(config)) {
            log.warn("Config warning: {}", warning);
        }
    }

    private record CliOptions(Path configPath, boolean dryRun, boolean printEffectiveConfig) {
    }
}
