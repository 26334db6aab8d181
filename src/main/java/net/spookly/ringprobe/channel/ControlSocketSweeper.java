package net.spookly.ringprobe.channel;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds control sockets left behind by a previous process. Live masters are reported so they can
 * be adopted, dead socket files are deleted.
 */
final class ControlSocketSweeper {
    private static final Logger log = LoggerFactory.getLogger(ControlSocketSweeper.class);

    private static final Duration CHECK_TIMEOUT = Duration.ofSeconds(5);

    private final ChannelSettings settings;
    private final SshCommands commands;
    private final CommandRunner runner;

    ControlSocketSweeper(ChannelSettings settings, SshCommands commands, CommandRunner runner) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.commands = Objects.requireNonNull(commands, "commands");
        this.runner = Objects.requireNonNull(runner, "runner");
    }

    /**
     * Sweep the control directory.
     *
     * @return hosts whose master answered {@code ssh -O check}
     */
    Set<String> sweep() throws InterruptedException {
        Path template = Path.of(settings.controlPathTemplate());
        Path directory = template.getParent();
        Set<String> live = new LinkedHashSet<>();
        if (directory == null || directory.toString().contains("%") || !Files.isDirectory(directory)) {
            return live;
        }
        Pattern pattern = basenamePattern(template.getFileName().toString(), settings.username());
        if (pattern == null) {
            log.warn("Control path template has no %h token, skipping socket recovery: {}", template);
            return live;
        }
        int removed = 0;
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(directory)) {
            for (Path entry : entries) {
                Matcher matcher = pattern.matcher(entry.getFileName().toString());
                if (!matcher.matches()) {
                    continue;
                }
                String host = matcher.group("host");
                if (isAlive(host)) {
                    live.add(host);
                    continue;
                }
                if (delete(entry)) {
                    removed++;
                }
            }
        } catch (IOException e) {
            log.warn("Failed to scan control directory {}: {}", directory, e.getMessage());
        }
        log.info("Control socket sweep: {} live, {} stale removed", live.size(), removed);
        return live;
    }

    private boolean isAlive(String host) throws InterruptedException {
        try {
            return runner.run(commands.check(host), CHECK_TIMEOUT).succeeded();
        } catch (IOException e) {
            log.debug("Control check for {} could not run: {}", host, e.getMessage());
            return false;
        }
    }

    private boolean delete(Path socket) {
        try {
            return Files.deleteIfExists(socket);
        } catch (IOException e) {
            log.warn("Failed to remove stale control socket {}: {}", socket, e.getMessage());
            return false;
        }
    }

    /**
     * Turn a control path basename template into a regex with a named {@code host} group.
     * Returns null when the template cannot identify a host.
     */
    static Pattern basenamePattern(String basename, String username) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        boolean sawHost = false;
        for (int i = 0; i < basename.length(); i++) {
            char c = basename.charAt(i);
            if (c != '%' || i + 1 >= basename.length()) {
                literal.append(c);
                continue;
            }
            char token = basename.charAt(++i);
            if (token == '%') {
                literal.append('%');
                continue;
            }
            flush(regex, literal);
            switch (token) {
                case 'h':
                    regex.append(sawHost ? "\\k<host>" : "(?<host>.+?)");
                    sawHost = true;
                    break;
                case 'r':
                    regex.append(Pattern.quote(username));
                    break;
                case 'p':
                    regex.append(SshCommands.SSH_PORT);
                    break;
                default:
                    regex.append(Pattern.quote("%" + token));
                    break;
            }
        }
        flush(regex, literal);
        return sawHost ? Pattern.compile(regex.toString()) : null;
    }

    private static void flush(StringBuilder regex, StringBuilder literal) {
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
            literal.setLength(0);
        }
    }
}
