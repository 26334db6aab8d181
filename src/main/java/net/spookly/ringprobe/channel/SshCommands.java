package net.spookly.ringprobe.channel;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds OpenSSH command lines for ControlMaster multiplexed channels.
 */
public final class SshCommands {
    static final int SSH_PORT = 22;

    private final ChannelSettings settings;

    public SshCommands(ChannelSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /**
     * Expand the control path template for one host.
     */
    public String controlPath(String host) {
        String template = settings.controlPathTemplate();
        StringBuilder out = new StringBuilder(template.length() + host.length());
        for (int i = 0; i < template.length(); i++) {
            char c = template.charAt(i);
            if (c != '%' || i + 1 >= template.length()) {
                out.append(c);
                continue;
            }
            char token = template.charAt(++i);
            switch (token) {
                case 'r':
                    out.append(settings.username());
                    break;
                case 'h':
                    out.append(host);
                    break;
                case 'p':
                    out.append(SSH_PORT);
                    break;
                case '%':
                    out.append('%');
                    break;
                default:
                    out.append('%').append(token);
                    break;
            }
        }
        return out.toString();
    }

    /**
     * Start a backgrounded master that persists until told to exit.
     */
    public List<String> openMaster(String host) {
        List<String> command = base(host);
        command.add("-o");
        command.add("ControlMaster=auto");
        command.add("-o");
        command.add("ControlPersist=yes");
        command.add("-MNf");
        command.add(host);
        return command;
    }

    /**
     * Run a remote command over an existing master.
     */
    public List<String> exec(String host, String remoteCommand) {
        List<String> command = base(host);
        command.add(host);
        command.add(remoteCommand);
        return command;
    }

    /**
     * Ask the master behind a control socket whether it is alive.
     */
    public List<String> check(String host) {
        return control(host, "check");
    }

    /**
     * Ask the master behind a control socket to exit.
     */
    public List<String> exit(String host) {
        return control(host, "exit");
    }

    private List<String> control(String host, String operation) {
        List<String> command = new ArrayList<>();
        command.add("ssh");
        command.add("-o");
        command.add("ControlPath=" + controlPath(host));
        command.add("-O");
        command.add(operation);
        command.add(host);
        return command;
    }

    private List<String> base(String host) {
        List<String> command = new ArrayList<>();
        command.add("ssh");
        command.add("-o");
        command.add("BatchMode=yes");
        command.add("-o");
        command.add("StrictHostKeyChecking=accept-new");
        command.add("-o");
        command.add("ConnectTimeout=" + Math.max(1, settings.connectTimeout().toSeconds()));
        command.add("-o");
        command.add("ControlPath=" + controlPath(host));
        if (settings.keyPath() != null) {
            command.add("-i");
            command.add(settings.keyPath().toString());
        }
        command.add("-l");
        command.add(settings.username());
        return command;
    }
}
