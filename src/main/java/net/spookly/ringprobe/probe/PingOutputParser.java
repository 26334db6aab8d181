package net.spookly.ringprobe.probe;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the summary lines printed by iputils and BSD ping.
 */
public final class PingOutputParser {
    private static final Pattern PACKETS = Pattern.compile(
            "(\\d+) packets transmitted, (\\d+) (?:packets )?received");
    private static final Pattern RTT = Pattern.compile(
            "(?:rtt|round-trip) min/avg/max/(?:mdev|stddev) = "
                    + "([0-9.]+)/([0-9.]+)/([0-9.]+)/([0-9.]+) ms");

    private PingOutputParser() {
    }

    public static PingSummary parse(String output) throws PingParseException {
        if (output == null || output.isBlank()) {
            throw new PingParseException("empty output");
        }
        Matcher packets = PACKETS.matcher(output);
        Matcher rtt = RTT.matcher(output);
        boolean hasPackets = packets.find();
        boolean hasRtt = rtt.find();
        if (!hasPackets && !hasRtt) {
            throw new PingParseException("no ping summary in output");
        }
        RttStats stats = null;
        if (hasRtt) {
            try {
                stats = new RttStats(
                        Double.parseDouble(rtt.group(1)),
                        Double.parseDouble(rtt.group(2)),
                        Double.parseDouble(rtt.group(3)),
                        Double.parseDouble(rtt.group(4))
                );
            } catch (NumberFormatException e) {
                throw new PingParseException("malformed rtt values: " + rtt.group());
            }
        }
        if (!hasPackets) {
            // Only the rtt line survived; at least one reply must have arrived for it to print.
            return new PingSummary(0, 1, stats);
        }
        int transmitted;
        int received;
        try {
            transmitted = Integer.parseInt(packets.group(1));
            received = Integer.parseInt(packets.group(2));
        } catch (NumberFormatException e) {
            throw new PingParseException("malformed packet counts: " + packets.group());
        }
        if (received == 0) {
            return new PingSummary(transmitted, 0, null);
        }
        if (stats == null) {
            throw new PingParseException(received + " replies but no rtt line");
        }
        return new PingSummary(transmitted, received, stats);
    }
}
