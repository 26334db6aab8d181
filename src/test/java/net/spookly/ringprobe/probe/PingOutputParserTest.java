package net.spookly.ringprobe.probe;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class PingOutputParserTest {
    @Test
    void parsesSingleLineSummary() throws PingParseException {
        PingSummary summary = PingOutputParser.parse(
                "10 packets transmitted, 10 received, rtt min/avg/max/mdev = 1.2/2.3/4.5/0.6 ms");

        assertEquals(10, summary.transmitted());
        assertEquals(10, summary.received());
        assertEquals(new RttStats(1.2, 2.3, 4.5, 0.6), summary.rtt());
    }

    @Test
    void parsesIputilsOutput() throws PingParseException {
        String output = String.join("\n",
                "PING 192.0.2.1 (192.0.2.1) 56(84) bytes of data.",
                "64 bytes from 192.0.2.1: icmp_seq=1 ttl=57 time=11.2 ms",
                "",
                "--- 192.0.2.1 ping statistics ---",
                "10 packets transmitted, 9 received, 10% packet loss, time 9012ms",
                "rtt min/avg/max/mdev = 10.981/11.204/11.530/0.160 ms");

        PingSummary summary = PingOutputParser.parse(output);

        assertEquals(9, summary.received());
        assertEquals(11.204, summary.rtt().avg());
    }

    @Test
    void parsesBsdOutput() throws PingParseException {
        String output = String.join("\n",
                "--- 192.0.2.1 ping statistics ---",
                "5 packets transmitted, 5 packets received, 0.0% packet loss",
                "round-trip min/avg/max/stddev = 0.041/0.056/0.071/0.011 ms");

        PingSummary summary = PingOutputParser.parse(output);

        assertEquals(5, summary.transmitted());
        assertEquals(0.071, summary.rtt().max());
    }

    @Test
    void zeroRepliesHaveNoRtt() throws PingParseException {
        PingSummary summary = PingOutputParser.parse(
                "10 packets transmitted, 0 received, 100% packet loss, time 9214ms");

        assertFalse(summary.anyReceived());
        assertNull(summary.rtt());
        assertEquals(10, summary.transmitted());
    }

    @Test
    void rejectsOutputWithoutSummary() {
        assertThrows(PingParseException.class, () -> PingOutputParser.parse(""));
        assertThrows(PingParseException.class, () -> PingOutputParser.parse("ping: unknown host example.invalid"));
        assertThrows(PingParseException.class, () -> PingOutputParser.parse("3 packets transmitted, 3 received"));
    }

    @Test
    void rttLineAloneImpliesAReply() throws PingParseException {
        PingSummary summary = PingOutputParser.parse("rtt min/avg/max/mdev = 1.0/1.0/1.0/0.0 ms");

        assertTrue(summary.anyReceived());
    }
}
