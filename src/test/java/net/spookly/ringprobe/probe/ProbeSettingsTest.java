package net.spookly.ringprobe.probe;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;

import net.spookly.ringprobe.config.RingProbeConfig;
import org.junit.jupiter.api.Test;

class ProbeSettingsTest {
    @Test
    void defaultsMatchTheRingPingInvocation() {
        RingProbeConfig config = new RingProbeConfig();

        ProbeSettings settings = ProbeSettings.fromConfig(config);

        assertEquals("ping -c10 -W5 192.0.2.1", settings.pingCommand("192.0.2.1"));
        assertEquals(100, settings.workers());
        assertEquals(Duration.ofSeconds(15), settings.perPointTimeout());
    }

    @Test
    void readsProbeAndSshSections() {
        RingProbeConfig config = new RingProbeConfig();
        config.probe = new RingProbeConfig.ProbeConfig();
        config.probe.count = 3;
        config.probe.waitSeconds = 2;
        config.ssh = new RingProbeConfig.SshConfig();
        config.ssh.commandTimeoutSeconds = 8;

        ProbeSettings settings = ProbeSettings.fromConfig(config);

        assertEquals("ping -c3 -W2 example.net", settings.pingCommand("example.net"));
        assertEquals(Duration.ofSeconds(8), settings.perPointTimeout());
    }

    @Test
    void pingCommandRefusesTargetsThatAreNotPlainHosts() {
        ProbeSettings settings = ProbeSettings.fromConfig(new RingProbeConfig());

        assertThrows(IllegalArgumentException.class, () -> settings.pingCommand("example.net;reboot"));
        assertThrows(IllegalArgumentException.class, () -> settings.pingCommand("example.net reboot"));
        assertThrows(IllegalArgumentException.class, () -> settings.pingCommand("-c1000"));
        assertEquals("ping -c10 -W5 2001:db8::1", settings.pingCommand("2001:db8::1"));
    }
}
