package net.spookly.ringprobe.probe;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.net.UnknownHostException;

import org.junit.jupiter.api.Test;

class TargetValidatorTest {
    private final TargetValidator validator = new TargetValidator(host -> {
        if (host.endsWith(".invalid")) {
            throw new UnknownHostException(host);
        }
    });

    @Test
    void acceptsHostnamesAndAddresses() {
        assertEquals("ring.nlnog.net", validator.validate("  ring.nlnog.net "));
        assertEquals("2001:db8::1", validator.validate("2001:db8::1"));
        assertEquals("192.0.2.1", validator.validate("192.0.2.1"));
    }

    @Test
    void rejectsShellMetacharacters() {
        assertThrows(IllegalArgumentException.class, () -> validator.validate("example.net; reboot"));
        assertThrows(IllegalArgumentException.class, () -> validator.validate("$(id)"));
        assertThrows(IllegalArgumentException.class, () -> validator.validate("-f"));
    }

    @Test
    void rejectsMissingOrUnresolvableTargets() {
        assertThrows(IllegalArgumentException.class, () -> validator.validate(null));
        assertThrows(IllegalArgumentException.class, () -> validator.validate("nothing.invalid"));
    }
}
