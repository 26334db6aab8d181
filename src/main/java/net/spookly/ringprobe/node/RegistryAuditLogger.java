package net.spookly.ringprobe.node;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default registry audit logger that emits one line per event.
 */
public final class RegistryAuditLogger implements RegistryEventListener {
    public static final RegistryAuditLogger INSTANCE = new RegistryAuditLogger();

    private static final Logger log = LoggerFactory.getLogger(RegistryAuditLogger.class);

    private RegistryAuditLogger() {
    }

    @Override
    public void onEvent(RegistryEvent event) {
        StringBuilder builder = new StringBuilder("registry_event");
        append(builder, "type", event.type());
        append(builder, "pointId", event.pointId());
        append(builder, "countryCode", event.countryCode());
        append(builder, "asn", event.asn());
        append(builder, "previousStatus", event.previousStatus());
        append(builder, "status", event.status());
        append(builder, "timestamp", event.timestamp());
        if (event.type() == RegistryEventType.STATUS_CHANGED) {
            log.debug("{}", builder);
        } else {
            log.info("{}", builder);
        }
    }

    private void append(StringBuilder builder, String key, Object value) {
        if (value == null) {
            return;
        }
        builder.append(' ').append(key).append('=').append(value);
    }
}
