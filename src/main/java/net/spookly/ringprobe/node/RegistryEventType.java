package net.spookly.ringprobe.node;

/**
 * Audit event types emitted by the node registry.
 */
public enum RegistryEventType {
    ADDED,
    REMOVED,
    STATUS_CHANGED
}
