package net.moznion.schedsync.event;

public enum Event {
    UPSERTED,
    UNCHANGED,
    REMOVED,
    FAILED,
}
