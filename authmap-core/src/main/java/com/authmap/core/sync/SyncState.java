package com.authmap.core.sync;

public enum SyncState {
    /** No watch open; about to (re)open one. */
    DISCONNECTED,
    /** Consuming an open watch stream. */
    WATCHING,
    /** Shut down on request. Terminal. */
    STOPPED,
    /** The initial watch could not be opened and fail-fast is on. Terminal. */
    FAILED
}
