package com.trademind.memory.store;

public enum StoreMode {
    INITIALIZING,
    READY,
    /** Startup failed; reads answer from what is loaded, writes are refused. */
    READ_ONLY
}
