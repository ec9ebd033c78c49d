package com.authmap.spring.autoconfigure;

import com.authmap.core.sync.SyncFatalException;

/** Supervisor hook invoked once when the sync loop gives up. */
@FunctionalInterface
public interface SyncFailureHandler {

    void onFatal(SyncFatalException failure);
}
