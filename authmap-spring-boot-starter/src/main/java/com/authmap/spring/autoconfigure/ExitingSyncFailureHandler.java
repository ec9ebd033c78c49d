package com.authmap.spring.autoconfigure;

import com.authmap.core.sync.SyncFatalException;
import java.util.function.IntConsumer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Closes the application context and exits the JVM with a non-zero status, so a store that can
 * never synchronize is not served as if it were authoritative.
 */
@Slf4j
public class ExitingSyncFailureHandler implements SyncFailureHandler {
    static final int EXIT_CODE = 1;

    private final ConfigurableApplicationContext context;
    private final IntConsumer exit;

    public ExitingSyncFailureHandler(ConfigurableApplicationContext context) {
        this(context, System::exit);
    }

    ExitingSyncFailureHandler(ConfigurableApplicationContext context, IntConsumer exit) {
        this.context = context;
        this.exit = exit;
    }

    @Override
    public void onFatal(SyncFatalException failure) {
        log.error("Identity mapping sync failed permanently; shutting down", failure);
        exit.accept(SpringApplication.exit(context, () -> EXIT_CODE));
    }
}
