package com.authmap.spring.autoconfigure;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import com.authmap.core.parse.MappingDocumentParser;
import com.authmap.core.store.MappingStore;
import com.authmap.core.sync.MappingSyncLoop;
import com.authmap.core.sync.SyncFatalException;
import com.authmap.core.sync.SyncState;
import com.authmap.testkit.ScriptedWatchClient;
import com.authmap.testkit.ScriptedWatchStream;
import com.authmap.watch.kubernetes.KubernetesWatchClient;
import com.authmap.watch.spi.WatchClient;
import com.authmap.watch.spi.WatchEvent;
import com.authmap.watch.spi.WatchHealthSink;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class AuthMapAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(
                    AutoConfigurations.of(KubernetesWatchAutoConfiguration.class, AuthMapAutoConfiguration.class))
            .withPropertyValues("authmap.kubernetes.enabled=false", "authmap.sync.backoff.initial=1ms");

    @Test
    void providesStoreWithoutSyncWhenNoWatchClientExists() {
        runner.run(context -> {
            assertThat(context).hasSingleBean(MappingStore.class);
            assertThat(context).hasSingleBean(MappingDocumentParser.class);
            assertThat(context).hasSingleBean(SyncFailureHandler.class);
            assertThat(context.getBean(SyncFailureHandler.class)).isInstanceOf(ExitingSyncFailureHandler.class);
            assertThat(context).doesNotHaveBean(MappingSyncLoop.class);
            assertThat(context).doesNotHaveBean(MappingSyncLifecycle.class);
            assertThat(context.getBean(WatchHealthSink.class)).isSameAs(WatchHealthSink.NOOP);
        });
    }

    @Test
    void masterSwitchDisablesEverything() {
        runner.withPropertyValues("authmap.enabled=false").run(context -> {
            assertThat(context).doesNotHaveBean(MappingStore.class);
            assertThat(context).doesNotHaveBean(MappingSyncLoop.class);
        });
    }

    @Test
    void startsTheSyncLoopAndStopsItWithTheContext() {
        ScriptedWatchClient client = new ScriptedWatchClient()
                .thenStream(new ScriptedWatchStream()
                        .emit(WatchEvent.added("aws-auth", Map.of("mapAccounts", "- \"111122223333\"\n"))));
        MappingSyncLoop[] captured = new MappingSyncLoop[1];

        runner.withBean(WatchClient.class, () -> client).run(context -> {
            assertThat(context).hasSingleBean(MappingSyncLoop.class);
            assertThat(context).hasSingleBean(MappingSyncLifecycle.class);
            MappingStore store = context.getBean(MappingStore.class);
            await(() -> store.accountRecognized("111122223333"));
            captured[0] = context.getBean(MappingSyncLoop.class);
            assertThat(captured[0].state()).isEqualTo(SyncState.WATCHING);
        });

        assertThat(captured[0].state()).isEqualTo(SyncState.STOPPED);
        assertThat(client.lastStream().isClosed()).isTrue();
    }

    @Test
    void bindsResourceNameAndBackoffProperties() {
        ScriptedWatchClient client = new ScriptedWatchClient();

        runner.withBean(WatchClient.class, () -> client)
                .withPropertyValues("authmap.resource.name=custom-auth", "authmap.sync.backoff.max=2s")
                .run(context -> {
                    assertThat(context.getBean(MappingSyncLoop.class).resourceName()).isEqualTo("custom-auth");
                    await(() -> client.openAttempts() == 1);
                    assertThat(client.openedNames()).containsExactly("custom-auth");
                });
    }

    @Test
    void handsAFatalInitialFailureToTheFailureHandler() {
        ScriptedWatchClient client = new ScriptedWatchClient().thenFail("forbidden");
        List<SyncFatalException> failures = new CopyOnWriteArrayList<>();

        runner.withBean(WatchClient.class, () -> client)
                .withBean(SyncFailureHandler.class, () -> failures::add)
                .run(context -> {
                    await(() -> failures.size() == 1);
                    assertThat(failures.get(0)).hasRootCauseMessage("forbidden");
                    assertThat(context.getBean(MappingSyncLoop.class).state()).isEqualTo(SyncState.FAILED);
                });
    }

    @Test
    void retriesInitialFailureWhenFailFastIsDisabled() {
        ScriptedWatchClient client = new ScriptedWatchClient().thenFail("not yet");
        List<SyncFatalException> failures = new CopyOnWriteArrayList<>();

        runner.withBean(WatchClient.class, () -> client)
                .withBean(SyncFailureHandler.class, () -> failures::add)
                .withPropertyValues("authmap.sync.fail-fast-on-initial-open=false")
                .run(context -> {
                    MappingSyncLoop loop = context.getBean(MappingSyncLoop.class);
                    await(() -> loop.state() == SyncState.WATCHING);
                    assertThat(client.openAttempts()).isEqualTo(2);
                    assertThat(failures).isEmpty();
                });
    }

    @Test
    void publishesWatchHealthThroughMicrometer() {
        ScriptedWatchClient client = new ScriptedWatchClient();

        runner.withBean(MeterRegistry.class, SimpleMeterRegistry::new)
                .withBean(WatchClient.class, () -> client)
                .run(context -> {
                    assertThat(context.getBean(WatchHealthSink.class)).isInstanceOf(MicrometerWatchHealthSink.class);
                    MeterRegistry registry = context.getBean(MeterRegistry.class);
                    await(() -> registry.find("watch.health").tag("result", "success").gauge() != null);
                    assertThat(registry.get("watch.health").tag("result", "success").gauge().value())
                            .isEqualTo(1.0);
                });
    }

    @Test
    void buildsTheKubernetesWatchClientFromProperties() {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(KubernetesWatchAutoConfiguration.class))
                .withBean(KubernetesClient.class, () -> mock(KubernetesClient.class))
                .withPropertyValues("authmap.resource.namespace=auth")
                .run(context -> {
                    assertThat(context).hasSingleBean(KubernetesWatchClient.class);
                    assertThat(context.getBean(KubernetesWatchClient.class).namespace()).isEqualTo("auth");
                });
    }

    @Test
    void applicationWatchClientTakesPrecedenceOverKubernetes() {
        ScriptedWatchClient client = new ScriptedWatchClient();

        new ApplicationContextRunner()
                .withConfiguration(
                        AutoConfigurations.of(KubernetesWatchAutoConfiguration.class, AuthMapAutoConfiguration.class))
                .withBean(KubernetesClient.class, () -> mock(KubernetesClient.class))
                .withBean(WatchClient.class, () -> client)
                .run(context -> {
                    assertThat(context).doesNotHaveBean(KubernetesWatchClient.class);
                    assertThat(context.getBean(WatchClient.class)).isSameAs(client);
                });
    }

    private static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("condition not met within 5s");
            }
            Thread.sleep(5);
        }
    }
}
