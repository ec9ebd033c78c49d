package com.authmap.spring.autoconfigure;

import com.authmap.core.parse.MappingDocumentParser;
import com.authmap.core.store.MappingStore;
import com.authmap.core.sync.MappingSyncLoop;
import com.authmap.core.sync.SyncSettings;
import com.authmap.watch.spi.WatchClient;
import com.authmap.watch.spi.WatchHealthSink;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires parser, store, health sink and, when a {@link WatchClient} exists, the sync loop.
 */
@AutoConfiguration(
        after = KubernetesWatchAutoConfiguration.class,
        afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnProperty(prefix = "authmap", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(AuthMapProperties.class)
public class AuthMapAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public MappingDocumentParser mappingDocumentParser() {
        return new MappingDocumentParser();
    }

    @Bean
    @ConditionalOnMissingBean
    public MappingStore mappingStore() {
        return new MappingStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public WatchHealthSink watchHealthSink() {
        return WatchHealthSink.NOOP;
    }

    @Bean
    @ConditionalOnMissingBean
    public SyncFailureHandler syncFailureHandler(ConfigurableApplicationContext context) {
        return new ExitingSyncFailureHandler(context);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MeterRegistry.class)
    @ConditionalOnBean(MeterRegistry.class)
    static class MicrometerHealthConfiguration {

        @Bean
        @ConditionalOnMissingBean(WatchHealthSink.class)
        public MicrometerWatchHealthSink micrometerWatchHealthSink(
                MeterRegistry registry, AuthMapProperties properties) {
            return new MicrometerWatchHealthSink(registry, properties.getMetrics().getGaugeName());
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnBean(WatchClient.class)
    static class SyncConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public MappingSyncLoop mappingSyncLoop(
                WatchClient watchClient,
                MappingDocumentParser parser,
                MappingStore store,
                ObjectProvider<WatchHealthSink> healthSink,
                AuthMapProperties properties) {
            AuthMapProperties.Sync sync = properties.getSync();
            SyncSettings settings = new SyncSettings(
                    properties.getResource().getName(),
                    sync.isFailFastOnInitialOpen(),
                    sync.getBackoff().getInitial(),
                    sync.getBackoff().getMax(),
                    sync.getBackoff().getMultiplier());
            return new MappingSyncLoop(
                    watchClient, parser, store, healthSink.getIfAvailable(() -> WatchHealthSink.NOOP), settings);
        }

        @Bean
        public MappingSyncLifecycle mappingSyncLifecycle(
                MappingSyncLoop loop, SyncFailureHandler failureHandler, AuthMapProperties properties) {
            return new MappingSyncLifecycle(
                    loop, failureHandler, properties.getSync().getShutdownTimeout());
        }
    }
}
