package com.authmap.spring.autoconfigure;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the identity mapping store and its sync loop.
 *
 * <h3>Configuration Example:</h3>
 * <pre>{@code
 * # application.yml
 * authmap:
 *   enabled: true
 *   resource:
 *     namespace: kube-system
 *     name: aws-auth
 *   sync:
 *     fail-fast-on-initial-open: true
 *     backoff:
 *       initial: 200ms
 *       max: 30s
 *       multiplier: 2.0
 *   kubernetes:
 *     enabled: true
 *   metrics:
 *     gauge-name: watch.health
 * }</pre>
 */
@ConfigurationProperties(prefix = "authmap")
public class AuthMapProperties {

    /** Master switch for the store, sync loop and health sink. */
    private boolean enabled = true;

    private final Resource resource = new Resource();
    private final Sync sync = new Sync();
    private final Kubernetes kubernetes = new Kubernetes();
    private final Metrics metrics = new Metrics();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Resource getResource() {
        return resource;
    }

    public Sync getSync() {
        return sync;
    }

    public Kubernetes getKubernetes() {
        return kubernetes;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    /** The single watched resource. */
    public static class Resource {
        private String namespace = "kube-system";
        private String name = "aws-auth";

        public String getNamespace() {
            return namespace;
        }

        public void setNamespace(String namespace) {
            this.namespace = namespace;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }
    }

    public static class Sync {
        /**
         * Give up (and shut the application down) when the very first watch cannot be opened.
         * Later failures are always retried.
         */
        private boolean failFastOnInitialOpen = true;

        /** How long context shutdown waits for the sync thread. */
        private Duration shutdownTimeout = Duration.ofSeconds(5);

        private final Backoff backoff = new Backoff();

        public boolean isFailFastOnInitialOpen() {
            return failFastOnInitialOpen;
        }

        public void setFailFastOnInitialOpen(boolean failFastOnInitialOpen) {
            this.failFastOnInitialOpen = failFastOnInitialOpen;
        }

        public Duration getShutdownTimeout() {
            return shutdownTimeout;
        }

        public void setShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
        }

        public Backoff getBackoff() {
            return backoff;
        }
    }

    public static class Backoff {
        private Duration initial = Duration.ofMillis(200);
        private Duration max = Duration.ofSeconds(30);
        private double multiplier = 2.0;

        public Duration getInitial() {
            return initial;
        }

        public void setInitial(Duration initial) {
            this.initial = initial;
        }

        public Duration getMax() {
            return max;
        }

        public void setMax(Duration max) {
            this.max = max;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }
    }

    public static class Kubernetes {
        /** Create a fabric8 client and ConfigMap watch client when the application supplies none. */
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    public static class Metrics {
        private String gaugeName = "watch.health";

        public String getGaugeName() {
            return gaugeName;
        }

        public void setGaugeName(String gaugeName) {
            this.gaugeName = gaugeName;
        }
    }
}
