package com.authmap.watch.kubernetes;

import com.authmap.watch.spi.WatchClient;
import com.authmap.watch.spi.WatchOpenException;
import com.authmap.watch.spi.WatchStream;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.Watch;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Watches a single ConfigMap by name in one namespace through the fabric8 client.
 */
public class KubernetesWatchClient implements WatchClient {
    private static final Logger log = LoggerFactory.getLogger(KubernetesWatchClient.class);

    public static final String DEFAULT_NAMESPACE = "kube-system";

    private final KubernetesClient client;
    private final String namespace;

    public KubernetesWatchClient(KubernetesClient client) {
        this(client, DEFAULT_NAMESPACE);
    }

    public KubernetesWatchClient(KubernetesClient client, String namespace) {
        this.client = Objects.requireNonNull(client, "client");
        this.namespace = Objects.requireNonNull(namespace, "namespace");
    }

    @Override
    public WatchStream open(String resourceName) throws WatchOpenException {
        ConfigMapWatchStream stream = new ConfigMapWatchStream(resourceName);
        try {
            Watch watch = client.configMaps()
                    .inNamespace(namespace)
                    .withName(resourceName)
                    .watch(stream);
            stream.attach(watch);
        } catch (KubernetesClientException ex) {
            throw new WatchOpenException(
                    "Unable to watch configmap " + namespace + "/" + resourceName + ": " + ex.getMessage(), ex);
        }
        log.debug("Opened watch on configmap {}/{}", namespace, resourceName);
        return stream;
    }

    public String namespace() {
        return namespace;
    }
}
