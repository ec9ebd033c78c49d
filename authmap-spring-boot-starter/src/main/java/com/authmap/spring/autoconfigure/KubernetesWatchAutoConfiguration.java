package com.authmap.spring.autoconfigure;

import com.authmap.watch.kubernetes.KubernetesWatchClient;
import com.authmap.watch.spi.WatchClient;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/** Supplies the ConfigMap watch transport when fabric8 is on the classpath. */
@AutoConfiguration
@ConditionalOnClass({KubernetesClient.class, KubernetesWatchClient.class})
@ConditionalOnProperty(prefix = "authmap.kubernetes", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(AuthMapProperties.class)
public class KubernetesWatchAutoConfiguration {

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public KubernetesClient authmapKubernetesClient() {
        return new KubernetesClientBuilder().build();
    }

    @Bean
    @ConditionalOnMissingBean(WatchClient.class)
    public KubernetesWatchClient kubernetesWatchClient(KubernetesClient client, AuthMapProperties properties) {
        return new KubernetesWatchClient(client, properties.getResource().getNamespace());
    }
}
