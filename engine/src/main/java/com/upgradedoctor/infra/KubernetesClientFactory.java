package com.upgradedoctor.infra;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Provides the fabric8 KubernetesClient as a Micronaut bean.
 * Uses the default kubeconfig / in-cluster config (auto-detected).
 *
 * In tests, this bean is replaced by @MockBean(KubernetesClient.class).
 */
@Factory
public class KubernetesClientFactory {

    private static final Logger log = LoggerFactory.getLogger(KubernetesClientFactory.class);

    @Singleton
    @Bean(preDestroy = "close")
    @Requires(missingBeans = KubernetesClient.class)
    public KubernetesClient kubernetesClient() {
        KubernetesClient client = new KubernetesClientBuilder().build();
        log.info("KubernetesClient initialized: {}", client.getMasterUrl());
        return client;
    }
}
