package com.xammer.nodelabeler.config;

import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

@Configuration
public class KubernetesClientConfig {

    private static final Logger logger = LoggerFactory.getLogger(KubernetesClientConfig.class);

    /**
     * Uses the kubeconfig file from {@code labeler.kubernetes.kubeconfig} when set,
     * otherwise fabric8's auto-configuration (service account when in-cluster,
     * {@code KUBECONFIG} / {@code ~/.kube/config} outside).
     */
    @Bean(destroyMethod = "close")
    public KubernetesClient kubernetesClient(LabelerProperties properties) {
        String kubeconfig = properties.getKubernetes().getKubeconfig();
        Config config;
        if (kubeconfig != null && !kubeconfig.isBlank()) {
            logger.info("Creating Kubernetes client from kubeconfig {}", kubeconfig);
            config = Config.fromKubeconfig(readKubeconfig(kubeconfig));
        } else {
            logger.info("Creating Kubernetes client from the environment");
            config = Config.autoConfigure(null);
        }

        KubernetesClient client = new KubernetesClientBuilder()
                .withConfig(config)
                .build();
        logger.info("Kubernetes client targets {}", client.getMasterUrl());
        return client;
    }

    private static String readKubeconfig(String path) {
        try {
            return Files.readString(Path.of(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Could not read kubeconfig " + path, e);
        }
    }
}
