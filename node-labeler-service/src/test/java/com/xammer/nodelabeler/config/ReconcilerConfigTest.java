package com.xammer.nodelabeler.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xammer.nodelabeler.exception.TemplateConfigurationException;
import com.xammer.nodelabeler.service.MetadataPlanner;
import com.xammer.nodelabeler.service.NodeMetadataResolver;
import com.xammer.nodelabeler.service.NodeReconciler;
import com.xammer.nodelabeler.service.ProviderIdParser;
import com.xammer.nodelabeler.service.TemplateSpecLoader;
import com.xammer.nodelabeler.service.TemplateSpecRegistry;
import com.xammer.nodelabeler.template.TemplateCompiler;
import com.xammer.nodelabeler.template.TemplateEvaluator;
import io.fabric8.kubernetes.client.KubernetesClient;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class ReconcilerConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(ReconcilerTestConfiguration.class);

    @Test
    void startsWithValidTemplates() {
        contextRunner
                .withPropertyValues("labeler.labels[0]=zone={1}", "labeler.annotations[0]=example.com/id={:all}")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context).hasSingleBean(NodeReconciler.class);
                    assertThat(context.getBean(TemplateSpecRegistry.class).size()).isEqualTo(2);
                });
    }

    @Test
    void invalidTemplateStopsTheContext() {
        contextRunner
                .withPropertyValues("labeler.labels[0]=key={unknown}")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .hasRootCauseInstanceOf(TemplateConfigurationException.class)
                            .hasStackTraceContaining("key={unknown}");
                });
    }

    @Configuration
    @EnableConfigurationProperties(LabelerProperties.class)
    @Import({ReconcilerConfig.class, TemplateSpecLoader.class, TemplateCompiler.class, TemplateEvaluator.class,
            ProviderIdParser.class, NodeMetadataResolver.class, MetadataPlanner.class})
    static class ReconcilerTestConfiguration {

        @Bean
        Clock clock() {
            return Clock.systemUTC();
        }

        @Bean
        ObjectMapper objectMapper() {
            return new ObjectMapper();
        }

        @Bean
        KubernetesClient kubernetesClient() {
            return mock(KubernetesClient.class);
        }
    }
}
