package com.xammer.nodelabeler.service;

import com.xammer.nodelabeler.domain.MetadataDomain;
import com.xammer.nodelabeler.domain.TemplateSpec;
import com.xammer.nodelabeler.exception.TemplateConfigurationException;
import com.xammer.nodelabeler.template.TemplateCompiler;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TemplateSpecLoaderTest {

    private final TemplateSpecLoader loader = new TemplateSpecLoader(new TemplateCompiler());

    @Test
    void defaultsToProviderIdLabelWhenNothingConfigured() {
        TemplateSpecRegistry registry = loader.load(List.of(), null);

        assertThat(registry.getSpecs()).hasSize(1);
        TemplateSpec spec = registry.getSpecs().get(0);
        assertThat(spec.getKey()).hasToString("provider-id");
        assertThat(spec.getDomain()).isEqualTo(MetadataDomain.LABEL);
        assertThat(spec.getTemplate().getSource()).isEqualTo("{:last}");
    }

    @Test
    void noDefaultWhenOnlyAnnotationsConfigured() {
        TemplateSpecRegistry registry = loader.load(List.of(), List.of("example.com/node-id={:all}"));

        assertThat(registry.getSpecs()).hasSize(1);
        assertThat(registry.getSpecs()).extracting(TemplateSpec::getDomain)
                .containsExactly(MetadataDomain.ANNOTATION);
    }

    @Test
    void keepsConfiguredOrderAndAppliesDefaultTemplate() {
        TemplateSpecRegistry registry = loader.load(
                List.of("zone={0}", "instance", "instance-id="),
                List.of("example.com/provider={:provider}://{:all}"));

        assertThat(registry.getSpecs()).extracting(TemplateSpec::toString).containsExactly(
                "label zone={0}",
                "label instance={:last}",
                "label instance-id={:last}",
                "annotation example.com/provider={:provider}://{:all}");
    }

    @Test
    void sameKeyMayBeUsedForLabelAndAnnotation() {
        TemplateSpecRegistry registry = loader.load(List.of("node-id"), List.of("node-id={:all}"));

        assertThat(registry.size()).isEqualTo(2);
    }

    @Test
    void reportsEveryInvalidEntryTogether() {
        assertThatThrownBy(() -> loader.load(
                List.of("good={0}", "bad={unknown}", "-key={0}", "good={1}", "slash={0}/{1}"),
                List.of("open={:last", "fine={:all}")))
                .isInstanceOf(TemplateConfigurationException.class)
                .satisfies(e -> assertThat(((TemplateConfigurationException) e).getErrors())
                        .hasSize(5)
                        .anySatisfy(m -> assertThat(m).startsWith("label 'bad={unknown}': UNKNOWN_TOKEN"))
                        .anySatisfy(m -> assertThat(m).contains("'-key={0}'").contains("invalid name"))
                        .anySatisfy(m -> assertThat(m).contains("duplicate key 'good'"))
                        .anySatisfy(m -> assertThat(m).startsWith("label 'slash={0}/{1}': MALFORMED_TEMPLATE"))
                        .anySatisfy(m -> assertThat(m).startsWith("annotation 'open={:last': MALFORMED_TEMPLATE")));
    }

    @Test
    void unknownTokenPreventsStartup() {
        assertThatThrownBy(() -> loader.load(List.of("key={unknown}"), List.of()))
                .isInstanceOf(TemplateConfigurationException.class)
                .hasMessageContaining("UNKNOWN_TOKEN");
    }

    @Test
    void blankEntriesAreIgnored() {
        TemplateSpecRegistry registry = loader.load(List.of(" ", ""), List.of());

        assertThat(registry.getSpecs()).extracting(s -> s.getKey().toString()).containsExactly("provider-id");
    }
}
