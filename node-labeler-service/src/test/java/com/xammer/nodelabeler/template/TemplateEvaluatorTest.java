package com.xammer.nodelabeler.template;

import com.xammer.nodelabeler.domain.MetadataDomain;
import com.xammer.nodelabeler.domain.ProviderId;
import com.xammer.nodelabeler.service.ProviderIdParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TemplateEvaluatorTest {

    private static final ProviderId AWS =
            new ProviderId("aws://us-west-2/i-0abcdef1234567890", "aws", List.of("us-west-2", "i-0abcdef1234567890"));

    private final TemplateCompiler compiler = new TemplateCompiler();
    private final TemplateEvaluator evaluator = new TemplateEvaluator();

    private String label(String template, ProviderId id) {
        return evaluator.evaluate(compiler.compile(template, MetadataDomain.LABEL), id, MetadataDomain.LABEL);
    }

    private String annotation(String template, ProviderId id) {
        return evaluator.evaluate(compiler.compile(template, MetadataDomain.ANNOTATION), id,
                MetadataDomain.ANNOTATION);
    }

    @Test
    void rendersProviderAndLastSegment() {
        assertThat(label("{:provider}-{:last}", AWS)).isEqualTo("aws-i-0abcdef1234567890");
    }

    @Test
    void allJoinerDependsOnDomain() {
        assertThat(label("{:all}", AWS)).isEqualTo("us-west-2_i-0abcdef1234567890");
        assertThat(annotation("{:all}", AWS)).isEqualTo("us-west-2/i-0abcdef1234567890");
    }

    @Test
    void indexTokensSelectSegments() {
        assertThat(label("{0}", AWS)).isEqualTo("us-west-2");
        assertThat(label("{1}", AWS)).isEqualTo("i-0abcdef1234567890");
        assertThat(label("{:first}", AWS)).isEqualTo("us-west-2");
    }

    @Test
    void indexPastLastSegmentIsOutOfRange() {
        assertThatThrownBy(() -> label("{2}", AWS))
                .isInstanceOf(EvaluationException.class)
                .extracting(e -> ((EvaluationException) e).getKind())
                .isEqualTo(EvaluationException.Kind.INDEX_OUT_OF_RANGE);
    }

    @Test
    void missingProviderIdFails() {
        assertThatThrownBy(() -> label("{:last}", null))
                .isInstanceOf(EvaluationException.class)
                .extracting(e -> ((EvaluationException) e).getKind())
                .isEqualTo(EvaluationException.Kind.MISSING_PROVIDER_ID);
    }

    @Test
    void mixedTemplatesRenderPerDomain() {
        ProviderId id = new ProviderIdParser().parse("aws://us-east-2/i-1234567890abcdef0").orElseThrow();

        assertThat(label("{:last}-{:first}_{:all}", id))
                .isEqualTo("i-1234567890abcdef0-us-east-2_us-east-2_i-1234567890abcdef0");
        assertThatThrownBy(() -> label("{:last}-{:first}_{:all}.{:last}", id))
                .isInstanceOf(EvaluationException.class)
                .hasMessageContaining("longer than 63");
        assertThat(annotation("{:last}-{:first} {:all}/{:last}", id))
                .isEqualTo("i-1234567890abcdef0-us-east-2 us-east-2/i-1234567890abcdef0/i-1234567890abcdef0");
    }

    @Test
    void labelTokensSubstituteIllegalCharacters() {
        ProviderId id = new ProviderId("azure://sub/rg:prod/vm 1", "azure", List.of("sub", "rg:prod", "vm 1"));

        assertThat(label("{1}.{2}", id)).isEqualTo("rg_prod.vm_1");
        assertThat(annotation("{1}.{2}", id)).isEqualTo("rg:prod.vm 1");
    }

    @Test
    void overlongLabelValueIsRejectedNotTruncated() {
        String longSegment = "x".repeat(64);
        ProviderId id = new ProviderId("kind://" + longSegment, "kind", List.of(longSegment));

        assertThatThrownBy(() -> label("{:last}", id))
                .isInstanceOf(EvaluationException.class)
                .extracting(e -> ((EvaluationException) e).getKind())
                .isEqualTo(EvaluationException.Kind.INVALID_LABEL_VALUE);
        assertThat(annotation("{:last}", id)).isEqualTo(longSegment);
    }

    @Test
    void labelValueMustEndAlphanumeric() {
        ProviderId id = new ProviderIdParser().parse("aws:///us-west-2a/i-0a1b2c3d").orElseThrow();

        assertThatThrownBy(() -> label("{:all}", id))
                .isInstanceOf(EvaluationException.class)
                .extracting(e -> ((EvaluationException) e).getKind())
                .isEqualTo(EvaluationException.Kind.INVALID_LABEL_VALUE);
        assertThat(label("{1}-{2}", id)).isEqualTo("us-west-2a-i-0a1b2c3d");
    }

    @Test
    void providerWithoutSegmentsHasNoLastSegment() {
        ProviderId id = new ProviderIdParser().parse("kind://").orElseThrow();

        assertThat(label("{:provider}", id)).isEqualTo("kind");
        assertThat(label("{:all}", id)).isEmpty();
        assertThatThrownBy(() -> label("{:last}", id))
                .isInstanceOf(EvaluationException.class)
                .extracting(e -> ((EvaluationException) e).getKind())
                .isEqualTo(EvaluationException.Kind.INDEX_OUT_OF_RANGE);
    }

    @Test
    void evaluationIsDeterministic() {
        CompiledTemplate template = compiler.compile("{:provider}.{:all}", MetadataDomain.LABEL);

        String first = evaluator.evaluate(template, AWS, MetadataDomain.LABEL);
        for (int i = 0; i < 10; i++) {
            assertThat(evaluator.evaluate(template, AWS, MetadataDomain.LABEL)).isEqualTo(first);
        }
    }
}
