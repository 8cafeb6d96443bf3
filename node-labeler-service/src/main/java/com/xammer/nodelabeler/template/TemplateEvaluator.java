package com.xammer.nodelabeler.template;

import com.xammer.nodelabeler.domain.MetadataDomain;
import com.xammer.nodelabeler.domain.ProviderId;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Renders a {@link CompiledTemplate} against a parsed provider id.
 *
 * <p>For labels, token output is mapped onto the label character set while it is
 * resolved ({@code {:all}} joins with {@code _}, other illegal characters become
 * {@code _}), and the final value must be a valid label value. Values are never truncated.
 */
@Component
public class TemplateEvaluator {

    /**
     * @param providerId parsed provider id, or {@code null} when the node has none
     * @throws EvaluationException when the template cannot be rendered for this provider id
     */
    public String evaluate(CompiledTemplate template, ProviderId providerId, MetadataDomain domain) {
        if (providerId == null) {
            throw new EvaluationException(EvaluationException.Kind.MISSING_PROVIDER_ID,
                    "node has no usable provider id");
        }

        StringBuilder out = new StringBuilder();
        for (Segment segment : template.getSegments()) {
            if (segment.isLiteral()) {
                out.append(segment.getLiteral());
            } else {
                out.append(resolve(segment, providerId, domain));
            }
        }

        String value = out.toString();
        if (domain == MetadataDomain.LABEL) {
            String violation = LabelValues.violation(value);
            if (violation != null) {
                throw new EvaluationException(EvaluationException.Kind.INVALID_LABEL_VALUE,
                        "rendered label value '" + value + "' " + violation);
            }
        }
        return value;
    }

    private static String resolve(Segment segment, ProviderId providerId, MetadataDomain domain) {
        List<String> segments = providerId.getSegments();
        String value;
        switch (segment.getToken()) {
            case PROVIDER:
                value = providerId.getProvider();
                break;
            case FIRST:
                value = segmentAt(providerId, 0);
                break;
            case LAST:
                value = segmentAt(providerId, segments.size() - 1);
                break;
            case INDEX:
                value = segmentAt(providerId, segment.getIndex());
                break;
            case ALL:
                value = String.join(String.valueOf(domain.getSegmentJoiner()), segments);
                break;
            default:
                throw new IllegalStateException("Unhandled token " + segment.getToken());
        }
        return domain == MetadataDomain.LABEL ? LabelValues.substitute(value) : value;
    }

    private static String segmentAt(ProviderId providerId, int index) {
        if (index < 0 || index >= providerId.segmentCount()) {
            throw new EvaluationException(EvaluationException.Kind.INDEX_OUT_OF_RANGE,
                    "segment " + index + " requested but provider id '" + providerId + "' has "
                            + providerId.segmentCount() + " segment(s)");
        }
        return providerId.getSegments().get(index);
    }
}
