package com.xammer.nodelabeler.template;

import com.xammer.nodelabeler.domain.MetadataDomain;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Compiles template strings such as {@code "{:provider}-{1}"} into segments.
 *
 * <p>Recognised tokens are {@code {:provider}}, {@code {:first}}, {@code {:last}},
 * {@code {:all}} and {@code {N}}. Templates for the label domain may only contain
 * literal characters that are legal in a label value.
 */
@Component
public class TemplateCompiler {

    /**
     * @param template template text; {@code null} compiles the default {@code {:last}}
     * @throws TemplateException if the template contains an unknown token or unbalanced braces
     */
    public CompiledTemplate compile(String template, MetadataDomain domain) {
        String source = template == null ? CompiledTemplate.DEFAULT_TEMPLATE : template;
        List<Segment> segments = new ArrayList<>();
        StringBuilder literal = new StringBuilder();

        int i = 0;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '{') {
                flush(literal, segments);
                int close = findClose(source, i);
                segments.add(parseToken(source, i, source.substring(i + 1, close)));
                i = close + 1;
            } else if (c == '}') {
                throw new TemplateException(TemplateException.Kind.MALFORMED_TEMPLATE, source, i,
                        "unexpected '}'");
            } else {
                if (domain == MetadataDomain.LABEL && !LabelValues.isAllowed(c)) {
                    throw new TemplateException(TemplateException.Kind.MALFORMED_TEMPLATE, source, i,
                            "character '" + c + "' is not allowed in a label value");
                }
                literal.append(c);
                i++;
            }
        }
        flush(literal, segments);
        return new CompiledTemplate(source, segments);
    }

    private static int findClose(String source, int open) {
        for (int j = open + 1; j < source.length(); j++) {
            char c = source.charAt(j);
            if (c == '}') {
                return j;
            }
            if (c == '{') {
                throw new TemplateException(TemplateException.Kind.MALFORMED_TEMPLATE, source, j,
                        "nested '{'");
            }
        }
        throw new TemplateException(TemplateException.Kind.MALFORMED_TEMPLATE, source, open, "unclosed '{'");
    }

    private static Segment parseToken(String source, int position, String body) {
        switch (body) {
            case ":provider":
                return Segment.token(TokenKind.PROVIDER);
            case ":first":
                return Segment.token(TokenKind.FIRST);
            case ":last":
                return Segment.token(TokenKind.LAST);
            case ":all":
                return Segment.token(TokenKind.ALL);
            default:
                if (isDigits(body)) {
                    try {
                        return Segment.index(Integer.parseInt(body));
                    } catch (NumberFormatException e) {
                        throw new TemplateException(TemplateException.Kind.UNKNOWN_TOKEN, source, position,
                                "index '" + body + "' is too large");
                    }
                }
                throw new TemplateException(TemplateException.Kind.UNKNOWN_TOKEN, source, position,
                        "unknown token '{" + body + "}'");
        }
    }

    private static boolean isDigits(String s) {
        if (s.isEmpty()) {
            return false;
        }
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) < '0' || s.charAt(i) > '9') {
                return false;
            }
        }
        return true;
    }

    private static void flush(StringBuilder literal, List<Segment> segments) {
        if (literal.length() > 0) {
            segments.add(Segment.literal(literal.toString()));
            literal.setLength(0);
        }
    }
}
