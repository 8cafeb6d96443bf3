package com.xammer.nodelabeler.service;

import com.xammer.nodelabeler.domain.MetadataDomain;
import com.xammer.nodelabeler.domain.MetadataKey;
import com.xammer.nodelabeler.domain.TemplateSpec;
import com.xammer.nodelabeler.exception.TemplateConfigurationException;
import com.xammer.nodelabeler.template.TemplateCompiler;
import com.xammer.nodelabeler.template.TemplateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns configured {@code key[=template]} entries into compiled {@link TemplateSpec}s.
 */
@Component
public class TemplateSpecLoader {

    private static final Logger logger = LoggerFactory.getLogger(TemplateSpecLoader.class);

    static final String DEFAULT_KEY = "provider-id";

    private final TemplateCompiler compiler;

    public TemplateSpecLoader(TemplateCompiler compiler) {
        this.compiler = compiler;
    }

    /**
     * Compiles every entry. With no labels and no annotations configured the single
     * label {@code provider-id={:last}} is used.
     *
     * @throws TemplateConfigurationException listing every invalid entry
     */
    public TemplateSpecRegistry load(List<String> labels, List<String> annotations) {
        List<String> labelEntries = nonBlank(labels);
        List<String> annotationEntries = nonBlank(annotations);
        if (labelEntries.isEmpty() && annotationEntries.isEmpty()) {
            logger.info("No labels or annotations configured, using default label '{}'", DEFAULT_KEY);
            labelEntries = List.of(DEFAULT_KEY);
        }

        List<TemplateSpec> specs = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        compileAll(labelEntries, MetadataDomain.LABEL, specs, errors);
        compileAll(annotationEntries, MetadataDomain.ANNOTATION, specs, errors);

        if (!errors.isEmpty()) {
            throw new TemplateConfigurationException(errors);
        }
        specs.forEach(spec -> logger.info("Configured {}", spec));
        return new TemplateSpecRegistry(specs);
    }

    private void compileAll(List<String> entries, MetadataDomain domain, List<TemplateSpec> specs,
            List<String> errors) {
        Set<MetadataKey> seen = new HashSet<>();
        for (String entry : entries) {
            String keyText = entry;
            String template = null;
            int eq = entry.indexOf('=');
            if (eq >= 0) {
                keyText = entry.substring(0, eq);
                template = entry.substring(eq + 1);
                if (template.isEmpty()) {
                    template = null;
                }
            }

            String where = domain.name().toLowerCase() + " '" + entry + "'";
            MetadataKey key;
            try {
                key = MetadataKey.parse(keyText);
            } catch (IllegalArgumentException e) {
                errors.add(where + ": " + e.getMessage());
                continue;
            }
            if (!seen.add(key)) {
                errors.add(where + ": duplicate key '" + key + "'");
                continue;
            }
            try {
                specs.add(new TemplateSpec(key, compiler.compile(template, domain), domain));
            } catch (TemplateException e) {
                errors.add(where + ": " + e.getKind() + ": " + e.getMessage());
            }
        }
    }

    private static List<String> nonBlank(List<String> entries) {
        List<String> result = new ArrayList<>();
        if (entries != null) {
            for (String entry : entries) {
                if (entry != null && !entry.trim().isEmpty()) {
                    result.add(entry.trim());
                }
            }
        }
        return result;
    }
}
