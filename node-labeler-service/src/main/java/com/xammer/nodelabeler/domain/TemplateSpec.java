package com.xammer.nodelabeler.domain;

import com.xammer.nodelabeler.template.CompiledTemplate;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * One configured metadata key with its compiled template. Built once at startup.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
public final class TemplateSpec {

    private final MetadataKey key;
    private final CompiledTemplate template;
    private final MetadataDomain domain;

    @Override
    public String toString() {
        return domain.name().toLowerCase() + " " + key + "=" + template.getSource();
    }
}
