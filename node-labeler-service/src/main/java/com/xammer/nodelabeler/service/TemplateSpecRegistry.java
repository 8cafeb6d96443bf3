package com.xammer.nodelabeler.service;

import com.xammer.nodelabeler.domain.TemplateSpec;

import java.util.Iterator;
import java.util.List;

/**
 * The ordered, immutable set of configured keys. Labels and annotations are iterated
 * the same way; only the domain on each spec differs.
 */
public class TemplateSpecRegistry implements Iterable<TemplateSpec> {

    private final List<TemplateSpec> specs;

    public TemplateSpecRegistry(List<TemplateSpec> specs) {
        this.specs = List.copyOf(specs);
    }

    public List<TemplateSpec> getSpecs() {
        return specs;
    }

    public int size() {
        return specs.size();
    }

    @Override
    public Iterator<TemplateSpec> iterator() {
        return specs.iterator();
    }

    @Override
    public String toString() {
        return specs.toString();
    }
}
