package com.xammer.nodelabeler.service;

import com.xammer.nodelabeler.domain.ProviderId;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Splits {@code <provider>://<seg0>/.../<segN>} into its provider and path segments.
 */
@Component
public class ProviderIdParser {

    private static final String SEPARATOR = "://";

    /**
     * @return the parsed id, or empty when {@code raw} is empty, has no {@code ://}
     *         or has an empty provider name
     */
    public Optional<ProviderId> parse(String raw) {
        if (raw == null || raw.isEmpty()) {
            return Optional.empty();
        }
        int separator = raw.indexOf(SEPARATOR);
        if (separator <= 0) {
            return Optional.empty();
        }

        String provider = raw.substring(0, separator);
        String path = raw.substring(separator + SEPARATOR.length());
        List<String> segments = path.isEmpty() ? List.of() : Arrays.asList(path.split("/", -1));
        return Optional.of(new ProviderId(raw, provider, segments));
    }
}
