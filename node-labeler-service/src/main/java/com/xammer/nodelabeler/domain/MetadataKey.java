package com.xammer.nodelabeler.domain;

import java.util.Objects;
import java.util.Optional;

/**
 * A label or annotation key, {@code [prefix/]name}, validated against the
 * Kubernetes qualified-name rules.
 */
public final class MetadataKey {

    private static final int MAX_NAME_LENGTH = 63;
    private static final int MAX_PREFIX_LENGTH = 253;

    private final String prefix;
    private final String name;

    private MetadataKey(String prefix, String name) {
        this.prefix = prefix;
        this.name = name;
    }

    /**
     * Parses and validates a key.
     *
     * @throws IllegalArgumentException describing the first rule the key breaks
     */
    public static MetadataKey parse(String key) {
        if (key == null) {
            throw new IllegalArgumentException("invalid key (null)");
        }
        String[] parts = key.split("/", -1);
        switch (parts.length) {
            case 1:
                validateName(parts[0]);
                return new MetadataKey(null, parts[0]);
            case 2:
                validatePrefix(parts[0]);
                validateName(parts[1]);
                return new MetadataKey(parts[0], parts[1]);
            default:
                throw new IllegalArgumentException("invalid key");
        }
    }

    private static void validateName(String name) {
        if (name.length() > MAX_NAME_LENGTH) {
            throw new IllegalArgumentException("invalid name (> 63 characters)");
        }
        if (!startsAndEndsAlphanumeric(name)) {
            throw new IllegalArgumentException("invalid name (must start and end with an alphanumeric character)");
        }
        for (char c : name.toCharArray()) {
            if (!isAsciiAlphanumeric(c) && c != '_' && c != '-' && c != '.') {
                throw new IllegalArgumentException("invalid name (invalid character '" + c + "')");
            }
        }
    }

    private static void validatePrefix(String prefix) {
        if (prefix.length() > MAX_PREFIX_LENGTH) {
            throw new IllegalArgumentException("invalid prefix (> 253 characters)");
        }
        for (String label : prefix.split("\\.", -1)) {
            if (label.isEmpty()) {
                throw new IllegalArgumentException("invalid prefix (dns label < 1 character)");
            }
            if (label.length() > MAX_NAME_LENGTH) {
                throw new IllegalArgumentException("invalid prefix (dns label > 63 characters)");
            }
            for (char c : label.toCharArray()) {
                if (!isAsciiAlphanumeric(c) && c != '_' && c != '-') {
                    throw new IllegalArgumentException("invalid prefix (invalid character '" + c + "')");
                }
            }
            if (!startsAndEndsAlphanumeric(label)) {
                throw new IllegalArgumentException(
                        "invalid prefix (must start and end with an alphanumeric character)");
            }
        }
    }

    private static boolean startsAndEndsAlphanumeric(String s) {
        return !s.isEmpty() && isAsciiAlphanumeric(s.charAt(0)) && isAsciiAlphanumeric(s.charAt(s.length() - 1));
    }

    static boolean isAsciiAlphanumeric(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
    }

    public Optional<String> getPrefix() {
        return Optional.ofNullable(prefix);
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MetadataKey)) return false;
        MetadataKey that = (MetadataKey) o;
        return Objects.equals(prefix, that.prefix) && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(prefix, name);
    }

    @Override
    public String toString() {
        return prefix == null ? name : prefix + "/" + name;
    }
}
