package com.tapelibrary.inventory.domain;

/**
 * Absolute, slash separated logical path stored in the path index.
 *
 * <p>A trailing slash is dropped so {@code /backup/2024/} and {@code /backup/2024} name the
 * same entry. Empty segments and the root itself are rejected.
 */
public record PathName(String value) {

    public PathName {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Path must not be blank");
        }
        if (!value.startsWith("/")) {
            throw new IllegalArgumentException("Path must be absolute: " + value);
        }
        if (value.length() > 1 && value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        if (value.equals("/")) {
            throw new IllegalArgumentException("The root path cannot be mapped to a volume");
        }
        if (value.contains("//")) {
            throw new IllegalArgumentException("Path must not contain empty segments: " + value);
        }
    }

    public static PathName of(String value) {
        return new PathName(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
