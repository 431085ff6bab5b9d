package com.phillippitts.voiceanalysis.domain;

import java.util.Objects;

/**
 * User-defined label attached to analyses. Two tags are equal when their names match.
 *
 * @param id   store-assigned id, {@code null} before first persist
 * @param name trimmed, non-blank tag name
 */
public record Tag(Long id, String name) {

    public Tag {
        Objects.requireNonNull(name, "Tag name must not be null");
        name = name.trim();
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Tag name must not be blank");
        }
    }

    public static Tag named(String name) {
        return new Tag(null, name);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Tag other && name.equals(other.name));
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }
}
