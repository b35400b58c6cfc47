package org.docmutate.engine;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable dotted path into a document, e.g. {@code s.a.0}.
 *
 * <p>Parts are kept verbatim. A part made only of digits may address an array element; a part equal to
 * {@code $} is the positional placeholder that is resolved against the matched array index at update time.
 */
public final class FieldPath implements Comparable<FieldPath> {
    public static final String POSITIONAL_PART = "$";

    private final String[] parts;

    private FieldPath(final String[] parts) {
        this.parts = parts;
    }

    public static FieldPath parse(final String dottedField) {
        if (dottedField == null || dottedField.isBlank()) {
            throw new InvalidPathException(dottedField, "field path must not be blank");
        }
        final String[] parts = dottedField.split("\\.", -1);
        for (final String part : parts) {
            if (part.isEmpty()) {
                throw new InvalidPathException(dottedField, "field path must not contain empty parts");
            }
        }
        return new FieldPath(parts);
    }

    public static FieldPath of(final List<String> parts) {
        Objects.requireNonNull(parts, "parts");
        if (parts.isEmpty()) {
            throw new InvalidPathException("", "field path must not be blank");
        }
        return parse(String.join(".", parts));
    }

    public int numParts() {
        return parts.length;
    }

    public String part(final int index) {
        return parts[index];
    }

    public String leaf() {
        return parts[parts.length - 1];
    }

    public boolean isNumericPart(final int index) {
        return isNumeric(parts[index]);
    }

    public String dottedField() {
        return String.join(".", parts);
    }

    /**
     * Index of the positional {@code $} part, or -1 when the path has none.
     */
    public int positionalPart() {
        for (int i = 0; i < parts.length; i++) {
            if (POSITIONAL_PART.equals(parts[i])) {
                return i;
            }
        }
        return -1;
    }

    public FieldPath withPositional(final String matchedField) {
        final int positional = positionalPart();
        if (positional < 0) {
            return this;
        }
        final String[] resolved = parts.clone();
        resolved[positional] = matchedField;
        return new FieldPath(resolved);
    }

    public int commonPrefixSize(final FieldPath other) {
        final int limit = Math.min(parts.length, other.parts.length);
        int size = 0;
        while (size < limit && parts[size].equals(other.parts[size])) {
            size++;
        }
        return size;
    }

    /**
     * True when this path equals {@code other} or is one of its ancestors.
     */
    public boolean isPrefixOf(final FieldPath other) {
        return parts.length <= other.parts.length && commonPrefixSize(other) == parts.length;
    }

    public boolean isRelatedTo(final FieldPath other) {
        return isPrefixOf(other) || other.isPrefixOf(this);
    }

    @Override
    public int compareTo(final FieldPath other) {
        final int limit = Math.min(parts.length, other.parts.length);
        for (int i = 0; i < limit; i++) {
            final int cmp = parts[i].compareTo(other.parts[i]);
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(parts.length, other.parts.length);
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof FieldPath)) {
            return false;
        }
        return Arrays.equals(parts, ((FieldPath) other).parts);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(parts);
    }

    @Override
    public String toString() {
        return dottedField();
    }

    /**
     * Array index form: ASCII digits without a leading zero, so that every index has exactly one spelling.
     */
    static boolean isNumeric(final String part) {
        if (part.isEmpty() || (part.length() > 1 && part.charAt(0) == '0')) {
            return false;
        }
        for (int i = 0; i < part.length(); i++) {
            final char c = part.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}
