package org.docmutate.engine;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.bson.Document;

/**
 * Confirms that an update left every shard key value unchanged, judged by value equality between the
 * pre-image and the post-image rather than by which paths the update touched.
 */
final class ShardKeyChecker {
    /** Reading of a path that does not exist; distinct from every present value, null included. */
    static final Object ABSENT = new Object() {
        @Override
        public String toString() {
            return "<absent>";
        }
    };

    private ShardKeyChecker() {}

    static void checkUnaltered(final ShardKeyPattern pattern, final Document preImage, final Document postImage) {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(preImage, "preImage");
        Objects.requireNonNull(postImage, "postImage");

        for (final FieldPath path : pattern.paths()) {
            final Object before = extract(preImage, path);
            final Object after = extract(postImage, path);
            if (before == ABSENT || after == ABSENT) {
                if (before != after) {
                    throw new ShardKeyViolationException(path.dottedField());
                }
                continue;
            }
            if (!DocumentValues.equivalent(before, after)) {
                throw new ShardKeyViolationException(path.dottedField());
            }
        }
    }

    /**
     * Value at {@code path}, following numeric parts into arrays, or {@link #ABSENT}.
     */
    static Object extract(final Document document, final FieldPath path) {
        Object current = document;
        for (int i = 0; i < path.numParts(); i++) {
            final String part = path.part(i);
            if (current instanceof Map<?, ?> map) {
                if (!map.containsKey(part)) {
                    return ABSENT;
                }
                current = map.get(part);
            } else if (current instanceof List<?> list && path.isNumericPart(i)) {
                final int index = parseIndex(part);
                if (index < 0 || index >= list.size()) {
                    return ABSENT;
                }
                current = list.get(index);
            } else {
                return ABSENT;
            }
        }
        return current;
    }

    private static int parseIndex(final String part) {
        try {
            return Integer.parseInt(part);
        } catch (final NumberFormatException exception) {
            return -1;
        }
    }
}
