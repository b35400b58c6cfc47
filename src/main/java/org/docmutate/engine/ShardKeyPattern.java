package org.docmutate.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.bson.Document;

/**
 * Ordered field paths whose values decide a document's shard. Built from a key pattern document such as
 * {@code {'s.a': 1, 's.c': 1}}; the pattern values are ignored.
 */
public final class ShardKeyPattern {
    private static final ShardKeyPattern EMPTY = new ShardKeyPattern(List.of());

    private final List<FieldPath> paths;

    private ShardKeyPattern(final List<FieldPath> paths) {
        this.paths = List.copyOf(paths);
    }

    public static ShardKeyPattern empty() {
        return EMPTY;
    }

    public static ShardKeyPattern of(final Document keyPattern) {
        if (keyPattern == null || keyPattern.isEmpty()) {
            return EMPTY;
        }
        final List<FieldPath> paths = new ArrayList<>(keyPattern.size());
        for (final String key : keyPattern.keySet()) {
            paths.add(FieldPath.parse(key));
        }
        return new ShardKeyPattern(paths);
    }

    public List<FieldPath> paths() {
        return paths;
    }

    public boolean isEmpty() {
        return paths.isEmpty();
    }

    /**
     * True when writing {@code target} could change a shard key value: the target is a shard key path, one
     * of its ancestors, or lies beneath it.
     */
    public boolean isAffectedBy(final FieldPath target) {
        Objects.requireNonNull(target, "target");
        for (final FieldPath path : paths) {
            if (path.isRelatedTo(target)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return paths.toString();
    }
}
