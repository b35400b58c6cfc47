package org.docmutate.engine;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.bson.Document;

/**
 * Deep copy and structural equality over the document value model.
 *
 * <p>Objects compare by key set and values regardless of key order, arrays compare element by element in
 * order, and scalars compare by type and value, so {@code 1} and {@code 1L} are different values.
 */
final class DocumentValues {
    private DocumentValues() {}

    static Document copy(final Map<?, ?> source) {
        Objects.requireNonNull(source, "source");

        final Document copy = new Document();
        for (final Map.Entry<?, ?> entry : source.entrySet()) {
            copy.put(String.valueOf(entry.getKey()), copyAny(entry.getValue()));
        }
        return copy;
    }

    static Object copyAny(final Object value) {
        if (value instanceof Map<?, ?> map) {
            return copy(map);
        }
        if (value instanceof List<?> input) {
            final List<Object> output = new ArrayList<>(input.size());
            for (final Object item : input) {
                output.add(copyAny(item));
            }
            return output;
        }
        if (value instanceof byte[] bytes) {
            return bytes.clone();
        }
        if (value instanceof Date date) {
            return new Date(date.getTime());
        }
        return value;
    }

    static boolean equivalent(final Object left, final Object right) {
        if (left == right) {
            return true;
        }
        if (left == null || right == null) {
            return false;
        }
        if (left instanceof Map<?, ?> leftMap) {
            if (!(right instanceof Map<?, ?> rightMap) || leftMap.size() != rightMap.size()) {
                return false;
            }
            for (final Map.Entry<?, ?> entry : leftMap.entrySet()) {
                final Object key = entry.getKey();
                if (!rightMap.containsKey(key) || !equivalent(entry.getValue(), rightMap.get(key))) {
                    return false;
                }
            }
            return true;
        }
        if (left instanceof List<?> leftList) {
            if (!(right instanceof List<?> rightList) || leftList.size() != rightList.size()) {
                return false;
            }
            for (int i = 0; i < leftList.size(); i++) {
                if (!equivalent(leftList.get(i), rightList.get(i))) {
                    return false;
                }
            }
            return true;
        }
        if (left.getClass() != right.getClass()) {
            return false;
        }
        if (left instanceof byte[] leftBytes) {
            return Arrays.equals(leftBytes, (byte[]) right);
        }
        return left.equals(right);
    }
}
