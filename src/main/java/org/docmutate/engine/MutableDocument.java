package org.docmutate.engine;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.bson.Document;

/**
 * Owned, mutable tree built from a document for the duration of one update.
 *
 * <p>Nodes are reached by field name or array index from the root, never through references kept outside
 * the tree, so inserting containers mid-path cannot alias or orphan anything. Values entering the tree are
 * copied, and {@link #toDocument()} copies them back out.
 */
final class MutableDocument {
    // Writing far past the end of an array would otherwise allocate an arbitrary amount of null padding.
    static final int MAX_PADDING = 1_500_000;

    private final ObjectNode root;

    private MutableDocument(final ObjectNode root) {
        this.root = root;
    }

    static MutableDocument of(final Document document) {
        Objects.requireNonNull(document, "document");
        return new MutableDocument((ObjectNode) Node.fromValue(document));
    }

    Document toDocument() {
        return root.toValue();
    }

    /**
     * Resolves the parent container of {@code path}, creating missing intermediate containers on the way.
     * A missing container becomes an array when the next part is numeric and an object otherwise.
     */
    Slot resolveForWrite(final FieldPath path) {
        Node container = root;
        for (int i = 0; i < path.numParts() - 1; i++) {
            final String part = path.part(i);
            final Slot step = Slot.of(container, part, path);
            final Node child = step.get();
            if (child == null) {
                final Node created = path.isNumericPart(i + 1) ? new ArrayNode() : new ObjectNode();
                step.set(created);
                container = created;
                continue;
            }
            if (child instanceof ScalarNode) {
                throw new PathConflictException(
                        path.dottedField(),
                        part,
                        "cannot create field '" + path.part(i + 1) + "' in element {" + part + ": "
                                + ((ScalarNode) child).describe() + "}");
            }
            container = child;
        }
        return Slot.of(container, path.leaf(), path);
    }

    /**
     * Resolves the parent container of {@code path} without creating anything.
     *
     * @return the leaf slot, or {@code null} when an intermediate container is missing
     */
    Slot resolveExisting(final FieldPath path) {
        Node container = root;
        for (int i = 0; i < path.numParts() - 1; i++) {
            final String part = path.part(i);
            final Node child = Slot.of(container, part, path).get();
            if (child == null) {
                return null;
            }
            if (child instanceof ScalarNode) {
                throw new PathConflictException(
                        path.dottedField(),
                        part,
                        "cannot use the part (" + path.part(i + 1) + " of " + path.dottedField()
                                + ") to traverse the element {" + part + ": " + ((ScalarNode) child).describe() + "}");
            }
            container = child;
        }
        return Slot.of(container, path.leaf(), path);
    }

    Node lookup(final FieldPath path) {
        final Slot slot = resolveExisting(path);
        return slot == null ? null : slot.get();
    }

    abstract static class Node {
        abstract Object toValue();

        static Node fromValue(final Object value) {
            if (value instanceof Map<?, ?> map) {
                final ObjectNode node = new ObjectNode();
                for (final Map.Entry<?, ?> entry : map.entrySet()) {
                    node.fields.put(String.valueOf(entry.getKey()), fromValue(entry.getValue()));
                }
                return node;
            }
            if (value instanceof List<?> list) {
                final ArrayNode node = new ArrayNode();
                for (final Object item : list) {
                    node.elements.add(fromValue(item));
                }
                return node;
            }
            return new ScalarNode(DocumentValues.copyAny(value));
        }
    }

    static final class ObjectNode extends Node {
        private final Map<String, Node> fields = new LinkedHashMap<>();

        @Override
        Document toValue() {
            final Document document = new Document();
            for (final Map.Entry<String, Node> entry : fields.entrySet()) {
                document.put(entry.getKey(), entry.getValue().toValue());
            }
            return document;
        }
    }

    static final class ArrayNode extends Node {
        private final List<Node> elements = new ArrayList<>();

        void append(final Node node) {
            elements.add(node);
        }

        /**
         * Keeps {@code window} elements from the start when positive, from the end when negative.
         */
        void truncateToWindow(final int window) {
            final int keep = Math.min(Math.abs(window), elements.size());
            if (window >= 0) {
                elements.subList(keep, elements.size()).clear();
            } else {
                elements.subList(0, elements.size() - keep).clear();
            }
        }

        List<Node> elements() {
            return elements;
        }

        @Override
        List<Object> toValue() {
            final List<Object> values = new ArrayList<>(elements.size());
            for (final Node element : elements) {
                values.add(element.toValue());
            }
            return values;
        }
    }

    static final class ScalarNode extends Node {
        private final Object value;

        ScalarNode(final Object value) {
            this.value = value;
        }

        Object value() {
            return value;
        }

        @Override
        Object toValue() {
            return DocumentValues.copyAny(value);
        }

        String describe() {
            return value instanceof String ? "\"" + value + "\"" : String.valueOf(value);
        }
    }

    /**
     * A named position inside a container: a field of an object or an index of an array.
     */
    static final class Slot {
        private final Node container;
        private final String part;
        private final int index;
        private final FieldPath path;

        private Slot(final Node container, final String part, final int index, final FieldPath path) {
            this.container = container;
            this.part = part;
            this.index = index;
            this.path = path;
        }

        static Slot of(final Node container, final String part, final FieldPath path) {
            if (container instanceof ArrayNode) {
                if (!FieldPath.isNumeric(part)) {
                    throw new PathConflictException(
                            path.dottedField(),
                            part,
                            "cannot use the part (" + part + " of " + path.dottedField()
                                    + ") to traverse an array element");
                }
                final int index;
                try {
                    index = Integer.parseInt(part);
                } catch (final NumberFormatException exception) {
                    throw new PathConflictException(
                            path.dottedField(), part, "array index '" + part + "' is out of range");
                }
                return new Slot(container, part, index, path);
            }
            return new Slot(container, part, -1, path);
        }

        String part() {
            return part;
        }

        boolean isArrayElement() {
            return container instanceof ArrayNode;
        }

        Node get() {
            if (container instanceof ArrayNode array) {
                return index < array.elements.size() ? array.elements.get(index) : null;
            }
            return ((ObjectNode) container).fields.get(part);
        }

        void set(final Node node) {
            if (container instanceof ArrayNode array) {
                final List<Node> elements = array.elements;
                if (index - elements.size() > MAX_PADDING) {
                    throw new PathConflictException(
                            path.dottedField(),
                            part,
                            "can't pad array to index " + index + ", at most " + MAX_PADDING + " nulls may be added");
                }
                while (elements.size() < index) {
                    elements.add(new ScalarNode(null));
                }
                if (index < elements.size()) {
                    elements.set(index, node);
                } else {
                    elements.add(node);
                }
                return;
            }
            ((ObjectNode) container).fields.put(part, node);
        }

        /**
         * Removes an object field, or nulls out an array element so later positions keep their indexes.
         *
         * @return whether anything was present
         */
        boolean remove() {
            if (container instanceof ArrayNode array) {
                if (index >= array.elements.size()) {
                    return false;
                }
                final Node current = array.elements.get(index);
                if (current instanceof ScalarNode scalar && scalar.value == null) {
                    return false;
                }
                array.elements.set(index, new ScalarNode(null));
                return true;
            }
            return ((ObjectNode) container).fields.remove(part) != null;
        }
    }
}
