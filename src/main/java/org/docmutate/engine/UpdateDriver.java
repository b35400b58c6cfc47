package org.docmutate.engine;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.bson.Document;
import org.docmutate.obs.CorrelationContext;
import org.docmutate.obs.JsonLinesLogger;

/**
 * Entry point of the update path: parses an update specification once, applies it to any number of target
 * documents, and checks that shard key values survived.
 *
 * <p>A driver is not thread-safe. The {@link ParsedUpdate} it holds is immutable and may be shared, but the
 * shard key pattern, the update context and the {@link #modsAffectShardKeys()} and {@link #docWasModified()}
 * flags are plain fields rewritten by every call. The flags describe the most recent
 * {@link #update(String, Document)} on this instance; concurrent callers need one driver each.
 */
public final class UpdateDriver {
    private final Options options;
    private final JsonLinesLogger logger;

    private ShardKeyPattern shardKeyPattern;
    private UpdateContext context;
    private ParsedUpdate parsed;
    private boolean modsAffectShardKeys;
    private boolean docWasModified;

    public UpdateDriver(final Options options) {
        this.options = Objects.requireNonNull(options, "options");
        this.logger = options.logger();
        this.shardKeyPattern = ShardKeyPattern.of(options.shardKeyPattern());
        this.context = options.context();
    }

    /**
     * Parses {@code spec}, replacing any previously parsed specification. After a failure the driver holds
     * no specification and cannot update.
     */
    public void parse(final Document spec) {
        parsed = null;
        try {
            parsed = UpdateSpecParser.parse(spec);
        } catch (final UpdateParseException exception) {
            logger.warn("update specification rejected", correlation("parse"), failureFields(exception));
            throw exception;
        }

        final Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("replacement", parsed.isReplacement());
        fields.put("numMods", parsed.numMods());
        logger.debug("update specification parsed", correlation("parse"), fields);
    }

    public int numMods() {
        return parsed == null ? 0 : parsed.numMods();
    }

    public boolean isDocReplacement() {
        return parsed != null && parsed.isReplacement();
    }

    public ParsedUpdate parsedUpdate() {
        return parsed;
    }

    public void refreshShardKeyPattern(final Document keyPattern) {
        this.shardKeyPattern = ShardKeyPattern.of(keyPattern);
    }

    public ShardKeyPattern shardKeyPattern() {
        return shardKeyPattern;
    }

    public void setContext(final UpdateContext context) {
        this.context = Objects.requireNonNull(context, "context");
    }

    public UpdateContext context() {
        return context;
    }

    /**
     * Applies the parsed specification to {@code target} and returns the mutated copy; {@code target}
     * itself is left untouched.
     *
     * @param matchedField array index matched by the query, substituted for a positional {@code $} part;
     *     may be {@code null} or empty when the specification has no positional path
     */
    public Document update(final String matchedField, final Document target) {
        if (parsed == null) {
            throw new IllegalStateException("update requires a successfully parsed specification");
        }
        Objects.requireNonNull(target, "target");
        modsAffectShardKeys = false;
        docWasModified = false;

        final ModifierApplier.ApplyResult result;
        try {
            result = ModifierApplier.apply(
                    parsed, target, matchedField, context, shardKeyPattern, options.identityField());
        } catch (final UpdateApplyException exception) {
            logger.warn("update could not be applied to document", correlation("update"), failureFields(exception));
            throw exception;
        }

        modsAffectShardKeys = result.affectsShardKeys();
        docWasModified = !DocumentValues.equivalent(target, result.document());
        return result.document();
    }

    /**
     * Conservative hint from the last update: true when some applied operation touched a path related to a
     * shard key, even if the final value ended up unchanged.
     */
    public boolean modsAffectShardKeys() {
        return modsAffectShardKeys;
    }

    public boolean docWasModified() {
        return docWasModified;
    }

    /**
     * Compares every shard key value of {@code preImage} with {@code postImage}.
     *
     * @throws ShardKeyViolationException naming the first shard key path whose value differs
     */
    public void checkShardKeysUnaltered(final Document preImage, final Document postImage) {
        try {
            ShardKeyChecker.checkUnaltered(shardKeyPattern, preImage, postImage);
        } catch (final ShardKeyViolationException exception) {
            logger.error("update would alter a shard key", correlation("checkShardKeys"), failureFields(exception));
            throw exception;
        }
    }

    private CorrelationContext correlation(final String operation) {
        return CorrelationContext.builder(options.requestId(), operation)
                .namespace(options.namespace())
                .build();
    }

    private static Map<String, Object> failureFields(final UpdateException exception) {
        final Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("code", exception.code());
        fields.put("codeName", exception.codeName());
        fields.put("error", exception.getMessage());
        fields.putAll(exception.details());
        return fields;
    }

    /**
     * Construction-time settings of an {@link UpdateDriver}.
     */
    public static final class Options {
        public static final String DEFAULT_IDENTITY_FIELD = "_id";
        public static final String DEFAULT_REQUEST_ID = "update";

        private final Document shardKeyPattern;
        private final String identityField;
        private final UpdateContext context;
        private final JsonLinesLogger logger;
        private final String requestId;
        private final String namespace;

        private Options(final Builder builder) {
            this.shardKeyPattern = builder.shardKeyPattern == null ? null : DocumentValues.copy(builder.shardKeyPattern);
            this.identityField = builder.identityField;
            this.context = Objects.requireNonNull(builder.context, "context");
            this.logger = Objects.requireNonNull(builder.logger, "logger");
            this.requestId = requireText(builder.requestId, "requestId");
            this.namespace = builder.namespace;
        }

        public static Options defaults() {
            return builder().build();
        }

        public static Builder builder() {
            return new Builder();
        }

        public Document shardKeyPattern() {
            return shardKeyPattern == null ? null : DocumentValues.copy(shardKeyPattern);
        }

        /**
         * Name of the top-level field that updates may not change, or {@code null} when none is protected.
         */
        public String identityField() {
            return identityField;
        }

        public UpdateContext context() {
            return context;
        }

        public JsonLinesLogger logger() {
            return logger;
        }

        public String requestId() {
            return requestId;
        }

        public String namespace() {
            return namespace;
        }

        private static String requireText(final String value, final String fieldName) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(fieldName + " must not be blank");
            }
            return value.trim();
        }

        public static final class Builder {
            private Document shardKeyPattern;
            private String identityField = DEFAULT_IDENTITY_FIELD;
            private UpdateContext context = UpdateContext.UPDATE;
            private JsonLinesLogger logger = JsonLinesLogger.noop();
            private String requestId = DEFAULT_REQUEST_ID;
            private String namespace;

            private Builder() {
            }

            public Builder shardKeyPattern(final Document shardKeyPattern) {
                this.shardKeyPattern = shardKeyPattern;
                return this;
            }

            public Builder identityField(final String identityField) {
                this.identityField = identityField;
                return this;
            }

            public Builder context(final UpdateContext context) {
                this.context = context;
                return this;
            }

            public Builder logger(final JsonLinesLogger logger) {
                this.logger = logger;
                return this;
            }

            public Builder requestId(final String requestId) {
                this.requestId = requestId;
                return this;
            }

            public Builder namespace(final String namespace) {
                this.namespace = namespace;
                return this;
            }

            public Options build() {
                return new Options(this);
            }
        }
    }
}
