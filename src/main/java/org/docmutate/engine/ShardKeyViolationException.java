package org.docmutate.engine;

/**
 * Reports the first shard key path whose value differs between the pre-image and the post-image.
 */
public final class ShardKeyViolationException extends UpdateException {
    private final String path;

    public ShardKeyViolationException(final String path) {
        super(IdentityFieldImmutableException.CODE_IMMUTABLE_FIELD,
                "ImmutableField",
                "the update would alter the value of shard key field '" + path + "'",
                detail("shardKeyPath", path));
        this.path = path;
    }

    public String path() {
        return path;
    }
}
