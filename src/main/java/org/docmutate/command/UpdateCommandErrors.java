package org.docmutate.command;

import java.util.Map;
import org.bson.BsonBoolean;
import org.bson.BsonDocument;
import org.bson.BsonDouble;
import org.bson.BsonInt32;
import org.bson.BsonInt64;
import org.bson.BsonNull;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.docmutate.engine.ShardKeyViolationException;
import org.docmutate.engine.UpdateApplyException;
import org.docmutate.engine.UpdateException;
import org.docmutate.engine.UpdateParseException;

/**
 * Maps update failures to wire-compatible command error envelopes:
 * {@code {ok: 0, errmsg, code, codeName, errInfo}}.
 */
public final class UpdateCommandErrors {
    private static final int CODE_INVALID_ARGUMENT = 14;

    private UpdateCommandErrors() {}

    public static BsonDocument fromException(final UpdateException exception) {
        final BsonDocument errInfo = new BsonDocument("stage", new BsonString(stageOf(exception)));
        for (final Map.Entry<String, Object> detail : exception.details().entrySet()) {
            errInfo.append(detail.getKey(), toBsonValue(detail.getValue()));
        }
        return error(exception.getMessage(), exception.code(), exception.codeName()).append("errInfo", errInfo);
    }

    /**
     * Envelope for argument errors raised outside the update grammar, e.g. a null specification.
     */
    public static BsonDocument fromIllegalArgument(final IllegalArgumentException exception) {
        final String message = exception.getMessage();
        if (message == null || message.isBlank()) {
            return error("invalid argument", CODE_INVALID_ARGUMENT, "BadValue");
        }
        return error(message, CODE_INVALID_ARGUMENT, "BadValue");
    }

    private static String stageOf(final UpdateException exception) {
        if (exception instanceof UpdateParseException) {
            return "parse";
        }
        if (exception instanceof UpdateApplyException) {
            return "apply";
        }
        if (exception instanceof ShardKeyViolationException) {
            return "shardKeyCheck";
        }
        return "update";
    }

    private static BsonDocument error(final String message, final int code, final String codeName) {
        return new BsonDocument()
                .append("ok", new BsonDouble(0.0))
                .append("errmsg", new BsonString(message))
                .append("code", new BsonInt32(code))
                .append("codeName", new BsonString(codeName));
    }

    private static BsonValue toBsonValue(final Object value) {
        if (value == null) {
            return BsonNull.VALUE;
        }
        if (value instanceof Integer integer) {
            return new BsonInt32(integer);
        }
        if (value instanceof Long longValue) {
            return new BsonInt64(longValue);
        }
        if (value instanceof Boolean bool) {
            return BsonBoolean.valueOf(bool);
        }
        return new BsonString(String.valueOf(value));
    }
}
