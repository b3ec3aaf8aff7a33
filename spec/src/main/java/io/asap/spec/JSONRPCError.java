package io.asap.spec;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.asap.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * The {@code error} member of a JSON-RPC 2.0 error response.
 *
 * @param code the error code; the standard codes are listed in {@link ASAPErrorCodes}
 * @param message short description of the error
 * @param data optional structured details; ASAP errors carry their kind under {@code tag}
 */
public record JSONRPCError(
        @JsonProperty("code") int code,
        @JsonProperty("message") String message,
        @JsonProperty("data") @Nullable Map<String, Object> data) {

    public JSONRPCError {
        Assert.checkNotNullParam("message", message);
    }

    /**
     * Creates an error with the standard message for a code.
     *
     * @param code the JSON-RPC error code
     * @param data optional details
     * @return the error
     */
    public static JSONRPCError fromCode(int code, @Nullable Map<String, Object> data) {
        return new JSONRPCError(code, standardMessage(code), data);
    }

    /**
     * @param code a JSON-RPC error code
     * @return the standard message, or {@code "Unknown error"} for non-standard codes
     */
    public static String standardMessage(int code) {
        return switch (code) {
            case ASAPErrorCodes.JSON_PARSE_ERROR_CODE -> "Parse error";
            case ASAPErrorCodes.INVALID_REQUEST_ERROR_CODE -> "Invalid request";
            case ASAPErrorCodes.METHOD_NOT_FOUND_ERROR_CODE -> "Method not found";
            case ASAPErrorCodes.INVALID_PARAMS_ERROR_CODE -> "Invalid params";
            case ASAPErrorCodes.INTERNAL_ERROR_CODE -> "Internal error";
            default -> "Unknown error";
        };
    }

    /**
     * @return the ASAP error kind from {@code data.tag}, or {@code null}
     */
    public @Nullable String tag() {
        if (data == null) {
            return null;
        }
        return data.get(ASAPErrorTags.TAG_KEY) instanceof String s ? s : null;
    }
}
