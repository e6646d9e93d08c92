package com.sretoolbox.scheduler.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

/**
 * Error body for every non-2xx API answer: a stable machine code plus a human-readable detail.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    String error;
    String detail;

    public static ErrorResponse notFound(String detail) {
        return new ErrorResponse("not_found", detail);
    }

    public static ErrorResponse badRequest(String detail) {
        return new ErrorResponse("bad_request", detail);
    }

    public static ErrorResponse methodNotAllowed(String method) {
        return new ErrorResponse("method_not_allowed", method + " is not supported here");
    }

    public static ErrorResponse queueUnavailable(String detail) {
        return new ErrorResponse("queue_unavailable", detail);
    }

    // detail stays generic; the cause is in the server log
    public static ErrorResponse internal() {
        return new ErrorResponse("internal_error", "unexpected server error");
    }
}
