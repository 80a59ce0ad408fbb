package com.codeflag.common.message;

/**
 * Values of {@link ResultMessage#status()}.
 *
 * Plain strings rather than an enum: the HTTP error status embeds the
 * upstream code ({@code piston_http_error_502}) and consumers must tolerate
 * values they do not know.
 */
public final class ResultStatus {

    public static final String SUCCESS                 = "success";
    public static final String ERROR                   = "error";
    public static final String UNSUPPORTED_LANGUAGE    = "unsupported_language";
    public static final String PISTON_TIMEOUT          = "piston_timeout";
    public static final String PISTON_CONNECTION_ERROR = "piston_connection_error";
    public static final String PISTON_RATE_LIMITED     = "piston_rate_limited";
    public static final String PISTON_API_ERROR_RETRY  = "piston_api_error_retry";
    public static final String PISTON_RESPONSE_ERROR   = "piston_response_error";
    public static final String FEEDER_ERROR            = "feeder_error";
    public static final String FEEDER_PROCESSING_ERROR = "feeder_processing_error";

    private static final String HTTP_ERROR_PREFIX = "piston_http_error_";

    private ResultStatus() {}

    public static String httpError(int statusCode) {
        return HTTP_ERROR_PREFIX + statusCode;
    }
}
