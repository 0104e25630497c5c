package com.optionbot.data;

import com.optionbot.data.http.HttpStatusException;
import com.optionbot.model.ScanFailureReason;
import org.json.JSONException;

import java.net.http.HttpTimeoutException;

/**
 * Upstream fetch failure tagged with the reason reported on a skipped ticker.
 */
public class DataFetchException extends Exception {
    private final ScanFailureReason reason;

    public DataFetchException(ScanFailureReason reason, String message) {
        super(message);
        this.reason = reason == null ? ScanFailureReason.OTHER : reason;
    }

    public DataFetchException(ScanFailureReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason == null ? ScanFailureReason.OTHER : reason;
    }

    public ScanFailureReason reason() {
        return reason;
    }

    /**
     * Maps a transport or parse error to a failure reason; {@code notFound} is used for HTTP 404.
     */
    public static DataFetchException classify(String what, Throwable error, ScanFailureReason notFound) {
        if (error instanceof DataFetchException) {
            return (DataFetchException) error;
        }
        ScanFailureReason reason = ScanFailureReason.OTHER;
        if (error instanceof HttpTimeoutException) {
            reason = ScanFailureReason.TIMEOUT;
        } else if (error instanceof HttpStatusException) {
            int status = ((HttpStatusException) error).statusCode();
            if (status == 429) {
                reason = ScanFailureReason.RATE_LIMIT;
            } else if (status == 404) {
                reason = notFound;
            }
        } else if (error instanceof JSONException || error instanceof IllegalArgumentException) {
            reason = ScanFailureReason.PARSE_ERROR;
        } else if (error instanceof InterruptedException) {
            reason = ScanFailureReason.CANCELLED;
        }
        String message = error == null || error.getMessage() == null ? "" : ": " + error.getMessage();
        return new DataFetchException(reason, what + " failed" + message, error);
    }
}
