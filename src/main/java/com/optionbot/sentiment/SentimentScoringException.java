package com.optionbot.sentiment;

import com.optionbot.core.diagnostics.CauseCode;

public class SentimentScoringException extends Exception {
    private final CauseCode causeCode;

    public SentimentScoringException(CauseCode causeCode, String message) {
        super(message);
        this.causeCode = causeCode == null ? CauseCode.RUNTIME_ERROR : causeCode;
    }

    public SentimentScoringException(CauseCode causeCode, String message, Throwable cause) {
        super(message, cause);
        this.causeCode = causeCode == null ? CauseCode.RUNTIME_ERROR : causeCode;
    }

    public CauseCode causeCode() {
        return causeCode;
    }
}
