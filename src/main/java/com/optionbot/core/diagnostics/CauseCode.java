package com.optionbot.core.diagnostics;

public enum CauseCode {
    NONE,
    FEATURE_DISABLED_BY_CONFIG,
    FEATURE_NOT_IMPLEMENTED,
    FEATURE_RUNTIME_ERROR,
    CLASSIFIER_INIT_FAILED,
    CLASSIFIER_TIMEOUT,
    CLASSIFIER_BAD_REPLY,
    RUNTIME_ERROR
}
