package com.optionbot.core.diagnostics;

/**
 * Resolved availability of an optional feature (the headline classifier) together with the cause
 * when it is off. Rendered into the run summary as {@code key=STATUS cause=... msg=...}.
 */
public final class FeatureResolution {
    public enum Status {
        ENABLED,
        DISABLED_BY_CONFIG,
        DISABLED_NOT_IMPLEMENTED,
        DISABLED_RUNTIME_ERROR
    }

    public final String featureKey;
    public final Status status;
    public final CauseCode causeCode;
    public final String message;
    public final String errorClass;

    private FeatureResolution(String featureKey, Status status, CauseCode causeCode, String message, String errorClass) {
        this.featureKey = featureKey == null ? "" : featureKey;
        this.status = status;
        this.causeCode = causeCode == null ? CauseCode.NONE : causeCode;
        this.message = message == null ? "" : message;
        this.errorClass = errorClass == null ? "" : errorClass;
    }

    /**
     * Config switch first, then presence of an implementation; a feature that passes both is enabled.
     */
    public static FeatureResolution resolve(String featureKey, boolean enabledByConfig, boolean implementationPresent) {
        if (!enabledByConfig) {
            return new FeatureResolution(featureKey, Status.DISABLED_BY_CONFIG,
                    CauseCode.FEATURE_DISABLED_BY_CONFIG, "disabled by config", "");
        }
        if (!implementationPresent) {
            return new FeatureResolution(featureKey, Status.DISABLED_NOT_IMPLEMENTED,
                    CauseCode.FEATURE_NOT_IMPLEMENTED, "no classifier available", "");
        }
        return new FeatureResolution(featureKey, Status.ENABLED, CauseCode.NONE, "enabled", "");
    }

    public static FeatureResolution failed(String featureKey, Throwable error, CauseCode cause) {
        String message = error == null || error.getMessage() == null ? "runtime error" : error.getMessage();
        return new FeatureResolution(
                featureKey,
                Status.DISABLED_RUNTIME_ERROR,
                cause == null ? CauseCode.FEATURE_RUNTIME_ERROR : cause,
                message,
                error == null ? "" : error.getClass().getSimpleName());
    }

    public boolean enabled() {
        return status == Status.ENABLED;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(featureKey).append('=').append(status);
        if (causeCode != CauseCode.NONE) {
            sb.append(" cause=").append(causeCode);
        }
        if (status != Status.ENABLED && !message.isEmpty()) {
            sb.append(" msg=").append(message);
        }
        return sb.toString();
    }
}
