package com.optionbot.pricing;

import java.util.List;

public final class PricingSelfTestException extends RuntimeException {
    private final List<String> failures;

    public PricingSelfTestException(List<String> failures) {
        super("pricing self-test failed: " + String.join("; ", failures == null ? List.of() : failures));
        this.failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public List<String> failures() {
        return failures;
    }
}
