package org.Aayush.scenario.core;

import lombok.Getter;

import java.util.Objects;

/**
 * Reason-coded failure raised by the scenario engine.
 *
 * <p>Every message is prefixed with its reason code, so log lines and HTTP error
 * payloads built from {@link #getMessage()} stay grep-able. Callers that need to
 * branch on the failure should use {@link #getReasonCode()} rather than message text.</p>
 */
@Getter
public class ScenarioEngineException extends RuntimeException {
    private final String reasonCode;

    /**
     * Creates a reason-coded engine failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public ScenarioEngineException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded engine failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public ScenarioEngineException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.reasonCode = requireReasonCode(reasonCode);
    }

    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
