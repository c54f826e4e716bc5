package org.Meridian.routing.core;

import lombok.Getter;

import java.util.Objects;

/**
 * Routing contract exception with deterministic reason codes.
 * <p>
 * {@link #REASON_NO_ROUTE_FOUND} is a legitimate query outcome rather than a graph defect;
 * callers separate it from structural failures with {@link #isNoRoute()}.
 */
@Getter
public final class RoutingException extends RuntimeException {
    public static final String REASON_INVALID_COORDINATES = "INVALID_COORDINATES";
    public static final String REASON_GRAPH_CONSTRUCTION = "GRAPH_CONSTRUCTION";
    public static final String REASON_EDGE_NOT_FOUND = "EDGE_NOT_FOUND";
    public static final String REASON_NO_ROUTE_FOUND = "NO_ROUTE_FOUND";
    public static final String REASON_HIERARCHY_MISMATCH = "HIERARCHY_MISMATCH";

    private final String reasonCode;

    /**
     * Creates a reason-coded routing failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public RoutingException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded routing failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public RoutingException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Returns whether this exception reports a disconnected source/target pair.
     */
    public boolean isNoRoute() {
        return REASON_NO_ROUTE_FOUND.equals(reasonCode);
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
