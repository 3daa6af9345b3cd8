package org.walknav.routing.error;

import lombok.AccessLevel;
import lombok.Getter;

import java.util.Objects;
import java.util.Optional;

/**
 * Base of all reason-coded route query failures.
 *
 * <p>{@link #getMessage()} carries the deterministic {@code [REASON] detail} form; the raw
 * detail is kept separately for user-facing translation.</p>
 */
@Getter
public abstract class RoutingException extends RuntimeException {
    private final RoutingErrorKind kind;
    private final String reasonCode;
    private final String detail;
    @Getter(AccessLevel.NONE)
    private final Endpoint endpoint;

    protected RoutingException(RoutingErrorKind kind, String reasonCode, Endpoint endpoint, String detail) {
        this(kind, reasonCode, endpoint, detail, null);
    }

    protected RoutingException(
            RoutingErrorKind kind,
            String reasonCode,
            Endpoint endpoint,
            String detail,
            Throwable cause
    ) {
        super(formatMessage(reasonCode, detail), cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.reasonCode = requireReasonCode(reasonCode);
        this.detail = detail;
        this.endpoint = endpoint;
    }

    /**
     * Failing endpoint, when the failure concerns only one side of the request.
     */
    public Optional<Endpoint> endpoint() {
        return Optional.ofNullable(endpoint);
    }

    private static String formatMessage(String reasonCode, String detail) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(detail, "detail");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
