package com.vibeflows.dataserver.core;

/**
 * Domain-level failure reported back to the caller as a value.
 */
public sealed interface GatewayError
        permits GatewayError.ValidationError,
                GatewayError.NotFoundError,
                GatewayError.ForbiddenError,
                GatewayError.RegistrationError {

    String code();

    String message();

    /** Malformed input or a duplicate key. Never worth retrying. */
    record ValidationError(String code, String message) implements GatewayError {
    }

    record NotFoundError(String code, String message) implements GatewayError {
    }

    /** The actor is not allowed to perform the operation on this document. */
    record ForbiddenError(String code, String message) implements GatewayError {
    }

    /** An agent registration did not take effect. */
    record RegistrationError(String code, String message) implements GatewayError {
    }
}
