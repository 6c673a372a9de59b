package io.fusionlite.core;

/**
 * Base of all errors raised by the fusion-lite core.
 * <p>
 * Unchecked on purpose: callers either guard with a query first
 * (for example {@code has} before {@code get}) or let the failure surface.
 */
public class FusionException extends RuntimeException {

    public FusionException(String message) {
        super(message);
    }

    public FusionException(String message, Throwable cause) {
        super(message, cause);
    }
}
