package io.fusionlite.core;

/**
 * A {@link PixelType} discriminant has no matching branch in a dispatch table,
 * either because it is {@link PixelType#INVALID} or because the dispatcher was
 * restricted to a subset of types.
 */
public class UnsupportedTypeException extends FusionException {
    private final PixelType type;

    public UnsupportedTypeException(String message, PixelType type) {
        super(message);
        this.type = type;
    }

    /** The rejected discriminant; may be null if null was dispatched. */
    public PixelType type() {
        return type;
    }
}
