// file: core/src/main/java/io/fusionlite/core/PixelType.java
package io.fusionlite.core;

import java.util.Locale;

/**
 * Runtime pixel data type of an image.
 * <p>
 * This is the discriminant used to pick a type-specialized strategy at runtime
 * (see {@link TypeDispatch}). The set is closed:
 *  - INT8 .. INT32:      signed/unsigned integer types, value range of the Java equivalent.
 *  - FLOAT32, FLOAT64:   floating point, normalized to [0, 1].
 *  - INVALID:            marks an unknown type; only valid for comparison, never dispatched.
 */
public enum PixelType {
    INT8, UINT8, INT16, UINT16, INT32, FLOAT32, FLOAT64, INVALID;

    public boolean isIntegerType() {
        return switch (this) {
            case INT8, UINT8, INT16, UINT16, INT32 -> true;
            default -> false;
        };
    }

    /** Bytes per value; 0 for INVALID. */
    public int byteSize() {
        return switch (this) {
            case INT8, UINT8 -> 1;
            case INT16, UINT16 -> 2;
            case INT32, FLOAT32 -> 4;
            case FLOAT64 -> 8;
            case INVALID -> 0;
        };
    }

    /**
     * Parse a type name case-insensitively, e.g. "uint16" or "FLOAT32".
     *
     * @throws UnsupportedTypeException for unknown names and for "invalid"
     */
    public static PixelType parse(String name) {
        if (name == null || name.isBlank()) {
            throw new UnsupportedTypeException("Pixel type name must not be blank", null);
        }
        PixelType t;
        try {
            t = PixelType.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new UnsupportedTypeException("Unknown pixel type: " + name, null);
        }
        if (t == INVALID) {
            throw new UnsupportedTypeException("INVALID is not a usable pixel type", t);
        }
        return t;
    }
}
