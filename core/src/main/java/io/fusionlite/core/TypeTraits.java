package io.fusionlite.core;

import java.util.Objects;

/**
 * Per-type constants for one valid {@link PixelType}.
 * <p>
 * Each constant stands in for a type-specialized instantiation: a strategy
 * family receives the matching {@code TypeTraits<V>} through
 * {@link TypedFactory#create(TypeTraits)} and builds an instance specialized on
 * the Java value class {@code V}.
 * <p>
 * Instances are singletons; compare with {@code ==}.
 */
public final class TypeTraits<V extends Number> {

    public static final TypeTraits<Byte> INT8 =
            new TypeTraits<>(PixelType.INT8, Byte.class, Byte.MIN_VALUE, Byte.MAX_VALUE);
    public static final TypeTraits<Short> UINT8 =
            new TypeTraits<>(PixelType.UINT8, Short.class, 0, 255);
    public static final TypeTraits<Short> INT16 =
            new TypeTraits<>(PixelType.INT16, Short.class, Short.MIN_VALUE, Short.MAX_VALUE);
    public static final TypeTraits<Integer> UINT16 =
            new TypeTraits<>(PixelType.UINT16, Integer.class, 0, 65535);
    public static final TypeTraits<Integer> INT32 =
            new TypeTraits<>(PixelType.INT32, Integer.class, Integer.MIN_VALUE, Integer.MAX_VALUE);
    public static final TypeTraits<Float> FLOAT32 =
            new TypeTraits<>(PixelType.FLOAT32, Float.class, 0, 1);
    public static final TypeTraits<Double> FLOAT64 =
            new TypeTraits<>(PixelType.FLOAT64, Double.class, 0, 1);

    private final PixelType type;
    private final Class<V> valueClass;
    private final double min;
    private final double max;

    private TypeTraits(PixelType type, Class<V> valueClass, double min, double max) {
        this.type = Objects.requireNonNull(type, "type");
        this.valueClass = Objects.requireNonNull(valueClass, "valueClass");
        this.min = min;
        this.max = max;
    }

    /**
     * Traits for a runtime type.
     *
     * @throws UnsupportedTypeException for INVALID or null
     */
    public static TypeTraits<?> of(PixelType type) {
        if (type == null) {
            throw new UnsupportedTypeException("Pixel type must not be null", null);
        }
        return switch (type) {
            case INT8 -> INT8;
            case UINT8 -> UINT8;
            case INT16 -> INT16;
            case UINT16 -> UINT16;
            case INT32 -> INT32;
            case FLOAT32 -> FLOAT32;
            case FLOAT64 -> FLOAT64;
            case INVALID -> throw new UnsupportedTypeException("INVALID has no type traits", type);
        };
    }

    public PixelType type() { return type; }

    /** Java class used to hold one value of this type. */
    public Class<V> valueClass() { return valueClass; }

    public double min() { return min; }

    public double max() { return max; }

    public boolean isInteger() { return type.isIntegerType(); }

    /**
     * Saturate {@code v} into [min, max]; integer types are additionally rounded
     * half away from zero. NaN maps to min.
     */
    public double clamp(double v) {
        if (Double.isNaN(v)) return min;
        double r = isInteger() ? Math.signum(v) * Math.floor(Math.abs(v) + 0.5) : v;
        return Math.max(min, Math.min(max, r));
    }

    @Override public String toString() { return "TypeTraits[" + type + "]"; }
}
