// file: core/src/main/java/io/fusionlite/core/TypeDispatch.java
package io.fusionlite.core;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Maps a runtime {@link PixelType} onto the matching {@link TypeTraits} constant
 * and invokes a {@link TypedFactory} with it.
 * <p>
 * The table is exhaustive over the closed enum: adding a constant to
 * {@link PixelType} without a branch in {@link TypeTraits#of(PixelType)} does not
 * compile. Dispatching INVALID, null, or a type outside a restriction fails with
 * {@link UnsupportedTypeException} before the factory is called.
 * <p>
 * Example, with {@code MyFusor<V>} having a {@code MyFusor(TypeTraits<V>)} constructor:
 * <pre>{@code
 * DataFusor f = TypeDispatch.run(MyFusor::new, img.type());
 * DataFusor g = TypeDispatch.restrictedTo(PixelType.UINT8, PixelType.UINT16)
 *                           .dispatch(MyFusor::new, img.type());
 * }</pre>
 * {@link TypedFactory} has a generic method, so it is implemented by a method
 * reference or an anonymous class, not by a lambda.
 */
public final class TypeDispatch {

    private static final TypeDispatch ALL = new TypeDispatch(EnumSet.complementOf(EnumSet.of(PixelType.INVALID)));

    private final Set<PixelType> allowed;

    private TypeDispatch(EnumSet<PixelType> allowed) {
        this.allowed = Collections.unmodifiableSet(EnumSet.copyOf(allowed));
    }

    /** Dispatch over every valid pixel type. */
    public static <R> R run(TypedFactory<R> factory, PixelType type) {
        return ALL.dispatch(factory, type);
    }

    /**
     * A dispatcher that accepts only the given types.
     * INVALID is never accepted, even when listed.
     */
    public static TypeDispatch restrictedTo(PixelType... types) {
        if (types == null || types.length == 0) {
            throw new IllegalArgumentException("at least one pixel type is required");
        }
        EnumSet<PixelType> set = EnumSet.noneOf(PixelType.class);
        set.addAll(Arrays.asList(types));
        set.remove(PixelType.INVALID);
        if (set.isEmpty()) {
            throw new IllegalArgumentException("no dispatchable pixel type in " + Arrays.toString(types));
        }
        return new TypeDispatch(set);
    }

    /** Types this dispatcher will hand to a factory. */
    public Set<PixelType> allowedTypes() {
        return allowed;
    }

    public boolean supports(PixelType type) {
        return type != null && allowed.contains(type);
    }

    /**
     * Invoke {@code factory} with the traits of {@code type}.
     *
     * @throws UnsupportedTypeException if {@code type} is not supported; the factory is not called
     */
    public <R> R dispatch(TypedFactory<R> factory, PixelType type) {
        if (factory == null) throw new NullPointerException("factory");
        if (!supports(type)) {
            throw new UnsupportedTypeException(
                    "Pixel type " + type + " is not supported here, supported: " + allowed, type);
        }
        return factory.create(TypeTraits.of(type));
    }
}
