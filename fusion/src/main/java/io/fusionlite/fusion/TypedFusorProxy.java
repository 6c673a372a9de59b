// file: fusion/src/main/java/io/fusionlite/fusion/TypedFusorProxy.java
package io.fusionlite.fusion;

import io.fusionlite.core.PixelType;
import io.fusionlite.core.TypedFactory;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Copyable proxy over a family of type-specialized fusors.
 * <p>
 * State:
 *  - family: factory building the specialized fusor for given type traits.
 *  - type:   the discriminant the owned fusor was built for.
 * <p>
 * Copy semantics:
 *  - {@link #TypedFusorProxy(TypedFusorProxy)} rebuilds a fresh fusor from the
 *    sample's family and type. Options, inputs and output of the sample are
 *    not carried over; the {@link Parallelizer} sets them on every copy.
 *  - {@link #assign(TypedFusorProxy)} builds the replacement first and swaps it
 *    in, so a failing factory leaves this proxy untouched.
 *  - {@link #moveFrom(TypedFusorProxy)} takes over the sample's fusor without
 *    calling the factory.
 * <p>
 * Typical use:
 * <pre>{@code
 * var proxy = new TypedFusorProxy(MyFusor::new, img.type());
 * var par = new Parallelizer<>(proxy, TypedFusorProxy::new);
 * }</pre>
 */
public final class TypedFusorProxy extends FusorProxy {
    private static final Logger log = Logger.getLogger(TypedFusorProxy.class.getName());

    private TypedFactory<? extends DataFusor> family;
    private PixelType type;

    /** First construction: build the fusor of {@code family} for {@code type}. */
    public TypedFusorProxy(TypedFactory<? extends DataFusor> family, PixelType type) {
        super(create(Objects.requireNonNull(family, "family"), type));
        this.family = family;
        this.type = type;
    }

    /** Copy: rebuild from the sample's family and type. */
    public TypedFusorProxy(TypedFusorProxy sample) {
        this(Objects.requireNonNull(sample, "sample").family, sample.type);
        log.log(Level.FINE, "Rebuilt fusor for pixel type {0}", type);
    }

    private TypedFusorProxy(DataFusor df, TypedFactory<? extends DataFusor> family, PixelType type) {
        super(df);
        this.family = family;
        this.type = type;
    }

    /**
     * Move: the new proxy owns {@code source}'s fusor, {@code source} is left
     * moved-from and must not be used again.
     */
    public static TypedFusorProxy moveFrom(TypedFusorProxy source) {
        Objects.requireNonNull(source, "source");
        return new TypedFusorProxy(source.release(), source.family, source.type);
    }

    /**
     * Copy assignment: afterwards this proxy owns a fresh fusor built like
     * {@code source}'s. If building it fails, this proxy keeps its old state.
     *
     * @return this
     */
    public TypedFusorProxy assign(TypedFusorProxy source) {
        TypedFusorProxy tmp = new TypedFusorProxy(source);
        swap(tmp);
        return this;
    }

    /** Exchange fusor, family and type with {@code other}. */
    public void swap(TypedFusorProxy other) {
        super.swap(other);

        TypedFactory<? extends DataFusor> f = this.family;
        this.family = other.family;
        other.family = f;

        PixelType t = this.type;
        this.type = other.type;
        other.type = t;
    }

    /** Discriminant of the owned fusor. */
    public PixelType type() {
        return type;
    }

    @Override public String toString() {
        return "TypedFusorProxy[" + type + "]";
    }
}
