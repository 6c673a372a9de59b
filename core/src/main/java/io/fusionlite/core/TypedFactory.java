package io.fusionlite.core;

/**
 * Factory functor parameterized by a per-type constant.
 * <p>
 * Implementations typically construct an instance of a type-specialized class,
 * e.g. the constructor reference {@code MyFusor::new}. Used through {@link TypeDispatch}.
 *
 * @param <R> result type, usually an opaque strategy handle
 */
@FunctionalInterface
public interface TypedFactory<R> {

    <V extends Number> R create(TypeTraits<V> traits);
}
