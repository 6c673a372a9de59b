// file: fusion/src/main/java/io/fusionlite/fusion/FusorProxy.java
package io.fusionlite.fusion;

import io.fusionlite.core.MultiResCollection;
import io.fusionlite.core.PixelType;
import io.fusionlite.core.TypeDispatch;
import io.fusionlite.core.TypedFactory;
import io.fusionlite.core.image.Image;
import io.fusionlite.core.image.ImageStore;

import java.util.Objects;

/**
 * A {@link DataFusor} that forwards every call to a fusor it owns.
 * <p>
 * Why: type-specialized fusors ({@code MyFusor<V>} built per {@link PixelType})
 * usually cannot be copied, but the {@link Parallelizer} needs one copy per
 * worker. A subclass of this proxy is copyable by rebuilding the underlying
 * fusor through its factory instead of copying it. See {@link TypedFusorProxy}.
 * <p>
 * Rules for subclasses:
 *  - {@link #df} is never null while the proxy is in use. A copy constructor
 *    must build a new fusor (through {@link #create}), never share the sample's.
 *  - Swap-based assignment must call {@link #swap(FusorProxy)} to exchange the
 *    owned fusor, plus swap its own fields.
 *  - A move may take the fusor with {@link #release()}; the source is unusable
 *    afterwards.
 * <p>
 * Forwarding adds no behavior: exceptions thrown by the owned fusor reach the
 * caller unchanged.
 */
public abstract class FusorProxy implements DataFusor {

    /** The real fusor. */
    protected DataFusor df;

    protected FusorProxy(DataFusor df) {
        this.df = Objects.requireNonNull(df, "df");
    }

    /**
     * Build one fusor of {@code family} specialized for {@code type}.
     *
     * @throws io.fusionlite.core.UnsupportedTypeException if {@code type} cannot be dispatched
     */
    public static DataFusor create(TypedFactory<? extends DataFusor> family, PixelType type) {
        return TypeDispatch.run(family, type);
    }

    // ---------- forwarding ----------

    @Override
    public void processOptions(Options options) {
        fusor().processOptions(options);
    }

    @Override
    public Options getOptions() {
        return fusor().getOptions();
    }

    @Override
    public void predict(int date, Image mask) {
        fusor().predict(date, mask);
    }

    @Override
    public MultiResCollection<Image> srcImages() {
        return fusor().srcImages();
    }

    @Override
    public void setSrcImages(ImageStore images) {
        fusor().setSrcImages(images);
    }

    @Override
    public Image outputImage() {
        return fusor().outputImage();
    }

    @Override
    public void setOutputImage(Image output) {
        fusor().setOutputImage(output);
    }

    // ---------- ownership ----------

    /** Exchange the owned fusors of two proxies. */
    protected void swap(FusorProxy other) {
        DataFusor tmp = this.df;
        this.df = other.df;
        other.df = tmp;
    }

    /** Hand out the owned fusor and leave this proxy moved-from. */
    protected DataFusor release() {
        DataFusor released = fusor();
        this.df = null;
        return released;
    }

    private DataFusor fusor() {
        if (df == null) {
            throw new IllegalStateException("fusor has been moved out of this proxy");
        }
        return df;
    }
}
