// file: fusion/src/main/java/io/fusionlite/fusion/DataFusor.java
package io.fusionlite.fusion;

import io.fusionlite.core.MultiResCollection;
import io.fusionlite.core.image.Image;
import io.fusionlite.core.image.ImageStore;

/**
 * A fusion strategy: reads source images by (tag, date) and predicts an output
 * image for a requested date.
 * <p>
 * Lifecycle:
 *  1) {@link #processOptions(Options)} with the fusor's own options subtype,
 *  2) {@link #setSrcImages(ImageStore)} with the shared source collection,
 *  3) {@link #predict(int, Image)} one or more times, reading
 *     {@link #outputImage()} after each call.
 * <p>
 * The source collection is shared with the caller and treated as read-only.
 * The output image belongs to the fusor.
 * <p>
 * Implementations may throw any unchecked exception; wrappers such as
 * {@link FusorProxy} pass it through as is.
 */
public interface DataFusor {

    /**
     * Validate and take over the options.
     *
     * @throws IllegalArgumentException if {@code options} is of the wrong kind or invalid
     */
    void processOptions(Options options);

    /** Options last processed. */
    Options getOptions();

    /**
     * Predict the image at {@code date} into {@link #outputImage()}.
     *
     * @param mask marks valid pixels of the source images; {@link Image#empty()} for none
     */
    void predict(int date, Image mask);

    /** {@link #predict(int, Image)} without mask. */
    default void predict(int date) {
        predict(date, Image.empty());
    }

    /** Source images, or null if none were set yet. */
    MultiResCollection<Image> srcImages();

    void setSrcImages(ImageStore images);

    /** Output buffer; written by {@link #predict}, may be replaced by the caller. */
    Image outputImage();

    void setOutputImage(Image output);
}
