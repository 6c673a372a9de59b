// file: core/src/main/java/io/fusionlite/core/image/Image.java
package io.fusionlite.core.image;

import io.fusionlite.core.PixelType;
import io.fusionlite.core.SizeException;
import io.fusionlite.core.TypeTraits;

import java.util.Arrays;
import java.util.Objects;

/**
 * Minimal single-channel raster.
 * <p>
 * Design:
 *  - Pixel values live in a row-major {@code double[]} held by reference.
 *    {@link #sharedCopy()} hands out another Image over the same array, so a
 *    pixel written through one handle is seen through the other.
 *  - {@link #cloneImage()} copies the array; the clone is independent.
 *  - Values are saturated to the range of {@link #type()} on write.
 * <p>
 * Loading, codecs and cropping views are not part of this class.
 */
public final class Image {

    private static final Image EMPTY_TEMPLATE = new Image(0, 0, PixelType.UINT8);

    private final int width;
    private final int height;
    private final PixelType type;
    private final TypeTraits<?> traits;
    private final double[] pixels;

    /** Zero-filled image. */
    public Image(int width, int height, PixelType type) {
        this(width, height, type, new double[checkedSize(width, height)]);
    }

    private Image(int width, int height, PixelType type, double[] pixels) {
        this.width = width;
        this.height = height;
        this.type = Objects.requireNonNull(type, "type");
        this.traits = TypeTraits.of(type);
        this.pixels = pixels;
    }

    /** A zero-sized image, used where "no image" is meant, e.g. no mask. */
    public static Image empty() {
        return EMPTY_TEMPLATE.sharedCopy();
    }

    public int width() { return width; }

    public int height() { return height; }

    public PixelType type() { return type; }

    public boolean isEmpty() { return width == 0 || height == 0; }

    public double get(int x, int y) {
        return pixels[index(x, y)];
    }

    /** Write a value, saturated (and rounded for integer types) to the type range. */
    public void set(int x, int y, double value) {
        pixels[index(x, y)] = traits.clamp(value);
    }

    public void fill(double value) {
        Arrays.fill(pixels, traits.clamp(value));
    }

    /** New handle on the same pixel buffer. */
    public Image sharedCopy() {
        return new Image(width, height, type, pixels);
    }

    /** Deep copy with its own pixel buffer. */
    public Image cloneImage() {
        return new Image(width, height, type, pixels.clone());
    }

    /** True if both handles write into the same pixel buffer. */
    public boolean isSharedWith(Image other) {
        return other != null && other.pixels == pixels;
    }

    /**
     * Copy all pixels of {@code src} into this image with the top-left corner at (x, y).
     *
     * @throws SizeException if {@code src} does not fit
     */
    public void copyValuesFrom(Image src, int x, int y) {
        Objects.requireNonNull(src, "src");
        if (x < 0 || y < 0 || x + src.width > width || y + src.height > height) {
            throw new SizeException("Cannot copy a " + src.width + "x" + src.height + " image to ("
                    + x + ", " + y + ") of a " + width + "x" + height + " image");
        }
        for (int row = 0; row < src.height; row++) {
            for (int col = 0; col < src.width; col++) {
                pixels[(y + row) * width + x + col] = traits.clamp(src.pixels[row * src.width + col]);
            }
        }
    }

    /** Same size, type and pixel values. */
    public boolean contentEquals(Image other) {
        return other != null
                && width == other.width
                && height == other.height
                && type == other.type
                && Arrays.equals(pixels, other.pixels);
    }

    @Override public String toString() {
        return "Image[" + width + "x" + height + ", " + type + "]";
    }

    // ---------- helpers ----------

    private int index(int x, int y) {
        if (x < 0 || y < 0 || x >= width || y >= height) {
            throw new IndexOutOfBoundsException("(" + x + ", " + y + ") outside " + width + "x" + height);
        }
        return y * width + x;
    }

    private static int checkedSize(int width, int height) {
        if (width < 0 || height < 0) {
            throw new SizeException("Image size must not be negative: " + width + "x" + height);
        }
        long n = (long) width * height;
        if (n > Integer.MAX_VALUE) {
            throw new SizeException("Image too large: " + width + "x" + height);
        }
        return (int) n;
    }
}
