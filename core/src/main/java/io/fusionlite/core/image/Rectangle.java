package io.fusionlite.core.image;

/**
 * Axis-aligned pixel rectangle. The all-zero rectangle is used by options to
 * mean "the whole image".
 */
public record Rectangle(int x, int y, int width, int height) {

    public static final Rectangle NONE = new Rectangle(0, 0, 0, 0);

    public long area() {
        return (long) width * height;
    }

    /** True for the all-zero rectangle. */
    public boolean isUnset() {
        return x == 0 && y == 0 && width == 0 && height == 0;
    }

    public Rectangle withY(int newY, int newHeight) {
        return new Rectangle(x, newY, width, newHeight);
    }
}
