// file: core/src/main/java/io/fusionlite/core/image/ImageStore.java
package io.fusionlite.core.image;

import io.fusionlite.core.KeyedStore;
import io.fusionlite.core.MultiResCollection;

import java.util.List;
import java.util.Objects;
import java.util.SortedSet;

/**
 * Source images of a fusion, indexed by resolution tag and date.
 * <p>
 * Wraps a {@link KeyedStore} of {@link Image}s and adds two copy flavours:
 *  - {@link #cloneWithClonedImages()}: every image is cloned. Nothing is shared
 *    with the original. Expensive (copies all pixel data).
 *  - {@link #cloneWithSharedImageCopies()}: the tag/date structure is new, the
 *    images are shared copies. Adding or removing entries in one store does not
 *    affect the other, but pixel writes through either are seen by both. Cheap.
 * <p>
 * The copy constructor has the deep semantics of {@link #cloneWithClonedImages()}.
 */
public final class ImageStore implements MultiResCollection<Image> {

    private final KeyedStore<Image> images;

    public ImageStore() {
        this.images = new KeyedStore<>();
    }

    /** Deep copy of {@code source}. */
    public ImageStore(ImageStore source) {
        this(new KeyedStore<>(Objects.requireNonNull(source, "source").images, Image::cloneImage));
    }

    private ImageStore(KeyedStore<Image> images) {
        this.images = images;
    }

    public ImageStore cloneWithClonedImages() {
        return new ImageStore(this);
    }

    public ImageStore cloneWithSharedImageCopies() {
        return new ImageStore(new KeyedStore<>(images, Image::sharedCopy));
    }

    // ---------- mutation ----------

    public Image set(String tag, int date, Image image) {
        return images.set(tag, date, image);
    }

    public void remove(String tag, int date) {
        images.remove(tag, date);
    }

    public void remove(String tag) {
        images.remove(tag);
    }

    public int remove(int date) {
        return images.remove(date);
    }

    // ---------- queries ----------

    @Override public boolean has(String tag, int date) { return images.has(tag, date); }

    @Override public boolean has(String tag) { return images.has(tag); }

    @Override public boolean has(int date) { return images.has(date); }

    @Override public Image get(String tag, int date) { return images.get(tag, date); }

    @Override public Image getAny(int date) { return images.getAny(date); }

    @Override public Image getAny(String tag) { return images.getAny(tag); }

    @Override public Image getAny() { return images.getAny(); }

    @Override public List<String> getResolutionTags() { return images.getResolutionTags(); }

    @Override public List<String> getResolutionTags(int date) { return images.getResolutionTags(date); }

    @Override public List<Integer> getDates(String tag) { return images.getDates(tag); }

    @Override public SortedSet<Integer> getDates() { return images.getDates(); }

    @Override public int countResolutionTags() { return images.countResolutionTags(); }

    @Override public int count() { return images.count(); }

    @Override public int count(String tag) { return images.count(tag); }

    @Override public int count(int date) { return images.count(date); }

    @Override public boolean isEmpty() { return images.isEmpty(); }

    @Override public void forEach(ElementVisitor<? super Image> visitor) { images.forEach(visitor); }

    @Override public String toString() {
        return "ImageStore" + images.getResolutionTags() + " (" + images.count() + " images)";
    }
}
