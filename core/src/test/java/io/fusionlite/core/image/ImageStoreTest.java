package io.fusionlite.core.image;

import io.fusionlite.core.NotFoundException;
import io.fusionlite.core.PixelType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Copy semantics of the image store: cloned vs. shared images.
 */
class ImageStoreTest {

    private static Image filled(double v) {
        var img = new Image(4, 3, PixelType.UINT16);
        img.fill(v);
        return img;
    }

    private static ImageStore sample() {
        var s = new ImageStore();
        s.set("L8", 20200101, filled(10));
        s.set("L8", 20200117, filled(11));
        s.set("MODIS", 20200101, filled(20));
        return s;
    }

    @Test
    void cloned_copy_is_fully_independent() {
        var s = sample();
        var c = s.cloneWithClonedImages();

        c.get("L8", 20200101).set(0, 0, 999);
        s.get("MODIS", 20200101).set(1, 1, 777);

        assertEquals(10, s.get("L8", 20200101).get(0, 0));
        assertEquals(20, c.get("MODIS", 20200101).get(1, 1));
        assertFalse(s.get("L8", 20200117).isSharedWith(c.get("L8", 20200117)));
    }

    @Test
    void copy_constructor_clones_like_clone_with_cloned_images() {
        var s = sample();
        var c = new ImageStore(s);

        c.get("L8", 20200117).fill(0);

        assertEquals(11, s.get("L8", 20200117).get(3, 2));
        assertEquals(s.getResolutionTags(), c.getResolutionTags());
        assertEquals(s.count(), c.count());
    }

    @Test
    void shared_copy_shares_pixels_but_not_keys() {
        var s = sample();
        var sh = s.cloneWithSharedImageCopies();

        // pixel writes are visible both ways
        sh.get("L8", 20200101).set(2, 2, 555);
        s.get("MODIS", 20200101).set(0, 1, 444);
        assertEquals(555, s.get("L8", 20200101).get(2, 2));
        assertEquals(444, sh.get("MODIS", 20200101).get(0, 1));

        // structure is not
        sh.set("S2", 20200105, filled(30));
        s.remove("L8", 20200117);
        assertFalse(s.has("S2"));
        assertTrue(sh.has("L8", 20200117));

        // replacing an element in one store leaves the other pointing at the old one
        sh.set("MODIS", 20200101, filled(1));
        assertEquals(20, s.get("MODIS", 20200101).get(3, 0));
    }

    @Test
    void cloning_does_not_mutate_the_receiver() {
        var s = sample();
        var before = s.get("L8", 20200101);

        s.cloneWithClonedImages();
        s.cloneWithSharedImageCopies();

        assertSame(before, s.get("L8", 20200101));
        assertEquals(3, s.count());
    }

    @Test
    void empty_image_counts_as_present() {
        var s = new ImageStore();
        s.set("mask", 1, Image.empty());

        assertTrue(s.has("mask", 1));
        assertFalse(s.isEmpty());
        assertTrue(s.getAny().isEmpty());
    }

    @Test
    void delegates_store_semantics() {
        var s = sample();

        assertEquals(List.of("L8", "MODIS"), s.getResolutionTags(20200101));
        assertEquals(List.of(20200101, 20200117), s.getDates("L8"));
        assertEquals(2, s.count(20200101));
        assertEquals(2, s.remove(20200101));
        assertEquals(0, s.remove(20200101));
        assertFalse(s.has("MODIS"));
        assertThrows(NotFoundException.class, () -> s.remove("MODIS"));
        assertThrows(NotFoundException.class, () -> s.getAny(20200101));
    }
}
