package io.fusionlite.core;

import java.util.List;
import java.util.SortedSet;

/**
 * Read-only view of elements indexed by resolution tag and date.
 * <p>
 * Ordering contract:
 *  - tags are ordered lexicographically, dates ascending;
 *  - every "first"/"any" lookup picks the first match in that order, so results
 *    are deterministic for a given content.
 * <p>
 * This view does not promise immutability of the elements themselves, only
 * that the key structure is not changed through it.
 */
public interface MultiResCollection<T> {

    /** True iff an element exists at exactly (tag, date). */
    boolean has(String tag, int date);

    /** True iff at least one element exists under {@code tag}. */
    boolean has(String tag);

    /** True iff at least one element exists at {@code date}, under any tag. */
    boolean has(int date);

    /**
     * Element at (tag, date).
     *
     * @throws NotFoundException if there is none; check with {@link #has(String, int)}
     */
    T get(String tag, int date);

    /**
     * Element at {@code date} under the first tag that has one.
     *
     * @throws NotFoundException if no tag has an element at that date
     */
    T getAny(int date);

    /**
     * Element at the earliest date of {@code tag}.
     *
     * @throws NotFoundException if the tag is absent
     */
    T getAny(String tag);

    /**
     * Element at the earliest date of the first tag.
     *
     * @throws NotFoundException if the collection is empty
     */
    T getAny();

    /** All non-empty tags, in key order. */
    List<String> getResolutionTags();

    /** Tags having an element at {@code date}, in key order. */
    List<String> getResolutionTags(int date);

    /** Dates under {@code tag} ascending; empty if the tag is absent. */
    List<Integer> getDates(String tag);

    /** Union of all dates, ascending. */
    SortedSet<Integer> getDates();

    int countResolutionTags();

    /** Total number of elements. */
    int count();

    int count(String tag);

    /** Number of tags having an element at {@code date}. Scans every tag. */
    int count(int date);

    /**
     * True if there is no element at all. Note an empty (zero-sized) image
     * counts as an element.
     */
    boolean isEmpty();

    /** Visit every element in key order. */
    void forEach(ElementVisitor<? super T> visitor);

    @FunctionalInterface
    interface ElementVisitor<T> {
        void visit(String tag, int date, T element);
    }
}
