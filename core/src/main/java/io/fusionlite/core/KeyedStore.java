// file: core/src/main/java/io/fusionlite/core/KeyedStore.java
package io.fusionlite.core;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.UnaryOperator;

/**
 * Collection of elements indexed by resolution tag and date.
 * <p>
 * Layout: tag -> (date -> element), both levels ordered ({@link TreeMap}).
 * <p>
 * Invariants:
 *  - A tag is present iff it has at least one element. Removing the last
 *    element of a tag removes the tag too.
 *  - (tag, date) pairs are unique; {@link #set} replaces an existing element.
 *  - Presence is membership only. An element that is itself "empty" (a
 *    zero-sized image, say) is still present.
 * <p>
 * Errors:
 *  - {@link #get}, {@link #getAny}, {@link #remove(String, int)} and
 *    {@link #remove(String)} throw {@link NotFoundException} on a miss.
 *  - {@link #remove(int)} is a sweep over all tags and never fails; removing a
 *    date nobody has is a no-op.
 * <p>
 * Not thread safe. Concurrent readers are fine as long as nobody mutates.
 */
public class KeyedStore<T> implements MultiResCollection<T> {

    private final NavigableMap<String, NavigableMap<Integer, T>> collection = new TreeMap<>();

    /** Empty store. */
    public KeyedStore() {
    }

    /**
     * Structural copy: new tag and date maps, same element references.
     */
    public KeyedStore(KeyedStore<T> source) {
        this(source, UnaryOperator.identity());
    }

    /**
     * Copy the key structure of {@code source} and pass every element through
     * {@code elementCopier}. The copier decides how much of an element is shared
     * between the two stores.
     */
    public KeyedStore(KeyedStore<T> source, UnaryOperator<T> elementCopier) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(elementCopier, "elementCopier");
        for (var resEntry : source.collection.entrySet()) {
            NavigableMap<Integer, T> dates = new TreeMap<>();
            for (var e : resEntry.getValue().entrySet()) {
                dates.put(e.getKey(), Objects.requireNonNull(elementCopier.apply(e.getValue()), "copied element"));
            }
            collection.put(resEntry.getKey(), dates);
        }
    }

    // ---------- queries ----------

    @Override
    public boolean has(String tag, int date) {
        return find(tag, date) != null;
    }

    @Override
    public boolean has(String tag) {
        return tag != null && collection.containsKey(tag);
    }

    @Override
    public boolean has(int date) {
        for (var dates : collection.values()) {
            if (dates.containsKey(date)) return true;
        }
        return false;
    }

    @Override
    public T get(String tag, int date) {
        T t = find(tag, date);
        if (t == null) throw NotFoundException.forElement(tag, date);
        return t;
    }

    @Override
    public T getAny(int date) {
        for (var dates : collection.values()) {
            T t = dates.get(date);
            if (t != null) return t;
        }
        throw NotFoundException.forDate(date);
    }

    @Override
    public T getAny(String tag) {
        NavigableMap<Integer, T> dates = tag == null ? null : collection.get(tag);
        if (dates == null || dates.isEmpty()) throw NotFoundException.forTag(tag);
        return dates.firstEntry().getValue();
    }

    @Override
    public T getAny() {
        if (!collection.isEmpty()) {
            NavigableMap<Integer, T> first = collection.firstEntry().getValue();
            if (!first.isEmpty()) return first.firstEntry().getValue();
        }
        throw new NotFoundException("There is no element to get. Please call count() before!");
    }

    @Override
    public List<String> getResolutionTags() {
        return List.copyOf(collection.keySet());
    }

    @Override
    public List<String> getResolutionTags(int date) {
        List<String> tags = new ArrayList<>();
        for (var e : collection.entrySet()) {
            if (e.getValue().containsKey(date)) tags.add(e.getKey());
        }
        return List.copyOf(tags);
    }

    @Override
    public List<Integer> getDates(String tag) {
        NavigableMap<Integer, T> dates = tag == null ? null : collection.get(tag);
        if (dates == null) return List.of();
        return List.copyOf(dates.keySet());
    }

    @Override
    public SortedSet<Integer> getDates() {
        SortedSet<Integer> all = new TreeSet<>();
        for (var dates : collection.values()) {
            all.addAll(dates.keySet());
        }
        return all;
    }

    @Override
    public int countResolutionTags() {
        return collection.size();
    }

    @Override
    public int count() {
        int sum = 0;
        for (var dates : collection.values()) {
            sum += dates.size();
        }
        return sum;
    }

    @Override
    public int count(String tag) {
        NavigableMap<Integer, T> dates = tag == null ? null : collection.get(tag);
        return dates == null ? 0 : dates.size();
    }

    @Override
    public int count(int date) {
        int n = 0;
        for (var dates : collection.values()) {
            if (dates.containsKey(date)) n++;
        }
        return n;
    }

    @Override
    public boolean isEmpty() {
        return collection.isEmpty();
    }

    @Override
    public void forEach(ElementVisitor<? super T> visitor) {
        Objects.requireNonNull(visitor, "visitor");
        for (var resEntry : collection.entrySet()) {
            for (var e : resEntry.getValue().entrySet()) {
                visitor.visit(resEntry.getKey(), e.getKey(), e.getValue());
            }
        }
    }

    // ---------- mutation ----------

    /**
     * Store {@code element} at (tag, date), replacing what was there.
     *
     * @return the stored element
     */
    public T set(String tag, int date, T element) {
        Objects.requireNonNull(tag, "tag");
        Objects.requireNonNull(element, "element");
        collection.computeIfAbsent(tag, k -> new TreeMap<>()).put(date, element);
        return element;
    }

    /**
     * Remove the element at (tag, date). The tag goes away with its last element.
     *
     * @throws NotFoundException if there is no such element
     */
    public void remove(String tag, int date) {
        NavigableMap<Integer, T> dates = tag == null ? null : collection.get(tag);
        if (dates == null || dates.remove(date) == null) {
            throw NotFoundException.forElement(tag, date);
        }
        if (dates.isEmpty()) collection.remove(tag);
    }

    /**
     * Remove every element of {@code tag}.
     *
     * @throws NotFoundException if the tag is absent
     */
    public void remove(String tag) {
        if (tag == null || collection.remove(tag) == null) {
            throw NotFoundException.forTag(tag);
        }
    }

    /**
     * Remove every element at {@code date}, across all tags, pruning tags that
     * become empty. Nothing at that date is not an error.
     *
     * @return number of removed elements
     */
    public int remove(int date) {
        int removed = 0;
        for (Iterator<Map.Entry<String, NavigableMap<Integer, T>>> it = collection.entrySet().iterator(); it.hasNext(); ) {
            NavigableMap<Integer, T> dates = it.next().getValue();
            if (dates.remove(date) != null) {
                removed++;
                if (dates.isEmpty()) it.remove();
            }
        }
        return removed;
    }

    // ---------- helpers ----------

    // Single lookup used by every exact-key accessor.
    private T find(String tag, int date) {
        if (tag == null) return null;
        NavigableMap<Integer, T> dates = collection.get(tag);
        return dates == null ? null : dates.get(date);
    }

    @Override
    public String toString() {
        return "KeyedStore" + collection;
    }
}
