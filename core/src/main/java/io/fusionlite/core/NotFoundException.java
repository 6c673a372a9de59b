package io.fusionlite.core;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * A key or partial key was not present.
 * <p>
 * Carries the offending resolution tag and/or date so callers can report
 * what exactly was missing without parsing the message.
 */
public class NotFoundException extends FusionException {
    private final String resolutionTag;
    private final Integer date;

    public NotFoundException(String message) {
        this(message, null, null);
    }

    public NotFoundException(String message, String resolutionTag, Integer date) {
        super(message);
        this.resolutionTag = resolutionTag;
        this.date = date;
    }

    /** Missing element at an exact (tag, date) pair. */
    public static NotFoundException forElement(String tag, int date) {
        return new NotFoundException(
                "Could not find the requested element of " + tag + " resolution with date " + date
                        + ". Please call has(tag, date) before!",
                tag, date);
    }

    /** No element under the given tag. */
    public static NotFoundException forTag(String tag) {
        return new NotFoundException(
                "Could not find any element of resolution " + tag + ". Please call has(tag) before!",
                tag, null);
    }

    /** No element at the given date. */
    public static NotFoundException forDate(int date) {
        return new NotFoundException(
                "Could not find any element with date " + date + ". Please call has(date) before!",
                null, date);
    }

    public Optional<String> resolutionTag() {
        return Optional.ofNullable(resolutionTag);
    }

    public OptionalInt date() {
        return date == null ? OptionalInt.empty() : OptionalInt.of(date);
    }
}
