package io.fusionlite.fusion;

import java.util.Objects;

/**
 * Options of a {@link Parallelizer}.
 * <p>
 * Fields:
 *  - numberOfThreads: worker count, clamped to [1, available processors].
 *  - algOptions:      options handed to each worker fusor. Their own
 *                     prediction area is ignored; each worker gets a stripe of
 *                     this object's prediction area instead.
 */
public final class ParallelizerOptions<O extends Options> extends Options {
    private int numberOfThreads = availableProcessors();
    private O algOptions;

    public ParallelizerOptions(O algOptions) {
        this.algOptions = Objects.requireNonNull(algOptions, "algOptions");
    }

    private ParallelizerOptions(ParallelizerOptions<O> source) {
        super(source);
        this.numberOfThreads = source.numberOfThreads;
        this.algOptions = copyOf(source.algOptions);
    }

    public int getNumberOfThreads() {
        return numberOfThreads;
    }

    /** Values above the processor count are reduced to it, values below 1 raised to 1. */
    public void setNumberOfThreads(int n) {
        this.numberOfThreads = Math.max(1, Math.min(n, availableProcessors()));
    }

    public O getAlgOptions() {
        return algOptions;
    }

    public void setAlgOptions(O algOptions) {
        this.algOptions = Objects.requireNonNull(algOptions, "algOptions");
    }

    @Override
    public ParallelizerOptions<O> copy() {
        return new ParallelizerOptions<>(this);
    }

    /**
     * Copy of algorithm options. Subclasses of {@link Options} are expected to
     * override {@link Options#copy()} with their own type.
     */
    static <O extends Options> O copyOf(O options) {
        Options c = options.copy();
        if (c.getClass() != options.getClass()) {
            throw new IllegalStateException(options.getClass().getName()
                    + " must override copy() to return its own type");
        }
        @SuppressWarnings("unchecked")
        O typed = (O) c;
        return typed;
    }

    private static int availableProcessors() {
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }
}
