// file: fusion/src/main/java/io/fusionlite/fusion/Parallelizer.java
package io.fusionlite.fusion;

import io.fusionlite.core.FusionException;
import io.fusionlite.core.NotFoundException;
import io.fusionlite.core.SizeException;
import io.fusionlite.core.image.Image;
import io.fusionlite.core.image.Rectangle;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.UnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs copies of a fusor in parallel, each on a horizontal stripe of the
 * prediction area, and assembles their outputs into one image.
 * <p>
 * Algorithm for {@link #predict(int, Image)}:
 *  - Resolve the prediction area (all-zero means the size of any source image).
 *  - Use at most one worker per row of the area.
 *  - Keep one copy of the sample fusor per worker, made with the copy function
 *    (e.g. {@code TypedFusorProxy::new}). Copies are reused by later calls.
 *  - Give each worker a copy of the algorithm options restricted to its stripe,
 *    the shared source images and a stripe-sized output image.
 *  - Run all workers, wait for all of them, then either rethrow the first
 *    failure unchanged or copy every stripe into {@link #outputImage()}.
 * <p>
 * The source collection is read concurrently by all workers and must not be
 * modified while {@code predict} runs.
 *
 * @param <A> fusor type being parallelized
 * @param <O> options type of that fusor
 */
public final class Parallelizer<A extends DataFusor, O extends Options> extends AbstractDataFusor {
    private static final Logger log = Logger.getLogger(Parallelizer.class.getName());

    private final A fusorSample;
    private final UnaryOperator<A> copier;
    private final List<A> fusors = new ArrayList<>();
    private ParallelizerOptions<O> options;

    /**
     * @param sample fusor to copy for the workers; never runs itself
     * @param copier builds an independent fusor equivalent to its argument
     */
    public Parallelizer(A sample, UnaryOperator<A> copier) {
        this.fusorSample = Objects.requireNonNull(sample, "sample");
        this.copier = Objects.requireNonNull(copier, "copier");
    }

    /**
     * @throws IllegalArgumentException unless {@code o} is a {@link ParallelizerOptions}
     */
    @Override
    public void processOptions(Options o) {
        if (!(o instanceof ParallelizerOptions<?> po)) {
            throw new IllegalArgumentException("Parallelizer needs ParallelizerOptions, got "
                    + (o == null ? "null" : o.getClass().getName()));
        }
        @SuppressWarnings("unchecked")
        ParallelizerOptions<O> copy = (ParallelizerOptions<O>) po.copy();
        this.options = copy;
    }

    /** Options last processed, or null before the first {@link #processOptions}. */
    @Override
    public ParallelizerOptions<O> getOptions() {
        return options;
    }

    /** Number of worker copies currently held. */
    public int workerCount() {
        return fusors.size();
    }

    @Override
    public void predict(int date, Image mask) {
        if (imgs == null) {
            throw new NotFoundException("Parallelizer's source image collection is empty. Set one with setSrcImages.");
        }
        if (options == null) {
            throw new IllegalStateException("processOptions must be called before predict");
        }

        Rectangle pa = options.getPredictionArea();
        if (pa.width() < 0 || pa.height() < 0 || (pa.area() == 0 && (pa.width() != 0 || pa.height() != 0))) {
            throw new SizeException("Prediction area " + pa + " is invalid (negative or zero dimension, but not empty). "
                    + "Note the prediction area of the algorithm options is ignored.");
        }

        Image reference = imgs.getAny();
        if (pa.isUnset()) {
            pa = new Rectangle(0, 0, reference.width(), reference.height());
        }
        if (output.width() != pa.width() || output.height() != pa.height() || output.type() != reference.type()) {
            output = new Image(pa.width(), pa.height(), reference.type());
        }
        if (pa.height() == 0) {
            return;
        }

        int nt = Math.min(options.getNumberOfThreads(), pa.height());
        while (fusors.size() < nt) {
            fusors.add(copier.apply(fusorSample));
        }
        while (fusors.size() > nt) {
            fusors.remove(fusors.size() - 1);
        }

        O algOptions = options.getAlgOptions();
        if (!algOptions.getPredictionArea().isUnset()) {
            log.log(Level.WARNING, "The algorithm options'' prediction area {0} is ignored and replaced by "
                    + "stripes of the parallelizer''s prediction area {1}", new Object[]{algOptions.getPredictionArea(), pa});
        }

        // split the area into horizontal stripes and prepare each worker
        List<Rectangle> stripes = new ArrayList<>(nt);
        double step = (double) pa.height() / nt;
        double curY = pa.y();
        for (int i = 0; i < nt; i++) {
            int y0 = (int) Math.round(curY);
            curY += step;
            Rectangle stripe = pa.withY(y0, (int) Math.round(curY) - y0);
            stripes.add(stripe);

            O workerOptions = ParallelizerOptions.copyOf(algOptions);
            workerOptions.setPredictionArea(stripe);

            A fusor = fusors.get(i);
            fusor.processOptions(workerOptions);
            fusor.setSrcImages(imgs);
            fusor.setOutputImage(new Image(stripe.width(), stripe.height(), reference.type()));
        }

        log.log(Level.FINE, "Predicting date {0} on {1} with {2} workers", new Object[]{date, pa, nt});
        runWorkers(date, mask);

        for (int i = 0; i < nt; i++) {
            Rectangle stripe = stripes.get(i);
            output.copyValuesFrom(fusors.get(i).outputImage(), 0, stripe.y() - pa.y());
        }
    }

    // ---------- internals ----------

    private void runWorkers(int date, Image mask) {
        AtomicInteger threadIds = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(fusors.size(), r -> {
            Thread t = new Thread(r, "fusion-worker-" + threadIds.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        try {
            List<Future<?>> futures = new ArrayList<>(fusors.size());
            for (A fusor : fusors) {
                futures.add(pool.submit(() -> fusor.predict(date, mask)));
            }

            // wait for every worker, keep the first failure
            Throwable firstFailure = null;
            for (Future<?> f : futures) {
                try {
                    f.get();
                } catch (ExecutionException e) {
                    if (firstFailure == null) firstFailure = e.getCause();
                }
            }
            if (firstFailure instanceof RuntimeException re) throw re;
            if (firstFailure instanceof Error err) throw err;
            if (firstFailure != null) throw new FusionException("Fusion worker failed", firstFailure);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FusionException("Interrupted while waiting for fusion workers", e);
        } finally {
            pool.shutdownNow();
        }
    }
}
