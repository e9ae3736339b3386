package com.largomodo.photosheet.core;

import com.largomodo.photosheet.collection.PhotoEntry;
import com.largomodo.photosheet.core.compose.ProgressSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.nio.file.Path;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs exports on a dedicated worker thread and reports to an {@link ExportListener}.
 * <p>
 * One run at a time: {@link #start} snapshots the photo list, moves the state to
 * {@link ExportState#RUNNING} and returns immediately. The run ends in
 * {@link ExportState#COMPLETED} or {@link ExportState#FAILED}; it cannot be cancelled.
 * <p>
 * Listener callbacks are handed to the callback executor in order. Pass a serial executor
 * (a UI event queue, a single-thread executor) to move them off the worker; the default runs
 * them directly on the worker. Progress is converted to whole percent and only increases
 * are reported; a successful run always reports 100 before {@code onSuccess}.
 * <p>
 * The worker is a single-thread {@link ThreadPoolExecutor}; queued runs are rejected by the
 * state check, so its queue never holds more than one task.
 */
public class ExportOrchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExportOrchestrator.class);

    static final String MDC_EXPORT = "export";

    private final PhotoExporter exporter;
    private final Executor callbackExecutor;
    private final ExecutorService worker;
    private final AtomicReference<ExportState> state = new AtomicReference<>(ExportState.IDLE);

    public ExportOrchestrator(PhotoExporter exporter) {
        this(exporter, Runnable::run);
    }

    /**
     * @param exporter         synchronous export pipeline
     * @param callbackExecutor serial executor that delivers listener callbacks
     */
    public ExportOrchestrator(PhotoExporter exporter, Executor callbackExecutor) {
        this.exporter = exporter;
        this.callbackExecutor = callbackExecutor;
        this.worker = new ThreadPoolExecutor(
                1, 1,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                runnable -> {
                    Thread thread = new Thread(runnable, "photosheet-export");
                    thread.setDaemon(true);
                    return thread;
                });
    }

    /**
     * Start an export.
     *
     * @param photos   photos in cell order; copied before this method returns
     * @param config   run settings
     * @param listener receives lifecycle callbacks
     * @return the run's outcome; completes normally for failed runs too
     * @throws IllegalStateException if a run is already in progress
     */
    public Future<ExportOutcome> start(List<PhotoEntry> photos, ExportConfiguration config, ExportListener listener) {
        ExportState current;
        do {
            current = state.get();
            if (current == ExportState.RUNNING) {
                throw new IllegalStateException("An export is already running");
            }
        } while (!state.compareAndSet(current, ExportState.RUNNING));

        List<PhotoEntry> snapshot = List.copyOf(photos);
        String runId = UUID.randomUUID().toString().substring(0, 8);
        try {
            return worker.submit(() -> run(runId, snapshot, config, listener));
        } catch (RuntimeException e) {
            state.set(ExportState.FAILED);
            throw e;
        }
    }

    public ExportState getState() {
        return state.get();
    }

    private ExportOutcome run(String runId, List<PhotoEntry> photos, ExportConfiguration config,
                              ExportListener listener) {
        MDC.put(MDC_EXPORT, runId);
        try {
            deliver(() -> listener.onStart(photos.size()));
            PercentTracker percent = new PercentTracker(listener);

            ExportOutcome outcome;
            try {
                AssemblyReport report = exporter.export(photos, config, percent);
                percent.report(100);
                outcome = ExportOutcome.completed(report);
            } catch (Throwable e) {
                // Errors too: the run must still end FAILED and reach onFailure
                String message = describe(e);
                log.error("Export failed: {}", message, e);
                outcome = ExportOutcome.failed(message);
            }

            // State changes before the terminal callback so a listener can start the next run
            if (outcome.isSuccess()) {
                state.set(ExportState.COMPLETED);
                Path output = outcome.output();
                deliver(() -> listener.onSuccess(output));
            } else {
                state.set(ExportState.FAILED);
                String message = outcome.failureMessage();
                deliver(() -> listener.onFailure(message));
            }
            return outcome;
        } finally {
            MDC.remove(MDC_EXPORT);
        }
    }

    private void deliver(Runnable callback) {
        callbackExecutor.execute(() -> {
            try {
                callback.run();
            } catch (RuntimeException e) {
                log.warn("Export listener failed", e);
            }
        });
    }

    static String describe(Throwable e) {
        String message = e.getMessage();
        if (message == null || message.isBlank()) {
            return e.getClass().getSimpleName();
        }
        return message;
    }

    /**
     * Two-phase shutdown: graceful, then forceful after the timeout.
     */
    @Override
    public void close() {
        worker.shutdown();
        try {
            if (!worker.awaitTermination(5, TimeUnit.MINUTES)) {
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            worker.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Converts photo counts to whole percent, forwarding only increases.
     * Used only from the worker thread.
     */
    private final class PercentTracker implements ProgressSink {
        private final ExportListener listener;
        private int last = -1;

        private PercentTracker(ExportListener listener) {
            this.listener = listener;
        }

        @Override
        public void onProgress(int processed, int total) {
            report(total == 0 ? 100 : (int) ((long) processed * 100 / total));
        }

        void report(int percent) {
            if (percent > last) {
                last = percent;
                log.debug("Progress {}%", percent);
                deliver(() -> listener.onProgress(percent));
            }
        }
    }
}
