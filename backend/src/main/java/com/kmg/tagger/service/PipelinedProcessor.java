package com.kmg.tagger.service;

import com.kmg.tagger.config.TaggerProperties;
import com.kmg.tagger.model.ImageItem;
import com.kmg.tagger.model.ItemResult;
import com.kmg.tagger.model.ItemStage;
import com.kmg.tagger.repo.ProgressStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a batch through two stages per item. While item {@code i} is processed on the calling
 * thread, item {@code i + 1} is prepared on a single background thread. Items finish strictly in
 * input order and each one is recorded in the progress store before the next one starts.
 */
@Service
public class PipelinedProcessor {
    private static final Logger log = LoggerFactory.getLogger(PipelinedProcessor.class);

    private final Duration prepareTimeout;

    @Autowired
    public PipelinedProcessor(TaggerProperties properties) {
        this(Duration.ofSeconds(properties.getPipeline().getPrepareTimeoutSeconds()));
    }

    PipelinedProcessor(Duration prepareTimeout) {
        this.prepareTimeout = prepareTimeout;
    }

    public <P> List<ItemResult> run(List<ImageItem> items, Preparer<P> preparer, Handler<P> handler,
                                    ProgressStore store) {
        return run(items, preparer, handler, store, Listener.NONE);
    }

    public <P> List<ItemResult> run(List<ImageItem> items, Preparer<P> preparer, Handler<P> handler,
                                    ProgressStore store, Listener listener) {
        List<ItemResult> results = new ArrayList<>(items.size());
        if (items.isEmpty()) {
            return results;
        }

        for (ImageItem item : items) {
            listener.stageChanged(item, ItemStage.PENDING);
        }

        ExecutorService prepareExecutor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "prepare-next");
            thread.setDaemon(true);
            return thread;
        });
        try {
            Future<P> next = submitPrepare(prepareExecutor, items.get(0), preparer, listener);
            for (int i = 0; i < items.size(); i++) {
                ImageItem item = items.get(i);
                Future<P> current = next;
                next = i + 1 < items.size()
                        ? submitPrepare(prepareExecutor, items.get(i + 1), preparer, listener)
                        : null;

                log.info("[{}/{}] Processing {}...", i + 1, items.size(), item.name());
                ItemResult result = processOne(item, current, preparer, handler, listener);
                record(store, result);
                listener.stageChanged(item, ItemStage.DONE);
                results.add(result);
                listener.itemCompleted(i + 1, items.size(), result);
            }
        } finally {
            prepareExecutor.shutdownNow();
        }
        return results;
    }

    private <P> Future<P> submitPrepare(ExecutorService executor, ImageItem item, Preparer<P> preparer,
                                        Listener listener) {
        return executor.submit(() -> {
            listener.stageChanged(item, ItemStage.PREPARING);
            P prepared = preparer.prepare(item);
            listener.stageChanged(item, ItemStage.PREPARED);
            return prepared;
        });
    }

    private <P> ItemResult processOne(ImageItem item, Future<P> pending, Preparer<P> preparer, Handler<P> handler,
                                      Listener listener) {
        P prepared = awaitPrepared(item, pending);
        if (prepared == null) {
            try {
                listener.stageChanged(item, ItemStage.PREPARING);
                prepared = preparer.prepare(item);
                listener.stageChanged(item, ItemStage.PREPARED);
            } catch (Exception e) {
                log.warn("  -> FAILED: could not prepare {}: {}", item.name(), e.getMessage());
                return ItemResult.failure(item, "Failed to prepare image: " + e.getMessage(), 0.0);
            }
            if (prepared == null) {
                return ItemResult.failure(item, "Failed to prepare image", 0.0);
            }
        }

        listener.stageChanged(item, ItemStage.PROCESSING);
        long start = System.nanoTime();
        try {
            ItemResult result = handler.handle(item, prepared);
            if (result == null) {
                return ItemResult.failure(item, "No result", elapsedSeconds(start));
            }
            return result;
        } catch (RuntimeException e) {
            log.error("Error processing {}: {}", item.name(), e.getMessage());
            return ItemResult.failure(item, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage(),
                    elapsedSeconds(start));
        }
    }

    private <P> P awaitPrepared(ImageItem item, Future<P> pending) {
        try {
            return pending.get(prepareTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.cancel(true);
            log.debug("Background preparation of {} timed out; preparing inline", item.name());
        } catch (ExecutionException e) {
            log.debug("Background preparation of {} failed; preparing inline: {}", item.name(),
                    e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for " + item.name(), e);
        }
        return null;
    }

    private void record(ProgressStore store, ItemResult result) {
        if (result.success()) {
            Map<String, Object> metadata = result.metadata() == null ? Map.of() : result.metadata().toMap();
            store.markProcessed(result.item(), result.keywords(), result.inferenceTime(), metadata);
        } else {
            store.markFailed(result.item(), result.error());
        }
    }

    private double elapsedSeconds(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }

    @FunctionalInterface
    public interface Preparer<P> {
        P prepare(ImageItem item) throws Exception;
    }

    @FunctionalInterface
    public interface Handler<P> {
        ItemResult handle(ImageItem item, P prepared);
    }

    public interface Listener {
        Listener NONE = new Listener() {
        };

        default void stageChanged(ImageItem item, ItemStage stage) {
        }

        default void itemCompleted(int done, int total, ItemResult result) {
        }
    }
}
