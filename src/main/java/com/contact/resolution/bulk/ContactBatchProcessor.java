package com.contact.resolution.bulk;

import com.contact.resolution.api.ContactIngestionService;
import com.contact.resolution.api.IngestResult;
import com.contact.resolution.attribution.AttributionService;
import com.contact.resolution.core.model.RawContactRecord;
import com.contact.resolution.logging.LogContext;
import com.contact.resolution.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Runs ingestion or attribution over many items with bounded parallelism.
 * A failing item is recorded as a {@link BatchError} and never aborts the rest.
 * Items touching the same contact are serialized by the ingestion service's locks.
 */
public class ContactBatchProcessor {
    private static final Logger log = LoggerFactory.getLogger(ContactBatchProcessor.class);

    private final ContactIngestionService ingestionService;
    private final AttributionService attributionService;
    private final MetricsService metricsService;
    private final BatchOptions options;

    public ContactBatchProcessor(ContactIngestionService ingestionService,
                                 AttributionService attributionService,
                                 MetricsService metricsService,
                                 BatchOptions options) {
        this.ingestionService = ingestionService;
        this.attributionService = attributionService;
        this.metricsService = metricsService;
        this.options = options != null ? options : BatchOptions.defaults();
    }

    public BatchSummary ingestAll(List<RawContactRecord> records) {
        return ingestAll(records, options);
    }

    /**
     * Ingests every record. Records run concurrently, so the order in which they are applied
     * is not the list order.
     */
    public BatchSummary ingestAll(List<RawContactRecord> records, BatchOptions batchOptions) {
        Objects.requireNonNull(records, "records is required");
        BatchAccumulator accumulator = new BatchAccumulator();
        run("ingest", records, batchOptions,
                record -> record != null ? record.reference() : "null",
                record -> {
                    IngestResult result = ingestionService.ingest(record);
                    accumulator.recordIngest(result);
                },
                accumulator);
        BatchSummary summary = accumulator.summary();
        log.info("batch.ingest.completed processed={} created={} merged={} flagged={} errors={}",
                summary.processed(), summary.created(), summary.merged(),
                summary.flaggedForReview(), summary.failed());
        return summary;
    }

    public AttributionBatchResult attributeAll(List<String> contactIds) {
        return attributeAll(contactIds, options);
    }

    public AttributionBatchResult attributeAll(List<String> contactIds, BatchOptions batchOptions) {
        Objects.requireNonNull(contactIds, "contactIds is required");
        BatchAccumulator accumulator = new BatchAccumulator();
        run("attribute", contactIds, batchOptions,
                Function.identity(),
                contactId -> accumulator.recordAttribution(attributionService.summarize(contactId)),
                accumulator);
        AttributionBatchResult result = new AttributionBatchResult(accumulator.summary(), accumulator.attributions());
        log.info("batch.attribute.completed processed={} errors={} chains={} averageCertainty={}",
                result.summary().processed(), result.summary().failed(), result.totalChains(),
                String.format(Locale.ROOT, "%.3f", result.averageCertainty()));
        return result;
    }

    private <T> void run(String operation,
                         List<T> items,
                         BatchOptions batchOptions,
                         Function<T, String> itemId,
                         Consumer<T> work,
                         BatchAccumulator accumulator) {
        metricsService.recordBatchSize(items.size());
        if (items.isEmpty()) {
            return;
        }
        BatchOptions effective = batchOptions != null ? batchOptions : options;
        int threads = Math.min(effective.maxConcurrency(), items.size());
        String batchId = UUID.randomUUID().toString();

        try (LogContext ctx = LogContext.forBatch(batchId, operation)) {
            log.info("batch.started operation={} items={} concurrency={}", operation, items.size(), threads);
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            List<Future<?>> futures = new ArrayList<>(items.size());
            try {
                for (T item : items) {
                    futures.add(executor.submit(() -> {
                        try (LogContext itemCtx = LogContext.forBatch(batchId, operation)) {
                            work.accept(item);
                        } catch (RuntimeException e) {
                            String id = itemId.apply(item);
                            log.warn("batch.item.failed operation={} item={} error={}",
                                    operation, id, e.getMessage());
                            accumulator.recordError(id, e);
                        }
                    }));
                }
                awaitAll(futures);
            } finally {
                shutdown(executor);
            }
        }
    }

    private static void awaitAll(List<Future<?>> futures) {
        for (int i = 0; i < futures.size(); i++) {
            try {
                futures.get(i).get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                for (int j = i; j < futures.size(); j++) {
                    futures.get(j).cancel(false);
                }
                log.warn("batch.interrupted remaining={}", futures.size() - i);
                return;
            } catch (ExecutionException e) {
                // work() records its own failures; anything escaping is an Error
                log.error("batch.worker.failed error={}", e.getCause().toString());
            }
        }
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
