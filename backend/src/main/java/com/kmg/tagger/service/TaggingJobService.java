package com.kmg.tagger.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmg.tagger.config.TaggerProperties;
import com.kmg.tagger.dto.JobRequest;
import com.kmg.tagger.dto.JobView;
import com.kmg.tagger.model.ImageItem;
import com.kmg.tagger.model.ItemResult;
import com.kmg.tagger.model.JobStatus;
import com.kmg.tagger.model.PreparedImage;
import com.kmg.tagger.model.Sequence;
import com.kmg.tagger.model.VehicleMetadata;
import com.kmg.tagger.repo.JobDirectoryLock;
import com.kmg.tagger.repo.ProgressStore;
import com.kmg.tagger.repo.ProgressStoreFactory;
import com.kmg.tagger.service.capability.HierarchicalKeywords;
import com.kmg.tagger.service.capability.MetadataWriter;
import com.kmg.tagger.service.capability.VisionInference;
import com.kmg.tagger.service.parse.KeywordMapper;
import com.kmg.tagger.service.parse.ModelResponseParser;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs tagging jobs: optional sequence pass, resume filtering, then the pipelined
 * encode/infer/write loop. One job runs at a time.
 */
@Service
public class TaggingJobService {
    private static final Logger log = LoggerFactory.getLogger(TaggingJobService.class);

    private final ImageScanner imageScanner;
    private final SequenceService sequenceService;
    private final SequenceTagWriter sequenceTagWriter;
    private final ProgressStoreFactory storeFactory;
    private final PipelinedProcessor processor;
    private final ImageEncoder imageEncoder;
    private final VisionInference visionInference;
    private final PromptCatalog promptCatalog;
    private final ModelResponseParser responseParser;
    private final KeywordMapper keywordMapper;
    private final MetadataWriter metadataWriter;
    private final CompletionFileWriter completionFileWriter;
    private final EventService eventService;
    private final TaggerProperties properties;
    private final ObjectMapper objectMapper;

    private final ExecutorService jobExecutor = Executors.newSingleThreadExecutor();
    private final Map<String, JobRun> jobs = new ConcurrentHashMap<>();
    private final AtomicReference<String> runningJobId = new AtomicReference<>(null);

    public TaggingJobService(
            ImageScanner imageScanner,
            SequenceService sequenceService,
            SequenceTagWriter sequenceTagWriter,
            ProgressStoreFactory storeFactory,
            PipelinedProcessor processor,
            ImageEncoder imageEncoder,
            VisionInference visionInference,
            PromptCatalog promptCatalog,
            ModelResponseParser responseParser,
            KeywordMapper keywordMapper,
            MetadataWriter metadataWriter,
            CompletionFileWriter completionFileWriter,
            EventService eventService,
            TaggerProperties properties,
            ObjectMapper objectMapper
    ) {
        this.imageScanner = imageScanner;
        this.sequenceService = sequenceService;
        this.sequenceTagWriter = sequenceTagWriter;
        this.storeFactory = storeFactory;
        this.processor = processor;
        this.imageEncoder = imageEncoder;
        this.visionInference = visionInference;
        this.promptCatalog = promptCatalog;
        this.responseParser = responseParser;
        this.keywordMapper = keywordMapper;
        this.metadataWriter = metadataWriter;
        this.completionFileWriter = completionFileWriter;
        this.eventService = eventService;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    /**
     * Queues a job on the job thread and returns its id.
     */
    public synchronized String startJob(JobRequest request) {
        JobRun job = register(request);
        try {
            jobExecutor.submit(() -> runJob(job));
        } catch (RuntimeException ex) {
            runningJobId.set(null);
            throw ex;
        }
        return job.id;
    }

    /**
     * Runs a job on the calling thread.
     */
    public JobView runJob(JobRequest request) {
        JobRun job;
        synchronized (this) {
            job = register(request);
        }
        runJob(job);
        return job.toView();
    }

    public List<JobView> listJobs() {
        return jobs.values().stream()
                .sorted(Comparator.comparing((JobRun job) -> job.createdAt).reversed())
                .map(JobRun::toView)
                .toList();
    }

    public JobView getJob(String jobId) {
        JobRun job = jobs.get(jobId);
        if (job == null) {
            throw new IllegalArgumentException("Job not found: " + jobId);
        }
        return job.toView();
    }

    public String sequencePreview(String jobId) {
        JobRun job = jobs.get(jobId);
        return job == null ? null : job.sequencePreview;
    }

    @PreDestroy
    public void shutdown() {
        jobExecutor.shutdownNow();
    }

    private JobRun register(JobRequest request) {
        Path input = Path.of(request.inputPath()).toAbsolutePath().normalize();
        if (!Files.exists(input)) {
            throw new IllegalArgumentException("Input path does not exist: " + input);
        }
        if (runningJobId.get() != null) {
            throw new IllegalStateException("Another job is already running.");
        }

        JobRun job = new JobRun(UUID.randomUUID().toString(), request, input);
        jobs.put(job.id, job);
        runningJobId.set(job.id);
        return job;
    }

    private void runJob(JobRun job) {
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("jobId", job.id);
        report.put("request", job.request);
        List<Map<String, Object>> reportItems = new ArrayList<>();

        job.markRunning();
        report.put("startedAt", job.startedAt);
        eventService.publish(EventService.JOB_STARTED, job.id, "Job started",
                Map.of("inputPath", job.input.toString()));

        try {
            execute(job, reportItems);
            job.finish(JobStatus.COMPLETED, null);
            report.put("status", JobStatus.COMPLETED.name());
            eventService.publish(EventService.JOB_COMPLETED, job.id, "Job completed", Map.of(
                    "successful", job.successful,
                    "failed", job.failed
            ));
        } catch (Exception e) {
            log.error("Job failed: {}", e.getMessage(), e);
            job.finish(JobStatus.FAILED, e.getMessage());
            report.put("status", JobStatus.FAILED.name());
            report.put("error", e.getMessage());
            eventService.publish(EventService.JOB_FAILED, job.id, "Job failed",
                    Map.of("error", e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage()));
        } finally {
            report.put("endedAt", job.endedAt);
            report.put("items", reportItems);
            writeReport(job.id, report);
            runningJobId.set(null);
        }
    }

    private void execute(JobRun job, List<Map<String, Object>> reportItems) throws IOException {
        JobRequest request = job.request;
        List<ImageItem> images = imageScanner.listSupportedImages(job.input);
        if (images.isEmpty()) {
            throw new IllegalArgumentException("No supported images found in " + job.input);
        }
        log.info("Found {} images to process", images.size());

        Path outputDir = request.outputDir() == null || request.outputDir().isBlank()
                ? null
                : Path.of(request.outputDir()).toAbsolutePath().normalize();

        try (JobDirectoryLock ignored = storeFactory.lock(job.input)) {
            if (request.detectSequences() || request.sequenceDryRun()) {
                boolean previewOnly = runSequencePass(job, images, outputDir);
                if (previewOnly) {
                    return;
                }
            }

            ProgressStore store = storeFactory.open(job.input);
            if (request.reset()) {
                store.reset();
            }

            List<ImageItem> pending = images;
            if (request.resume()) {
                pending = images.stream().filter(image -> !store.isProcessed(image)).toList();
                job.skipped = images.size() - pending.size();
                if (job.skipped > 0) {
                    log.info("Resuming: skipping {} already-processed images", job.skipped);
                }
            }
            if (pending.isEmpty()) {
                log.info("All images already processed. Use reset to start fresh.");
                return;
            }
            if (request.maxImages() != null && request.maxImages() < pending.size()) {
                pending = pending.subList(0, request.maxImages());
                log.info("Limited to {} images", pending.size());
            }
            job.totalImages = pending.size();

            if (outputDir != null) {
                Files.createDirectories(outputDir);
            }

            VisionInference inference = connect(request);
            runPipeline(job, pending, inference, outputDir, store, reportItems);

            logSummary(job);
            if (store.stats().failedCount() > 0) {
                log.info("\n{}", store.report());
            }
            completionFileWriter.write(
                    new CompletionFileWriter.RunCounts(job.totalImages, job.successful, job.failed, job.noSubject),
                    store.stats().totalTime(),
                    request.dryRun()
            );
        }
    }

    /**
     * @return true when the job ends after the sequence preview
     */
    private boolean runSequencePass(JobRun job, List<ImageItem> images, Path outputDir) {
        JobRequest request = job.request;
        List<Sequence> sequences = sequenceService.detect(images, request.sequenceThreshold(),
                !request.skipSequenceSharpness());
        job.sequences = sequences.size();

        if (request.sequenceDryRun()) {
            job.sequencePreview = sequenceService.format(sequences);
            log.info("\n{}", job.sequencePreview);
            return true;
        }
        if (sequences.isEmpty()) {
            return false;
        }
        if (request.dryRun()) {
            log.info("[DRY RUN] Would write sequence metadata for {} sequences", sequences.size());
            return false;
        }

        log.info("Writing sequence keywords...");
        int failures = sequenceTagWriter.writeAll(sequences, outputDir);
        if (failures > 0) {
            log.warn("Sequence keywords could not be written to {} frames", failures);
        }
        log.info("Sequence metadata written for {} sequences", sequences.size());
        return false;
    }

    private VisionInference connect(JobRequest request) {
        log.info("Initializing vision model...");
        VisionInference inference = request.model() == null || request.model().isBlank()
                ? visionInference
                : visionInference.withModel(request.model());
        if (!inference.checkConnection()) {
            throw new VisionInference.InferenceUnavailableException(
                    "Cannot connect to inference server at " + properties.getInference().getServerUrl());
        }
        inference.ensureReady();
        log.info("Using {}", inference.describe());
        if (request.warmUp()) {
            inference.warmUp();
        }
        return inference;
    }

    private void runPipeline(JobRun job, List<ImageItem> images, VisionInference inference, Path outputDir,
                             ProgressStore store, List<Map<String, Object>> reportItems) {
        JobRequest request = job.request;
        String prompt = promptCatalog.promptFor(request.profileOrDefault(), request.fuzzyNumbers());

        log.info("Processing {} images with profile '{}'...", images.size(), request.profileOrDefault().id());
        if (request.fuzzyNumbers()) {
            log.info("Fuzzy number detection enabled");
        }
        if (request.dryRun()) {
            log.info("DRY RUN - no metadata will be written");
        }

        BatchProgress progress = new BatchProgress(images.size());
        PipelinedProcessor.Handler<PreparedImage> handler =
                (item, prepared) -> tagImage(item, prepared, inference, prompt, request, outputDir);
        PipelinedProcessor.Listener listener = new PipelinedProcessor.Listener() {
            @Override
            public void itemCompleted(int done, int total, ItemResult result) {
                job.record(result);
                logOutcome(result);
                log.info(progress.advance());
                reportItems.add(reportItem(result));
                publishOutcome(job.id, done, total, result);
            }
        };

        processor.run(images, imageEncoder, handler, store, listener);
    }

    ItemResult tagImage(ImageItem item, PreparedImage prepared, VisionInference inference, String prompt,
                        JobRequest request, Path outputDir) {
        long start = System.nanoTime();
        String response = inference.analyze(prepared, prompt);
        double inferenceTime = (System.nanoTime() - start) / 1_000_000_000.0;

        VehicleMetadata metadata = responseParser.parse(response);
        List<String> keywords = keywordMapper.keywordsFor(metadata, request.fuzzyNumbers());

        String targetPath = null;
        if (!request.dryRun()) {
            Path target = HierarchicalKeywords.targetFor(item.path(), outputDir, item.isRaw());
            metadataWriter.write(target, KeywordMapper.forWriting(keywords), item.path(), true);
            targetPath = target.toString();
        }
        return ItemResult.success(item, keywords, inferenceTime, metadata.carDetected(), targetPath, metadata);
    }

    private void logOutcome(ItemResult result) {
        if (!result.success()) {
            log.warn("  -> FAILED: {}", result.error());
            return;
        }
        String keywords;
        if (!result.subjectDetected()) {
            keywords = "(no car detected)";
        } else if (result.keywords().isEmpty()) {
            keywords = "(no keywords)";
        } else {
            keywords = String.join(", ", result.keywords());
        }
        log.info("  -> {} ({}s)", keywords, String.format("%.1f", result.inferenceTime()));
    }

    private void publishOutcome(String jobId, int done, int total, ItemResult result) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("image", result.item().name());
        payload.put("done", done);
        payload.put("total", total);
        if (result.success()) {
            payload.put("keywords", result.keywords());
            eventService.publish(EventService.ITEM_COMPLETED, jobId, "Image tagged", payload);
        } else {
            payload.put("error", result.error());
            eventService.publish(EventService.ITEM_FAILED, jobId, "Image failed", payload);
        }
    }

    private void logSummary(JobRun job) {
        log.info("-".repeat(50));
        StringBuilder summary = new StringBuilder()
                .append(job.successful).append(" successful, ")
                .append(job.failed).append(" failed");
        if (job.noSubject > 0) {
            summary.append(", ").append(job.noSubject).append(" no car detected");
        }
        log.info("Processing complete: {}", summary);
        if (job.request.dryRun()) {
            log.info("DRY RUN complete - no files were modified");
        }
    }

    private Map<String, Object> reportItem(ItemResult result) {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put("image", result.item().toString());
        item.put("success", result.success());
        item.put("keywords", result.keywords());
        item.put("error", result.error());
        item.put("inferenceTime", result.inferenceTime());
        item.put("targetPath", result.targetPath());
        return item;
    }

    private void writeReport(String jobId, Map<String, Object> report) {
        try {
            Files.createDirectories(Path.of(properties.getOutput().getReportDir()));
            Path reportPath = Path.of(properties.getOutput().getReportDir()).resolve(jobId + ".json");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(reportPath.toFile(), report);
        } catch (IOException e) {
            log.warn("Failed to write report for {}: {}", jobId, e.getMessage());
        }
    }

    private static String now() {
        return OffsetDateTime.now(ZoneOffset.UTC).toString();
    }

    private static class JobRun {
        private final String id;
        private final JobRequest request;
        private final Path input;
        private final String createdAt = now();
        private volatile JobStatus status = JobStatus.CREATED;
        private volatile String startedAt;
        private volatile String endedAt;
        private volatile String lastError;
        private volatile String sequencePreview;
        private volatile int totalImages;
        private volatile int skipped;
        private volatile int sequences;
        private int processed;
        private int successful;
        private int failed;
        private int noSubject;

        JobRun(String id, JobRequest request, Path input) {
            this.id = id;
            this.request = request;
            this.input = input;
        }

        void markRunning() {
            status = JobStatus.RUNNING;
            startedAt = now();
        }

        void finish(JobStatus finalStatus, String error) {
            lastError = error;
            endedAt = now();
            status = finalStatus;
        }

        synchronized void record(ItemResult result) {
            processed++;
            if (result.success()) {
                successful++;
                if (!result.subjectDetected()) {
                    noSubject++;
                }
            } else {
                failed++;
            }
        }

        synchronized JobView toView() {
            return new JobView(
                    id,
                    input.toString(),
                    status,
                    createdAt,
                    startedAt,
                    endedAt,
                    totalImages,
                    processed,
                    successful,
                    failed,
                    noSubject,
                    skipped,
                    sequences,
                    lastError
            );
        }
    }
}
