package hydromet.gwlevel.consolidate.service;

import hydromet.gwlevel.consolidate.config.ConsolidationConfig;
import hydromet.gwlevel.consolidate.dto.ConsolidationReportDto;
import hydromet.gwlevel.consolidate.dto.ConsolidationReportDto.RegionSummary;
import hydromet.gwlevel.consolidate.exception.ConsolidationConflictException;
import hydromet.gwlevel.consolidate.exception.ConsolidationException;
import hydromet.gwlevel.consolidate.exception.MergeIntegrityException;
import hydromet.gwlevel.consolidate.exception.PipelineCancelledException;
import hydromet.gwlevel.consolidate.exception.ReshapeException;
import hydromet.gwlevel.consolidate.exception.RunInProgressException;
import hydromet.gwlevel.consolidate.model.FileStage;
import hydromet.gwlevel.consolidate.model.NationalMatrix;
import hydromet.gwlevel.consolidate.model.RawFile;
import hydromet.gwlevel.consolidate.model.RegionSource;
import hydromet.gwlevel.consolidate.model.RegionTable;
import hydromet.gwlevel.consolidate.model.SinkAck;
import hydromet.gwlevel.consolidate.model.ValidationVerdict;
import hydromet.gwlevel.consolidate.model.WideFrame;
import hydromet.gwlevel.consolidate.service.NationalMergeService.NationalAccumulator;
import hydromet.gwlevel.consolidate.service.RegionConsolidationService.RegionAccumulator;
import hydromet.gwlevel.consolidate.util.RunIdUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one end-to-end consolidation: discover region folders, validate and
 * reshape every file, consolidate each region, merge the regions into the
 * national matrix and hand it to the sink.
 *
 * Threading:
 * - files are validated and reshaped on the file processing pool
 * - each region is consolidated on the region pool, folding its frames in file-name order
 * - the calling thread folds region tables into the national matrix as they complete
 *
 * Only one run may be active at a time. {@link #cancel()} stops a run between
 * files and between regions; a cancelled or failed run never writes output.
 */
@Service
public class ConsolidationPipelineService {

    private static final Logger logger = LoggerFactory.getLogger(ConsolidationPipelineService.class);

    static final String REGION_CONSOLIDATED = "CONSOLIDATED";
    static final String REGION_SKIPPED = "SKIPPED";

    private final ConsolidationConfig config;
    private final RegionFolderScanner regionFolderScanner;
    private final FileValidationService fileValidationService;
    private final ReshapeService reshapeService;
    private final RegionConsolidationService regionConsolidationService;
    private final NationalMergeService nationalMergeService;
    private final AuditTrailService auditTrailService;
    private final MatrixSink matrixSink;
    private final AsyncTaskExecutor fileProcessingExecutor;
    private final AsyncTaskExecutor regionConsolidationExecutor;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public ConsolidationPipelineService(ConsolidationConfig config,
                                        RegionFolderScanner regionFolderScanner,
                                        FileValidationService fileValidationService,
                                        ReshapeService reshapeService,
                                        RegionConsolidationService regionConsolidationService,
                                        NationalMergeService nationalMergeService,
                                        AuditTrailService auditTrailService,
                                        MatrixSink matrixSink,
                                        @Qualifier("fileProcessingExecutor") AsyncTaskExecutor fileProcessingExecutor,
                                        @Qualifier("regionConsolidationExecutor") AsyncTaskExecutor regionConsolidationExecutor) {
        this.config = config;
        this.regionFolderScanner = regionFolderScanner;
        this.fileValidationService = fileValidationService;
        this.reshapeService = reshapeService;
        this.regionConsolidationService = regionConsolidationService;
        this.nationalMergeService = nationalMergeService;
        this.auditTrailService = auditTrailService;
        this.matrixSink = matrixSink;
        this.fileProcessingExecutor = fileProcessingExecutor;
        this.regionConsolidationExecutor = regionConsolidationExecutor;
    }

    /**
     * Run a consolidation with the configured input root and output file.
     */
    public ConsolidationReportDto run() {
        return run(Paths.get(config.getInputRoot()), Paths.get(config.getOutputFile()));
    }

    /**
     * Run a consolidation.
     *
     * @param inputRoot parent folder of the region folders
     * @param output    destination of the national matrix
     * @return the run report; its status is COMPLETED, FAILED or CANCELLED
     * @throws RunInProgressException if another run is in progress
     * @throws IllegalArgumentException if the input root is not a directory
     */
    public ConsolidationReportDto run(Path inputRoot, Path output) {
        if (!Files.isDirectory(inputRoot)) {
            throw new IllegalArgumentException("Input root is not a directory: " + inputRoot);
        }
        if (!running.compareAndSet(false, true)) {
            throw new RunInProgressException("A consolidation run is already in progress");
        }

        String runId = UUID.randomUUID().toString();
        RunIdUtil.setRunId(runId);
        cancelled.set(false);
        auditTrailService.reset();

        LocalDateTime startTime = LocalDateTime.now();
        ConsolidationReportDto report = new ConsolidationReportDto();
        report.setRunId(runId);
        report.setInputRoot(inputRoot.toString());
        report.setProcessingStartTime(startTime);
        report.setCompleteness(NationalMatrix.Completeness.PARTIAL.name());
        report.setRegionSummaries(new ArrayList<>());
        report.setRegionsSkipped(new ArrayList<>());

        List<Future<RegionOutcome>> regionFutures = new ArrayList<>();
        try {
            logger.info("Starting consolidation run {} from {} to {}", runId, inputRoot, output);

            List<RegionSource> regions = regionFolderScanner.discoverRegions(inputRoot);
            report.setFilesDiscovered(regions.stream().mapToInt(region -> region.getFiles().size()).sum());

            NationalMatrix matrix = consolidateRegions(regions, regionFutures, report);
            checkCancelled();

            SinkAck ack = matrixSink.write(matrix, output);

            report.setStatus(ConsolidationReportDto.STATUS_COMPLETED);
            report.setCompleteness(matrix.getCompleteness().name());
            report.setOutputLocation(ack.getLocation());
            report.setStationCount(matrix.getColumnCount());
            report.setDateCount(matrix.getRowCount());
            report.setFirstDate(matrix.getFirstDate());
            report.setLastDate(matrix.getLastDate());

        } catch (PipelineCancelledException e) {
            logger.warn("Consolidation run {} cancelled: {}", runId, e.getMessage());
            markCancelled(report, e.getMessage());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Consolidation run {} interrupted", runId);
            markCancelled(report, "Run interrupted");

        } catch (MergeIntegrityException e) {
            logger.error("National merge failed in run {}: {}", runId, e.getMessage());
            markFailed(report, "National merge failed: " + e.getMessage());

        } catch (IOException e) {
            logger.error("I/O failure in run {}", runId, e);
            markFailed(report, "I/O failure: " + e.getMessage());

        } catch (ConsolidationException e) {
            logger.error("Consolidation run {} failed", runId, e);
            markFailed(report, e.getMessage());

        } catch (RuntimeException e) {
            logger.error("Consolidation run {} failed unexpectedly", runId, e);
            markFailed(report, "Unexpected failure: " + e.getMessage());

        } finally {
            regionFutures.forEach(future -> future.cancel(true));
            exportAuditTrail();
            finishReport(report, startTime);
            logger.info("Consolidation run {} finished with status {} in {} ms",
                    runId, report.getStatus(), report.getProcessingDurationMs());
            RunIdUtil.clearRunId();
            cancelled.set(false);
            running.set(false);
        }
        return report;
    }

    /**
     * Ask the active run to stop at the next file or region boundary.
     *
     * @return true if a run was in progress
     */
    public boolean cancel() {
        if (!running.get()) {
            return false;
        }
        logger.info("Cancellation requested");
        cancelled.set(true);
        return true;
    }

    public boolean isRunning() {
        return running.get();
    }

    private NationalMatrix consolidateRegions(List<RegionSource> regions,
                                              List<Future<RegionOutcome>> regionFutures,
                                              ConsolidationReportDto report) throws InterruptedException {
        CompletionService<RegionOutcome> completionService =
                new ExecutorCompletionService<>(regionConsolidationExecutor);
        for (RegionSource region : regions) {
            regionFutures.add(completionService.submit(() -> consolidateRegion(region)));
        }

        NationalAccumulator national = nationalMergeService.newAccumulator();
        List<RegionOutcome> merged = new ArrayList<>();
        int conflictCount = 0;

        for (int i = 0; i < regions.size(); i++) {
            checkCancelled();
            RegionOutcome outcome = await(completionService.take());
            report.getRegionSummaries().add(outcome.summary);

            if (outcome.table == null) {
                report.getRegionsSkipped().add(outcome.summary.getRegion());
                continue;
            }
            national.add(outcome.table);
            conflictCount += outcome.table.getConflicts().size();
            merged.add(outcome);
        }

        NationalMatrix matrix = national.complete();
        for (RegionOutcome outcome : merged) {
            for (String fileId : outcome.table.getContributingFiles()) {
                auditTrailService.recordStage(fileId, outcome.table.getRegionCode(),
                        FileStage.MERGED_INTO_NATIONAL, "Merged into national matrix");
            }
        }

        report.setRegionsMerged(merged.size());
        report.setConflictCount(conflictCount);
        return matrix;
    }

    /**
     * Region task: keep a bounded window of files on the file pool and fold the
     * frames in file order. A future leaves the window as soon as its frame is folded.
     */
    private RegionOutcome consolidateRegion(RegionSource region) throws InterruptedException {
        String regionCode = region.getRegionCode();
        logger.info("Consolidating region {} ({} files)", regionCode, region.getFiles().size());

        int window = Math.max(1, config.getExecutors().getRegionFilesInFlight());
        Iterator<Path> pending = region.getFiles().iterator();
        Deque<Future<WideFrame>> fileFutures = new ArrayDeque<>(window);

        RegionAccumulator accumulator = regionConsolidationService.newAccumulator(regionCode);
        try {
            while (fileFutures.size() < window && pending.hasNext()) {
                fileFutures.add(submitFile(regionCode, pending.next()));
            }
            while (!fileFutures.isEmpty()) {
                checkCancelled();
                WideFrame frame = await(fileFutures.peekFirst());
                fileFutures.removeFirst();
                if (pending.hasNext()) {
                    fileFutures.add(submitFile(regionCode, pending.next()));
                }
                if (frame != null) {
                    accumulator.add(frame);
                }
            }
        } catch (ConsolidationConflictException e) {
            fileFutures.forEach(future -> future.cancel(true));
            logger.warn("Region {} skipped: {}", regionCode, e.getMessage());
            return RegionOutcome.skipped(region, e.getMessage());
        } catch (PipelineCancelledException | InterruptedException e) {
            fileFutures.forEach(future -> future.cancel(true));
            throw e;
        }

        if (accumulator.isEmpty()) {
            logger.warn("Region {} skipped: no file survived validation and reshaping", regionCode);
            return RegionOutcome.skipped(region, "No usable files");
        }

        RegionTable table = accumulator.build();
        for (String fileId : table.getContributingFiles()) {
            auditTrailService.recordStage(fileId, regionCode, FileStage.CONSOLIDATED_INTO_REGION,
                    "Consolidated into region " + regionCode);
        }
        return RegionOutcome.consolidated(region, table);
    }

    private Future<WideFrame> submitFile(String regionCode, Path path) {
        return fileProcessingExecutor.submit(() -> processFile(regionCode, path));
    }

    /**
     * File task: load, validate and reshape one file.
     *
     * @return the reshaped frame, or null if the file was rejected or could not be reshaped
     */
    private WideFrame processFile(String regionCode, Path path) {
        checkCancelled();
        String fileId = path.toString();

        RawFile file;
        try {
            file = regionFolderScanner.load(regionCode, path);
        } catch (IOException e) {
            logger.warn("Could not read {}: {}", fileId, e.getMessage());
            auditTrailService.record(fileId, ValidationVerdict.rejected(fileId, regionCode,
                    ValidationVerdict.Outcome.REJECTED_OTHER, "Unreadable file: " + e.getMessage()));
            return null;
        }
        auditTrailService.recordStage(fileId, regionCode, FileStage.INGESTED,
                String.format("%d bytes, sha256 %s", file.getSizeBytes(), file.getChecksum()));

        ValidationVerdict verdict = fileValidationService.validate(file);
        if (!verdict.isAccepted()) {
            return null;
        }

        try {
            WideFrame frame = reshapeService.reshape(file);
            auditTrailService.recordStage(fileId, regionCode, FileStage.RESHAPED,
                    String.format("%d dates x %d stations", frame.getRowCount(), frame.getColumnCount()));
            return frame;
        } catch (ReshapeException e) {
            logger.warn("Reshape failed for {}: {}", fileId, e.getMessage());
            auditTrailService.recordStage(fileId, regionCode, FileStage.RESHAPE_FAILED, e.getMessage());
            return null;
        }
    }

    private static <T> T await(Future<T> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof InterruptedException) {
                throw (InterruptedException) cause;
            }
            throw new ConsolidationException("Pipeline task failed", cause);
        }
    }

    private void checkCancelled() {
        if (cancelled.get() || Thread.currentThread().isInterrupted()) {
            throw new PipelineCancelledException("Run cancelled on request");
        }
    }

    private void exportAuditTrail() {
        String logFile = config.getAudit().getLogFile();
        if (logFile == null || logFile.isBlank()) {
            return;
        }
        try {
            auditTrailService.exportJsonLines(Paths.get(logFile));
        } catch (IOException e) {
            logger.error("Could not write audit trail to {}", logFile, e);
        }
    }

    private static void markCancelled(ConsolidationReportDto report, String message) {
        report.setStatus(ConsolidationReportDto.STATUS_CANCELLED);
        report.setErrorMessage(message);
    }

    private static void markFailed(ConsolidationReportDto report, String message) {
        report.setStatus(ConsolidationReportDto.STATUS_FAILED);
        report.setErrorMessage(message);
    }

    private void finishReport(ConsolidationReportDto report, LocalDateTime startTime) {
        LocalDateTime endTime = LocalDateTime.now();
        report.setAuditSummary(auditTrailService.summarize());
        report.setProcessingEndTime(endTime);
        report.setProcessingDurationMs(Duration.between(startTime, endTime).toMillis());
    }

    private static final class RegionOutcome {
        private final RegionTable table;
        private final RegionSummary summary;

        private RegionOutcome(RegionTable table, RegionSummary summary) {
            this.table = table;
            this.summary = summary;
        }

        static RegionOutcome consolidated(RegionSource region, RegionTable table) {
            return new RegionOutcome(table, new RegionSummary(region.getRegionCode(), REGION_CONSOLIDATED,
                    region.getFiles().size(), table.getContributingFiles().size(),
                    table.getColumnCount(), table.getRowCount(), table.getConflicts().size(), null));
        }

        static RegionOutcome skipped(RegionSource region, String reason) {
            return new RegionOutcome(null, new RegionSummary(region.getRegionCode(), REGION_SKIPPED,
                    region.getFiles().size(), 0, 0, 0, 0, reason));
        }
    }
}
