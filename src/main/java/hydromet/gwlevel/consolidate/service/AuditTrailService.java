package hydromet.gwlevel.consolidate.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import hydromet.gwlevel.consolidate.dto.AuditSummaryDto;
import hydromet.gwlevel.consolidate.model.AuditEntry;
import hydromet.gwlevel.consolidate.model.FileStage;
import hydromet.gwlevel.consolidate.model.ValidationVerdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.stream.Collectors;

/**
 * Append-only record of every file's disposition.
 *
 * Safe under concurrent writers: entries go to a lock-free queue and the
 * per-file stage is advanced atomically. A file can only move forward
 * through {@link FileStage}; any attempt to go back is refused.
 */
@Service
public class AuditTrailService {

    private static final Logger logger = LoggerFactory.getLogger(AuditTrailService.class);

    private final Queue<AuditEntry> entries = new ConcurrentLinkedQueue<>();
    private final Map<String, FileStage> stages = new ConcurrentHashMap<>();

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    /**
     * Record the validation verdict of a file.
     */
    public AuditEntry record(String fileId, ValidationVerdict verdict) {
        FileStage stage = verdict.isAccepted() ? FileStage.VALIDATED_ACCEPTED : FileStage.VALIDATED_REJECTED;
        return append(fileId, verdict.getRegionCode(), stage, verdict.getOutcome().name(), verdict.getReason());
    }

    /**
     * Record that a file moved to a later stage.
     *
     * @throws IllegalStateException if the transition is not a forward move from the file's current stage
     */
    public AuditEntry recordStage(String fileId, String regionCode, FileStage stage, String reason) {
        return append(fileId, regionCode, stage, stage.name(), reason);
    }

    private AuditEntry append(String fileId, String regionCode, FileStage stage, String outcome, String reason) {
        stages.compute(fileId, (id, current) -> {
            boolean allowed = current == null ? FileStage.isEntryStage(stage) : current.canAdvanceTo(stage);
            if (!allowed) {
                throw new IllegalStateException(String.format(
                        "File %s cannot move from %s to %s", id, current, stage));
            }
            return stage;
        });

        AuditEntry entry = new AuditEntry(fileId, regionCode, stage, outcome, reason, LocalDateTime.now());
        entries.add(entry);
        logger.debug("Audit: {} [{}] {} - {}", fileId, regionCode, outcome, reason);
        return entry;
    }

    public FileStage currentStage(String fileId) {
        return stages.get(fileId);
    }

    /**
     * Snapshot of all entries in arrival order.
     */
    public List<AuditEntry> getEntries() {
        return new ArrayList<>(entries);
    }

    public List<AuditEntry> getEntriesFor(String fileId) {
        return entries.stream()
                .filter(entry -> entry.getFileId().equals(fileId))
                .collect(Collectors.toList());
    }

    /**
     * Accepted/rejected counts and rejection reasons, from the validation entries.
     */
    public AuditSummaryDto summarize() {
        Map<ValidationVerdict.Outcome, Integer> byOutcome = new EnumMap<>(ValidationVerdict.Outcome.class);
        Map<String, Integer> reasons = new LinkedHashMap<>();
        int reshapeFailures = 0;
        int merged = 0;

        for (AuditEntry entry : entries) {
            switch (entry.getStage()) {
                case VALIDATED_ACCEPTED:
                case VALIDATED_REJECTED:
                    ValidationVerdict.Outcome outcome = ValidationVerdict.Outcome.valueOf(entry.getOutcome());
                    byOutcome.merge(outcome, 1, Integer::sum);
                    if (outcome != ValidationVerdict.Outcome.ACCEPTED) {
                        reasons.merge(outcome.name() + ": " + entry.getReason(), 1, Integer::sum);
                    }
                    break;
                case RESHAPE_FAILED:
                    reshapeFailures++;
                    reasons.merge("RESHAPE_FAILED: " + entry.getReason(), 1, Integer::sum);
                    break;
                case MERGED_INTO_NATIONAL:
                    merged++;
                    break;
                default:
                    break;
            }
        }

        int accepted = byOutcome.getOrDefault(ValidationVerdict.Outcome.ACCEPTED, 0);
        int validated = byOutcome.values().stream().mapToInt(Integer::intValue).sum();

        AuditSummaryDto summary = new AuditSummaryDto();
        summary.setFilesValidated(validated);
        summary.setFilesAccepted(accepted);
        summary.setFilesRejected(validated - accepted);
        summary.setReshapeFailures(reshapeFailures);
        summary.setFilesMerged(merged);
        Map<String, Integer> outcomeCounts = new LinkedHashMap<>();
        byOutcome.forEach((outcome, count) -> outcomeCounts.put(outcome.name(), count));
        summary.setOutcomeCounts(outcomeCounts);
        summary.setRejectionReasons(reasons);
        return summary;
    }

    /**
     * Mirror the trail as JSON lines. Called once per run by the pipeline thread.
     */
    public void exportJsonLines(Path destination) throws IOException {
        Path parent = destination.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (BufferedWriter writer = Files.newBufferedWriter(destination, StandardCharsets.UTF_8)) {
            for (AuditEntry entry : entries) {
                writer.write(objectMapper.writeValueAsString(entry));
                writer.newLine();
            }
        }
        logger.info("Wrote {} audit entries to {}", entries.size(), destination);
    }

    /**
     * Forget everything recorded so far. Used at the start of a new run.
     */
    public void reset() {
        entries.clear();
        stages.clear();
    }
}
