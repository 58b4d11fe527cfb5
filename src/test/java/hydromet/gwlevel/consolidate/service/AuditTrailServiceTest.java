package hydromet.gwlevel.consolidate.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import hydromet.gwlevel.consolidate.dto.AuditSummaryDto;
import hydromet.gwlevel.consolidate.model.AuditEntry;
import hydromet.gwlevel.consolidate.model.FileStage;
import hydromet.gwlevel.consolidate.model.RawFile;
import hydromet.gwlevel.consolidate.model.ValidationVerdict;
import hydromet.gwlevel.consolidate.model.ValidationVerdict.Outcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static hydromet.gwlevel.consolidate.util.TestDataFactory.rawFile;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for AuditTrailService
 *
 * Tests cover:
 * - Forward-only stage transitions
 * - Summary counts and rejection reasons
 * - Concurrent writers
 * - JSON-lines export
 */
class AuditTrailServiceTest {

    @TempDir
    Path tempDir;

    private AuditTrailService auditTrailService;

    @BeforeEach
    void setUp() {
        auditTrailService = new AuditTrailService();
    }

    @Test
    void testRecord_AcceptedVerdict() {
        // Given: Accepted verdict
        RawFile file = rawFile("R1", "r1/a.csv", "x");
        ValidationVerdict verdict = ValidationVerdict.accepted(file, "2 data rows, 5 columns");

        // When: Record
        AuditEntry entry = auditTrailService.record(file.getFileId(), verdict);

        // Then: Entry carries id, outcome, reason and timestamp
        assertThat(entry.getFileId()).isEqualTo("r1/a.csv");
        assertThat(entry.getRegionCode()).isEqualTo("R1");
        assertThat(entry.getStage()).isEqualTo(FileStage.VALIDATED_ACCEPTED);
        assertThat(entry.getOutcome()).isEqualTo("ACCEPTED");
        assertThat(entry.getReason()).isEqualTo("2 data rows, 5 columns");
        assertThat(entry.getTimestamp()).isNotNull();
        assertThat(auditTrailService.currentStage("r1/a.csv")).isEqualTo(FileStage.VALIDATED_ACCEPTED);
    }

    @Test
    void testRecordStage_FullForwardPath() {
        // Given: File ingested and accepted
        auditTrailService.recordStage("r1/a.csv", "R1", FileStage.INGESTED, "12 bytes");
        auditTrailService.record("r1/a.csv", ValidationVerdict.accepted(rawFile("R1", "r1/a.csv", "x"), "ok"));

        // When: Walk the remaining stages
        auditTrailService.recordStage("r1/a.csv", "R1", FileStage.RESHAPED, "1 dates x 1 stations");
        auditTrailService.recordStage("r1/a.csv", "R1", FileStage.CONSOLIDATED_INTO_REGION, "R1");
        auditTrailService.recordStage("r1/a.csv", "R1", FileStage.MERGED_INTO_NATIONAL, "merged");

        // Then: Every step recorded in order
        assertThat(auditTrailService.getEntriesFor("r1/a.csv"))
                .extracting(AuditEntry::getStage)
                .containsExactly(FileStage.INGESTED, FileStage.VALIDATED_ACCEPTED, FileStage.RESHAPED,
                        FileStage.CONSOLIDATED_INTO_REGION, FileStage.MERGED_INTO_NATIONAL);
        assertThat(auditTrailService.currentStage("r1/a.csv")).isEqualTo(FileStage.MERGED_INTO_NATIONAL);
    }

    @Test
    void testRecordStage_BackwardMove_Refused() {
        // Given: File already reshaped
        auditTrailService.record("r1/a.csv", ValidationVerdict.accepted(rawFile("R1", "r1/a.csv", "x"), "ok"));
        auditTrailService.recordStage("r1/a.csv", "R1", FileStage.RESHAPED, "ok");

        // When/Then: Going back to validation is refused and nothing is appended
        assertThatThrownBy(() -> auditTrailService.record("r1/a.csv",
                ValidationVerdict.rejected("r1/a.csv", "R1", Outcome.REJECTED_OTHER, "late")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("RESHAPED");
        assertThat(auditTrailService.getEntries()).hasSize(2);
        assertThat(auditTrailService.currentStage("r1/a.csv")).isEqualTo(FileStage.RESHAPED);
    }

    @Test
    void testRecordStage_RejectedFileCannotBeReshaped() {
        auditTrailService.record("r1/a.csv",
                ValidationVerdict.rejected("r1/a.csv", "R1", Outcome.REJECTED_EMPTY, "No data rows below header"));

        assertThatThrownBy(() -> auditTrailService.recordStage("r1/a.csv", "R1", FileStage.RESHAPED, "x"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testRecordStage_UnknownFileMustStartAtEntryStage() {
        assertThatThrownBy(() -> auditTrailService.recordStage("r1/new.csv", "R1",
                FileStage.CONSOLIDATED_INTO_REGION, "x"))
                .isInstanceOf(IllegalStateException.class);
        assertThat(auditTrailService.currentStage("r1/new.csv")).isNull();
    }

    @Test
    void testSummarize_CountsAndReasons() {
        // Given: Two accepted, three rejected, one reshape failure
        auditTrailService.record("a", ValidationVerdict.accepted(rawFile("R1", "a", "x"), "ok"));
        auditTrailService.record("b", ValidationVerdict.accepted(rawFile("R1", "b", "x"), "ok"));
        auditTrailService.record("c", ValidationVerdict.rejected("c", "R1", Outcome.REJECTED_EMPTY, "No data rows below header"));
        auditTrailService.record("d", ValidationVerdict.rejected("d", "R1", Outcome.REJECTED_EMPTY, "No data rows below header"));
        auditTrailService.record("e", ValidationVerdict.rejected("e", "R2", Outcome.REJECTED_MISSING_COLUMNS, "Missing required columns: [Date]"));
        auditTrailService.recordStage("b", "R1", FileStage.RESHAPE_FAILED, "No usable rows (3 skipped)");

        // When: Summarize
        AuditSummaryDto summary = auditTrailService.summarize();

        // Then: Counts by outcome and reason
        assertThat(summary.getFilesValidated()).isEqualTo(5);
        assertThat(summary.getFilesAccepted()).isEqualTo(2);
        assertThat(summary.getFilesRejected()).isEqualTo(3);
        assertThat(summary.getReshapeFailures()).isEqualTo(1);
        assertThat(summary.getFilesMerged()).isZero();
        assertThat(summary.getOutcomeCounts())
                .containsEntry("ACCEPTED", 2)
                .containsEntry("REJECTED_EMPTY", 2)
                .containsEntry("REJECTED_MISSING_COLUMNS", 1);
        assertThat(summary.getRejectionReasons())
                .containsEntry("REJECTED_EMPTY: No data rows below header", 2)
                .containsEntry("REJECTED_MISSING_COLUMNS: Missing required columns: [Date]", 1)
                .containsEntry("RESHAPE_FAILED: No usable rows (3 skipped)", 1);
    }

    @Test
    void testRecord_ConcurrentWriters_NoEntryLost() throws Exception {
        // Given: 8 threads recording 200 files each
        int threads = 8;
        int filesPerThread = 200;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        for (int t = 0; t < threads; t++) {
            int thread = t;
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < filesPerThread; i++) {
                    String fileId = "t" + thread + "/f" + i + ".csv";
                    auditTrailService.recordStage(fileId, "R1", FileStage.INGESTED, "x");
                    auditTrailService.record(fileId, ValidationVerdict.accepted(rawFile("R1", fileId, "x"), "ok"));
                    auditTrailService.recordStage(fileId, "R1", FileStage.RESHAPED, "x");
                }
                return null;
            }));
        }

        // When: Released together
        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        executor.shutdown();

        // Then: Every entry is there
        assertThat(auditTrailService.getEntries()).hasSize(threads * filesPerThread * 3);
        assertThat(auditTrailService.summarize().getFilesAccepted()).isEqualTo(threads * filesPerThread);
    }

    @Test
    void testExportJsonLines_OneObjectPerEntry() throws Exception {
        // Given: Two entries
        auditTrailService.record("r1/a.csv", ValidationVerdict.accepted(rawFile("R1", "r1/a.csv", "x"), "ok"));
        auditTrailService.record("r1/b.csv",
                ValidationVerdict.rejected("r1/b.csv", "R1", Outcome.REJECTED_PLACEHOLDER, "placeholders only"));
        Path output = tempDir.resolve("logs/audit.jsonl");

        // When: Export
        auditTrailService.exportJsonLines(output);

        // Then: One JSON object per line with snake_case keys and ISO timestamps
        List<String> lines = Files.readAllLines(output, StandardCharsets.UTF_8);
        assertThat(lines).hasSize(2);
        JsonNode second = new ObjectMapper().readTree(lines.get(1));
        assertThat(second.get("file_id").asText()).isEqualTo("r1/b.csv");
        assertThat(second.get("stage").asText()).isEqualTo("VALIDATED_REJECTED");
        assertThat(second.get("outcome").asText()).isEqualTo("REJECTED_PLACEHOLDER");
        assertThat(second.get("reason").asText()).isEqualTo("placeholders only");
        assertThat(second.get("timestamp").isTextual()).isTrue();
    }

    @Test
    void testReset_ClearsEverything() {
        auditTrailService.record("r1/a.csv", ValidationVerdict.accepted(rawFile("R1", "r1/a.csv", "x"), "ok"));

        auditTrailService.reset();

        assertThat(auditTrailService.getEntries()).isEmpty();
        assertThat(auditTrailService.currentStage("r1/a.csv")).isNull();
        // The same file id may be validated again in a new run
        auditTrailService.record("r1/a.csv", ValidationVerdict.accepted(rawFile("R1", "r1/a.csv", "x"), "ok"));
        assertThat(auditTrailService.getEntries()).hasSize(1);
    }
}
