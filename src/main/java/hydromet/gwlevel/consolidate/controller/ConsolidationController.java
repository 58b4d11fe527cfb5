package hydromet.gwlevel.consolidate.controller;

import hydromet.gwlevel.consolidate.config.ConsolidationConfig;
import hydromet.gwlevel.consolidate.dto.AuditSummaryDto;
import hydromet.gwlevel.consolidate.dto.ConsolidationReportDto;
import hydromet.gwlevel.consolidate.dto.ConsolidationRunRequestDto;
import hydromet.gwlevel.consolidate.dto.ErrorResponseDto;
import hydromet.gwlevel.consolidate.exception.RunInProgressException;
import hydromet.gwlevel.consolidate.model.AuditEntry;
import hydromet.gwlevel.consolidate.service.AuditTrailService;
import hydromet.gwlevel.consolidate.service.ConsolidationPipelineService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Controller for consolidation runs and the audit trail
 * Triggers a run over the region folders and reports what happened to every file
 */
@RestController
@RequestMapping("/api/v1/consolidation")
@CrossOrigin(origins = "*", maxAge = 3600)
@Tag(name = "Consolidation", description = "National groundwater level consolidation runs and audit trail")
public class ConsolidationController {

    private static final Logger logger = LoggerFactory.getLogger(ConsolidationController.class);

    @Autowired
    private ConsolidationPipelineService pipelineService;

    @Autowired
    private AuditTrailService auditTrailService;

    @Autowired
    private ConsolidationConfig config;

    /**
     * Run a consolidation synchronously
     */
    @PostMapping("/runs")
    @Operation(
        summary = "Run a consolidation",
        description = "Validates, reshapes and consolidates every region folder under the input root, "
                + "then writes the national matrix. Omitted paths fall back to the configured defaults."
    )
    @ApiResponse(responseCode = "200", description = "Run completed or was cancelled; see the report status")
    @ApiResponse(responseCode = "400", description = "Invalid input root")
    @ApiResponse(responseCode = "409", description = "Another run is in progress")
    @ApiResponse(responseCode = "500", description = "Run failed; the body carries the partial report")
    public ResponseEntity<?> startRun(@RequestBody(required = false) ConsolidationRunRequestDto request) {
        Path inputRoot = Paths.get(orDefault(request == null ? null : request.getInputRoot(), config.getInputRoot()));
        Path output = Paths.get(orDefault(request == null ? null : request.getOutputFile(), config.getOutputFile()));

        logger.info("Consolidation run requested: {} -> {}", inputRoot, output);

        try {
            ConsolidationReportDto report = pipelineService.run(inputRoot, output);

            if (ConsolidationReportDto.STATUS_FAILED.equals(report.getStatus())) {
                ErrorResponseDto errorResponse = new ErrorResponseDto(
                    "Consolidation Failed",
                    report.getErrorMessage(),
                    report
                );
                return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
            }
            return ResponseEntity.ok(report);

        } catch (IllegalArgumentException e) {
            logger.warn("Validation error: {}", e.getMessage());
            return ResponseEntity.badRequest().body(new ErrorResponseDto("Validation Error", e.getMessage()));

        } catch (RunInProgressException e) {
            logger.warn("Run refused: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(new ErrorResponseDto("Run In Progress", e.getMessage()));

        } catch (Exception e) {
            logger.error("Consolidation run failed unexpectedly", e);
            ErrorResponseDto errorResponse = new ErrorResponseDto(
                "Processing Error",
                "Consolidation run failed: " + e.getMessage()
            );
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
        }
    }

    /**
     * Cancel the active run
     */
    @PostMapping("/runs/cancel")
    @Operation(
        summary = "Cancel the active run",
        description = "The run stops at the next file or region boundary and writes no output"
    )
    @ApiResponse(responseCode = "200", description = "Cancellation requested")
    @ApiResponse(responseCode = "409", description = "No run in progress")
    public ResponseEntity<?> cancelRun() {
        if (!pipelineService.cancel()) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(new ErrorResponseDto("No Active Run", "There is no consolidation run to cancel"));
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "CANCEL_REQUESTED");
        response.put("message", "The active run will stop at the next file or region boundary");
        return ResponseEntity.ok(response);
    }

    /**
     * Check whether a run is in progress
     */
    @GetMapping("/runs/status")
    @Operation(summary = "Get run status", description = "Reports whether a consolidation run is in progress")
    @ApiResponse(responseCode = "200", description = "Status retrieved successfully")
    public ResponseEntity<Map<String, Object>> getRunStatus() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("running", pipelineService.isRunning());
        return ResponseEntity.ok(response);
    }

    /**
     * Audit trail of the latest run
     */
    @GetMapping("/audit")
    @Operation(
        summary = "Get audit trail",
        description = "Every stage each file reached in the latest run, in the order it was recorded"
    )
    @ApiResponse(responseCode = "200", description = "Audit trail retrieved successfully")
    public ResponseEntity<List<AuditEntry>> getAuditTrail(
            @Parameter(description = "Only return entries of this file")
            @RequestParam(value = "file_id", required = false) String fileId) {

        List<AuditEntry> entries = fileId == null || fileId.isBlank()
                ? auditTrailService.getEntries()
                : auditTrailService.getEntriesFor(fileId);
        return ResponseEntity.ok(entries);
    }

    /**
     * Accepted/rejected counts of the latest run
     */
    @GetMapping("/audit/summary")
    @Operation(
        summary = "Get audit summary",
        description = "Accepted and rejected file counts, grouped by outcome and rejection reason"
    )
    @ApiResponse(responseCode = "200", description = "Summary retrieved successfully")
    public ResponseEntity<AuditSummaryDto> getAuditSummary() {
        return ResponseEntity.ok(auditTrailService.summarize());
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
