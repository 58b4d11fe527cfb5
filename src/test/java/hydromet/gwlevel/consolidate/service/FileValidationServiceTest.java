package hydromet.gwlevel.consolidate.service;

import hydromet.gwlevel.consolidate.config.ConsolidationConfig;
import hydromet.gwlevel.consolidate.model.RawFile;
import hydromet.gwlevel.consolidate.model.RegionSchema;
import hydromet.gwlevel.consolidate.model.ValidationVerdict;
import hydromet.gwlevel.consolidate.model.ValidationVerdict.Outcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.nio.charset.StandardCharsets;
import java.util.Random;

import static hydromet.gwlevel.consolidate.util.TestDataFactory.*;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for FileValidationService
 *
 * Tests cover:
 * - Empty and header-only files
 * - Missing required columns, default and region-specific schemas
 * - Placeholder-only files
 * - Minimum row threshold
 * - Binary and unreadable input never raising
 * - Every verdict written to the audit trail
 */
class FileValidationServiceTest {

    @Mock
    private AuditTrailService auditTrailService;

    private ConsolidationConfig config;
    private CsvParsingService csvParsingService;
    private FileValidationService fileValidationService;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        config = new ConsolidationConfig();
        csvParsingService = new CsvParsingService();
        fileValidationService = new FileValidationService(
                config, csvParsingService, new PlaceholderMatcher(config), auditTrailService);
    }

    @Test
    void testValidate_ValidFileAccepted() {
        // Given: File with all columns and two readings
        RawFile file = rawFile("R1", "r1/good.csv", stationCsv(ROW_S001_JAN_05, ROW_S001_JAN_12));

        // When: Validate
        ValidationVerdict verdict = fileValidationService.validate(file);

        // Then: Accepted and audited
        assertThat(verdict.isAccepted()).isTrue();
        assertThat(verdict.getOutcome()).isEqualTo(Outcome.ACCEPTED);
        assertThat(verdict.getReason()).isEqualTo("2 data rows, 5 columns");
        verify(auditTrailService).record("r1/good.csv", verdict);
    }

    @Test
    void testValidate_HeaderOnly_RejectedEmpty() {
        // Given: Header row and nothing else
        RawFile file = rawFile("R1", "r1/header_only.csv", STATION_HEADER + "\n");

        // When: Validate
        ValidationVerdict verdict = fileValidationService.validate(file);

        // Then: Rejected as empty, nothing else attempted
        assertThat(verdict.getOutcome()).isEqualTo(Outcome.REJECTED_EMPTY);
        assertThat(verdict.getReason()).isEqualTo("No data rows below header");
        verify(auditTrailService).record("r1/header_only.csv", verdict);
    }

    @Test
    void testValidate_ZeroBytes_RejectedEmpty() {
        // Given: Completely empty file
        RawFile file = RawFile.of("R1", "r1/zero.csv", new byte[0]);

        // When: Validate
        ValidationVerdict verdict = fileValidationService.validate(file);

        // Then: Rejected as empty
        assertThat(verdict.getOutcome()).isEqualTo(Outcome.REJECTED_EMPTY);
        assertThat(verdict.getReason()).isEqualTo("No header and no data rows");
    }

    @Test
    void testValidate_NoDateColumn_RejectedMissingColumns() {
        // Given: File without a Date column
        RawFile file = rawFile("R1", "r1/no_date.csv",
                csv(HEADER_WITHOUT_DATE, "R1,D1,S001,12.3", "R1,D1,S001,12.6"));

        // When: Validate
        ValidationVerdict verdict = fileValidationService.validate(file);

        // Then: Rejected, the reason names the missing column
        assertThat(verdict.getOutcome()).isEqualTo(Outcome.REJECTED_MISSING_COLUMNS);
        assertThat(verdict.getReason()).contains("Date");
    }

    @Test
    void testValidate_RegionSpecificSchema() {
        // Given: Region R2 names its level column differently and has no district column
        RegionSchema schema = new RegionSchema();
        schema.setLevelColumn("Water_Depth");
        schema.setLevelColumnHint("depth");
        schema.setDistrictColumnRequired(false);
        config.getRegions().put("R2", schema);
        String content = csv("Date,State,Station_name,Water_Depth",
                "2020-01-05,R2,S010,4.2", "2020-01-12,R2,S010,4.4");

        // When: Validate the same content for R2 and for R1
        ValidationVerdict r2 = fileValidationService.validate(rawFile("R2", "r2/a.csv", content));
        ValidationVerdict r1 = fileValidationService.validate(rawFile("R1", "r1/a.csv", content));

        // Then: Only the region with the matching schema accepts it
        assertThat(r2.isAccepted()).isTrue();
        assertThat(r1.getOutcome()).isEqualTo(Outcome.REJECTED_MISSING_COLUMNS);
        assertThat(r1.getReason()).contains("District").contains("level");
    }

    @Test
    void testValidate_LevelColumnFoundByHint() {
        // Given: Level column carries a unit suffix
        RawFile file = rawFile("R1", "r1/hint.csv", csv("Date,State,District,Station_name,Water level (m)",
                "2020-01-05,R1,D1,S001,12.3", "2020-01-12,R1,D1,S001,12.6"));

        // When: Validate
        ValidationVerdict verdict = fileValidationService.validate(file);

        // Then: Accepted through the hint
        assertThat(verdict.isAccepted()).isTrue();
    }

    @Test
    void testValidate_PlaceholderLevels_RejectedPlaceholder() {
        // Given: Every level is a placeholder or blank
        RawFile file = rawFile("R1", "r1/placeholder.csv",
                stationCsv("2020-01-05,R1,D1,S001,NA", "2020-01-12,R1,D1,S001,", "2020-01-19,R1,D1,S001,--"));

        // When: Validate
        ValidationVerdict verdict = fileValidationService.validate(file);

        // Then: Rejected as placeholder
        assertThat(verdict.getOutcome()).isEqualTo(Outcome.REJECTED_PLACEHOLDER);
    }

    @Test
    void testValidate_SingleRowNoDataMarker_RejectedPlaceholder() {
        // Given: The export's "no data" file: one row, marker in the station cell
        RawFile file = rawFile("R1", "r1/nodata.csv",
                stationCsv("2020-01-05,R1,D1,No Data Available,12.3"));

        // When: Validate
        ValidationVerdict verdict = fileValidationService.validate(file);

        // Then: Placeholder wins over the row threshold
        assertThat(verdict.getOutcome()).isEqualTo(Outcome.REJECTED_PLACEHOLDER);
    }

    @Test
    void testValidate_BelowMinimumRows_RejectedOther() {
        // Given: A single genuine reading
        RawFile file = rawFile("R1", "r1/single.csv", stationCsv(ROW_S001_JAN_05));

        // When: Validate
        ValidationVerdict verdict = fileValidationService.validate(file);

        // Then: Rejected by the threshold
        assertThat(verdict.getOutcome()).isEqualTo(Outcome.REJECTED_OTHER);
        assertThat(verdict.getReason()).isEqualTo("Below minimum row threshold of 2");
    }

    @Test
    void testValidate_MinimumRowsConfigurable() {
        // Given: Threshold lowered to one row
        config.getValidation().setMinimumRows(1);
        RawFile file = rawFile("R1", "r1/single.csv", stationCsv(ROW_S001_JAN_05));

        // When: Validate
        ValidationVerdict verdict = fileValidationService.validate(file);

        // Then: Accepted
        assertThat(verdict.isAccepted()).isTrue();
    }

    @Test
    void testValidate_BinaryContent_RejectedOther() {
        // Given: Bytes of a zip archive
        byte[] content = {0x50, 0x4B, 0x03, 0x04, 0x14, 0x00, 0x00, 0x00, 0x08, 0x00};
        RawFile file = RawFile.of("R1", "r1/archive.csv", content);

        // When: Validate
        ValidationVerdict verdict = fileValidationService.validate(file);

        // Then: Rejected without raising
        assertThat(verdict.getOutcome()).isEqualTo(Outcome.REJECTED_OTHER);
        assertThat(verdict.getReason()).isEqualTo("Binary content");
        verify(auditTrailService).record("r1/archive.csv", verdict);
    }

    @Test
    void testValidate_TruncatedAndRandomInput_NeverThrows() {
        // Given: Truncated quote, invalid UTF-8 and random bytes
        Random random = new Random(7);
        byte[] noise = new byte[512];
        random.nextBytes(noise);
        RawFile[] files = {
                rawFile("R1", "r1/truncated.csv", STATION_HEADER + "\n2020-01-05,R1,\"D1"),
                RawFile.of("R1", "r1/latin1.csv", "Date;Station\n05.01.2020;Schäfer".getBytes(StandardCharsets.ISO_8859_1)),
                RawFile.of("R1", "r1/noise.csv", noise)
        };

        // When/Then: Every file gets a verdict
        for (RawFile file : files) {
            ValidationVerdict verdict = assertDoesNotThrowVerdict(file);
            assertThat(verdict).isNotNull();
            assertThat(verdict.getFileId()).isEqualTo(file.getFileId());
        }
        verify(auditTrailService, times(files.length)).record(anyString(), any(ValidationVerdict.class));
    }

    @Test
    void testValidate_ParserFailure_RejectedOther() {
        // Given: A parser that blows up
        CsvParsingService failingParser = mock(CsvParsingService.class);
        when(failingParser.looksBinary(any())).thenReturn(false);
        when(failingParser.parse(any())).thenThrow(new IllegalStateException("boom"));
        FileValidationService service = new FileValidationService(
                config, failingParser, new PlaceholderMatcher(config), auditTrailService);
        RawFile file = rawFile("R1", "r1/bad.csv", "whatever");

        // When: Validate
        ValidationVerdict verdict = service.validate(file);

        // Then: The failure becomes a rejection
        assertThat(verdict.getOutcome()).isEqualTo(Outcome.REJECTED_OTHER);
        assertThat(verdict.getReason()).isEqualTo("Unreadable content: IllegalStateException");
        verify(auditTrailService).record(eq("r1/bad.csv"), any(ValidationVerdict.class));
    }

    private ValidationVerdict assertDoesNotThrowVerdict(RawFile file) {
        ValidationVerdict[] holder = new ValidationVerdict[1];
        assertThatCode(() -> holder[0] = fileValidationService.validate(file)).doesNotThrowAnyException();
        return holder[0];
    }
}
