package hydromet.gwlevel.consolidate.service;

import hydromet.gwlevel.consolidate.model.ParsedTable;
import hydromet.gwlevel.consolidate.model.RawFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Service responsible for CSV parsing of raw station files.
 *
 * Features:
 * - Decode raw bytes as UTF-8, replacing malformed sequences instead of failing
 * - Strip a leading byte order mark
 * - Parse CSV rows handling quoted fields and commas within quotes
 * - Trim header names (region exports pad them with spaces)
 * - Ignore blank lines
 *
 * This service is stateless and can be safely used concurrently.
 */
@Service
public class CsvParsingService {

    private static final Logger logger = LoggerFactory.getLogger(CsvParsingService.class);

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    /**
     * Parse the content of a raw file into header and data rows.
     * An empty or blank file yields a table with no header and no rows.
     *
     * @param file the raw file
     * @return parsed table
     */
    public ParsedTable parse(RawFile file) {
        String text = new String(file.getContent(), StandardCharsets.UTF_8);
        if (!text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK) {
            text = text.substring(1);
        }

        List<String> headers = Collections.emptyList();
        List<List<String>> rows = new ArrayList<>();

        for (String line : text.split("\\r?\\n|\\r")) {
            if (line.trim().isEmpty()) {
                continue;
            }
            List<String> values = parseCsvRow(line);
            if (headers.isEmpty()) {
                headers = values;
            } else {
                rows.add(values);
            }
        }

        logger.debug("Parsed {}: {} columns, {} data rows", file.getFileId(), headers.size(), rows.size());
        return new ParsedTable(headers, rows);
    }

    /**
     * Parse CSV row handling quoted fields and commas within quotes.
     * Follows RFC 4180 CSV specification for quote handling.
     *
     * Examples:
     *   "R1,D1,S001" → ["R1", "D1", "S001"]
     *   "R1,\"Pune, East\",S001" → ["R1", "Pune, East", "S001"]
     *   "\"Well \"\"A\"\"\",12.3" → ["Well \"A\"", "12.3"]
     *
     * @param csvLine the CSV line to parse
     * @return list of trimmed field values
     */
    public List<String> parseCsvRow(String csvLine) {
        List<String> values = new ArrayList<>();
        boolean inQuotes = false;
        StringBuilder currentValue = new StringBuilder();

        for (int i = 0; i < csvLine.length(); i++) {
            char c = csvLine.charAt(i);

            if (c == '"') {
                // Handle escaped quotes (double quotes "" represent a single quote)
                if (inQuotes && i + 1 < csvLine.length() && csvLine.charAt(i + 1) == '"') {
                    currentValue.append('"');
                    i++; // Skip next quote
                } else {
                    inQuotes = !inQuotes;
                }
            } else if (c == ',' && !inQuotes) {
                // End of field
                values.add(currentValue.toString().trim());
                currentValue = new StringBuilder();
            } else {
                currentValue.append(c);
            }
        }

        // Add the last field
        values.add(currentValue.toString().trim());

        return values;
    }

    /**
     * True if the content looks like binary data rather than text.
     * NUL bytes never occur in the CSV exports this service reads.
     */
    public boolean looksBinary(byte[] content) {
        int limit = Math.min(content.length, 8192);
        for (int i = 0; i < limit; i++) {
            if (content[i] == 0) {
                return true;
            }
        }
        return false;
    }
}
