package hydromet.gwlevel.consolidate.model;

import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * Header and data rows of a delimited file, headers trimmed.
 * Rows may be shorter or longer than the header.
 */
@Getter
public final class ParsedTable {

    private final List<String> headers;
    private final List<List<String>> rows;

    public ParsedTable(List<String> headers, List<List<String>> rows) {
        this.headers = Collections.unmodifiableList(headers);
        this.rows = Collections.unmodifiableList(rows);
    }

    public int getRowCount() {
        return rows.size();
    }

    public boolean hasHeader() {
        return !headers.isEmpty();
    }

    /**
     * Cell at the given column, or an empty string if the row is too short or the column is absent.
     */
    public static String cell(List<String> row, int columnIndex) {
        if (columnIndex < 0 || columnIndex >= row.size()) {
            return "";
        }
        String value = row.get(columnIndex);
        return value != null ? value : "";
    }
}
