package com.project.normalizer.schema_normalizer.util;

import com.project.normalizer.schema_normalizer.model.Column;
import com.project.normalizer.schema_normalizer.model.ColumnType;
import com.project.normalizer.schema_normalizer.model.Dataset;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reads RFC-4180 CSV text (first record is the header) into a typed {@link Dataset} and writes
 * datasets back out. Empty cells become nulls.
 */
public final class CsvParsingUtil {

    private static final CSVFormat CSV_FORMAT = CSVFormat.DEFAULT
            .builder()
            .setTrim(false)
            .setIgnoreSurroundingSpaces(false)
            .setIgnoreEmptyLines(true)
            .build();

    private static final Pattern INTEGER = Pattern.compile("-?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("-?\\d*\\.\\d+|-?\\d+\\.\\d*");
    private static final Pattern ISO_DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");

    private CsvParsingUtil() {}

    public static List<List<String>> parseRows(String csvText) {
        if (csvText == null || csvText.trim().isEmpty()) {
            return List.of();
        }
        try (CSVParser parser = CSVParser.parse(new StringReader(csvText), CSV_FORMAT)) {
            List<List<String>> rows = new ArrayList<>();
            for (CSVRecord record : parser) {
                List<String> parsed = new ArrayList<>(record.size());
                record.forEach(value -> parsed.add(value == null ? "" : value));
                rows.add(parsed);
            }
            return rows;
        } catch (IOException | UncheckedIOException | IllegalStateException ex) {
            throw new IllegalArgumentException("Failed to parse CSV input: " + ex.getMessage(), ex);
        }
    }

    /**
     * Parse CSV text into a dataset. Each column gets the narrowest type every non-empty value
     * fits: integer, decimal, boolean, ISO date, else text. Integers written with a leading zero
     * (zip codes, for instance) stay text so no digit is lost.
     *
     * @throws IllegalArgumentException on an empty input, a duplicate header or a ragged row
     */
    public static Dataset readDataset(String csvText) {
        List<List<String>> records = parseRows(csvText);
        if (records.isEmpty()) {
            throw new IllegalArgumentException("CSV input has no header row");
        }
        List<String> header = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (String name : records.get(0)) {
            String trimmed = name.trim();
            if (trimmed.isEmpty()) {
                throw new IllegalArgumentException("CSV header has an empty column name");
            }
            if (!seen.add(trimmed)) {
                throw new IllegalArgumentException("Duplicate column name in CSV header: " + trimmed);
            }
            header.add(trimmed);
        }

        List<List<String>> raw = records.subList(1, records.size());
        for (int r = 0; r < raw.size(); r++) {
            if (raw.get(r).size() != header.size()) {
                throw new IllegalArgumentException("CSV row " + (r + 2) + " has " + raw.get(r).size()
                        + " values, expected " + header.size());
            }
        }

        List<Column> columns = new ArrayList<>(header.size());
        List<ColumnType> types = new ArrayList<>(header.size());
        for (int c = 0; c < header.size(); c++) {
            ColumnType type = inferType(raw, c);
            boolean nullable = false;
            for (List<String> row : raw) {
                if (row.get(c).isEmpty()) {
                    nullable = true;
                    break;
                }
            }
            types.add(type);
            columns.add(new Column(header.get(c), type, nullable || raw.isEmpty()));
        }

        List<List<Object>> rows = new ArrayList<>(raw.size());
        for (List<String> row : raw) {
            List<Object> typed = new ArrayList<>(row.size());
            for (int c = 0; c < row.size(); c++) {
                typed.add(convert(row.get(c), types.get(c)));
            }
            rows.add(typed);
        }
        return new Dataset(columns, rows);
    }

    public static String toCsv(Dataset dataset) {
        try (StringWriter writer = new StringWriter();
             CSVPrinter printer = new CSVPrinter(writer, CSV_FORMAT)) {
            printer.printRecord(dataset.getColumnNames());
            for (List<Object> row : dataset.getRows()) {
                List<String> cells = new ArrayList<>(row.size());
                for (Object value : row) {
                    cells.add(format(value));
                }
                printer.printRecord(cells);
            }
            printer.flush();
            return writer.toString();
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to serialize CSV", ex);
        }
    }

    static ColumnType inferType(List<List<String>> rows, int column) {
        boolean any = false;
        boolean integer = true;
        boolean decimal = true;
        boolean bool = true;
        boolean date = true;
        for (List<String> row : rows) {
            String value = row.get(column);
            if (value.isEmpty()) continue;
            any = true;
            if (integer && (!INTEGER.matcher(value).matches() || hasLeadingZero(value) || !fitsLong(value))) {
                integer = false;
            }
            if (decimal && !(INTEGER.matcher(value).matches() && !hasLeadingZero(value))
                    && !DECIMAL.matcher(value).matches()) {
                decimal = false;
            }
            if (bool && !isBoolean(value)) {
                bool = false;
            }
            if (date && !isDate(value)) {
                date = false;
            }
        }
        if (!any) return ColumnType.EMPTY;
        if (integer) return ColumnType.INTEGER;
        if (decimal) return ColumnType.DECIMAL;
        if (bool) return ColumnType.BOOLEAN;
        if (date) return ColumnType.DATE;
        return ColumnType.TEXT;
    }

    private static Object convert(String value, ColumnType type) {
        if (value.isEmpty()) {
            return null;
        }
        return switch (type) {
            case INTEGER -> Long.parseLong(value);
            case DECIMAL -> new BigDecimal(value);
            case BOOLEAN -> Boolean.parseBoolean(value.toLowerCase(Locale.ROOT));
            case DATE -> LocalDate.parse(value);
            default -> value;
        };
    }

    private static String format(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        return value.toString();
    }

    private static boolean hasLeadingZero(String value) {
        String digits = value.startsWith("-") ? value.substring(1) : value;
        return digits.length() > 1 && digits.charAt(0) == '0';
    }

    private static boolean fitsLong(String value) {
        try {
            Long.parseLong(value);
            return true;
        } catch (NumberFormatException ex) {
            return false;
        }
    }

    private static boolean isBoolean(String value) {
        return value.equalsIgnoreCase("true") || value.equalsIgnoreCase("false");
    }

    private static boolean isDate(String value) {
        if (!ISO_DATE.matcher(value).matches()) {
            return false;
        }
        try {
            LocalDate.parse(value);
            return true;
        } catch (DateTimeParseException ex) {
            return false;
        }
    }
}
