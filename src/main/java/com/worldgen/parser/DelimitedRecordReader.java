package com.worldgen.parser;

import com.worldgen.exception.ErrorKind;
import com.worldgen.exception.MapLoadException;
import lombok.extern.slf4j.Slf4j;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectReader;
import tools.jackson.dataformat.csv.CsvMapper;
import tools.jackson.dataformat.csv.CsvReadFeature;
import tools.jackson.dataformat.csv.CsvSchema;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads semicolon-separated files into typed records.
 * <p>
 * Jackson's CSV format splits the rows; each row is then handed to a {@link RowDecoder}.
 * Whether a row that fails to decode aborts the file or is skipped is chosen by the
 * caller through {@link RowDecodeMode}.
 */
@Slf4j
public final class DelimitedRecordReader {

    private static final char DELIMITER = ';';

    private static final CsvMapper MAPPER = CsvMapper.builder()
            .enable(CsvReadFeature.WRAP_AS_ARRAY)
            .build();

    private static final CsvSchema SCHEMA = CsvSchema.emptySchema()
            .withColumnSeparator(DELIMITER)
            .withoutQuoteChar()
            .withoutEscapeChar();

    private DelimitedRecordReader() {
    }

    public static <T> List<T> read(Path path, boolean hasHeader, RowDecodeMode mode, RowDecoder<T> decoder) {
        List<String[]> rows = readRows(path);
        List<T> records = new ArrayList<>(rows.size());
        int skipped = 0;
        for (int i = hasHeader ? 1 : 0; i < rows.size(); i++) {
            String[] columns = rows.get(i);
            if (isBlank(columns)) {
                continue;
            }
            DelimitedRow row = new DelimitedRow(i + 1, columns);
            try {
                records.add(decoder.decode(row));
            } catch (MapLoadException e) {
                if (mode == RowDecodeMode.STRICT) {
                    throw new MapLoadException(e.getKind(), path,
                            "Row " + row.number() + ": " + e.getDetail(), e);
                }
                skipped++;
                log.warn("Skipping {} of {}: {}", row, path.getFileName(), e.getDetail());
            }
        }
        if (skipped > 0) {
            log.warn("Skipped {} undecodable row(s) in {}", skipped, path);
        }
        log.debug("Read {} record(s) from {}", records.size(), path);
        return List.copyOf(records);
    }

    private static List<String[]> readRows(Path path) {
        ObjectReader reader = MAPPER.readerFor(String[].class).with(SCHEMA);
        try (BufferedReader in = LegacyText.open(path)) {
            return reader.<String[]>readValues(in).readAll();
        } catch (JacksonException e) {
            throw new MapLoadException(ErrorKind.FORMAT, path,
                    "Malformed delimited file: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw MapLoadException.io(path, "Unable to read file", e);
        }
    }

    private static boolean isBlank(String[] columns) {
        for (String column : columns) {
            if (!column.isBlank()) {
                return false;
            }
        }
        return true;
    }
}
