package com.marketruns.common.table;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.marketruns.common.exception.MissingInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Loads a CSV export into a {@link DataTable} with Jackson's CSV data format.
 * The first record is the header row; a leading byte-order mark is dropped.
 */
public final class CsvTableReader {

    private static final Logger log = LoggerFactory.getLogger(CsvTableReader.class);

    private static final char BOM = '\uFEFF';

    private final CsvMapper mapper;

    public CsvTableReader() {
        this.mapper = new CsvMapper();
        this.mapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        this.mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
    }

    /**
     * Reads the file at {@code path}.
     *
     * @throws MissingInputException if the file does not exist or cannot be read
     */
    public DataTable read(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new MissingInputException(String.valueOf(path), "CSV file not found");
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            DataTable table = read(path.toString(), reader);
            log.info("[CsvTableReader] Loaded. source={} rows={} columns={}",
                     path, table.rowCount(), table.columnCount());
            return table;
        } catch (IOException e) {
            throw new MissingInputException(path.toString(), "CSV file could not be read", e);
        }
    }

    /** Reads CSV text from an open reader. The caller owns the reader. */
    public DataTable read(String source, Reader reader) throws IOException {
        List<String[]> records;
        try (MappingIterator<String[]> it = mapper.readerFor(String[].class).readValues(reader)) {
            records = it.readAll();
        }
        if (records.isEmpty()) {
            return DataTable.of(source, List.of(), List.of());
        }
        List<String> headers = new ArrayList<>(Arrays.asList(records.get(0)));
        if (!headers.isEmpty() && !headers.get(0).isEmpty() && headers.get(0).charAt(0) == BOM) {
            headers.set(0, headers.get(0).substring(1));
        }
        headers.replaceAll(String::trim);

        List<List<String>> rows = new ArrayList<>(records.size() - 1);
        for (int i = 1; i < records.size(); i++) {
            rows.add(Arrays.asList(records.get(i)));
        }
        return DataTable.of(source, headers, rows);
    }
}
