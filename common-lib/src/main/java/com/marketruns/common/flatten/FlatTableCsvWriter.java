package com.marketruns.common.flatten;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a {@link FlatTable} as CSV with Jackson's CSV data format: a header row, then one
 * line per row in table order, {@code \n} line endings, empty cells for {@code null}.
 * Equal tables produce identical bytes.
 */
public final class FlatTableCsvWriter {

    private static final Logger log = LoggerFactory.getLogger(FlatTableCsvWriter.class);

    private final CsvMapper mapper;

    public FlatTableCsvWriter() {
        this.mapper = new CsvMapper();
        this.mapper.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
    }

    public String toCsv(FlatTable table) {
        StringWriter out = new StringWriter();
        try {
            write(table, out);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }

    public void write(FlatTable table, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(table, out);
        }
        log.info("[FlatTableCsvWriter] Exported. path={} level={} rows={}", path, table.level(), table.rowCount());
    }

    /** Writes to an open writer. The caller owns the writer. */
    public void write(FlatTable table, Writer out) throws IOException {
        CsvSchema.Builder schema = CsvSchema.builder().setUseHeader(true).setLineSeparator("\n");
        table.columns().forEach(schema::addColumn);
        try (SequenceWriter rows = mapper.writer(schema.build()).writeValues(out)) {
            rows.writeAll(table.rows());
        }
    }
}
