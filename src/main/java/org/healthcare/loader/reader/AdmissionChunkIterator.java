package org.healthcare.loader.reader;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.healthcare.loader.exception.SchemaValidationException;
import org.healthcare.loader.exception.SourceReadException;
import org.healthcare.loader.model.PatientAdmission;
import org.healthcare.loader.model.SourceColumn;
import org.healthcare.loader.transform.RowTransformer;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;

/**
 * Lazy, single-pass sequence of transformed chunks.
 * <p>
 * Each element holds the documents derived from at most {@code chunkSize} raw rows.
 * Chunks in which every row was dropped are skipped. The header is validated on the
 * first pull. Not thread-safe.
 */
@Slf4j
public class AdmissionChunkIterator implements Iterator<List<PatientAdmission>>, Closeable {

    private final Path source;
    private final CSVParser parser;
    private final Iterator<CSVRecord> records;
    private final RowTransformer rowTransformer;
    private final int chunkSize;

    private boolean validated;
    private List<PatientAdmission> pending;
    private long rowsRead;
    private long rowsSkipped;

    AdmissionChunkIterator(Path source, CSVParser parser, RowTransformer rowTransformer, int chunkSize) {
        this.source = source;
        this.parser = parser;
        this.records = parser.iterator();
        this.rowTransformer = rowTransformer;
        this.chunkSize = chunkSize;
    }

    @Override
    public boolean hasNext() {
        validateHeader();
        while (pending == null && hasMoreRecords()) {
            List<PatientAdmission> chunk = readChunk();
            if (!chunk.isEmpty()) {
                pending = chunk;
            }
        }
        return pending != null;
    }

    @Override
    public List<PatientAdmission> next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more chunks in " + source);
        }
        List<PatientAdmission> chunk = pending;
        pending = null;
        return chunk;
    }

    /**
     * Checks the CSV header against the expected columns. Runs once; later calls are no-ops.
     *
     * @throws SchemaValidationException if an expected column is missing
     */
    public void validateHeader() {
        if (!validated) {
            validateColumns(parser.getHeaderNames());
            validated = true;
        }
    }

    public long getRowsRead() {
        return rowsRead;
    }

    public long getRowsSkipped() {
        return rowsSkipped;
    }

    @Override
    public void close() throws IOException {
        parser.close();
    }

    private List<PatientAdmission> readChunk() {
        List<PatientAdmission> documents = new ArrayList<>(chunkSize);
        int read = 0;
        while (read < chunkSize && hasMoreRecords()) {
            CSVRecord record = records.next();
            read++;
            rowTransformer.transform(toRawRecord(record))
                .ifPresentOrElse(documents::add, () -> rowsSkipped++);
        }
        rowsRead += read;
        log.debug("Chunk of {} rows produced {} documents ({} rows read so far)", read, documents.size(), rowsRead);
        return documents;
    }

    private boolean hasMoreRecords() {
        try {
            return records.hasNext();
        } catch (UncheckedIOException e) {
            throw new SourceReadException(source, e.getCause());
        }
    }

    private static Map<String, String> toRawRecord(CSVRecord record) {
        Map<String, String> raw = new LinkedHashMap<>();
        for (String header : SourceColumn.headers()) {
            raw.put(header, record.isSet(header) ? record.get(header) : null);
        }
        return raw;
    }

    static void validateColumns(List<String> columns) {
        List<String> missing = SourceColumn.headers().stream()
            .filter(expected -> !columns.contains(expected))
            .collect(Collectors.toList());
        if (!missing.isEmpty()) {
            throw new SchemaValidationException(missing);
        }
        List<String> extra = columns.stream()
            .filter(column -> !SourceColumn.headers().contains(column))
            .collect(Collectors.toList());
        if (!extra.isEmpty()) {
            log.warn("Extra columns present and will be ignored: {}", extra);
        }
    }
}
