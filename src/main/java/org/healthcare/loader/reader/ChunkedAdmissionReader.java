package org.healthcare.loader.reader;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.healthcare.loader.exception.SourceReadException;
import org.healthcare.loader.transform.RowTransformer;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Opens the healthcare CSV for chunked, bounded-memory reading.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ChunkedAdmissionReader {

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
        .setHeader()
        .setSkipHeaderRecord(true)
        .setIgnoreEmptyLines(true)
        .setAllowMissingColumnNames(true)
        .build();

    private final RowTransformer rowTransformer;

    /**
     * Opens {@code source}. Nothing but the header is read until the first pull;
     * the returned iterator must be closed by the caller.
     */
    public AdmissionChunkIterator open(Path source, int chunkSize) {
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        }
        try {
            BufferedReader reader = Files.newBufferedReader(source, StandardCharsets.UTF_8);
            try {
                skipByteOrderMark(reader);
                CSVParser parser = FORMAT.parse(reader);
                log.debug("Opened {} with chunk size {}", source, chunkSize);
                return new AdmissionChunkIterator(source, parser, rowTransformer, chunkSize);
            } catch (IOException | RuntimeException e) {
                reader.close();
                throw e;
            }
        } catch (IOException e) {
            throw new SourceReadException(source, e);
        }
    }

    private static void skipByteOrderMark(BufferedReader reader) throws IOException {
        reader.mark(1);
        if (reader.read() != BYTE_ORDER_MARK) {
            reader.reset();
        }
    }
}
