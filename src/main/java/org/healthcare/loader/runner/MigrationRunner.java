package org.healthcare.loader.runner;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.healthcare.loader.config.LoaderProperties;
import org.healthcare.loader.exception.MissingInputException;
import org.healthcare.loader.model.PatientAdmission;
import org.healthcare.loader.reader.AdmissionChunkIterator;
import org.healthcare.loader.reader.ChunkedAdmissionReader;
import org.healthcare.loader.writer.BatchingWriter;
import org.healthcare.loader.writer.NaturalKeyIndexProvisioner;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs one load: read and transform the CSV, then either preview it (dry run)
 * or write it to MongoDB.
 * <p>
 * MongoDB-backed beans are resolved only when writing, so a dry run never opens a connection.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MigrationRunner implements CommandLineRunner {

    private final LoaderProperties properties;
    private final ChunkedAdmissionReader reader;
    private final DocumentPreviewPrinter previewPrinter;
    private final ObjectProvider<BatchingWriter> writerProvider;
    private final ObjectProvider<NaturalKeyIndexProvisioner> provisionerProvider;

    @Value("${spring.data.mongodb.uri:mongodb://localhost:27017}")
    private String mongoUri;

    @Value("${spring.data.mongodb.database:healthcare}")
    private String database;

    @Override
    public void run(String... args) throws IOException {
        Path source = resolveSource();
        log.info("Reading CSV from: {}", source);

        try (AdmissionChunkIterator chunks = reader.open(source, properties.getChunkSize())) {
            chunks.validateHeader();
            if (properties.isDryRun()) {
                preview(chunks);
                return;
            }
            load(chunks);
            log.info("Processed {} rows, skipped {} with incomplete natural key", chunks.getRowsRead(), chunks.getRowsSkipped());
        }
    }

    private Path resolveSource() {
        String csvPath = properties.getCsvPath();
        if (csvPath == null || csvPath.isBlank()) {
            log.error("loader.csv-path or CSV_PATH env is required.");
            throw new MissingInputException("No CSV path configured (loader.csv-path / CSV_PATH)");
        }
        Path source = Path.of(csvPath);
        if (!Files.isRegularFile(source)) {
            log.error("CSV file not found: {}", source);
            throw new MissingInputException("CSV file not found: " + source);
        }
        return source;
    }

    private void preview(AdmissionChunkIterator chunks) {
        if (!chunks.hasNext()) {
            log.warn("CSV appears empty; nothing to preview.");
            return;
        }
        List<PatientAdmission> firstChunk = chunks.next();
        List<PatientAdmission> sample = firstChunk.subList(0, Math.min(properties.getPreviewSize(), firstChunk.size()));
        log.info("Previewing {} transformed documents (dry-run):", sample.size());
        previewPrinter.print(sample, System.out);
    }

    private void load(AdmissionChunkIterator chunks) {
        log.info("Connecting to MongoDB: {} | db={} | collection={}", redact(mongoUri), database, properties.getCollection());

        if (properties.isCreateIndexes()) {
            provisionerProvider.getObject().ensureNaturalKeyIndex(properties.getCollection());
        }

        log.info("Mode: {}", properties.isUpsert() ? "UPSERT" : "INSERT");
        long written = writerProvider.getObject().writeAll(chunks);
        log.info("Written {} documents into {}.{}", written, database, properties.getCollection());
    }

    /**
     * Drops credentials from a connection string before logging it.
     */
    static String redact(String uri) {
        int scheme = uri.indexOf("://");
        int at = uri.lastIndexOf('@');
        if (scheme < 0 || at < scheme) {
            return uri;
        }
        return uri.substring(0, scheme + 3) + "***@" + uri.substring(at + 1);
    }
}
