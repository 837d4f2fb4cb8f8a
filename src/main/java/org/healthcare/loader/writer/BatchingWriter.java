package org.healthcare.loader.writer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.healthcare.loader.config.LoaderProperties;
import org.healthcare.loader.model.PatientAdmission;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Regroups reader chunks into write batches of {@code loader.batch-size} documents
 * and hands each batch to the configured {@link WriteStrategy}, one at a time.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class BatchingWriter {

    private final WriteStrategy writeStrategy;
    private final LoaderProperties properties;

    /**
     * Drains {@code chunks}.
     *
     * @return sum of the per-batch counts reported by the write strategy
     */
    public long writeAll(Iterator<List<PatientAdmission>> chunks) {
        int batchSize = properties.getBatchSize();
        List<PatientAdmission> buffer = new ArrayList<>(batchSize);
        long total = 0;
        int batches = 0;

        while (chunks.hasNext()) {
            for (PatientAdmission admission : chunks.next()) {
                buffer.add(admission);
                if (buffer.size() >= batchSize) {
                    total += flush(buffer);
                    batches++;
                    log.info("{} batch {} done, {} documents written so far", writeStrategy.mode(), batches, total);
                }
            }
        }
        if (!buffer.isEmpty()) {
            total += flush(buffer);
            batches++;
            log.info("{} batch {} done, {} documents written so far", writeStrategy.mode(), batches, total);
        }
        return total;
    }

    private int flush(List<PatientAdmission> buffer) {
        int written = writeStrategy.write(List.copyOf(buffer));
        buffer.clear();
        return written;
    }
}
