package org.healthcare.loader.writer;

import com.mongodb.bulk.BulkWriteError;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.healthcare.loader.config.LoaderProperties;
import org.healthcare.loader.model.PatientAdmission;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.mongodb.BulkOperationException;
import org.springframework.data.mongodb.core.BulkOperations.BulkMode;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Plain unordered bulk insert. MongoDB assigns {@code _id}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "loader", name = "upsert", havingValue = "false")
public class InsertWriteStrategy implements WriteStrategy {

    private final MongoTemplate mongoTemplate;
    private final LoaderProperties properties;

    /**
     * On a partial failure the remaining documents are still inserted (unordered), and the
     * batch reports the number of failed documents instead of the number inserted.
     */
    @Override
    public int write(List<PatientAdmission> batch) {
        if (batch.isEmpty()) {
            return 0;
        }
        try {
            return mongoTemplate.bulkOps(BulkMode.UNORDERED, PatientAdmission.class, properties.getCollection())
                .insert(batch)
                .execute()
                .getInsertedCount();
        } catch (BulkOperationException e) {
            List<BulkWriteError> errors = e.getErrors();
            log.error("Bulk write error (insert): {} of {} documents rejected: {}",
                errors.size(), batch.size(), BulkErrors.describe(errors));
            return errors.size();
        }
    }

    @Override
    public String mode() {
        return "INSERT";
    }
}
