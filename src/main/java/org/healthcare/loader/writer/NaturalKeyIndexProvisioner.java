package org.healthcare.loader.writer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.healthcare.loader.exception.IndexProvisioningException;
import org.healthcare.loader.model.PatientAdmission;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.stereotype.Component;

/**
 * Creates the unique compound index backing natural-key upserts.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class NaturalKeyIndexProvisioner {

    public static final String INDEX_NAME = "uniq_admission";

    private final MongoTemplate mongoTemplate;

    /**
     * Idempotent: an identical existing index is left alone.
     *
     * @throws IndexProvisioningException on any other failure, e.g. existing duplicate keys
     */
    public String ensureNaturalKeyIndex(String collection) {
        try {
            String name = mongoTemplate.indexOps(collection).ensureIndex(naturalKeyIndex());
            log.info("Ensured unique index: {}", name);
            return name;
        } catch (DataAccessException e) {
            log.error("Failed to create index {} on {}: {}", INDEX_NAME, collection, e.getMessage());
            throw new IndexProvisioningException(collection, e);
        }
    }

    static Index naturalKeyIndex() {
        Index index = new Index();
        for (String field : PatientAdmission.NATURAL_KEY_FIELDS) {
            index.on(field, Sort.Direction.ASC);
        }
        return index.unique().named(INDEX_NAME);
    }
}
