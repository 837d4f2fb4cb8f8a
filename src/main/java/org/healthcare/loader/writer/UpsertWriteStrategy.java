package org.healthcare.loader.writer;

import com.mongodb.bulk.BulkWriteResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.healthcare.loader.config.LoaderProperties;
import org.healthcare.loader.model.PatientAdmission;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.mongodb.BulkOperationException;
import org.springframework.data.mongodb.core.BulkOperations;
import org.springframework.data.mongodb.core.BulkOperations.BulkMode;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.healthcare.loader.model.PatientAdmission.ADMISSION_TYPE;
import static org.healthcare.loader.model.PatientAdmission.AGE;
import static org.healthcare.loader.model.PatientAdmission.BILLING_AMOUNT;
import static org.healthcare.loader.model.PatientAdmission.BLOOD_TYPE;
import static org.healthcare.loader.model.PatientAdmission.DATE_OF_ADMISSION;
import static org.healthcare.loader.model.PatientAdmission.DISCHARGE_DATE;
import static org.healthcare.loader.model.PatientAdmission.DOCTOR;
import static org.healthcare.loader.model.PatientAdmission.GENDER;
import static org.healthcare.loader.model.PatientAdmission.HOSPITAL;
import static org.healthcare.loader.model.PatientAdmission.INGESTED_AT;
import static org.healthcare.loader.model.PatientAdmission.INSURANCE_PROVIDER;
import static org.healthcare.loader.model.PatientAdmission.LAST_MODIFIED_AT;
import static org.healthcare.loader.model.PatientAdmission.MEDICAL_CONDITION;
import static org.healthcare.loader.model.PatientAdmission.MEDICATION;
import static org.healthcare.loader.model.PatientAdmission.NAME;
import static org.healthcare.loader.model.PatientAdmission.ROOM_NUMBER;
import static org.healthcare.loader.model.PatientAdmission.SOURCE;
import static org.healthcare.loader.model.PatientAdmission.TEST_RESULTS;

/**
 * Merge-by-natural-key writer.
 * <p>
 * Every field is overwritten on each write except {@code ingested_at}, which is only
 * set when the upsert inserts a new document.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "loader", name = "upsert", havingValue = "true", matchIfMissing = true)
public class UpsertWriteStrategy implements WriteStrategy {

    private final MongoTemplate mongoTemplate;
    private final LoaderProperties properties;

    /**
     * @return upserted plus modified documents, or 0 when the bulk operation reports any error
     */
    @Override
    public int write(List<PatientAdmission> batch) {
        if (batch.isEmpty()) {
            return 0;
        }
        warnOnRepeatedKeys(batch);

        BulkOperations ops = mongoTemplate.bulkOps(BulkMode.UNORDERED, properties.getCollection());
        for (PatientAdmission admission : batch) {
            ops.upsert(naturalKeyQuery(admission), mergeUpdate(admission));
        }
        try {
            BulkWriteResult result = ops.execute();
            return result.getUpserts().size() + result.getModifiedCount();
        } catch (BulkOperationException e) {
            // Operations that succeeded before the failure are not counted.
            log.error("Bulk write error (upsert): {} of {} operations failed: {}",
                e.getErrors().size(), batch.size(), BulkErrors.describe(e.getErrors()));
            return 0;
        }
    }

    @Override
    public String mode() {
        return "UPSERT";
    }

    static Query naturalKeyQuery(PatientAdmission admission) {
        return Query.query(Criteria.where(NAME).is(admission.getName())
            .and(GENDER).is(admission.getGender())
            .and(BLOOD_TYPE).is(admission.getBloodType())
            .and(DATE_OF_ADMISSION).is(admission.getDateOfAdmission())
            .and(HOSPITAL).is(admission.getHospital()));
    }

    static Update mergeUpdate(PatientAdmission admission) {
        return new Update()
            .set(NAME, admission.getName())
            .set(AGE, admission.getAge())
            .set(GENDER, admission.getGender())
            .set(BLOOD_TYPE, admission.getBloodType())
            .set(MEDICAL_CONDITION, admission.getMedicalCondition())
            .set(DATE_OF_ADMISSION, admission.getDateOfAdmission())
            .set(DOCTOR, admission.getDoctor())
            .set(HOSPITAL, admission.getHospital())
            .set(INSURANCE_PROVIDER, admission.getInsuranceProvider())
            .set(BILLING_AMOUNT, admission.getBillingAmount())
            .set(ROOM_NUMBER, admission.getRoomNumber())
            .set(ADMISSION_TYPE, admission.getAdmissionType())
            .set(DISCHARGE_DATE, admission.getDischargeDate())
            .set(MEDICATION, admission.getMedication())
            .set(TEST_RESULTS, admission.getTestResults())
            .set(SOURCE, admission.getSource())
            .set(LAST_MODIFIED_AT, admission.getLastModifiedAt())
            .setOnInsert(INGESTED_AT, admission.getIngestedAt());
    }

    private void warnOnRepeatedKeys(List<PatientAdmission> batch) {
        Set<List<Object>> keys = new HashSet<>();
        int repeated = 0;
        for (PatientAdmission admission : batch) {
            if (!keys.add(admission.naturalKey())) {
                repeated++;
            }
        }
        if (repeated > 0) {
            log.warn("Write batch of {} documents repeats {} natural keys; same-key upserts in one unordered batch may collide",
                batch.size(), repeated);
        }
    }
}
