package org.healthcare.loader.transform;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.healthcare.loader.model.PatientAdmission;
import org.healthcare.loader.model.SourceColumn;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static org.healthcare.loader.transform.CellCoercion.coerceDate;
import static org.healthcare.loader.transform.CellCoercion.coerceFloat;
import static org.healthcare.loader.transform.CellCoercion.coerceInt;
import static org.healthcare.loader.transform.CellCoercion.coerceString;
import static org.healthcare.loader.transform.CellCoercion.normalizeLower;

/**
 * Maps one raw CSV record to a {@link PatientAdmission}.
 * Rows with an incomplete natural key are dropped with a warning.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RowTransformer {

    private final Clock clock;

    /**
     * @param rawRecord cell values keyed by CSV header name
     * @return the normalized document, or empty when the row must be skipped
     */
    public Optional<PatientAdmission> transform(Map<String, ?> rawRecord) {
        String name = normalizeLower(cell(rawRecord, SourceColumn.NAME)).orElse(null);
        String gender = normalizeLower(cell(rawRecord, SourceColumn.GENDER)).orElse(null);
        String bloodType = normalizeLower(cell(rawRecord, SourceColumn.BLOOD_TYPE)).orElse(null);
        LocalDate admittedOn = coerceDate(cell(rawRecord, SourceColumn.DATE_OF_ADMISSION)).orElse(null);
        String hospital = normalizeLower(cell(rawRecord, SourceColumn.HOSPITAL)).orElse(null);

        if (name == null || gender == null || bloodType == null || admittedOn == null || hospital == null) {
            Map<String, Object> partialKey = new LinkedHashMap<>();
            partialKey.put(PatientAdmission.NAME, name);
            partialKey.put(PatientAdmission.GENDER, gender);
            partialKey.put(PatientAdmission.BLOOD_TYPE, bloodType);
            partialKey.put(PatientAdmission.DATE_OF_ADMISSION, admittedOn);
            partialKey.put(PatientAdmission.HOSPITAL, hospital);
            log.warn("Skipping row with incomplete natural key: {}", partialKey);
            return Optional.empty();
        }

        // Mongo keeps millisecond precision only
        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);

        return Optional.of(PatientAdmission.builder()
            .name(name)
            .age(coerceInt(cell(rawRecord, SourceColumn.AGE)).orElse(null))
            .gender(gender)
            .bloodType(bloodType)
            .medicalCondition(coerceString(cell(rawRecord, SourceColumn.MEDICAL_CONDITION)).orElse(null))
            .dateOfAdmission(admittedOn)
            .doctor(coerceString(cell(rawRecord, SourceColumn.DOCTOR)).orElse(null))
            .hospital(hospital)
            .insuranceProvider(coerceString(cell(rawRecord, SourceColumn.INSURANCE_PROVIDER)).orElse(null))
            .billingAmount(coerceFloat(cell(rawRecord, SourceColumn.BILLING_AMOUNT)).orElse(null))
            .roomNumber(coerceString(cell(rawRecord, SourceColumn.ROOM_NUMBER)).orElse(null))
            .admissionType(coerceString(cell(rawRecord, SourceColumn.ADMISSION_TYPE)).orElse(null))
            .dischargeDate(coerceDate(cell(rawRecord, SourceColumn.DISCHARGE_DATE)).orElse(null))
            .medication(coerceString(cell(rawRecord, SourceColumn.MEDICATION)).orElse(null))
            .testResults(coerceString(cell(rawRecord, SourceColumn.TEST_RESULTS)).orElse(null))
            .ingestedAt(now)
            .lastModifiedAt(now)
            .source(PatientAdmission.SOURCE_TAG)
            .build());
    }

    private static Object cell(Map<String, ?> rawRecord, SourceColumn column) {
        return rawRecord.get(column.header());
    }
}
