package org.healthcare.loader.model;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Columns of the healthcare CSV export. Header names are case-sensitive.
 */
public enum SourceColumn {
    NAME("Name"),
    AGE("Age"),
    GENDER("Gender"),
    BLOOD_TYPE("Blood Type"),
    MEDICAL_CONDITION("Medical Condition"),
    DATE_OF_ADMISSION("Date of Admission"),
    DOCTOR("Doctor"),
    HOSPITAL("Hospital"),
    INSURANCE_PROVIDER("Insurance Provider"),
    BILLING_AMOUNT("Billing Amount"),
    ROOM_NUMBER("Room Number"),
    ADMISSION_TYPE("Admission Type"),
    DISCHARGE_DATE("Discharge Date"),
    MEDICATION("Medication"),
    TEST_RESULTS("Test Results");

    private static final List<String> HEADERS = Arrays.stream(values())
        .map(SourceColumn::header)
        .collect(Collectors.toUnmodifiableList());

    private final String header;

    SourceColumn(String header) {
        this.header = header;
    }

    public String header() {
        return header;
    }

    /**
     * The expected schema: all header names in declaration order.
     */
    public static List<String> headers() {
        return HEADERS;
    }
}
