package org.healthcare.loader.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

/**
 * Normalized patient admission document.
 * One document per natural key (name, gender, blood type, admission date, hospital).
 * The collection name is chosen at runtime, see {@code loader.collection}.
 */
@Document
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatientAdmission {

    public static final String NAME = "name";
    public static final String AGE = "age";
    public static final String GENDER = "gender";
    public static final String BLOOD_TYPE = "blood_type";
    public static final String MEDICAL_CONDITION = "medical_condition";
    public static final String DATE_OF_ADMISSION = "date_of_admission";
    public static final String DOCTOR = "doctor";
    public static final String HOSPITAL = "hospital";
    public static final String INSURANCE_PROVIDER = "insurance_provider";
    public static final String BILLING_AMOUNT = "billing_amount";
    public static final String ROOM_NUMBER = "room_number";
    public static final String ADMISSION_TYPE = "admission_type";
    public static final String DISCHARGE_DATE = "discharge_date";
    public static final String MEDICATION = "medication";
    public static final String TEST_RESULTS = "test_results";
    public static final String INGESTED_AT = "ingested_at";
    public static final String LAST_MODIFIED_AT = "last_modified_at";
    public static final String SOURCE = "source";

    /**
     * Natural key fields, in index order.
     */
    public static final List<String> NATURAL_KEY_FIELDS =
        List.of(NAME, GENDER, BLOOD_TYPE, DATE_OF_ADMISSION, HOSPITAL);

    public static final String SOURCE_TAG = "csv_migration_v2";

    @Id
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String id;

    @Field(NAME)
    private String name;

    @Field(AGE)
    private Integer age;

    @Field(GENDER)
    private String gender;

    @Field(BLOOD_TYPE)
    private String bloodType;

    @Field(MEDICAL_CONDITION)
    private String medicalCondition;

    @Field(DATE_OF_ADMISSION)
    private LocalDate dateOfAdmission;

    @Field(DOCTOR)
    private String doctor;

    @Field(HOSPITAL)
    private String hospital;

    @Field(INSURANCE_PROVIDER)
    private String insuranceProvider;

    @Field(BILLING_AMOUNT)
    private Double billingAmount;

    @Field(ROOM_NUMBER)
    private String roomNumber;

    @Field(ADMISSION_TYPE)
    private String admissionType;

    @Field(DISCHARGE_DATE)
    private LocalDate dischargeDate;

    @Field(MEDICATION)
    private String medication;

    @Field(TEST_RESULTS)
    private String testResults;

    @Field(INGESTED_AT)
    private Instant ingestedAt;

    @Field(LAST_MODIFIED_AT)
    private Instant lastModifiedAt;

    @Field(SOURCE)
    @Builder.Default
    private String source = SOURCE_TAG;

    /**
     * Natural key values in {@link #NATURAL_KEY_FIELDS} order.
     */
    public List<Object> naturalKey() {
        return Arrays.asList(name, gender, bloodType, dateOfAdmission, hospital);
    }
}
