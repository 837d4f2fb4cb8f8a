package org.healthcare.loader.writer;

import org.healthcare.loader.model.PatientAdmission;

import java.util.List;

/**
 * Writes one batch of documents in a single bulk round-trip.
 */
public interface WriteStrategy {

    /**
     * Bulk failures are logged and reflected in the returned count, never thrown.
     *
     * @return the count this batch contributes to the run total
     */
    int write(List<PatientAdmission> batch);

    /**
     * Label used in logs.
     */
    String mode();
}
