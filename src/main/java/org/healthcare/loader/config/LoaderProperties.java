package org.healthcare.loader.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Loader settings, bound from {@code loader.*}.
 * Connection string and database name come from {@code spring.data.mongodb.*}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "loader")
public class LoaderProperties {

    /**
     * CSV file to load. Required; checked when the run starts.
     */
    private String csvPath;

    @NotBlank
    private String collection = "patients";

    /**
     * Documents per bulk write.
     */
    @Min(1)
    private int batchSize = 1000;

    /**
     * CSV rows read per chunk.
     */
    @Min(1)
    private int chunkSize = 5000;

    /**
     * Transform the first chunk and print a preview without touching MongoDB.
     */
    private boolean dryRun = false;

    /**
     * Upsert on the natural key; when false, plain inserts.
     */
    private boolean upsert = true;

    /**
     * Ensure the unique natural-key index before writing.
     */
    private boolean createIndexes = false;

    @Min(1)
    @Max(100)
    private int previewSize = 5;
}
