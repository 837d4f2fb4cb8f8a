package org.healthcare.loader.runner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.healthcare.loader.model.PatientAdmission;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;

/**
 * Renders transformed documents as indented JSON for dry runs.
 */
@Component
public class DocumentPreviewPrinter {

    private final ObjectMapper objectMapper;

    public DocumentPreviewPrinter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public void print(List<PatientAdmission> documents, PrintStream out) {
        try {
            out.println(objectMapper.writeValueAsString(documents));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not render preview documents", e);
        }
    }
}
