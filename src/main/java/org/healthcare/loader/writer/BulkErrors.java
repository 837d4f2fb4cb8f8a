package org.healthcare.loader.writer;

import com.mongodb.bulk.BulkWriteError;

import java.util.List;
import java.util.stream.Collectors;

final class BulkErrors {

    private static final int MAX_DESCRIBED = 10;

    private BulkErrors() {
    }

    /**
     * Index, code and message of the first few write errors.
     */
    static String describe(List<BulkWriteError> errors) {
        String described = errors.stream()
            .limit(MAX_DESCRIBED)
            .map(error -> "[index=" + error.getIndex() + ", code=" + error.getCode() + ", message=" + error.getMessage() + "]")
            .collect(Collectors.joining(", "));
        return errors.size() > MAX_DESCRIBED
            ? described + " ... and " + (errors.size() - MAX_DESCRIBED) + " more"
            : described;
    }
}
