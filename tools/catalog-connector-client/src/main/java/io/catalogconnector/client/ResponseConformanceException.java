package io.catalogconnector.client;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The connector answered, but its response does not conform to the taxonomy.
 */
public class ResponseConformanceException extends ConformanceException {

    private static final long serialVersionUID = 1L;

    private final List<Violation> violations;

    public ResponseConformanceException(List<Violation> violations) {
        super(ErrorKind.RESPONSE_CONFORMANCE, "invalid response: " + describe(violations));
        this.violations = Collections.unmodifiableList(new ArrayList<>(violations));
    }

    List<Violation> violations() {
        return violations;
    }

    private static String describe(List<Violation> violations) {
        return violations.stream()
            .map(v -> (v.getPath().isEmpty() ? "<root>" : v.getPath()) + ": " + v.getMessage())
            .collect(Collectors.joining(", ", "[", "]"));
    }
}
