package io.catalogconnector.client;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;

import com.networknt.schema.ValidationMessage;

/**
 * Turns validator messages into {@link Violation}s addressed by field path.
 */
public class ViolationCollector {

    private static final String REQUIRED = "required";

    private final Logger log;
    private final List<Violation> violations = new ArrayList<>();

    public ViolationCollector(Logger log) {
        this.log = log;
    }

    public void add(ValidationMessage message) {
        Violation v = extractViolation(message);
        log.debug("{}: {}", v.getPath(), v.getMessage());
        violations.add(v);
    }

    public void addAll(Iterable<ValidationMessage> messages) {
        messages.forEach(this::add);
    }

    public boolean hasViolations() {
        return !violations.isEmpty();
    }

    public List<Violation> getViolations() {
        return new ArrayList<>(violations);
    }

    private Violation extractViolation(ValidationMessage message) {
        String path = message.getPath();
        String[] arguments = message.getArguments();
        // A missing property is reported against its parent object.
        if (REQUIRED.equals(message.getType()) && arguments != null && arguments.length > 0) {
            path = path + "." + arguments[0];
        }
        return new Violation(fieldPath(path), message.getType(), message.getMessage());
    }

    static String fieldPath(String jsonPath) {
        if (jsonPath.startsWith("$.")) {
            return jsonPath.substring(2);
        }
        if (jsonPath.startsWith("$")) {
            return jsonPath.substring(1);
        }
        return jsonPath;
    }
}
