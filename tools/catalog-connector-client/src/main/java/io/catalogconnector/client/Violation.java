package io.catalogconnector.client;

import java.util.Objects;

public class Violation {
    private final String path;
    private final String rule;
    private final String message;

    public Violation(String path, String rule, String message) {
        this.path = path;
        this.rule = rule;
        this.message = message;
    }

    /**
     * Dotted and indexed path of the offending field, relative to the response root,
     * e.g. {@code resource_metadata.columns[1].name}. Empty for the root itself.
     */
    public String getPath() {
        return path;
    }

    /**
     * Schema keyword that failed, e.g. {@code required} or {@code type}.
     */
    public String getRule() {
        return rule;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Violation)) {
            return false;
        }
        Violation that = (Violation) o;
        return path.equals(that.path) && rule.equals(that.rule) && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, rule, message);
    }

    public String toString() {
        return "path: " + getPath() + " rule: " + getRule() + " message: " + getMessage();
    }
}
