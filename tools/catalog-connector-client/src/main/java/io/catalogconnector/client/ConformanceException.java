package io.catalogconnector.client;

import java.util.Collections;
import java.util.List;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Failure of a conformance run. The message reads as a causal chain, outer-most context
 * first, e.g. {@code failed to validate the catalog connector response: invalid response: ...}.
 */
public class ConformanceException extends Exception {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;
    private final String context;

    public ConformanceException(ErrorKind kind, String context) {
        this(kind, context, null);
    }

    public ConformanceException(ErrorKind kind, String context, @Nullable Throwable cause) {
        super(chain(context, cause), cause);
        this.kind = kind;
        this.context = context;
    }

    /**
     * Adds phase context to an existing failure, keeping its kind.
     */
    public static ConformanceException wrap(String context, ConformanceException cause) {
        return new ConformanceException(cause.getKind(), context, cause);
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * The context added at this level only, without the messages of the causes.
     */
    public String getContext() {
        return context;
    }

    /**
     * Violations carried anywhere in the cause chain, or an empty list.
     */
    public List<Violation> getViolations() {
        for (Throwable t = this; t != null; t = t.getCause()) {
            if (t instanceof ResponseConformanceException) {
                return ((ResponseConformanceException) t).violations();
            }
        }
        return Collections.emptyList();
    }

    private static String chain(String context, @Nullable Throwable cause) {
        if (cause == null || cause.getMessage() == null) {
            return context;
        }
        return context + ": " + cause.getMessage();
    }
}
