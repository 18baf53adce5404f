package io.catalogconnector.client;

import java.util.List;

public interface Validator {

    /**
     * Checks a response against one taxonomy definition.
     *
     * @return the violations found, in schema traversal order; empty if the response conforms
     * @throws ConformanceException if the response cannot be serialized or the reference
     *     cannot be resolved
     */
    List<Violation> validate(Object response, TaxonomyReference taxonomy) throws ConformanceException;

    /**
     * Like {@link #validate}, but fails with a {@link ResponseConformanceException} carrying
     * every violation when the response does not conform.
     */
    default void ensure(Object response, TaxonomyReference taxonomy) throws ConformanceException {
        List<Violation> violations = validate(response, taxonomy);
        if (!violations.isEmpty()) {
            throw new ResponseConformanceException(violations);
        }
    }
}
