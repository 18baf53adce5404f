package io.catalogconnector.client;

import com.networknt.schema.JsonSchema;

public interface TaxonomyStore {

    /**
     * Returns the compiled schema for one taxonomy definition.
     *
     * @throws ConformanceException of kind {@link ErrorKind#SCHEMA_RESOLUTION} if the file
     *     cannot be read or the pointer does not resolve
     */
    JsonSchema resolve(TaxonomyReference reference) throws ConformanceException;
}
