package io.catalogconnector.client;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaException;

/**
 * JSON schema validation of connector responses. The response is serialized to canonical
 * JSON (sorted properties, no nulls) and checked against a definition from the
 * {@link TaxonomyStore}. Instances hold no per-call state and may be shared.
 */
public class TaxonomyValidator implements Validator {

    private final TaxonomyStore taxonomies;
    private final Logger log;
    private final ObjectMapper mapper;

    public TaxonomyValidator(TaxonomyStore taxonomies) {
        this(taxonomies, LoggerFactory.getLogger(TaxonomyValidator.class));
    }

    public TaxonomyValidator(TaxonomyStore taxonomies, Logger log) {
        this.taxonomies = taxonomies;
        this.log = log;
        this.mapper = canonicalMapper();
    }

    public static ObjectMapper canonicalMapper() {
        return JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .serializationInclusion(JsonInclude.Include.NON_NULL)
            .build();
    }

    public List<Violation> validate(Object response, TaxonomyReference taxonomy) throws ConformanceException {
        JsonNode json = serialize(response);
        JsonSchema schema = taxonomies.resolve(taxonomy);

        ViolationCollector collector = new ViolationCollector(log);
        try {
            collector.addAll(schema.validate(json));
        }
        catch (JsonSchemaException e) {
            throw new ConformanceException(ErrorKind.SCHEMA_RESOLUTION, "unable to apply " + taxonomy, e);
        }
        if (collector.hasViolations()) {
            log.warn("Response violates {} in {} place(s)", taxonomy, collector.getViolations().size());
        }
        return collector.getViolations();
    }

    private JsonNode serialize(Object response) throws ConformanceException {
        try {
            byte[] responseJson = mapper.writeValueAsBytes(response);
            log.info("responseJSON: {}", new String(responseJson, StandardCharsets.UTF_8));
            return mapper.readTree(responseJson);
        }
        catch (JsonProcessingException e) {
            throw new ConformanceException(ErrorKind.RESPONSE_SERIALIZATION, "unable to serialize the response", e);
        }
        catch (IOException e) {
            throw new ConformanceException(ErrorKind.RESPONSE_SERIALIZATION, "unable to read back the response", e);
        }
    }
}
