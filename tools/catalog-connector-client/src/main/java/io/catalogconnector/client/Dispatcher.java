package io.catalogconnector.client;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import io.catalogconnector.client.catalog.CatalogException;
import io.catalogconnector.client.catalog.DataCatalog;
import io.catalogconnector.client.catalog.DataCatalogFactory;

/**
 * Runs one conformance check: selects the operation, decodes the request, calls the connector
 * and validates its response against the operation's taxonomy definition. Each phase wraps
 * the failure it reports, so the final message reads outer-most phase first.
 *
 * <p>Request payloads are only parsed, never validated against the taxonomy.
 */
public class Dispatcher {

    static final String MDC_OPERATION = "operation";

    private final DataCatalogFactory catalogs;
    private final Validator validator;
    private final String taxonomyFile;
    private final Logger log;
    private final ObjectMapper mapper = JsonMapper.builder()
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .build();

    public Dispatcher(DataCatalogFactory catalogs, Validator validator, String taxonomyFile) {
        this(catalogs, validator, taxonomyFile, LoggerFactory.getLogger(Dispatcher.class));
    }

    public Dispatcher(DataCatalogFactory catalogs, Validator validator, String taxonomyFile, Logger log) {
        this.catalogs = catalogs;
        this.validator = validator;
        this.taxonomyFile = taxonomyFile;
        this.log = log;
    }

    public void run(String operationName, byte[] rawRequest, String credentialLocator) throws ConformanceException {
        Operation operation = select(operationName);
        MDC.put(MDC_OPERATION, operation.operationName());
        try (DataCatalog catalog = open()) {
            Object request = decode(operation, rawRequest);
            Object response = invoke(operation, catalog, request, credentialLocator);
            validate(operation, response);
            log.info("RESPONSE VALIDATION PASS");
        }
        finally {
            MDC.remove(MDC_OPERATION);
        }
    }

    static Operation select(String operationName) throws ConformanceException {
        return Operation.fromName(operationName)
            .orElseThrow(() -> new ConformanceException(ErrorKind.UNSUPPORTED_OPERATION,
                "Unsupported operation " + operationName));
    }

    private DataCatalog open() throws ConformanceException {
        try {
            return catalogs.open();
        }
        catch (CatalogException e) {
            throw new ConformanceException(ErrorKind.CONNECTOR_INVOCATION, "unable to create data catalog facade", e);
        }
    }

    Object decode(Operation operation, byte[] rawRequest) throws ConformanceException {
        Object request;
        try {
            request = mapper.readValue(rawRequest, operation.requestType());
        }
        catch (IOException e) {
            throw new ConformanceException(ErrorKind.REQUEST_DECODE,
                "dataCatalog request unmarshal failed for " + operation, e);
        }
        if (request == null) {
            throw new ConformanceException(ErrorKind.REQUEST_DECODE,
                "dataCatalog request unmarshal failed for " + operation + ": request is null");
        }
        return request;
    }

    private Object invoke(Operation operation, DataCatalog catalog, Object request, String credentialLocator)
            throws ConformanceException {
        try {
            return operation.call(catalog, request, credentialLocator);
        }
        catch (CatalogException e) {
            throw new ConformanceException(ErrorKind.CONNECTOR_INVOCATION,
                "failed to receive the catalog connector response", e);
        }
    }

    private void validate(Operation operation, Object response) throws ConformanceException {
        try {
            validator.ensure(response, operation.responseTaxonomy(taxonomyFile));
        }
        catch (ConformanceException e) {
            throw ConformanceException.wrap("failed to validate the catalog connector response", e);
        }
    }
}
