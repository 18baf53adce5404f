package io.catalogconnector.client;

import java.util.Optional;

import io.catalogconnector.client.catalog.CatalogException;
import io.catalogconnector.client.catalog.DataCatalog;
import io.catalogconnector.client.model.CreateAssetRequest;
import io.catalogconnector.client.model.GetAssetRequest;

/**
 * The connector operations this client can exercise, each with its request type, the catalog
 * call it makes and the taxonomy definition its response must satisfy.
 */
public enum Operation {

    GET_ASSET("get-asset", GetAssetRequest.class, "GetAssetResponse") {
        @Override
        Object call(DataCatalog catalog, Object request, String credentialLocator) throws CatalogException {
            return catalog.getAssetInfo((GetAssetRequest) request, credentialLocator);
        }
    },

    CREATE_ASSET("create-asset", CreateAssetRequest.class, "CreateAssetResponse") {
        @Override
        Object call(DataCatalog catalog, Object request, String credentialLocator) throws CatalogException {
            return catalog.createAsset((CreateAssetRequest) request, credentialLocator);
        }
    };

    private final String operationName;
    private final Class<?> requestType;
    private final String responseDefinition;

    Operation(String operationName, Class<?> requestType, String responseDefinition) {
        this.operationName = operationName;
        this.requestType = requestType;
        this.responseDefinition = responseDefinition;
    }

    public static Optional<Operation> fromName(String name) {
        for (Operation operation : values()) {
            if (operation.operationName.equals(name)) {
                return Optional.of(operation);
            }
        }
        return Optional.empty();
    }

    /**
     * Name used on the command line, e.g. {@code get-asset}.
     */
    public String operationName() {
        return operationName;
    }

    public Class<?> requestType() {
        return requestType;
    }

    public String responseDefinition() {
        return responseDefinition;
    }

    public TaxonomyReference responseTaxonomy(String taxonomyFile) {
        return TaxonomyReference.definition(taxonomyFile, responseDefinition);
    }

    /**
     * Invokes the catalog operation. {@code request} must be an instance of {@link #requestType()}.
     */
    abstract Object call(DataCatalog catalog, Object request, String credentialLocator) throws CatalogException;

    @Override
    public String toString() {
        return operationName;
    }
}
