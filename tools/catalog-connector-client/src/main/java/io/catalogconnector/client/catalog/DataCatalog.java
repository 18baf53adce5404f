package io.catalogconnector.client.catalog;

import io.catalogconnector.client.model.CreateAssetRequest;
import io.catalogconnector.client.model.CreateAssetResponse;
import io.catalogconnector.client.model.GetAssetRequest;
import io.catalogconnector.client.model.GetAssetResponse;

/**
 * The operations a data catalog connector exposes. The credential locator is handed to the
 * connector unchanged; it tells the connector where to fetch the credentials it needs.
 */
public interface DataCatalog extends AutoCloseable {

    GetAssetResponse getAssetInfo(GetAssetRequest request, String credentialLocator) throws CatalogException;

    CreateAssetResponse createAsset(CreateAssetRequest request, String credentialLocator) throws CatalogException;

    @Override
    void close();
}
