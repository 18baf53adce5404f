package io.catalogconnector.client.catalog;

/**
 * Opens a catalog client for one run. The caller owns the returned client and closes it.
 */
@FunctionalInterface
public interface DataCatalogFactory {

    DataCatalog open() throws CatalogException;
}
