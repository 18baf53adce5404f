package io.catalogconnector.client.catalog;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class DataCatalogs {

    private static final Logger log = LoggerFactory.getLogger(DataCatalogs.class);

    private DataCatalogs() {
    }

    /**
     * Creates a client for the connector at {@code connectorUrl}. Every provider speaks the
     * same connector API, so the provider name only labels the client in the log.
     */
    public static DataCatalog newDataCatalog(String providerName, String connectorUrl, Duration timeout)
            throws CatalogException {
        URI endpoint;
        try {
            endpoint = new URI(connectorUrl);
        }
        catch (URISyntaxException e) {
            throw new CatalogException("invalid catalog connector url " + connectorUrl, e);
        }
        String scheme = endpoint.getScheme();
        if ((!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) || endpoint.getHost() == null) {
            throw new CatalogException("catalog connector url must be an absolute http(s) url: " + connectorUrl);
        }
        log.info("Connecting to {} catalog connector at {}", providerName, endpoint);
        return new OpenApiDataCatalog(providerName, endpoint, timeout);
    }

    public static DataCatalogFactory factory(String providerName, String connectorUrl, Duration timeout) {
        return () -> newDataCatalog(providerName, connectorUrl, timeout);
    }
}
