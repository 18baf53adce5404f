package io.catalogconnector.client.catalog;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import io.catalogconnector.client.model.CreateAssetRequest;
import io.catalogconnector.client.model.CreateAssetResponse;
import io.catalogconnector.client.model.GetAssetRequest;
import io.catalogconnector.client.model.GetAssetResponse;

/**
 * HTTP client for the data catalog connector API: JSON request and response bodies posted to
 * {@code /getAssetInfo} and {@code /createAsset}, with the credential locator in a request
 * header.
 */
public class OpenApiDataCatalog implements DataCatalog {

    static final String GET_ASSET_PATH = "/getAssetInfo";
    static final String CREATE_ASSET_PATH = "/createAsset";
    static final String READ_CREDENTIALS_HEADER = "X-Request-Datacatalog-Cred";
    static final String WRITE_CREDENTIALS_HEADER = "X-Request-Datacatalog-Write-Cred";

    private static final Logger log = LoggerFactory.getLogger(OpenApiDataCatalog.class);

    private final String name;
    private final String baseUrl;
    private final Duration timeout;
    private final HttpClient client;
    private final ObjectMapper mapper = JsonMapper.builder()
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .build();
    private volatile boolean closed;

    public OpenApiDataCatalog(String name, URI endpoint, Duration timeout) {
        this.name = name;
        String url = endpoint.toString();
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        this.timeout = timeout;
        this.client = HttpClient.newBuilder().connectTimeout(timeout).build();
    }

    public GetAssetResponse getAssetInfo(GetAssetRequest request, String credentialLocator) throws CatalogException {
        return post(GET_ASSET_PATH, READ_CREDENTIALS_HEADER, credentialLocator, request, GetAssetResponse.class);
    }

    public CreateAssetResponse createAsset(CreateAssetRequest request, String credentialLocator) throws CatalogException {
        return post(CREATE_ASSET_PATH, WRITE_CREDENTIALS_HEADER, credentialLocator, request, CreateAssetResponse.class);
    }

    private <T> T post(String path, String credentialsHeader, String credentialLocator, Object body, Class<T> responseType)
            throws CatalogException {
        if (closed) {
            throw new CatalogException(name + " catalog client is closed");
        }
        URI uri = URI.create(baseUrl + path);
        HttpResponse<byte[]> response;
        try {
            HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .header(credentialsHeader, credentialLocator)
                .POST(HttpRequest.BodyPublishers.ofByteArray(mapper.writeValueAsBytes(body)))
                .build();
            log.debug("POST {}", uri);
            response = client.send(request, BodyHandlers.ofByteArray());
        }
        catch (IOException e) {
            throw new CatalogException("POST " + uri + " failed", e);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CatalogException("POST " + uri + " interrupted", e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new CatalogException("POST " + uri + " returned status " + status + ": "
                + new String(response.body(), StandardCharsets.UTF_8).trim());
        }
        try {
            T result = mapper.readValue(response.body(), responseType);
            if (result == null) {
                throw new CatalogException("POST " + uri + " returned an empty body");
            }
            return result;
        }
        catch (IOException e) {
            throw new CatalogException("unable to decode the response of POST " + uri, e);
        }
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            log.debug("Closed {} catalog client", name);
        }
    }
}
