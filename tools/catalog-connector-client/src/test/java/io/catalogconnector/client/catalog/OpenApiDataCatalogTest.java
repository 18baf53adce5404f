package io.catalogconnector.client.catalog;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.time.Duration;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.catalogconnector.client.model.Connection;
import io.catalogconnector.client.model.CreateAssetRequest;
import io.catalogconnector.client.model.CreateAssetResponse;
import io.catalogconnector.client.model.GetAssetRequest;
import io.catalogconnector.client.model.GetAssetResponse;
import io.catalogconnector.client.model.OperationType;
import io.catalogconnector.client.model.ResourceDetails;
import io.catalogconnector.client.model.ResourceMetadata;

public class OpenApiDataCatalogTest {

    private static final String CREDENTIALS = "/v1/kubernetes-secrets/my-secret?namespace=default";
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private FakeConnector connector;

    @Before
    public void setUp() throws Exception {
        connector = new FakeConnector();
    }

    @After
    public void tearDown() {
        connector.close();
    }

    @Test
    public void getAssetInfo() throws Exception {
        connector.getAssetInfo(200, "{\"name\":\"paysim-csv\",\"details\":{\"connection\":{\"name\":\"s3\","
            + "\"s3\":{\"bucket\":\"bucket1\"}},\"data_format\":\"csv\"},\"unknown\":1}");

        GetAssetResponse response;
        try (DataCatalog catalog = DataCatalogs.newDataCatalog("openapi", connector.url(), TIMEOUT)) {
            response = catalog.getAssetInfo(new GetAssetRequest("paysim-csv", OperationType.READ), CREDENTIALS);
        }

        assertEquals("paysim-csv", response.getName());
        assertEquals("s3", response.getDetails().getConnection().getName());
        assertTrue(response.getDetails().getConnection().getProperties().containsKey("s3"));
        assertEquals(CREDENTIALS, connector.lastCredentials(OpenApiDataCatalog.GET_ASSET_PATH));
        JsonNode sent = new ObjectMapper().readTree(connector.lastBody(OpenApiDataCatalog.GET_ASSET_PATH));
        assertEquals("paysim-csv", sent.get("asset_id").asText());
        assertEquals("read", sent.get("operation_type").asText());
    }

    @Test
    public void createAsset() throws Exception {
        connector.createAsset(201, "{\"asset_id\":\"new-asset\"}");
        CreateAssetRequest request = new CreateAssetRequest("openapi", null,
            new ResourceMetadata("new-asset", null, null, null, null),
            new ResourceDetails(new Connection("s3"), "parquet"), null);

        try (DataCatalog catalog = DataCatalogs.newDataCatalog("openapi", connector.url() + "/", TIMEOUT)) {
            assertEquals(new CreateAssetResponse("new-asset"), catalog.createAsset(request, CREDENTIALS));
        }
        assertEquals(CREDENTIALS, connector.lastCredentials(OpenApiDataCatalog.CREATE_ASSET_PATH));
        JsonNode sent = new ObjectMapper().readTree(connector.lastBody(OpenApiDataCatalog.CREATE_ASSET_PATH));
        assertEquals("openapi", sent.get("destination_catalog_id").asText());
    }

    @Test
    public void errorStatus() throws Exception {
        connector.getAssetInfo(500, "asset not found");
        try (DataCatalog catalog = DataCatalogs.newDataCatalog("openapi", connector.url(), TIMEOUT)) {
            catalog.getAssetInfo(new GetAssetRequest("missing", OperationType.READ), CREDENTIALS);
            fail("expected a catalog failure");
        }
        catch (CatalogException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("returned status 500: asset not found"));
        }
    }

    @Test
    public void undecodableBody() throws Exception {
        connector.createAsset(200, "not json");
        try (DataCatalog catalog = DataCatalogs.newDataCatalog("openapi", connector.url(), TIMEOUT)) {
            catalog.createAsset(new CreateAssetRequest("openapi", null, null, null, null), CREDENTIALS);
            fail("expected a catalog failure");
        }
        catch (CatalogException e) {
            assertTrue(e.getMessage(), e.getMessage().startsWith("unable to decode the response"));
        }
    }

    @Test(expected = CatalogException.class)
    public void closedCatalog() throws Exception {
        connector.getAssetInfo(200, "{\"name\":\"a\"}");
        DataCatalog catalog = DataCatalogs.newDataCatalog("openapi", connector.url(), TIMEOUT);
        catalog.close();
        catalog.getAssetInfo(new GetAssetRequest("a", OperationType.READ), CREDENTIALS);
    }

    @Test(expected = CatalogException.class)
    public void rejectNonHttpUrl() throws Exception {
        DataCatalogs.newDataCatalog("openapi", "ftp://localhost:8080", TIMEOUT);
    }

    @Test(expected = CatalogException.class)
    public void rejectMalformedUrl() throws Exception {
        DataCatalogs.newDataCatalog("openapi", "http://local host", TIMEOUT);
    }
}
