package io.catalogconnector.client;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import io.catalogconnector.client.model.Connection;
import io.catalogconnector.client.model.CreateAssetRequest;
import io.catalogconnector.client.model.GetAssetResponse;
import io.catalogconnector.client.model.ResourceColumn;
import io.catalogconnector.client.model.ResourceDetails;
import io.catalogconnector.client.model.ResourceMetadata;

final class Fixtures {

    static final String CREDENTIALS = "/v1/kubernetes-secrets/my-secret?namespace=default";

    static final String GET_ASSET_RESPONSE_JSON = "{"
        + "\"name\":\"paysim-csv\","
        + "\"resource_metadata\":{\"name\":\"paysim-csv\",\"geography\":\"theshire\","
        + "\"columns\":[{\"name\":\"nameOrig\",\"tags\":{\"PII\":true}}]},"
        + "\"details\":{\"connection\":{\"name\":\"s3\",\"s3\":{\"bucket\":\"bucket1\"}},\"data_format\":\"csv\"},"
        + "\"credentials\":\"" + CREDENTIALS + "\"}";

    private Fixtures() {
    }

    static ResourceMetadata metadata() {
        return new ResourceMetadata("paysim-csv", "data-owner", "theshire",
            Collections.singletonMap("finance", true),
            Arrays.asList(new ResourceColumn("nameOrig", Collections.singletonMap("PII", true)),
                new ResourceColumn("amount", null)));
    }

    static ResourceDetails details() {
        Map<String, Object> s3 = new LinkedHashMap<>();
        s3.put("endpoint", "http://localstack:4566");
        s3.put("bucket", "bucket1");
        return new ResourceDetails(new Connection("s3", Collections.singletonMap("s3", s3)), "csv");
    }

    static GetAssetResponse getAssetResponse() {
        return new GetAssetResponse("paysim-csv", metadata(), details(), CREDENTIALS);
    }

    static CreateAssetRequest createAssetRequest() {
        return new CreateAssetRequest("openapi", "new-asset", metadata(), details(), CREDENTIALS);
    }
}
