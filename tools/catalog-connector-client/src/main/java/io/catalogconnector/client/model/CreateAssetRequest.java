package io.catalogconnector.client.model;

import java.util.Objects;

import org.checkerframework.checker.nullness.qual.Nullable;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public final class CreateAssetRequest {

    private final String destinationCatalogId;
    private final @Nullable String destinationAssetId;
    private final ResourceMetadata resourceMetadata;
    private final ResourceDetails details;
    private final @Nullable String credentials;

    @JsonCreator
    public CreateAssetRequest(@JsonProperty("destination_catalog_id") String destinationCatalogId,
                              @JsonProperty("destination_asset_id") @Nullable String destinationAssetId,
                              @JsonProperty("resource_metadata") ResourceMetadata resourceMetadata,
                              @JsonProperty("details") ResourceDetails details,
                              @JsonProperty("credentials") @Nullable String credentials) {
        this.destinationCatalogId = destinationCatalogId;
        this.destinationAssetId = destinationAssetId;
        this.resourceMetadata = resourceMetadata;
        this.details = details;
        this.credentials = credentials;
    }

    @JsonProperty("destination_catalog_id")
    public String getDestinationCatalogId() {
        return destinationCatalogId;
    }

    @JsonProperty("destination_asset_id")
    public @Nullable String getDestinationAssetId() {
        return destinationAssetId;
    }

    @JsonProperty("resource_metadata")
    public ResourceMetadata getResourceMetadata() {
        return resourceMetadata;
    }

    @JsonProperty("details")
    public ResourceDetails getDetails() {
        return details;
    }

    @JsonProperty("credentials")
    public @Nullable String getCredentials() {
        return credentials;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CreateAssetRequest)) {
            return false;
        }
        CreateAssetRequest that = (CreateAssetRequest) o;
        return Objects.equals(destinationCatalogId, that.destinationCatalogId)
            && Objects.equals(destinationAssetId, that.destinationAssetId)
            && Objects.equals(resourceMetadata, that.resourceMetadata)
            && Objects.equals(details, that.details)
            && Objects.equals(credentials, that.credentials);
    }

    @Override
    public int hashCode() {
        return Objects.hash(destinationCatalogId, destinationAssetId, resourceMetadata, details, credentials);
    }
}
