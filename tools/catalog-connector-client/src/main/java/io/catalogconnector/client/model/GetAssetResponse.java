package io.catalogconnector.client.model;

import java.util.Objects;

import org.checkerframework.checker.nullness.qual.Nullable;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * What a connector returns for {@code getAssetInfo}. Fields are nullable here because a
 * non-conforming connector may omit them; the taxonomy decides which ones are required.
 */
public final class GetAssetResponse {

    private final @Nullable String name;
    private final @Nullable ResourceMetadata resourceMetadata;
    private final @Nullable ResourceDetails details;
    private final @Nullable String credentials;

    @JsonCreator
    public GetAssetResponse(@JsonProperty("name") @Nullable String name,
                            @JsonProperty("resource_metadata") @Nullable ResourceMetadata resourceMetadata,
                            @JsonProperty("details") @Nullable ResourceDetails details,
                            @JsonProperty("credentials") @Nullable String credentials) {
        this.name = name;
        this.resourceMetadata = resourceMetadata;
        this.details = details;
        this.credentials = credentials;
    }

    @JsonProperty("name")
    public @Nullable String getName() {
        return name;
    }

    @JsonProperty("resource_metadata")
    public @Nullable ResourceMetadata getResourceMetadata() {
        return resourceMetadata;
    }

    @JsonProperty("details")
    public @Nullable ResourceDetails getDetails() {
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
        if (!(o instanceof GetAssetResponse)) {
            return false;
        }
        GetAssetResponse that = (GetAssetResponse) o;
        return Objects.equals(name, that.name)
            && Objects.equals(resourceMetadata, that.resourceMetadata)
            && Objects.equals(details, that.details)
            && Objects.equals(credentials, that.credentials);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, resourceMetadata, details, credentials);
    }
}
