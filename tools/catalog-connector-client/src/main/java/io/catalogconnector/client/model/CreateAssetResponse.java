package io.catalogconnector.client.model;

import java.util.Objects;

import org.checkerframework.checker.nullness.qual.Nullable;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public final class CreateAssetResponse {

    private final @Nullable String assetId;

    @JsonCreator
    public CreateAssetResponse(@JsonProperty("asset_id") @Nullable String assetId) {
        this.assetId = assetId;
    }

    @JsonProperty("asset_id")
    public @Nullable String getAssetId() {
        return assetId;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CreateAssetResponse && Objects.equals(assetId, ((CreateAssetResponse) o).assetId);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(assetId);
    }
}
