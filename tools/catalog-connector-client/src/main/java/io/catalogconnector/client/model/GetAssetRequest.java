package io.catalogconnector.client.model;

import java.util.Objects;

import org.checkerframework.checker.nullness.qual.Nullable;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public final class GetAssetRequest {

    private final String assetId;
    private final @Nullable OperationType operationType;

    @JsonCreator
    public GetAssetRequest(@JsonProperty("asset_id") String assetId,
                           @JsonProperty("operation_type") @Nullable OperationType operationType) {
        this.assetId = assetId;
        this.operationType = operationType;
    }

    @JsonProperty("asset_id")
    public String getAssetId() {
        return assetId;
    }

    @JsonProperty("operation_type")
    public @Nullable OperationType getOperationType() {
        return operationType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GetAssetRequest)) {
            return false;
        }
        GetAssetRequest that = (GetAssetRequest) o;
        return Objects.equals(assetId, that.assetId) && operationType == that.operationType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(assetId, operationType);
    }

    @Override
    public String toString() {
        return "GetAssetRequest{asset_id=" + assetId + ", operation_type=" + operationType + "}";
    }
}
