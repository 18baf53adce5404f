package io.catalogconnector.client.model;

import java.util.Objects;

import org.checkerframework.checker.nullness.qual.Nullable;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public final class ResourceDetails {

    private final Connection connection;
    private final @Nullable String dataFormat;

    @JsonCreator
    public ResourceDetails(@JsonProperty("connection") Connection connection,
                           @JsonProperty("data_format") @Nullable String dataFormat) {
        this.connection = connection;
        this.dataFormat = dataFormat;
    }

    @JsonProperty("connection")
    public Connection getConnection() {
        return connection;
    }

    @JsonProperty("data_format")
    public @Nullable String getDataFormat() {
        return dataFormat;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ResourceDetails)) {
            return false;
        }
        ResourceDetails that = (ResourceDetails) o;
        return Objects.equals(connection, that.connection) && Objects.equals(dataFormat, that.dataFormat);
    }

    @Override
    public int hashCode() {
        return Objects.hash(connection, dataFormat);
    }
}
