package io.catalogconnector.client.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.checkerframework.checker.nullness.qual.Nullable;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Descriptive metadata of an asset as held by the catalog.
 */
public final class ResourceMetadata {

    private final @Nullable String name;
    private final @Nullable String owner;
    private final @Nullable String geography;
    private final @Nullable Map<String, Object> tags;
    private final @Nullable List<ResourceColumn> columns;

    @JsonCreator
    public ResourceMetadata(@JsonProperty("name") @Nullable String name,
                            @JsonProperty("owner") @Nullable String owner,
                            @JsonProperty("geography") @Nullable String geography,
                            @JsonProperty("tags") @Nullable Map<String, Object> tags,
                            @JsonProperty("columns") @Nullable List<ResourceColumn> columns) {
        this.name = name;
        this.owner = owner;
        this.geography = geography;
        this.tags = tags;
        this.columns = columns;
    }

    @JsonProperty("name")
    public @Nullable String getName() {
        return name;
    }

    @JsonProperty("owner")
    public @Nullable String getOwner() {
        return owner;
    }

    @JsonProperty("geography")
    public @Nullable String getGeography() {
        return geography;
    }

    @JsonProperty("tags")
    public @Nullable Map<String, Object> getTags() {
        return tags;
    }

    @JsonProperty("columns")
    public @Nullable List<ResourceColumn> getColumns() {
        return columns;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ResourceMetadata)) {
            return false;
        }
        ResourceMetadata that = (ResourceMetadata) o;
        return Objects.equals(name, that.name)
            && Objects.equals(owner, that.owner)
            && Objects.equals(geography, that.geography)
            && Objects.equals(tags, that.tags)
            && Objects.equals(columns, that.columns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, owner, geography, tags, columns);
    }
}
