package io.catalogconnector.client.model;

import java.util.Map;
import java.util.Objects;

import org.checkerframework.checker.nullness.qual.Nullable;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public final class ResourceColumn {

    private final String name;
    private final @Nullable Map<String, Object> tags;

    @JsonCreator
    public ResourceColumn(@JsonProperty("name") String name,
                          @JsonProperty("tags") @Nullable Map<String, Object> tags) {
        this.name = name;
        this.tags = tags;
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("tags")
    public @Nullable Map<String, Object> getTags() {
        return tags;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ResourceColumn)) {
            return false;
        }
        ResourceColumn that = (ResourceColumn) o;
        return Objects.equals(name, that.name) && Objects.equals(tags, that.tags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, tags);
    }
}
