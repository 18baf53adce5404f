package io.catalogconnector.client.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * How to reach the data of an asset. Only {@code name} is fixed; every other property is
 * specific to the named connection type (e.g. {@code s3}, {@code db2}) and kept as is.
 */
public final class Connection {

    private final String name;
    private final Map<String, Object> properties = new LinkedHashMap<>();

    @JsonCreator
    public Connection(@JsonProperty("name") String name) {
        this.name = name;
    }

    public Connection(String name, Map<String, Object> properties) {
        this(name);
        this.properties.putAll(properties);
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonAnyGetter
    public Map<String, Object> getProperties() {
        return properties;
    }

    @JsonAnySetter
    void setProperty(String key, Object value) {
        properties.put(key, value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Connection)) {
            return false;
        }
        Connection that = (Connection) o;
        return Objects.equals(name, that.name) && properties.equals(that.properties);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, properties);
    }
}
