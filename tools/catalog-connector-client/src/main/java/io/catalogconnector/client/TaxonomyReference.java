package io.catalogconnector.client;

import java.util.Objects;

/**
 * Points at one schema definition: a taxonomy file plus a JSON pointer inside it,
 * written as {@code taxonomy/datacatalog.json#/definitions/GetAssetResponse}.
 */
public final class TaxonomyReference {

    public static final String DEFAULT_TAXONOMY_FILE = "taxonomy/datacatalog.json";

    private final String file;
    private final String pointer;

    private TaxonomyReference(String file, String pointer) {
        this.file = file;
        this.pointer = pointer;
    }

    public static TaxonomyReference parse(String reference) {
        int hash = reference.indexOf('#');
        if (hash <= 0) {
            throw new IllegalArgumentException("Taxonomy reference must have the form <file>#<pointer>: " + reference);
        }
        String pointer = reference.substring(hash + 1);
        if (!pointer.startsWith("/")) {
            throw new IllegalArgumentException("Taxonomy pointer must start with '/': " + reference);
        }
        return new TaxonomyReference(reference.substring(0, hash), pointer);
    }

    public static TaxonomyReference definition(String file, String definitionName) {
        return parse(file + "#/definitions/" + definitionName);
    }

    public String getFile() {
        return file;
    }

    public String getPointer() {
        return pointer;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TaxonomyReference)) {
            return false;
        }
        TaxonomyReference that = (TaxonomyReference) o;
        return file.equals(that.file) && pointer.equals(that.pointer);
    }

    @Override
    public int hashCode() {
        return Objects.hash(file, pointer);
    }

    @Override
    public String toString() {
        return file + "#" + pointer;
    }
}
