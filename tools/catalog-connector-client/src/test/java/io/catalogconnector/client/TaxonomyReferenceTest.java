package io.catalogconnector.client;

import static org.junit.Assert.assertEquals;

import org.junit.Test;

public class TaxonomyReferenceTest {

    @Test
    public void parseFileAndPointer() {
        TaxonomyReference reference = TaxonomyReference.parse("resources/taxonomy/datacatalog.json#/definitions/GetAssetResponse");
        assertEquals("resources/taxonomy/datacatalog.json", reference.getFile());
        assertEquals("/definitions/GetAssetResponse", reference.getPointer());
        assertEquals("resources/taxonomy/datacatalog.json#/definitions/GetAssetResponse", reference.toString());
    }

    @Test
    public void operationsReferenceTheirResponseDefinitions() {
        assertEquals(TaxonomyReference.parse("taxonomy/datacatalog.json#/definitions/CreateAssetResponse"),
            Operation.CREATE_ASSET.responseTaxonomy("taxonomy/datacatalog.json"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectMissingPointer() {
        TaxonomyReference.parse("taxonomy/datacatalog.json");
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectRelativePointer() {
        TaxonomyReference.parse("taxonomy/datacatalog.json#definitions/GetAssetResponse");
    }
}
