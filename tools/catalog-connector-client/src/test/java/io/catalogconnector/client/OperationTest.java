package io.catalogconnector.client;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

import org.junit.Test;

import io.catalogconnector.client.model.CreateAssetRequest;
import io.catalogconnector.client.model.GetAssetRequest;

public class OperationTest {

    @Test
    public void selectEveryOperationByName() throws Exception {
        for (Operation operation : Operation.values()) {
            assertEquals(operation, Operation.fromName(operation.operationName()).get());
            assertEquals(operation, Dispatcher.select(operation.operationName()));
        }
    }

    @Test
    public void operationTable() {
        assertEquals(GetAssetRequest.class, Operation.GET_ASSET.requestType());
        assertEquals("GetAssetResponse", Operation.GET_ASSET.responseDefinition());
        assertEquals(CreateAssetRequest.class, Operation.CREATE_ASSET.requestType());
        assertEquals("CreateAssetResponse", Operation.CREATE_ASSET.responseDefinition());
    }

    @Test
    public void unknownNames() {
        assertFalse(Operation.fromName("delete-asset").isPresent());
        assertFalse(Operation.fromName("GET_ASSET").isPresent());
        assertFalse(Operation.fromName("").isPresent());
    }
}
