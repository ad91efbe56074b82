package dk.trustworks.msgraph.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.microsoft.kiota.store.BackedModel;
import com.microsoft.kiota.store.BackingStore;

import java.util.Arrays;
import java.util.Set;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Helper methods for common assertions in tests.
 * Provides reusable assertion patterns to keep tests clean and readable.
 */
public class AssertionHelpers {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Assert that two JSON documents are structurally equal. Member order is ignored.
     *
     * @param expectedJson Expected document
     * @param actualJson   Actual document
     */
    public static void assertJsonEquals(String expectedJson, String actualJson) {
        assertEquals(readJson(expectedJson), readJson(actualJson),
                "JSON mismatch, actual was: " + actualJson);
    }

    /**
     * Parse a JSON document, failing the test if it is malformed.
     */
    public static JsonNode readJson(String json) {
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            return fail("Invalid JSON: " + json, e);
        }
    }

    /**
     * Assert that the model's backing store reports no changed values.
     * A freshly decoded model should satisfy this.
     *
     * @param model The model to inspect
     */
    public static void assertNoChangedValues(BackedModel model) {
        assertChangedKeys(model);
    }

    /**
     * Assert that exactly the given keys are reported as changed.
     *
     * @param model        The model to inspect
     * @param expectedKeys Wire names expected to be changed
     */
    public static void assertChangedKeys(BackedModel model, String... expectedKeys) {
        BackingStore store = model.getBackingStore();
        boolean previous = store.getReturnOnlyChangedValues();
        store.setReturnOnlyChangedValues(true);
        try {
            Set<String> actual = new TreeSet<>(store.enumerate().keySet());
            assertEquals(new TreeSet<>(Arrays.asList(expectedKeys)), actual, "Changed keys mismatch");
        } finally {
            store.setReturnOnlyChangedValues(previous);
        }
    }
}
