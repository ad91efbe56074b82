package dk.trustworks.msgraph.serialization;

import com.microsoft.kiota.serialization.JsonSerializationWriter;
import com.microsoft.kiota.serialization.Parsable;
import com.microsoft.kiota.store.BackedModel;
import com.microsoft.kiota.store.BackingStore;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;

/**
 * JSON writer for Graph payloads.
 * <p>
 * Differs from the plain Kiota writer for object collections:
 * <ul>
 *     <li>{@code null} elements are written as JSON {@code null} instead of being dropped.</li>
 *     <li>When backing store hooks are installed, every element is written in full. A collection
 *     property is sent whole, so an element decoded earlier must not shrink to its changed values.</li>
 * </ul>
 */
public class GraphJsonSerializationWriter extends JsonSerializationWriter {

    @Override
    public <T extends Parsable> void writeCollectionOfObjectValues(String key, Iterable<T> values) {
        if (values == null) {
            return;
        }
        if (getOnBeforeObjectSerialization() != null) {
            Set<Object> visited = Collections.newSetFromMap(new IdentityHashMap<>());
            for (T value : values) {
                markChanged(value, visited);
            }
        }
        if (containsNull(values)) {
            // the untyped path writes each element on its own and null elements as null
            writeCollectionOfPrimitiveValues(key, values);
        } else {
            super.writeCollectionOfObjectValues(key, values);
        }
    }

    private static void markChanged(Object value, Set<Object> visited) {
        if (value instanceof BackedModel && visited.add(value)) {
            BackingStore store = ((BackedModel) value).getBackingStore();
            store.setIsInitializationCompleted(false);
            for (Map.Entry<String, Object> entry : store.enumerate().entrySet()) {
                markChanged(entry.getValue(), visited);
            }
        } else if (value instanceof Iterable<?> && visited.add(value)) {
            for (Object element : (Iterable<?>) value) {
                markChanged(element, visited);
            }
        }
    }

    private static boolean containsNull(Iterable<?> values) {
        for (Object value : values) {
            if (value == null) {
                return true;
            }
        }
        return false;
    }
}
