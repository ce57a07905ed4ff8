package works.bosk.jsontree.codec;

import java.io.Writer;
import works.bosk.jsontree.value.JsonValue;

/**
 * Emits JSON text corresponding to {@link JsonValue} trees.
 */
public interface Generator {
	void generate(Writer out, JsonValue value);
}
