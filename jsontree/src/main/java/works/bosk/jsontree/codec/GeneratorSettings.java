package works.bosk.jsontree.codec;

/**
 * Governs the layout of text from {@link TreeGenerator}.
 *
 * @param pretty     newline after each opening bracket and comma, two-space indentation,
 *                   and a space after each colon
 * @param debugDump  annotate each node with a comment naming its type, and write
 *                   undefined nodes and NaN instead of rejecting them.
 *                   The output is for humans and isn't necessarily valid JSON.
 *                   Implies {@code pretty}.
 * @param maxDepth   the deepest nesting of arrays and objects that will be written
 */
public record GeneratorSettings(
	boolean pretty,
	boolean debugDump,
	FloatFormat floatFormat,
	int maxDepth
) {
	public static final GeneratorSettings COMPACT = new GeneratorSettings(false, false, FloatFormat.DEFAULT, ParserSettings.DEFAULT_MAX_DEPTH);
	public static final GeneratorSettings PRETTY = COMPACT.withPretty(true);
	public static final GeneratorSettings DEBUG = COMPACT.withDebugDump(true);

	public GeneratorSettings {
		if (floatFormat == null) {
			throw new NullPointerException("floatFormat");
		}
		if (maxDepth < 1) {
			throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
		}
	}

	/**
	 * @return true if output is laid out on multiple lines
	 */
	public boolean indents() {
		return pretty || debugDump;
	}

	public GeneratorSettings withPretty(boolean pretty) {
		return new GeneratorSettings(pretty, debugDump, floatFormat, maxDepth);
	}

	public GeneratorSettings withDebugDump(boolean debugDump) {
		return new GeneratorSettings(pretty, debugDump, floatFormat, maxDepth);
	}

	public GeneratorSettings withFloatFormat(FloatFormat floatFormat) {
		return new GeneratorSettings(pretty, debugDump, floatFormat, maxDepth);
	}

	public GeneratorSettings withMaxDepth(int maxDepth) {
		return new GeneratorSettings(pretty, debugDump, floatFormat, maxDepth);
	}
}
