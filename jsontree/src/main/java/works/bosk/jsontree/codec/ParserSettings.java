package works.bosk.jsontree.codec;

import java.util.EnumSet;
import java.util.Set;

/**
 * Governs how forgiving a {@link TreeParser} is.
 *
 * @param maxDepth the deepest nesting of arrays and objects accepted;
 *                 the top-level container is depth 1
 */
public record ParserSettings(
	boolean allowByteOrderMark,
	boolean allowUnescapedSlash,
	boolean allowComments,
	boolean allowTrailingCommas,
	boolean allowUnquotedKeys,
	boolean allowPlusSign,
	int maxDepth
) {
	public static final int DEFAULT_MAX_DEPTH = 512;

	/**
	 * Exactly RFC 8259, except that {@code /} must be escaped in strings.
	 */
	public static final ParserSettings STRICT = of(EnumSet.noneOf(ParseOption.class));

	/**
	 * RFC 8259, plus a leading byte order mark.
	 */
	public static final ParserSettings DEFAULT = of(EnumSet.of(ParseOption.BYTE_ORDER_MARK, ParseOption.UNESCAPED_SLASH));

	/**
	 * Everything {@link ParseOption} offers.
	 */
	public static final ParserSettings LENIENT = of(EnumSet.allOf(ParseOption.class));

	public ParserSettings {
		if (maxDepth < 1) {
			throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
		}
	}

	public static ParserSettings of(Set<ParseOption> options) {
		return new ParserSettings(
			options.contains(ParseOption.BYTE_ORDER_MARK),
			options.contains(ParseOption.UNESCAPED_SLASH),
			options.contains(ParseOption.COMMENTS),
			options.contains(ParseOption.TRAILING_COMMAS),
			options.contains(ParseOption.UNQUOTED_KEYS),
			options.contains(ParseOption.PLUS_SIGN),
			DEFAULT_MAX_DEPTH);
	}

	public boolean allows(ParseOption option) {
		return switch (option) {
			case BYTE_ORDER_MARK -> allowByteOrderMark;
			case UNESCAPED_SLASH -> allowUnescapedSlash;
			case COMMENTS -> allowComments;
			case TRAILING_COMMAS -> allowTrailingCommas;
			case UNQUOTED_KEYS -> allowUnquotedKeys;
			case PLUS_SIGN -> allowPlusSign;
		};
	}

	public EnumSet<ParseOption> options() {
		EnumSet<ParseOption> result = EnumSet.noneOf(ParseOption.class);
		for (ParseOption option : ParseOption.values()) {
			if (allows(option)) {
				result.add(option);
			}
		}
		return result;
	}

	public ParserSettings with(ParseOption option) {
		EnumSet<ParseOption> options = options();
		options.add(option);
		return of(options).withMaxDepth(maxDepth);
	}

	public ParserSettings without(ParseOption option) {
		EnumSet<ParseOption> options = options();
		options.remove(option);
		return of(options).withMaxDepth(maxDepth);
	}

	public ParserSettings withMaxDepth(int maxDepth) {
		return new ParserSettings(allowByteOrderMark, allowUnescapedSlash, allowComments, allowTrailingCommas, allowUnquotedKeys, allowPlusSign, maxDepth);
	}
}
