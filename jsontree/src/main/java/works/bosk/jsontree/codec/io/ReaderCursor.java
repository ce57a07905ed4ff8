package works.bosk.jsontree.codec.io;

import java.io.IOException;
import java.io.PushbackReader;
import java.io.Reader;

/**
 * A {@link CharCursor} that pulls one char at a time from a {@link Reader},
 * and only when it must, so that reading a value never consumes more of the reader
 * than the value itself plus at most one char of lookahead.
 * Wrap slow readers in a {@link java.io.BufferedReader}.
 * <p>
 * If the reader is a {@link PushbackReader}, {@link #close()} returns
 * the lookahead char to it, leaving the reader positioned exactly after the value.
 * The reader itself is never closed; it belongs to the caller.
 * <p>
 * {@link IOException}s are rethrown as {@link IllegalStateException}.
 */
public final class ReaderCursor implements CharCursor {
	private static final int NOT_FETCHED = -2;

	final Reader reader;
	private int lookahead = NOT_FETCHED;
	private final Position position = new Position();

	public ReaderCursor(Reader reader) {
		this.reader = reader;
	}

	@Override
	public int peek() {
		if (lookahead == NOT_FETCHED) {
			try {
				lookahead = reader.read();
			} catch (IOException e) {
				throw new IllegalStateException(e);
			}
		}
		return lookahead;
	}

	@Override
	public int next() {
		int c = peek();
		if (c != EOF) {
			position.advancePast(c);
			lookahead = NOT_FETCHED;
		}
		return c;
	}

	@Override
	public int line() {
		return position.line();
	}

	@Override
	public int column() {
		return position.column();
	}

	@Override
	public long offset() {
		return position.offset();
	}

	/**
	 * Only the lookahead char is available without consuming input.
	 */
	@Override
	public String preview(int requestedLength) {
		if (requestedLength <= 0 || peek() == EOF) {
			return "";
		} else {
			return String.valueOf((char) lookahead);
		}
	}

	@Override
	public void close() {
		if (reader instanceof PushbackReader p && lookahead >= 0) {
			try {
				p.unread(lookahead);
			} catch (IOException e) {
				throw new IllegalStateException(e);
			}
			lookahead = NOT_FETCHED;
		}
	}
}
