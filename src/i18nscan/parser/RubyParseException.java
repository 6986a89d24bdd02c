package i18nscan.parser;

/**
 * The external parser could not produce a tree for a source text.
 */
public class RubyParseException extends Exception {

	private static final long serialVersionUID = -2419361580390725114L;

	public RubyParseException(String message) {
		super(message);
	}

	public RubyParseException(String message, Throwable cause) {
		super(message, cause);
	}

}
