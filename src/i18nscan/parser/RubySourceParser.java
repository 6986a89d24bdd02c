package i18nscan.parser;

import i18nscan.model.ruby.RubyParseResult;

/**
 * The external Ruby parser. Implementations turn source text into a raw tree plus its comment tokens.
 */
public interface RubySourceParser {

	RubyParseResult parse(String source) throws RubyParseException;

}
