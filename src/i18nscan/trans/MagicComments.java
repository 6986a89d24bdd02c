package i18nscan.trans;

import i18nscan.model.ruby.RubyComment;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes the comments that talk to the scanner.
 *
 * {@code # i18n-tasks-use t('some.key')} documents a translation call made in a way the scanner cannot see, for
 * the call on the following line. {@code # i18n-tasks-skip-prism} anywhere in a file asks for the file to be left
 * to another scanner.
 */
public final class MagicComments {

	public static final Pattern USE_PREFIX = Pattern.compile("\\A.\\s*i18n-tasks-use\\s+");
	public static final String SKIP_MARKER = "i18n-tasks-skip-prism";

	private MagicComments() {}

	/**
	 * @return the code snippet of a magic comment, or empty when the text does not start with the magic prefix
	 */
	public static Optional<String> snippetOf(String text) {
		Matcher matcher = USE_PREFIX.matcher(text);
		if (!matcher.find()) {
			return Optional.empty();
		}
		return Optional.of(matcher.replaceAll("").replace("#", "").trim());
	}

	public static boolean hasSkipMarker(List<RubyComment> comments) {
		if (comments == null) {
			return false;
		}
		for (RubyComment comment : comments) {
			if (comment.getText().contains(SKIP_MARKER)) {
				return true;
			}
		}
		return false;
	}

}
