package i18nscan.trans;

import i18nscan.model.normalized.TranslationCallNode;
import i18nscan.model.ruby.RubyComment;
import i18nscan.parser.RubyParseException;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Translation calls documented by magic comments, by the 1-based line the comment starts on. Built once per file
 * and never modified afterwards.
 */
public class CommentTranslationIndex {

	private static final Logger logger = Logger.getLogger("i18nscan.CommentTranslationIndex");

	private static final CommentTranslationIndex EMPTY = new CommentTranslationIndex(Collections.emptyMap());

	private final Map<Integer, List<TranslationCallNode>> byLine;

	private CommentTranslationIndex(Map<Integer, List<TranslationCallNode>> byLine) {
		this.byLine = Collections.unmodifiableMap(byLine);
	}

	public static CommentTranslationIndex empty() {
		return EMPTY;
	}

	/**
	 * Scans the comments for magic comments and extracts the translation calls of their snippets. Comments that
	 * are not magic, snippets that fail to parse or normalize, and snippets without translation calls are skipped.
	 *
	 * @param comments the comment tokens of one file, or null
	 */
	public static CommentTranslationIndex build(List<RubyComment> comments, SnippetTranslationExtractor extractor) {
		if (comments == null) {
			return EMPTY;
		}
		Map<Integer, List<TranslationCallNode>> byLine = new TreeMap<>();
		for (RubyComment comment : comments) {
			Optional<String> snippet = MagicComments.snippetOf(comment.getText());
			if (!snippet.isPresent()) {
				continue;
			}
			List<TranslationCallNode> translations;
			try {
				translations = extractor.extract(snippet.get());
			} catch (RubyParseException | RuntimeException e) {
				logger.fine("ignoring magic comment " + comment.getLocation().prettyString() + ": " + e.getMessage());
				continue;
			}
			if (translations.isEmpty()) {
				continue;
			}
			// last comment wins when two start on the same line; every call on the next line gets the same entry
			byLine.put(comment.getLocation().getStartLine(), Collections.unmodifiableList(translations));
		}
		return new CommentTranslationIndex(byLine);
	}

	/**
	 * @return the translation calls documented on the given line, or an empty list
	 */
	public List<TranslationCallNode> lookup(int line) {
		return byLine.getOrDefault(line, Collections.emptyList());
	}

	public Map<Integer, List<TranslationCallNode>> asMap() {
		return byLine;
	}

	public boolean isEmpty() {
		return byLine.isEmpty();
	}

}
