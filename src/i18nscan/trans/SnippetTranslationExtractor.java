package i18nscan.trans;

import i18nscan.model.normalized.Normalized;
import i18nscan.model.normalized.NormalizedList;
import i18nscan.model.normalized.TranslationCallNode;
import i18nscan.model.ruby.RubyParseResult;
import i18nscan.parser.RubyParseException;
import i18nscan.parser.RubySourceParser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;

/**
 * Runs the normalizer over a source snippet and keeps the translation calls found at its top level.
 *
 * Every snippet gets a brand-new normalizer from the supplier, so nothing leaks between snippets or into the
 * traversal of the file the comment belongs to.
 */
public class SnippetTranslationExtractor {

	private final RubySourceParser parser;
	private final Supplier<? extends RubyNormalizingVisitor> freshNormalizer;

	public SnippetTranslationExtractor(RubySourceParser parser,
	                                   Supplier<? extends RubyNormalizingVisitor> freshNormalizer) {
		this.parser = parser;
		this.freshNormalizer = freshNormalizer;
	}

	public List<TranslationCallNode> extract(String snippet) throws RubyParseException {
		RubyParseResult parsed = parser.parse(snippet);
		if (parsed.getProgram() == null) {
			return Collections.emptyList();
		}
		Normalized normalized = freshNormalizer.get().normalize(parsed.getProgram());
		List<TranslationCallNode> translations = new ArrayList<>();
		for (Normalized element : NormalizedList.flatten(Collections.singletonList(normalized)).getElements()) {
			if (element instanceof TranslationCallNode) {
				translations.add((TranslationCallNode) element);
			}
		}
		return translations;
	}

}
