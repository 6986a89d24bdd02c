package i18nscan.trans;

import i18nscan.model.normalized.Normalized;
import i18nscan.model.ruby.RubyComment;
import i18nscan.model.ruby.RubyNode;
import i18nscan.model.ruby.RubyParseResult;
import i18nscan.parser.RubySourceParser;

import java.util.List;

/**
 * Normalizes one file: first the magic comment index is built from the file's comments, each snippet with its own
 * throwaway normalizer, then a fresh normalizer runs once over the whole tree.
 *
 * Errors of the main traversal are not caught here; the caller decides whether to skip the file or give up.
 */
public class NormalizationPass {
	private NormalizationPass() {}

	public static Normalized perform(RubyParseResult parseResult, RubySourceParser parser, CallNames callNames) {
		return perform(parseResult.getProgram(), parseResult.getComments(), parser, callNames);
	}

	/**
	 * @param comments the comment tokens of the file, or null to scan without magic comments
	 */
	public static Normalized perform(RubyNode root, List<RubyComment> comments, RubySourceParser parser,
	                                 CallNames callNames) {
		CommentTranslationIndex index = CommentTranslationIndex.build(comments,
				new SnippetTranslationExtractor(parser, () -> new RubyNormalizingVisitor(callNames)));
		return new RubyNormalizingVisitor(callNames, index).normalize(root);
	}
}
