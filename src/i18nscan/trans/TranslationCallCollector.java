package i18nscan.trans;

import i18nscan.model.normalized.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Lists every translation call of a normalized tree, including those attached to calls through magic comments.
 *
 * Calls come out in pre-order: the comment translations of a call, then the call itself, then whatever its
 * receiver, key and options contain.
 */
public class TranslationCallCollector extends NormalizedVisitor<Void, RuntimeException> {

	private final List<LocatedTranslationCall> found = new ArrayList<>();
	// line of the magic comment being visited, or -1 outside comment translations
	private int commentLine = -1;

	public static List<TranslationCallNode> collect(Normalized normalized) {
		List<TranslationCallNode> calls = new ArrayList<>();
		for (LocatedTranslationCall located : collectLocated(normalized)) {
			calls.add(located.getCall());
		}
		return Collections.unmodifiableList(calls);
	}

	public static List<LocatedTranslationCall> collectLocated(Normalized normalized) {
		TranslationCallCollector collector = new TranslationCallCollector();
		normalized.accept(collector);
		return Collections.unmodifiableList(collector.found);
	}

	private void visitCommentTranslations(NormalizedNode carrier, List<TranslationCallNode> translations) {
		if (translations.isEmpty()) {
			return;
		}
		int saved = commentLine;
		if (commentLine < 0) {
			commentLine = carrier.getLocation().getStartLine() - 1;
		}
		visitAll(translations);
		commentLine = saved;
	}

	private void visitAll(List<? extends Normalized> children) {
		for (Normalized child : children) {
			child.accept(this);
		}
	}

	@Override
	public Void visit(ModuleNode moduleNode) {
		visitAll(moduleNode.getChildren());
		return null;
	}

	@Override
	public Void visit(ClassNode classNode) {
		visitAll(classNode.getChildren());
		return null;
	}

	@Override
	public Void visit(DefNode defNode) {
		visitAll(defNode.getCalls());
		return null;
	}

	@Override
	public Void visit(BlockNode blockNode) {
		visitAll(blockNode.getCalls());
		return null;
	}

	@Override
	public Void visit(LambdaNode lambdaNode) {
		visitAll(lambdaNode.getCalls());
		return null;
	}

	@Override
	public Void visit(CallNode callNode) {
		visitCommentTranslations(callNode, callNode.getCommentTranslations());
		return null;
	}

	@Override
	public Void visit(TranslationCallNode translationCallNode) {
		visitCommentTranslations(translationCallNode, translationCallNode.getCommentTranslations());
		int line = commentLine >= 0 ? commentLine : translationCallNode.getLocation().getStartLine();
		found.add(new LocatedTranslationCall(translationCallNode, line));
		if (translationCallNode.getReceiver() != null) {
			translationCallNode.getReceiver().accept(this);
		}
		if (translationCallNode.getKey() != null) {
			translationCallNode.getKey().accept(this);
		}
		translationCallNode.getOptions().accept(this);
		return null;
	}

	@Override
	public Void visit(InterpolatedStringNode interpolatedStringNode) {
		visitAll(interpolatedStringNode.getParts());
		return null;
	}

	@Override
	public Void visit(NormalizedList normalizedList) {
		visitAll(normalizedList.getElements());
		return null;
	}

	@Override
	public Void visit(StringPrimitive stringPrimitive) {
		return null;
	}

	@Override
	public Void visit(SymbolPrimitive symbolPrimitive) {
		return null;
	}

	@Override
	public Void visit(IntegerPrimitive integerPrimitive) {
		return null;
	}

	@Override
	public Void visit(DecimalPrimitive decimalPrimitive) {
		return null;
	}

	@Override
	public Void visit(MappingPrimitive mappingPrimitive) {
		for (Map.Entry<Normalized, Normalized> entry : mappingPrimitive.getEntries().entrySet()) {
			entry.getKey().accept(this);
			entry.getValue().accept(this);
		}
		return null;
	}

}
