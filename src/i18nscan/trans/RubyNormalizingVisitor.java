package i18nscan.trans;

import i18nscan.model.normalized.*;
import i18nscan.model.ruby.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a raw Ruby tree into a normalized tree.
 *
 * One instance handles one tree: it owns the private-visibility state of the traversal and the magic comment
 * index of the file. Results come in three shapes (see {@link Normalized.Shape}); statement sequences return
 * flattened lists, structural constructs return nodes, and literals return primitives. Node kinds without a rule
 * of their own ({@link RubyOther}) pass their children through.
 *
 * Subclasses may recognize further call shapes by overriding {@link #visit(RubyCall)} and deferring to it for
 * anything they do not handle.
 */
public class RubyNormalizingVisitor extends RubyNodeVisitor<Normalized, RuntimeException> {

	private final CallNames callNames;
	private final CommentTranslationIndex commentTranslations;
	private final NormalizingContext context;

	public RubyNormalizingVisitor(CallNames callNames, CommentTranslationIndex commentTranslations) {
		this.callNames = callNames;
		this.commentTranslations = commentTranslations;
		this.context = new NormalizingContext();
	}

	public RubyNormalizingVisitor(CallNames callNames) {
		this(callNames, CommentTranslationIndex.empty());
	}

	public Normalized normalize(RubyNode node) {
		return node.accept(this);
	}

	public CallNames getCallNames() {
		return callNames;
	}

	public NormalizingContext getContext() {
		return context;
	}

	private List<Normalized> normalizeEach(List<? extends RubyNode> nodes) {
		List<Normalized> results = new ArrayList<>();
		for (RubyNode node : nodes) {
			results.add(node.accept(this));
		}
		return results;
	}

	private NormalizedList normalizeChildren(RubyNode node) {
		return NormalizedList.flatten(normalizeEach(node.getChildNodes()));
	}

	@Override
	public Normalized visit(RubyProgram program) {
		if (program.getStatements() == null) {
			return NormalizedList.empty();
		}
		return program.getStatements().accept(this);
	}

	@Override
	public Normalized visit(RubyStatements statements) {
		return NormalizedList.flatten(normalizeEach(statements.getBody()));
	}

	@Override
	public Normalized visit(RubyEmbeddedStatements embeddedStatements) {
		if (embeddedStatements.getStatements() == null) {
			return NormalizedList.empty();
		}
		return embeddedStatements.getStatements().accept(this);
	}

	@Override
	public Normalized visit(RubyModule module) {
		List<Normalized> children = new ArrayList<>();
		if (module.getBody() != null) {
			children = normalizeEach(module.getBody().getBody());
		}
		return new ModuleNode(module, children);
	}

	@Override
	public Normalized visit(RubyClass rubyClass) {
		ClassNode classNode = new ClassNode(rubyClass);
		if (rubyClass.getBody() != null) {
			for (RubyNode statement : rubyClass.getBody().getBody()) {
				classNode.addChild(statement.accept(this));
			}
		}
		return classNode;
	}

	@Override
	public Normalized visit(RubyInstanceVariableWrite instanceVariableWrite) {
		return normalizeChildren(instanceVariableWrite);
	}

	@Override
	public Normalized visit(RubyLocalVariableWrite localVariableWrite) {
		return normalizeChildren(localVariableWrite);
	}

	@Override
	public Normalized visit(RubyLocalVariableTarget localVariableTarget) {
		return normalizeChildren(localVariableTarget);
	}

	@Override
	public Normalized visit(RubyMultiWrite multiWrite) {
		return normalizeChildren(multiWrite);
	}

	@Override
	public Normalized visit(RubyDef def) {
		List<Normalized> calls = new ArrayList<>();
		if (def.getBody() != null) {
			calls = NormalizedList.flatten(Collections.singletonList(def.getBody().accept(this)))
					.getElements();
		}
		// the flag as it is now; a later visibility toggle does not affect this method
		return new DefNode(def, calls, context.isPrivateMethods());
	}

	@Override
	public Normalized visit(RubyIf rubyIf) {
		return new NormalizedList(normalizeEach(rubyIf.getChildNodes()));
	}

	@Override
	public Normalized visit(RubyElse rubyElse) {
		if (rubyElse.getStatements() == null) {
			return NormalizedList.empty();
		}
		return rubyElse.getStatements().accept(this);
	}

	@Override
	public Normalized visit(RubyAnd and) {
		return NormalizedList.of(and.getLeft().accept(this), and.getRight().accept(this));
	}

	@Override
	public Normalized visit(RubyOr or) {
		return NormalizedList.of(or.getLeft().accept(this), or.getRight().accept(this));
	}

	@Override
	public Normalized visit(RubyLambda lambda) {
		if (lambda.getBody() == null) {
			return new LambdaNode(lambda, new ArrayList<>());
		}
		// unlike a block, every statement result is kept as is
		return new LambdaNode(lambda, normalizeEach(lambda.getBody().getChildNodes()));
	}

	@Override
	public Normalized visit(RubyBlock block) {
		return new BlockNode(block, bodyCalls(block.getBody()));
	}

	private List<Normalized> bodyCalls(RubyNode body) {
		if (body == null) {
			return new ArrayList<>();
		}
		List<Normalized> results = new ArrayList<>();
		for (Normalized result : normalizeEach(body.getChildNodes())) {
			if (result.getShape() == Normalized.Shape.LIST && ((NormalizedList) result).isEmpty()) {
				continue;
			}
			results.add(result);
		}
		return NormalizedList.flatten(results).getElements();
	}

	@Override
	public Normalized visit(RubyCall call) {
		// a magic comment documents the call on the line that follows it
		List<TranslationCallNode> documented = commentTranslations.lookup(call.getLocation().getStartLine() - 1);
		if (isVisibilityToggle(call)) {
			context.markPrivateMethods();
			return NormalizedList.empty();
		}
		if (callNames.isTranslationCall(call.getName())) {
			return handleTranslationCall(call, documented);
		}
		return new CallNode(call, documented);
	}

	protected boolean isVisibilityToggle(RubyCall call) {
		return callNames.isVisibilityToggle(call.getName()) && call.getReceiver() == null && !call.hasArguments();
	}

	/**
	 * Builds a translation call from a call whose name is a translation call name. A key that is an interpolated
	 * string cannot be known statically, so such calls stay plain calls.
	 */
	protected Normalized handleTranslationCall(RubyCall call, List<TranslationCallNode> documented) {
		ClassifiedArguments arguments = ArgumentClassifier.classify(call, this);
		Normalized key = arguments.getFirst();
		if (key instanceof InterpolatedStringNode) {
			return new CallNode(call, documented);
		}
		Normalized receiver = call.getReceiver() == null ? null : call.getReceiver().accept(this);
		return new TranslationCallNode(call, key, receiver, arguments.getOptions(), documented);
	}

	@Override
	public Normalized visit(RubyAssoc assoc) {
		return NormalizedList.of(assoc.getKey().accept(this), assoc.getValue().accept(this));
	}

	@Override
	public Normalized visit(RubySymbol symbol) {
		return new SymbolPrimitive(symbol.getValue());
	}

	@Override
	public Normalized visit(RubyString string) {
		return new StringPrimitive(string.getContent());
	}

	@Override
	public Normalized visit(RubyInterpolatedString interpolatedString) {
		return new InterpolatedStringNode(interpolatedString,
				NormalizedList.flatten(normalizeEach(interpolatedString.getParts())).getElements());
	}

	@Override
	public Normalized visit(RubyInteger integer) {
		return new IntegerPrimitive(integer.getValue());
	}

	@Override
	public Normalized visit(RubyDecimal decimal) {
		return new DecimalPrimitive(decimal.getValue());
	}

	@Override
	public Normalized visit(RubyConstantRead constantRead) {
		return new SymbolPrimitive(constantRead.getName());
	}

	/**
	 * Positional arguments first, flattened, then exactly one options mapping: the first keyword hash, or an empty
	 * mapping when there is none.
	 */
	@Override
	public Normalized visit(RubyArguments arguments) {
		List<RubyNode> positional = new ArrayList<>();
		RubyKeywordHash keywords = null;
		for (RubyNode argument : arguments.getArguments()) {
			if (argument instanceof RubyKeywordHash) {
				if (keywords == null) {
					keywords = (RubyKeywordHash) argument;
				}
			} else {
				positional.add(argument);
			}
		}
		List<Normalized> results = new ArrayList<>(NormalizedList.flatten(normalizeEach(positional)).getElements());
		results.add(keywords == null ? MappingPrimitive.empty() : keywords.accept(this));
		return new NormalizedList(results);
	}

	@Override
	public Normalized visit(RubyArray array) {
		return NormalizedList.flatten(normalizeEach(array.getElements()));
	}

	@Override
	public Normalized visit(RubyKeywordHash keywordHash) {
		Map<Normalized, Normalized> entries = new LinkedHashMap<>();
		for (RubyNode element : keywordHash.getElements()) {
			if (!(element instanceof RubyAssoc)) {
				throw new UnsupportedOptionsEntryIssue(keywordHash, element);
			}
			RubyAssoc assoc = (RubyAssoc) element;
			// not through visit(RubyAssoc), the pair must not be flattened
			entries.put(assoc.getKey().accept(this), assoc.getValue().accept(this));
		}
		return new MappingPrimitive(entries);
	}

	@Override
	public Normalized visit(RubyOther other) {
		return normalizeChildren(other);
	}

}
