package i18nscan.model.ruby;

import i18nscan.util.SourceLocation;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Static helpers for building raw trees by hand. Nodes get an unknown location unless built with one of the
 * {@code at} variants, which place them on a given line.
 */
public class RubyBuilder {
	private RubyBuilder() {}

	public static RubyProgram program(RubyNode... statements) {
		return new RubyProgram(SourceLocation.unknown(), statements(statements));
	}

	public static RubyStatements statements(RubyNode... body) {
		return new RubyStatements(SourceLocation.unknown(), Arrays.asList(body));
	}

	public static RubyModule module(String name, RubyNode... body) {
		return new RubyModule(SourceLocation.unknown(), constant(name), statements(body));
	}

	public static RubyClass classDef(String name, RubyNode... body) {
		return new RubyClass(SourceLocation.unknown(), constant(name), null, statements(body));
	}

	public static RubyClass subclassDef(String name, RubyNode superclass, RubyNode... body) {
		return new RubyClass(SourceLocation.unknown(), constant(name), superclass, statements(body));
	}

	public static RubyDef def(String name, RubyNode... body) {
		return new RubyDef(SourceLocation.unknown(), name, null, body.length == 0 ? null : statements(body));
	}

	public static RubyCall call(String name, RubyNode... args) {
		return call(SourceLocation.unknown(), null, name, args);
	}

	public static RubyCall callAt(int line, String name, RubyNode... args) {
		return call(SourceLocation.line(line), null, name, args);
	}

	public static RubyCall methodCall(RubyNode receiver, String name, RubyNode... args) {
		return call(SourceLocation.unknown(), receiver, name, args);
	}

	public static RubyCall call(SourceLocation location, RubyNode receiver, String name, RubyNode... args) {
		RubyArguments arguments = args.length == 0 ? null : new RubyArguments(SourceLocation.unknown(),
				Arrays.asList(args));
		return new RubyCall(location, receiver, name, arguments, null);
	}

	public static RubyCall callWithBlock(String name, RubyBlock block, RubyNode... args) {
		RubyArguments arguments = args.length == 0 ? null : new RubyArguments(SourceLocation.unknown(),
				Arrays.asList(args));
		return new RubyCall(SourceLocation.unknown(), null, name, arguments, block);
	}

	public static RubyBlock block(RubyNode... body) {
		return new RubyBlock(SourceLocation.unknown(), body.length == 0 ? null : statements(body));
	}

	public static RubyLambda lambda(RubyNode... body) {
		return new RubyLambda(SourceLocation.unknown(), body.length == 0 ? null : statements(body));
	}

	public static RubyIf ifS(RubyNode predicate, List<RubyNode> yes, RubyNode subsequent) {
		return new RubyIf(SourceLocation.unknown(), predicate, statements(yes.toArray(new RubyNode[0])), subsequent);
	}

	public static RubyElse elseS(RubyNode... body) {
		return new RubyElse(SourceLocation.unknown(), statements(body));
	}

	public static RubyAnd and(RubyNode left, RubyNode right) {
		return new RubyAnd(SourceLocation.unknown(), left, right);
	}

	public static RubyOr or(RubyNode left, RubyNode right) {
		return new RubyOr(SourceLocation.unknown(), left, right);
	}

	public static RubyLocalVariableWrite localWrite(String name, RubyNode value) {
		return new RubyLocalVariableWrite(SourceLocation.unknown(), name, value);
	}

	public static RubyInstanceVariableWrite ivarWrite(String name, RubyNode value) {
		return new RubyInstanceVariableWrite(SourceLocation.unknown(), name, value);
	}

	public static RubyMultiWrite multiWrite(RubyNode value, String... targets) {
		RubyNode[] nodes = new RubyNode[targets.length];
		for (int i = 0; i < targets.length; i++) {
			nodes[i] = new RubyLocalVariableTarget(SourceLocation.unknown(), targets[i]);
		}
		return new RubyMultiWrite(SourceLocation.unknown(), Arrays.asList(nodes), value);
	}

	public static RubyKeywordHash kwargs(RubyNode... elements) {
		return new RubyKeywordHash(SourceLocation.unknown(), Arrays.asList(elements));
	}

	public static RubyAssoc assoc(RubyNode key, RubyNode value) {
		return new RubyAssoc(SourceLocation.unknown(), key, value);
	}

	public static RubyAssoc assoc(String symbolKey, RubyNode value) {
		return assoc(sym(symbolKey), value);
	}

	public static RubyArray array(RubyNode... elements) {
		return new RubyArray(SourceLocation.unknown(), Arrays.asList(elements));
	}

	public static RubySymbol sym(String value) {
		return new RubySymbol(SourceLocation.unknown(), value);
	}

	public static RubyString str(String content) {
		return new RubyString(SourceLocation.unknown(), content);
	}

	public static RubyInterpolatedString interpolated(RubyNode... parts) {
		return new RubyInterpolatedString(SourceLocation.unknown(), Arrays.asList(parts));
	}

	public static RubyEmbeddedStatements embedded(RubyNode... statements) {
		return new RubyEmbeddedStatements(SourceLocation.unknown(), statements(statements));
	}

	public static RubyInteger num(long value) {
		return new RubyInteger(SourceLocation.unknown(), BigInteger.valueOf(value));
	}

	public static RubyDecimal decimal(String value) {
		return new RubyDecimal(SourceLocation.unknown(), new BigDecimal(value));
	}

	public static RubyConstantRead constant(String name) {
		return new RubyConstantRead(SourceLocation.unknown(), name);
	}

	public static RubyOther other(String type, RubyNode... children) {
		return new RubyOther(SourceLocation.unknown(), type, Arrays.asList(children));
	}

	public static RubyOther self() {
		return new RubyOther(SourceLocation.unknown(), "self_node", Collections.emptyList());
	}

	public static RubyComment comment(int line, String text) {
		return new RubyComment(SourceLocation.line(line), text);
	}
}
