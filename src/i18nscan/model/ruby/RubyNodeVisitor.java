package i18nscan.model.ruby;

public abstract class RubyNodeVisitor<T, E extends Throwable> {

	public abstract T visit(RubyProgram program) throws E;
	public abstract T visit(RubyStatements statements) throws E;
	public abstract T visit(RubyEmbeddedStatements embeddedStatements) throws E;
	public abstract T visit(RubyModule module) throws E;
	public abstract T visit(RubyClass rubyClass) throws E;
	public abstract T visit(RubyInstanceVariableWrite instanceVariableWrite) throws E;
	public abstract T visit(RubyLocalVariableWrite localVariableWrite) throws E;
	public abstract T visit(RubyLocalVariableTarget localVariableTarget) throws E;
	public abstract T visit(RubyMultiWrite multiWrite) throws E;
	public abstract T visit(RubyDef def) throws E;
	public abstract T visit(RubyIf rubyIf) throws E;
	public abstract T visit(RubyElse rubyElse) throws E;
	public abstract T visit(RubyAnd and) throws E;
	public abstract T visit(RubyOr or) throws E;
	public abstract T visit(RubyLambda lambda) throws E;
	public abstract T visit(RubyBlock block) throws E;
	public abstract T visit(RubyCall call) throws E;
	public abstract T visit(RubyAssoc assoc) throws E;
	public abstract T visit(RubySymbol symbol) throws E;
	public abstract T visit(RubyString string) throws E;
	public abstract T visit(RubyInterpolatedString interpolatedString) throws E;
	public abstract T visit(RubyInteger integer) throws E;
	public abstract T visit(RubyDecimal decimal) throws E;
	public abstract T visit(RubyConstantRead constantRead) throws E;
	public abstract T visit(RubyArguments arguments) throws E;
	public abstract T visit(RubyArray array) throws E;
	public abstract T visit(RubyKeywordHash keywordHash) throws E;
	public abstract T visit(RubyOther other) throws E;

}
