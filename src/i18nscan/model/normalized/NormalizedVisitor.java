package i18nscan.model.normalized;

public abstract class NormalizedVisitor<T, E extends Throwable> {

	public abstract T visit(ModuleNode moduleNode) throws E;
	public abstract T visit(ClassNode classNode) throws E;
	public abstract T visit(DefNode defNode) throws E;
	public abstract T visit(BlockNode blockNode) throws E;
	public abstract T visit(LambdaNode lambdaNode) throws E;
	public abstract T visit(CallNode callNode) throws E;
	public abstract T visit(TranslationCallNode translationCallNode) throws E;
	public abstract T visit(InterpolatedStringNode interpolatedStringNode) throws E;
	public abstract T visit(NormalizedList normalizedList) throws E;
	public abstract T visit(StringPrimitive stringPrimitive) throws E;
	public abstract T visit(SymbolPrimitive symbolPrimitive) throws E;
	public abstract T visit(IntegerPrimitive integerPrimitive) throws E;
	public abstract T visit(DecimalPrimitive decimalPrimitive) throws E;
	public abstract T visit(MappingPrimitive mappingPrimitive) throws E;

}
