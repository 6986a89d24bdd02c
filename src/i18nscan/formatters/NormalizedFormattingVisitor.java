package i18nscan.formatters;

import i18nscan.model.normalized.*;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Writes a normalized tree as an indented outline. Leaf values are written in Ruby literal syntax, so a translation
 * call reads like {@code t("welcome.title", {:scope => "home"})}.
 */
public class NormalizedFormattingVisitor extends NormalizedVisitor<Void, IOException> {

	private final IndentingWriter out;

	public NormalizedFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	private void writeChildren(List<? extends Normalized> children) throws IOException {
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (Normalized child : children) {
				out.newLine();
				child.accept(this);
			}
		}
	}

	private void writeCommentTranslations(List<TranslationCallNode> commentTranslations) throws IOException {
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (TranslationCallNode translation : commentTranslations) {
				out.newLine();
				out.write("# ");
				translation.accept(this);
			}
		}
	}

	@Override
	public Void visit(ModuleNode moduleNode) throws IOException {
		out.write("module ");
		out.write(String.valueOf(moduleNode.getName()));
		writeChildren(moduleNode.getChildren());
		return null;
	}

	@Override
	public Void visit(ClassNode classNode) throws IOException {
		out.write("class ");
		out.write(String.valueOf(classNode.getName()));
		writeChildren(classNode.getChildren());
		return null;
	}

	@Override
	public Void visit(DefNode defNode) throws IOException {
		if (defNode.isPrivate()) {
			out.write("private ");
		}
		out.write("def ");
		out.write(defNode.getName());
		writeChildren(defNode.getCalls());
		return null;
	}

	@Override
	public Void visit(BlockNode blockNode) throws IOException {
		out.write("block");
		writeChildren(blockNode.getCalls());
		return null;
	}

	@Override
	public Void visit(LambdaNode lambdaNode) throws IOException {
		out.write("lambda");
		writeChildren(lambdaNode.getCalls());
		return null;
	}

	@Override
	public Void visit(CallNode callNode) throws IOException {
		out.write(callNode.getName());
		out.write("(...)");
		writeCommentTranslations(callNode.getCommentTranslations());
		return null;
	}

	@Override
	public Void visit(TranslationCallNode translationCallNode) throws IOException {
		if (translationCallNode.getReceiver() != null) {
			translationCallNode.getReceiver().accept(this);
			out.write(".");
		}
		out.write(translationCallNode.getName());
		out.write("(");
		if (translationCallNode.getKey() != null) {
			translationCallNode.getKey().accept(this);
		}
		if (!translationCallNode.getOptions().isEmpty()) {
			if (translationCallNode.getKey() != null) {
				out.write(", ");
			}
			translationCallNode.getOptions().accept(this);
		}
		out.write(")");
		writeCommentTranslations(translationCallNode.getCommentTranslations());
		return null;
	}

	@Override
	public Void visit(InterpolatedStringNode interpolatedStringNode) throws IOException {
		out.write("\"");
		for (Normalized part : interpolatedStringNode.getParts()) {
			if (part instanceof StringPrimitive) {
				out.write(((StringPrimitive) part).getValue());
			} else {
				out.write("#{");
				part.accept(this);
				out.write("}");
			}
		}
		out.write("\"");
		return null;
	}

	@Override
	public Void visit(NormalizedList normalizedList) throws IOException {
		out.write("[");
		boolean first = true;
		for (Normalized element : normalizedList.getElements()) {
			if (first) {
				first = false;
			} else {
				out.write(", ");
			}
			element.accept(this);
		}
		out.write("]");
		return null;
	}

	@Override
	public Void visit(StringPrimitive stringPrimitive) throws IOException {
		out.write("\"");
		out.write(stringPrimitive.getValue().replace("\\", "\\\\").replace("\"", "\\\""));
		out.write("\"");
		return null;
	}

	@Override
	public Void visit(SymbolPrimitive symbolPrimitive) throws IOException {
		out.write(":");
		out.write(symbolPrimitive.getValue());
		return null;
	}

	@Override
	public Void visit(IntegerPrimitive integerPrimitive) throws IOException {
		out.write(integerPrimitive.getValue().toString());
		return null;
	}

	@Override
	public Void visit(DecimalPrimitive decimalPrimitive) throws IOException {
		out.write(decimalPrimitive.getValue().toPlainString());
		return null;
	}

	@Override
	public Void visit(MappingPrimitive mappingPrimitive) throws IOException {
		out.write("{");
		boolean first = true;
		for (Map.Entry<Normalized, Normalized> entry : mappingPrimitive.getEntries().entrySet()) {
			if (first) {
				first = false;
			} else {
				out.write(", ");
			}
			entry.getKey().accept(this);
			out.write(" => ");
			entry.getValue().accept(this);
		}
		out.write("}");
		return null;
	}

}
