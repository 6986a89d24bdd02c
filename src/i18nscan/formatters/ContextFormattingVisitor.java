package i18nscan.formatters;

import i18nscan.errors.ContextVisitor;
import i18nscan.trans.WhileNormalizingFile;

import java.io.IOException;

public class ContextFormattingVisitor extends ContextVisitor<Void, IOException> {

	private final IndentingWriter out;

	public ContextFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(WhileNormalizingFile whileNormalizingFile) throws IOException {
		out.write("while normalizing file ");
		out.write(whileNormalizingFile.getFile().toString());
		return null;
	}

}
