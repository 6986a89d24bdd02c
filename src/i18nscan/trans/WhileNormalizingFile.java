package i18nscan.trans;

import i18nscan.errors.Context;
import i18nscan.errors.ContextVisitor;

import java.nio.file.Path;

public class WhileNormalizingFile extends Context {

	private final Path file;

	public WhileNormalizingFile(Path file) {
		this.file = file;
	}

	public Path getFile() {
		return file;
	}

	@Override
	public <T, E extends Throwable> T accept(ContextVisitor<T, E> ctx) throws E {
		return ctx.visit(this);
	}

}
