package i18nscan.errors;

import i18nscan.trans.WhileNormalizingFile;

public abstract class ContextVisitor<T, E extends Throwable> {

	public abstract T visit(WhileNormalizingFile whileNormalizingFile) throws E;

}
