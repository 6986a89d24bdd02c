package i18nscan.trans;

/**
 * Traversal state of one {@link RubyNormalizingVisitor}. Never shared between visitors, so neither comment
 * snippets nor other files can see or change it.
 */
public class NormalizingContext {

	private boolean privateMethods = false;

	public boolean isPrivateMethods() {
		return privateMethods;
	}

	public void markPrivateMethods() {
		privateMethods = true;
	}

}
