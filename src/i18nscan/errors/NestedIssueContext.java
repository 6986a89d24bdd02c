package i18nscan.errors;

/**
 * Forwards issues to a parent context, wrapping each in this context's {@link Context}.
 */
public class NestedIssueContext extends IssueContext {

	private final IssueContext parent;
	private final Context context;
	private boolean sawErrors = false;

	public NestedIssueContext(IssueContext parent, Context context) {
		this.parent = parent;
		this.context = context;
	}

	@Override
	public void error(Issue err) {
		sawErrors = true;
		parent.error(err.withContext(context));
	}

	/**
	 * @return whether an issue was reported through this context, ignoring issues the parent already had
	 */
	@Override
	public boolean hasErrors() {
		return sawErrors;
	}

}
