package i18nscan.model.normalized;

import i18nscan.model.ruby.RubyCall;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A call that is not a recognized translation call. Its arguments and block are not descended into; only the
 * translation calls documented by a magic comment on the preceding line are attached.
 */
public class CallNode extends NormalizedNode {

	private final List<TranslationCallNode> commentTranslations;

	public CallNode(RubyCall origin, List<TranslationCallNode> commentTranslations) {
		super(origin);
		this.commentTranslations = Collections.unmodifiableList(new ArrayList<>(commentTranslations));
	}

	@Override
	public RubyCall getOrigin() {
		return (RubyCall) super.getOrigin();
	}

	public String getName() {
		return getOrigin().getName();
	}

	public List<TranslationCallNode> getCommentTranslations() {
		return commentTranslations;
	}

	@Override
	public <T, E extends Throwable> T accept(NormalizedVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getName(), commentTranslations);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		CallNode other = (CallNode) obj;
		return Objects.equals(getName(), other.getName()) && commentTranslations.equals(other.commentTranslations);
	}

}
