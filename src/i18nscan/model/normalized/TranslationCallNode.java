package i18nscan.model.normalized;

import i18nscan.model.ruby.RubyCall;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A recognized translation call such as {@code t('welcome.title', scope: 'home')}.
 *
 * The key is the first positional argument as normalized, or null when the call has none. It is never an
 * {@link InterpolatedStringNode}; such calls stay plain {@link CallNode}s. The receiver is null for receiverless
 * calls.
 */
public class TranslationCallNode extends NormalizedNode {

	private final Normalized key;
	private final Normalized receiver;
	private final MappingPrimitive options;
	private final List<TranslationCallNode> commentTranslations;

	public TranslationCallNode(RubyCall origin, Normalized key, Normalized receiver, MappingPrimitive options,
	                           List<TranslationCallNode> commentTranslations) {
		super(origin);
		this.key = key;
		this.receiver = receiver;
		this.options = options;
		this.commentTranslations = Collections.unmodifiableList(new ArrayList<>(commentTranslations));
	}

	@Override
	public RubyCall getOrigin() {
		return (RubyCall) super.getOrigin();
	}

	public String getName() {
		return getOrigin().getName();
	}

	public Normalized getKey() {
		return key;
	}

	public Normalized getReceiver() {
		return receiver;
	}

	public MappingPrimitive getOptions() {
		return options;
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
		return Objects.hash(getName(), key, receiver, options, commentTranslations);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		TranslationCallNode other = (TranslationCallNode) obj;
		return Objects.equals(getName(), other.getName()) && Objects.equals(key, other.key) &&
				Objects.equals(receiver, other.receiver) && Objects.equals(options, other.options) &&
				commentTranslations.equals(other.commentTranslations);
	}

}
