package i18nscan.model.normalized;

import i18nscan.model.ruby.RubyLambda;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class LambdaNode extends NormalizedNode {

	private final List<Normalized> calls;

	public LambdaNode(RubyLambda origin, List<Normalized> calls) {
		super(origin);
		this.calls = Collections.unmodifiableList(new ArrayList<>(calls));
	}

	@Override
	public RubyLambda getOrigin() {
		return (RubyLambda) super.getOrigin();
	}

	public List<Normalized> getCalls() {
		return calls;
	}

	@Override
	public <T, E extends Throwable> T accept(NormalizedVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return calls.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		LambdaNode other = (LambdaNode) obj;
		return calls.equals(other.calls);
	}

}
