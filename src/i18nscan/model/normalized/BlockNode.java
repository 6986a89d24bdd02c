package i18nscan.model.normalized;

import i18nscan.model.ruby.RubyBlock;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class BlockNode extends NormalizedNode {

	private final List<Normalized> calls;

	public BlockNode(RubyBlock origin, List<Normalized> calls) {
		super(origin);
		this.calls = Collections.unmodifiableList(new ArrayList<>(calls));
	}

	@Override
	public RubyBlock getOrigin() {
		return (RubyBlock) super.getOrigin();
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
		BlockNode other = (BlockNode) obj;
		return calls.equals(other.calls);
	}

}
