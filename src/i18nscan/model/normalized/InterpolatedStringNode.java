package i18nscan.model.normalized;

import i18nscan.model.ruby.RubyInterpolatedString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class InterpolatedStringNode extends NormalizedNode {

	private final List<Normalized> parts;

	public InterpolatedStringNode(RubyInterpolatedString origin, List<Normalized> parts) {
		super(origin);
		this.parts = Collections.unmodifiableList(new ArrayList<>(parts));
	}

	@Override
	public RubyInterpolatedString getOrigin() {
		return (RubyInterpolatedString) super.getOrigin();
	}

	public List<Normalized> getParts() {
		return parts;
	}

	@Override
	public <T, E extends Throwable> T accept(NormalizedVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return parts.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		InterpolatedStringNode other = (InterpolatedStringNode) obj;
		return parts.equals(other.parts);
	}

}
