package i18nscan.model.normalized;

import i18nscan.model.ruby.RubyDef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class DefNode extends NormalizedNode {

	private final List<Normalized> calls;
	private final boolean privateMethod;

	public DefNode(RubyDef origin, List<Normalized> calls, boolean privateMethod) {
		super(origin);
		this.calls = Collections.unmodifiableList(new ArrayList<>(calls));
		this.privateMethod = privateMethod;
	}

	@Override
	public RubyDef getOrigin() {
		return (RubyDef) super.getOrigin();
	}

	public String getName() {
		return getOrigin().getName();
	}

	public List<Normalized> getCalls() {
		return calls;
	}

	/**
	 * @return whether a visibility toggle had been seen when this definition was reached
	 */
	public boolean isPrivate() {
		return privateMethod;
	}

	@Override
	public <T, E extends Throwable> T accept(NormalizedVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getName(), calls, privateMethod);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		DefNode other = (DefNode) obj;
		return privateMethod == other.privateMethod && Objects.equals(getName(), other.getName()) &&
				calls.equals(other.calls);
	}

}
