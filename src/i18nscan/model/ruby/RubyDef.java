package i18nscan.model.ruby;

import i18nscan.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class RubyDef extends RubyNode {

	private final String name;
	private final RubyNode receiver;
	private final RubyNode body;

	public RubyDef(SourceLocation location, String name, RubyNode receiver, RubyNode body) {
		super(location);
		this.name = name;
		this.receiver = receiver;
		this.body = body;
	}

	public String getName() {
		return name;
	}

	/**
	 * @return the receiver of a singleton method definition such as {@code def self.foo}, or null
	 */
	public RubyNode getReceiver() {
		return receiver;
	}

	public RubyNode getBody() {
		return body;
	}

	@Override
	public List<RubyNode> getChildNodes() {
		return presentChildren(receiver, body);
	}

	@Override
	public <T, E extends Throwable> T accept(RubyNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, receiver, body);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		RubyDef other = (RubyDef) obj;
		return Objects.equals(name, other.name) && Objects.equals(receiver, other.receiver) &&
				Objects.equals(body, other.body);
	}

}
