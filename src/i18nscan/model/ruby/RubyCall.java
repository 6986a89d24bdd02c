package i18nscan.model.ruby;

import i18nscan.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A method call, with or without receiver, arguments and block.
 */
public class RubyCall extends RubyNode {

	private final RubyNode receiver;
	private final String name;
	private final RubyArguments arguments;
	private final RubyNode block;

	public RubyCall(SourceLocation location, RubyNode receiver, String name, RubyArguments arguments,
	                RubyNode block) {
		super(location);
		this.receiver = receiver;
		this.name = name;
		this.arguments = arguments;
		this.block = block;
	}

	public RubyNode getReceiver() {
		return receiver;
	}

	public String getName() {
		return name;
	}

	/**
	 * @return the argument list, or null when the call is written without arguments
	 */
	public RubyArguments getArguments() {
		return arguments;
	}

	public RubyNode getBlock() {
		return block;
	}

	public boolean hasArguments() {
		return arguments != null && !arguments.getArguments().isEmpty();
	}

	@Override
	public List<RubyNode> getChildNodes() {
		return presentChildren(receiver, arguments, block);
	}

	@Override
	public <T, E extends Throwable> T accept(RubyNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(receiver, name, arguments, block);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		RubyCall other = (RubyCall) obj;
		return Objects.equals(receiver, other.receiver) && Objects.equals(name, other.name) &&
				Objects.equals(arguments, other.arguments) && Objects.equals(block, other.block);
	}

	@Override
	public String toString() {
		return "RubyCall[" + name + "]" + getChildNodes();
	}

}
