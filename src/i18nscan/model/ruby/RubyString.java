package i18nscan.model.ruby;

import i18nscan.util.SourceLocation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class RubyString extends RubyNode {

	private final String content;

	public RubyString(SourceLocation location, String content) {
		super(location);
		this.content = content;
	}

	/**
	 * @return the unescaped string content
	 */
	public String getContent() {
		return content;
	}

	@Override
	public List<RubyNode> getChildNodes() {
		return Collections.emptyList();
	}

	@Override
	public <T, E extends Throwable> T accept(RubyNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(content);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		RubyString other = (RubyString) obj;
		return Objects.equals(content, other.content);
	}

	@Override
	public String toString() {
		return "\"" + content + "\"";
	}

}
