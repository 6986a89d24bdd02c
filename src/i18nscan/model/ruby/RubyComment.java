package i18nscan.model.ruby;

import i18nscan.util.SourceLocatable;
import i18nscan.util.SourceLocation;

import java.util.Objects;

/**
 * A comment token. The text is the comment as written, including its leading marker.
 */
public class RubyComment extends SourceLocatable {

	private final SourceLocation location;
	private final String text;

	public RubyComment(SourceLocation location, String text) {
		this.location = location;
		this.text = text;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	public String getText() {
		return text;
	}

	@Override
	public int hashCode() {
		return Objects.hash(location, text);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (obj == null || getClass() != obj.getClass()) return false;
		RubyComment other = (RubyComment) obj;
		return Objects.equals(location, other.location) && Objects.equals(text, other.text);
	}

	@Override
	public String toString() {
		return "RubyComment [text=" + text + ", location=" + location + "]";
	}

}
