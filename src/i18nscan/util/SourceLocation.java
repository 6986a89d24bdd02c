package i18nscan.util;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A span of source text. Lines are 1-based, as reported by the external parser; columns and offsets are 0-based.
 */
public class SourceLocation {
	private final Path file;
	private final int startOffset;
	private final int endOffset;
	private final int startLine;
	private final int endLine;
	private final int startColumn;
	private final int endColumn;

	public SourceLocation(Path file, int startOffset, int endOffset, int startLine, int endLine, int startColumn,
	                      int endColumn) {
		this.file = file;
		this.startOffset = startOffset;
		this.endOffset = endOffset;
		this.startLine = startLine;
		this.endLine = endLine;
		this.startColumn = startColumn;
		this.endColumn = endColumn;
	}

	public static SourceLocation unknown() {
		return new SourceLocation(null, -1, -1, -1, -1, -1, -1);
	}

	/**
	 * A location covering a single line, used for hand-built trees and for comments whose exact columns do not
	 * matter.
	 */
	public static SourceLocation line(int line) {
		return new SourceLocation(null, -1, -1, line, line, 0, 0);
	}

	public boolean isUnknown() {
		return startLine < 0;
	}

	public String prettyString() {
		if (isUnknown()) {
			return "at unknown source location";
		}
		StringBuilder b = new StringBuilder("at ");
		b.append(startLine).append(':').append(startColumn + 1);
		if (startLine != endLine) {
			b.append('-').append(endLine).append(':').append(endColumn);
		} else if (startColumn != endColumn) {
			b.append('-').append(endColumn);
		}
		if (file != null) {
			b.append(" in file ").append(file);
		}
		return b.toString();
	}

	public Path getFile() {
		return file;
	}

	public int getStartOffset() {
		return startOffset;
	}

	public int getEndOffset() {
		return endOffset;
	}

	public int getStartLine() {
		return startLine;
	}

	public int getEndLine() {
		return endLine;
	}

	public int getStartColumn() {
		return startColumn;
	}

	public int getEndColumn() {
		return endColumn;
	}

	@Override
	public int hashCode() {
		return Objects.hash(file, startOffset, endOffset, startLine, endLine, startColumn, endColumn);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		SourceLocation other = (SourceLocation) obj;
		return endColumn == other.endColumn && endLine == other.endLine && startColumn == other.startColumn &&
				startOffset == other.startOffset && endOffset == other.endOffset && startLine == other.startLine &&
				Objects.equals(file, other.file);
	}

	@Override
	public String toString() {
		if (isUnknown()) {
			return "SourceLocation [UNKNOWN]";
		} else {
			return "SourceLocation [file=" + file + ", startOffset=" + startOffset + ", endOffset=" + endOffset +
					", startLine=" + startLine + ", endLine=" + endLine + ", startColumn=" + startColumn +
					", endColumn=" + endColumn + "]";
		}
	}
}
