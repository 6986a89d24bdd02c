package i18nscan.formatters;

import i18nscan.errors.IssueVisitor;
import i18nscan.errors.IssueWithContext;
import i18nscan.parser.ParsingIssue;
import i18nscan.trans.IOErrorIssue;
import i18nscan.trans.OptionParserIssue;
import i18nscan.trans.UnsupportedOptionsEntryIssue;

import java.io.IOException;

public class IssueFormattingVisitor extends IssueVisitor<Void, IOException> {
	private final IndentingWriter out;

	public IssueFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(IssueWithContext issueWithContext) throws IOException {
		issueWithContext.getContext().accept(new ContextFormattingVisitor(out));
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			issueWithContext.getIssue().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(OptionParserIssue optionParserIssue) throws IOException {
		out.write("unable to parse options: ");
		out.write(optionParserIssue.getReason());
		return null;
	}

	@Override
	public Void visit(IOErrorIssue ioErrorIssue) throws IOException {
		out.write("IO Error: ");
		out.write(ioErrorIssue.getError().toString());
		return null;
	}

	@Override
	public Void visit(ParsingIssue parsingIssue) throws IOException {
		out.write("error parsing Ruby: ");
		out.write(String.valueOf(parsingIssue.getError().getMessage()));
		return null;
	}

	@Override
	public Void visit(UnsupportedOptionsEntryIssue unsupportedOptionsEntryIssue) throws IOException {
		out.write("unsupported entry in keyword arguments ");
		out.write(unsupportedOptionsEntryIssue.getEntry().getLocation().prettyString());
		out.write(": expected key-value pairs only, found ");
		out.write(unsupportedOptionsEntryIssue.getEntry().toString());
		return null;
	}

}
