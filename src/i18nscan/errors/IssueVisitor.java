package i18nscan.errors;

import i18nscan.parser.ParsingIssue;
import i18nscan.trans.IOErrorIssue;
import i18nscan.trans.OptionParserIssue;
import i18nscan.trans.UnsupportedOptionsEntryIssue;

public abstract class IssueVisitor<T, E extends Throwable> {
	public abstract T visit(IssueWithContext issueWithContext) throws E;
	public abstract T visit(OptionParserIssue optionParserIssue) throws E;
	public abstract T visit(IOErrorIssue ioErrorIssue) throws E;
	public abstract T visit(ParsingIssue parsingIssue) throws E;
	public abstract T visit(UnsupportedOptionsEntryIssue unsupportedOptionsEntryIssue) throws E;
}
