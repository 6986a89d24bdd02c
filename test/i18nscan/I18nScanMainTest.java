package i18nscan;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import i18nscan.errors.Issue;
import i18nscan.errors.IssueWithContext;
import i18nscan.errors.TopLevelIssueContext;
import i18nscan.model.ruby.RubyParseResult;
import i18nscan.parser.ParsingIssue;
import i18nscan.parser.RubyParseException;
import i18nscan.parser.RubySourceParser;
import i18nscan.trans.CallNames;
import i18nscan.trans.IOErrorIssue;
import i18nscan.trans.LocatedTranslationCall;
import i18nscan.trans.UnsupportedOptionsEntryIssue;
import i18nscan.trans.WhileNormalizingFile;
import i18nscan.util.SourceLocation;

import static i18nscan.model.ruby.RubyBuilder.*;

public class I18nScanMainTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private Path source(String name, String contents) throws IOException {
		File file = folder.newFile(name);
		FileUtils.writeStringToFile(file, contents, StandardCharsets.UTF_8);
		return file.toPath();
	}

	// every source text parses to the same prepared tree
	private static RubySourceParser parsingTo(RubyParseResult result) {
		return source -> result;
	}

	@Test
	public void testScanFindsAndFormatsCalls() throws IOException {
		Path path = source("view.rb", "t('a.b', scope: :x)\n");
		RubySourceParser parser = parsingTo(new RubyParseResult(
				program(call(SourceLocation.line(1), constant("I18n"), "t", str("a.b"),
						kwargs(assoc("scope", sym("x"))))),
				Collections.emptyList()));
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		List<LocatedTranslationCall> found = I18nScanMain.scanFile(ctx, path, parser, CallNames.defaults());

		assertFalse(ctx.hasErrors());
		assertThat(found.size(), is(1));
		assertThat(I18nScanMain.formatFound(path, found.get(0)),
				is(path + ":1: \"a.b\" receiver=:I18n options={:scope => :x}"));
	}

	@Test
	public void testSkipMarker() throws RubyParseException {
		RubySourceParser parser = parsingTo(new RubyParseResult(
				program(call("t", str("a"))),
				Arrays.asList(comment(1, "# i18n-tasks-skip-prism"))));
		List<LocatedTranslationCall> found = I18nScanMain.scanSource(Paths.get("skipped.rb"), "", parser,
				CallNames.defaults());
		assertTrue(found.isEmpty());
	}

	@Test
	public void testMissingFileIsAnIssueOfThatFile() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		Path path = new File(folder.getRoot(), "absent.rb").toPath();
		List<LocatedTranslationCall> found = I18nScanMain.scanFile(ctx, path,
				parsingTo(new RubyParseResult(program(), Collections.emptyList())), CallNames.defaults());

		assertTrue(found.isEmpty());
		assertThat(ctx.getIssues().size(), is(1));
		Issue issue = ctx.getIssues().get(0);
		assertThat(issue, instanceOf(IssueWithContext.class));
		IssueWithContext withContext = (IssueWithContext) issue;
		assertThat(withContext.getIssue(), instanceOf(IOErrorIssue.class));
		assertEquals(path, ((WhileNormalizingFile) withContext.getContext()).getFile());
		assertThat(ctx.format(), containsString("while normalizing file " + path));
	}

	@Test
	public void testParseFailureDoesNotStopOtherFiles() throws IOException {
		Path broken = source("broken.rb", "t(");
		Path fine = source("fine.rb", "t('ok')");
		RubySourceParser parser = source -> {
			if (source.equals("t(")) {
				throw new RubyParseException("unexpected end-of-input");
			}
			return new RubyParseResult(program(call("t", str("ok"))), Collections.emptyList());
		};
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		assertTrue(I18nScanMain.scanFile(ctx, broken, parser, CallNames.defaults()).isEmpty());
		assertThat(I18nScanMain.scanFile(ctx, fine, parser, CallNames.defaults()).size(), is(1));

		assertThat(ctx.getIssues().size(), is(1));
		assertThat(((IssueWithContext) ctx.getIssues().get(0)).getIssue(), instanceOf(ParsingIssue.class));
		assertThat(ctx.format(), containsString("error parsing Ruby: unexpected end-of-input"));
	}

	@Test
	public void testNormalizationIssueIsRecorded() throws IOException {
		Path path = source("splat.rb", "t('k', **opts)");
		RubySourceParser parser = parsingTo(new RubyParseResult(
				program(call("t", str("k"), kwargs(other("assoc_splat_node", call("opts"))))),
				Collections.emptyList()));
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		assertTrue(I18nScanMain.scanFile(ctx, path, parser, CallNames.defaults()).isEmpty());
		assertThat(((IssueWithContext) ctx.getIssues().get(0)).getIssue(),
				instanceOf(UnsupportedOptionsEntryIssue.class));
	}

	@Test
	public void testVersion() {
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		int status = new I18nScanMain(new String[] {"-version"}, new PrintStream(bytes, true)).run();
		assertThat(status, is(0));
		assertThat(new String(bytes.toByteArray(), StandardCharsets.UTF_8),
				containsString("i18nscan version " + I18nScanOptions.VERSION));
	}

	@Test
	public void testBadOptionsFail() {
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		assertThat(new I18nScanMain(new String[] {"a.rb"}, new PrintStream(bytes, true)).run(), is(1));
	}

}
