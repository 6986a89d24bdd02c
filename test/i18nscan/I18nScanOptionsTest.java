package i18nscan;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import i18nscan.errors.TopLevelIssueContext;
import i18nscan.trans.OptionParserIssue;
import i18nscan.trans.OptionParsingPass;

public class I18nScanOptionsTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private String config(String json) throws IOException {
		File file = folder.newFile("config.json");
		FileUtils.writeStringToFile(file, json, StandardCharsets.UTF_8);
		return file.getPath();
	}

	@Test
	public void testParserFromCommandLine() throws I18nScanOptionException {
		I18nScanOptions opts = new I18nScanOptions(new String[] {"-p", "ruby dump_tree.rb", "a.rb", "b.rb"});
		opts.parse();
		assertThat(opts.parserCommand, is(Arrays.asList("ruby", "dump_tree.rb")));
		assertThat(opts.inputFilePaths, is(Arrays.asList("a.rb", "b.rb")));
		assertTrue(opts.scanner.getCallNames().isTranslationCall("t"));
	}

	@Test
	public void testParserFromConfiguration() throws I18nScanOptionException, IOException {
		String path = config("{\"parser\": {\"command\": [\"prism-dump\"]}, " +
				"\"scanner\": {\"translation_calls\": [\"l\"]}}");
		I18nScanOptions opts = new I18nScanOptions(new String[] {"-c", path, "a.rb"});
		opts.parse();
		assertThat(opts.parserCommand, is(Arrays.asList("prism-dump")));
		assertTrue(opts.scanner.getCallNames().isTranslationCall("l"));
		assertFalse(opts.scanner.getCallNames().isTranslationCall("t"));
	}

	@Test
	public void testCommandLineOverridesConfiguration() throws I18nScanOptionException, IOException {
		String path = config("{\"parser\": {\"command\": [\"prism-dump\"]}}");
		I18nScanOptions opts = new I18nScanOptions(new String[] {"-c", path, "-p", "other-dump", "a.rb"});
		opts.parse();
		assertThat(opts.parserCommand, is(Arrays.asList("other-dump")));
	}

	@Test(expected = I18nScanOptionException.class)
	public void testNoInputFiles() throws I18nScanOptionException {
		new I18nScanOptions(new String[] {"-p", "dump"}).parse();
	}

	@Test(expected = I18nScanOptionException.class)
	public void testNoParser() throws I18nScanOptionException {
		new I18nScanOptions(new String[] {"a.rb"}).parse();
	}

	@Test(expected = I18nScanOptionException.class)
	public void testMalformedConfiguration() throws I18nScanOptionException, IOException {
		String path = config("{\"parser\": ");
		new I18nScanOptions(new String[] {"-c", path, "-p", "dump", "a.rb"}).parse();
	}

	@Test(expected = I18nScanOptionException.class)
	public void testMistypedConfiguration() throws I18nScanOptionException, IOException {
		String path = config("{\"scanner\": {\"visibility_calls\": \"private\"}}");
		new I18nScanOptions(new String[] {"-c", path, "-p", "dump", "a.rb"}).parse();
	}

	@Test(expected = I18nScanOptionException.class)
	public void testMissingConfiguration() throws I18nScanOptionException {
		String path = new File(folder.getRoot(), "absent.json").getPath();
		new I18nScanOptions(new String[] {"-c", path, "-p", "dump", "a.rb"}).parse();
	}

	@Test
	public void testHelpNeedsNothingElse() throws I18nScanOptionException {
		I18nScanOptions opts = new I18nScanOptions(new String[] {"-h"});
		opts.parse();
		assertTrue(opts.isInformational());
		assertTrue(opts.inputFilePaths.isEmpty());
	}

	@Test
	public void testOptionParsingPassReportsIssuesAndSetsLevel() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		Logger logger = Logger.getLogger("i18nscan.test.options");
		OptionParsingPass.perform(ctx, logger, new String[] {"-q", "a.rb"});
		assertTrue(ctx.hasErrors());
		assertThat(ctx.getIssues().get(0), instanceOf(OptionParserIssue.class));
		assertThat(logger.getLevel(), is(Level.WARNING));

		TopLevelIssueContext verbose = new TopLevelIssueContext();
		OptionParsingPass.perform(verbose, logger, new String[] {"-v", "-p", "dump", "a.rb"});
		assertFalse(verbose.hasErrors());
		assertThat(logger.getLevel(), is(Level.FINE));
	}

}
