package i18nscan;

import i18nscan.errors.Issue;
import i18nscan.errors.IssueContext;
import i18nscan.errors.TopLevelIssueContext;
import i18nscan.model.normalized.Normalized;
import i18nscan.model.normalized.TranslationCallNode;
import i18nscan.model.ruby.RubyParseResult;
import i18nscan.parser.ParsingIssue;
import i18nscan.parser.ProcessRubySourceParser;
import i18nscan.parser.RubyParseException;
import i18nscan.parser.RubySourceParser;
import i18nscan.trans.*;
import org.apache.commons.io.FileUtils;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

public class I18nScanMain {
	private final String[] cmdArgs;
	private final PrintStream out;
	private static final Logger logger = Logger.getLogger("i18nscan");

	public I18nScanMain(String[] args, PrintStream out) {
		this.cmdArgs = args;
		this.out = out;
	}

	// Creates an I18nScanMain instance, and initiates run() below.
	public static void main(String[] args) {
		int status = new I18nScanMain(args, System.out).run();
		if (status == 0) {
			logger.info("Finished");
		} else {
			logger.info("Terminated with errors");
		}
		System.exit(status);
	}

	// Top-level workhorse method. Returns the process exit status.
	public int run() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();

		// Check options, set up logging.
		I18nScanOptions opts = OptionParsingPass.perform(ctx, logger, cmdArgs);
		if (ctx.hasErrors()) {
			System.err.println(ctx.format());
			opts.printHelp();
			return 1;
		}
		if (opts.version) {
			out.println("i18nscan version " + I18nScanOptions.VERSION);
			return 0;
		}
		if (opts.help) {
			opts.printHelp();
			return 0;
		}

		RubySourceParser parser = new ProcessRubySourceParser(opts.parserCommand);
		CallNames callNames = opts.scanner.getCallNames();
		for (String inputFilePath : opts.inputFilePaths) {
			Path path = Paths.get(inputFilePath);
			for (LocatedTranslationCall found : scanFile(ctx, path, parser, callNames)) {
				out.println(formatFound(path, found));
			}
		}

		if (ctx.hasErrors()) {
			System.err.println(ctx.format());
			return 1;
		}
		return 0;
	}

	/**
	 * Scans one file. Any failure is reported to ctx in the context of the file, and yields no calls.
	 */
	public static List<LocatedTranslationCall> scanFile(IssueContext ctx, Path path, RubySourceParser parser,
	                                                     CallNames callNames) {
		IssueContext fileCtx = ctx.withContext(new WhileNormalizingFile(path));
		try {
			logger.fine("Reading " + path);
			String source = FileUtils.readFileToString(path.toFile(), StandardCharsets.UTF_8);
			return scanSource(path, source, parser, callNames);
		} catch (IOException e) {
			fileCtx.error(new IOErrorIssue(e));
		} catch (RubyParseException e) {
			fileCtx.error(new ParsingIssue(e));
		} catch (Issue issue) {
			fileCtx.error(issue);
		}
		return Collections.emptyList();
	}

	static List<LocatedTranslationCall> scanSource(Path path, String source, RubySourceParser parser,
	                                               CallNames callNames) throws RubyParseException {
		logger.fine("Parsing " + path);
		RubyParseResult parseResult = parser.parse(source);
		if (MagicComments.hasSkipMarker(parseResult.getComments())) {
			logger.info("Skipping " + path + ": contains " + MagicComments.SKIP_MARKER);
			return Collections.emptyList();
		}
		logger.fine("Normalizing " + path);
		Normalized normalized = NormalizationPass.perform(parseResult, parser, callNames);
		List<LocatedTranslationCall> found = new ArrayList<>(TranslationCallCollector.collectLocated(normalized));
		logger.fine("Found " + found.size() + " translation call(s) in " + path);
		return found;
	}

	static String formatFound(Path path, LocatedTranslationCall found) {
		TranslationCallNode call = found.getCall();
		StringBuilder b = new StringBuilder();
		b.append(path).append(':').append(found.getLine()).append(": ");
		if (call.getKey() == null) {
			b.append("(no key)");
		} else {
			b.append(call.getKey());
		}
		if (call.getReceiver() != null) {
			b.append(" receiver=").append(call.getReceiver());
		}
		if (!call.getOptions().isEmpty()) {
			b.append(" options=").append(call.getOptions());
		}
		return b.toString();
	}
}
