package i18nscan.trans;

import i18nscan.I18nScanOptionException;
import i18nscan.I18nScanOptions;
import i18nscan.errors.IssueContext;

import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

public class OptionParsingPass {
	private OptionParsingPass() {}

	public static I18nScanOptions perform(IssueContext ctx, Logger logger, String[] args) {
		I18nScanOptions opts = new I18nScanOptions(args);
		try {
			opts.parse();
		} catch (I18nScanOptionException e) {
			ctx.error(new OptionParserIssue(e.getMessage()));
		}
		// set the logger's log level based on command line arguments
		if (opts.logLvlQuiet) {
			logger.setLevel(Level.WARNING);
		} else if (opts.logLvlVerbose) {
			logger.setLevel(Level.FINE);
		} else {
			logger.setLevel(Level.INFO);
		}
		// the console handler filters at INFO unless told otherwise
		for (Handler handler : Logger.getLogger("").getHandlers()) {
			handler.setLevel(logger.getLevel());
		}
		return opts;
	}
}
