package i18nscan.trans;

import i18nscan.I18nScanException;

/**
 * Exception while turning a raw Ruby tree into a normalized tree.
 */
public class NormalizationException extends I18nScanException {

	private static final long serialVersionUID = -6914023356717840815L;
	private static final String prefix = "Normalization Error";

	public NormalizationException(String msg) {
		super(prefix, msg);
	}

}
