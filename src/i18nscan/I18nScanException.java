package i18nscan;

/**
 * An i18nscan exception consisting of a prefix (type of error) and a message.
 */
public abstract class I18nScanException extends RuntimeException {
	private final String msg;
	private final String prefix;

	public I18nScanException(String prefix, String msg) {
		super(prefix + ": " + msg);
		this.prefix = prefix;
		this.msg = msg;
	}

	public String getMsg() {
		return msg;
	}

	public String getPrefix() {
		return prefix;
	}
}
