package i18nscan;

public class I18nScanOptionException extends Exception {

	private static final long serialVersionUID = 4290431713508390447L;

	public I18nScanOptionException(String message) {
		super(message);
	}

}
