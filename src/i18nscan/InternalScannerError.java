package i18nscan;

public class InternalScannerError extends RuntimeException {
	public InternalScannerError(String message) {
		super("internal scanner error: " + message);
	}
}
