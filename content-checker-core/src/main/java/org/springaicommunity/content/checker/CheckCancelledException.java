package org.springaicommunity.content.checker;

/**
 * Thrown from a suspension point once the shared {@link CancellationSignal} has fired.
 */
public class CheckCancelledException extends ContentCheckException {

	public CheckCancelledException(String message) {
		super(ErrorKind.CANCELLED, message);
	}

}
