package org.springaicommunity.content.checker;

import org.jspecify.annotations.Nullable;

/**
 * Base exception for failures while checking content. Carries an {@link ErrorKind} so
 * that retry decisions never depend on the exception type.
 */
public class ContentCheckException extends RuntimeException {

	private final ErrorKind errorKind;

	private final @Nullable String filePath;

	public ContentCheckException(ErrorKind errorKind, String message) {
		this(errorKind, message, null, null);
	}

	public ContentCheckException(ErrorKind errorKind, String message, @Nullable String filePath) {
		this(errorKind, message, filePath, null);
	}

	public ContentCheckException(ErrorKind errorKind, String message, @Nullable String filePath,
			@Nullable Throwable cause) {
		super(message, cause);
		this.errorKind = errorKind;
		this.filePath = filePath;
	}

	public ErrorKind getErrorKind() {
		return errorKind;
	}

	public @Nullable String getFilePath() {
		return filePath;
	}

	public boolean isTransient() {
		return errorKind.isTransient();
	}

}
