package org.onetimepassword.token;

public class InvalidTokenUrlException extends IllegalArgumentException {
	public InvalidTokenUrlException(String message) {
		super(message);
	}

	public InvalidTokenUrlException(String message, Throwable cause) {
		super(message, cause);
	}
}
