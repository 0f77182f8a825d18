package org.onetimepassword.common;

public class GenerationException extends RuntimeException {
	private final GenerationError error;

	public GenerationException(GenerationError error) {
		super("OTP generation failed: " + error);
		this.error = error;
	}

	public GenerationError getError() {
		return error;
	}
}
