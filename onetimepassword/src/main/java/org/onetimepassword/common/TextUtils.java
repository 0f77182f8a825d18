package org.onetimepassword.common;

public final class TextUtils {
	private TextUtils() {
	}

	/**
	 * Completa à esquerda até {@code length}; nunca trunca.
	 */
	public static String padStart(String s, char pad, int length) {
		int missing = length - s.length();
		if (missing <= 0)
			return s;
		return String.valueOf(pad).repeat(missing) + s;
	}
}
