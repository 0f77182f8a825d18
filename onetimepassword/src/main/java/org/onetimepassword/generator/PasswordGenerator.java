package org.onetimepassword.generator;

import org.onetimepassword.common.CryptoUtils;
import org.onetimepassword.common.GenerationError;
import org.onetimepassword.common.Outcome;
import org.onetimepassword.common.TextUtils;

/**
 * HOTP (RFC 4226): HMAC do contador, truncamento dinâmico e redução decimal.
 */
public final class PasswordGenerator {
	public static final int MIN_DIGITS = 1;
	public static final int MAX_DIGITS = 9; // 10 dígitos estouram um uint32

	private static final int[] POWERS_OF_TEN = {
			1, 10, 100, 1_000, 10_000, 100_000, 1_000_000, 10_000_000, 100_000_000, 1_000_000_000
	};

	private PasswordGenerator() {
	}

	public static Outcome<String> generate(Algorithm algorithm, int digits, byte[] secret, long counter) {
		if (digits < MIN_DIGITS || digits > MAX_DIGITS)
			return Outcome.failure(GenerationError.INVALID_DIGITS);

		byte[] hash = CryptoUtils.hmac(algorithm.newDigest(), secret, CryptoUtils.bigEndian(counter));
		int code = truncate(hash) % POWERS_OF_TEN[digits];
		return Outcome.success(TextUtils.padStart(Integer.toString(code), '0', digits));
	}

	/**
	 * Truncamento dinâmico (RFC 4226 §5.3). Os 4 bits baixos do último byte dão o offset (0..15);
	 * todo hash suportado tem pelo menos 20 bytes.
	 */
	static int truncate(byte[] hash) {
		int offset = hash[hash.length - 1] & 0x0F;
		return CryptoUtils.readBigEndianInt(hash, offset) & 0x7FFFFFFF;
	}
}
