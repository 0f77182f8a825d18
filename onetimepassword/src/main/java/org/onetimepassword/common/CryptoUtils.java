package org.onetimepassword.common;

import org.bouncycastle.crypto.Digest;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.KeyParameter;
import org.apache.commons.codec.binary.Base32;
import org.apache.commons.codec.binary.Hex;

import java.nio.ByteBuffer;
import java.util.Locale;

public final class CryptoUtils {
	public static final int COUNTER_LEN = 8; // uint64
	public static final int TRUNCATED_LEN = 4; // uint32

	private CryptoUtils() {
	}

	/**
	 * HMAC(key, message) com o digest informado. Aceita chave vazia.
	 */
	public static byte[] hmac(Digest digest, byte[] key, byte[] message) {
		HMac mac = new HMac(digest);
		mac.init(new KeyParameter(key));
		mac.update(message, 0, message.length);
		byte[] out = new byte[mac.getMacSize()];
		mac.doFinal(out, 0);
		return out;
	}

	public static byte[] bigEndian(long value) {
		return ByteBuffer.allocate(COUNTER_LEN).putLong(value).array();
	}

	// ByteBuffer valida os limites; ordem padrão é big-endian
	public static int readBigEndianInt(byte[] data, int offset) {
		return ByteBuffer.wrap(data, offset, TRUNCATED_LEN).getInt();
	}

	public static String toBase32(byte[] data) {
		return new Base32().encodeAsString(data).replace("=", "");
	}

	public static byte[] fromBase32(String s) {
		return new Base32().decode(s.toUpperCase(Locale.ROOT));
	}

	public static boolean isBase32(String s) {
		return !s.isEmpty() && new Base32().isInAlphabet(s.toUpperCase(Locale.ROOT));
	}

	public static String toHex(byte[] data) {
		return Hex.encodeHexString(data);
	}
}
