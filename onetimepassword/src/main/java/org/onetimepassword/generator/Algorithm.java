package org.onetimepassword.generator;

import org.bouncycastle.crypto.Digest;
import org.bouncycastle.crypto.digests.SHA1Digest;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.digests.SHA512Digest;

import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Função de hash usada pelo HMAC.
 */
public enum Algorithm {
	SHA1(20, SHA1Digest::new),
	SHA256(32, SHA256Digest::new),
	SHA512(64, SHA512Digest::new);

	private final int hashLength;
	private final Supplier<Digest> digests;

	Algorithm(int hashLength, Supplier<Digest> digests) {
		this.hashLength = hashLength;
		this.digests = digests;
	}

	public int hashLength() {
		return hashLength;
	}

	// Digest do BC não é thread-safe: uma instância por chamada
	public Digest newDigest() {
		return digests.get();
	}

	public static Optional<Algorithm> fromName(String name) {
		if (name == null)
			return Optional.empty();
		try {
			return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
		} catch (IllegalArgumentException e) {
			return Optional.empty();
		}
	}
}
