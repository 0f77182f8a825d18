package org.onetimepassword.token;

import org.onetimepassword.common.Outcome;
import org.onetimepassword.generator.Generator;

import java.time.Instant;
import java.util.Objects;

/**
 * Conta OTP: nome, emissor e gerador.
 */
public record Token(String name, String issuer, Generator generator) {

	public Token {
		Objects.requireNonNull(name, "name");
		Objects.requireNonNull(issuer, "issuer");
		Objects.requireNonNull(generator, "generator");
	}

	public Token(Generator generator) {
		this("", "", generator);
	}

	public Outcome<String> currentPassword(Instant now) {
		return generator.password(now);
	}

	/**
	 * Token após consumir uma senha (HOTP avança o contador).
	 */
	public Token updatedToken() {
		return new Token(name, issuer, generator.successor());
	}
}
