package org.onetimepassword.common;

/**
 * Falhas recuperáveis da geração de senhas.
 */
public enum GenerationError {
	/** timestamp negativo (ou não representável) */
	INVALID_TIME,
	/** período zero ou negativo */
	INVALID_PERIOD,
	/** dígitos fora de 1..9 */
	INVALID_DIGITS
}
