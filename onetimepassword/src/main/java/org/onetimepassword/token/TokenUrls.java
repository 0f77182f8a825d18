package org.onetimepassword.token;

import org.onetimepassword.common.CryptoUtils;
import org.onetimepassword.generator.Algorithm;
import org.onetimepassword.generator.Factor;
import org.onetimepassword.generator.Generator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Formato "Key URI" dos apps autenticadores:
 * otpauth://totp/Emissor:conta?algorithm=SHA1&digits=6&issuer=Emissor&period=30&secret=BASE32
 */
public final class TokenUrls {
	private static final Logger log = LoggerFactory.getLogger(TokenUrls.class);

	public static final String SCHEME = "otpauth";
	private static final String HOTP = "hotp";
	private static final String TOTP = "totp";
	private static final Pattern INTEGER = Pattern.compile("[0-9]+");
	private static final Pattern DECIMAL = Pattern.compile("[0-9]+(\\.[0-9]+)?");

	private TokenUrls() {
	}

	public static String toUrl(Token token) {
		Generator g = token.generator();
		String type = g.factor().fold(c -> HOTP, t -> TOTP);
		// só o separador emissor:nome fica literal
		String label = token.issuer().isEmpty()
				? encode(token.name())
				: encode(token.issuer()) + ":" + encode(token.name());

		StringBuilder sb = new StringBuilder(SCHEME).append("://").append(type).append('/')
				.append(label)
				.append("?algorithm=").append(g.algorithm().name())
				.append("&digits=").append(g.digits());
		if (!token.issuer().isEmpty())
			sb.append("&issuer=").append(encode(token.issuer()));
		String factorParam = g.factor().fold(
				c -> "&counter=" + Long.toUnsignedString(c.value()),
				t -> "&period=" + formatPeriod(t.period()));
		sb.append(factorParam);
		sb.append("&secret=").append(CryptoUtils.toBase32(g.secret()));
		return sb.toString();
	}

	/**
	 * @throws InvalidTokenUrlException se a URL não descreve um token válido
	 */
	public static Token parse(String url) {
		try {
			return doParse(url);
		} catch (InvalidTokenUrlException e) {
			log.debug("Rejected token URL: {}", e.getMessage());
			throw e;
		}
	}

	private static Token doParse(String url) {
		if (url == null)
			throw new InvalidTokenUrlException("URL is null");
		URI uri;
		try {
			uri = new URI(url.trim());
		} catch (URISyntaxException e) {
			throw new InvalidTokenUrlException("Malformed URL", e);
		}
		if (!SCHEME.equalsIgnoreCase(uri.getScheme()))
			throw new InvalidTokenUrlException("Unsupported scheme: " + uri.getScheme());

		String type = uri.getHost() == null ? uri.getAuthority() : uri.getHost();
		if (type == null)
			throw new InvalidTokenUrlException("Missing token type");
		type = type.toLowerCase(Locale.ROOT);

		Map<String, String> query = parseQuery(uri.getRawQuery());

		Factor factor = switch (type) {
		case HOTP -> Factor.counter(parseCounter(query.get("counter")));
		case TOTP -> Factor.timer(parsePeriod(query.get("period")));
		default -> throw new InvalidTokenUrlException("Unknown token type: " + type);
		};

		String rawSecret = query.get("secret");
		if (rawSecret == null || !CryptoUtils.isBase32(rawSecret))
			throw new InvalidTokenUrlException("Missing or invalid secret");
		byte[] secret = CryptoUtils.fromBase32(rawSecret);
		if (secret.length == 0)
			throw new InvalidTokenUrlException("Missing or invalid secret");

		Algorithm algorithm = Generator.DEFAULT_ALGORITHM;
		if (query.containsKey("algorithm")) {
			algorithm = Algorithm.fromName(query.get("algorithm"))
					.orElseThrow(() -> new InvalidTokenUrlException("Unknown algorithm: " + query.get("algorithm")));
		}

		int digits = query.containsKey("digits") ? parseInt("digits", query.get("digits")) : Generator.DEFAULT_DIGITS;

		Generator generator = Generator.create(factor, secret, algorithm, digits)
				.orElseThrow(() -> new InvalidTokenUrlException("Invalid generator configuration"));

		// separa no primeiro ':' literal, antes de decodificar
		String rawLabel = uri.getRawPath() == null ? "" : uri.getRawPath();
		if (rawLabel.startsWith("/"))
			rawLabel = rawLabel.substring(1);

		String issuer = query.get("issuer");
		String name = decodePath(rawLabel);
		int colon = rawLabel.indexOf(':');
		if (colon >= 0) {
			String prefix = decodePath(rawLabel.substring(0, colon));
			if (issuer == null || issuer.equals(prefix)) {
				issuer = prefix;
				name = decodePath(rawLabel.substring(colon + 1)).stripLeading();
			}
		}
		return new Token(name, issuer == null ? "" : issuer, generator);
	}

	private static Map<String, String> parseQuery(String rawQuery) {
		Map<String, String> out = new LinkedHashMap<>();
		if (rawQuery == null || rawQuery.isEmpty())
			return out;
		for (String pair : rawQuery.split("&")) {
			if (pair.isEmpty())
				continue;
			int eq = pair.indexOf('=');
			String key = eq < 0 ? pair : pair.substring(0, eq);
			String value = eq < 0 ? "" : pair.substring(eq + 1);
			// primeira ocorrência vence
			out.putIfAbsent(decode(key).toLowerCase(Locale.ROOT), decode(value));
		}
		return out;
	}

	private static long parseCounter(String value) {
		if (value == null)
			return 0;
		if (!INTEGER.matcher(value).matches())
			throw new InvalidTokenUrlException("Invalid counter: " + value);
		try {
			return Long.parseUnsignedLong(value);
		} catch (NumberFormatException e) {
			throw new InvalidTokenUrlException("Invalid counter: " + value, e);
		}
	}

	private static double parsePeriod(String value) {
		if (value == null)
			return Generator.DEFAULT_PERIOD;
		if (!DECIMAL.matcher(value).matches())
			throw new InvalidTokenUrlException("Invalid period: " + value);
		try {
			return Double.parseDouble(value);
		} catch (NumberFormatException e) {
			throw new InvalidTokenUrlException("Invalid period: " + value, e);
		}
	}

	private static int parseInt(String field, String value) {
		if (!INTEGER.matcher(value).matches())
			throw new InvalidTokenUrlException("Invalid " + field + ": " + value);
		try {
			return Integer.parseInt(value);
		} catch (NumberFormatException e) {
			throw new InvalidTokenUrlException("Invalid " + field + ": " + value, e);
		}
	}

	// sem notação científica, para voltar pelo parsePeriod
	private static String formatPeriod(double period) {
		return BigDecimal.valueOf(period).stripTrailingZeros().toPlainString();
	}

	private static String encode(String s) {
		return URLEncoder.encode(s, StandardCharsets.UTF_8).replace("+", "%20");
	}

	// no path '+' é literal
	private static String decodePath(String s) {
		return decode(s.replace("+", "%2B"));
	}

	private static String decode(String s) {
		try {
			return URLDecoder.decode(s, StandardCharsets.UTF_8);
		} catch (IllegalArgumentException e) {
			throw new InvalidTokenUrlException("Malformed escape in URL", e);
		}
	}
}
