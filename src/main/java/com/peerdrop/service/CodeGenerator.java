package com.peerdrop.service;

import com.peerdrop.config.PeerDropProperties;
import com.peerdrop.exception.CodeSpaceExhaustedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.Locale;
import java.util.Random;
import java.util.function.Predicate;

/**
 * Produces short room codes such as {@code 7KQ2M}.
 * Holds no state of its own; uniqueness is checked against whatever the caller reports as in use.
 */
@Component
@Slf4j
public class CodeGenerator {

	private final String alphabet;
	private final int length;
	private final int maxAttempts;
	private final Random random;

	@Autowired
	public CodeGenerator(PeerDropProperties properties) {
		this(properties.getCode().getAlphabet(), properties.getCode().getLength(),
				properties.getCode().getMaxAttempts(), new SecureRandom());
	}

	public CodeGenerator(String alphabet, int length, int maxAttempts, Random random) {
		if (alphabet == null || alphabet.isEmpty()) {
			throw new IllegalArgumentException("Code alphabet must not be empty");
		}
		if (length < 1 || maxAttempts < 1) {
			throw new IllegalArgumentException("Code length and max attempts must be positive");
		}
		this.alphabet = alphabet.toUpperCase(Locale.ROOT);
		this.length = length;
		this.maxAttempts = maxAttempts;
		this.random = random;
	}

	/**
	 * Generate a code not accepted by {@code inUse}.
	 *
	 * @throws CodeSpaceExhaustedException if every attempt collided
	 */
	public String generate(Predicate<String> inUse) {
		for (int attempt = 1; attempt <= maxAttempts; attempt++) {
			String candidate = nextCandidate();
			if (!inUse.test(candidate)) {
				if (attempt > 1) {
					log.debug("Generated code {} after {} attempts", candidate, attempt);
				}
				return candidate;
			}
		}
		log.error("Failed to generate a unique room code after {} attempts", maxAttempts);
		throw new CodeSpaceExhaustedException(maxAttempts);
	}

	/**
	 * Canonical form of a user-entered code: trimmed and upper-cased. {@code null} becomes empty.
	 */
	public static String canonicalize(String raw) {
		if (raw == null) {
			return "";
		}
		return raw.trim().toUpperCase(Locale.ROOT);
	}

	private String nextCandidate() {
		StringBuilder sb = new StringBuilder(length);
		for (int i = 0; i < length; i++) {
			sb.append(alphabet.charAt(random.nextInt(alphabet.length())));
		}
		return sb.toString();
	}
}
