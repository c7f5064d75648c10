package com.anthem.csrfp.core.service;

import com.anthem.csrfp.core.model.CsrfpConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Produces random tokens. Prefers a hex-encoded SHA-512 digest of a random
 * seed; falls back to sampling {@code [a-z0-9]} when the digest is unavailable.
 * Either way there are at most 128 characters to draw from.
 */
public class TokenGenerator {

    private static final Logger log = LoggerFactory.getLogger(TokenGenerator.class);

    public static final int MAX_TOKEN_LENGTH = 128;

    static final String HASH_ALGORITHM = "SHA-512";
    private static final int SEED_BYTES = 64;
    private static final char[] ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789".toCharArray();

    private final SecureRandom random;
    private final String hashAlgorithm;

    public TokenGenerator() {
        this(new SecureRandom(), HASH_ALGORITHM);
    }

    // For testing
    TokenGenerator(SecureRandom random, String hashAlgorithm) {
        this.random = random;
        this.hashAlgorithm = hashAlgorithm;
    }

    /**
     * @param length requested length; non-positive values mean {@value CsrfpConfig#DEFAULT_TOKEN_LENGTH}
     * @return a token of the resolved length, capped at {@value #MAX_TOKEN_LENGTH}
     */
    public String generate(int length) {
        int resolved = Math.min(CsrfpConfig.resolveTokenLength(length), MAX_TOKEN_LENGTH);
        String source = hashedSeed();
        if (source == null) {
            source = sampledCharacters();
        }
        return source.substring(0, Math.min(resolved, source.length()));
    }

    private String hashedSeed() {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance(hashAlgorithm);
        } catch (NoSuchAlgorithmException e) {
            log.debug("{} unavailable, sampling token characters instead", hashAlgorithm);
            return null;
        }
        byte[] seed = new byte[SEED_BYTES];
        random.nextBytes(seed);
        return HexFormat.of().formatHex(digest.digest(seed));
    }

    private String sampledCharacters() {
        StringBuilder token = new StringBuilder(MAX_TOKEN_LENGTH);
        for (int i = 0; i < MAX_TOKEN_LENGTH; i++) {
            token.append(ALPHABET[random.nextInt(ALPHABET.length)]);
        }
        return token.toString();
    }
}
