package com.schoolmate.backend.modules.approval.domain;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Generates edit tokens ({@code SPET-} followed by 64 upper-case hex characters) and derives the
 * stored hash.
 */
public final class EditTokenCodec {

    public static final String PREFIX = "SPET-";
    private static final int TOKEN_BYTES = 32;
    private static final Pattern FORMAT = Pattern.compile("^SPET-[0-9A-F]{64}$");
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private EditTokenCodec() {
    }

    public static String generate() {
        byte[] bytes = new byte[TOKEN_BYTES];
        SECURE_RANDOM.nextBytes(bytes);
        return PREFIX + HexFormat.of().withUpperCase().formatHex(bytes);
    }

    public static boolean isWellFormed(String token) {
        return token != null && FORMAT.matcher(token).matches();
    }

    public static String hash(String token) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(token.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }
}
