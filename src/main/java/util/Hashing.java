package util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Content hashes used for freshness keys and cache file names
 */
public class Hashing {

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private Hashing() {
        // static methods only
    }

    /**
     * SHA-256 of the UTF-8 encoding of the given string, as lower-case hex
     *
     * @param s
     *            string to hash
     * @return hex digest
     */
    public static String sha256(String s) {
        MessageDigest md;
        try {
            md = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // every JDK ships SHA-256
            throw new RuntimeException(e);
        }
        byte[] digest = md.digest(s.getBytes(StandardCharsets.UTF_8));
        char[] out = new char[digest.length * 2];
        for (int i = 0; i < digest.length; i++) {
            out[2 * i] = HEX[(digest[i] >> 4) & 0xf];
            out[2 * i + 1] = HEX[digest[i] & 0xf];
        }
        return new String(out);
    }
}
