package de.bsommerfeld.patchfetcher.core.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 hashing utility. Uses streaming I/O so multi-gigabyte patch
 * archives are never loaded into memory.
 */
public final class HashUtil {

    private static final String ALGORITHM = "SHA-256";
    private static final int BUFFER_SIZE = 128 * 1024;

    private HashUtil() {}

    /**
     * Computes the hex-encoded SHA-256 hash of the given file.
     *
     * @throws IOException if the file cannot be read
     */
    public static String sha256(Path file) throws IOException {
        try {
            MessageDigest digest = MessageDigest.getInstance(ALGORITHM);
            try (InputStream in = Files.newInputStream(file)) {
                byte[] buffer = new byte[BUFFER_SIZE];
                int read;
                while ((read = in.read(buffer)) != -1) {
                    digest.update(buffer, 0, read);
                }
            }
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            // Every Java platform implementation must provide SHA-256
            throw new AssertionError(ALGORITHM + " not available", e);
        }
    }

    /** Case-insensitive digest comparison; catalogs report upper-case hex. */
    public static boolean matches(Path file, String expectedHash) throws IOException {
        return sha256(file).equalsIgnoreCase(expectedHash);
    }
}
