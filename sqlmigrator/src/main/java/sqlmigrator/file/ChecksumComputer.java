package sqlmigrator.file;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 digest of migration file bytes, as lower-case hex.
 *
 * <p>The digest is stored next to each applied record for drift detection.
 * This class only produces it; policy lives with the caller.
 */
public final class ChecksumComputer {

    private static final String ALGORITHM = "SHA-256";

    private ChecksumComputer() {}

    public static String computeChecksum(byte[] rawContent) {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
        return HexFormat.of().formatHex(digest.digest(rawContent));
    }

    public static String computeChecksum(String content) {
        return computeChecksum(content.getBytes(StandardCharsets.UTF_8));
    }
}
