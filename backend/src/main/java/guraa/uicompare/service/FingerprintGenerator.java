package guraa.uicompare.service;

import guraa.uicompare.model.ComparisonFingerprint;
import guraa.uicompare.model.ComparisonThresholds;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Derives cache fingerprints from the content of the compared inputs.
 */
@Component
public class FingerprintGenerator {

    private static final String ALGORITHM = "SHA-256";

    /**
     * @param renderedImage The rendered image bytes
     * @param referenceImage The reference image bytes
     * @param referenceDocument The raw reference node document
     * @param thresholds The thresholds the verdict is judged against
     * @return The fingerprint of the three inputs under those thresholds
     */
    public ComparisonFingerprint fingerprint(byte[] renderedImage, byte[] referenceImage, String referenceDocument,
                                             ComparisonThresholds thresholds) {
        return new ComparisonFingerprint(
                hash(renderedImage),
                hash(referenceImage),
                hash(referenceDocument != null ? referenceDocument.getBytes(StandardCharsets.UTF_8) : null),
                thresholds.getVisualThreshold(),
                thresholds.getStructuralThreshold());
    }

    /**
     * Hex SHA-256 digest of some bytes; null hashes like an empty array.
     */
    public String hash(byte[] data) {
        MessageDigest md;
        try {
            md = MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " is not available", e);
        }

        byte[] digest = md.digest(data != null ? data : new byte[0]);

        StringBuilder sb = new StringBuilder(digest.length * 2);
        for (byte b : digest) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}
