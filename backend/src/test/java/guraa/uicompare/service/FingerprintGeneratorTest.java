package guraa.uicompare.service;

import guraa.uicompare.model.ComparisonFingerprint;
import guraa.uicompare.model.ComparisonThresholds;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class FingerprintGeneratorTest {

    private static final String EMPTY_SHA256 = "e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855";

    private final FingerprintGenerator generator = new FingerprintGenerator();
    private final ComparisonThresholds defaults = ComparisonThresholds.defaults();

    @Test
    void hashesWithSha256Hex() {
        assertThat(generator.hash(new byte[0])).isEqualTo(EMPTY_SHA256);
        assertThat(generator.hash(null)).isEqualTo(EMPTY_SHA256);
        assertThat(generator.hash("abc".getBytes(StandardCharsets.UTF_8)))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    void sameContentGivesEqualFingerprints() {
        ComparisonFingerprint first = generator.fingerprint(new byte[]{1, 2}, new byte[]{3}, "{}", defaults);
        ComparisonFingerprint second = generator.fingerprint(new byte[]{1, 2}, new byte[]{3}, "{}", defaults);

        assertThat(first).isEqualTo(second).hasSameHashCodeAs(second);
        assertThat(first.toString()).startsWith(
                first.getRenderedImageHash() + "_" + first.getReferenceImageHash() + "_"
                        + first.getReferenceStructureHash());
        assertThat(first.getVisualThreshold()).isEqualTo(0.95);
        assertThat(first.getStructuralThreshold()).isEqualTo(0.90);
    }

    @Test
    void anyChangedInputChangesTheFingerprint() {
        ComparisonFingerprint base = generator.fingerprint(new byte[]{1}, new byte[]{2}, "{}", defaults);

        assertThat(generator.fingerprint(new byte[]{9}, new byte[]{2}, "{}", defaults)).isNotEqualTo(base);
        assertThat(generator.fingerprint(new byte[]{1}, new byte[]{9}, "{}", defaults)).isNotEqualTo(base);
        assertThat(generator.fingerprint(new byte[]{1}, new byte[]{2}, "{\"a\":1}", defaults)).isNotEqualTo(base);
    }

    @Test
    void thresholdsArePartOfTheFingerprint() {
        ComparisonFingerprint base = generator.fingerprint(new byte[]{1}, new byte[]{2}, "{}", defaults);

        assertThat(generator.fingerprint(new byte[]{1}, new byte[]{2}, "{}", new ComparisonThresholds(0.5, 0.90)))
                .isNotEqualTo(base);
        assertThat(generator.fingerprint(new byte[]{1}, new byte[]{2}, "{}", new ComparisonThresholds(0.95, 0.5)))
                .isNotEqualTo(base);
    }
}
