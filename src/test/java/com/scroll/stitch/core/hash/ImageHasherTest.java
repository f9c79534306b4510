package com.scroll.stitch.core.hash;

import com.scroll.stitch.core.image.ImageDecodeException;
import com.scroll.stitch.support.TestImages;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 整图哈希：确定性、位语义、参数校验和批量策略
 */
public class ImageHasherTest {

    private final ImageHasher hasher = new ImageHasher();

    @Test
    @DisplayName("Should produce the same hash for the same bytes with every algorithm")
    void hash_SameInput_IsDeterministic() {
        byte[] image = TestImages.strip(48).block(40, 96).toPng();

        for (HashAlgorithm algorithm : HashAlgorithm.values()) {
            long first = hasher.hash(image, algorithm, 8);
            long second = hasher.hash(image, algorithm, 8);
            assertThat(second).as(algorithm.getTag()).isEqualTo(first);
            assertThat(ImageHasher.hammingDistance(first, second)).isZero();
        }
    }

    @Test
    @DisplayName("Should keep the hash after a lossless re-encode")
    void hash_LosslessReencode_Unchanged() {
        byte[] image = TestImages.horizontalGradient(90, 16, false);
        byte[] again = TestImages.reencode(image);

        for (HashAlgorithm algorithm : HashAlgorithm.values()) {
            assertThat(hasher.hash(again, algorithm, 8))
                    .as(algorithm.getTag())
                    .isEqualTo(hasher.hash(image, algorithm, 8));
        }
    }

    @Test
    @DisplayName("dHash sets every bit when brightness increases left to right")
    void differenceHash_IncreasingGradient_AllBitsSet() {
        byte[] image = TestImages.horizontalGradient(90, 16, false);

        assertThat(hasher.differenceHash(image, 8)).isEqualTo(-1L);
        assertThat(hasher.differenceHash(TestImages.horizontalGradient(90, 16, true), 8)).isZero();
    }

    @Test
    @DisplayName("Uniform image gives dHash 0 and aHash with every bit set")
    void hash_UniformImage_KnownValues() {
        byte[] image = TestImages.solid(40, 30, 120, 120, 120);

        assertThat(hasher.differenceHash(image, 8)).isZero();
        assertThat(hasher.averageHash(image, 8)).isEqualTo(-1L);
        // 4x4 只用低 16 位
        assertThat(hasher.averageHash(image, 4)).isEqualTo(0xFFFFL);
    }

    @Test
    @DisplayName("pHash tells a gradient from its mirror image")
    void perceptualHash_MirroredGradient_Differs() {
        long forward = hasher.perceptualHash(TestImages.horizontalGradient(90, 16, false), 8);
        long mirrored = hasher.perceptualHash(TestImages.horizontalGradient(90, 16, true), 8);

        assertThat(ImageHasher.hammingDistance(forward, mirrored)).isPositive();
    }

    @Test
    @DisplayName("Larger pHash sizes are capped at 64 bits")
    void perceptualHash_LargeSize_Succeeds() {
        byte[] image = TestImages.horizontalGradient(90, 16, false);

        assertThat(hasher.perceptualHash(image, 16)).isEqualTo(hasher.perceptualHash(image, 16));
        assertThat(hasher.perceptualHash(image, 32)).isEqualTo(hasher.perceptualHash(image, 32));
    }

    @Test
    @DisplayName("Hamming distance and similarity follow the bit counts")
    void similarity_KnownPairs() {
        assertThat(ImageHasher.hammingDistance(0L, -1L)).isEqualTo(64);
        assertThat(ImageHasher.hammingDistance(0b1011L, 0b0001L)).isEqualTo(2);

        assertThat(ImageHasher.similarity(42L, 42L, 8)).isEqualTo(1.0);
        assertThat(ImageHasher.similarity(0L, -1L, 8)).isEqualTo(0.0);
        assertThat(ImageHasher.similarity(0L, 0xFFL, 8)).isEqualTo(1.0 - 8 / 64.0);
        assertThat(ImageHasher.similarity(0x5AL, 0x0FL, 8)).isEqualTo(ImageHasher.similarity(0x0FL, 0x5AL, 8));

        assertThatThrownBy(() -> ImageHasher.similarity(1L, 2L, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should reject hash sizes that do not fit the algorithm")
    void hash_InvalidSize_Throws() {
        byte[] image = TestImages.solid(16, 16, 10, 20, 30);

        assertThatThrownBy(() -> hasher.differenceHash(image, 9)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> hasher.averageHash(image, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> hasher.perceptualHash(image, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> hasher.perceptualHash(image, 33)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should fail with an image load error on undecodable bytes")
    void hash_Garbage_ThrowsDecodeError() {
        assertThatThrownBy(() -> hasher.differenceHash(TestImages.garbage(), 8))
                .isInstanceOf(ImageDecodeException.class)
                .hasMessageStartingWith("Failed to load");
        assertThatThrownBy(() -> hasher.averageHash(new byte[0], 8))
                .isInstanceOf(ImageDecodeException.class)
                .hasMessageContaining("empty buffer");
    }

    @Test
    @DisplayName("Should resolve tags case-insensitively and reject unknown ones")
    void fromTag_Resolution() {
        assertThat(HashAlgorithm.fromTag("dhash")).isEqualTo(HashAlgorithm.DHASH);
        assertThat(HashAlgorithm.fromTag(" PHash ")).isEqualTo(HashAlgorithm.PHASH);

        assertThatThrownBy(() -> HashAlgorithm.fromTag("whash"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown hash method: whash");
    }

    @Test
    @DisplayName("Batch results keep input order and match single-image hashes")
    void batchHash_AllValid_OrderedResults() {
        byte[] a = TestImages.strip(32).block(20, 0).toPng();
        byte[] b = TestImages.horizontalGradient(90, 16, false);
        byte[] c = TestImages.solid(20, 20, 200, 10, 10);

        List<HashOutcome> outcomes = hasher.batchHash(List.of(a, b, c), HashAlgorithm.DHASH, 8, BatchHashPolicy.STRICT);

        assertThat(outcomes).hasSize(3);
        assertThat(outcomes).allMatch(HashOutcome::isSuccess);
        assertThat(outcomes.get(0).getHash()).isEqualTo(hasher.differenceHash(a, 8));
        assertThat(outcomes.get(1).getHash()).isEqualTo(-1L);
        assertThat(outcomes.get(2).getIndex()).isEqualTo(2);
    }

    @Test
    @DisplayName("Strict batch reports the lowest failing index")
    void batchHash_Strict_ThrowsFirstFailure() {
        byte[] good = TestImages.solid(20, 20, 1, 2, 3);
        List<byte[]> images = List.of(good, TestImages.garbage(), good, new byte[0]);

        assertThatThrownBy(() -> hasher.batchHash(images, HashAlgorithm.AHASH, 8, BatchHashPolicy.STRICT))
                .isInstanceOf(ImageDecodeException.class)
                .hasMessageStartingWith("Image 1: Failed to load");
    }

    @Test
    @DisplayName("Lenient batch isolates failures with placeholder hashes")
    void batchHash_Lenient_PlaceholderForFailures() {
        byte[] good = TestImages.solid(20, 20, 1, 2, 3);
        List<byte[]> images = List.of(good, TestImages.garbage(), good, new byte[0]);

        List<HashOutcome> outcomes = hasher.batchHash(images, HashAlgorithm.AHASH, 8, BatchHashPolicy.LENIENT);

        assertThat(outcomes).extracting(HashOutcome::isSuccess).containsExactly(true, false, true, false);
        assertThat(outcomes.get(0).getHash()).isEqualTo(-1L);
        assertThat(outcomes.get(1).getHash()).isEqualTo(HashOutcome.PLACEHOLDER_HASH);
        assertThat(outcomes.get(1).getError()).startsWith("Failed to load");
        assertThat(outcomes.get(3).getError()).contains("empty buffer");
    }

    @Test
    @DisplayName("Batch edge cases")
    void batchHash_EdgeCases() {
        assertThat(hasher.batchHash(List.of(), HashAlgorithm.DHASH, 8, BatchHashPolicy.STRICT)).isEmpty();
        assertThatThrownBy(() -> hasher.batchHash(List.of(TestImages.garbage()), HashAlgorithm.DHASH, 12,
                BatchHashPolicy.LENIENT))
                .isInstanceOf(IllegalArgumentException.class);

        assertThat(BatchHashPolicy.fromName(null)).isEqualTo(BatchHashPolicy.STRICT);
        assertThat(BatchHashPolicy.fromName("Lenient")).isEqualTo(BatchHashPolicy.LENIENT);
        assertThatThrownBy(() -> BatchHashPolicy.fromName("best-effort"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
