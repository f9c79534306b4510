package com.scroll.stitch.core.hash;

import com.scroll.stitch.core.image.ImageCodec;
import com.scroll.stitch.core.image.ImageDecodeException;
import com.scroll.stitch.support.TestImages;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.opencv.core.Mat;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class RowHasherTest {

    private final RowHasher rowHasher = new RowHasher();

    @Test
    @DisplayName("Should return one fingerprint per row, top to bottom")
    void rowFingerprints_RowCountAndOrder() {
        byte[] image = TestImages.strip(64).block(37, 40).toPng();

        long[] hashes = rowHasher.rowFingerprints(image, RowHasher.DEFAULT_IGNORE_RIGHT_PIXELS);

        assertThat(hashes).hasSize(37);
        int[] rgb = TestImages.color(5, 40);
        assertThat(hashes[5]).isEqualTo(RowHasher.mix(rgb[0], rgb[1], rgb[2]));
        assertThat(hashes[0]).isNotEqualTo(hashes[1]);
    }

    @Test
    @DisplayName("Identical rows give identical fingerprints")
    void rowFingerprints_IdenticalRows_Equal() {
        byte[] image = TestImages.strip(50).uniform(3, 64, 128, 192).block(2, 0).uniform(1, 64, 128, 192).toPng();

        long[] hashes = rowHasher.rowFingerprints(image, 0);

        assertThat(hashes[0]).isEqualTo(hashes[1]).isEqualTo(hashes[2]).isEqualTo(hashes[5]);
        assertThat(hashes[0]).isEqualTo(64L * 73856093L + 128L * 19349663L + 192L * 83492791L);
    }

    @Test
    @DisplayName("Channel means inside the same multiple of 8 quantize to the same fingerprint")
    void rowFingerprints_SmallNoise_Absorbed() {
        long[] low = rowHasher.rowFingerprints(TestImages.solid(30, 2, 16, 96, 200), 0);
        long[] high = rowHasher.rowFingerprints(TestImages.solid(30, 2, 23, 103, 207), 0);
        long[] next = rowHasher.rowFingerprints(TestImages.solid(30, 2, 24, 96, 200), 0);

        assertThat(high).containsExactly(low);
        assertThat(next[0]).isNotEqualTo(low[0]);

        assertThat(RowHasher.quantize(0)).isZero();
        assertThat(RowHasher.quantize(7)).isZero();
        assertThat(RowHasher.quantize(8)).isEqualTo(8);
        assertThat(RowHasher.quantize(255)).isEqualTo(248);
    }

    @Test
    @DisplayName("Scrollbar columns on the right are excluded")
    void rowFingerprints_IgnoreRightPixels_ExcludesScrollbar() {
        byte[] light = TestImages.strip(80).block(12, 0).scrollbar(20, 240).toPng();
        byte[] dark = TestImages.strip(80).block(12, 0).scrollbar(20, 16).toPng();

        assertThat(rowHasher.rowFingerprints(light, 20)).containsExactly(rowHasher.rowFingerprints(dark, 20));
        assertThat(rowHasher.rowFingerprints(light, 0)[0]).isNotEqualTo(rowHasher.rowFingerprints(dark, 0)[0]);
    }

    @Test
    @DisplayName("Images narrower than the ignored width use every column")
    void effectiveWidth_EdgeCases() {
        assertThat(RowHasher.effectiveWidth(100, 20)).isEqualTo(80);
        assertThat(RowHasher.effectiveWidth(100, 0)).isEqualTo(100);
        assertThat(RowHasher.effectiveWidth(20, 20)).isEqualTo(20);
        assertThat(RowHasher.effectiveWidth(10, 20)).isEqualTo(10);
        assertThat(RowHasher.effectiveWidth(21, 20)).isEqualTo(1);

        byte[] narrow = TestImages.solid(10, 4, 80, 80, 80);
        assertThat(rowHasher.rowFingerprints(narrow, 20)).containsExactly(rowHasher.rowFingerprints(narrow, 0));
    }

    @Test
    @DisplayName("Sub-views of a decoded image hash like the matching region of the full image")
    void rowFingerprints_NonContinuousView_MatchesFullImage() {
        byte[] image = TestImages.strip(80).block(40, 0).scrollbar(20, 200).toPng();
        long[] full = rowHasher.rowFingerprints(image, 20);

        Mat bgra = ImageCodec.decodeBgra(image);
        Mat columns = bgra.colRange(0, 60);
        Mat rows = bgra.rowRange(10, 25);
        try {
            assertThat(columns.isContinuous()).isFalse();
            assertThat(rowHasher.rowFingerprints(columns, 0)).containsExactly(full);
            assertThat(rowHasher.rowFingerprints(rows, 20)).containsExactly(Arrays.copyOfRange(full, 10, 25));
        } finally {
            columns.release();
            rows.release();
            bgra.release();
        }
    }

    @Test
    @DisplayName("Should fail on undecodable bytes")
    void rowFingerprints_Garbage_Throws() {
        assertThatThrownBy(() -> rowHasher.rowFingerprints(TestImages.garbage(), 20))
                .isInstanceOf(ImageDecodeException.class);
    }
}
