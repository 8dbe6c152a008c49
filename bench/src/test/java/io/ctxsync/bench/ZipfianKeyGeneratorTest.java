package io.ctxsync.bench;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.SplittableRandom;

import static org.junit.jupiter.api.Assertions.*;

class ZipfianKeyGeneratorTest {

    @Test
    void ids_stay_in_range_and_favour_the_head() {
        ZipfianKeyGenerator zipf = new ZipfianKeyGenerator(1000, 0.99);
        SplittableRandom rnd = new SplittableRandom(1L);

        int head = 0;
        for (int i = 0; i < 20_000; i++) {
            int k = zipf.next(rnd);
            assertTrue(k >= 0 && k < 1000);
            if (k < 100) head++;
        }
        // the 10% hottest ids carry roughly two thirds of the mass at skew 0.99
        double expected = zipf.headMass(100);
        assertEquals(expected, head / 20_000.0, 0.03);
        assertTrue(expected > 0.6);
    }

    @Test
    void head_mass_is_a_cdf() {
        ZipfianKeyGenerator zipf = new ZipfianKeyGenerator(10, 1.0);

        assertEquals(0.0, zipf.headMass(0));
        assertEquals(1.0, zipf.headMass(10));
        assertEquals(1.0, zipf.headMass(50));
        assertTrue(zipf.headMass(1) > zipf.headMass(2) - zipf.headMass(1));
    }

    @Test
    void rejects_bad_parameters() {
        assertThrows(IllegalArgumentException.class, () -> new ZipfianKeyGenerator(0, 1.0));
        assertThrows(IllegalArgumentException.class, () -> new ZipfianKeyGenerator(10, 0.0));
    }

    @Test
    void percentile_interpolates_between_samples() {
        assertEquals(2.5, CacheHitRateBench.percentile(List.of(1.0, 2.0, 3.0, 4.0), 0.5), 1e-9);
        assertTrue(Double.isNaN(CacheHitRateBench.percentile(List.of(), 0.5)));
    }
}
