package network.compose.twopc.sim.internal.time;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class DurationRangeTest {

    @Test
    void samplesStayInsideBounds() {
        DurationRange range = DurationRange.ofMillis(500, 1_500);
        Random random = new Random(7);
        for (int i = 0; i < 1_000; i++) {
            Duration d = range.sample(random);
            assertTrue(d.compareTo(range.min()) >= 0 && d.compareTo(range.max()) <= 0, d.toString());
        }
    }

    @Test
    void fixedRangeAlwaysReturnsItsValue() {
        DurationRange range = DurationRange.fixed(Duration.ofMillis(250));
        assertEquals(Duration.ofMillis(250), range.sample(new Random()));
    }

    @Test
    void rejectsInvertedOrNegativeBounds() {
        assertThrows(IllegalArgumentException.class, () -> DurationRange.ofMillis(10, 5));
        assertThrows(IllegalArgumentException.class, () -> DurationRange.ofMillis(-1, 5));
    }
}
