package traffic.ml;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PartitionTest {

    private final Series parent = Series.of(1, 2, 3, 4, 5, 6, 7, 8, 9, 10);

    @Test
    public void testSplitOrdersSlices() {
        Partition p = Partition.split(parent, 2, 5, 2);
        assertArrayEquals(new double[] {3, 4, 5, 6, 7}, p.getTraining().values());
        assertArrayEquals(new double[] {8, 9}, p.getValidation().values());
        assertArrayEquals(new double[] {3, 4, 5, 6, 7, 8, 9}, p.getCombined().values());
        assertEquals(2, p.getDiscardedPrefix());
        assertTrue(p.hasValidation());
    }

    @Test
    public void testNoValidation() {
        Partition p = Partition.split(parent, 0, 10, 0);
        assertFalse(p.hasValidation());
        assertEquals(p.getTraining(), p.getCombined());
        assertThrows(IllegalStateException.class, p::getValidation);
        assertFalse(Partition.trainingOnly(parent).hasValidation());
    }

    @Test
    public void testTooLong() {
        assertThrows(InsufficientDataException.class, () -> Partition.split(parent, 1, 8, 2));
        assertThrows(IllegalArgumentException.class, () -> Partition.split(parent, -1, 5, 0));
    }
}
