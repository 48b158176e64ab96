package traffic.ml;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class TransformSpecTest {

    @Test
    public void testRoundTrip() {
        double[] xs = {0.01, 0.5, 1, 3, 250, 12000};
        TransformSpec[] specs = {TransformSpec.log(), TransformSpec.power(0), TransformSpec.power(0.5),
            TransformSpec.power(-1.3), TransformSpec.power(2)};
        for (TransformSpec spec : specs) {
            for (double x : xs) {
                assertEquals(x, spec.inverse(spec.apply(x)), 1e-9 * Math.max(1, x), spec + " at " + x);
            }
        }
    }

    @Test
    public void testPowerZeroIsLog() {
        assertEquals(Math.log(42), TransformSpec.power(0).apply(42), 1e-12);
        assertEquals(0, TransformSpec.log().getLambda());
        assertEquals(TransformSpec.Family.LOG, TransformSpec.log().getFamily());
    }

    @Test
    public void testDomainErrors() {
        assertThrows(DomainException.class, () -> TransformSpec.power(0.5).apply(0));
        assertThrows(DomainException.class, () -> TransformSpec.log().apply(-1));
        assertThrows(DomainException.class, () -> TransformSpec.power(0.5).apply(Series.of(3, -2)));
        // y·λ + 1 < 0
        assertThrows(DomainException.class, () -> TransformSpec.power(0.5).inverse(-3));
        assertThrows(DomainException.class, () -> TransformSpec.power(-1).inverse(1));
        assertEquals(0, TransformSpec.power(0.5).inverse(-2), 1e-12);
    }
}
