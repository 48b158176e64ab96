package traffic.ml;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PolynomialsTest {

    @Test
    public void testSeasonalProduct() {
        // (1 - 0.5B)(1 - 0.3B^2)
        double[] op = Polynomials.multiply(Polynomials.arOperator(new double[] {0.5}, 1),
            Polynomials.arOperator(new double[] {0.3}, 2));
        assertArrayEquals(new double[] {1, -0.5, -0.3, 0.15}, op, 1e-12);
        assertArrayEquals(new double[] {0.5, 0.3, -0.15}, Polynomials.arCoefficients(op), 1e-12);
        assertArrayEquals(new double[] {0, 0.4}, Polynomials.maCoefficients(
            Polynomials.maOperator(new double[] {0.4}, 2)), 1e-12);
    }

    @Test
    public void testStationarityRegion() {
        assertTrue(Polynomials.rootsOutsideUnitCircle(new double[] {0.5, 0.3}));
        assertFalse(Polynomials.rootsOutsideUnitCircle(new double[] {0.5, 0.6}));
        assertFalse(Polynomials.rootsOutsideUnitCircle(new double[] {1.0}));
        assertFalse(Polynomials.rootsOutsideUnitCircle(new double[] {0, 0, 0, 0, 0, 0, -1.02}));
        assertTrue(Polynomials.rootsOutsideUnitCircle(new double[] {0.9, 0, 0}));
        assertTrue(Polynomials.rootsOutsideUnitCircle(new double[0]));
    }

    @Test
    public void testInvertibility() {
        assertTrue(Polynomials.maInvertible(new double[] {-0.4}));
        assertFalse(Polynomials.maInvertible(new double[] {1.5}));
        assertFalse(Polynomials.maInvertible(new double[] {-1}));
    }

    @Test
    public void testMinRootModulus() {
        assertEquals(2, Polynomials.minRootModulus(new double[] {1, -0.5}), 1e-8);
        // 1 - 0.25 B^2 has roots ±2
        assertEquals(2, Polynomials.minRootModulus(new double[] {1, 0, -0.25, 0}), 1e-8);
        assertEquals(Double.POSITIVE_INFINITY, Polynomials.minRootModulus(new double[] {1, 0}));
    }

    @Test
    public void testMinRootModulusOnUnitCircleTerminates() {
        // (1 - B)(1 - B^7): double root at 1 plus the other seventh roots of unity
        double[] op = Polynomials.multiply(new double[] {1, -1}, new double[] {1, 0, 0, 0, 0, 0, 0, -1});
        double modulus = Polynomials.minRootModulus(op);
        assertTrue(Double.isNaN(modulus) || Math.abs(modulus - 1) < 1e-3, "modulus " + modulus);
    }

    @Test
    public void testInvertMaReflectsInsideRoots() {
        assertArrayEquals(new double[] {-0.5}, Polynomials.invertMa(new double[] {-2}), 1e-10);
        // 1 - 2.25z + 0.5z^2 = (1 - z/0.5)(1 - z/4) becomes (1 - z/2)(1 - z/4)
        assertArrayEquals(new double[] {-0.75, 0.125}, Polynomials.invertMa(new double[] {-2.25, 0.5}), 1e-8);
        double[] invertible = {0.4, 0.2};
        assertArrayEquals(invertible, Polynomials.invertMa(invertible), 0);
        assertTrue(Polynomials.maInvertible(Polynomials.invertMa(new double[] {0.5, 0, 0, 3})));
    }

    @Test
    public void testShrinkIntoRegion() {
        double[] phi = Polynomials.shrinkToStationary(new double[] {1.5, 0, 0.4});
        assertTrue(Polynomials.rootsOutsideUnitCircle(phi));
        assertEquals(0.0, phi[1]);
        double[] theta = Polynomials.shrinkToInvertible(new double[] {-1.0});
        assertTrue(Polynomials.maInvertible(theta));
        assertTrue(theta[0] < 0 && theta[0] > -1);
        assertArrayEquals(new double[] {0.3}, Polynomials.shrinkToStationary(new double[] {0.3}), 0);
    }
}
