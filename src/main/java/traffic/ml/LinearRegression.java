package traffic.ml;

import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Ordinary Least Squares (OLS) regression with an intercept.
 * <p>
 * Model: y = β₀ + β₁x₁ + ... + βₖxₖ, solved by the normal equation β = (X'X)⁻¹X'y
 * where X carries a leading column of 1s.
 */
public class LinearRegression {

    private final double[] coefficients;  // β₀, β₁, ..., βₖ
    private final double residualSumOfSquares;
    private final double rSquared;
    private final int n;

    /**
     * @param x design matrix (rows = observations, columns = regressors; no intercept column)
     * @param y response vector
     * @throws NumericalException when X'X is singular
     */
    public LinearRegression(double[][] x, double[] y) {
        if (x == null || y == null || x.length != y.length || x.length == 0) {
            throw new IllegalArgumentException("x and y must be non-null, same length, and non-empty");
        }
        n = x.length;
        int p = x[0].length + 1;
        double[][] design = new double[n][p];
        for (int i = 0; i < n; i++) {
            design[i][0] = 1.0;
            System.arraycopy(x[i], 0, design[i], 1, p - 1);
        }

        RealMatrix xm = MatrixUtils.createRealMatrix(design);
        RealMatrix xt = xm.transpose();
        DecompositionSolver solver = new LUDecomposition(xt.multiply(xm)).getSolver();
        if (!solver.isNonSingular()) {
            throw new NumericalException("design matrix X'X is singular");
        }
        RealVector yv = MatrixUtils.createRealVector(y);
        coefficients = solver.solve(xt.operate(yv)).toArray();

        double meanY = 0;
        for (double v : y) meanY += v;
        meanY /= n;
        double ssTot = 0;
        double ssRes = 0;
        for (int i = 0; i < n; i++) {
            double e = y[i] - predict(x[i]);
            ssTot += (y[i] - meanY) * (y[i] - meanY);
            ssRes += e * e;
        }
        residualSumOfSquares = ssRes;
        rSquared = ssTot > 0 ? 1.0 - ssRes / ssTot : 0;
    }

    /** Regression of y on its time index 0..n-1. */
    public static LinearRegression onTime(double[] y) {
        double[][] t = new double[y.length][1];
        for (int i = 0; i < y.length; i++) t[i][0] = i;
        return new LinearRegression(t, y);
    }

    public double getIntercept() {
        return coefficients[0];
    }

    /** Coefficient of regressor i (0-based). */
    public double getCoefficient(int i) {
        return coefficients[i + 1];
    }

    public double getResidualSumOfSquares() { return residualSumOfSquares; }
    public double getRSquared() { return rSquared; }
    public int getObservations() { return n; }

    public double predict(double[] x) {
        double y = coefficients[0];
        for (int i = 0; i < x.length; i++) {
            y += coefficients[i + 1] * x[i];
        }
        return y;
    }
}
