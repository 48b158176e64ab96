package traffic.ml.stats;

/**
 * Picks the autoregressive order of a series by AIC over Yule-Walker fits of order
 * 0..min(n - 1, ⌊10 log10 n⌋). White noise should select order 0.
 */
public final class ArOrderSelection {

    private final int selectedOrder;
    private final double[] aic;

    private ArOrderSelection(int selectedOrder, double[] aic) {
        this.selectedOrder = selectedOrder;
        this.aic = aic;
    }

    public static ArOrderSelection select(double[] x) {
        int n = x.length;
        int maxOrder = Math.min(n - 1, (int) Math.floor(10 * Math.log10(n)));
        double[] aic = new double[maxOrder + 1];
        if (maxOrder < 1) return new ArOrderSelection(0, aic);
        Autocorrelation.Levinson lev = Autocorrelation.levinson(Autocorrelation.acf(x, maxOrder));
        int best = 0;
        for (int k = 0; k <= maxOrder; k++) {
            // relative variances suffice: the γ(0) factor shifts every AIC equally
            aic[k] = n * Math.log(lev.variance[k]) + 2 * k;
            if (aic[k] < aic[best]) best = k;
        }
        return new ArOrderSelection(best, aic);
    }

    public int getSelectedOrder() { return selectedOrder; }

    public int getMaxOrder() {
        return aic.length - 1;
    }

    /** AIC of each candidate order. */
    public double[] getAic() {
        return aic.clone();
    }
}
