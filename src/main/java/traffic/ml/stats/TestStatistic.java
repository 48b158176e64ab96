package traffic.ml.stats;

/**
 * Outcome of a hypothesis test: statistic, p-value and degrees of freedom (0 when not applicable).
 */
public final class TestStatistic {

    private final String name;
    private final double statistic;
    private final double pValue;
    private final int degreesOfFreedom;

    public TestStatistic(String name, double statistic, double pValue, int degreesOfFreedom) {
        this.name = name;
        this.statistic = statistic;
        this.pValue = pValue;
        this.degreesOfFreedom = degreesOfFreedom;
    }

    public String getName() { return name; }
    public double getStatistic() { return statistic; }
    public double getPValue() { return pValue; }
    public int getDegreesOfFreedom() { return degreesOfFreedom; }

    /** Whether the null hypothesis is rejected at the given level. */
    public boolean rejects(double significanceLevel) {
        return pValue < significanceLevel;
    }

    @Override
    public String toString() {
        return String.format("%s: statistic=%.4f, p=%.4g, df=%d", name, statistic, pValue, degreesOfFreedom);
    }
}
