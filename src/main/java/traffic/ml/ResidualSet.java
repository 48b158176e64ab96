package traffic.ml;

/**
 * One-step prediction errors of a fitted model against its own training series.
 * <p>
 * Indexed like the training series: the first {@link #getOffset()} observations are consumed
 * by differencing and have no residual.
 */
public final class ResidualSet {

    private final double[] values;
    private final int offset;
    private final int trainingLength;

    ResidualSet(double[] values, int offset, int trainingLength) {
        if (values.length + offset != trainingLength) {
            throw new IllegalArgumentException("residual count " + values.length + " + offset " + offset
                + " does not match training length " + trainingLength);
        }
        this.values = values.clone();
        this.offset = offset;
        this.trainingLength = trainingLength;
    }

    /** First training index that carries a residual. */
    public int getOffset() { return offset; }

    public int getTrainingLength() { return trainingLength; }

    public int size() {
        return values.length;
    }

    public boolean has(int trainingIndex) {
        return trainingIndex >= offset && trainingIndex < trainingLength;
    }

    /** Residual at a training-series index. */
    public double get(int trainingIndex) {
        if (!has(trainingIndex)) {
            throw new IndexOutOfBoundsException("no residual at training index " + trainingIndex
                + " (valid range " + offset + ".." + (trainingLength - 1) + ")");
        }
        return values[trainingIndex - offset];
    }

    /** Residuals in time order, without the consumed prefix. */
    public double[] values() {
        return values.clone();
    }

    public double[] squared() {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) out[i] = values[i] * values[i];
        return out;
    }
}
