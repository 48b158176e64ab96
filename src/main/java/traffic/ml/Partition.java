package traffic.ml;

/**
 * Training, validation and combined (training + validation) slices of one parent series.
 * Training ends strictly before validation begins; an optional prefix of the parent is discarded.
 */
public final class Partition {

    private final Series training;
    private final Series validation;
    private final Series combined;
    private final int discardedPrefix;

    private Partition(Series training, Series validation, int discardedPrefix) {
        this.training = training;
        this.validation = validation;
        this.combined = validation == null ? training : training.concat(validation);
        this.discardedPrefix = discardedPrefix;
    }

    /**
     * Split {@code parent} as [discarded prefix | training | validation]; anything after the
     * validation slice is ignored.
     *
     * @param validationLength may be 0, in which case there is no validation slice
     */
    public static Partition split(Series parent, int discardedPrefix, int trainingLength, int validationLength) {
        if (discardedPrefix < 0 || trainingLength < 1 || validationLength < 0) {
            throw new IllegalArgumentException("prefix and validation length must be >= 0, training length >= 1");
        }
        int trainingEnd = discardedPrefix + trainingLength;
        int validationEnd = trainingEnd + validationLength;
        if (validationEnd > parent.length()) {
            throw new InsufficientDataException("partition needs " + validationEnd
                + " observations but the series has " + parent.length());
        }
        Series training = parent.slice(discardedPrefix, trainingEnd);
        Series validation = validationLength == 0 ? null : parent.slice(trainingEnd, validationEnd);
        return new Partition(training, validation, discardedPrefix);
    }

    /** The whole series is training data. */
    public static Partition trainingOnly(Series series) {
        return new Partition(series, null, 0);
    }

    public Series getTraining() { return training; }
    public Series getCombined() { return combined; }
    public int getDiscardedPrefix() { return discardedPrefix; }

    public boolean hasValidation() {
        return validation != null;
    }

    /** @throws IllegalStateException when the partition has no validation slice */
    public Series getValidation() {
        if (validation == null) throw new IllegalStateException("partition has no validation slice");
        return validation;
    }
}
