package traffic.ml;

import java.util.Collections;
import java.util.Comparator;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Set of SARIMA coefficients fixed to exactly zero during estimation. Labels follow the
 * usual naming: {@code ar2}, {@code ma1}, {@code sar1}, {@code sma2}.
 */
public final class CoefficientMask {

    public enum Kind {
        AR("ar"), MA("ma"), SEASONAL_AR("sar"), SEASONAL_MA("sma");

        private final String prefix;

        Kind(String prefix) {
            this.prefix = prefix;
        }

        public String getPrefix() { return prefix; }
    }

    /** One coefficient position: kind plus 1-based lag within that polynomial. */
    public static final class Term {
        private final Kind kind;
        private final int lag;

        public Term(Kind kind, int lag) {
            if (lag < 1) throw new IllegalArgumentException("lag must be >= 1");
            this.kind = Objects.requireNonNull(kind);
            this.lag = lag;
        }

        /** Parse a label such as {@code sma2}. */
        public static Term parse(String label) {
            String s = label.trim().toLowerCase();
            // longest prefixes first so "sar" is not read as "ar"
            for (Kind kind : new Kind[] {Kind.SEASONAL_AR, Kind.SEASONAL_MA, Kind.AR, Kind.MA}) {
                if (s.startsWith(kind.prefix)) {
                    try {
                        return new Term(kind, Integer.parseInt(s.substring(kind.prefix.length())));
                    } catch (NumberFormatException e) {
                        break;
                    }
                }
            }
            throw new IllegalArgumentException("unrecognized coefficient label: " + label);
        }

        public Kind getKind() { return kind; }
        public int getLag() { return lag; }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Term)) return false;
            Term t = (Term) o;
            return kind == t.kind && lag == t.lag;
        }

        @Override
        public int hashCode() {
            return Objects.hash(kind, lag);
        }

        @Override
        public String toString() {
            return kind.prefix + lag;
        }
    }

    private static final Comparator<Term> ORDER =
        Comparator.comparing(Term::getKind).thenComparingInt(Term::getLag);

    private static final CoefficientMask NONE = new CoefficientMask(Collections.emptySet());

    private final Set<Term> fixed;

    private CoefficientMask(Set<Term> fixed) {
        TreeSet<Term> sorted = new TreeSet<>(ORDER);
        sorted.addAll(fixed);
        this.fixed = Collections.unmodifiableSet(sorted);
    }

    public static CoefficientMask none() {
        return NONE;
    }

    public static CoefficientMask of(Set<Term> fixed) {
        return fixed.isEmpty() ? NONE : new CoefficientMask(fixed);
    }

    public static CoefficientMask ofLabels(String... labels) {
        Set<Term> terms = new TreeSet<>(ORDER);
        for (String label : labels) terms.add(Term.parse(label));
        return of(terms);
    }

    public boolean isFixed(Kind kind, int lag) {
        return fixed.contains(new Term(kind, lag));
    }

    public boolean isEmpty() {
        return fixed.isEmpty();
    }

    public int size() {
        return fixed.size();
    }

    public Set<Term> getFixed() { return fixed; }

    @Override
    public boolean equals(Object o) {
        return o instanceof CoefficientMask && fixed.equals(((CoefficientMask) o).fixed);
    }

    @Override
    public int hashCode() {
        return fixed.hashCode();
    }

    @Override
    public String toString() {
        return fixed.stream().map(Term::toString).collect(Collectors.joining(",", "{", "}"));
    }
}
