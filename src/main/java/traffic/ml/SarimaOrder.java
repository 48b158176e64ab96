package traffic.ml;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * SARIMA(p,d,q)(P,D,Q)s structure plus the coefficients fixed to zero.
 * <p>
 * Model: φ(B)Φ(B^s) ∇^d ∇_s^D y_t = θ(B)Θ(B^s) ε_t
 * <p>
 * Coefficient vectors are laid out as [ar1..arp, ma1..maq, sar1..sarP, sma1..smaQ].
 */
public final class SarimaOrder {

    private final int p, d, q, P, D, Q, s;
    private final CoefficientMask mask;

    public SarimaOrder(int p, int d, int q, int P, int D, int Q, int s, CoefficientMask mask) {
        if (p < 0 || d < 0 || q < 0 || P < 0 || D < 0 || Q < 0) {
            throw new IllegalArgumentException("orders must be non-negative");
        }
        if ((P > 0 || D > 0 || Q > 0) && s < 2) {
            throw new IllegalArgumentException("seasonal terms need a seasonal period >= 2, got " + s);
        }
        this.p = p;
        this.d = d;
        this.q = q;
        this.P = P;
        this.D = D;
        this.Q = Q;
        this.s = s;
        this.mask = mask == null ? CoefficientMask.none() : mask;
        for (CoefficientMask.Term term : this.mask.getFixed()) {
            if (term.getLag() > orderOf(term.getKind())) {
                throw new IllegalArgumentException("masked coefficient " + term + " is outside " + this);
            }
        }
    }

    public SarimaOrder(int p, int d, int q, int P, int D, int Q, int s) {
        this(p, d, q, P, D, Q, s, CoefficientMask.none());
    }

    public SarimaOrder withMask(CoefficientMask newMask) {
        return new SarimaOrder(p, d, q, P, D, Q, s, newMask);
    }

    public int getP() { return p; }
    public int getD() { return d; }
    public int getQ() { return q; }
    public int getSeasonalP() { return P; }
    public int getSeasonalD() { return D; }
    public int getSeasonalQ() { return Q; }
    public int getSeasonLength() { return s; }
    public CoefficientMask getMask() { return mask; }

    public int orderOf(CoefficientMask.Kind kind) {
        switch (kind) {
            case AR: return p;
            case MA: return q;
            case SEASONAL_AR: return P;
            default: return Q;
        }
    }

    /** Total coefficient positions, masked ones included. */
    public int coefficientCount() {
        return p + q + P + Q;
    }

    /** Coefficients left for the optimizer. */
    public int freeCoefficientCount() {
        return coefficientCount() - mask.size();
    }

    /** Observations consumed by the integration part. */
    public int differencingLag() {
        return d + D * s;
    }

    /** Coefficient terms in vector order. */
    public List<CoefficientMask.Term> terms() {
        List<CoefficientMask.Term> terms = new ArrayList<>(coefficientCount());
        for (CoefficientMask.Kind kind : CoefficientMask.Kind.values()) {
            for (int lag = 1; lag <= orderOf(kind); lag++) terms.add(new CoefficientMask.Term(kind, lag));
        }
        return terms;
    }

    /** Positions (in vector order) of the coefficients that are estimated. */
    public int[] freeIndices() {
        List<CoefficientMask.Term> terms = terms();
        int[] idx = new int[freeCoefficientCount()];
        int k = 0;
        for (int i = 0; i < terms.size(); i++) {
            CoefficientMask.Term t = terms.get(i);
            if (!mask.isFixed(t.getKind(), t.getLag())) idx[k++] = i;
        }
        return idx;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SarimaOrder)) return false;
        SarimaOrder that = (SarimaOrder) o;
        return p == that.p && d == that.d && q == that.q && P == that.P && D == that.D && Q == that.Q
            && s == that.s && mask.equals(that.mask);
    }

    @Override
    public int hashCode() {
        return Objects.hash(p, d, q, P, D, Q, s, mask);
    }

    @Override
    public String toString() {
        String base = String.format("SARIMA(%d,%d,%d)(%d,%d,%d)%d", p, d, q, P, D, Q, s);
        return mask.isEmpty() ? base : base + " fixed=" + mask;
    }
}
