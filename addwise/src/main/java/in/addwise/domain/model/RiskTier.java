package in.addwise.domain.model;

/**
 * Ordered risk classification, safest first.
 *
 * NO_GO is a hard filter: the optimizer treats it as infeasible, not as a
 * low score. It is still reported so a human can override it.
 */
public enum RiskTier {
    ELITE,      // < 5% disaster probability
    SAFE,       // 5-10%
    MODERATE,   // 10-15%
    RISKY,      // 15-25%
    DANGEROUS,  // > 25%
    NO_GO;      // hard filtered

    public boolean isSelectable() {
        return this != NO_GO;
    }

    public boolean isSaferThan(RiskTier other) {
        return this.ordinal() < other.ordinal();
    }
}
