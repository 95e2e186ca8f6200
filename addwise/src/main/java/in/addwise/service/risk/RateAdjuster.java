package in.addwise.service.risk;

import in.addwise.domain.model.Candidate;

/**
 * One multiplicative adjustment to a candidate's negative-event rate.
 *
 * Implementations are pure: same rate and candidate, same result. The
 * calculator applies its adjusters in registration order.
 */
@FunctionalInterface
public interface RateAdjuster {

    /**
     * @param ratePer9  rate after the previous adjusters
     * @param candidate candidate being assessed
     * @return adjusted rate per 9
     */
    double adjust(double ratePer9, Candidate candidate);
}
