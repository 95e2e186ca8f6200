package in.addwise.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PosteriorBeliefTest {

    @Test
    void testPriorOnly() {
        PosteriorBelief belief = PosteriorBelief.prior(15.0, 49.0);

        assertEquals(15.0, belief.posteriorMean());
        assertEquals(49.0, belief.posteriorVariance());
        assertEquals(7.0, belief.posteriorStdDev(), 1e-12);
    }

    @Test
    void testRunningMean() {
        PosteriorBelief belief = PosteriorBelief.prior(0.0, 1e9)
            .withObservation(10.0)
            .withObservation(20.0)
            .withObservation(30.0);

        assertEquals(20.0, belief.observedMean(), 1e-12);
        assertEquals(20.0, belief.posteriorMean(), 1e-3, "Flat prior converges on the sample mean");
    }

    @Test
    void testRecentredPriorKeepsObservations() {
        PosteriorBelief belief = PosteriorBelief.prior(15.0, 100.0, 100.0).withObservation(25.0);

        PosteriorBelief moved = belief.withPriorMean(5.0);

        assertEquals(20.0, belief.posteriorMean(), 1e-12);
        assertEquals(15.0, moved.posteriorMean(), 1e-12, "Equal precisions: halfway between 5 and 25");
        assertEquals(belief.posteriorVariance(), moved.posteriorVariance(), 1e-12);
        assertEquals(9.0, PosteriorBelief.prior(15.0, 100.0).withPriorMean(9.0).posteriorMean());
    }

    @Test
    void testRejectsNonPositiveVariance() {
        assertThrows(IllegalArgumentException.class, () -> PosteriorBelief.prior(10.0, 0.0));
        assertThrows(IllegalArgumentException.class, () -> PosteriorBelief.prior(10.0, 4.0, -1.0));
    }
}
