package org.carma.deception.mechanism;

import org.carma.deception.model.*;

/**
 * Computes an approximate equilibrium of the deception-jamming game.
 *
 * Implementations must be stateless: one call is a pure function of its parameters
 * (and seed), so sweeps may call the same instance from many threads.
 */
public interface EquilibriumEngine {

    /**
     * Validate the parameters and run the game to a fixed point or the iteration cap.
     *
     * @throws org.carma.deception.safety.InvalidParametersException if validation fails;
     *         no iteration is performed in that case
     */
    EquilibriumResult solve(EquilibriumParams params);
}
