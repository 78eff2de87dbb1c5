package org.boole.minimization;

import java.util.List;
import java.util.logging.Logger;

/**
 * Quine-McCluskey: implicanti primi, poi essenziali, poi copertura greedy dei
 * mintermini rimasti.
 */
public class QuineMcCluskeyMinimizer implements Minimizer {

    private static final Logger LOGGER = Logger.getLogger(QuineMcCluskeyMinimizer.class.getName());

    @Override
    public MinimizationAlgorithm algorithm() {
        return MinimizationAlgorithm.QUINE_MCCLUSKEY;
    }

    @Override
    public List<Implicant> cover(List<Integer> minterms, int variableCount) {
        List<Implicant> primes = PrimeImplicantGenerator.generate(minterms, variableCount);
        List<Implicant> essentials = PrimeImplicantGenerator.essentials(primes, minterms);
        LOGGER.fine("Quine-McCluskey: " + primes.size() + " primi, " + essentials.size() + " essenziali");
        return GreedyCoverSelector.select(primes, essentials, minterms);
    }
}
