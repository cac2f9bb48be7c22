package net.lsmc.montecarlo.assetderivativevaluation.products;

import net.lsmc.stochastic.RandomVariableInterface;

/**
 * The exercise value of an option as a function of the underlying.
 *
 * Implementations have to be pure, path-wise functions: the value on a path depends only on the
 * underlying on the same path, the result has the same number of paths as the argument and no state
 * is shared between calls. The function has to be defined for all real arguments, even if only
 * non-negative values of the underlying are economically relevant.
 */
@FunctionalInterface
public interface PayoffFunction {

	/**
	 * @param underlying The value of the underlying (cross-section over all paths).
	 * @return The exercise value on each path.
	 */
	RandomVariableInterface getValue(RandomVariableInterface underlying);
}
