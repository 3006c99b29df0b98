/**
 * Gelato
 * TiedParameterValidator.java
 *
 * Galaxy/AGN Emission Line Analysis TOol: tied multi-component emission line
 * models for astronomical spectra.
 *
 */

package gelato;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.fitting.leastsquares.ParameterValidator;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.FastMath;

/**
 * Keeps an optimizer's trial point consistent with a composite model: every
 * parameter is clamped into its component's bounds, then every tied
 * parameter is overwritten from its tie function.
 */
public class TiedParameterValidator implements ParameterValidator {

	private final CompositeModel model;
	private final double[] lower;
	private final double[] upper;

	public TiedParameterValidator(final CompositeModel model) {
		this.model = model;
		this.lower = model.getLowerBounds();
		this.upper = model.getUpperBounds();
	}

	@Override
	public RealVector validate(final RealVector params) {
		if (params.getDimension() != lower.length) {
			throw new DimensionMismatchException(params.getDimension(),
				lower.length);
		}
		final double[] p = params.toArray();
		for (int i = 0; i < p.length; i++)
			p[i] = FastMath.max(lower[i], FastMath.min(upper[i], p[i]));
		model.applyTies(p);
		return new ArrayRealVector(p, false);
	}
}
