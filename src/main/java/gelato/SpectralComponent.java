/**
 * Gelato
 * SpectralComponent.java
 *
 * Galaxy/AGN Emission Line Analysis TOol: tied multi-component emission line
 * models for astronomical spectra.
 *
 */

package gelato;

import org.apache.commons.math3.analysis.ParametricUnivariateFunction;
import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.NullArgumentException;
import org.apache.commons.math3.exception.NumberIsTooLargeException;
import org.apache.commons.math3.util.FastMath;

/**
 * One fittable piece of a spectral model. A component declares its canonical
 * (unqualified) parameter names, an initial guess and the bounds of each
 * parameter; the values themselves live in the composite model that owns the
 * component and are passed in on evaluation, in the declared order.
 */
public abstract class SpectralComponent implements
	ParametricUnivariateFunction
{

	/** Speed of light, km/s. */
	public static final double C = 299792.458;
	static final double SQRT2PI = FastMath.sqrt(2 * FastMath.PI);

	private final String[] paramNames;
	private final double[] initial;
	private final double[] lower;
	private final double[] upper;

	protected SpectralComponent(final String[] paramNames,
		final double[] initial, final double[] lower, final double[] upper)
	{
		final int n = paramNames.length;
		if (initial.length != n) throw new DimensionMismatchException(
			initial.length, n);
		if (lower.length != n) throw new DimensionMismatchException(lower.length,
			n);
		if (upper.length != n) throw new DimensionMismatchException(upper.length,
			n);
		for (int i = 0; i < n; i++) {
			if (lower[i] > upper[i]) {
				throw new NumberIsTooLargeException(lower[i], upper[i], true);
			}
		}
		this.paramNames = paramNames.clone();
		this.initial = initial.clone();
		this.lower = lower.clone();
		this.upper = upper.clone();
	}

	/**
	 * Canonical parameter names, in the order the parameters are passed to
	 * {@link #value(double, double...)}.
	 */
	public String[] getParamNames() {
		return paramNames.clone();
	}

	public int getParameterCount() {
		return paramNames.length;
	}

	/**
	 * @return position of {@code role} in the declared names, or -1
	 */
	public int indexOf(final String role) {
		for (int i = 0; i < paramNames.length; i++) {
			if (paramNames[i].equals(role)) return i;
		}
		return -1;
	}

	public double[] getInitialParameters() {
		return initial.clone();
	}

	public double[] getLowerBounds() {
		return lower.clone();
	}

	public double[] getUpperBounds() {
		return upper.clone();
	}

	/**
	 * Value at {@code x} using the initial guess.
	 */
	public double value(final double x) {
		return value(x, initial);
	}

	protected void checkParameters(final double[] param) {
		if (param == null) {
			throw new NullArgumentException();
		}
		if (param.length != paramNames.length) {
			throw new DimensionMismatchException(param.length, paramNames.length);
		}
	}
}
