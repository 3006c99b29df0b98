/**
 * Gelato
 * Continuum.java
 *
 * Galaxy/AGN Emission Line Analysis TOol: tied multi-component emission line
 * models for astronomical spectra.
 *
 */

package gelato;

import java.util.Arrays;

import org.apache.commons.lang3.ArrayUtils;
import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;
import org.apache.commons.math3.exception.NotStrictlyPositiveException;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.stat.descriptive.rank.Median;

/**
 * Polynomial continuum over one fitting region, in rest-frame wavelength
 * measured from the region's pivot. Parameters: Redshift, then the polynomial
 * coefficients {@code Coefficient0 .. CoefficientN}.
 */
public class Continuum extends SpectralComponent {

	static final String COEFFICIENT = "Coefficient";

	private final double pivot; // rest frame

	Continuum(final double pivot, final double[] initial, final double[] lower,
		final double[] upper)
	{
		super(paramNames(initial.length - 1), initial, lower, upper);
		if (pivot <= 0) throw new NotStrictlyPositiveException(pivot);
		this.pivot = pivot;
	}

	private static String[] paramNames(final int nCoeffs) {
		final String[] names = new String[nCoeffs + 1];
		names[0] = ParameterName.REDSHIFT;
		for (int i = 0; i < nCoeffs; i++)
			names[i + 1] = COEFFICIENT + i;
		return names;
	}

	/**
	 * Continuum over {@code region} (observed frame), starting flat at the
	 * median flux of the region.
	 */
	public static Continuum create(final double[] region,
		final Spectrum spectrum)
	{
		spectrum.requireData();
		final ModelSettings s = spectrum.getSettings();
		final double z = spectrum.getRedshift();
		final double dz = s.getRedshiftTolerance();
		final int deg = s.getContinuumDegree();

		final RealVector inside = spectrum.fluxInside(region[0], region[1]);
		final double level = inside.getDimension() == 0 ? 0.0 : new Median()
			.evaluate(inside.toArray());

		final double[] coeffs = new double[deg + 1];
		coeffs[0] = level;
		final double[] lowC = new double[deg + 1];
		final double[] highC = new double[deg + 1];
		Arrays.fill(lowC, Double.NEGATIVE_INFINITY);
		Arrays.fill(highC, Double.POSITIVE_INFINITY);

		final double pivot = (region[0] + region[1]) / 2 / (1 + z);
		return new Continuum(pivot, ArrayUtils.addAll(new double[] { z }, coeffs),
			ArrayUtils.addAll(new double[] { z - dz }, lowC), ArrayUtils.addAll(
				new double[] { z + dz }, highC));
	}

	public double getPivot() {
		return pivot;
	}

	public int getDegree() {
		return getParameterCount() - 2;
	}

	@Override
	public double value(final double x, final double... param) {
		checkParameters(param);
		final double t = x / (1 + param[0]) - pivot;
		return new PolynomialFunction(ArrayUtils.subarray(param, 1, param.length))
			.value(t);
	}

	/**
	 * Partial derivatives with respect to Redshift and each coefficient.
	 */
	@Override
	public double[] gradient(final double x, final double... param) {
		checkParameters(param);
		final double[] coeffs = ArrayUtils.subarray(param, 1, param.length);
		final double t = x / (1 + param[0]) - pivot;
		final double dT = -x / ((1 + param[0]) * (1 + param[0]));
		final double dZ = new PolynomialFunction(coeffs).polynomialDerivative()
			.value(t) * dT;
		return ArrayUtils.addAll(new double[] { dZ },
			new PolynomialFunction.Parametric().gradient(t, coeffs));
	}

	@Override
	public String toString() {
		return "Continuum[" + pivot + ", deg " + getDegree() + "]";
	}
}
