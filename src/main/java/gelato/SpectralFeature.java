/**
 * Gelato
 * SpectralFeature.java
 *
 * Galaxy/AGN Emission Line Analysis TOol: tied multi-component emission line
 * models for astronomical spectra.
 *
 */

package gelato;

import org.apache.commons.math3.analysis.function.Gaussian;
import org.apache.commons.math3.exception.NotStrictlyPositiveException;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.FastMath;

/**
 * A single line profile in velocity space, with parameters in the following
 * order:
 * <ul>
 * <li>Redshift</li>
 * <li>Flux (integrated)</li>
 * <li>Dispersion (km/s)</li>
 * </ul>
 * The observed centre is {@code center * (1 + Redshift)} and the observed
 * width {@code Dispersion / c} times that centre.
 */
public class SpectralFeature extends SpectralComponent {

	static final String[] PARAM_NAMES = { ParameterName.REDSHIFT,
		ParameterName.FLUX, ParameterName.DISPERSION };

	enum Profile {
		GAUSSIAN, LORENTZIAN
	}

	private final double center;
	private final Profile profile;

	SpectralFeature(final double center, final Profile profile,
		final double[] initial, final double[] lower, final double[] upper)
	{
		super(PARAM_NAMES, initial, lower, upper);
		if (center <= 0) throw new NotStrictlyPositiveException(center);
		this.center = center;
		this.profile = profile;
	}

	/**
	 * Standard narrow Gaussian line at rest wavelength {@code center}, with
	 * the initial guess taken from {@code spectrum}.
	 *
	 * @throws ModelConfigurationException if the spectrum carries no data.
	 */
	public static SpectralFeature create(final double center,
		final Spectrum spectrum)
	{
		final ModelSettings s = spectrum.getSettings();
		return create(center, spectrum, Profile.GAUSSIAN, spectrum.getRedshift(),
			s.getNarrowDispersion(), s.getNarrowDispersionMin(), s
				.getNarrowDispersionMax(), false);
	}

	static SpectralFeature create(final double center, final Spectrum spectrum,
		final Profile profile, final double z0, final double dispersion,
		final double minDispersion, final double maxDispersion,
		final boolean absorption)
	{
		spectrum.requireData();
		final ModelSettings s = spectrum.getSettings();
		final double z = spectrum.getRedshift();
		final double dz = s.getRedshiftTolerance();

		final double mu = center * (1 + z0);
		final double sd = dispersion / C * mu;
		final double half = s.getFluxWindow() * (1 + z);
		final RealVector window = spectrum.fluxInside(mu - half, mu + half);
		double peak = 0.0;
		if (window.getDimension() > 0) {
			peak = absorption ? window.getMinValue() - window.getMaxValue()
				: window.getMaxValue() - window.getMinValue();
		}
		final double flux = profile == Profile.LORENTZIAN ? peak * FastMath.PI *
			sd : peak * SQRT2PI * sd;

		final double[] initial = { z0, flux, dispersion };
		final double[] lower = { FastMath.min(z0, z - dz), absorption
			? Double.NEGATIVE_INFINITY : 0.0, minDispersion };
		final double[] upper = { FastMath.max(z0, z + dz), absorption ? 0.0
			: Double.POSITIVE_INFINITY, maxDispersion };
		return new SpectralFeature(center, profile, initial, lower, upper);
	}

	public double getCenter() {
		return center;
	}

	Profile getProfile() {
		return profile;
	}

	/**
	 * @param x observed wavelength
	 * @param param Redshift, Flux, Dispersion
	 */
	@Override
	public double value(final double x, final double... param) {
		checkParameters(param);
		final double mu = center * (1 + param[0]);
		final double sd = width(mu, param[2]);
		if (profile == Profile.LORENTZIAN) {
			final double u = x - mu;
			return param[1] / FastMath.PI * sd / (u * u + sd * sd);
		}
		return new Gaussian(param[1] / (sd * SQRT2PI), mu, sd).value(x);
	}

	/**
	 * Partial derivatives with respect to Redshift, Flux and Dispersion.
	 */
	@Override
	public double[] gradient(final double x, final double... param) {
		checkParameters(param);
		final double mu = center * (1 + param[0]);
		final double sd = width(mu, param[2]);
		final double dSdZ = param[2] / C * center;
		final double dSdD = mu / C;

		final double dFlux, dMu, dSd;
		if (profile == Profile.LORENTZIAN) {
			final double u = x - mu;
			final double den = u * u + sd * sd;
			dFlux = sd / (FastMath.PI * den);
			dMu = param[1] / FastMath.PI * sd * 2 * u / (den * den);
			dSd = param[1] / FastMath.PI * (u * u - sd * sd) / (den * den);
		}
		else {
			final double norm = param[1] / (sd * SQRT2PI);
			// d/dnorm, d/dmean, d/dsigma
			final double[] g = new Gaussian.Parametric().gradient(x, norm, mu, sd);
			dFlux = g[0] / (sd * SQRT2PI);
			dMu = g[1];
			dSd = g[2] - g[0] * norm / sd;
		}
		return new double[] { dMu * center + dSd * dSdZ, dFlux, dSd * dSdD };
	}

	private double width(final double mu, final double dispersion) {
		final double sd = dispersion / C * mu;
		if (sd <= 0) throw new NotStrictlyPositiveException(dispersion);
		return sd;
	}

	@Override
	public String toString() {
		return "SpectralFeature[" + center + ", " + profile + "]";
	}
}
