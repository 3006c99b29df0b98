/**
 * Gelato
 * TestSpectra.java
 *
 * Galaxy/AGN Emission Line Analysis TOol: tied multi-component emission line
 * models for astronomical spectra.
 *
 */

package gelato;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.commons.math3.analysis.function.Gaussian;

import gelato.EmissionGroup.Line;
import gelato.EmissionGroup.Species;

/**
 * Synthetic spectra and hierarchies shared by the tests.
 */
final class TestSpectra {

	static final double Z = 0.05;

	static final double HALPHA = 6564.61;
	static final double HBETA = 4862.68;
	static final double NII_A = 6585.27;
	static final double NII_B = 6549.86;
	static final double OIII_A = 5008.24;
	static final double OIII_B = 4960.30;

	private TestSpectra() {}

	static Line line(final double wavelength) {
		return new Line(wavelength);
	}

	static Line line(final double wavelength, final double relStrength) {
		return new Line(wavelength, relStrength);
	}

	static Species species(final String name, final int flag,
		final Line... lines)
	{
		return new Species(name, flag, Arrays.asList(lines));
	}

	static EmissionGroup group(final String name, final boolean tieRedshift,
		final boolean tieDispersion, final Species... species)
	{
		return new EmissionGroup(name, tieRedshift, tieDispersion, Arrays.asList(
			species));
	}

	/**
	 * Balmer (HAlpha, HBeta; redshift and dispersion tied) and Forbidden
	 * ([NII] doublet 1 : 0.34, [OIII] doublet 1 : 0.35; nothing tied across
	 * species).
	 */
	static List<EmissionGroup> hierarchy() {
		return Arrays.asList(
			group("Balmer", true, true,
				species("HAlpha", 0, line(HALPHA)),
				species("HBeta", 0, line(HBETA))),
			group("Forbidden", false, false,
				species("[NII]", 0, line(NII_A, 1.0), line(NII_B, 0.34)),
				species("[OIII]", 0, line(OIII_A, 1.0), line(OIII_B, 0.35))));
	}

	static List<double[]> regions() {
		return Arrays.asList(
			new double[] { 4800 * (1 + Z), 5050 * (1 + Z) },
			new double[] { 6500 * (1 + Z), 6650 * (1 + Z) });
	}

	/** Flat continuum of 1 with a line at each Balmer wavelength. */
	static Spectrum spectrum(final List<EmissionGroup> groups) {
		final int n = 4000;
		final double[] wav = new double[n];
		final double[] flux = new double[n];
		final double[] sigma = new double[n];
		for (int i = 0; i < n; i++) {
			wav[i] = 4700 * (1 + Z) + i * 0.5;
			flux[i] = 1.0;
			for (final double c : new double[] { HALPHA, HBETA }) {
				final double mu = c * (1 + Z);
				flux[i] += new Gaussian(5.0, mu, 130 / SpectralComponent.C * mu).value(
					wav[i]);
			}
			sigma[i] = 0.1;
		}
		return new Spectrum(wav, flux, sigma, Z, regions(), groups);
	}

	static Spectrum spectrum() {
		return spectrum(hierarchy());
	}

	/** Spectrum with configuration only. */
	static Spectrum emptySpectrum(final List<EmissionGroup> groups) {
		return new Spectrum(null, null, null, Z, Collections.<double[]> emptyList(),
			groups);
	}

	static List<double[]> threeRegions() {
		final List<double[]> r = new ArrayList<>(regions());
		r.add(new double[] { 6700 * (1 + Z), 6740 * (1 + Z) });
		return r;
	}
}
