/**
 * Gelato
 * Spectrum.java
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
import java.util.Objects;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.NumberIsTooLargeException;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealVector;

/**
 * Read-only spectrum context: observed wavelengths, flux and uncertainty,
 * the object's redshift, the fitting regions (observed frame, Angstrom), the
 * emission hierarchy and the model settings. Arrays may be absent when the
 * spectrum is only used to carry configuration; components that need them
 * then fail with a {@link ModelConfigurationException}.
 */
public final class Spectrum {

	private final RealVector wav;
	private final RealVector flux;
	private final RealVector sigma;
	private final double z;
	private final List<double[]> regions;
	private final List<EmissionGroup> emissionGroups;
	private final ModelSettings settings;

	public Spectrum(final double[] wav, final double[] flux,
		final double[] sigma, final double z, final List<double[]> regions,
		final List<EmissionGroup> emissionGroups, final ModelSettings settings)
	{
		if (wav != null && flux != null && wav.length != flux.length) {
			throw new DimensionMismatchException(flux.length, wav.length);
		}
		if (wav != null && sigma != null && wav.length != sigma.length) {
			throw new DimensionMismatchException(sigma.length, wav.length);
		}
		this.wav = wav == null ? null : new ArrayRealVector(wav);
		this.flux = flux == null ? null : new ArrayRealVector(flux);
		this.sigma = sigma == null ? null : new ArrayRealVector(sigma);
		this.z = z;

		final List<double[]> r = new ArrayList<>();
		if (regions != null) {
			for (final double[] region : regions) {
				if (region.length != 2) {
					throw new DimensionMismatchException(region.length, 2);
				}
				if (region[0] >= region[1]) {
					throw new NumberIsTooLargeException(region[0], region[1], false);
				}
				r.add(region.clone());
			}
		}
		this.regions = Collections.unmodifiableList(r);
		this.emissionGroups = Collections.unmodifiableList(new ArrayList<>(
			Objects.requireNonNull(emissionGroups, "emissionGroups")));
		this.settings = settings == null ? ModelSettings.defaults() : settings;
	}

	public Spectrum(final double[] wav, final double[] flux,
		final double[] sigma, final double z, final List<double[]> regions,
		final List<EmissionGroup> emissionGroups)
	{
		this(wav, flux, sigma, z, regions, emissionGroups, null);
	}

	public boolean hasData() {
		return wav != null && flux != null && sigma != null;
	}

	/**
	 * @throws ModelConfigurationException if wavelength, flux or sigma is
	 *           missing.
	 */
	void requireData() {
		if (wav == null) throw new ModelConfigurationException(
			"Spectrum has no wavelength array");
		if (flux == null) throw new ModelConfigurationException(
			"Spectrum has no flux array");
		if (sigma == null) throw new ModelConfigurationException(
			"Spectrum has no sigma array");
	}

	/**
	 * @throws ModelConfigurationException if no fitting region is defined.
	 */
	void requireRegions() {
		if (regions.isEmpty()) throw new ModelConfigurationException(
			"Spectrum has no fitting regions");
	}

	/**
	 * Flux samples whose observed wavelength falls strictly inside
	 * {@code (lo, hi)}.
	 */
	RealVector fluxInside(final double lo, final double hi) {
		requireData();
		final double[] out = new double[wav.getDimension()];
		int n = 0;
		for (int i = 0; i < wav.getDimension(); i++) {
			final double w = wav.getEntry(i);
			if (w > lo && w < hi) out[n++] = flux.getEntry(i);
		}
		return new ArrayRealVector(Arrays.copyOf(out, n), false);
	}

	public RealVector getWavelength() {
		return wav == null ? null : wav.copy();
	}

	public RealVector getFlux() {
		return flux == null ? null : flux.copy();
	}

	public RealVector getSigma() {
		return sigma == null ? null : sigma.copy();
	}

	public double getRedshift() {
		return z;
	}

	public List<double[]> getRegions() {
		final List<double[]> out = new ArrayList<>();
		for (final double[] r : regions)
			out.add(r.clone());
		return out;
	}

	int getRegionCount() {
		return regions.size();
	}

	double[] getRegion(final int i) {
		return regions.get(i).clone();
	}

	public List<EmissionGroup> getEmissionGroups() {
		return emissionGroups;
	}

	public ModelSettings getSettings() {
		return settings;
	}
}
