/**
 * Gelato
 * ModelSettings.java
 *
 * Galaxy/AGN Emission Line Analysis TOol: tied multi-component emission line
 * models for astronomical spectra.
 *
 */

package gelato;

import java.util.prefs.Preferences;

import org.apache.commons.math3.exception.NotStrictlyPositiveException;
import org.apache.commons.math3.exception.NumberIsTooSmallException;

/**
 * Numeric conventions used when components are instantiated. Velocities in
 * km/s, wavelengths in Angstrom.
 */
public final class ModelSettings {

	// Preference keys
	static final String NARROWDISP = "narrowDispersion";
	static final String NARROWMIN = "narrowDispersionMin";
	static final String NARROWMAX = "narrowDispersionMax";
	static final String BROADDISP = "broadDispersion";
	static final String BROADMIN = "broadDispersionMin";
	static final String BROADMAX = "broadDispersionMax";
	static final String OUTFLOWDISP = "outflowDispersion";
	static final String OUTFLOWSHIFT = "outflowVelocity";
	static final String FLUXWINDOW = "fluxWindow";
	static final String DEGCONT = "continuumDegree";
	static final String DZ = "redshiftTolerance";

	private static final ModelSettings DEFAULTS = new ModelSettings(130.0, 60.0,
		500.0, 1000.0, 500.0, 10000.0, 400.0, -300.0, 10.0, 1, 0.005);

	private final double narrowDispersion, narrowDispersionMin,
			narrowDispersionMax;
	private final double broadDispersion, broadDispersionMin, broadDispersionMax;
	private final double outflowDispersion, outflowVelocity;
	private final double fluxWindow; // half width, rest frame
	private final int continuumDegree;
	private final double redshiftTolerance;

	ModelSettings(final double narrowDispersion, final double narrowDispersionMin,
		final double narrowDispersionMax, final double broadDispersion,
		final double broadDispersionMin, final double broadDispersionMax,
		final double outflowDispersion, final double outflowVelocity,
		final double fluxWindow, final int continuumDegree,
		final double redshiftTolerance)
	{
		checkRange(narrowDispersion, narrowDispersionMin, narrowDispersionMax);
		checkRange(broadDispersion, broadDispersionMin, broadDispersionMax);
		if (outflowDispersion <= 0)
			throw new NotStrictlyPositiveException(outflowDispersion);
		if (fluxWindow <= 0) throw new NotStrictlyPositiveException(fluxWindow);
		if (continuumDegree < 0)
			throw new NumberIsTooSmallException(continuumDegree, 0, true);
		if (redshiftTolerance < 0)
			throw new NumberIsTooSmallException(redshiftTolerance, 0, true);
		this.narrowDispersion = narrowDispersion;
		this.narrowDispersionMin = narrowDispersionMin;
		this.narrowDispersionMax = narrowDispersionMax;
		this.broadDispersion = broadDispersion;
		this.broadDispersionMin = broadDispersionMin;
		this.broadDispersionMax = broadDispersionMax;
		this.outflowDispersion = outflowDispersion;
		this.outflowVelocity = outflowVelocity;
		this.fluxWindow = fluxWindow;
		this.continuumDegree = continuumDegree;
		this.redshiftTolerance = redshiftTolerance;
	}

	private static void checkRange(final double value, final double min,
		final double max)
	{
		if (min <= 0) throw new NotStrictlyPositiveException(min);
		if (value < min) throw new NumberIsTooSmallException(value, min, true);
		if (max < value) throw new NumberIsTooSmallException(max, value, true);
	}

	public static ModelSettings defaults() {
		return DEFAULTS;
	}

	/**
	 * Reads settings from a preferences node, falling back to the defaults
	 * for missing keys.
	 */
	public static ModelSettings load(final Preferences prefs) {
		final ModelSettings d = DEFAULTS;
		return new ModelSettings(
			prefs.getDouble(NARROWDISP, d.narrowDispersion),
			prefs.getDouble(NARROWMIN, d.narrowDispersionMin),
			prefs.getDouble(NARROWMAX, d.narrowDispersionMax),
			prefs.getDouble(BROADDISP, d.broadDispersion),
			prefs.getDouble(BROADMIN, d.broadDispersionMin),
			prefs.getDouble(BROADMAX, d.broadDispersionMax),
			prefs.getDouble(OUTFLOWDISP, d.outflowDispersion),
			prefs.getDouble(OUTFLOWSHIFT, d.outflowVelocity),
			prefs.getDouble(FLUXWINDOW, d.fluxWindow),
			prefs.getInt(DEGCONT, d.continuumDegree),
			prefs.getDouble(DZ, d.redshiftTolerance));
	}

	public void store(final Preferences prefs) {
		prefs.putDouble(NARROWDISP, narrowDispersion);
		prefs.putDouble(NARROWMIN, narrowDispersionMin);
		prefs.putDouble(NARROWMAX, narrowDispersionMax);
		prefs.putDouble(BROADDISP, broadDispersion);
		prefs.putDouble(BROADMIN, broadDispersionMin);
		prefs.putDouble(BROADMAX, broadDispersionMax);
		prefs.putDouble(OUTFLOWDISP, outflowDispersion);
		prefs.putDouble(OUTFLOWSHIFT, outflowVelocity);
		prefs.putDouble(FLUXWINDOW, fluxWindow);
		prefs.putInt(DEGCONT, continuumDegree);
		prefs.putDouble(DZ, redshiftTolerance);
	}

	public double getNarrowDispersion() {
		return narrowDispersion;
	}

	public double getNarrowDispersionMin() {
		return narrowDispersionMin;
	}

	public double getNarrowDispersionMax() {
		return narrowDispersionMax;
	}

	public double getBroadDispersion() {
		return broadDispersion;
	}

	public double getBroadDispersionMin() {
		return broadDispersionMin;
	}

	public double getBroadDispersionMax() {
		return broadDispersionMax;
	}

	public double getOutflowDispersion() {
		return outflowDispersion;
	}

	public double getOutflowVelocity() {
		return outflowVelocity;
	}

	public double getFluxWindow() {
		return fluxWindow;
	}

	public int getContinuumDegree() {
		return continuumDegree;
	}

	public double getRedshiftTolerance() {
		return redshiftTolerance;
	}
}
