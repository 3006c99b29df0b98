/**
 * Gelato
 * AdditionalComponent.java
 *
 * Galaxy/AGN Emission Line Analysis TOol: tied multi-component emission line
 * models for astronomical spectra.
 *
 */

package gelato;

import gelato.SpectralFeature.Profile;

/**
 * Non-standard line profiles, selected by a negative species flag.
 */
public enum AdditionalComponent {

	/** Broad Gaussian, e.g. from a broad line region. */
	BROAD(-1) {

		@Override
		SpectralFeature create(final double center, final Spectrum spectrum) {
			final ModelSettings s = spectrum.getSettings();
			return SpectralFeature.create(center, spectrum, Profile.GAUSSIAN,
				spectrum.getRedshift(), s.getBroadDispersion(), s
					.getBroadDispersionMin(), s.getBroadDispersionMax(), false);
		}
	},

	/** Blue-shifted Gaussian of intermediate width. */
	OUTFLOW(-2) {

		@Override
		SpectralFeature create(final double center, final Spectrum spectrum) {
			final ModelSettings s = spectrum.getSettings();
			final double z0 = (1 + spectrum.getRedshift()) * (1 + s
				.getOutflowVelocity() / SpectralComponent.C) - 1;
			return SpectralFeature.create(center, spectrum, Profile.GAUSSIAN, z0, s
				.getOutflowDispersion(), s.getNarrowDispersionMin(), s
					.getBroadDispersionMax(), false);
		}
	},

	/** Gaussian with non-positive flux. */
	ABSORPTION(-3) {

		@Override
		SpectralFeature create(final double center, final Spectrum spectrum) {
			final ModelSettings s = spectrum.getSettings();
			return SpectralFeature.create(center, spectrum, Profile.GAUSSIAN,
				spectrum.getRedshift(), s.getNarrowDispersion(), s
					.getNarrowDispersionMin(), s.getBroadDispersionMax(), true);
		}
	},

	/** Lorentzian line with a broad dispersion range. */
	LORENTZIAN(-4) {

		@Override
		SpectralFeature create(final double center, final Spectrum spectrum) {
			final ModelSettings s = spectrum.getSettings();
			return SpectralFeature.create(center, spectrum, Profile.LORENTZIAN,
				spectrum.getRedshift(), s.getBroadDispersion(), s
					.getNarrowDispersionMin(), s.getBroadDispersionMax(), false);
		}
	};

	private final int flag;

	AdditionalComponent(final int flag) {
		this.flag = flag;
	}

	public int getFlag() {
		return flag;
	}

	abstract SpectralFeature create(double center, Spectrum spectrum);

	/**
	 * @throws UnknownComponentException if no variant is registered for
	 *           {@code flag}.
	 */
	public static AdditionalComponent fromFlag(final int flag) {
		for (final AdditionalComponent c : values()) {
			if (c.flag == flag) return c;
		}
		throw new UnknownComponentException(flag);
	}
}
