/**
 * Gelato
 * SpectralFeatureFactory.java
 *
 * Galaxy/AGN Emission Line Analysis TOol: tied multi-component emission line
 * models for astronomical spectra.
 *
 */

package gelato;

/**
 * Default factory: {@link SpectralFeature} for standard species, the
 * {@link AdditionalComponent} selected by the flag otherwise.
 */
public class SpectralFeatureFactory implements FeatureFactory {

	@Override
	public SpectralComponent create(final int flag, final double center,
		final Spectrum spectrum)
	{
		if (flag < 0) {
			return AdditionalComponent.fromFlag(flag).create(center, spectrum);
		}
		return SpectralFeature.create(center, spectrum);
	}
}
