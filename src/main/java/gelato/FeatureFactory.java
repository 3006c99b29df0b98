/**
 * Gelato
 * FeatureFactory.java
 *
 * Galaxy/AGN Emission Line Analysis TOol: tied multi-component emission line
 * models for astronomical spectra.
 *
 */

package gelato;

/**
 * Creates the component for one line of the emission hierarchy.
 */
public interface FeatureFactory {

	/**
	 * @param flag species flag; negative values select an
	 *          {@link AdditionalComponent}
	 * @param center rest wavelength of the line
	 * @param spectrum spectrum context, read only
	 * @return a new component; its {@link SpectralComponent#getParamNames()}
	 *         are the unqualified names of its parameters
	 * @throws UnknownComponentException if a negative flag is not known
	 * @throws ModelConfigurationException if the spectrum lacks required data
	 */
	SpectralComponent create(int flag, double center, Spectrum spectrum);
}
