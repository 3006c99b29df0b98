/**
 * Gelato
 * ModelConfigurationException.java
 *
 * Galaxy/AGN Emission Line Analysis TOol: tied multi-component emission line
 * models for astronomical spectra.
 *
 */

package gelato;

/**
 * The emission hierarchy, the spectrum context and the generated components
 * disagree. Model construction for the spectrum is abandoned; a batch caller
 * may skip the spectrum and carry on.
 */
public class ModelConfigurationException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public ModelConfigurationException(final String message) {
		super(message);
	}

	public ModelConfigurationException(final String message,
		final Throwable cause)
	{
		super(message, cause);
	}
}
