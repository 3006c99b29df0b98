/**
 * Gelato
 * UnknownComponentException.java
 *
 * Galaxy/AGN Emission Line Analysis TOol: tied multi-component emission line
 * models for astronomical spectra.
 *
 */

package gelato;

/**
 * A negative species flag does not select any {@link AdditionalComponent}.
 */
public class UnknownComponentException extends ModelConfigurationException {

	private static final long serialVersionUID = 1L;

	private final int flag;

	public UnknownComponentException(final int flag) {
		super("No additional component for flag " + flag);
		this.flag = flag;
	}

	public int getFlag() {
		return flag;
	}
}
