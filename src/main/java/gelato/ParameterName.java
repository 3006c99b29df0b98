/**
 * Gelato
 * ParameterName.java
 *
 * Galaxy/AGN Emission Line Analysis TOol: tied multi-component emission line
 * models for astronomical spectra.
 *
 */

package gelato;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Fully qualified name of one slot of a composite parameter vector:
 * {@code Group-Species-Wavelength-Role}, e.g.
 * {@code Balmer-HAlpha-6564.61-Dispersion}.
 */
public final class ParameterName {

	public static final String REDSHIFT = "Redshift";
	public static final String FLUX = "Flux";
	public static final String DISPERSION = "Dispersion";

	static final String SEPARATOR = "-";

	private final String group;
	private final String species;
	private final double wavelength;
	private final String role;

	public ParameterName(final String group, final String species,
		final double wavelength, final String role)
	{
		this.group = Objects.requireNonNull(group, "group");
		this.species = Objects.requireNonNull(species, "species");
		this.wavelength = wavelength;
		this.role = Objects.requireNonNull(role, "role");
	}

	/**
	 * Prefix shared by every parameter of one line, trailing separator
	 * included.
	 */
	public static String prefix(final String group, final String species,
		final double wavelength)
	{
		return group + SEPARATOR + species + SEPARATOR + format(wavelength) +
			SEPARATOR;
	}

	/**
	 * Shortest decimal form of {@code w}, always with a fractional part and in
	 * positional notation for {@code 1e-4 <= |w| < 1e16}, e.g.
	 * {@code 10000000.0} rather than {@code 1.0E7}. Outside that range the
	 * exponent form of {@link Double#toString(double)} is kept.
	 */
	static String format(final double w) {
		final String s = Double.toString(w);
		final double a = Math.abs(w);
		if (s.indexOf('E') < 0 || a < 1e-4 || a >= 1e16) return s;
		final String plain = new BigDecimal(s).stripTrailingZeros()
			.toPlainString();
		return plain.indexOf('.') < 0 ? plain + ".0" : plain;
	}

	/**
	 * Name of another role on the same line.
	 */
	public ParameterName withRole(final String newRole) {
		return new ParameterName(group, species, wavelength, newRole);
	}

	public String getGroup() {
		return group;
	}

	public String getSpecies() {
		return species;
	}

	public double getWavelength() {
		return wavelength;
	}

	public String getRole() {
		return role;
	}

	public boolean hasRole(final String r) {
		return role.equals(r);
	}

	@Override
	public boolean equals(final Object o) {
		if (this == o) return true;
		if (!(o instanceof ParameterName)) return false;
		final ParameterName n = (ParameterName) o;
		return Double.compare(wavelength, n.wavelength) == 0 &&
			group.equals(n.group) && species.equals(n.species) && role.equals(
				n.role);
	}

	@Override
	public int hashCode() {
		return Objects.hash(group, species, wavelength, role);
	}

	@Override
	public String toString() {
		return prefix(group, species, wavelength) + role;
	}
}
