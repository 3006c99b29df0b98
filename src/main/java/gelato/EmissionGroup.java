/**
 * Gelato
 * EmissionGroup.java
 *
 * Galaxy/AGN Emission Line Analysis TOol: tied multi-component emission line
 * models for astronomical spectra.
 *
 */

package gelato;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

import org.apache.commons.math3.exception.NotStrictlyPositiveException;

/**
 * Top level of the emission line hierarchy: a named set of species whose
 * redshifts and dispersions may be tied together. Immutable; the order of
 * species and lines is significant, the first entry of each scope being its
 * anchor.
 */
public final class EmissionGroup {

	private final String name;
	private final boolean tieRedshift;
	private final boolean tieDispersion;
	private final List<Species> species;

	public EmissionGroup(final String name, final boolean tieRedshift,
		final boolean tieDispersion, final List<Species> species)
	{
		this.name = Objects.requireNonNull(name, "name");
		this.tieRedshift = tieRedshift;
		this.tieDispersion = tieDispersion;
		this.species = Collections.unmodifiableList(new ArrayList<>(species));
	}

	public String getName() {
		return name;
	}

	public boolean isTieRedshift() {
		return tieRedshift;
	}

	public boolean isTieDispersion() {
		return tieDispersion;
	}

	public List<Species> getSpecies() {
		return species;
	}

	/** Number of lines over all species of the group. */
	public int getLineCount() {
		int n = 0;
		for (final Species s : species)
			n += s.getLines().size();
		return n;
	}

	@Override
	public String toString() {
		return name + species;
	}

	/**
	 * A named set of lines, e.g. one ion. A flag of zero or more selects the
	 * standard {@link SpectralFeature}; a negative flag selects an
	 * {@link AdditionalComponent}.
	 */
	public static final class Species {

		private final String name;
		private final int flag;
		private final List<Line> lines;

		public Species(final String name, final int flag, final List<Line> lines) {
			this.name = Objects.requireNonNull(name, "name");
			this.flag = flag;
			this.lines = Collections.unmodifiableList(new ArrayList<>(lines));
		}

		public String getName() {
			return name;
		}

		public int getFlag() {
			return flag;
		}

		public boolean isAdditional() {
			return flag < 0;
		}

		public List<Line> getLines() {
			return lines;
		}

		@Override
		public String toString() {
			return name + lines;
		}
	}

	/**
	 * One transition. The relative strength is optional; lines without one
	 * never take part in flux tying.
	 */
	public static final class Line {

		private final double wavelength;
		private final OptionalDouble relStrength;

		public Line(final double wavelength, final OptionalDouble relStrength) {
			if (wavelength <= 0) {
				throw new NotStrictlyPositiveException(wavelength);
			}
			this.wavelength = wavelength;
			this.relStrength = Objects.requireNonNull(relStrength, "relStrength");
		}

		public Line(final double wavelength, final double relStrength) {
			this(wavelength, OptionalDouble.of(relStrength));
		}

		public Line(final double wavelength) {
			this(wavelength, OptionalDouble.empty());
		}

		public double getWavelength() {
			return wavelength;
		}

		public OptionalDouble getRelStrength() {
			return relStrength;
		}

		@Override
		public String toString() {
			return relStrength.isPresent() ? wavelength + ":" + relStrength
				.getAsDouble() : Double.toString(wavelength);
		}
	}
}
