/**
 * Gelato
 * ScopeState.java
 *
 * Galaxy/AGN Emission Line Analysis TOol: tied multi-component emission line
 * models for astronomical spectra.
 *
 */

package gelato;

/**
 * Anchors seen so far while walking the emission hierarchy: the group
 * anchor, the species anchor and the flux reference of the current species.
 * Entering a group clears all three, entering a species clears the last two.
 */
final class ScopeState {

	private Anchor group;
	private Anchor species;
	private int fluxIndex = -1;
	private double fluxRatio;

	void enterGroup() {
		group = null;
		enterSpecies();
	}

	void enterSpecies() {
		species = null;
		fluxIndex = -1;
		fluxRatio = Double.NaN;
	}

	boolean hasGroupAnchor() {
		return group != null;
	}

	boolean hasSpeciesAnchor() {
		return species != null;
	}

	boolean hasFluxReference() {
		return fluxIndex >= 0;
	}

	Anchor getGroupAnchor() {
		return group;
	}

	Anchor getSpeciesAnchor() {
		return species;
	}

	void setGroupAnchor(final int redshiftIndex, final int dispersionIndex) {
		group = new Anchor(redshiftIndex, dispersionIndex);
	}

	void setSpeciesAnchor(final int redshiftIndex, final int dispersionIndex) {
		species = new Anchor(redshiftIndex, dispersionIndex);
	}

	void setFluxReference(final int index, final double ratio) {
		fluxIndex = index;
		fluxRatio = ratio;
	}

	/**
	 * Tie of a flux with relative strength {@code ratio} on the current
	 * reference.
	 *
	 * @throws ModelConfigurationException if there is no reference, or the
	 *           scale it gives is not finite.
	 */
	TieFunction fluxTie(final double ratio) {
		if (!hasFluxReference()) {
			throw new ModelConfigurationException(
				"Flux tie without a reference line");
		}
		final double scale = ratio / fluxRatio;
		if (Double.isNaN(scale) || Double.isInfinite(scale)) {
			throw new ModelConfigurationException("Flux ratio " + ratio + "/" +
				fluxRatio + " is not finite");
		}
		return TieFunction.of(fluxIndex, scale);
	}

	/** Redshift and dispersion ties of a scope's first line. */
	static final class Anchor {

		private final TieFunction redshift;
		private final TieFunction dispersion;

		Anchor(final int redshiftIndex, final int dispersionIndex) {
			this.redshift = TieFunction.of(redshiftIndex);
			this.dispersion = TieFunction.of(dispersionIndex);
		}

		TieFunction getRedshift() {
			return redshift;
		}

		TieFunction getDispersion() {
			return dispersion;
		}
	}
}
