/**
 * Gelato
 * ParameterTying.java
 *
 * Galaxy/AGN Emission Line Analysis TOol: tied multi-component emission line
 * models for astronomical spectra.
 *
 */

package gelato;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

import org.scijava.log.LogService;

import gelato.EmissionGroup.Line;
import gelato.EmissionGroup.Species;

/**
 * Builds the tie table of a composite model from the emission hierarchy.
 * <p>
 * Continuum: the first continuum Redshift is free, all later ones follow it.
 * <p>
 * Emission, per group: the first line of the group is the group anchor.
 * Later lines follow its Redshift if the group ties redshifts, its Dispersion
 * if the group ties dispersions. Within a species the first line is the
 * species anchor and later lines always follow its Redshift and Dispersion,
 * which overrides the group tie for those lines. Fluxes are tied within a
 * species only, scaled by relative strength, between lines that have one.
 */
class ParameterTying {

	static final String CONTINUUM = "Continuum";

	private final LogService log;

	ParameterTying(final LogService log) {
		this.log = log;
	}

	/**
	 * Continuum then emission pass, replacing the whole tie table. The model is
	 * only changed if both passes succeed.
	 */
	void tieParams(final CompositeModel model, final List<EmissionGroup> groups) {
		final Map<ParameterName, TieFunction> staged = new LinkedHashMap<>();
		tieContinuum(model, staged);
		tieEmission(model, groups, staged);
		model.bindTies(staged);
	}

	/**
	 * Continuum pass only. Ties of other parameters are kept; continuum ties
	 * are rebuilt.
	 */
	void tieContinuum(final CompositeModel model) {
		final Map<ParameterName, TieFunction> staged = new LinkedHashMap<>();
		for (final Map.Entry<ParameterName, TieFunction> e : model.getTies()
			.entrySet())
		{
			if (!CONTINUUM.equals(e.getKey().getGroup())) staged.put(e.getKey(), e
				.getValue());
		}
		tieContinuum(model, staged);
		model.bindTies(staged);
	}

	private void tieContinuum(final CompositeModel model,
		final Map<ParameterName, TieFunction> staged)
	{
		TieFunction anchor = null;
		final List<ParameterName> names = model.getNames();
		for (int i = 0; i < names.size(); i++) {
			final ParameterName n = names.get(i);
			if (!n.hasRole(ParameterName.REDSHIFT) || !CONTINUUM.equals(n
				.getGroup())) continue;
			if (anchor == null) {
				anchor = TieFunction.of(i);
				log.debug("Continuum redshift anchor: " + n);
			}
			else {
				staged.put(n, anchor);
				log.debug(n + " -> " + anchor);
			}
		}
	}

	private void tieEmission(final CompositeModel model,
		final List<EmissionGroup> groups,
		final Map<ParameterName, TieFunction> staged)
	{
		final ScopeState state = new ScopeState();
		for (final EmissionGroup group : groups) {
			state.enterGroup();
			for (final Species species : group.getSpecies()) {
				state.enterSpecies();
				for (final Line line : species.getLines()) {
					final ParameterName redshift = new ParameterName(group.getName(),
						species.getName(), line.getWavelength(), ParameterName.REDSHIFT);
					final ParameterName dispersion = redshift.withRole(
						ParameterName.DISPERSION);
					final int zIndex = model.requireIndex(redshift);
					final int dIndex = model.requireIndex(dispersion);

					// Group
					if (!state.hasGroupAnchor()) {
						state.setGroupAnchor(zIndex, dIndex);
						log.debug("Group anchor: " + redshift);
					}
					else {
						if (group.isTieRedshift()) {
							bind(staged, redshift, state.getGroupAnchor().getRedshift());
						}
						if (group.isTieDispersion()) {
							bind(staged, dispersion, state.getGroupAnchor()
								.getDispersion());
						}
					}

					// Species
					if (!state.hasSpeciesAnchor()) {
						state.setSpeciesAnchor(zIndex, dIndex);
					}
					else {
						bind(staged, redshift, state.getSpeciesAnchor().getRedshift());
						bind(staged, dispersion, state.getSpeciesAnchor()
							.getDispersion());
					}

					// Flux
					final OptionalDouble ratio = line.getRelStrength();
					if (!ratio.isPresent()) continue;
					final ParameterName flux = redshift.withRole(ParameterName.FLUX);
					final int fIndex = model.requireIndex(flux);
					if (!state.hasFluxReference()) {
						state.setFluxReference(fIndex, ratio.getAsDouble());
						log.debug("Flux reference: " + flux);
					}
					else {
						bind(staged, flux, state.fluxTie(ratio.getAsDouble()));
					}
				}
			}
		}
	}

	private void bind(final Map<ParameterName, TieFunction> staged,
		final ParameterName name, final TieFunction tie)
	{
		staged.put(name, tie);
		log.debug(name + " -> " + tie);
	}
}
