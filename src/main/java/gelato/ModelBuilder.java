/**
 * Gelato
 * ModelBuilder.java
 *
 * Galaxy/AGN Emission Line Analysis TOol: tied multi-component emission line
 * models for astronomical spectra.
 *
 * Feature: construction of multi-component emission line models with
 * redshift, dispersion and flux ties following a group/species/line
 * hierarchy. Components implement the parametric function interfaces of the
 * Apache Commons Math project.
 *
 */

package gelato;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.apache.commons.lang3.time.StopWatch;
import org.scijava.Context;
import org.scijava.log.LogService;
import org.scijava.plugin.Parameter;

import gelato.EmissionGroup.Line;
import gelato.EmissionGroup.Species;

/**
 * Builds the emission model, the continuum model and their sum for one
 * spectrum. Every call builds a new model from scratch; nothing is kept
 * between calls, so one builder may serve spectra one after another.
 */
public class ModelBuilder {

	@Parameter
	private LogService log;

	private final FeatureFactory factory;
	private final ParameterTying tying;

	public ModelBuilder(final Context context) {
		this(context, new SpectralFeatureFactory());
	}

	public ModelBuilder(final Context context, final FeatureFactory factory) {
		context.inject(this);
		this.factory = factory;
		this.tying = new ParameterTying(log);
	}

	/**
	 * Emission model for the hierarchy embedded in {@code spectrum}.
	 */
	public CompositeModel buildEmission(final Spectrum spectrum) {
		return buildEmission(spectrum, Optional.empty());
	}

	/**
	 * Builds one component per line, sums them in hierarchy order and ties
	 * their parameters.
	 *
	 * @param emissionGroups hierarchy to use instead of the spectrum's own
	 * @return the tied emission model; {@link CompositeModel#getNames()} holds
	 *         {@code Group-Species-Wavelength-Role} for every parameter
	 * @throws ModelConfigurationException if the hierarchy, the spectrum and
	 *           the components disagree
	 */
	public CompositeModel buildEmission(final Spectrum spectrum,
		final Optional<List<EmissionGroup>> emissionGroups)
	{
		final StopWatch sw = new StopWatch();
		sw.start();
		final List<EmissionGroup> groups = emissionGroups.orElse(spectrum
			.getEmissionGroups());
		try {
			final CompositeModel model = assembleEmission(spectrum, groups);
			tying.tieParams(model, groups);
			sw.stop();
			log.info(String.format(
				"Emission model: %1$d components, %2$d parameters, %3$d tied (%4$d ms)",
				model.getSubModelCount(), model.getParameterCount(), model.getTies()
					.size(), sw.getTime()));
			return model;
		}
		catch (final ModelConfigurationException e) {
			log.error("Emission model not built: " + e.getMessage());
			throw e;
		}
	}

	/**
	 * One untied component per line, summed in hierarchy order.
	 */
	CompositeModel assembleEmission(final Spectrum spectrum,
		final List<EmissionGroup> groups)
	{
		final List<CompositeModel> components = new ArrayList<>();
		for (final EmissionGroup group : groups) {
			for (final Species species : group.getSpecies()) {
				for (final Line line : species.getLines()) {
					final SpectralComponent c = factory.create(species.getFlag(), line
						.getWavelength(), spectrum);
					components.add(CompositeModel.of(c, group.getName(), species
						.getName(), line.getWavelength()));
				}
			}
		}
		if (components.isEmpty()) {
			throw new ModelConfigurationException("Emission hierarchy has no lines");
		}
		return CompositeModel.sum(components);
	}

	/**
	 * Rebuilds the continuum and emission ties of {@code model} from
	 * {@code emissionGroups}, e.g. after it was assembled by other means.
	 * Ties made earlier, from any hierarchy, are discarded.
	 */
	public CompositeModel tieParams(final Spectrum spectrum,
		final CompositeModel model,
		final Optional<List<EmissionGroup>> emissionGroups)
	{
		tying.tieParams(model, emissionGroups.orElse(spectrum
			.getEmissionGroups()));
		return model;
	}

	/**
	 * One {@link Continuum} per fitting region, in region order, named
	 * {@code Continuum-Region<i>-<pivot>-<Role>}, with all redshifts tied to
	 * the first.
	 */
	public CompositeModel buildContinuum(final Spectrum spectrum) {
		spectrum.requireRegions();
		final List<CompositeModel> regions = new ArrayList<>();
		for (int i = 0; i < spectrum.getRegionCount(); i++) {
			final Continuum c = Continuum.create(spectrum.getRegion(i), spectrum);
			regions.add(CompositeModel.of(c, ParameterTying.CONTINUUM, "Region" +
				(i + 1), c.getPivot()));
		}
		final CompositeModel model = CompositeModel.sum(regions);
		tying.tieContinuum(model);
		log.info(String.format("Continuum model: %1$d regions, %2$d parameters",
			regions.size(), model.getParameterCount()));
		return model;
	}

	/**
	 * Sums per-region continuum models, ties their redshifts and appends the
	 * emission model.
	 */
	public CompositeModel buildModel(final List<CompositeModel> continuumRegions,
		final CompositeModel emission)
	{
		final CompositeModel continuum = CompositeModel.sum(continuumRegions);
		tying.tieContinuum(continuum);
		return buildModel(continuum, emission);
	}

	/**
	 * Final model: parameters {@code [continuum..., emission...]}, each half
	 * taking its values and ties from its own model.
	 */
	public CompositeModel buildModel(final CompositeModel continuum,
		final CompositeModel emission)
	{
		final CompositeModel model = continuum.plus(emission);
		log.info(String.format(
			"Model: %1$d continuum + %2$d emission parameters, %3$d free",
			continuum.getParameterCount(), emission.getParameterCount(), model
				.getFreeParameterCount()));
		return model;
	}
}
