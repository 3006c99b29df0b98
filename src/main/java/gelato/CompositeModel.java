/**
 * Gelato
 * CompositeModel.java
 *
 * Galaxy/AGN Emission Line Analysis TOol: tied multi-component emission line
 * models for astronomical spectra.
 *
 */

package gelato;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.math3.analysis.ParametricUnivariateFunction;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.NullArgumentException;
import org.apache.commons.math3.exception.OutOfRangeException;

/**
 * Ordered sum of spectral components sharing one flat parameter vector. The
 * parameters of component {@code i} occupy the slice starting at
 * {@link #getOffset(int)}, in insertion order. Every slot has a qualified
 * {@link ParameterName}; slots listed in the tie table follow another slot
 * through a {@link TieFunction}, all others are free.
 */
public class CompositeModel implements UnivariateFunction {

	private final List<SpectralComponent> components;
	private final int[] offsets;
	private final List<ParameterName> names;
	private final Map<ParameterName, Integer> index;
	private final double[] parameters;
	private final Map<ParameterName, TieFunction> ties;

	private CompositeModel(final List<SpectralComponent> components,
		final List<ParameterName> names, final double[] parameters,
		final Map<ParameterName, TieFunction> ties)
	{
		this.components = Collections.unmodifiableList(new ArrayList<>(
			components));
		this.offsets = new int[components.size()];
		int n = 0;
		for (int i = 0; i < components.size(); i++) {
			offsets[i] = n;
			n += components.get(i).getParameterCount();
		}
		if (names.size() != n) throw new DimensionMismatchException(names.size(),
			n);
		if (parameters.length != n) throw new DimensionMismatchException(
			parameters.length, n);

		this.names = Collections.unmodifiableList(new ArrayList<>(names));
		this.index = new HashMap<>();
		for (int i = 0; i < n; i++) {
			if (index.put(names.get(i), i) != null) {
				throw new ModelConfigurationException("Duplicate parameter name " +
					names.get(i));
			}
		}
		this.parameters = parameters.clone();
		this.ties = new LinkedHashMap<>();
		bindTies(ties);
	}

	/**
	 * Single-component model whose parameters are named {@code prefix + role}
	 * for each of the component's declared names.
	 *
	 * @param group group name
	 * @param species species name
	 * @param wavelength rest wavelength of the line (or pivot of a region)
	 */
	public static CompositeModel of(final SpectralComponent component,
		final String group, final String species, final double wavelength)
	{
		final List<ParameterName> n = new ArrayList<>();
		for (final String role : component.getParamNames())
			n.add(new ParameterName(group, species, wavelength, role));
		return new CompositeModel(Collections.singletonList(component), n,
			component.getInitialParameters(), Collections.emptyMap());
	}

	/**
	 * Order-preserving sum: the parameters of {@code other} are appended after
	 * those of this model, and its ties are shifted so that they still point
	 * at the same parameters.
	 *
	 * @throws ModelConfigurationException if the two models share a name.
	 */
	public CompositeModel plus(final CompositeModel other) {
		final List<SpectralComponent> c = new ArrayList<>(components);
		c.addAll(other.components);
		final List<ParameterName> n = new ArrayList<>(names);
		n.addAll(other.names);
		final double[] p = Arrays.copyOf(parameters, parameters.length +
			other.parameters.length);
		System.arraycopy(other.parameters, 0, p, parameters.length,
			other.parameters.length);

		final Map<ParameterName, TieFunction> t = new LinkedHashMap<>(ties);
		for (final Map.Entry<ParameterName, TieFunction> e : other.ties
			.entrySet())
		{
			t.put(e.getKey(), e.getValue().shift(parameters.length));
		}
		return new CompositeModel(c, n, p, t);
	}

	/**
	 * Left-to-right reduction of {@code models} with {@link #plus}.
	 */
	public static CompositeModel sum(final List<CompositeModel> models) {
		if (models == null || models.isEmpty()) {
			throw new NullArgumentException();
		}
		CompositeModel out = models.get(0);
		for (int i = 1; i < models.size(); i++)
			out = out.plus(models.get(i));
		return out;
	}

	/**
	 * Replaces the tie table. All entries are checked before anything is
	 * changed, so a rejected table leaves the model as it was.
	 *
	 * @throws ModelConfigurationException if a key is not a parameter of this
	 *           model, a source is out of range or a parameter is tied to
	 *           itself.
	 */
	void bindTies(final Map<ParameterName, TieFunction> table) {
		for (final Map.Entry<ParameterName, TieFunction> e : table.entrySet()) {
			final Integer target = index.get(e.getKey());
			if (target == null) {
				throw new ModelConfigurationException("Cannot tie unknown parameter " +
					e.getKey());
			}
			final int source = e.getValue().getSourceIndex();
			if (source >= parameters.length) {
				throw new ModelConfigurationException("Tie of " + e.getKey() +
					" points outside the model: " + e.getValue());
			}
			if (source == target) {
				throw new ModelConfigurationException("Parameter " + e.getKey() +
					" is tied to itself");
			}
		}
		ties.clear();
		ties.putAll(table);
	}

	/**
	 * Writes every tied parameter from its tie function, in the order the ties
	 * were made. Ties always point at parameters processed earlier, so a
	 * single pass also resolves a follower whose anchor is itself tied.
	 */
	public void applyTies() {
		applyTies(parameters);
	}

	void applyTies(final double[] p) {
		for (final Map.Entry<ParameterName, TieFunction> e : ties.entrySet()) {
			p[index.get(e.getKey())] = e.getValue().value(p);
		}
	}

	@Override
	public double value(final double x) {
		double output = 0;
		for (int i = 0; i < components.size(); i++)
			output += subModelValue(i, x);
		return output;
	}

	public double[] value(final double[] x) {
		final double[] out = new double[x.length];
		for (int i = 0; i < x.length; i++)
			out[i] = value(x[i]);
		return out;
	}

	/**
	 * Value of component {@code i} alone, with the current parameters.
	 */
	public double subModelValue(final int i, final double x) {
		return components.get(i).value(x, slice(parameters, i));
	}

	private double[] slice(final double[] p, final int i) {
		return Arrays.copyOfRange(p, offsets[i], offsets[i] + components.get(i)
			.getParameterCount());
	}

	public int getParameterCount() {
		return parameters.length;
	}

	/** Number of parameters not in the tie table. */
	public int getFreeParameterCount() {
		return parameters.length - ties.size();
	}

	public double[] getParameters() {
		return parameters.clone();
	}

	public void setParameters(final double[] p) {
		if (p.length != parameters.length) {
			throw new DimensionMismatchException(p.length, parameters.length);
		}
		System.arraycopy(p, 0, parameters, 0, p.length);
	}

	public double getParameter(final int i) {
		checkIndex(i);
		return parameters[i];
	}

	public void setParameter(final int i, final double value) {
		checkIndex(i);
		parameters[i] = value;
	}

	public double getParameter(final ParameterName name) {
		return parameters[requireIndex(name)];
	}

	public void setParameter(final ParameterName name, final double value) {
		parameters[requireIndex(name)] = value;
	}

	private void checkIndex(final int i) {
		if (i < 0 || i >= parameters.length) {
			throw new OutOfRangeException(i, 0, parameters.length - 1);
		}
	}

	/**
	 * @return position of {@code name} in the parameter vector, or -1
	 */
	public int indexOf(final ParameterName name) {
		final Integer i = index.get(name);
		return i == null ? -1 : i;
	}

	/**
	 * @throws ModelConfigurationException if {@code name} is not a parameter
	 *           of this model.
	 */
	int requireIndex(final ParameterName name) {
		final Integer i = index.get(name);
		if (i == null) {
			throw new ModelConfigurationException("Model has no parameter " + name);
		}
		return i;
	}

	public List<ParameterName> getNames() {
		return names;
	}

	/**
	 * @return the tie of {@code name}, or {@code null} for a free parameter
	 */
	public TieFunction getTie(final ParameterName name) {
		return ties.get(name);
	}

	public boolean isTied(final ParameterName name) {
		return ties.containsKey(name);
	}

	/** Read-only view of the tie table, in the order the ties were made. */
	public Map<ParameterName, TieFunction> getTies() {
		return Collections.unmodifiableMap(ties);
	}

	public int getSubModelCount() {
		return components.size();
	}

	public SpectralComponent getSubModel(final int i) {
		return components.get(i);
	}

	public int getOffset(final int i) {
		return offsets[i];
	}

	public double[] getLowerBounds() {
		final double[] out = new double[parameters.length];
		for (int i = 0; i < components.size(); i++) {
			final double[] b = components.get(i).getLowerBounds();
			System.arraycopy(b, 0, out, offsets[i], b.length);
		}
		return out;
	}

	public double[] getUpperBounds() {
		final double[] out = new double[parameters.length];
		for (int i = 0; i < components.size(); i++) {
			final double[] b = components.get(i).getUpperBounds();
			System.arraycopy(b, 0, out, offsets[i], b.length);
		}
		return out;
	}

	/**
	 * The model as a function of its parameter vector, for a least-squares
	 * fitter.
	 */
	public ParametricUnivariateFunction parametric() {
		return new Parametric(this);
	}

	@Override
	public String toString() {
		return "CompositeModel[" + components.size() + " components, " +
			parameters.length + " parameters, " + ties.size() + " tied]";
	}

	/**
	 * Parametric form of a composite model: {@code param} is a full parameter
	 * vector, the gradient is the concatenation of the component gradients.
	 */
	static class Parametric implements ParametricUnivariateFunction {

		private final CompositeModel model;

		Parametric(final CompositeModel model) {
			this.model = model;
		}

		@Override
		public double value(final double x, final double... param) {
			checkLength(param);
			double output = 0;
			for (int i = 0; i < model.components.size(); i++)
				output += model.components.get(i).value(x, model.slice(param, i));
			return output;
		}

		@Override
		public double[] gradient(final double x, final double... param) {
			checkLength(param);
			final double[] out = new double[param.length];
			for (int i = 0; i < model.components.size(); i++) {
				final double[] g = model.components.get(i).gradient(x, model.slice(
					param, i));
				System.arraycopy(g, 0, out, model.offsets[i], g.length);
			}
			return out;
		}

		private void checkLength(final double[] param) {
			if (param == null) throw new NullArgumentException();
			if (param.length != model.parameters.length) {
				throw new DimensionMismatchException(param.length,
					model.parameters.length);
			}
		}
	}
}
