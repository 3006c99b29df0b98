/**
 * Gelato
 * CompositeModelTest.java
 *
 * Galaxy/AGN Emission Line Analysis TOol: tied multi-component emission line
 * models for astronomical spectra.
 *
 */

package gelato;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.fitting.leastsquares.ParameterValidator;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealVector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class CompositeModelTest {

	private Spectrum spectrum;
	private CompositeModel a, b;

	@BeforeEach
	void setUp() {
		spectrum = TestSpectra.spectrum();
		a = CompositeModel.of(SpectralFeature.create(TestSpectra.HALPHA,
			spectrum), "Balmer", "HAlpha", TestSpectra.HALPHA);
		b = CompositeModel.of(SpectralFeature.create(TestSpectra.HBETA, spectrum),
			"Balmer", "HBeta", TestSpectra.HBETA);
	}

	private ParameterName hb(final String role) {
		return new ParameterName("Balmer", "HBeta", TestSpectra.HBETA, role);
	}

	@Test
	void sumKeepsSlicePositions() {
		final CompositeModel sum = CompositeModel.sum(Arrays.asList(a, b));

		assertEquals(6, sum.getParameterCount());
		assertEquals(0, sum.getOffset(0));
		assertEquals(3, sum.getOffset(1));
		assertEquals(3, sum.indexOf(hb(ParameterName.REDSHIFT)));
		final double[] p = sum.getParameters();
		assertTrue(Arrays.equals(a.getParameters(), Arrays.copyOfRange(p, 0, 3)));
		assertTrue(Arrays.equals(b.getParameters(), Arrays.copyOfRange(p, 3, 6)));
	}

	@Test
	void valueIsSumOfComponents() {
		final CompositeModel sum = a.plus(b);
		final double x = TestSpectra.HBETA * (1 + TestSpectra.Z);

		assertEquals(a.value(x) + b.value(x), sum.value(x), 1e-12);
		assertEquals(b.value(x), sum.subModelValue(1, x), 0.0);
	}

	@Test
	void tiesShiftWhenAppended() {
		final ParameterName oiii = new ParameterName("Forbidden", "[OIII]",
			TestSpectra.OIII_A, ParameterName.DISPERSION);
		final CompositeModel tied = b.plus(CompositeModel.of(SpectralFeature
			.create(TestSpectra.OIII_A, spectrum), "Forbidden", "[OIII]",
			TestSpectra.OIII_A));
		final Map<ParameterName, TieFunction> t = new LinkedHashMap<>();
		t.put(oiii, TieFunction.of(2));
		tied.bindTies(t);

		final CompositeModel sum = a.plus(tied);
		assertEquals(TieFunction.of(5), sum.getTie(oiii));
		assertEquals(sum.indexOf(hb(ParameterName.DISPERSION)), sum.getTie(oiii)
			.getSourceIndex());
		assertNull(sum.getTie(hb(ParameterName.DISPERSION)));
	}

	@Test
	void duplicateNamesAreRejected() {
		assertThrows(ModelConfigurationException.class, () -> a.plus(a));
	}

	@Test
	void rejectedTieTableLeavesModelUnchanged() {
		final CompositeModel sum = a.plus(b);
		final Map<ParameterName, TieFunction> good = new LinkedHashMap<>();
		good.put(hb(ParameterName.REDSHIFT), TieFunction.of(0));
		sum.bindTies(good);

		final Map<ParameterName, TieFunction> bad = new LinkedHashMap<>();
		bad.put(hb(ParameterName.DISPERSION), TieFunction.of(2));
		bad.put(hb("Velocity"), TieFunction.of(0));
		assertThrows(ModelConfigurationException.class, () -> sum.bindTies(bad));
		assertEquals(good, sum.getTies());

		final Map<ParameterName, TieFunction> self = new LinkedHashMap<>();
		self.put(hb(ParameterName.FLUX), TieFunction.of(4));
		assertThrows(ModelConfigurationException.class, () -> sum.bindTies(self));

		final Map<ParameterName, TieFunction> outside = new LinkedHashMap<>();
		outside.put(hb(ParameterName.FLUX), TieFunction.of(6));
		assertThrows(ModelConfigurationException.class, () -> sum.bindTies(
			outside));
		assertEquals(good, sum.getTies());
	}

	@Test
	void applyTiesWritesFollowersOnly() {
		final CompositeModel sum = a.plus(b);
		final Map<ParameterName, TieFunction> t = new LinkedHashMap<>();
		t.put(hb(ParameterName.FLUX), TieFunction.of(1, 0.35));
		sum.bindTies(t);
		sum.setParameter(1, 10.0);
		sum.setParameter(hb(ParameterName.FLUX), -1.0);

		sum.applyTies();
		assertEquals(10.0, sum.getParameter(1), 0.0);
		assertEquals(3.5, sum.getParameter(hb(ParameterName.FLUX)), 1e-12);
	}

	@Test
	void setParametersChecksLength() {
		assertThrows(DimensionMismatchException.class, () -> a.setParameters(
			new double[2]));
		assertThrows(ModelConfigurationException.class, () -> a.getParameter(hb(
			ParameterName.FLUX)));
		assertEquals(-1, a.indexOf(hb(ParameterName.FLUX)));
	}

	@Test
	void parametricFormMatchesModel() {
		final CompositeModel sum = a.plus(b);
		final double x = TestSpectra.HALPHA * (1 + TestSpectra.Z) + 1.5;

		assertEquals(sum.value(x), sum.parametric().value(x, sum.getParameters()),
			0.0);
		final double[] g = sum.parametric().gradient(x, sum.getParameters());
		assertEquals(6, g.length);
		assertTrue(Arrays.equals(a.getSubModel(0).gradient(x, a.getParameters()),
			Arrays.copyOfRange(g, 0, 3)));
	}

	@Test
	void validatorClampsThenTies() {
		final CompositeModel sum = a.plus(b);
		final Map<ParameterName, TieFunction> t = new LinkedHashMap<>();
		t.put(hb(ParameterName.DISPERSION), TieFunction.of(2));
		sum.bindTies(t);
		final ParameterValidator validator = new TiedParameterValidator(sum);

		final double[] trial = sum.getParameters();
		trial[2] = 1e6; // above the narrow limit
		trial[5] = 80.0;
		trial[1] = -5.0; // negative emission flux
		final RealVector out = validator.validate(new ArrayRealVector(trial));

		final double max = ModelSettings.defaults().getNarrowDispersionMax();
		assertEquals(max, out.getEntry(2), 0.0);
		assertEquals(max, out.getEntry(5), 0.0);
		assertEquals(0.0, out.getEntry(1), 0.0);
		assertEquals(1e6, trial[2], 0.0);
	}
}
