/**
 * Gelato
 * ModelSettingsTest.java
 *
 * Galaxy/AGN Emission Line Analysis TOol: tied multi-component emission line
 * models for astronomical spectra.
 *
 */

package gelato;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.prefs.BackingStoreException;
import java.util.prefs.Preferences;

import org.apache.commons.math3.exception.NumberIsTooSmallException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class ModelSettingsTest {

	private Preferences prefs;

	@BeforeEach
	void setUp() {
		prefs = Preferences.userRoot().node("gelato-test-" + System.nanoTime());
	}

	@AfterEach
	void tearDown() throws BackingStoreException {
		prefs.removeNode();
	}

	@Test
	void missingKeysFallBackToDefaults() {
		final ModelSettings s = ModelSettings.load(prefs);
		final ModelSettings d = ModelSettings.defaults();

		assertEquals(d.getNarrowDispersion(), s.getNarrowDispersion(), 0.0);
		assertEquals(d.getBroadDispersionMax(), s.getBroadDispersionMax(), 0.0);
		assertEquals(d.getContinuumDegree(), s.getContinuumDegree());
	}

	@Test
	void storedValuesAreReadBack() {
		prefs.putDouble(ModelSettings.NARROWDISP, 90.0);
		prefs.putInt(ModelSettings.DEGCONT, 3);
		final ModelSettings s = ModelSettings.load(prefs);
		assertEquals(90.0, s.getNarrowDispersion(), 0.0);
		assertEquals(3, s.getContinuumDegree());

		final Preferences copy = prefs.node("copy");
		s.store(copy);
		assertEquals(90.0, ModelSettings.load(copy).getNarrowDispersion(), 0.0);
		assertEquals(s.getOutflowVelocity(), ModelSettings.load(copy)
			.getOutflowVelocity(), 0.0);
	}

	@Test
	void inconsistentValuesAreRejected() {
		prefs.putDouble(ModelSettings.NARROWDISP, 1000.0); // above narrow maximum
		assertThrows(NumberIsTooSmallException.class, () -> ModelSettings.load(
			prefs));
	}

	@Test
	void settingsDriveComponentDefaults() {
		prefs.putDouble(ModelSettings.BROADDISP, 2500.0);
		final ModelSettings s = ModelSettings.load(prefs);
		final Spectrum base = TestSpectra.spectrum();
		final Spectrum spectrum = new Spectrum(base.getWavelength().toArray(), base
			.getFlux().toArray(), base.getSigma().toArray(), TestSpectra.Z,
			TestSpectra.regions(), TestSpectra.hierarchy(), s);

		final SpectralComponent broad = new SpectralFeatureFactory().create(-1,
			TestSpectra.HALPHA, spectrum);
		assertEquals(2500.0, broad.getInitialParameters()[2], 0.0);
	}
}
