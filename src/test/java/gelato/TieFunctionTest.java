/**
 * Gelato
 * TieFunctionTest.java
 *
 * Galaxy/AGN Emission Line Analysis TOol: tied multi-component emission line
 * models for astronomical spectra.
 *
 */

package gelato;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.math3.exception.OutOfRangeException;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.junit.jupiter.api.Test;

public class TieFunctionTest {

	@Test
	void identityAndScaledValues() {
		final double[] p = { 2.0, 8.0, -3.0 };

		assertEquals(8.0, TieFunction.of(1).value(p), 0.0);
		assertEquals(-1.5, TieFunction.of(2, 0.5).value(p), 0.0);
		assertEquals(-1.5, TieFunction.of(2, 0.5).value(new ArrayRealVector(p)),
			0.0);
	}

	@Test
	void tiesMadeInALoopKeepTheirOwnIndex() {
		final List<TieFunction> ties = new ArrayList<>();
		int index = 0;
		double scale = 1.0;
		for (int i = 0; i < 4; i++) {
			ties.add(TieFunction.of(index, scale));
			index++;
			scale *= 2;
		}
		final double[] p = { 1.0, 10.0, 100.0, 1000.0 };
		assertEquals(1.0, ties.get(0).value(p), 0.0);
		assertEquals(20.0, ties.get(1).value(p), 0.0);
		assertEquals(400.0, ties.get(2).value(p), 0.0);
		assertEquals(8000.0, ties.get(3).value(p), 0.0);

		p[2] = 7.0;
		assertEquals(28.0, ties.get(2).value(p), 0.0);
	}

	@Test
	void shiftMovesSourceOnly() {
		final TieFunction t = TieFunction.of(3, 0.25).shift(10);
		assertEquals(13, t.getSourceIndex());
		assertEquals(0.25, t.getScale(), 0.0);
	}

	@Test
	void equalityIsByValue() {
		assertEquals(TieFunction.of(2), TieFunction.of(2, 1.0));
		assertEquals(TieFunction.of(2).hashCode(), TieFunction.of(2, 1.0)
			.hashCode());
		assertNotEquals(TieFunction.of(2), TieFunction.of(2, 0.5));
		assertEquals("p[2]", TieFunction.of(2).toString());
	}

	@Test
	void indexMustBeInRange() {
		assertThrows(OutOfRangeException.class, () -> TieFunction.of(-1));
		assertThrows(OutOfRangeException.class, () -> TieFunction.of(5).value(
			new double[3]));
		assertThrows(OutOfRangeException.class, () -> TieFunction.of(5).value(
			new ArrayRealVector(3)));
	}
}
