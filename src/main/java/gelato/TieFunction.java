/**
 * Gelato
 * TieFunction.java
 *
 * Galaxy/AGN Emission Line Analysis TOol: tied multi-component emission line
 * models for astronomical spectra.
 *
 */

package gelato;

import org.apache.commons.math3.exception.OutOfRangeException;
import org.apache.commons.math3.linear.RealVector;

/**
 * Value a tied parameter must take: the parameter at {@code sourceIndex} of
 * the composite parameter vector, multiplied by {@code scale}.
 * <p>
 * The index and scale are fixed when the tie is made, so a tie generated
 * inside a loop keeps pointing at the slot that was current at that time.
 */
public final class TieFunction {

	private final int sourceIndex;
	private final double scale;

	private TieFunction(final int sourceIndex, final double scale) {
		if (sourceIndex < 0) {
			throw new OutOfRangeException(sourceIndex, 0, Integer.MAX_VALUE);
		}
		this.sourceIndex = sourceIndex;
		this.scale = scale;
	}

	/**
	 * Identity tie on the parameter at {@code sourceIndex}.
	 */
	public static TieFunction of(final int sourceIndex) {
		return new TieFunction(sourceIndex, 1.0);
	}

	/**
	 * Linearly scaled tie on the parameter at {@code sourceIndex}.
	 */
	public static TieFunction of(final int sourceIndex, final double scale) {
		return new TieFunction(sourceIndex, scale);
	}

	/**
	 * @param parameters the full composite parameter vector
	 * @return {@code parameters[sourceIndex] * scale}
	 */
	public double value(final double[] parameters) {
		checkSource(parameters.length);
		return parameters[sourceIndex] * scale;
	}

	public double value(final RealVector parameters) {
		checkSource(parameters.getDimension());
		return parameters.getEntry(sourceIndex) * scale;
	}

	private void checkSource(final int length) {
		if (sourceIndex >= length) {
			throw new OutOfRangeException(sourceIndex, 0, length - 1);
		}
	}

	/**
	 * Same tie, with the source moved {@code offset} slots to the right. Used
	 * when the owning model is appended after another one.
	 */
	TieFunction shift(final int offset) {
		return new TieFunction(sourceIndex + offset, scale);
	}

	public int getSourceIndex() {
		return sourceIndex;
	}

	public double getScale() {
		return scale;
	}

	@Override
	public boolean equals(final Object o) {
		if (this == o) return true;
		if (!(o instanceof TieFunction)) return false;
		final TieFunction t = (TieFunction) o;
		return sourceIndex == t.sourceIndex &&
			Double.compare(scale, t.scale) == 0;
	}

	@Override
	public int hashCode() {
		return 31 * sourceIndex + Double.hashCode(scale);
	}

	@Override
	public String toString() {
		if (scale == 1.0) return "p[" + sourceIndex + "]";
		return String.format("%1$.6g * p[%2$d]", scale, sourceIndex);
	}
}
