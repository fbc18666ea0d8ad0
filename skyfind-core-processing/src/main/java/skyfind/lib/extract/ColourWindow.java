/*-
 * #%L
 * This file is part of SkyFind.
 * %%
 * Copyright (C) 2024 - 2026 SkyFind developers
 * %%
 * SkyFind is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * SkyFind is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with SkyFind.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package skyfind.lib.extract;

import java.io.Serializable;

/**
 * Allowed range for the colour index between two bands, used to reject spurious star detections.
 * <p>
 * The colour index is {@code -2.5 log10(F_a / F_b)}. It can only be evaluated when both fluxes 
 * are positive; otherwise the window does not reject anything.
 * 
 * @author SkyFind developers
 */
public class ColourWindow implements Serializable {
	
	private static final long serialVersionUID = 1L;
	
	private String bandA;
	private String bandB;
	private double min = Double.NEGATIVE_INFINITY;
	private double max = Double.POSITIVE_INFINITY;
	
	private ColourWindow() {}
	
	/**
	 * Create a colour window.
	 * @param bandA
	 * @param bandB
	 * @param min
	 * @param max
	 */
	public ColourWindow(String bandA, String bandB, double min, double max) {
		this.bandA = bandA;
		this.bandB = bandB;
		this.min = min;
		this.max = max;
	}
	
	/**
	 * Compute the colour index.
	 * @param fluxA
	 * @param fluxB
	 * @return the colour, or NaN if either flux is not positive
	 */
	public static double colour(double fluxA, double fluxB) {
		if (!(fluxA > 0) || !(fluxB > 0))
			return Double.NaN;
		return -2.5 * Math.log10(fluxA / fluxB);
	}
	
	/**
	 * Query whether two fluxes pass this window.
	 * @param fluxA flux in band A
	 * @param fluxB flux in band B
	 * @return false only if the colour can be evaluated and lies outside the window
	 */
	public boolean accepts(double fluxA, double fluxB) {
		double c = colour(fluxA, fluxB);
		if (Double.isNaN(c))
			return true;
		return c >= min && c <= max;
	}
	
	/**
	 * Check that the window is usable.
	 * @throws IllegalArgumentException
	 */
	public void validate() throws IllegalArgumentException {
		if (bandA == null || bandB == null)
			throw new IllegalArgumentException("Colour window needs two bands");
		if (!(min < max))
			throw new IllegalArgumentException("Colour window " + this + " is empty");
	}

	public String getBandA() {
		return bandA;
	}

	public String getBandB() {
		return bandB;
	}

	public double getMin() {
		return min;
	}

	public double getMax() {
		return max;
	}
	
	@Override
	public String toString() {
		return bandA + "-" + bandB + " [" + min + ", " + max + "]";
	}

}
