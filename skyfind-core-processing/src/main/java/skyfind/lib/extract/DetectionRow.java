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
 * One row of a per-frame table: what was found for one catalog object (or uncataloged source) in one frame.
 * 
 * @param index catalog index
 * @param id external identifier, or null
 * @param detected whether the object was found in the frame
 * @param modeled whether an analytic profile was fitted
 * @param fwhm FWHM of the fitted profile in pixels, or NaN
 * @param flux background-subtracted flux, or NaN
 * @param saturation whether a saturated region was removed
 * @param x x position in pixels, or NaN if unknown
 * @param y y position in pixels, or NaN if unknown
 */
public record DetectionRow(int index, String id, boolean detected, boolean modeled, double fwhm, double flux, 
		boolean saturation, double x, double y) implements Serializable {
	
	/**
	 * Create a row for an object that was not found.
	 * @param index
	 * @param id
	 * @param x
	 * @param y
	 * @return
	 */
	public static DetectionRow undetected(int index, String id, double x, double y) {
		return new DetectionRow(index, id, false, false, Double.NaN, Double.NaN, false, x, y);
	}
	
	/**
	 * Query whether a finite flux was measured for a detected object.
	 * @return
	 */
	public boolean hasDetectedFlux() {
		return detected && Double.isFinite(flux);
	}

}
