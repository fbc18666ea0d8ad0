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

package skyfind.lib.sources;

import java.io.Serializable;

/**
 * Parameters for finding and removing saturated stars.
 * 
 * @author SkyFind developers
 */
public class SaturationConfig implements Serializable {
	
	private static final long serialVersionUID = 1L;
	
	private boolean remove = false;
	private SaturationMethod method = SaturationMethod.BRIGHTEST;
	private FluxCutoff cutoff = FluxCutoff.PERCENTAGE;
	private double cutoffValue = 10.0;
	private double sigmas = 10.0;
	private boolean expand = true;
	private int maxExpansionLevel = 3;
	private double expansionFactor = 1.5;
	private boolean apertureRemoval = false;
	private double apertureFactor = 1.5;
	private boolean removeIfUndetected = false;
	private boolean removeForeground = false;
	
	/**
	 * Check that all values are usable.
	 * @throws IllegalArgumentException
	 */
	public void validate() throws IllegalArgumentException {
		if (method == null)
			throw new IllegalArgumentException("Unknown saturation method");
		if (cutoff == null)
			throw new IllegalArgumentException("Unknown saturation cutoff method");
		if (cutoff == FluxCutoff.PERCENTAGE && !(cutoffValue > 0 && cutoffValue <= 100))
			throw new IllegalArgumentException("Saturation cutoff percentage must be in (0, 100], but was " + cutoffValue);
		if (!(sigmas > 0))
			throw new IllegalArgumentException("Saturation sigmas must be > 0, but was " + sigmas);
		if (!(expansionFactor > 1) || maxExpansionLevel < 0)
			throw new IllegalArgumentException("Saturation expansion factor must be > 1 and expansion level >= 0");
		if (!(apertureFactor > 0))
			throw new IllegalArgumentException("Aperture factor must be > 0, but was " + apertureFactor);
	}

	public boolean isRemove() {
		return remove;
	}

	public void setRemove(boolean remove) {
		this.remove = remove;
	}

	public SaturationMethod getMethod() {
		return method;
	}

	public void setMethod(SaturationMethod method) {
		this.method = method;
	}

	public FluxCutoff getCutoff() {
		return cutoff;
	}

	public double getCutoffValue() {
		return cutoffValue;
	}

	/**
	 * Radius of the saturation search, in units of the profile sigma.
	 * @return
	 */
	public double getSigmas() {
		return sigmas;
	}

	public boolean isExpand() {
		return expand;
	}

	public int getMaxExpansionLevel() {
		return maxExpansionLevel;
	}

	public double getExpansionFactor() {
		return expansionFactor;
	}

	/**
	 * Whether an elliptical aperture around each saturation segment is removed as well.
	 * @return
	 */
	public boolean isApertureRemoval() {
		return apertureRemoval;
	}

	public double getApertureFactor() {
		return apertureFactor;
	}

	/**
	 * Whether stars without a source are searched for saturation as well.
	 * @return
	 */
	public boolean isRemoveIfUndetected() {
		return removeIfUndetected;
	}

	public void setRemoveIfUndetected(boolean removeIfUndetected) {
		this.removeIfUndetected = removeIfUndetected;
	}

	/**
	 * Whether saturation is removed for stars in front of the principal galaxy.
	 * @return
	 */
	public boolean isRemoveForeground() {
		return removeForeground;
	}

	public void setRemoveForeground(boolean removeForeground) {
		this.removeForeground = removeForeground;
	}

}
