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
 * Parameters for replacing stars by their local background.
 * 
 * @author SkyFind developers
 */
public class RemovalConfig implements Serializable {
	
	private static final long serialVersionUID = 1L;
	
	private boolean remove = true;
	private double sigmaLevel = 4.0;
	private double outerFactor = 1.6;
	private boolean removeIfUndetected = false;
	private boolean removeForeground = false;
	
	/**
	 * Check that all values are usable.
	 * @throws IllegalArgumentException
	 */
	public void validate() throws IllegalArgumentException {
		if (!(sigmaLevel > 0))
			throw new IllegalArgumentException("Removal sigma level must be > 0, but was " + sigmaLevel);
		if (!(outerFactor > Source.DEFAULT_INNER_FACTOR))
			throw new IllegalArgumentException("Removal outer factor must be > " + Source.DEFAULT_INNER_FACTOR + ", but was " + outerFactor);
	}

	public boolean isRemove() {
		return remove;
	}

	public void setRemove(boolean remove) {
		this.remove = remove;
	}

	/**
	 * Radius of the removed region, in units of the profile sigma.
	 * @return
	 */
	public double getSigmaLevel() {
		return sigmaLevel;
	}

	public double getOuterFactor() {
		return outerFactor;
	}

	public boolean isRemoveIfUndetected() {
		return removeIfUndetected;
	}

	public void setRemoveIfUndetected(boolean removeIfUndetected) {
		this.removeIfUndetected = removeIfUndetected;
	}

	/**
	 * Whether stars lying on top of the principal galaxy are removed too.
	 * @return
	 */
	public boolean isRemoveForeground() {
		return removeForeground;
	}

	public void setRemoveForeground(boolean removeForeground) {
		this.removeForeground = removeForeground;
	}

}
