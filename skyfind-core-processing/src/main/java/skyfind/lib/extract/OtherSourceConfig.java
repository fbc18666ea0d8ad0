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

import skyfind.lib.sources.Source;

/**
 * Settings for finding sources that are not in any catalog.
 * 
 * @author SkyFind developers
 */
public class OtherSourceConfig implements Serializable {
	
	private static final long serialVersionUID = 1L;
	
	private boolean find = true;
	private double thresholdSigmas = 3.0;
	private int minPixels = 5;
	private double clipSigma = 3.0;
	private boolean remove = false;
	private double outerFactor = 1.5;
	
	void validate() {
		if (!(thresholdSigmas > 0))
			throw new IllegalArgumentException("Other source threshold must be > 0, but was " + thresholdSigmas);
		if (minPixels < 1)
			throw new IllegalArgumentException("Minimum segment size must be >= 1, but was " + minPixels);
		if (!(clipSigma > 0))
			throw new IllegalArgumentException("Clipping sigma must be > 0, but was " + clipSigma);
		if (!(outerFactor > Source.DEFAULT_INNER_FACTOR))
			throw new IllegalArgumentException("Other source outer factor must be > " + Source.DEFAULT_INNER_FACTOR);
	}

	public boolean isFind() {
		return find;
	}

	public void setFind(boolean find) {
		this.find = find;
	}

	/**
	 * Detection threshold, in sigma-clipped standard deviations above the median.
	 * @return
	 */
	public double getThresholdSigmas() {
		return thresholdSigmas;
	}

	public void setThresholdSigmas(double thresholdSigmas) {
		this.thresholdSigmas = thresholdSigmas;
	}

	public int getMinPixels() {
		return minPixels;
	}

	public double getClipSigma() {
		return clipSigma;
	}

	public boolean isRemove() {
		return remove;
	}

	public void setRemove(boolean remove) {
		this.remove = remove;
	}

	public double getOuterFactor() {
		return outerFactor;
	}

}
