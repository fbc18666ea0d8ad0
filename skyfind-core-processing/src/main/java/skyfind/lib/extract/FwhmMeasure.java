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

import java.util.Collection;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import com.google.gson.annotations.SerializedName;

/**
 * Ways to combine the FWHM values of fitted stars into a single frame FWHM.
 */
public enum FwhmMeasure {
	
	@SerializedName("max")
	MAX,
	
	@SerializedName("mean")
	MEAN,
	
	@SerializedName("median")
	MEDIAN;
	
	/**
	 * Combine values, ignoring any that are not finite.
	 * @param values
	 * @return the combined value, or NaN if there are no finite values
	 */
	public double combine(Collection<Double> values) {
		var stats = new DescriptiveStatistics();
		for (var v : values) {
			if (v != null && Double.isFinite(v))
				stats.addValue(v);
		}
		if (stats.getN() == 0)
			return Double.NaN;
		switch (this) {
		case MAX:
			return stats.getMax();
		case MEAN:
			return stats.getMean();
		case MEDIAN:
			return stats.getPercentile(50);
		default:
			throw new IllegalArgumentException("Unknown FWHM measure " + this);
		}
	}

}
