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

package skyfind.lib.analysis.stats;

import java.io.Serializable;

/**
 * Summary statistics of the values that survived sigma-clipping.
 * 
 * @author SkyFind developers
 */
public final class ClippedStatistics implements Serializable {
	
	private static final long serialVersionUID = 1L;

	private final double mean;
	private final double median;
	private final double stdDev;
	private final int nKept;
	private final int nRejected;
	
	ClippedStatistics(double mean, double median, double stdDev, int nKept, int nRejected) {
		this.mean = mean;
		this.median = median;
		this.stdDev = stdDev;
		this.nKept = nKept;
		this.nRejected = nRejected;
	}

	/**
	 * Mean of the retained values.
	 * @return
	 */
	public double getMean() {
		return mean;
	}

	/**
	 * Median of the retained values.
	 * @return
	 */
	public double getMedian() {
		return median;
	}

	/**
	 * Population standard deviation of the retained values.
	 * @return
	 */
	public double getStdDev() {
		return stdDev;
	}

	/**
	 * Number of values retained.
	 * @return
	 */
	public int getNKept() {
		return nKept;
	}
	
	/**
	 * Number of values rejected as outliers.
	 * @return
	 */
	public int getNRejected() {
		return nRejected;
	}

	@Override
	public String toString() {
		return "ClippedStatistics [mean=" + mean + ", median=" + median + ", stdDev=" + stdDev + ", n=" + nKept + ", rejected=" + nRejected + "]";
	}

}
