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

package skyfind.lib.geom;

import java.io.Serializable;
import java.util.Collection;

/**
 * A rectangular region of the sky in right ascension and declination.
 * <p>
 * Boxes crossing RA = 0 are not handled specially; the RA range is taken as-is.
 * 
 * @author SkyFind developers
 */
public final class SkyBoundingBox implements Serializable {
	
	private static final long serialVersionUID = 1L;

	private final double minRA, maxRA, minDec, maxDec;
	
	private SkyBoundingBox(double minRA, double maxRA, double minDec, double maxDec) {
		this.minRA = minRA;
		this.maxRA = maxRA;
		this.minDec = minDec;
		this.maxDec = maxDec;
	}
	
	/**
	 * Create a bounding box from its limits, in degrees.
	 * @param minRA
	 * @param maxRA
	 * @param minDec
	 * @param maxDec
	 * @return
	 * @throws IllegalArgumentException if a minimum exceeds its maximum
	 */
	public static SkyBoundingBox createInstance(double minRA, double maxRA, double minDec, double maxDec) {
		if (minRA > maxRA || minDec > maxDec)
			throw new IllegalArgumentException("Invalid bounding box limits RA [" + minRA + ", " + maxRA + "], Dec [" + minDec + ", " + maxDec + "]");
		return new SkyBoundingBox(minRA, maxRA, minDec, maxDec);
	}
	
	/**
	 * Get the smallest box containing all the given coordinates.
	 * @param coordinates
	 * @return
	 * @throws IllegalArgumentException if the collection is empty
	 */
	public static SkyBoundingBox enclosing(Collection<SkyCoordinate> coordinates) {
		if (coordinates.isEmpty())
			throw new IllegalArgumentException("Cannot create a bounding box from no coordinates");
		double minRA = Double.POSITIVE_INFINITY, maxRA = Double.NEGATIVE_INFINITY;
		double minDec = Double.POSITIVE_INFINITY, maxDec = Double.NEGATIVE_INFINITY;
		for (var c : coordinates) {
			minRA = Math.min(minRA, c.getRA());
			maxRA = Math.max(maxRA, c.getRA());
			minDec = Math.min(minDec, c.getDec());
			maxDec = Math.max(maxDec, c.getDec());
		}
		return new SkyBoundingBox(minRA, maxRA, minDec, maxDec);
	}
	
	/**
	 * Get the smallest box containing this box and another.
	 * @param other
	 * @return
	 */
	public SkyBoundingBox union(SkyBoundingBox other) {
		return new SkyBoundingBox(
				Math.min(minRA, other.minRA), Math.max(maxRA, other.maxRA),
				Math.min(minDec, other.minDec), Math.max(maxDec, other.maxDec));
	}
	
	/**
	 * Query whether a coordinate falls inside this box (inclusive).
	 * @param coordinate
	 * @return
	 */
	public boolean contains(SkyCoordinate coordinate) {
		return coordinate.getRA() >= minRA && coordinate.getRA() <= maxRA &&
				coordinate.getDec() >= minDec && coordinate.getDec() <= maxDec;
	}
	
	/**
	 * Central coordinate of the box.
	 * @return
	 */
	public SkyCoordinate getCenter() {
		return new SkyCoordinate((minRA + maxRA) / 2.0, (minDec + maxDec) / 2.0);
	}

	@SuppressWarnings("javadoc")
	public double getMinRA() {
		return minRA;
	}

	@SuppressWarnings("javadoc")
	public double getMaxRA() {
		return maxRA;
	}

	@SuppressWarnings("javadoc")
	public double getMinDec() {
		return minDec;
	}

	@SuppressWarnings("javadoc")
	public double getMaxDec() {
		return maxDec;
	}

	@Override
	public String toString() {
		return "SkyBoundingBox [RA " + minRA + " - " + maxRA + ", Dec " + minDec + " - " + maxDec + "]";
	}

}
