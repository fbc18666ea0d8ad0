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

/**
 * An equatorial sky position, with right ascension and declination in degrees.
 * 
 * @author SkyFind developers
 */
public final class SkyCoordinate implements Serializable {

	private static final long serialVersionUID = 1L;
	
	private final double ra;
	private final double dec;
	
	/**
	 * Create a sky coordinate.
	 * @param ra right ascension in degrees, wrapped into [0, 360)
	 * @param dec declination in degrees, in [-90, 90]
	 * @throws IllegalArgumentException if the declination is out of range or either value is not finite
	 */
	public SkyCoordinate(double ra, double dec) {
		if (!Double.isFinite(ra) || !Double.isFinite(dec) || Math.abs(dec) > 90)
			throw new IllegalArgumentException("Invalid sky coordinate (" + ra + ", " + dec + ")");
		double wrapped = ra % 360.0;
		this.ra = wrapped < 0 ? wrapped + 360.0 : wrapped;
		this.dec = dec;
	}
	
	/**
	 * Right ascension, in degrees.
	 * @return
	 */
	public double getRA() {
		return ra;
	}
	
	/**
	 * Declination, in degrees.
	 * @return
	 */
	public double getDec() {
		return dec;
	}
	
	/**
	 * Great-circle separation from another coordinate, in degrees (haversine formula).
	 * @param other
	 * @return
	 */
	public double separation(SkyCoordinate other) {
		double dec1 = Math.toRadians(dec);
		double dec2 = Math.toRadians(other.dec);
		double dRA = Math.toRadians(other.ra - ra);
		double sinDDec = Math.sin((dec2 - dec1) / 2);
		double sinDRA = Math.sin(dRA / 2);
		double a = sinDDec * sinDDec + Math.cos(dec1) * Math.cos(dec2) * sinDRA * sinDRA;
		return Math.toDegrees(2 * Math.asin(Math.min(1.0, Math.sqrt(a))));
	}

	@Override
	public int hashCode() {
		return Double.hashCode(ra) * 31 + Double.hashCode(dec);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof SkyCoordinate other))
			return false;
		return Double.compare(ra, other.ra) == 0 && Double.compare(dec, other.dec) == 0;
	}

	@Override
	public String toString() {
		return String.format("SkyCoordinate (%.6f, %.6f)", ra, dec);
	}
	
}
