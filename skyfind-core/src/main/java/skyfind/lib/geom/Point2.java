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
 * An immutable 2D point in pixel coordinates.
 * <p>
 * Pixel coordinates are zero-based, with integer values at pixel centers.
 * 
 * @author SkyFind developers
 *
 */
public final class Point2 implements Serializable {
	
	private static final long serialVersionUID = 1L;
	
	private final double x, y;
	
	/**
	 * Point constructor.
	 * @param x
	 * @param y
	 */
	public Point2(final double x, final double y) {
		this.x = x;
		this.y = y;
	}
	
	/**
	 * Get the x coordinate of this point.
	 * @return
	 */
	public double getX() {
		return x;
	}

	/**
	 * Get the y coordinate of this point.
	 * @return
	 */
	public double getY() {
		return y;
	}
	
	/**
	 * Get the column of the pixel containing this point.
	 * @return
	 */
	public int getPixelX() {
		return (int)Math.round(x);
	}
	
	/**
	 * Get the row of the pixel containing this point.
	 * @return
	 */
	public int getPixelY() {
		return (int)Math.round(y);
	}

	/**
	 * Calculate the squared distance between this point and a specified x and y location.
	 * @param x
	 * @param y
	 * @return
	 */
	public double distanceSq(final double x, final double y) {
		double dx = this.x - x;
		double dy = this.y - y;
		return dx * dx + dy * dy;
	}
	
	/**
	 * Calculate the distance between this point and a specified x and y location.
	 * @param x
	 * @param y
	 * @return
	 */
	public double distance(final double x, final double y) {
		return Math.sqrt(distanceSq(x, y));
	}
	
	/**
	 * Calculate the distance between this point and another point.
	 * @param p
	 * @return
	 */
	public double distance(final Point2 p) {
		return distance(p.getX(), p.getY());
	}
	
	/**
	 * Create a new point shifted by the specified amounts.
	 * @param dx
	 * @param dy
	 * @return
	 */
	public Point2 translate(double dx, double dy) {
		return new Point2(x + dx, y + dy);
	}
	
	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		long temp;
		temp = Double.doubleToLongBits(x);
		result = prime * result + (int) (temp ^ (temp >>> 32));
		temp = Double.doubleToLongBits(y);
		result = prime * result + (int) (temp ^ (temp >>> 32));
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof Point2 other))
			return false;
		return Double.doubleToLongBits(x) == Double.doubleToLongBits(other.x) &&
				Double.doubleToLongBits(y) == Double.doubleToLongBits(other.y);
	}
	
	@Override
	public String toString() {
		return "Point: " + x + ", " + y;
	}

}
