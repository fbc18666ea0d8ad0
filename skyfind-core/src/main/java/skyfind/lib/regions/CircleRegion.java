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

package skyfind.lib.regions;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;

import skyfind.lib.geom.Point2;

/**
 * A circle.
 * 
 * @author SkyFind developers
 */
public class CircleRegion extends RegionShape {

	private static final long serialVersionUID = 1L;
	
	private final double radius;

	/**
	 * Create a circle.
	 * @param center
	 * @param radius radius in pixels, must be &gt; 0
	 * @param color
	 * @param text
	 */
	public CircleRegion(Point2 center, double radius, String color, String text) {
		super(center, color, text);
		if (!(radius > 0))
			throw new IllegalArgumentException("Circle radius must be > 0, but was " + radius);
		this.radius = radius;
	}
	
	/**
	 * Radius, in pixels.
	 * @return
	 */
	public double getRadius() {
		return radius;
	}

	@Override
	public Geometry toGeometry() {
		return GEOMETRY_FACTORY.createPoint(new Coordinate(getCenter().getX(), getCenter().getY())).buffer(radius, 16);
	}

	@Override
	String toDS9Shape() {
		return "circle(" + format(getCenter().getX() + 1) + "," + format(getCenter().getY() + 1) + "," + format(radius) + ")";
	}

}
