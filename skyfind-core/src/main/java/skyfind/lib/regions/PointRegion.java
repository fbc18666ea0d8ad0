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
 * A point marker.
 * 
 * @author SkyFind developers
 */
public class PointRegion extends RegionShape {

	private static final long serialVersionUID = 1L;

	/**
	 * Create a point marker.
	 * @param center
	 * @param color
	 * @param text
	 */
	public PointRegion(Point2 center, String color, String text) {
		super(center, color, text);
	}

	@Override
	public Geometry toGeometry() {
		return GEOMETRY_FACTORY.createPoint(new Coordinate(getCenter().getX(), getCenter().getY()));
	}

	@Override
	String toDS9Shape() {
		return "point(" + format(getCenter().getX() + 1) + "," + format(getCenter().getY() + 1) + ")";
	}
	
	@Override
	public String toDS9() {
		return super.toDS9() + " point=x";
	}

}
