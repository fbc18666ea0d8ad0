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

import java.io.Serializable;
import java.util.Locale;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;

import skyfind.lib.geom.Point2;
import skyfind.lib.images.Mask;

/**
 * An annotated shape in pixel coordinates, used to describe what was found in a frame.
 * 
 * @author SkyFind developers
 */
public abstract class RegionShape implements Serializable {
	
	private static final long serialVersionUID = 1L;

	static final GeometryFactory GEOMETRY_FACTORY = new GeometryFactory();
	
	private final Point2 center;
	private final String color;
	private final String text;
	
	RegionShape(Point2 center, String color, String text) {
		this.center = center;
		this.color = color == null ? "green" : color;
		this.text = text;
	}
	
	/**
	 * Center of the shape, in 0-based pixel coordinates.
	 * @return
	 */
	public Point2 getCenter() {
		return center;
	}
	
	/**
	 * Display color name.
	 * @return
	 */
	public String getColor() {
		return color;
	}
	
	/**
	 * Annotation text, or null.
	 * @return
	 */
	public String getText() {
		return text;
	}
	
	/**
	 * Get a JTS geometry for this shape, in pixel coordinates.
	 * @return
	 */
	public abstract Geometry toGeometry();
	
	/**
	 * Get the shape part of a DS9 region line (in 1-based image coordinates), without properties.
	 * @return
	 */
	abstract String toDS9Shape();
	
	/**
	 * Get the DS9 region line for this shape.
	 * @return
	 */
	public String toDS9() {
		var sb = new StringBuilder(toDS9Shape());
		sb.append(" # color=").append(color);
		if (text != null && !text.isBlank())
			sb.append(" text={").append(text).append("}");
		return sb.toString();
	}
	
	/**
	 * Rasterize this shape, marking pixels whose centers fall inside it.
	 * Shapes without area give an empty mask.
	 * @param width
	 * @param height
	 * @return
	 */
	public Mask toMask(int width, int height) {
		var mask = Mask.createEmpty(width, height);
		var geometry = toGeometry();
		if (geometry.getArea() <= 0)
			return mask;
		paint(geometry, mask);
		return mask;
	}
	
	static void paint(Geometry geometry, Mask mask) {
		PreparedGeometry prepared = PreparedGeometryFactory.prepare(geometry);
		Envelope env = geometry.getEnvelopeInternal();
		int xStart = Math.max(0, (int)Math.floor(env.getMinX()));
		int yStart = Math.max(0, (int)Math.floor(env.getMinY()));
		int xEnd = Math.min(mask.getWidth() - 1, (int)Math.ceil(env.getMaxX()));
		int yEnd = Math.min(mask.getHeight() - 1, (int)Math.ceil(env.getMaxY()));
		for (int y = yStart; y <= yEnd; y++) {
			for (int x = xStart; x <= xEnd; x++) {
				if (prepared.contains(GEOMETRY_FACTORY.createPoint(new Coordinate(x, y))))
					mask.set(x, y, true);
			}
		}
	}
	
	static String format(double value) {
		return String.format(Locale.ROOT, "%.3f", value);
	}
	
}
