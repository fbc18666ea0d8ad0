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
import org.locationtech.jts.util.GeometricShapeFactory;

import skyfind.lib.geom.Point2;
import skyfind.lib.images.Mask;

/**
 * An ellipse, used for extended sources and saturation apertures.
 * 
 * @author SkyFind developers
 */
public class EllipseRegion extends RegionShape {

	private static final long serialVersionUID = 1L;
	
	private final double semiMajor;
	private final double semiMinor;
	private final double angle;

	/**
	 * Create an ellipse.
	 * @param center
	 * @param semiMajor semi-major axis in pixels
	 * @param semiMinor semi-minor axis in pixels
	 * @param angle angle of the major axis from the x axis, in degrees
	 * @param color
	 * @param text
	 */
	public EllipseRegion(Point2 center, double semiMajor, double semiMinor, double angle, String color, String text) {
		super(center, color, text);
		if (!(semiMajor > 0) || !(semiMinor > 0))
			throw new IllegalArgumentException("Ellipse axes must be > 0, but were " + semiMajor + " and " + semiMinor);
		this.semiMajor = semiMajor;
		this.semiMinor = semiMinor;
		this.angle = angle;
	}
	
	/**
	 * Create the ellipse with the same second moments as the true pixels of a mask.
	 * <p>
	 * With a factor of 1, a uniformly-filled elliptical mask gives back (approximately) its own outline.
	 * 
	 * @param mask
	 * @param x0 x offset added to mask coordinates
	 * @param y0 y offset added to mask coordinates
	 * @param factor scale factor for both axes
	 * @param minAxis lower limit for both semi-axes, in pixels
	 * @param color
	 * @param text
	 * @return the ellipse, or null if the mask is empty
	 */
	public static EllipseRegion fromMask(Mask mask, int x0, int y0, double factor, double minAxis, String color, String text) {
		var moments = new PixelMoments();
		for (int y = 0; y < mask.getHeight(); y++) {
			for (int x = 0; x < mask.getWidth(); x++) {
				if (mask.get(x, y))
					moments.add(x + x0, y + y0);
			}
		}
		return moments.toEllipse(factor, minAxis, color, text);
	}
	
	/**
	 * Create a new ellipse scaled by a constant factor.
	 * @param factor
	 * @return
	 */
	public EllipseRegion scale(double factor) {
		return new EllipseRegion(getCenter(), semiMajor * factor, semiMinor * factor, angle, getColor(), getText());
	}

	@SuppressWarnings("javadoc")
	public double getSemiMajor() {
		return semiMajor;
	}

	@SuppressWarnings("javadoc")
	public double getSemiMinor() {
		return semiMinor;
	}

	@SuppressWarnings("javadoc")
	public double getAngle() {
		return angle;
	}

	@Override
	public Geometry toGeometry() {
		var factory = new GeometricShapeFactory(GEOMETRY_FACTORY);
		factory.setCentre(new Coordinate(getCenter().getX(), getCenter().getY()));
		factory.setWidth(semiMajor * 2);
		factory.setHeight(semiMinor * 2);
		factory.setRotation(Math.toRadians(angle));
		factory.setNumPoints(64);
		return factory.createEllipse();
	}

	@Override
	String toDS9Shape() {
		return "ellipse(" + format(getCenter().getX() + 1) + "," + format(getCenter().getY() + 1) + "," +
				format(semiMajor) + "," + format(semiMinor) + "," + format(angle) + ")";
	}

}
