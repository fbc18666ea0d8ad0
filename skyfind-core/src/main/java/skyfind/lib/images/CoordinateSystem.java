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

package skyfind.lib.images;

import java.io.Serializable;
import java.util.List;

import skyfind.lib.geom.Point2;
import skyfind.lib.geom.SkyBoundingBox;
import skyfind.lib.geom.SkyCoordinate;

/**
 * Gnomonic (TAN) world coordinate system for a frame.
 * <p>
 * Reference pixels follow the FITS convention (1-based), while all pixel coordinates accepted 
 * and returned by this class are 0-based.
 * 
 * @author SkyFind developers
 */
public final class CoordinateSystem implements Serializable {
	
	private static final long serialVersionUID = 1L;

	private final double crpix1, crpix2;
	private final double crval1, crval2;
	private final double cd11, cd12, cd21, cd22;
	private final int width, height;
	
	/**
	 * Create a coordinate system from FITS WCS parameters.
	 * @param width frame width in pixels
	 * @param height frame height in pixels
	 * @param crpix1 reference pixel x (1-based)
	 * @param crpix2 reference pixel y (1-based)
	 * @param crval1 reference right ascension, in degrees
	 * @param crval2 reference declination, in degrees
	 * @param cd11 
	 * @param cd12 
	 * @param cd21 
	 * @param cd22 
	 */
	public CoordinateSystem(int width, int height, double crpix1, double crpix2, double crval1, double crval2,
			double cd11, double cd12, double cd21, double cd22) {
		if (width <= 0 || height <= 0)
			throw new IllegalArgumentException("Frame dimensions must be > 0, but were " + width + "x" + height);
		double det = cd11 * cd22 - cd12 * cd21;
		if (det == 0 || !Double.isFinite(det))
			throw new IllegalArgumentException("CD matrix is singular");
		this.width = width;
		this.height = height;
		this.crpix1 = crpix1;
		this.crpix2 = crpix2;
		this.crval1 = crval1;
		this.crval2 = crval2;
		this.cd11 = cd11;
		this.cd12 = cd12;
		this.cd21 = cd21;
		this.cd22 = cd22;
	}
	
	/**
	 * Create a north-up, east-left coordinate system centered on a sky position.
	 * @param center sky position of the frame center
	 * @param pixelScale pixel scale in arcseconds
	 * @param width
	 * @param height
	 * @return
	 */
	public static CoordinateSystem createInstance(SkyCoordinate center, double pixelScale, int width, int height) {
		double scale = pixelScale / 3600.0;
		return new CoordinateSystem(width, height, (width + 1) / 2.0, (height + 1) / 2.0,
				center.getRA(), center.getDec(), -scale, 0, 0, scale);
	}
	
	/**
	 * Convert a sky position to 0-based pixel coordinates.
	 * @param coordinate
	 * @return
	 */
	public Point2 toPixel(SkyCoordinate coordinate) {
		double ra = Math.toRadians(coordinate.getRA());
		double dec = Math.toRadians(coordinate.getDec());
		double ra0 = Math.toRadians(crval1);
		double dec0 = Math.toRadians(crval2);
		double cosC = Math.sin(dec0) * Math.sin(dec) + Math.cos(dec0) * Math.cos(dec) * Math.cos(ra - ra0);
		if (cosC <= 0)
			return new Point2(Double.NaN, Double.NaN);
		double xi = Math.toDegrees(Math.cos(dec) * Math.sin(ra - ra0) / cosC);
		double eta = Math.toDegrees((Math.cos(dec0) * Math.sin(dec) - Math.sin(dec0) * Math.cos(dec) * Math.cos(ra - ra0)) / cosC);
		double det = cd11 * cd22 - cd12 * cd21;
		double dx = (cd22 * xi - cd12 * eta) / det;
		double dy = (-cd21 * xi + cd11 * eta) / det;
		return new Point2(dx + crpix1 - 1, dy + crpix2 - 1);
	}
	
	/**
	 * Convert 0-based pixel coordinates to a sky position.
	 * @param x
	 * @param y
	 * @return
	 */
	public SkyCoordinate toSky(double x, double y) {
		double dx = x + 1 - crpix1;
		double dy = y + 1 - crpix2;
		double xi = Math.toRadians(cd11 * dx + cd12 * dy);
		double eta = Math.toRadians(cd21 * dx + cd22 * dy);
		double ra0 = Math.toRadians(crval1);
		double dec0 = Math.toRadians(crval2);
		double denom = Math.cos(dec0) - eta * Math.sin(dec0);
		double ra = ra0 + Math.atan2(xi, denom);
		double dec = Math.atan2(eta * Math.cos(dec0) + Math.sin(dec0), Math.sqrt(xi * xi + denom * denom));
		return new SkyCoordinate(Math.toDegrees(ra), Math.toDegrees(dec));
	}
	
	/**
	 * Get the sky position of a pixel.
	 * @param point
	 * @return
	 */
	public SkyCoordinate toSky(Point2 point) {
		return toSky(point.getX(), point.getY());
	}
	
	/**
	 * Average pixel scale, in arcseconds.
	 * @return
	 */
	public double getPixelScale() {
		return Math.sqrt(Math.abs(cd11 * cd22 - cd12 * cd21)) * 3600.0;
	}
	
	/**
	 * Query whether a sky position falls within the frame.
	 * @param coordinate
	 * @return
	 */
	public boolean contains(SkyCoordinate coordinate) {
		var p = toPixel(coordinate);
		return p.getX() >= -0.5 && p.getY() >= -0.5 && p.getX() < width - 0.5 && p.getY() < height - 0.5;
	}
	
	/**
	 * Get the sky bounding box of the frame, computed from its corners.
	 * @return
	 */
	public SkyBoundingBox getBoundingBox() {
		return SkyBoundingBox.enclosing(List.of(
				toSky(-0.5, -0.5),
				toSky(width - 0.5, -0.5),
				toSky(-0.5, height - 0.5),
				toSky(width - 0.5, height - 0.5)
				));
	}

	@SuppressWarnings("javadoc")
	public int getWidth() {
		return width;
	}

	@SuppressWarnings("javadoc")
	public int getHeight() {
		return height;
	}

	@SuppressWarnings("javadoc")
	public double getCrpix1() {
		return crpix1;
	}

	@SuppressWarnings("javadoc")
	public double getCrpix2() {
		return crpix2;
	}

	@SuppressWarnings("javadoc")
	public double getCrval1() {
		return crval1;
	}

	@SuppressWarnings("javadoc")
	public double getCrval2() {
		return crval2;
	}
	
	/**
	 * Get the CD matrix as {cd11, cd12, cd21, cd22}, in degrees per pixel.
	 * @return
	 */
	public double[] getCDMatrix() {
		return new double[] {cd11, cd12, cd21, cd22};
	}

}
