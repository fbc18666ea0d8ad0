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
import java.util.Objects;

import skyfind.lib.analysis.images.SimpleImages;
import skyfind.lib.analysis.images.SimpleModifiableImage;
import skyfind.lib.geom.Point2;
import skyfind.lib.geom.SkyCoordinate;

/**
 * A single-band image with its coordinate system and filter.
 * <p>
 * The name, coordinate system and filter are fixed, but pixel values may be changed in place 
 * (e.g. when sources are removed). Use {@link #copy()} before handing a frame to code that 
 * should not alter the original.
 * 
 * @author SkyFind developers
 */
public class Frame implements SimpleModifiableImage, Serializable {
	
	private static final long serialVersionUID = 1L;

	private final String name;
	private final int width, height;
	private final float[] pixels;
	private final float[] errors;
	private final CoordinateSystem wcs;
	private final PhotometricFilter filter;
	
	/**
	 * Create a new frame.
	 * @param name unique name of the frame, used to key per-frame results
	 * @param pixels row-major pixel values; these are used directly and not copied
	 * @param width
	 * @param height
	 * @param wcs coordinate system; its dimensions must match the frame
	 * @param filter
	 * @param errors optional row-major error map, or null
	 */
	public Frame(String name, float[] pixels, int width, int height, CoordinateSystem wcs, PhotometricFilter filter, float[] errors) {
		Objects.requireNonNull(name, "Frame name must not be null");
		Objects.requireNonNull(wcs, "Coordinate system must not be null");
		Objects.requireNonNull(filter, "Filter must not be null");
		if (pixels.length != width * height)
			throw new IllegalArgumentException("Pixel array of length " + pixels.length + " does not match " + width + "x" + height);
		if (errors != null && errors.length != pixels.length)
			throw new IllegalArgumentException("Error map length " + errors.length + " does not match pixel count " + pixels.length);
		if (wcs.getWidth() != width || wcs.getHeight() != height)
			throw new IllegalArgumentException("Coordinate system dimensions do not match frame " + name);
		this.name = name;
		this.pixels = pixels;
		this.width = width;
		this.height = height;
		this.wcs = wcs;
		this.filter = filter;
		this.errors = errors;
	}
	
	/**
	 * Create a new frame without an error map.
	 * @param name
	 * @param pixels
	 * @param width
	 * @param height
	 * @param wcs
	 * @param filter
	 */
	public Frame(String name, float[] pixels, int width, int height, CoordinateSystem wcs, PhotometricFilter filter) {
		this(name, pixels, width, height, wcs, filter, null);
	}
	
	/**
	 * Create an independent deep copy of this frame.
	 * @return
	 */
	public Frame copy() {
		return new Frame(name, pixels.clone(), width, height, wcs, filter, errors == null ? null : errors.clone());
	}
	
	/**
	 * Create a frame with the same identity, but different pixel values.
	 * @param newPixels
	 * @return
	 */
	public Frame withPixels(float[] newPixels) {
		return new Frame(name, newPixels, width, height, wcs, filter, errors);
	}
	
	/**
	 * Unique name of this frame.
	 * @return
	 */
	public String getName() {
		return name;
	}
	
	/**
	 * The band in which this frame was observed.
	 * @return
	 */
	public PhotometricFilter getFilter() {
		return filter;
	}
	
	/**
	 * Characteristic wavelength of the frame's filter, in micron.
	 * @return
	 */
	public double getWavelength() {
		return filter.getWavelength();
	}
	
	/**
	 * Coordinate system of the frame.
	 * @return
	 */
	public CoordinateSystem getCoordinateSystem() {
		return wcs;
	}
	
	/**
	 * Pixel scale, in arcseconds.
	 * @return
	 */
	public double getPixelScale() {
		return wcs.getPixelScale();
	}
	
	/**
	 * Get the FWHM of the filter PSF in pixels, or NaN if it is unknown.
	 * @return
	 */
	public double getPsfFwhmPixels() {
		var fwhm = filter.getPsfFwhm();
		return fwhm == null ? Double.NaN : fwhm / getPixelScale();
	}
	
	/**
	 * Convert a sky position to pixel coordinates in this frame.
	 * @param coordinate
	 * @return
	 */
	public Point2 toPixel(SkyCoordinate coordinate) {
		return wcs.toPixel(coordinate);
	}
	
	/**
	 * Query whether a pixel position falls inside this frame.
	 * @param point
	 * @return
	 */
	public boolean contains(Point2 point) {
		return Double.isFinite(point.getX()) && Double.isFinite(point.getY()) && contains(point.getPixelX(), point.getPixelY());
	}
	
	/**
	 * Query whether this frame has an error map.
	 * @return
	 */
	public boolean hasErrors() {
		return errors != null;
	}
	
	/**
	 * Get a copy of the error map, or null if there is none.
	 * @return
	 */
	public float[] getErrors() {
		return errors == null ? null : errors.clone();
	}
	
	/**
	 * Count pixels with finite values.
	 * @return
	 */
	public int countFinite() {
		return SimpleImages.countFinite(this);
	}

	@Override
	public float getValue(int x, int y) {
		return pixels[y * width + x];
	}

	@Override
	public int getWidth() {
		return width;
	}

	@Override
	public int getHeight() {
		return height;
	}

	@Override
	public void setValue(int x, int y, float val) {
		pixels[y * width + x] = val;
	}

	@Override
	public float[] getArray(boolean direct) {
		return direct ? pixels : pixels.clone();
	}

	@Override
	public String toString() {
		return "Frame " + name + " (" + width + "x" + height + ", " + filter + ")";
	}
	
}
