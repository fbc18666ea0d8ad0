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
import java.util.Arrays;

import skyfind.lib.geom.Point2;

/**
 * A boolean raster, aligned either with a frame or with a box inside a frame.
 * <p>
 * Set operations require both masks to have the same dimensions, and always return a new mask.
 * 
 * @author SkyFind developers
 */
public final class Mask implements Serializable {
	
	private static final long serialVersionUID = 1L;

	private final int width, height;
	private final boolean[] data;
	
	private Mask(int width, int height, boolean[] data) {
		this.width = width;
		this.height = height;
		this.data = data;
	}
	
	/**
	 * Create a mask in which all pixels are false.
	 * @param width
	 * @param height
	 * @return
	 */
	public static Mask createEmpty(int width, int height) {
		if (width <= 0 || height <= 0)
			throw new IllegalArgumentException("Mask dimensions must be > 0, but were " + width + "x" + height);
		return new Mask(width, height, new boolean[width * height]);
	}
	
	/**
	 * Create a mask from an existing array, which is used directly.
	 * @param data row-major values
	 * @param width
	 * @param height
	 * @return
	 */
	public static Mask createInstance(boolean[] data, int width, int height) {
		if (data.length != width * height)
			throw new IllegalArgumentException("Mask array of length " + data.length + " does not match " + width + "x" + height);
		return new Mask(width, height, data);
	}
	
	/**
	 * Create a mask that is true inside an ellipse.
	 * @param width mask width
	 * @param height mask height
	 * @param center ellipse center, in mask pixel coordinates
	 * @param semiMajor semi-major axis, in pixels
	 * @param semiMinor semi-minor axis, in pixels
	 * @param angle rotation of the major axis from the x axis, in degrees (counter-clockwise)
	 * @return
	 */
	public static Mask createEllipse(int width, int height, Point2 center, double semiMajor, double semiMinor, double angle) {
		if (!(semiMajor > 0) || !(semiMinor > 0))
			throw new IllegalArgumentException("Ellipse axes must be > 0, but were " + semiMajor + " and " + semiMinor);
		var mask = createEmpty(width, height);
		double theta = Math.toRadians(angle);
		double cos = Math.cos(theta);
		double sin = Math.sin(theta);
		double a2 = semiMajor * semiMajor;
		double b2 = semiMinor * semiMinor;
		for (int y = 0; y < height; y++) {
			double dy = y - center.getY();
			for (int x = 0; x < width; x++) {
				double dx = x - center.getX();
				double u = dx * cos + dy * sin;
				double v = -dx * sin + dy * cos;
				if (u * u / a2 + v * v / b2 <= 1.0)
					mask.data[y * width + x] = true;
			}
		}
		return mask;
	}
	
	/**
	 * Create a mask that is true for all pixels that are NaN or infinite.
	 * @param frame
	 * @return
	 */
	public static Mask createNonFinite(Frame frame) {
		float[] pixels = frame.getArray(true);
		boolean[] data = new boolean[pixels.length];
		for (int i = 0; i < pixels.length; i++)
			data[i] = !Float.isFinite(pixels[i]);
		return new Mask(frame.getWidth(), frame.getHeight(), data);
	}

	/**
	 * Mask width.
	 * @return
	 */
	public int getWidth() {
		return width;
	}

	/**
	 * Mask height.
	 * @return
	 */
	public int getHeight() {
		return height;
	}
	
	/**
	 * Get the value at a pixel; locations outside the mask are false.
	 * @param x
	 * @param y
	 * @return
	 */
	public boolean get(int x, int y) {
		if (x < 0 || y < 0 || x >= width || y >= height)
			return false;
		return data[y * width + x];
	}
	
	/**
	 * Set the value at a pixel.
	 * @param x
	 * @param y
	 * @param value
	 */
	public void set(int x, int y, boolean value) {
		data[y * width + x] = value;
	}
	
	/**
	 * Query whether the pixel containing a point is masked.
	 * @param point
	 * @return
	 */
	public boolean masks(Point2 point) {
		return get(point.getPixelX(), point.getPixelY());
	}
	
	/**
	 * Number of true pixels.
	 * @return
	 */
	public int countTrue() {
		int n = 0;
		for (boolean b : data) {
			if (b)
				n++;
		}
		return n;
	}
	
	/**
	 * Query whether no pixel is true.
	 * @return
	 */
	public boolean isEmpty() {
		for (boolean b : data) {
			if (b)
				return false;
		}
		return true;
	}
	
	/**
	 * Query whether any true pixel lies on the outer border of the mask.
	 * @return
	 */
	public boolean touchesEdge() {
		for (int x = 0; x < width; x++) {
			if (data[x] || data[(height - 1) * width + x])
				return true;
		}
		for (int y = 0; y < height; y++) {
			if (data[y * width] || data[y * width + width - 1])
				return true;
		}
		return false;
	}
	
	/**
	 * Get a mask that is true wherever this or the other mask is true.
	 * @param other
	 * @return
	 */
	public Mask union(Mask other) {
		checkSameSize(other);
		boolean[] result = new boolean[data.length];
		for (int i = 0; i < data.length; i++)
			result[i] = data[i] || other.data[i];
		return new Mask(width, height, result);
	}
	
	/**
	 * Get a mask that is true wherever both this and the other mask are true.
	 * @param other
	 * @return
	 */
	public Mask intersection(Mask other) {
		checkSameSize(other);
		boolean[] result = new boolean[data.length];
		for (int i = 0; i < data.length; i++)
			result[i] = data[i] && other.data[i];
		return new Mask(width, height, result);
	}
	
	/**
	 * Query whether any pixel is true in both masks.
	 * @param other
	 * @return
	 */
	public boolean overlaps(Mask other) {
		checkSameSize(other);
		for (int i = 0; i < data.length; i++) {
			if (data[i] && other.data[i])
				return true;
		}
		return false;
	}
	
	/**
	 * Get the inverse of this mask.
	 * @return
	 */
	public Mask inverse() {
		boolean[] result = new boolean[data.length];
		for (int i = 0; i < data.length; i++)
			result[i] = !data[i];
		return new Mask(width, height, result);
	}
	
	/**
	 * Extract a rectangular region of this mask.
	 * Pixels of the region that fall outside this mask are false.
	 * @param x0 origin of the region in this mask
	 * @param y0 
	 * @param w width of the region
	 * @param h height of the region
	 * @return
	 */
	public Mask crop(int x0, int y0, int w, int h) {
		var result = createEmpty(w, h);
		for (int y = 0; y < h; y++) {
			for (int x = 0; x < w; x++)
				result.data[y * w + x] = get(x0 + x, y0 + y);
		}
		return result;
	}
	
	/**
	 * Get a copy of the mask values.
	 * @return
	 */
	public boolean[] toArray() {
		return data.clone();
	}
	
	/**
	 * Create an independent copy.
	 * @return
	 */
	public Mask duplicate() {
		return new Mask(width, height, data.clone());
	}
	
	private void checkSameSize(Mask other) {
		if (other.width != width || other.height != height)
			throw new IllegalArgumentException("Mask sizes differ: " + width + "x" + height + " and " + other.width + "x" + other.height);
	}

	@Override
	public int hashCode() {
		return 31 * (31 * width + height) + Arrays.hashCode(data);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof Mask other))
			return false;
		return width == other.width && height == other.height && Arrays.equals(data, other.data);
	}

}
