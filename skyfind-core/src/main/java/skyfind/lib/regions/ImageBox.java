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
import java.util.Arrays;

import skyfind.lib.analysis.images.SimpleImage;
import skyfind.lib.analysis.images.SimpleModifiableImage;
import skyfind.lib.geom.Point2;
import skyfind.lib.images.Mask;

/**
 * A rectangular block of pixel values copied from a larger image, together with its 
 * position within that image.
 * <p>
 * Relative coordinates index pixels of the box; absolute coordinates index pixels of the 
 * image the box was taken from.
 * 
 * @author SkyFind developers
 */
public class ImageBox implements SimpleModifiableImage, Serializable {

	private static final long serialVersionUID = 1L;
	
	private final int x0, y0;
	private final int width, height;
	private final float[] data;
	
	private ImageBox(int x0, int y0, int width, int height, float[] data) {
		this.x0 = x0;
		this.y0 = y0;
		this.width = width;
		this.height = height;
		this.data = data;
	}
	
	/**
	 * Create a box from existing values.
	 * @param x0 absolute x coordinate of the first column
	 * @param y0 absolute y coordinate of the first row
	 * @param width
	 * @param height
	 * @param data row-major values, used directly
	 * @return
	 */
	public static ImageBox createInstance(int x0, int y0, int width, int height, float[] data) {
		if (width <= 0 || height <= 0)
			throw new IllegalArgumentException("Box width and height must be > 0, but were " + width + " and " + height);
		if (data.length != width * height)
			throw new IllegalArgumentException("Data length " + data.length + " does not match " + width + "x" + height);
		return new ImageBox(x0, y0, width, height, data);
	}
	
	/**
	 * Copy a rectangular region of an image. The region is clipped to the image bounds.
	 * @param image
	 * @param x0
	 * @param y0
	 * @param width
	 * @param height
	 * @return
	 * @throws IllegalArgumentException if the region does not overlap the image
	 */
	public static ImageBox fromImage(SimpleImage image, int x0, int y0, int width, int height) {
		int xStart = Math.max(0, x0);
		int yStart = Math.max(0, y0);
		int xEnd = Math.min(image.getWidth(), x0 + width);
		int yEnd = Math.min(image.getHeight(), y0 + height);
		if (xEnd <= xStart || yEnd <= yStart)
			throw new IllegalArgumentException("Region (" + x0 + ", " + y0 + ", " + width + ", " + height + ") lies outside the image");
		int w = xEnd - xStart;
		int h = yEnd - yStart;
		float[] values = new float[w * h];
		for (int y = 0; y < h; y++) {
			for (int x = 0; x < w; x++)
				values[y * w + x] = image.getValue(xStart + x, yStart + y);
		}
		return new ImageBox(xStart, yStart, w, h, values);
	}
	
	/**
	 * Copy a square region of an image centered on the pixel containing a point.
	 * The half-width is the radius rounded up, so the box spans {@code 2 * halfWidth + 1} 
	 * pixels before clipping to the image bounds.
	 * 
	 * @param image
	 * @param center
	 * @param radius
	 * @return
	 */
	public static ImageBox fromCircle(SimpleImage image, Point2 center, double radius) {
		return fromCenter(image, center, halfWidth(radius));
	}
	
	/**
	 * Copy a square region of an image centered on the pixel containing a point.
	 * @param image
	 * @param center
	 * @param halfWidth
	 * @return
	 */
	public static ImageBox fromCenter(SimpleImage image, Point2 center, int halfWidth) {
		int cx = center.getPixelX();
		int cy = center.getPixelY();
		return fromImage(image, cx - halfWidth, cy - halfWidth, halfWidth * 2 + 1, halfWidth * 2 + 1);
	}
	
	/**
	 * Get the half-width of a box for a radius.
	 * @param radius
	 * @return
	 */
	public static int halfWidth(double radius) {
		if (!(radius > 0))
			throw new IllegalArgumentException("Radius must be > 0, but was " + radius);
		return Math.max(1, (int)Math.ceil(radius));
	}
	
	/**
	 * Extract the part of this box covering the same absolute pixels as another box.
	 * Pixels of the other box that are not covered by this one are NaN.
	 * @param other
	 * @return
	 */
	public ImageBox boxLike(ImageBox other) {
		float[] values = new float[other.width * other.height];
		for (int y = 0; y < other.height; y++) {
			for (int x = 0; x < other.width; x++) {
				int rx = other.x0 + x - x0;
				int ry = other.y0 + y - y0;
				values[y * other.width + x] = contains(rx, ry) ? data[ry * width + rx] : Float.NaN;
			}
		}
		return new ImageBox(other.x0, other.y0, other.width, other.height, values);
	}
	
	/**
	 * Create a smaller box from this one, centered on the pixel containing an absolute point.
	 * @param center absolute coordinates of the new center
	 * @param halfWidth half-width of the new box
	 * @return
	 */
	public ImageBox crop(Point2 center, int halfWidth) {
		int cx = center.getPixelX() - x0;
		int cy = center.getPixelY() - y0;
		var cropped = fromImage(this, cx - halfWidth, cy - halfWidth, halfWidth * 2 + 1, halfWidth * 2 + 1);
		return new ImageBox(cropped.x0 + x0, cropped.y0 + y0, cropped.width, cropped.height, cropped.data);
	}
	
	/**
	 * Convert an absolute position to a position relative to this box.
	 * @param absolute
	 * @return
	 */
	public Point2 toRelative(Point2 absolute) {
		return new Point2(absolute.getX() - x0, absolute.getY() - y0);
	}
	
	/**
	 * Convert a position relative to this box to an absolute position.
	 * @param relative
	 * @return
	 */
	public Point2 toAbsolute(Point2 relative) {
		return new Point2(relative.getX() + x0, relative.getY() + y0);
	}
	
	/**
	 * Query whether an absolute position falls inside the box.
	 * @param absolute
	 * @return
	 */
	public boolean containsAbsolute(Point2 absolute) {
		return contains(absolute.getPixelX() - x0, absolute.getPixelY() - y0);
	}
	
	/**
	 * Write the values of this box into an image wherever a box-sized mask is true.
	 * All other pixels of the image are left untouched, as are masked pixels whose 
	 * value in this box is NaN.
	 * 
	 * @param image the image to modify
	 * @param where mask with the same dimensions as this box
	 * @return the number of pixels changed
	 */
	public int replace(SimpleModifiableImage image, Mask where) {
		if (where.getWidth() != width || where.getHeight() != height)
			throw new IllegalArgumentException("Mask size " + where.getWidth() + "x" + where.getHeight() + " does not match box " + width + "x" + height);
		int n = 0;
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				if (!where.get(x, y))
					continue;
				float v = data[y * width + x];
				if (Float.isNaN(v) || !image.contains(x0 + x, y0 + y))
					continue;
				image.setValue(x0 + x, y0 + y, v);
				n++;
			}
		}
		return n;
	}
	
	/**
	 * Subtract another box with the same geometry, returning a new box.
	 * @param other
	 * @return
	 */
	public ImageBox subtract(ImageBox other) {
		if (other.x0 != x0 || other.y0 != y0 || other.width != width || other.height != height)
			throw new IllegalArgumentException("Cannot subtract boxes with different geometry");
		float[] values = new float[data.length];
		for (int i = 0; i < data.length; i++)
			values[i] = data[i] - other.data[i];
		return new ImageBox(x0, y0, width, height, values);
	}
	
	/**
	 * Create a box with the same geometry, filled with a constant value.
	 * @param value
	 * @return
	 */
	public ImageBox filledWith(float value) {
		float[] values = new float[data.length];
		Arrays.fill(values, value);
		return new ImageBox(x0, y0, width, height, values);
	}
	
	/**
	 * Create an independent copy.
	 * @return
	 */
	public ImageBox duplicate() {
		return new ImageBox(x0, y0, width, height, data.clone());
	}
	
	/**
	 * Absolute x coordinate of the first column.
	 * @return
	 */
	public int getX0() {
		return x0;
	}
	
	/**
	 * Absolute y coordinate of the first row.
	 * @return
	 */
	public int getY0() {
		return y0;
	}

	@Override
	public float getValue(int x, int y) {
		return data[y * width + x];
	}

	@Override
	public void setValue(int x, int y, float val) {
		data[y * width + x] = val;
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
	public float[] getArray(boolean direct) {
		return direct ? data : data.clone();
	}

	@Override
	public String toString() {
		return "ImageBox [x=" + x0 + ", y=" + y0 + ", w=" + width + ", h=" + height + "]";
	}

}
