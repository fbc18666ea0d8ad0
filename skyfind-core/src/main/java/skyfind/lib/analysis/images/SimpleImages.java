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

package skyfind.lib.analysis.images;

import java.io.Serializable;

/**
 * Create and query {@link SimpleImage SimpleImage} instances for basic pixel processing.
 * 
 * @author SkyFind developers
 *
 */
public class SimpleImages {
	
	/**
	 * Get the pixel values for the image.
	 * @param image
	 * @param direct if true, return the direct pixel buffer if possible. The caller should <i>not</i> modify this.
	 * @return
	 */
	public static float[] getPixels(SimpleImage image, boolean direct) {
		if (image instanceof SimpleModifiableImage modifiable)
			return modifiable.getArray(direct);
		int w = image.getWidth();
		int n = w * image.getHeight();
		float[] pixels = new float[n];
		for (int i = 0; i < n; i++)
			pixels[i] = image.getValue(i % w, i / w);
		return pixels;
	}
	
	/**
	 * Create a {@link SimpleImage} backed by an existing float array of pixels.
	 * <p>
	 * Pixels are stored in row-major order.
	 * 
	 * @param data
	 * @param width
	 * @param height
	 * @return
	 * @throws IllegalArgumentException if the array length does not match the dimensions
	 */
	public static SimpleModifiableImage createFloatImage(float[] data, int width, int height) {
		if (data.length != width * height)
			throw new IllegalArgumentException("Pixel array of length " + data.length + " does not match " + width + "x" + height);
		return new FloatArraySimpleImage(data, width, height);
	}

	/**
	 * Create a {@link SimpleImage} backed by a new float array of pixels.
	 *
	 * @param width
	 * @param height
	 * @return
	 */
	public static SimpleModifiableImage createFloatImage(int width, int height) {
		return new FloatArraySimpleImage(new float[width * height], width, height);
	}
	
	/**
	 * Count the pixels that are neither NaN nor infinite.
	 * @param image
	 * @return
	 */
	public static int countFinite(SimpleImage image) {
		int count = 0;
		for (float v : getPixels(image, true)) {
			if (Float.isFinite(v))
				count++;
		}
		return count;
	}
	
	/**
	 * Get the maximum finite value in an image, or NaN if there are no finite pixels.
	 * @param image
	 * @return
	 */
	public static double getMaxValue(SimpleImage image) {
		double max = Double.NEGATIVE_INFINITY;
		for (float v : getPixels(image, true)) {
			if (Float.isFinite(v) && v > max)
				max = v;
		}
		return Double.isInfinite(max) ? Double.NaN : max;
	}
	
	
	/**
	 * Implementation of a SimpleImage backed by an array of floats.
	 */
	static class FloatArraySimpleImage implements SimpleModifiableImage, Serializable {

		private static final long serialVersionUID = 1L;
		
		private final float[] data;
		private final int width;
		private final int height;
		
		FloatArraySimpleImage(float[] data, int width, int height) {
			this.data = data;
			this.width = width;
			this.height = height;
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
			if (direct)
				return data;
			return data.clone();
		}

	}
}
