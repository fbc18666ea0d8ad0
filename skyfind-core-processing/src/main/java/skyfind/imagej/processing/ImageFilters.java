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

package skyfind.imagej.processing;

import ij.process.FloatProcessor;
import skyfind.lib.analysis.fitting.ModelFamily;
import skyfind.lib.analysis.images.SimpleImage;
import skyfind.lib.analysis.images.SimpleImages;
import skyfind.lib.analysis.images.SimpleModifiableImage;

/**
 * Static methods for smoothing images with ImageJ.
 * 
 * @author SkyFind developers
 *
 */
public class ImageFilters {
	
	/**
	 * Create a normalized, square Gaussian kernel.
	 * @param fwhm full width at half maximum, in pixels
	 * @param size kernel width and height; must be odd and &gt;= 3
	 * @return row-major kernel values summing to 1
	 */
	public static float[] createGaussianKernel(double fwhm, int size) {
		if (!(fwhm > 0))
			throw new IllegalArgumentException("Kernel FWHM must be > 0, but was " + fwhm);
		if (size < 3 || size % 2 == 0)
			throw new IllegalArgumentException("Kernel size must be odd and >= 3, but was " + size);
		double sigma = fwhm / ModelFamily.SIGMA_TO_FWHM;
		int half = size / 2;
		float[] kernel = new float[size * size];
		double sum = 0;
		for (int y = -half; y <= half; y++) {
			for (int x = -half; x <= half; x++) {
				double v = Math.exp(-(x * x + y * y) / (2 * sigma * sigma));
				kernel[(y + half) * size + x + half] = (float)v;
				sum += v;
			}
		}
		for (int i = 0; i < kernel.length; i++)
			kernel[i] /= sum;
		return kernel;
	}
	
	/**
	 * Get the smallest odd kernel size covering +/- 1.5 FWHM, and at least 3.
	 * @param fwhm
	 * @return
	 */
	public static int kernelSizeForFwhm(double fwhm) {
		int size = (int)Math.ceil(3 * fwhm);
		if (size % 2 == 0)
			size++;
		return Math.max(3, size);
	}
	
	/**
	 * Convolve an image with a square kernel.
	 * Non-finite pixels are replaced by a fill value before convolution, since they would otherwise 
	 * spread across the output.
	 * 
	 * @param image input image, which is not modified
	 * @param kernel row-major kernel values
	 * @param size kernel width and height
	 * @param fill value used in place of non-finite pixels
	 * @return a new image
	 */
	public static SimpleModifiableImage convolve(SimpleImage image, float[] kernel, int size, float fill) {
		if (kernel.length != size * size)
			throw new IllegalArgumentException("Kernel length " + kernel.length + " does not match size " + size);
		int w = image.getWidth();
		int h = image.getHeight();
		float[] pixels = SimpleImages.getPixels(image, false);
		for (int i = 0; i < pixels.length; i++) {
			if (!Float.isFinite(pixels[i]))
				pixels[i] = fill;
		}
		var fp = new FloatProcessor(w, h, pixels);
		fp.convolve(kernel, size, size);
		return SimpleImages.createFloatImage((float[])fp.getPixels(), w, h);
	}
	
	/**
	 * Convolve an image with a normalized Gaussian kernel.
	 * @param image
	 * @param fwhm
	 * @param size
	 * @param fill value used in place of non-finite pixels
	 * @return
	 * @see #convolve(SimpleImage, float[], int, float)
	 */
	public static SimpleModifiableImage gaussianSmooth(SimpleImage image, double fwhm, int size, float fill) {
		return convolve(image, createGaussianKernel(fwhm, size), size, fill);
	}

}
