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

package skyfind.lib.analysis.stats;

import java.util.Arrays;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import skyfind.lib.analysis.images.SimpleImage;
import skyfind.lib.images.Mask;

/**
 * Iterative sigma-clipping.
 * <p>
 * On each iteration, values further than {@code sigma} standard deviations from the median 
 * of the retained values are rejected. Iteration stops when no new value is rejected, or 
 * after a maximum number of iterations.
 * 
 * @author SkyFind developers
 */
public class SigmaClip {
	
	/**
	 * Default number of standard deviations used for clipping.
	 */
	public static final double DEFAULT_SIGMA = 3.0;
	
	/**
	 * Default maximum number of clipping iterations.
	 */
	public static final int DEFAULT_MAX_ITERATIONS = 5;
	
	/**
	 * Compute sigma-clipped statistics, ignoring non-finite values.
	 * @param values
	 * @param sigma
	 * @param maxIterations
	 * @return statistics of the retained values; all fields are NaN if there are no finite values
	 */
	public static ClippedStatistics computeStatistics(double[] values, double sigma, int maxIterations) {
		boolean[] rejected = new boolean[values.length];
		for (int i = 0; i < values.length; i++)
			rejected[i] = !Double.isFinite(values[i]);
		clip(values, rejected, sigma, maxIterations);
		return summarize(values, rejected);
	}
	
	/**
	 * Compute sigma-clipped statistics of an image, ignoring masked and non-finite pixels.
	 * @param image
	 * @param excluded mask of pixels to ignore (true = ignore), or null to use all pixels
	 * @param sigma
	 * @return
	 */
	public static ClippedStatistics computeStatistics(SimpleImage image, Mask excluded, double sigma) {
		double[] values = toValues(image);
		boolean[] rejected = initialRejection(values, image, excluded);
		clip(values, rejected, sigma, DEFAULT_MAX_ITERATIONS);
		return summarize(values, rejected);
	}
	
	/**
	 * Compute statistics of an image without clipping, ignoring masked and non-finite pixels.
	 * @param image
	 * @param excluded mask of pixels to ignore (true = ignore), or null to use all pixels
	 * @return
	 */
	public static ClippedStatistics computeStatistics(SimpleImage image, Mask excluded) {
		double[] values = toValues(image);
		return summarize(values, initialRejection(values, image, excluded));
	}

	/**
	 * Create a mask that excludes the same pixels as an existing mask, and additionally all
	 * non-finite pixels and pixels rejected by sigma-clipping.
	 * @param image
	 * @param excluded mask of pixels to ignore (true = ignore), or null
	 * @param sigma
	 * @param maxIterations
	 * @return a new mask, with the same size as the image
	 */
	public static Mask clipMask(SimpleImage image, Mask excluded, double sigma, int maxIterations) {
		double[] values = toValues(image);
		boolean[] rejected = initialRejection(values, image, excluded);
		clip(values, rejected, sigma, maxIterations);
		return Mask.createInstance(rejected, image.getWidth(), image.getHeight());
	}
	
	private static double[] toValues(SimpleImage image) {
		int w = image.getWidth();
		int h = image.getHeight();
		double[] values = new double[w * h];
		for (int y = 0; y < h; y++) {
			for (int x = 0; x < w; x++)
				values[y * w + x] = image.getValue(x, y);
		}
		return values;
	}
	
	private static boolean[] initialRejection(double[] values, SimpleImage image, Mask excluded) {
		if (excluded != null && (excluded.getWidth() != image.getWidth() || excluded.getHeight() != image.getHeight()))
			throw new IllegalArgumentException("Mask size does not match image size");
		int w = image.getWidth();
		boolean[] rejected = new boolean[values.length];
		for (int i = 0; i < values.length; i++)
			rejected[i] = !Double.isFinite(values[i]) || (excluded != null && excluded.get(i % w, i / w));
		return rejected;
	}
	
	private static void clip(double[] values, boolean[] rejected, double sigma, int maxIterations) {
		if (!(sigma > 0))
			throw new IllegalArgumentException("Clipping sigma must be > 0, but was " + sigma);
		for (int iter = 0; iter < maxIterations; iter++) {
			var stats = new DescriptiveStatistics();
			for (int i = 0; i < values.length; i++) {
				if (!rejected[i])
					stats.addValue(values[i]);
			}
			if (stats.getN() < 3)
				return;
			double median = stats.getPercentile(50);
			double std = Math.sqrt(stats.getPopulationVariance());
			if (std == 0)
				return;
			int nChanged = 0;
			for (int i = 0; i < values.length; i++) {
				if (!rejected[i] && Math.abs(values[i] - median) > sigma * std) {
					rejected[i] = true;
					nChanged++;
				}
			}
			if (nChanged == 0)
				return;
		}
	}
	
	private static ClippedStatistics summarize(double[] values, boolean[] rejected) {
		double[] kept = new double[values.length];
		int n = 0;
		int nRejected = 0;
		for (int i = 0; i < values.length; i++) {
			if (rejected[i]) {
				if (Double.isFinite(values[i]))
					nRejected++;
			} else
				kept[n++] = values[i];
		}
		if (n == 0)
			return new ClippedStatistics(Double.NaN, Double.NaN, Double.NaN, 0, nRejected);
		var stats = new DescriptiveStatistics(Arrays.copyOf(kept, n));
		return new ClippedStatistics(
				stats.getMean(),
				stats.getPercentile(50),
				Math.sqrt(stats.getPopulationVariance()),
				n,
				nRejected);
	}

}
