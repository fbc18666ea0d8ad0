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

import java.util.ArrayList;
import java.util.List;

import ij.process.FloatProcessor;
import ij.process.FloodFiller;
import skyfind.lib.analysis.images.SimpleImage;
import skyfind.lib.geom.Point2;
import skyfind.lib.images.SegmentationMap;

/**
 * Static methods to label connected regions and locate local maxima.
 * 
 * @author SkyFind developers
 *
 */
public class RegionLabeling {
	
	private static final float UNLABELED = -1f;
	
	/**
	 * Label 8-connected regions of pixels above a threshold.
	 * <p>
	 * Regions smaller than {@code minPixels} are discarded, and remaining labels are numbered 
	 * consecutively from 1 in raster order of their first pixel.
	 * 
	 * @param image
	 * @param threshold pixels strictly above this value are foreground; NaNs are background
	 * @param minPixels minimum number of pixels in a region
	 * @return
	 */
	public static SegmentationMap labelImage(SimpleImage image, double threshold, int minPixels) {
		int w = image.getWidth();
		int h = image.getHeight();
		var fp = new FloatProcessor(w, h);
		for (int y = 0; y < h; y++) {
			for (int x = 0; x < w; x++) {
				if (image.getValue(x, y) > threshold)
					fp.setf(x, y, UNLABELED);
			}
		}
		
		// Flood fill each region with its own label
		var ff = new FloodFiller(fp);
		int label = 0;
		for (int y = 0; y < h; y++) {
			for (int x = 0; x < w; x++) {
				if (fp.getf(x, y) == UNLABELED) {
					label++;
					fp.setValue(label);
					ff.fill8(x, y);
				}
			}
		}
		
		// Count pixels per label & renumber those that are large enough
		int[] counts = new int[label + 1];
		for (int i = 0; i < w * h; i++)
			counts[(int)fp.getf(i)]++;
		int[] newLabels = new int[label + 1];
		int n = 0;
		for (int i = 1; i <= label; i++) {
			if (counts[i] >= minPixels)
				newLabels[i] = ++n;
		}
		int[] labels = new int[w * h];
		for (int i = 0; i < w * h; i++)
			labels[i] = newLabels[(int)fp.getf(i)];
		return SegmentationMap.createInstance(labels, w, h);
	}
	
	/**
	 * Find local maxima above a threshold.
	 * <p>
	 * A pixel is a maximum if no pixel in the surrounding {@code boxSize x boxSize} neighborhood 
	 * is larger, and no earlier pixel (in raster order) in the neighborhood has the same value.
	 * 
	 * @param image
	 * @param threshold
	 * @param boxSize neighborhood size; must be odd
	 * @return maxima in image pixel coordinates, in raster order
	 */
	public static List<Point2> findLocalMaxima(SimpleImage image, double threshold, int boxSize) {
		if (boxSize < 1 || boxSize % 2 == 0)
			throw new IllegalArgumentException("Box size must be odd and >= 1, but was " + boxSize);
		int w = image.getWidth();
		int h = image.getHeight();
		int half = boxSize / 2;
		var maxima = new ArrayList<Point2>();
		for (int y = 0; y < h; y++) {
			for (int x = 0; x < w; x++) {
				float v = image.getValue(x, y);
				if (!(v > threshold))
					continue;
				if (isMaximum(image, x, y, v, half))
					maxima.add(new Point2(x, y));
			}
		}
		return maxima;
	}
	
	private static boolean isMaximum(SimpleImage image, int x, int y, float v, int half) {
		int w = image.getWidth();
		int h = image.getHeight();
		for (int yy = Math.max(0, y - half); yy <= Math.min(h - 1, y + half); yy++) {
			for (int xx = Math.max(0, x - half); xx <= Math.min(w - 1, x + half); xx++) {
				if (xx == x && yy == y)
					continue;
				float v2 = image.getValue(xx, yy);
				if (v2 > v)
					return false;
				if (v2 == v && (yy < y || (yy == y && xx < x)))
					return false;
			}
		}
		return true;
	}

}
