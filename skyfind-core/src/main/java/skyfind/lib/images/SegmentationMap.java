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
import java.util.Set;
import java.util.TreeSet;

/**
 * An integer-labeled raster, where 0 represents the background.
 * 
 * @author SkyFind developers
 */
public final class SegmentationMap implements Serializable {

	private static final long serialVersionUID = 1L;
	
	private final int width, height;
	private final int[] labels;
	
	private SegmentationMap(int width, int height, int[] labels) {
		this.width = width;
		this.height = height;
		this.labels = labels;
	}
	
	/**
	 * Create a map where every pixel is background.
	 * @param width
	 * @param height
	 * @return
	 */
	public static SegmentationMap createEmpty(int width, int height) {
		if (width <= 0 || height <= 0)
			throw new IllegalArgumentException("Segmentation map dimensions must be > 0, but were " + width + "x" + height);
		return new SegmentationMap(width, height, new int[width * height]);
	}
	
	/**
	 * Create a map from an existing array of labels, which is used directly.
	 * @param labels row-major labels
	 * @param width
	 * @param height
	 * @return
	 */
	public static SegmentationMap createInstance(int[] labels, int width, int height) {
		if (labels.length != width * height)
			throw new IllegalArgumentException("Label array of length " + labels.length + " does not match " + width + "x" + height);
		return new SegmentationMap(width, height, labels);
	}

	@SuppressWarnings("javadoc")
	public int getWidth() {
		return width;
	}

	@SuppressWarnings("javadoc")
	public int getHeight() {
		return height;
	}
	
	/**
	 * Get the label at a pixel; locations outside the map are background.
	 * @param x
	 * @param y
	 * @return
	 */
	public int get(int x, int y) {
		if (x < 0 || y < 0 || x >= width || y >= height)
			return 0;
		return labels[y * width + x];
	}
	
	/**
	 * Set the label at a pixel.
	 * @param x
	 * @param y
	 * @param label
	 */
	public void set(int x, int y, int label) {
		labels[y * width + x] = label;
	}
	
	/**
	 * Paint a label wherever a mask is true.
	 * The mask may be smaller than the map, in which case its origin is given by x0 and y0; 
	 * pixels falling outside the map are ignored.
	 * 
	 * @param mask
	 * @param x0
	 * @param y0
	 * @param label
	 */
	public void paint(Mask mask, int x0, int y0, int label) {
		for (int y = 0; y < mask.getHeight(); y++) {
			int yy = y + y0;
			if (yy < 0 || yy >= height)
				continue;
			for (int x = 0; x < mask.getWidth(); x++) {
				int xx = x + x0;
				if (xx >= 0 && xx < width && mask.get(x, y))
					labels[yy * width + xx] = label;
			}
		}
	}
	
	/**
	 * Get all distinct non-zero labels, in ascending order.
	 * @return
	 */
	public Set<Integer> getLabels() {
		var set = new TreeSet<Integer>();
		for (int v : labels) {
			if (v != 0)
				set.add(v);
		}
		return set;
	}
	
	/**
	 * Get all distinct non-zero labels found where a frame-sized mask is true.
	 * @param mask
	 * @return
	 */
	public Set<Integer> getLabelsIn(Mask mask) {
		checkSize(mask);
		var set = new TreeSet<Integer>();
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				int v = labels[y * width + x];
				if (v != 0 && mask.get(x, y))
					set.add(v);
			}
		}
		return set;
	}
	
	/**
	 * Reset all pixels with the given label to background.
	 * @param label
	 * @return the number of pixels that were reset
	 */
	public int removeLabel(int label) {
		int n = 0;
		for (int i = 0; i < labels.length; i++) {
			if (labels[i] == label) {
				labels[i] = 0;
				n++;
			}
		}
		return n;
	}
	
	/**
	 * Count pixels with a specific label.
	 * @param label
	 * @return
	 */
	public int count(int label) {
		int n = 0;
		for (int v : labels) {
			if (v == label)
				n++;
		}
		return n;
	}
	
	/**
	 * Get a mask that is true for all non-background pixels.
	 * @return
	 */
	public Mask toMask() {
		boolean[] data = new boolean[labels.length];
		for (int i = 0; i < labels.length; i++)
			data[i] = labels[i] != 0;
		return Mask.createInstance(data, width, height);
	}
	
	/**
	 * Get a mask that is true for all pixels with a specific label.
	 * @param label
	 * @return
	 */
	public Mask toMask(int label) {
		boolean[] data = new boolean[labels.length];
		for (int i = 0; i < labels.length; i++)
			data[i] = labels[i] == label;
		return Mask.createInstance(data, width, height);
	}
	
	/**
	 * Get a copy of the labels, in row-major order.
	 * @return
	 */
	public int[] toArray() {
		return labels.clone();
	}
	
	/**
	 * Create an independent copy.
	 * @return
	 */
	public SegmentationMap duplicate() {
		return new SegmentationMap(width, height, labels.clone());
	}
	
	private void checkSize(Mask mask) {
		if (mask.getWidth() != width || mask.getHeight() != height)
			throw new IllegalArgumentException("Mask size " + mask.getWidth() + "x" + mask.getHeight() + " does not match segmentation map " + width + "x" + height);
	}
	
}
