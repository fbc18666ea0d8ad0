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

/**
 * A minimal interface to define a means to provide access to pixel values from a 2D, 1-channel image.
 * 
 * @author SkyFind developers
 *
 */
public interface SimpleImage {
	
	/**
	 * Get the value of a single pixel.
	 * @param x x-coordinate of the pixel
	 * @param y y-coordinate of the pixel
	 * @return
	 */
	float getValue(int x, int y);
	
	/**
	 * Width of the image, in pixels.
	 * @return
	 */
	int getWidth();
	
	/**
	 * Height of the image, in pixels.
	 * @return
	 */
	int getHeight();
	
	/**
	 * Query whether a pixel location falls inside the image.
	 * @param x
	 * @param y
	 * @return
	 */
	default boolean contains(int x, int y) {
		return x >= 0 && y >= 0 && x < getWidth() && y < getHeight();
	}

}
