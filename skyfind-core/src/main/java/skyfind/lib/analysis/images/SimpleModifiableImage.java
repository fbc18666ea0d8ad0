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
 * A {@link SimpleImage} whose pixel values can be changed.
 * 
 * @author SkyFind developers
 *
 */
public interface SimpleModifiableImage extends SimpleImage {
	
	/**
	 * Set the value of a single pixel.
	 * @param x x-coordinate of the pixel to set
	 * @param y y-coordinate of the pixel to set
	 * @param val new pixel value
	 */
	void setValue(int x, int y, float val);
	
	/**
	 * Request the pixel array representing all the pixels in this image, returned row-wise.
	 * @param direct if true, the internal array will be returned if possible 
	 * @return
	 */
	float[] getArray(boolean direct);
	
}
