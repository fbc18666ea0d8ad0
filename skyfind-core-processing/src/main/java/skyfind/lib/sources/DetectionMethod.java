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

package skyfind.lib.sources;

import com.google.gson.annotations.SerializedName;

/**
 * Ways to decide whether a catalog object is present in a frame.
 */
public enum DetectionMethod {
	
	/**
	 * Search for a single local maximum near the catalog position, zooming in when several are found.
	 */
	@SerializedName("peaks")
	PEAKS,
	
	/**
	 * Threshold the smoothed cutout and take the segment containing the catalog position.
	 */
	@SerializedName("segmentation")
	SEGMENTATION;

}
