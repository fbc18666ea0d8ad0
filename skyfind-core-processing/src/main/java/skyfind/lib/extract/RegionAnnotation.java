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

package skyfind.lib.extract;

import com.google.gson.annotations.SerializedName;

/**
 * Text written next to each star in region files.
 */
public enum RegionAnnotation {
	
	/**
	 * Background-subtracted flux.
	 */
	@SerializedName("flux")
	FLUX,
	
	/**
	 * Whether a source was found.
	 */
	@SerializedName("has_source")
	HAS_SOURCE,
	
	/**
	 * Whether a background was estimated.
	 */
	@SerializedName("has_background")
	HAS_BACKGROUND,
	
	@SerializedName("none")
	NONE;

}
