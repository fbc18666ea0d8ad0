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
 * Ways to turn a cutoff value into a flux threshold for {@link SaturationMethod#BRIGHTEST}.
 */
public enum FluxCutoff {
	
	/**
	 * Keep the given percentage of the brightest stars.
	 */
	@SerializedName("percentage")
	PERCENTAGE,
	
	/**
	 * Keep stars whose flux exceeds the mean by the given number of standard deviations.
	 */
	@SerializedName("sigma")
	SIGMA;

}
