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

import java.io.Serializable;

import skyfind.lib.sources.DetectionConfig;
import skyfind.lib.sources.DetectionMethod;

/**
 * Settings for finding extended sources.
 * 
 * @author SkyFind developers
 */
public class GalaxyConfig implements Serializable {
	
	private static final long serialVersionUID = 1L;
	
	private DetectionConfig detection = createDetection();
	private boolean useD25 = false;
	private double d25ExpansionFactor = 1.0;
	private boolean removeGalaxies = false;
	
	private static DetectionConfig createDetection() {
		var config = new DetectionConfig();
		config.setMethod(DetectionMethod.SEGMENTATION);
		return config;
	}
	
	void validate() {
		if (detection == null)
			throw new IllegalArgumentException("Missing galaxy detection settings");
		detection.validate("galaxies.detection");
		if (!(d25ExpansionFactor > 0))
			throw new IllegalArgumentException("D25 expansion factor must be > 0, but was " + d25ExpansionFactor);
	}

	public DetectionConfig getDetection() {
		return detection;
	}

	/**
	 * Whether galaxies with a catalog extent use the catalog ellipse rather than segmentation.
	 * @return
	 */
	public boolean isUseD25() {
		return useD25;
	}

	public void setUseD25(boolean useD25) {
		this.useD25 = useD25;
	}

	public double getD25ExpansionFactor() {
		return d25ExpansionFactor;
	}

	/**
	 * Whether galaxies other than the principal galaxy are replaced by their background.
	 * @return
	 */
	public boolean isRemoveGalaxies() {
		return removeGalaxies;
	}

	public void setRemoveGalaxies(boolean removeGalaxies) {
		this.removeGalaxies = removeGalaxies;
	}

}
