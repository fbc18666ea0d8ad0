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

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

import skyfind.lib.analysis.fitting.ModelFamily;

/**
 * Parameters for fitting analytic profiles to stars.
 * 
 * @author SkyFind developers
 */
public class FittingConfig implements Serializable {
	
	private static final long serialVersionUID = 1L;
	
	private List<ModelFamily> models = new ArrayList<>(List.of(ModelFamily.GAUSSIAN, ModelFamily.MOFFAT, ModelFamily.AIRY));
	private double maxCenterOffset = 3.0;
	private boolean fitIfUndetected = false;
	
	/**
	 * Check that all values are usable.
	 * @throws IllegalArgumentException
	 */
	public void validate() throws IllegalArgumentException {
		if (models == null || models.isEmpty())
			throw new IllegalArgumentException("At least one model must be given for fitting");
		if (models.contains(null))
			throw new IllegalArgumentException("Unknown model in " + models);
		if (!(maxCenterOffset > 0))
			throw new IllegalArgumentException("Maximum center offset must be > 0, but was " + maxCenterOffset);
	}

	/**
	 * Profiles to try, in order. The first acceptable fit is kept.
	 * @return
	 */
	public List<ModelFamily> getModels() {
		return models;
	}

	public void setModels(List<ModelFamily> models) {
		this.models = models;
	}

	public double getMaxCenterOffset() {
		return maxCenterOffset;
	}

	public boolean isFitIfUndetected() {
		return fitIfUndetected;
	}

	public void setFitIfUndetected(boolean fitIfUndetected) {
		this.fitIfUndetected = fitIfUndetected;
	}

}
