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
import skyfind.lib.sources.FittingConfig;
import skyfind.lib.sources.RemovalConfig;
import skyfind.lib.sources.SaturationConfig;

/**
 * Settings for finding, fitting and removing point sources.
 * 
 * @author SkyFind developers
 */
public class StarConfig implements Serializable {
	
	private static final long serialVersionUID = 1L;
	
	private DetectionConfig detection = new DetectionConfig();
	private FittingConfig fitting = new FittingConfig();
	private FwhmMeasure fwhmMeasure = FwhmMeasure.MAX;
	private double defaultFwhm = 3.0;
	private double minDistanceFromGalaxy = 0;
	private RemovalConfig removal = new RemovalConfig();
	private SaturationConfig saturation = new SaturationConfig();
	private RegionAnnotation annotation = RegionAnnotation.FLUX;
	
	void validate() {
		if (detection == null || fitting == null || removal == null || saturation == null)
			throw new IllegalArgumentException("Missing star settings");
		detection.validate("stars.detection");
		fitting.validate();
		removal.validate();
		saturation.validate();
		if (fwhmMeasure == null)
			throw new IllegalArgumentException("Unknown FWHM measure");
		if (annotation == null)
			throw new IllegalArgumentException("Unknown region annotation");
		if (!(defaultFwhm > 0))
			throw new IllegalArgumentException("Default FWHM must be > 0, but was " + defaultFwhm);
		if (!(minDistanceFromGalaxy >= 0))
			throw new IllegalArgumentException("Minimum distance from galaxy must be >= 0, but was " + minDistanceFromGalaxy);
	}

	public DetectionConfig getDetection() {
		return detection;
	}

	public FittingConfig getFitting() {
		return fitting;
	}

	public FwhmMeasure getFwhmMeasure() {
		return fwhmMeasure;
	}

	public void setFwhmMeasure(FwhmMeasure fwhmMeasure) {
		this.fwhmMeasure = fwhmMeasure;
	}

	/**
	 * FWHM in pixels, used when neither fitted stars nor the filter give one.
	 * @return
	 */
	public double getDefaultFwhm() {
		return defaultFwhm;
	}

	public void setDefaultFwhm(double defaultFwhm) {
		this.defaultFwhm = defaultFwhm;
	}

	/**
	 * Stars closer than this to the principal galaxy center, in arcseconds, are ignored. 0 disables the check.
	 * @return
	 */
	public double getMinDistanceFromGalaxy() {
		return minDistanceFromGalaxy;
	}

	public void setMinDistanceFromGalaxy(double minDistanceFromGalaxy) {
		this.minDistanceFromGalaxy = minDistanceFromGalaxy;
	}

	public RemovalConfig getRemoval() {
		return removal;
	}

	public SaturationConfig getSaturation() {
		return saturation;
	}

	public RegionAnnotation getAnnotation() {
		return annotation;
	}

	public void setAnnotation(RegionAnnotation annotation) {
		this.annotation = annotation;
	}

}
