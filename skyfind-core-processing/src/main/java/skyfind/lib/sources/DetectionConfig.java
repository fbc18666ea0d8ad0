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

/**
 * Parameters controlling how sources are located around catalog positions.
 * <p>
 * Instances are usually read from JSON, where any missing field keeps its default value.
 * 
 * @author SkyFind developers
 */
public class DetectionConfig implements Serializable {
	
	private static final long serialVersionUID = 1L;
	
	private DetectionMethod method = DetectionMethod.PEAKS;
	
	private double initialRadius = 10.0;
	private double innerFactor = Source.DEFAULT_INNER_FACTOR;
	private double outerFactor = 1.5;
	
	private BackgroundMethod backgroundMethod = BackgroundMethod.POLYNOMIAL;
	private boolean sigmaClip = true;
	private double clipSigma = 3.0;
	
	private double peakThresholdSigmas = 5.0;
	private int maxZoomLevels = 3;
	private double zoomFactor = 1.5;
	private double maxPeakOffset = 3.0;
	
	private double segmentationThreshold = 2.0;
	private double kernelFwhm = 2.0;
	private int kernelSize = 5;
	private int minPixels = 5;
	
	private boolean expand = true;
	private int maxExpansionLevel = 3;
	private double expansionFactor = 1.5;
	
	/**
	 * Check that all values are usable.
	 * @param name name of the enclosing section, used in error messages
	 * @throws IllegalArgumentException if any value is missing or out of range
	 */
	public void validate(String name) throws IllegalArgumentException {
		if (method == null)
			throw new IllegalArgumentException(name + ": unknown detection method");
		if (backgroundMethod == null)
			throw new IllegalArgumentException(name + ": unknown background method");
		if (!(initialRadius > 0))
			throw new IllegalArgumentException(name + ": initial radius must be > 0, but was " + initialRadius);
		if (!(innerFactor > 1))
			throw new IllegalArgumentException(name + ": inner factor must be > 1, but was " + innerFactor);
		if (!(outerFactor > innerFactor))
			throw new IllegalArgumentException(name + ": outer factor " + outerFactor + " must be larger than inner factor " + innerFactor);
		if (!(clipSigma > 0))
			throw new IllegalArgumentException(name + ": clipping sigma must be > 0, but was " + clipSigma);
		if (!(zoomFactor > 1))
			throw new IllegalArgumentException(name + ": zoom factor must be > 1, but was " + zoomFactor);
		if (maxZoomLevels < 0 || maxExpansionLevel < 0)
			throw new IllegalArgumentException(name + ": zoom and expansion levels must not be negative");
		if (!(expansionFactor > 1))
			throw new IllegalArgumentException(name + ": expansion factor must be > 1, but was " + expansionFactor);
		if (!(kernelFwhm > 0) || kernelSize < 3 || kernelSize % 2 == 0)
			throw new IllegalArgumentException(name + ": kernel must have FWHM > 0 and an odd size >= 3");
		if (minPixels < 1)
			throw new IllegalArgumentException(name + ": minimum segment size must be >= 1, but was " + minPixels);
		if (!(maxPeakOffset >= 0))
			throw new IllegalArgumentException(name + ": maximum peak offset must be >= 0, but was " + maxPeakOffset);
	}

	public DetectionMethod getMethod() {
		return method;
	}

	public void setMethod(DetectionMethod method) {
		this.method = method;
	}

	/**
	 * Radius of the first cutout, in pixels, used when the object gives no better estimate.
	 * @return
	 */
	public double getInitialRadius() {
		return initialRadius;
	}

	public void setInitialRadius(double initialRadius) {
		this.initialRadius = initialRadius;
	}

	public double getInnerFactor() {
		return innerFactor;
	}

	public double getOuterFactor() {
		return outerFactor;
	}

	public void setOuterFactor(double outerFactor) {
		this.outerFactor = outerFactor;
	}

	public BackgroundMethod getBackgroundMethod() {
		return backgroundMethod;
	}

	public void setBackgroundMethod(BackgroundMethod backgroundMethod) {
		this.backgroundMethod = backgroundMethod;
	}

	public boolean isSigmaClip() {
		return sigmaClip;
	}

	public double getClipSigma() {
		return clipSigma;
	}

	public double getPeakThresholdSigmas() {
		return peakThresholdSigmas;
	}

	public int getMaxZoomLevels() {
		return maxZoomLevels;
	}

	public double getZoomFactor() {
		return zoomFactor;
	}

	/**
	 * Maximum distance between a detected peak and the catalog position, in pixels.
	 * @return
	 */
	public double getMaxPeakOffset() {
		return maxPeakOffset;
	}

	public double getSegmentationThreshold() {
		return segmentationThreshold;
	}

	public double getKernelFwhm() {
		return kernelFwhm;
	}

	public int getKernelSize() {
		return kernelSize;
	}

	public int getMinPixels() {
		return minPixels;
	}

	/**
	 * Whether a segment touching the cutout edge should be searched again in a larger cutout.
	 * @return
	 */
	public boolean isExpand() {
		return expand;
	}

	public int getMaxExpansionLevel() {
		return maxExpansionLevel;
	}

	public double getExpansionFactor() {
		return expansionFactor;
	}

}
