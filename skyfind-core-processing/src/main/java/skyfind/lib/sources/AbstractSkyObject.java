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

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import skyfind.lib.geom.Point2;
import skyfind.lib.images.Frame;
import skyfind.lib.objects.CatalogObject;

/**
 * Base class for catalog objects being processed in a single frame.
 * <p>
 * Combines the immutable catalog entry, its pixel position in the frame, and the mutable 
 * {@link DetectionState}.
 * 
 * @author SkyFind developers
 */
public abstract class AbstractSkyObject {
	
	private static final Logger logger = LoggerFactory.getLogger(AbstractSkyObject.class);
	
	private final CatalogObject catalogObject;
	private final Point2 pixelPosition;
	private final DetectionState state = new DetectionState();
	
	protected AbstractSkyObject(CatalogObject catalogObject, Point2 pixelPosition) {
		this.catalogObject = Objects.requireNonNull(catalogObject);
		this.pixelPosition = Objects.requireNonNull(pixelPosition);
	}
	
	/**
	 * Get the label used for this object in segmentation maps.
	 * @return a label &gt; 0
	 */
	public abstract int getSegmentLabel();
	
	/**
	 * Get the catalog entry.
	 * @return
	 */
	public CatalogObject getCatalogObject() {
		return catalogObject;
	}
	
	/**
	 * Get the row index of the object in its catalog.
	 * @return
	 */
	public int getIndex() {
		return catalogObject.getIndex();
	}
	
	/**
	 * Get the catalog position converted to pixel coordinates of the current frame.
	 * @return
	 */
	public Point2 getPixelPosition() {
		return pixelPosition;
	}
	
	/**
	 * Get the mutable detection state.
	 * @return
	 */
	public DetectionState getState() {
		return state;
	}
	
	/**
	 * Get the detected source, or null.
	 * @return
	 */
	public Source getSource() {
		return state.getSource();
	}
	
	/**
	 * Query whether a source has been found for this object.
	 * @return
	 */
	public boolean hasSource() {
		return state.getSource() != null;
	}
	
	/**
	 * Set the source for this object, replacing any previous source.
	 * @param source
	 */
	public void setSource(Source source) {
		state.setSource(source);
	}
	
	public boolean isIgnored() {
		return state.isIgnored();
	}
	
	public void setIgnored(boolean ignore) {
		state.setIgnored(ignore);
	}
	
	public boolean isSpecial() {
		return state.isSpecial();
	}
	
	public void setSpecial(boolean special) {
		state.setSpecial(special);
	}
	
	/**
	 * Background-subtracted flux of the detected source.
	 * @return the flux, or NaN if there is no source with an estimated background
	 */
	public double getFlux() {
		var source = getSource();
		return source == null ? Double.NaN : source.getFlux();
	}
	
	/**
	 * Find the segment containing a position, growing the search region while the segment 
	 * touches the edge of the cutout.
	 * 
	 * @param frame
	 * @param center
	 * @param semiMajor
	 * @param semiMinor
	 * @param angle
	 * @param config
	 * @param expand whether to grow the region when the segment touches the cutout edge
	 * @param maxLevel maximum number of times the region may grow
	 * @param expansionFactor factor by which the axes grow each time
	 * @return the source with its segment and background, or null if no segment contains the position
	 */
	protected static Source segmentAround(Frame frame, Point2 center, double semiMajor, double semiMinor, double angle, 
			DetectionConfig config, boolean expand, int maxLevel, double expansionFactor) {
		double scale = 1.0;
		for (int level = 0; ; level++) {
			var source = Source.fromEllipse(frame, center, semiMajor * scale, semiMinor * scale, angle, 
					config.getInnerFactor(), config.getOuterFactor());
			source.estimateBackground(config.getBackgroundMethod(), config.isSigmaClip(), config.getClipSigma());
			source.subtractBackground();
			if (!source.findCenterSegment(config.getSegmentationThreshold(), config.getKernelFwhm(), config.getKernelSize(), config.getMinPixels()))
				return null;
			if (!expand || level >= maxLevel || !source.getSegmentationMask().touchesEdge())
				return source;
			scale *= expansionFactor;
			logger.debug("Segment at {} touches the cutout edge, expanding by {}", center, scale);
		}
	}
	
	/**
	 * Find the segment containing a position using the expansion settings of a detection configuration.
	 * @param frame
	 * @param center
	 * @param semiMajor
	 * @param semiMinor
	 * @param angle
	 * @param config
	 * @return
	 * @see #segmentAround(Frame, Point2, double, double, double, DetectionConfig, boolean, int, double)
	 */
	protected static Source segmentAround(Frame frame, Point2 center, double semiMajor, double semiMinor, double angle, DetectionConfig config) {
		return segmentAround(frame, center, semiMajor, semiMinor, angle, config, 
				config.isExpand(), config.getMaxExpansionLevel(), config.getExpansionFactor());
	}
	
	@Override
	public String toString() {
		return getClass().getSimpleName() + " [index=" + getIndex() + ", position=" + pixelPosition + "]";
	}

}
