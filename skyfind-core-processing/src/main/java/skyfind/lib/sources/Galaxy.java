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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import skyfind.lib.geom.Point2;
import skyfind.lib.images.Frame;
import skyfind.lib.objects.CatalogObject;
import skyfind.lib.objects.GalaxyAttributes;
import skyfind.lib.objects.ObjectKind;
import skyfind.lib.regions.EllipseRegion;

/**
 * An extended source from a catalog.
 * <p>
 * Catalog axes are diameters in arcminutes and the position angle is measured east of north; 
 * they are converted to pixel semi-axes and an angle from the x axis for a frame with north up 
 * and east to the left.
 * 
 * @author SkyFind developers
 */
public class Galaxy extends AbstractSkyObject {
	
	private static final Logger logger = LoggerFactory.getLogger(Galaxy.class);
	
	/**
	 * Segmentation label of the principal galaxy.
	 */
	public static final int PRINCIPAL_LABEL = 1;
	
	/**
	 * Segmentation label of companions of the principal galaxy.
	 */
	public static final int COMPANION_LABEL = 2;
	
	/**
	 * Segmentation label of all other galaxies.
	 */
	public static final int OTHER_LABEL = 3;
	
	private final double pixelScale;
	
	/**
	 * Create a galaxy.
	 * @param catalogObject catalog entry; must be a galaxy
	 * @param pixelPosition catalog position in pixel coordinates of the frame
	 * @param pixelScale pixel scale of the frame, in arcseconds
	 */
	public Galaxy(CatalogObject catalogObject, Point2 pixelPosition, double pixelScale) {
		super(catalogObject, pixelPosition);
		if (catalogObject.getKind() != ObjectKind.GALAXY || catalogObject.getGalaxy() == null)
			throw new IllegalArgumentException("Catalog object " + catalogObject + " is not a galaxy");
		if (!(pixelScale > 0))
			throw new IllegalArgumentException("Pixel scale must be > 0, but was " + pixelScale);
		this.pixelScale = pixelScale;
	}
	
	private GalaxyAttributes attributes() {
		return getCatalogObject().getGalaxy();
	}
	
	public String getName() {
		return attributes().getName();
	}
	
	public boolean isPrincipal() {
		return attributes().isPrincipal();
	}
	
	public boolean isCompanion() {
		return attributes().isCompanion();
	}
	
	/**
	 * Query whether the catalog provides a major axis.
	 * @return
	 */
	public boolean hasExtent() {
		return attributes().hasExtent();
	}
	
	@Override
	public int getSegmentLabel() {
		if (isPrincipal())
			return PRINCIPAL_LABEL;
		if (isCompanion())
			return COMPANION_LABEL;
		return OTHER_LABEL;
	}
	
	/**
	 * Semi-major axis from the catalog, in pixels.
	 * @return the semi-major axis, or NaN if there is no extent
	 */
	public double getSemiMajor() {
		if (!hasExtent())
			return Double.NaN;
		return attributes().getMajorAxis() * 30.0 / pixelScale;
	}
	
	/**
	 * Semi-minor axis from the catalog, in pixels; falls back to the semi-major axis if no minor axis is given.
	 * @return the semi-minor axis, or NaN if there is no extent
	 */
	public double getSemiMinor() {
		Double minor = attributes().getMinorAxis();
		if (minor == null || !(minor > 0))
			return getSemiMajor();
		return minor * 30.0 / pixelScale;
	}
	
	/**
	 * Angle of the major axis from the x axis, in degrees.
	 * @return
	 */
	public double getPixelAngle() {
		Double pa = attributes().getPositionAngle();
		return pa == null ? 0 : pa + 90.0;
	}
	
	/**
	 * Look for the segment containing the catalog position.
	 * <p>
	 * The search region is the catalog ellipse if there is one, otherwise a circle with the 
	 * initial radius. It is expanded while the segment touches its edge.
	 * 
	 * @param frame
	 * @param config
	 * @return the source, or null if no segment was found (the stored source is then cleared)
	 */
	public Source findSource(Frame frame, DetectionConfig config) {
		Source source;
		if (hasExtent())
			source = segmentAround(frame, getPixelPosition(), getSemiMajor(), getSemiMinor(), getPixelAngle(), config);
		else
			source = segmentAround(frame, getPixelPosition(), config.getInitialRadius(), config.getInitialRadius(), 0, config);
		setSource(source);
		return source;
	}
	
	/**
	 * Create a source from the catalog ellipse, without segmentation.
	 * The background is not estimated.
	 * 
	 * @param frame
	 * @param outerFactor ratio between the background box radius and the source radius
	 * @param expansionFactor scale factor applied to the catalog axes
	 * @return
	 * @throws IllegalStateException if the catalog provides no extent
	 */
	public Source sourceFromParameters(Frame frame, double outerFactor, double expansionFactor) {
		if (!hasExtent())
			throw new IllegalStateException("Galaxy " + getName() + " has no catalog extent");
		return Source.fromEllipse(frame, getPixelPosition(), getSemiMajor() * expansionFactor, getSemiMinor() * expansionFactor, getPixelAngle(), 
				Source.DEFAULT_INNER_FACTOR, outerFactor);
	}
	
	/**
	 * Get an ellipse describing the galaxy: the catalog ellipse if available, otherwise a circle 
	 * with the given radius.
	 * @param fallbackRadius
	 * @return
	 */
	public EllipseRegion toEllipse(double fallbackRadius) {
		String text = isPrincipal() ? getName() + " (principal)" : getName();
		if (hasExtent())
			return new EllipseRegion(getPixelPosition(), getSemiMajor(), getSemiMinor(), getPixelAngle(), "green", text);
		return new EllipseRegion(getPixelPosition(), fallbackRadius, fallbackRadius, 0, "red", text);
	}
	
	/**
	 * Replace the galaxy by the estimated background of its source.
	 * @param frame
	 * @return number of pixels replaced
	 * @throws IllegalStateException if there is no source with an estimated background
	 */
	public int remove(Frame frame) {
		var source = getSource();
		if (source == null)
			throw new IllegalStateException("Galaxy " + getName() + " has no source to remove");
		int n = source.replaceWithBackground(frame);
		logger.debug("Removed galaxy {} ({} pixels)", getName(), n);
		return n;
	}

}
