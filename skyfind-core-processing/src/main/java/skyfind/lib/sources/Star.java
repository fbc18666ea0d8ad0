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

import skyfind.lib.analysis.fitting.ModelFamily;
import skyfind.lib.analysis.fitting.ModelFitter;
import skyfind.lib.analysis.fitting.PsfModel;
import skyfind.lib.geom.Point2;
import skyfind.lib.images.Frame;
import skyfind.lib.objects.CatalogObject;
import skyfind.lib.objects.ObjectKind;
import skyfind.lib.regions.EllipseRegion;

/**
 * A point source from a catalog, which can be located, fitted with an analytic profile and 
 * removed from a frame.
 * 
 * @author SkyFind developers
 */
public class Star extends AbstractSkyObject {
	
	private static final Logger logger = LoggerFactory.getLogger(Star.class);
	
	private static final double MIN_APERTURE_AXIS = 0.5;
	
	/**
	 * Create a star.
	 * @param catalogObject catalog entry; must be a star
	 * @param pixelPosition catalog position in pixel coordinates of the frame
	 */
	public Star(CatalogObject catalogObject, Point2 pixelPosition) {
		super(catalogObject, pixelPosition);
		if (catalogObject.getKind() != ObjectKind.STAR)
			throw new IllegalArgumentException("Catalog object " + catalogObject + " is not a star");
	}
	
	/**
	 * Stars are labelled by catalog index, starting at 1.
	 */
	@Override
	public int getSegmentLabel() {
		return getIndex() + 1;
	}
	
	/**
	 * Get the fitted profile.
	 * @return the model, or null if no profile has been fitted
	 */
	public PsfModel getModel() {
		return getState().getModel();
	}
	
	/**
	 * Query whether a profile has been fitted.
	 * @return
	 */
	public boolean hasModel() {
		return getModel() != null;
	}
	
	/**
	 * Query whether a saturated region has been found and removed for this star.
	 * @return
	 */
	public boolean hasSaturation() {
		return getState().hasSaturation();
	}
	
	/**
	 * FWHM of the fitted profile, in pixels.
	 * @return the FWHM, or NaN without a model
	 */
	public double getFwhm() {
		var model = getModel();
		return model == null ? Double.NaN : model.getFwhm();
	}
	
	/**
	 * Best available position: the model center, else the detected peak, else the catalog position.
	 * @return
	 */
	public Point2 getBestPosition() {
		var model = getModel();
		if (model != null)
			return model.getCenter();
		var source = getSource();
		if (source != null && source.getPeak() != null)
			return source.getPeak();
		return getPixelPosition();
	}
	
	/**
	 * Try to find the star close to its catalog position.
	 * <p>
	 * With {@link DetectionMethod#PEAKS}, the background-subtracted cutout is searched for 
	 * local maxima. If several are found the cutout is zoomed in and searched again, up to the 
	 * configured number of levels; a single maximum within the maximum offset means the star is detected.
	 * With {@link DetectionMethod#SEGMENTATION}, the segment containing the catalog position is used.
	 * 
	 * @param frame
	 * @param config
	 * @param radius initial cutout radius, in pixels
	 * @return the source, or null if the star was not found (the stored source is then cleared)
	 */
	public Source findSource(Frame frame, DetectionConfig config, double radius) {
		Source source;
		switch (config.getMethod()) {
		case PEAKS:
			source = findByPeaks(Source.fromCircle(frame, getPixelPosition(), radius, config.getInnerFactor(), config.getOuterFactor()), config);
			break;
		case SEGMENTATION:
			source = segmentAround(frame, getPixelPosition(), radius, radius, 0, config);
			break;
		default:
			throw new IllegalArgumentException("Unknown detection method " + config.getMethod());
		}
		setSource(source);
		return source;
	}
	
	private Source findByPeaks(Source source, DetectionConfig config) {
		for (int level = 0; ; level++) {
			source.estimateBackground(config.getBackgroundMethod(), config.isSigmaClip(), config.getClipSigma());
			source.subtractBackground();
			var peaks = source.locatePeaks(config.getPeakThresholdSigmas());
			if (peaks.isEmpty())
				return null;
			if (peaks.size() == 1) {
				double offset = peaks.get(0).distance(getPixelPosition());
				if (offset <= config.getMaxPeakOffset())
					return source;
				logger.trace("Peak for star {} is {} pixels from the catalog position", getIndex(), offset);
				return null;
			}
			if (level >= config.getMaxZoomLevels())
				return null;
			try {
				source = source.zoom(config.getZoomFactor());
			} catch (IllegalStateException e) {
				logger.trace("Cannot zoom further for star {}: {}", getIndex(), e.getMessage());
				return null;
			}
		}
	}
	
	/**
	 * Fit the configured profiles, in order, to a source.
	 * <p>
	 * The first profile whose fit converges with a positive amplitude, a FWHM smaller than the 
	 * cutout and a center close enough to the initial estimate is kept.
	 * 
	 * @param config
	 * @param source the source to fit, or null to use the stored source
	 * @param guessFwhm initial estimate of the FWHM, in pixels
	 * @return the fitted model, or null if no profile could be fitted
	 * @throws IllegalStateException if there is no source, or its background has not been subtracted
	 */
	public PsfModel fitModel(FittingConfig config, Source source, double guessFwhm) {
		if (source == null)
			source = getSource();
		if (source == null)
			throw new IllegalStateException("No source to fit for star " + getIndex());
		var data = source.getSubtracted();
		if (data == null)
			throw new IllegalStateException("Background must be subtracted before fitting star " + getIndex());
		var guess = source.getPeak() == null ? getPixelPosition() : source.getPeak();
		for (var family : config.getModels()) {
			var model = ModelFitter.fit(family, data, guess, guessFwhm, config.getMaxCenterOffset());
			if (model != null && model.getAmplitude() > 0) {
				logger.trace("Fitted {} to star {}: FWHM = {}", family, getIndex(), model.getFwhm());
				getState().setModel(model);
				return model;
			}
		}
		getState().setModel(null);
		return null;
	}
	
	/**
	 * Create a circular source with a radius given in units of the profile sigma.
	 * 
	 * @param frame
	 * @param defaultFwhm FWHM used when there is no model, in pixels
	 * @param sigmaLevel radius in units of sigma
	 * @param outerFactor ratio between the background box radius and the source radius
	 * @return
	 */
	public Source sourceAtSigmaLevel(Frame frame, double defaultFwhm, double sigmaLevel, double outerFactor) {
		double sigma = hasModel() ? getModel().getSigma() : defaultFwhm / ModelFamily.SIGMA_TO_FWHM;
		return Source.fromCircle(frame, getBestPosition(), sigma * sigmaLevel, outerFactor);
	}
	
	/**
	 * Replace the star by its estimated local background.
	 * 
	 * @param frame the frame to modify
	 * @param config
	 * @param defaultFwhm FWHM used when there is no model, in pixels
	 * @param method
	 * @param sigmaClip
	 * @param clipSigma clipping threshold, in standard deviations
	 * @return the source whose pixels were replaced, or null if the star was skipped
	 */
	public Source remove(Frame frame, RemovalConfig config, double defaultFwhm, BackgroundMethod method, boolean sigmaClip, double clipSigma) {
		if (!hasSource() && !config.isRemoveIfUndetected())
			return null;
		var source = sourceAtSigmaLevel(frame, defaultFwhm, config.getSigmaLevel(), config.getOuterFactor());
		source.estimateBackground(method, sigmaClip, clipSigma);
		int n = source.replaceWithBackground(frame);
		logger.trace("Replaced {} pixels for star {}", n, getIndex());
		return source;
	}
	
	/**
	 * Look for a saturated region around the star and replace it by its background.
	 * <p>
	 * The search is centered on the catalog position, with a radius of the profile sigma times 
	 * the configured number of sigmas.
	 * If a segment is found it becomes the source of this star.
	 * 
	 * @param frame
	 * @param config
	 * @param detection segmentation and background parameters
	 * @param defaultFwhm FWHM used when there is no model, in pixels
	 * @return true if a saturated region was found and removed
	 */
	public boolean removeSaturation(Frame frame, SaturationConfig config, DetectionConfig detection, double defaultFwhm) {
		double sigma = hasModel() ? getModel().getSigma() : defaultFwhm / ModelFamily.SIGMA_TO_FWHM;
		double radius = sigma * config.getSigmas();
		var source = segmentAround(frame, getPixelPosition(), radius, radius, 0, detection, 
				config.isExpand(), config.getMaxExpansionLevel(), config.getExpansionFactor());
		if (source == null)
			return false;
		source.replaceWithBackground(frame);
		setSource(source);
		getState().setHasSaturation(true);
		return true;
	}
	
	/**
	 * Get an elliptical aperture enclosing the saturation segment, from its second moments.
	 * 
	 * @param factor scale factor applied to the axes; 1 gives the ellipse of a uniform disk with the same moments
	 * @return the aperture in frame pixel coordinates, or null if there is no saturation segment
	 */
	public EllipseRegion findAperture(double factor) {
		var source = getSource();
		if (!hasSaturation() || source == null || source.getSegmentationMask() == null)
			return null;
		var cutout = source.getCutout();
		return EllipseRegion.fromMask(source.getSegmentationMask(), cutout.getX0(), cutout.getY0(), factor, MIN_APERTURE_AXIS, 
				"white", "aperture " + getIndex());
	}
	
	/**
	 * Replace the pixels inside an aperture by their estimated background.
	 * @param frame
	 * @param aperture
	 * @param outerFactor
	 * @param method
	 * @param sigmaClip
	 * @param clipSigma
	 * @return the number of pixels replaced
	 */
	public int removeAperture(Frame frame, EllipseRegion aperture, double outerFactor, BackgroundMethod method, boolean sigmaClip, double clipSigma) {
		var source = Source.fromEllipse(frame, aperture.getCenter(), aperture.getSemiMajor(), aperture.getSemiMinor(), aperture.getAngle(), 
				Source.DEFAULT_INNER_FACTOR, outerFactor);
		source.estimateBackground(method, sigmaClip, clipSigma);
		return source.replaceWithBackground(frame);
	}

}
