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
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import skyfind.imagej.processing.ImageFilters;
import skyfind.imagej.processing.RegionLabeling;
import skyfind.lib.analysis.fitting.PolynomialSurface;
import skyfind.lib.analysis.images.SimpleImage;
import skyfind.lib.analysis.images.SimpleModifiableImage;
import skyfind.lib.analysis.stats.SigmaClip;
import skyfind.lib.geom.Point2;
import skyfind.lib.images.Mask;
import skyfind.lib.regions.ImageBox;

/**
 * A candidate detection: a small cutout around a position in a frame, together with a larger 
 * background box around the same position.
 * <p>
 * The background mask excludes an inner ellipse (the source, scaled by the inner factor) from 
 * the background box, leaving an annulus from which the background underneath the source can be 
 * estimated. Its radii always satisfy {@code outer > inner > cutout}.
 * <p>
 * The estimated background, the background-subtracted cutout, the segmentation mask and the 
 * peak are derived from the cutout geometry. They are null until computed, and are not carried 
 * over by {@link #zoom(double)}.
 * 
 * @author SkyFind developers
 */
public class Source implements Serializable {
	
	private static final long serialVersionUID = 1L;

	private static final Logger logger = LoggerFactory.getLogger(Source.class);
	
	/**
	 * Default ratio between the radius of the excluded inner ellipse and the source radius.
	 */
	public static final double DEFAULT_INNER_FACTOR = 1.2;
	
	private static final int POLYNOMIAL_ORDER = 3;
	private static final int PEAK_BOX_SIZE = 5;
	
	private final Point2 center;
	private final double semiMajor, semiMinor, angle;
	private final double innerFactor, outerFactor;
	
	private final ImageBox cutout;
	private final ImageBox background;
	private final Mask backgroundMask;
	private final Mask ellipseMask;
	
	private ImageBox estimatedBackground;
	private ImageBox subtracted;
	private Mask segmentationMask;
	private Point2 peak;
	
	private Source(Point2 center, double semiMajor, double semiMinor, double angle, double innerFactor, double outerFactor,
			ImageBox cutout, ImageBox background) {
		this.center = center;
		this.semiMajor = semiMajor;
		this.semiMinor = semiMinor;
		this.angle = angle;
		this.innerFactor = innerFactor;
		this.outerFactor = outerFactor;
		this.cutout = cutout;
		this.background = background;
		this.ellipseMask = Mask.createEllipse(cutout.getWidth(), cutout.getHeight(), cutout.toRelative(center), semiMajor, semiMinor, angle);
		this.backgroundMask = Mask.createEllipse(background.getWidth(), background.getHeight(), background.toRelative(center), 
				semiMajor * innerFactor, semiMinor * innerFactor, angle);
	}
	
	/**
	 * Create an elliptical source.
	 * 
	 * @param image the frame containing the source
	 * @param center center of the source, in frame pixel coordinates
	 * @param semiMajor semi-major axis, in pixels
	 * @param semiMinor semi-minor axis, in pixels
	 * @param angle angle of the major axis from the x axis, in degrees
	 * @param innerFactor ratio of the excluded inner ellipse to the source ellipse; must be &gt; 1
	 * @param outerFactor ratio of the background box radius to the source radius; must exceed the inner factor
	 * @return
	 * @throws IllegalArgumentException if the factors are invalid, or the source lies outside the image
	 */
	public static Source fromEllipse(SimpleImage image, Point2 center, double semiMajor, double semiMinor, double angle, 
			double innerFactor, double outerFactor) {
		Objects.requireNonNull(center, "Source center must not be null");
		if (!(innerFactor > 1))
			throw new IllegalArgumentException("Inner factor must be > 1, but was " + innerFactor);
		if (!(outerFactor > innerFactor))
			throw new IllegalArgumentException("Outer factor " + outerFactor + " must be larger than inner factor " + innerFactor);
		if (!(semiMajor > 0) || !(semiMinor > 0))
			throw new IllegalArgumentException("Source axes must be > 0, but were " + semiMajor + " and " + semiMinor);
		double a = Math.max(semiMajor, semiMinor);
		var cutout = ImageBox.fromCircle(image, center, a);
		var background = ImageBox.fromCircle(image, center, a * outerFactor);
		return new Source(center, semiMajor, semiMinor, angle, innerFactor, outerFactor, cutout, background);
	}
	
	/**
	 * Create a circular source.
	 * @param image
	 * @param center
	 * @param radius
	 * @param innerFactor
	 * @param outerFactor
	 * @return
	 * @see #fromEllipse(SimpleImage, Point2, double, double, double, double, double)
	 */
	public static Source fromCircle(SimpleImage image, Point2 center, double radius, double innerFactor, double outerFactor) {
		return fromEllipse(image, center, radius, radius, 0, innerFactor, outerFactor);
	}
	
	/**
	 * Create a circular source using {@link #DEFAULT_INNER_FACTOR}.
	 * @param image
	 * @param center
	 * @param radius
	 * @param outerFactor
	 * @return
	 */
	public static Source fromCircle(SimpleImage image, Point2 center, double radius, double outerFactor) {
		return fromCircle(image, center, radius, DEFAULT_INNER_FACTOR, outerFactor);
	}
	
	/**
	 * Estimate the background underneath the source from the background annulus.
	 * <p>
	 * The result depends only on the pixel values and geometry, so calling this method again on 
	 * an unchanged source gives identical values. Any previous background-subtracted cutout is discarded.
	 * 
	 * @param method
	 * @param sigmaClip if true, iteratively exclude outlying annulus pixels before fitting
	 * @param sigma clipping threshold, in standard deviations
	 * @return the estimated background, with the geometry of the cutout
	 * @throws BackgroundEstimationException if too few usable annulus pixels remain
	 */
	public ImageBox estimateBackground(BackgroundMethod method, boolean sigmaClip, double sigma) {
		if (method == null)
			throw new IllegalArgumentException("Background method must not be null");
		Mask excluded = backgroundMask;
		if (sigmaClip)
			excluded = SigmaClip.clipMask(background, backgroundMask, sigma, SigmaClip.DEFAULT_MAX_ITERATIONS);
		
		switch (method) {
		case POLYNOMIAL:
			try {
				var surface = PolynomialSurface.fit(background, excluded, POLYNOMIAL_ORDER);
				estimatedBackground = surface.evaluate(cutout);
			} catch (IllegalArgumentException e) {
				throw new BackgroundEstimationException("Unable to fit background around " + center + ": " + e.getMessage(), e);
			}
			break;
		case LOCAL_MEAN:
			// Clipped pixels are already part of the excluded mask
			var stats = SigmaClip.computeStatistics(background, excluded);
			if (stats.getNKept() == 0)
				throw new BackgroundEstimationException("No usable background pixels around " + center);
			estimatedBackground = cutout.filledWith((float)stats.getMean());
			break;
		default:
			throw new IllegalArgumentException("Unknown background method " + method);
		}
		subtracted = null;
		return estimatedBackground;
	}
	
	/**
	 * Subtract the estimated background from the cutout.
	 * @return the background-subtracted cutout
	 * @throws IllegalStateException if the background has not been estimated
	 */
	public ImageBox subtractBackground() {
		if (estimatedBackground == null)
			throw new IllegalStateException("Background must be estimated before it can be subtracted");
		subtracted = cutout.subtract(estimatedBackground);
		return subtracted;
	}
	
	/**
	 * Find the segment containing the source center.
	 * <p>
	 * The threshold is the sigma-clipped mean plus {@code thresholdSigmas} sigma-clipped standard 
	 * deviations of the background annulus. The cutout is smoothed with a Gaussian kernel before 
	 * thresholding, and 8-connected regions with fewer than {@code minPixels} pixels are discarded.
	 * 
	 * @param thresholdSigmas
	 * @param kernelFwhm
	 * @param kernelSize
	 * @param minPixels
	 * @return true if a segment was found at the center, false otherwise (the mask is then null)
	 * @throws BackgroundEstimationException if the annulus has no usable pixels
	 */
	public boolean findCenterSegment(double thresholdSigmas, double kernelFwhm, int kernelSize, int minPixels) {
		var stats = SigmaClip.computeStatistics(background, backgroundMask, SigmaClip.DEFAULT_SIGMA);
		if (stats.getNKept() == 0)
			throw new BackgroundEstimationException("No usable background pixels around " + center);
		double threshold = stats.getMean() + stats.getStdDev() * thresholdSigmas;
		var smoothed = ImageFilters.gaussianSmooth(cutout, kernelFwhm, kernelSize, (float)stats.getMean());
		var labels = RegionLabeling.labelImage(smoothed, threshold, minPixels);
		var rel = cutout.toRelative(center);
		int label = labels.get(rel.getPixelX(), rel.getPixelY());
		if (label == 0) {
			logger.trace("No segment found at {} (threshold {})", center, threshold);
			segmentationMask = null;
			return false;
		}
		segmentationMask = labels.toMask(label);
		return true;
	}
	
	/**
	 * Locate local maxima in the cutout.
	 * <p>
	 * The background-subtracted cutout is used if available, otherwise the raw cutout. 
	 * The threshold is the sigma-clipped median plus {@code thresholdSigmas} sigma-clipped standard deviations.
	 * If exactly one maximum is found it is stored as the peak of this source.
	 * 
	 * @param thresholdSigmas
	 * @return all maxima, in absolute pixel coordinates
	 */
	public List<Point2> locatePeaks(double thresholdSigmas) {
		var data = subtracted == null ? cutout : subtracted;
		var stats = SigmaClip.computeStatistics(data, null, SigmaClip.DEFAULT_SIGMA);
		if (stats.getNKept() == 0) {
			peak = null;
			return List.of();
		}
		double threshold = stats.getMedian() + thresholdSigmas * stats.getStdDev();
		var peaks = RegionLabeling.findLocalMaxima(data, threshold, PEAK_BOX_SIZE).stream()
				.map(data::toAbsolute)
				.toList();
		peak = peaks.size() == 1 ? peaks.get(0) : null;
		return peaks;
	}
	
	/**
	 * Create a smaller source around the same center.
	 * <p>
	 * The axes are divided by the factor, and the cutout and background boxes are cropped from 
	 * the existing ones, so that both strictly shrink. Derived values are not copied.
	 * 
	 * @param factor zoom factor; must be &gt; 1
	 * @return a new source
	 * @throws IllegalStateException if the source is already too small to shrink further
	 */
	public Source zoom(double factor) {
		if (!(factor > 1))
			throw new IllegalArgumentException("Zoom factor must be > 1, but was " + factor);
		double a = semiMajor / factor;
		double b = semiMinor / factor;
		int cutoutHalfWidth = shrink(ImageBox.halfWidth(Math.max(semiMajor, semiMinor)), ImageBox.halfWidth(Math.max(a, b)));
		int backgroundHalfWidth = shrink(ImageBox.halfWidth(Math.max(semiMajor, semiMinor) * outerFactor), 
				ImageBox.halfWidth(Math.max(a, b) * outerFactor));
		return new Source(center, a, b, angle, innerFactor, outerFactor, 
				cutout.crop(center, cutoutHalfWidth), background.crop(center, backgroundHalfWidth));
	}
	
	private static int shrink(int current, int requested) {
		int n = Math.min(requested, current - 1);
		if (n < 1)
			throw new IllegalStateException("Source is too small to zoom further");
		return n;
	}
	
	/**
	 * Replace frame pixels under the removal mask with the estimated background.
	 * @param frame frame to modify; must be the frame this source was created from
	 * @return number of pixels replaced
	 * @throws IllegalStateException if the background has not been estimated
	 * @see #getRemovalMask()
	 */
	public int replaceWithBackground(SimpleModifiableImage frame) {
		if (estimatedBackground == null)
			throw new IllegalStateException("Background must be estimated before the source can be removed");
		return estimatedBackground.replace(frame, getRemovalMask());
	}
	
	/**
	 * Get the pixels belonging to the source, relative to the cutout: the segmentation mask 
	 * if one was found, otherwise the source ellipse.
	 * @return
	 */
	public Mask getRemovalMask() {
		return segmentationMask == null ? ellipseMask : segmentationMask;
	}
	
	/**
	 * Sum of background-subtracted values under the removal mask.
	 * @return the flux, or NaN if the background has not been estimated
	 */
	public double getFlux() {
		if (estimatedBackground == null)
			return Double.NaN;
		var mask = getRemovalMask();
		double sum = 0;
		for (int y = 0; y < cutout.getHeight(); y++) {
			for (int x = 0; x < cutout.getWidth(); x++) {
				if (!mask.get(x, y))
					continue;
				double v = cutout.getValue(x, y) - estimatedBackground.getValue(x, y);
				if (Double.isFinite(v))
					sum += v;
			}
		}
		return sum;
	}
	
	/**
	 * Center of the source, in absolute pixel coordinates.
	 * @return
	 */
	public Point2 getCenter() {
		return center;
	}
	
	/**
	 * Largest semi-axis, in pixels.
	 * @return
	 */
	public double getRadius() {
		return Math.max(semiMajor, semiMinor);
	}

	@SuppressWarnings("javadoc")
	public double getSemiMajor() {
		return semiMajor;
	}

	@SuppressWarnings("javadoc")
	public double getSemiMinor() {
		return semiMinor;
	}

	/**
	 * Angle of the major axis from the x axis, in degrees.
	 * @return
	 */
	public double getAngle() {
		return angle;
	}

	@SuppressWarnings("javadoc")
	public double getInnerFactor() {
		return innerFactor;
	}

	@SuppressWarnings("javadoc")
	public double getOuterFactor() {
		return outerFactor;
	}

	/**
	 * Pixel values around the source.
	 * @return
	 */
	public ImageBox getCutout() {
		return cutout;
	}

	/**
	 * Pixel values of the larger box used to estimate the background.
	 * @return
	 */
	public ImageBox getBackground() {
		return background;
	}

	/**
	 * Mask of the background box that is true for pixels excluded from background estimation.
	 * @return
	 */
	public Mask getBackgroundMask() {
		return backgroundMask;
	}
	
	/**
	 * Mask of the cutout that is true inside the source ellipse.
	 * @return
	 */
	public Mask getEllipseMask() {
		return ellipseMask;
	}

	/**
	 * Estimated background with the geometry of the cutout, or null.
	 * @return
	 */
	public ImageBox getEstimatedBackground() {
		return estimatedBackground;
	}

	/**
	 * Background-subtracted cutout, or null.
	 * @return
	 */
	public ImageBox getSubtracted() {
		return subtracted;
	}

	/**
	 * Segment containing the center, relative to the cutout, or null.
	 * @return
	 */
	public Mask getSegmentationMask() {
		return segmentationMask;
	}
	
	/**
	 * Single peak found by {@link #locatePeaks(double)}, or null.
	 * @return
	 */
	public Point2 getPeak() {
		return peak;
	}
	
	/**
	 * Query whether a single peak has been found.
	 * @return
	 */
	public boolean hasPeak() {
		return peak != null;
	}

	@Override
	public String toString() {
		return String.format("Source [center=(%.2f, %.2f), axes=(%.2f, %.2f), angle=%.1f]", 
				center.getX(), center.getY(), semiMajor, semiMinor, angle);
	}
	
}
