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

import java.util.ArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import skyfind.imagej.processing.ImageFilters;
import skyfind.imagej.processing.RegionLabeling;
import skyfind.lib.analysis.stats.SigmaClip;
import skyfind.lib.geom.Point2;
import skyfind.lib.images.Frame;
import skyfind.lib.images.Mask;
import skyfind.lib.images.SegmentationMap;
import skyfind.lib.regions.EllipseRegion;
import skyfind.lib.regions.PixelMoments;
import skyfind.lib.regions.RegionList;
import skyfind.lib.sources.BackgroundMethod;
import skyfind.lib.sources.Galaxy;
import skyfind.lib.sources.Source;

/**
 * Find bright sources that are in neither the galaxy nor the star catalog.
 * <p>
 * Pixels belonging to known galaxies and stars are excluded when estimating the frame background. 
 * The frame is smoothed with a Gaussian matching its PSF and thresholded; segments that overlap 
 * the principal galaxy, its companions or any known star are discarded.
 * 
 * @author SkyFind developers
 */
public class OtherSourceFinder {
	
	private static final Logger logger = LoggerFactory.getLogger(OtherSourceFinder.class);
	
	private static final double MIN_AXIS = 1.0;
	
	private final OtherSourceConfig config;
	
	/**
	 * Create a finder with the given settings.
	 * @param config
	 */
	public OtherSourceFinder(OtherSourceConfig config) {
		this.config = config;
	}
	
	/**
	 * Find uncataloged sources in a frame. The frame is modified if sources are removed.
	 * 
	 * @param frame
	 * @param galaxySegments galaxy segmentation map of the frame, or null
	 * @param starSegments star segmentation map of the frame, or null
	 * @param fwhm PSF FWHM of the frame, in pixels
	 * @param masks
	 * @return one row per source, indexed from 0
	 */
	public ExtractionResult find(Frame frame, SegmentationMap galaxySegments, SegmentationMap starSegments, double fwhm, ObjectMasks masks) {
		int w = frame.getWidth();
		int h = frame.getHeight();
		if (!(fwhm > 0))
			throw new IllegalArgumentException("FWHM must be > 0, but was " + fwhm);
		
		var excluded = Mask.createNonFinite(frame);
		if (galaxySegments != null)
			excluded = excluded.union(galaxySegments.toMask());
		if (starSegments != null)
			excluded = excluded.union(starSegments.toMask());
		if (masks.getBad() != null)
			excluded = excluded.union(masks.getBad());
		
		var stats = SigmaClip.computeStatistics(frame, excluded, config.getClipSigma());
		if (stats.getNKept() == 0) {
			logger.warn("No background pixels left in {}, skipping search for other sources", frame.getName());
			return empty(frame);
		}
		double median = stats.getMedian();
		double threshold = median + config.getThresholdSigmas() * stats.getStdDev();
		var smoothed = ImageFilters.gaussianSmooth(frame, fwhm, ImageFilters.kernelSizeForFwhm(fwhm), (float)median);
		var labels = RegionLabeling.labelImage(smoothed, threshold, config.getMinPixels());
		
		int[] labelArray = labels.toArray();
		int nLabels = 0;
		for (int label : labelArray)
			nLabels = Math.max(nLabels, label);
		
		// Single pass over the labels, accumulating what is needed for every segment
		var moments = new PixelMoments[nLabels + 1];
		double[] fluxes = new double[nLabels + 1];
		boolean[] discard = new boolean[nLabels + 1];
		for (int y = 0; y < h; y++) {
			for (int x = 0; x < w; x++) {
				int label = labelArray[y * w + x];
				if (label == 0)
					continue;
				if (moments[label] == null)
					moments[label] = new PixelMoments();
				moments[label].add(x, y);
				float v = frame.getValue(x, y);
				if (Float.isFinite(v))
					fluxes[label] += v - median;
				if (!discard[label])
					discard[label] = overlapsKnownObject(x, y, galaxySegments, starSegments, masks);
			}
		}
		
		var regions = new RegionList();
		var rows = new ArrayList<DetectionRow>();
		var ellipses = new ArrayList<EllipseRegion>();
		int[] newLabels = new int[nLabels + 1];
		for (int label = 1; label <= nLabels; label++) {
			if (discard[label] || moments[label] == null)
				continue;
			int index = rows.size();
			newLabels[label] = index + 1;
			var ellipse = moments[label].toEllipse(1.0, MIN_AXIS, "yellow", "other " + index);
			rows.add(new DetectionRow(index, null, true, false, Double.NaN, fluxes[label], false, 
					ellipse.getCenter().getX(), ellipse.getCenter().getY()));
			regions.add(ellipse);
			ellipses.add(ellipse);
		}
		
		var segments = SegmentationMap.createEmpty(w, h);
		for (int i = 0; i < labelArray.length; i++) {
			int label = newLabels[labelArray[i]];
			if (label > 0)
				segments.set(i % w, i / w, label);
		}
		
		var failures = new ArrayList<Failure>();
		if (config.isRemove()) {
			for (int index = 0; index < ellipses.size(); index++) {
				var ellipse = ellipses.get(index);
				try {
					var source = Source.fromEllipse(frame, ellipse.getCenter(), ellipse.getSemiMajor(), ellipse.getSemiMinor(), ellipse.getAngle(), 
							Source.DEFAULT_INNER_FACTOR, config.getOuterFactor());
					source.estimateBackground(BackgroundMethod.POLYNOMIAL, true, config.getClipSigma());
					source.replaceWithBackground(frame);
				} catch (RuntimeException e) {
					logger.error("Unable to remove other source {} from {}: {}", index, frame.getName(), e.getMessage(), e);
					failures.add(Failure.of(index, "removal", e));
				}
			}
		}
		logger.info("Found {} other sources in {} (threshold {})", rows.size(), frame.getName(), threshold);
		return new ExtractionResult(frame.getName(), rows, regions, new RegionList(), segments, frame, fwhm, failures);
	}
	
	/**
	 * Segments touching the principal galaxy, its companions, a known star or an ignored pixel are discarded.
	 */
	private static boolean overlapsKnownObject(int x, int y, SegmentationMap galaxySegments, SegmentationMap starSegments, ObjectMasks masks) {
		if (galaxySegments != null) {
			int g = galaxySegments.get(x, y);
			if (g == Galaxy.PRINCIPAL_LABEL || g == Galaxy.COMPANION_LABEL)
				return true;
		}
		if (starSegments != null && starSegments.get(x, y) != 0)
			return true;
		return masks.isIgnored(new Point2(x, y));
	}
	
	private static ExtractionResult empty(Frame frame) {
		return new ExtractionResult(frame.getName(), new ArrayList<>(), new RegionList(), new RegionList(), 
				SegmentationMap.createEmpty(frame.getWidth(), frame.getHeight()), frame, Double.NaN, new ArrayList<>());
	}

}
