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
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import skyfind.lib.common.LogTools;
import skyfind.lib.geom.Point2;
import skyfind.lib.images.Frame;
import skyfind.lib.images.SegmentationMap;
import skyfind.lib.objects.ObjectCatalog;
import skyfind.lib.regions.CircleRegion;
import skyfind.lib.regions.RegionList;
import skyfind.lib.sources.FluxCutoff;
import skyfind.lib.sources.Galaxy;
import skyfind.lib.sources.SaturationMethod;
import skyfind.lib.sources.Source;
import skyfind.lib.sources.Star;

/**
 * Find, fit and remove the stars of a catalog in one frame.
 * <p>
 * Stars are processed in stages (detection, fitting, removal, saturation), and a failure for one 
 * star in any stage is logged and recorded without affecting the others.
 * 
 * @author SkyFind developers
 */
public class PointSourceFinder {
	
	private static final Logger logger = LoggerFactory.getLogger(PointSourceFinder.class);
	
	private final StarConfig config;
	
	/**
	 * Create a finder with the given settings.
	 * @param config
	 */
	public PointSourceFinder(StarConfig config) {
		this.config = config;
	}
	
	/**
	 * Find stars in a frame. The frame is modified if stars or saturation are removed.
	 * 
	 * @param frame
	 * @param catalog star catalog
	 * @param masks
	 * @param galaxySegments galaxy segmentation map of the same frame, or null
	 * @param principalPosition pixel position of the principal galaxy, or null
	 * @return
	 */
	public ExtractionResult find(Frame frame, ObjectCatalog catalog, ObjectMasks masks, SegmentationMap galaxySegments, Point2 principalPosition) {
		var detection = config.getDetection();
		var failures = new ArrayList<Failure>();
		var stars = new ArrayList<Star>();
		
		double defaultFwhm = frame.getPsfFwhmPixels();
		if (!Double.isFinite(defaultFwhm)) {
			LogTools.warnOnce(logger, "Filter PSF unknown, using default FWHM of {} pixels", config.getDefaultFwhm());
			defaultFwhm = config.getDefaultFwhm();
		}
		double radius = Math.max(detection.getInitialRadius(), 2 * defaultFwhm);
		
		for (var object : catalog.getObjects()) {
			var pixel = frame.toPixel(object.getPosition());
			if (!frame.contains(pixel) || masks.isBad(pixel))
				continue;
			var star = new Star(object, pixel);
			star.setIgnored(masks.isIgnored(pixel) || tooCloseToGalaxy(pixel, principalPosition, frame.getPixelScale()));
			star.setSpecial(masks.isSpecial(pixel));
			stars.add(star);
		}
		
		int nDetected = 0;
		for (var star : stars) {
			if (star.isIgnored())
				continue;
			try {
				if (star.findSource(frame, detection, radius) != null)
					nDetected++;
			} catch (RuntimeException e) {
				logger.error("Unable to detect star {} in {}: {}", star.getIndex(), frame.getName(), e.getMessage(), e);
				failures.add(Failure.of(star.getIndex(), "detection", e));
			}
		}
		logger.debug("Detected {} of {} stars in {}", nDetected, stars.size(), frame.getName());
		
		var fitting = config.getFitting();
		for (var star : stars) {
			if (star.isIgnored() || (!star.hasSource() && !fitting.isFitIfUndetected()))
				continue;
			try {
				Source source = star.getSource();
				if (source == null) {
					source = Source.fromCircle(frame, star.getPixelPosition(), radius, detection.getInnerFactor(), detection.getOuterFactor());
					source.estimateBackground(detection.getBackgroundMethod(), detection.isSigmaClip(), detection.getClipSigma());
					source.subtractBackground();
				}
				star.fitModel(fitting, source, defaultFwhm);
			} catch (RuntimeException e) {
				logger.error("Unable to fit star {} in {}: {}", star.getIndex(), frame.getName(), e.getMessage(), e);
				failures.add(Failure.of(star.getIndex(), "fitting", e));
			}
		}
		
		var fwhms = stars.stream().filter(Star::hasModel).map(Star::getFwhm).toList();
		double fwhm = config.getFwhmMeasure().combine(fwhms);
		if (Double.isNaN(fwhm)) {
			logger.debug("No fitted stars in {}, using FWHM of {} pixels", frame.getName(), defaultFwhm);
			fwhm = defaultFwhm;
		} else
			logger.info("FWHM of {} is {} pixels ({} fitted stars)", frame.getName(), String.format(Locale.ROOT, "%.2f", fwhm), fwhms.size());
		
		// Fluxes are measured before anything is removed
		Map<Integer, Double> fluxes = new HashMap<>();
		for (var star : stars)
			fluxes.put(star.getIndex(), star.getFlux());
		
		Map<Integer, Source> removed = new HashMap<>();
		var removal = config.getRemoval();
		if (removal.isRemove()) {
			for (var star : stars) {
				if (star.isIgnored())
					continue;
				if (!removal.isRemoveForeground() && isOnPrincipalGalaxy(star, galaxySegments))
					continue;
				try {
					var source = star.remove(frame, removal, fwhm, detection.getBackgroundMethod(), detection.isSigmaClip(), detection.getClipSigma());
					if (source != null)
						removed.put(star.getIndex(), source);
				} catch (RuntimeException e) {
					logger.error("Unable to remove star {} from {}: {}", star.getIndex(), frame.getName(), e.getMessage(), e);
					failures.add(Failure.of(star.getIndex(), "removal", e));
				}
			}
		}
		
		var saturationRegions = new RegionList();
		var saturation = config.getSaturation();
		if (saturation.isRemove()) {
			for (var star : selectForSaturation(stars, fluxes)) {
				if (!saturation.isRemoveForeground() && isOnPrincipalGalaxy(star, galaxySegments))
					continue;
				try {
					if (!star.removeSaturation(frame, saturation, detection, fwhm))
						continue;
					removed.put(star.getIndex(), star.getSource());
					var outline = star.findAperture(1.0);
					if (outline != null)
						saturationRegions.add(outline);
					if (saturation.isApertureRemoval()) {
						var aperture = star.findAperture(saturation.getApertureFactor());
						if (aperture != null)
							star.removeAperture(frame, aperture, removal.getOuterFactor(), detection.getBackgroundMethod(), 
									detection.isSigmaClip(), detection.getClipSigma());
					}
				} catch (RuntimeException e) {
					logger.error("Unable to remove saturation for star {} from {}: {}", star.getIndex(), frame.getName(), e.getMessage(), e);
					failures.add(Failure.of(star.getIndex(), "saturation", e));
				}
			}
		}
		
		var regions = new RegionList();
		var segments = SegmentationMap.createEmpty(frame.getWidth(), frame.getHeight());
		Map<Integer, Star> byIndex = new HashMap<>();
		for (var star : stars) {
			byIndex.put(star.getIndex(), star);
			if (star.isIgnored())
				continue;
			double r = star.hasModel() ? star.getFwhm() : fwhm;
			regions.add(new CircleRegion(star.getBestPosition(), r, regionColor(star), regionText(star, fluxes.get(star.getIndex()))));
			var source = removed.containsKey(star.getIndex()) ? removed.get(star.getIndex()) : star.getSource();
			if (source != null)
				segments.paint(source.getRemovalMask(), source.getCutout().getX0(), source.getCutout().getY0(), star.getSegmentLabel());
		}
		
		var rows = new ArrayList<DetectionRow>();
		for (var object : catalog.getObjects()) {
			var star = byIndex.get(object.getIndex());
			if (star == null || star.isIgnored()) {
				var pixel = frame.toPixel(object.getPosition());
				rows.add(DetectionRow.undetected(object.getIndex(), object.getId(), pixel.getX(), pixel.getY()));
				continue;
			}
			var position = star.getBestPosition();
			rows.add(new DetectionRow(object.getIndex(), object.getId(), star.hasSource(), star.hasModel(), star.getFwhm(), 
					fluxes.get(star.getIndex()), star.hasSaturation(), position.getX(), position.getY()));
		}
		
		logger.info("Found {} of {} stars in {} ({} removed, {} saturated)", nDetected, catalog.size(), frame.getName(), 
				removed.size(), saturationRegions.size());
		return new ExtractionResult(frame.getName(), rows, regions, saturationRegions, segments, frame, fwhm, failures);
	}
	
	private boolean tooCloseToGalaxy(Point2 pixel, Point2 principalPosition, double pixelScale) {
		double minDistance = config.getMinDistanceFromGalaxy();
		if (principalPosition == null || !(minDistance > 0))
			return false;
		return pixel.distance(principalPosition) * pixelScale < minDistance;
	}
	
	private static boolean isOnPrincipalGalaxy(Star star, SegmentationMap galaxySegments) {
		if (galaxySegments == null)
			return false;
		var p = star.getBestPosition();
		return galaxySegments.get(p.getPixelX(), p.getPixelY()) == Galaxy.PRINCIPAL_LABEL;
	}
	
	/**
	 * Select stars to check for saturation.
	 * <p>
	 * Detected stars are selected by flux, brightest first. Stars without a source follow 
	 * if saturation should also be removed for undetected stars.
	 * 
	 * @param stars
	 * @param fluxes fluxes measured before removal
	 * @return
	 */
	List<Star> selectForSaturation(List<Star> stars, Map<Integer, Double> fluxes) {
		var saturation = config.getSaturation();
		var selected = new ArrayList<>(selectDetectedForSaturation(stars, fluxes));
		if (saturation.isRemoveIfUndetected()) {
			stars.stream()
				.filter(s -> !s.isIgnored() && !s.hasSource())
				.forEach(selected::add);
		}
		return selected;
	}
	
	private List<Star> selectDetectedForSaturation(List<Star> stars, Map<Integer, Double> fluxes) {
		var candidates = stars.stream()
				.filter(s -> !s.isIgnored() && s.hasSource() && Double.isFinite(fluxes.get(s.getIndex())))
				.sorted(Comparator.comparingDouble((Star s) -> fluxes.get(s.getIndex())).reversed())
				.toList();
		var saturation = config.getSaturation();
		if (saturation.getMethod() == SaturationMethod.ALL || candidates.isEmpty())
			return candidates;
		if (saturation.getCutoff() == FluxCutoff.PERCENTAGE) {
			int n = (int)Math.ceil(candidates.size() * saturation.getCutoffValue() / 100.0);
			return candidates.subList(0, Math.min(n, candidates.size()));
		}
		var stats = new DescriptiveStatistics();
		for (var star : candidates)
			stats.addValue(fluxes.get(star.getIndex()));
		double threshold = stats.getMean() + saturation.getCutoffValue() * stats.getStandardDeviation();
		return candidates.stream().filter(s -> fluxes.get(s.getIndex()) > threshold).toList();
	}
	
	private static String regionColor(Star star) {
		if (star.hasModel())
			return "blue";
		if (star.hasSource())
			return "green";
		return "red";
	}
	
	private String regionText(Star star, double flux) {
		switch (config.getAnnotation()) {
		case FLUX:
			return Double.isFinite(flux) ? String.format(Locale.ROOT, "%.3g", flux) : null;
		case HAS_SOURCE:
			return star.hasSource() ? "source" : "no source";
		case HAS_BACKGROUND:
			return star.hasSource() && star.getSource().getEstimatedBackground() != null ? "background" : "no background";
		case NONE:
		default:
			return null;
		}
	}

}
