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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import skyfind.lib.images.Frame;
import skyfind.lib.images.SegmentationMap;
import skyfind.lib.objects.ObjectCatalog;
import skyfind.lib.regions.PointRegion;
import skyfind.lib.regions.RegionList;
import skyfind.lib.sources.Galaxy;
import skyfind.lib.sources.Source;

/**
 * Find the galaxies of a catalog in one frame.
 * <p>
 * Failures for individual galaxies are logged and recorded, and do not stop the others from being processed.
 * 
 * @author SkyFind developers
 */
public class ExtendedSourceFinder {
	
	private static final Logger logger = LoggerFactory.getLogger(ExtendedSourceFinder.class);
	
	private final GalaxyConfig config;
	
	/**
	 * Create a finder with the given settings.
	 * @param config
	 */
	public ExtendedSourceFinder(GalaxyConfig config) {
		this.config = config;
	}
	
	/**
	 * Find galaxies in a frame. The frame is modified if galaxies are removed.
	 * 
	 * @param frame
	 * @param catalog galaxy catalog
	 * @param masks
	 * @return
	 */
	public ExtractionResult find(Frame frame, ObjectCatalog catalog, ObjectMasks masks) {
		var detection = config.getDetection();
		var failures = new ArrayList<Failure>();
		var galaxies = new ArrayList<Galaxy>();
		var rows = new ArrayList<DetectionRow>();
		
		for (var object : catalog.getObjects()) {
			var pixel = frame.toPixel(object.getPosition());
			if (!frame.contains(pixel) || masks.isBad(pixel)) {
				logger.debug("Galaxy {} is outside the usable part of {}", object.getGalaxy().getName(), frame.getName());
				continue;
			}
			var galaxy = new Galaxy(object, pixel, frame.getPixelScale());
			galaxy.setIgnored(masks.isIgnored(pixel));
			galaxy.setSpecial(masks.isSpecial(pixel));
			galaxies.add(galaxy);
		}
		
		var detected = new ArrayList<Galaxy>();
		for (var galaxy : galaxies) {
			if (galaxy.isIgnored())
				continue;
			try {
				Source source;
				if (config.isUseD25() && galaxy.hasExtent()) {
					source = galaxy.sourceFromParameters(frame, detection.getOuterFactor(), config.getD25ExpansionFactor());
					estimate(source);
					galaxy.setSource(source);
				} else
					source = galaxy.findSource(frame, detection);
				if (source != null)
					detected.add(galaxy);
				if (galaxy.isSpecial())
					logger.info("Special galaxy {} in {}: {}", galaxy.getName(), frame.getName(), source == null ? "not found" : source);
			} catch (RuntimeException e) {
				logger.error("Unable to detect galaxy {} in {}: {}", galaxy.getName(), frame.getName(), e.getMessage(), e);
				failures.add(Failure.of(galaxy.getIndex(), "detection", e));
			}
		}
		
		// Principal galaxy and companions always get a source if the catalog gives their extent
		for (var galaxy : galaxies) {
			if (galaxy.hasSource() || galaxy.isIgnored() || !galaxy.hasExtent() || !(galaxy.isPrincipal() || galaxy.isCompanion()))
				continue;
			try {
				var source = galaxy.sourceFromParameters(frame, detection.getOuterFactor(), config.getD25ExpansionFactor());
				estimate(source);
				galaxy.setSource(source);
				logger.debug("Using catalog ellipse for {} in {}", galaxy.getName(), frame.getName());
			} catch (RuntimeException e) {
				logger.error("Unable to create source for {} in {}: {}", galaxy.getName(), frame.getName(), e.getMessage(), e);
				failures.add(Failure.of(galaxy.getIndex(), "forced source", e));
			}
		}
		
		var regions = new RegionList();
		for (var galaxy : galaxies) {
			String color = galaxy.hasExtent() ? "green" : "red";
			regions.add(new PointRegion(galaxy.getPixelPosition(), color, null));
			regions.add(galaxy.toEllipse(detection.getInitialRadius()));
		}
		
		var segments = SegmentationMap.createEmpty(frame.getWidth(), frame.getHeight());
		galaxies.stream()
			.filter(Galaxy::hasSource)
			.sorted(Comparator.comparingInt(Galaxy::getSegmentLabel).reversed())
			.forEach(g -> {
				var source = g.getSource();
				segments.paint(source.getRemovalMask(), source.getCutout().getX0(), source.getCutout().getY0(), g.getSegmentLabel());
			});
		
		// Fluxes are measured before any galaxy is removed
		var byIndex = new HashMap<Integer, Galaxy>();
		for (var galaxy : galaxies)
			byIndex.put(galaxy.getIndex(), galaxy);
		for (var object : catalog.getObjects()) {
			var galaxy = byIndex.get(object.getIndex());
			var pixel = frame.toPixel(object.getPosition());
			if (galaxy == null || !galaxy.hasSource()) {
				rows.add(DetectionRow.undetected(object.getIndex(), object.getId(), pixel.getX(), pixel.getY()));
				continue;
			}
			rows.add(new DetectionRow(object.getIndex(), object.getId(), detected.contains(galaxy), false, Double.NaN, 
					galaxy.getFlux(), false, pixel.getX(), pixel.getY()));
		}
		
		if (config.isRemoveGalaxies()) {
			for (var galaxy : galaxies) {
				if (galaxy.isPrincipal() || !galaxy.hasSource())
					continue;
				try {
					galaxy.remove(frame);
				} catch (RuntimeException e) {
					logger.error("Unable to remove galaxy {} from {}: {}", galaxy.getName(), frame.getName(), e.getMessage(), e);
					failures.add(Failure.of(galaxy.getIndex(), "removal", e));
				}
			}
		}
		
		logger.info("Found {} of {} galaxies in {}", detected.size(), catalog.size(), frame.getName());
		return new ExtractionResult(frame.getName(), rows, regions, new RegionList(), segments, frame, Double.NaN, failures);
	}
	
	private void estimate(Source source) {
		var detection = config.getDetection();
		source.estimateBackground(detection.getBackgroundMethod(), detection.isSigmaClip(), detection.getClipSigma());
		source.subtractBackground();
	}

}
