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

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import skyfind.lib.catalog.CatalogSource;
import skyfind.lib.geom.Point2;
import skyfind.lib.geom.SkyBoundingBox;
import skyfind.lib.images.Frame;
import skyfind.lib.images.SegmentationMap;
import skyfind.lib.objects.ObjectCatalog;

/**
 * Find galaxies, stars and uncataloged sources in a set of frames of the same field, 
 * one frame per band.
 * <p>
 * Each stage processes all frames in parallel on its own thread pool. Every task gets a copy of its 
 * frame; when a task completes, its processed frame replaces the original so that later stages 
 * see the result of earlier removals. Frames whose task failed keep their previous pixels and 
 * are reported in the {@link Diagnostics}.
 * 
 * @author SkyFind developers
 */
public class SourceFinder {
	
	private static final Logger logger = LoggerFactory.getLogger(SourceFinder.class);
	
	/**
	 * Name of the galaxy stage.
	 */
	public static final String STAGE_GALAXIES = "galaxies";
	
	/**
	 * Name of the star stage.
	 */
	public static final String STAGE_STARS = "stars";
	
	/**
	 * Name of the stage finding uncataloged sources.
	 */
	public static final String STAGE_OTHER = "other";
	
	private final Map<String, Frame> frames = new LinkedHashMap<>();
	private final Map<String, ObjectMasks> masks = new HashMap<>();
	private final CatalogSource catalogSource;
	private final SourceFinderConfig config;
	private final StageExecutor executor;
	private final Diagnostics diagnostics = new Diagnostics();
	
	private ObjectCatalog galaxyCatalog;
	private ObjectCatalog starCatalog;
	private CrossBandTable galaxyTable;
	private CrossBandTable starTable;
	private List<Integer> rejectedStars = new ArrayList<>();
	
	private final Map<String, ExtractionResult> galaxyResults = new LinkedHashMap<>();
	private final Map<String, ExtractionResult> starResults = new LinkedHashMap<>();
	private final Map<String, ExtractionResult> otherResults = new LinkedHashMap<>();
	
	/**
	 * Create a source finder.
	 * 
	 * @param frames frames keyed by band name
	 * @param catalogSource source of the galaxy and star catalogs
	 * @param config settings; these are validated immediately
	 * @throws IllegalArgumentException if the settings are invalid
	 */
	public SourceFinder(Map<String, Frame> frames, CatalogSource catalogSource, SourceFinderConfig config) {
		Objects.requireNonNull(frames, "Frames must not be null");
		Objects.requireNonNull(config, "Config must not be null");
		config.validate();
		this.frames.putAll(frames);
		this.catalogSource = catalogSource;
		this.config = config;
		this.executor = new StageExecutor(config.getProcesses());
	}
	
	/**
	 * Set the special, ignore and bad masks for one frame.
	 * @param frameName
	 * @param frameMasks
	 */
	public void setMasks(String frameName, ObjectMasks frameMasks) {
		if (!frames.containsKey(frameName))
			throw new IllegalArgumentException("Unknown frame " + frameName);
		masks.put(frameName, frameMasks);
	}
	
	/**
	 * Use a galaxy catalog instead of requesting one from the catalog source.
	 * @param catalog
	 */
	public void setGalaxyCatalog(ObjectCatalog catalog) {
		this.galaxyCatalog = catalog;
	}
	
	/**
	 * Use a star catalog instead of requesting one from the catalog source.
	 * @param catalog
	 */
	public void setStarCatalog(ObjectCatalog catalog) {
		this.starCatalog = catalog;
	}
	
	/**
	 * Get the region of the sky covered by all frames.
	 * @return
	 */
	public SkyBoundingBox getBoundingBox() {
		SkyBoundingBox box = null;
		for (var frame : frames.values()) {
			var frameBox = frame.getCoordinateSystem().getBoundingBox();
			box = box == null ? frameBox : box.union(frameBox);
		}
		return box;
	}
	
	/**
	 * Find the galaxies of the extended-source catalog in every frame.
	 * @return the merged table, with one row per catalog galaxy
	 * @throws IOException if the catalog cannot be obtained
	 */
	public CrossBandTable findGalaxies() throws IOException {
		if (galaxyCatalog == null)
			galaxyCatalog = getCatalogSource().getExtendedSourceCatalog(getBoundingBox());
		logger.info("Finding {} galaxies in {} frames", galaxyCatalog.size(), frames.size());
		
		var tasks = new LinkedHashMap<String, FrameTasks.GalaxyTask>();
		for (var entry : frames.entrySet()) {
			tasks.put(entry.getKey(), new FrameTasks.GalaxyTask(entry.getValue().copy(), galaxyCatalog, 
					getMasks(entry.getKey()), config.getGalaxies()));
		}
		collect(STAGE_GALAXIES, executor.run(STAGE_GALAXIES, tasks), galaxyResults);
		galaxyTable = CrossBandTable.merge(galaxyCatalog, inFrameOrder(galaxyResults));
		return galaxyTable;
	}
	
	/**
	 * Find the stars of the point-source catalog in every frame up to the wavelength cutoff.
	 * <p>
	 * Detected stars whose colours fall outside any configured colour window are dropped from the table.
	 * 
	 * @return the merged table
	 * @throws IOException if the catalog cannot be obtained
	 */
	public CrossBandTable findStars() throws IOException {
		if (starCatalog == null) {
			double minPixelScale = frames.values().stream().mapToDouble(Frame::getPixelScale).min().orElse(Double.NaN);
			starCatalog = getCatalogSource().getPointSourceCatalog(getBoundingBox(), minPixelScale, config.getPointCatalogs());
		}
		logger.info("Finding {} stars in {} frames", starCatalog.size(), frames.size());
		
		var principal = galaxyCatalog == null ? null : galaxyCatalog.getPrincipal().orElse(null);
		var tasks = new LinkedHashMap<String, FrameTasks.StarTask>();
		for (var entry : frames.entrySet()) {
			var frame = entry.getValue();
			if (frame.getWavelength() > config.getStarWavelengthCutoff()) {
				logger.info("Skipping stars for {} (wavelength {} > {} micron)", entry.getKey(), frame.getWavelength(), config.getStarWavelengthCutoff());
				continue;
			}
			var galaxyResult = galaxyResults.get(entry.getKey());
			SegmentationMap galaxySegments = galaxyResult == null ? null : galaxyResult.getSegments();
			Point2 principalPosition = principal == null ? null : frame.toPixel(principal.getPosition());
			tasks.put(entry.getKey(), new FrameTasks.StarTask(frame.copy(), starCatalog, getMasks(entry.getKey()), 
					galaxySegments, principalPosition, config.getStars()));
		}
		collect(STAGE_STARS, executor.run(STAGE_STARS, tasks), starResults);
		
		var merged = CrossBandTable.merge(starCatalog, inFrameOrder(starResults));
		var rejected = new ArrayList<Integer>();
		starTable = merged.filter(row -> {
			if (passesColourWindows(row))
				return true;
			rejected.add(row.index());
			return false;
		});
		rejectedStars = rejected;
		if (!rejected.isEmpty())
			logger.info("Rejected {} stars outside colour windows", rejected.size());
		return starTable;
	}
	
	/**
	 * Find uncataloged sources in every frame, excluding known galaxies and stars.
	 * @return results keyed by frame name
	 */
	public Map<String, ExtractionResult> findOtherSources() {
		if (!config.getOtherSources().isFind()) {
			logger.info("Search for other sources is disabled");
			return otherResults;
		}
		var tasks = new LinkedHashMap<String, FrameTasks.OtherSourceTask>();
		for (var entry : frames.entrySet()) {
			String name = entry.getKey();
			var galaxyResult = galaxyResults.get(name);
			var starResult = starResults.get(name);
			tasks.put(name, new FrameTasks.OtherSourceTask(entry.getValue().copy(), 
					galaxyResult == null ? null : galaxyResult.getSegments(),
					starResult == null ? null : starResult.getSegments(),
					getFwhm(name), getMasks(name), config.getOtherSources()));
		}
		collect(STAGE_OTHER, executor.run(STAGE_OTHER, tasks), otherResults);
		return otherResults;
	}
	
	/**
	 * Run all stages.
	 * <p>
	 * If a catalog cannot be obtained, the corresponding stage is recorded as failed and the 
	 * remaining stages still run.
	 * 
	 * @return
	 */
	public SourceFinderResult run() {
		try {
			findGalaxies();
		} catch (IOException e) {
			logger.error("Unable to find galaxies: {}", e.getMessage(), e);
			diagnostics.addStageFailure(STAGE_GALAXIES, e.getMessage());
		}
		try {
			findStars();
		} catch (IOException e) {
			logger.error("Unable to find stars: {}", e.getMessage(), e);
			diagnostics.addStageFailure(STAGE_STARS, e.getMessage());
		}
		findOtherSources();
		return getResult();
	}
	
	/**
	 * Get the results of all stages run so far.
	 * @return
	 */
	public SourceFinderResult getResult() {
		return new SourceFinderResult(galaxyCatalog, starCatalog, galaxyTable, starTable, rejectedStars, 
				inFrameOrder(galaxyResults), inFrameOrder(starResults), inFrameOrder(otherResults), frames, diagnostics);
	}
	
	public Diagnostics getDiagnostics() {
		return diagnostics;
	}
	
	/**
	 * Get the current pixels of a frame, including all removals so far.
	 * @param name
	 * @return
	 */
	public Frame getFrame(String name) {
		return frames.get(name);
	}
	
	/**
	 * FWHM for a frame: from the star stage if available, otherwise from the filter PSF, otherwise the default.
	 * @param name
	 * @return FWHM in pixels
	 */
	double getFwhm(String name) {
		var starResult = starResults.get(name);
		if (starResult != null && Double.isFinite(starResult.getFwhm()) && starResult.getFwhm() > 0)
			return starResult.getFwhm();
		double fwhm = frames.get(name).getPsfFwhmPixels();
		if (Double.isFinite(fwhm) && fwhm > 0)
			return fwhm;
		return config.getStars().getDefaultFwhm();
	}
	
	private CatalogSource getCatalogSource() throws IOException {
		if (catalogSource == null)
			throw new IOException("No catalog source available");
		return catalogSource;
	}
	
	private ObjectMasks getMasks(String frameName) {
		return masks.getOrDefault(frameName, ObjectMasks.none());
	}
	
	private boolean passesColourWindows(CrossBandTable.Row row) {
		for (var window : config.getColourWindows()) {
			if (!window.accepts(row.getFlux(window.getBandA()), row.getFlux(window.getBandB())))
				return false;
		}
		return true;
	}
	
	private void collect(String stage, Map<String, FrameTaskResult> taskResults, Map<String, ExtractionResult> stageResults) {
		stageResults.clear();
		int nFailed = 0;
		for (var taskResult : taskResults.values()) {
			String name = taskResult.getFrameName();
			if (!taskResult.isCompleted()) {
				diagnostics.addFrameFailure(stage, name, taskResult.getError());
				nFailed++;
				continue;
			}
			var result = taskResult.getResult();
			stageResults.put(name, result);
			frames.put(name, result.getFrame());
			for (var failure : result.getFailures())
				diagnostics.addObjectFailure(stage, name, failure);
		}
		if (nFailed > 0)
			logger.warn("{} of {} frames failed for {}", nFailed, taskResults.size(), stage);
		else
			logger.info("Completed {} for {} frames", stage, taskResults.size());
	}
	
	private Map<String, ExtractionResult> inFrameOrder(Map<String, ExtractionResult> results) {
		var ordered = new LinkedHashMap<String, ExtractionResult>();
		for (var name : frames.keySet()) {
			var result = results.get(name);
			if (result != null)
				ordered.put(name, result);
		}
		return ordered;
	}

}
