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
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import skyfind.lib.catalog.FileCatalogSource;
import skyfind.lib.io.FitsIO;
import skyfind.lib.io.GsonTools;
import skyfind.lib.io.RegionIO;
import skyfind.lib.io.TableIO;

/**
 * Write the results of a {@link SourceFinder} run to a directory.
 * <p>
 * The layout is:
 * <ul>
 * <li>{@code galaxies.json}, {@code stars.json}: catalogs in the format read by {@link FileCatalogSource}</li>
 * <li>{@code galaxies.tsv}, {@code stars.tsv}: cross-band tables</li>
 * <li>{@code regions/<frame>_<stage>.reg}: DS9 region files</li>
 * <li>{@code segments/<frame>_<stage>.fits}: segmentation maps</li>
 * <li>{@code frames/<frame>.fits}: frames after removal</li>
 * <li>{@code diagnostics.json}</li>
 * </ul>
 * 
 * @author SkyFind developers
 */
public class SourceFinderWriter {
	
	private static final Logger logger = LoggerFactory.getLogger(SourceFinderWriter.class);
	
	private final Path directory;
	
	/**
	 * Create a writer for an output directory, which is created if necessary.
	 * @param directory
	 */
	public SourceFinderWriter(Path directory) {
		this.directory = directory;
	}
	
	/**
	 * Write all results.
	 * @param result
	 * @throws IOException
	 */
	public void write(SourceFinderResult result) throws IOException {
		Files.createDirectories(directory);
		if (result.getGalaxyCatalog() != null)
			FileCatalogSource.write(result.getGalaxyCatalog(), directory.resolve("galaxies.json"));
		if (result.getStarCatalog() != null)
			FileCatalogSource.write(result.getStarCatalog(), directory.resolve("stars.json"));
		if (result.getGalaxyTable() != null)
			writeTable(result.getGalaxyTable(), directory.resolve("galaxies.tsv"));
		if (result.getStarTable() != null)
			writeTable(result.getStarTable(), directory.resolve("stars.tsv"));
		
		writeStage(SourceFinder.STAGE_GALAXIES, result.getGalaxyResults());
		writeStage(SourceFinder.STAGE_STARS, result.getStarResults());
		writeStage(SourceFinder.STAGE_OTHER, result.getOtherResults());
		
		var frameDir = Files.createDirectories(directory.resolve("frames"));
		for (var entry : result.getFrames().entrySet())
			FitsIO.writeFrame(entry.getValue(), frameDir.resolve(entry.getKey() + ".fits").toFile());
		
		GsonTools.writeJson(directory.resolve("diagnostics.json"), result.getDiagnostics().getEntries());
		logger.info("Results written to {}", directory);
	}
	
	/**
	 * Write a cross-band table as tab-separated values.
	 * @param table
	 * @param path
	 * @throws IOException
	 */
	public static void writeTable(CrossBandTable table, Path path) throws IOException {
		TableIO.writeTable(path, table.getHeader(), table.toTableRows());
	}
	
	/**
	 * Write a per-frame table as tab-separated values.
	 * @param result
	 * @param path
	 * @throws IOException
	 */
	public static void writeTable(ExtractionResult result, Path path) throws IOException {
		var header = List.of("index", "id", "detected", "modeled", "fwhm", "flux", "saturation", "x", "y");
		var rows = result.getRows().stream()
				.map(r -> List.<Object>of(r.index(), r.id() == null ? "" : r.id(), r.detected(), r.modeled(), r.fwhm(), r.flux(), 
						r.saturation(), r.x(), r.y()))
				.toList();
		TableIO.writeTable(path, header, rows);
	}
	
	private void writeStage(String stage, Map<String, ExtractionResult> results) throws IOException {
		if (results.isEmpty())
			return;
		var regionDir = Files.createDirectories(directory.resolve("regions"));
		var segmentDir = Files.createDirectories(directory.resolve("segments"));
		var tableDir = Files.createDirectories(directory.resolve("tables"));
		for (var entry : results.entrySet()) {
			String base = entry.getKey() + "_" + stage;
			var result = entry.getValue();
			RegionIO.writeDS9(result.getRegions(), regionDir.resolve(base + ".reg"));
			if (!result.getSaturationRegions().isEmpty())
				RegionIO.writeDS9(result.getSaturationRegions(), regionDir.resolve(base + "_saturation.reg"));
			FitsIO.writeSegmentationMap(result.getSegments(), result.getFrame().getCoordinateSystem(), 
					segmentDir.resolve(base + ".fits").toFile());
			writeTable(result, tableDir.resolve(base + ".tsv"));
		}
	}

}
