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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import skyfind.lib.images.Frame;
import skyfind.lib.objects.ObjectCatalog;

/**
 * Everything produced by a {@link SourceFinder} run.
 * <p>
 * Catalogs and tables are null for stages that could not be run; the reason is then given by the diagnostics.
 * 
 * @author SkyFind developers
 */
public class SourceFinderResult {
	
	private final ObjectCatalog galaxyCatalog;
	private final ObjectCatalog starCatalog;
	private final CrossBandTable galaxyTable;
	private final CrossBandTable starTable;
	private final List<Integer> rejectedStars;
	private final Map<String, ExtractionResult> galaxyResults;
	private final Map<String, ExtractionResult> starResults;
	private final Map<String, ExtractionResult> otherResults;
	private final Map<String, Frame> frames;
	private final Diagnostics diagnostics;
	
	SourceFinderResult(ObjectCatalog galaxyCatalog, ObjectCatalog starCatalog, CrossBandTable galaxyTable, CrossBandTable starTable,
			List<Integer> rejectedStars, Map<String, ExtractionResult> galaxyResults, Map<String, ExtractionResult> starResults,
			Map<String, ExtractionResult> otherResults, Map<String, Frame> frames, Diagnostics diagnostics) {
		this.galaxyCatalog = galaxyCatalog;
		this.starCatalog = starCatalog;
		this.galaxyTable = galaxyTable;
		this.starTable = starTable;
		this.rejectedStars = List.copyOf(rejectedStars);
		this.galaxyResults = Collections.unmodifiableMap(new LinkedHashMap<>(galaxyResults));
		this.starResults = Collections.unmodifiableMap(new LinkedHashMap<>(starResults));
		this.otherResults = Collections.unmodifiableMap(new LinkedHashMap<>(otherResults));
		this.frames = Collections.unmodifiableMap(new LinkedHashMap<>(frames));
		this.diagnostics = diagnostics;
	}

	public ObjectCatalog getGalaxyCatalog() {
		return galaxyCatalog;
	}

	public ObjectCatalog getStarCatalog() {
		return starCatalog;
	}

	/**
	 * Merged galaxy table, or null if galaxies could not be found.
	 * @return
	 */
	public CrossBandTable getGalaxyTable() {
		return galaxyTable;
	}

	/**
	 * Merged star table without rejected stars, or null if stars could not be found.
	 * @return
	 */
	public CrossBandTable getStarTable() {
		return starTable;
	}

	/**
	 * Catalog indices of detected stars whose colours fell outside a colour window.
	 * @return
	 */
	public List<Integer> getRejectedStars() {
		return rejectedStars;
	}

	public Map<String, ExtractionResult> getGalaxyResults() {
		return galaxyResults;
	}

	public Map<String, ExtractionResult> getStarResults() {
		return starResults;
	}

	public Map<String, ExtractionResult> getOtherResults() {
		return otherResults;
	}

	/**
	 * Frames after all removal steps.
	 * @return
	 */
	public Map<String, Frame> getFrames() {
		return frames;
	}

	public Diagnostics getDiagnostics() {
		return diagnostics;
	}

}
