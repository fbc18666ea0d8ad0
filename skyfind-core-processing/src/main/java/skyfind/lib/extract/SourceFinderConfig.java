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
import java.io.InputStreamReader;
import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonParseException;

import skyfind.lib.io.GsonTools;

/**
 * Settings for a {@link SourceFinder}.
 * <p>
 * Read from JSON using {@link GsonTools}; fields missing from the JSON keep the values of 
 * {@code default-config.json}. Call {@link #validate()} before use, since unknown enum values 
 * are read as null.
 * 
 * @author SkyFind developers
 */
public class SourceFinderConfig implements Serializable {
	
	private static final long serialVersionUID = 1L;
	
	private static final Logger logger = LoggerFactory.getLogger(SourceFinderConfig.class);
	
	private static final String DEFAULT_RESOURCE = "default-config.json";
	
	private int processes = 2;
	private double starWavelengthCutoff = 25.0;
	private List<String> pointCatalogs = new ArrayList<>();
	private List<ColourWindow> colourWindows = new ArrayList<>();
	
	private GalaxyConfig galaxies = new GalaxyConfig();
	private StarConfig stars = new StarConfig();
	private OtherSourceConfig otherSources = new OtherSourceConfig();
	
	/**
	 * Read the bundled default configuration.
	 * @return
	 * @throws IOException if the resource cannot be read
	 */
	public static SourceFinderConfig createDefault() throws IOException {
		try (var stream = SourceFinderConfig.class.getResourceAsStream(DEFAULT_RESOURCE)) {
			if (stream == null)
				throw new IOException("Missing resource " + DEFAULT_RESOURCE);
			try (var reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
				return GsonTools.getInstance().fromJson(reader, SourceFinderConfig.class);
			} catch (JsonParseException e) {
				throw new IOException("Unable to parse " + DEFAULT_RESOURCE, e);
			}
		}
	}
	
	/**
	 * Read a configuration from a JSON file.
	 * @param path
	 * @return
	 * @throws IOException
	 */
	public static SourceFinderConfig read(Path path) throws IOException {
		SourceFinderConfig config = GsonTools.readJson(path, SourceFinderConfig.class);
		logger.debug("Read configuration from {}", path);
		return config;
	}
	
	/**
	 * Write this configuration to a JSON file.
	 * @param path
	 * @throws IOException
	 */
	public void write(Path path) throws IOException {
		GsonTools.writeJson(path, this);
	}
	
	/**
	 * Check all settings, before any processing starts.
	 * @throws IllegalArgumentException if any setting is missing, unknown or out of range
	 */
	public void validate() throws IllegalArgumentException {
		if (processes < 1)
			throw new IllegalArgumentException("Number of processes must be >= 1, but was " + processes);
		if (!(starWavelengthCutoff > 0))
			throw new IllegalArgumentException("Star wavelength cutoff must be > 0, but was " + starWavelengthCutoff);
		if (galaxies == null || stars == null || otherSources == null)
			throw new IllegalArgumentException("Configuration must include galaxies, stars and otherSources sections");
		galaxies.validate();
		stars.validate();
		otherSources.validate();
		if (colourWindows != null) {
			for (var window : colourWindows) {
				if (window == null)
					throw new IllegalArgumentException("Colour windows must not be null");
				window.validate();
			}
		}
	}

	/**
	 * Number of frames processed in parallel.
	 * @return
	 */
	public int getProcesses() {
		return processes;
	}

	public void setProcesses(int processes) {
		this.processes = processes;
	}

	/**
	 * Frames with a longer wavelength, in micron, are skipped when finding stars.
	 * @return
	 */
	public double getStarWavelengthCutoff() {
		return starWavelengthCutoff;
	}

	public void setStarWavelengthCutoff(double starWavelengthCutoff) {
		this.starWavelengthCutoff = starWavelengthCutoff;
	}

	/**
	 * Names of the point-source catalogs to use; empty to use all.
	 * @return
	 */
	public List<String> getPointCatalogs() {
		return pointCatalogs == null ? List.of() : pointCatalogs;
	}

	public List<ColourWindow> getColourWindows() {
		return colourWindows == null ? List.of() : colourWindows;
	}

	public void setColourWindows(List<ColourWindow> colourWindows) {
		this.colourWindows = colourWindows;
	}

	public GalaxyConfig getGalaxies() {
		return galaxies;
	}

	public StarConfig getStars() {
		return stars;
	}

	public OtherSourceConfig getOtherSources() {
		return otherSources;
	}

}
