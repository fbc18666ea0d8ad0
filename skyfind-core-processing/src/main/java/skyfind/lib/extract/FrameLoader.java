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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import skyfind.lib.images.Frame;
import skyfind.lib.io.FitsIO;

/**
 * Read all FITS frames in a directory.
 * 
 * @author SkyFind developers
 */
public class FrameLoader {
	
	private static final Logger logger = LoggerFactory.getLogger(FrameLoader.class);
	
	// Suppress default constructor for non-instantiability
	private FrameLoader() {
		throw new AssertionError();
	}
	
	/**
	 * Read every {@code .fits} or {@code .fit} file in a directory, sorted by file name.
	 * Frames are keyed by their filter name.
	 * 
	 * @param directory
	 * @return
	 * @throws IOException if a file cannot be read, or two frames have the same filter
	 */
	public static Map<String, Frame> loadDirectory(Path directory) throws IOException {
		if (!Files.isDirectory(directory))
			throw new IOException(directory + " is not a directory");
		
		List<Path> files;
		try (var stream = Files.list(directory)) {
			files = stream
					.filter(p -> Files.isRegularFile(p) && isFits(p))
					.sorted()
					.collect(Collectors.toList());
		}
		var frames = new LinkedHashMap<String, Frame>();
		for (var file : files) {
			var frame = FitsIO.readFrame(file.toFile());
			String name = frame.getFilter().getName();
			if (frames.containsKey(name))
				throw new IOException("Duplicate frame for filter " + name + " in " + file);
			frames.put(name, frame);
			logger.debug("Read frame {} from {}", name, file);
		}
		logger.info("Read {} frames from {}", frames.size(), directory);
		return frames;
	}
	
	private static boolean isFits(Path path) {
		String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
		return name.endsWith(".fits") || name.endsWith(".fit");
	}

}
