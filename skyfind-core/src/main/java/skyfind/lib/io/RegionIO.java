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

package skyfind.lib.io;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import skyfind.lib.regions.RegionList;
import skyfind.lib.regions.RegionShape;

/**
 * Write region lists in the DS9 region file format, using image coordinates.
 * 
 * @author SkyFind developers
 */
public class RegionIO {
	
	private static final String HEADER = "# Region file format: DS9 version 4.1";
	private static final String GLOBAL = "global color=green dashlist=8 3 width=1 font=\"helvetica 10 normal roman\" select=1 highlite=1 dash=0 fixed=0 edit=1 move=1 delete=1 include=1 source=1";
	
	/**
	 * Write regions to a file, replacing any existing file.
	 * @param regions
	 * @param path
	 * @throws IOException
	 */
	public static void writeDS9(RegionList regions, Path path) throws IOException {
		try (var writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
			writeDS9(regions, writer);
		}
	}
	
	/**
	 * Write regions to a writer.
	 * @param regions
	 * @param writer
	 * @throws IOException
	 */
	public static void writeDS9(RegionList regions, Writer writer) throws IOException {
		writer.write(HEADER);
		writer.write(System.lineSeparator());
		writer.write(GLOBAL);
		writer.write(System.lineSeparator());
		writer.write("image");
		writer.write(System.lineSeparator());
		for (RegionShape shape : regions) {
			writer.write(shape.toDS9());
			writer.write(System.lineSeparator());
		}
	}
	
	/**
	 * Get the DS9 representation of regions as a string.
	 * @param regions
	 * @return
	 */
	public static String toDS9String(RegionList regions) {
		var writer = new StringWriter();
		try {
			writeDS9(regions, writer);
		} catch (IOException e) {
			throw new IllegalStateException("Unexpected exception writing to a string", e);
		}
		return writer.toString();
	}

}
