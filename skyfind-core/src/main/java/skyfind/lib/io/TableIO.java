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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Write simple delimited tables.
 * <p>
 * Missing values (null, or NaN doubles) are written as empty cells.
 * 
 * @author SkyFind developers
 */
public class TableIO {
	
	/**
	 * Default delimiter.
	 */
	public static final String TAB = "\t";
	
	/**
	 * Write a tab-delimited table, replacing any existing file.
	 * @param path
	 * @param header column names
	 * @param rows rows, each with one value per column
	 * @throws IOException
	 */
	public static void writeTable(Path path, List<String> header, List<? extends List<?>> rows) throws IOException {
		writeTable(path, header, rows, TAB);
	}
	
	/**
	 * Write a delimited table, replacing any existing file.
	 * @param path
	 * @param header column names
	 * @param rows rows, each with one value per column
	 * @param delimiter
	 * @throws IOException
	 * @throws IllegalArgumentException if a row does not match the number of columns
	 */
	public static void writeTable(Path path, List<String> header, List<? extends List<?>> rows, String delimiter) throws IOException {
		try (var writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
			writer.write(String.join(delimiter, header));
			writer.write(System.lineSeparator());
			for (var row : rows) {
				if (row.size() != header.size())
					throw new IllegalArgumentException("Row has " + row.size() + " values, but table has " + header.size() + " columns");
				var sb = new StringBuilder();
				for (int i = 0; i < row.size(); i++) {
					if (i > 0)
						sb.append(delimiter);
					sb.append(toCell(row.get(i)));
				}
				writer.write(sb.toString());
				writer.write(System.lineSeparator());
			}
		}
	}
	
	static String toCell(Object value) {
		if (value == null)
			return "";
		if (value instanceof Double d && d.isNaN())
			return "";
		if (value instanceof Float f && f.isNaN())
			return "";
		return value.toString();
	}
	
	/**
	 * Read all lines of a delimited table, split into cells.
	 * @param path
	 * @param delimiter
	 * @return
	 * @throws IOException
	 */
	public static List<String[]> readTable(Path path, String delimiter) throws IOException {
		return Files.readAllLines(path, StandardCharsets.UTF_8).stream()
				.filter(line -> !line.isBlank())
				.map(line -> line.split(delimiter, -1))
				.toList();
	}

}
