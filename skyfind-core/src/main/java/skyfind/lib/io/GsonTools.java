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
import java.io.Reader;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

import skyfind.lib.geom.SkyCoordinate;

/**
 * Helper class providing Gson instances with type adapters registered to serialize 
 * several key SkyFind classes.
 * <p>
 * These include:
 * <ul>
 * <li>{@link SkyCoordinate}, written as {@code {"ra": ..., "dec": ...}} and validated on reading</li>
 * </ul>
 * Special floating point values (NaN, infinity) are written rather than rejected.
 * 
 * @author SkyFind developers
 *
 */
public class GsonTools {
	
	private static final Logger logger = LoggerFactory.getLogger(GsonTools.class);
	
	private static GsonBuilder builder = new GsonBuilder()
			.serializeSpecialFloatingPointValues()
			.setLenient()
			.registerTypeAdapter(SkyCoordinate.class, new SkyCoordinateTypeAdapter().nullSafe());
	
	/**
	 * Get default Gson, capable of serializing/deserializing some key SkyFind classes.
	 * @return
	 * 
	 * @see #getInstance(boolean)
	 */
	public static Gson getInstance() {
		return builder.create();
	}
	
	/**
	 * Get default Gson, optionally with pretty printing enabled.
	 * 
	 * @param pretty if true, write using pretty-printing (i.e. more whitespace for formatting)
	 * @return
	 */
	public static Gson getInstance(boolean pretty) {
		if (pretty)
			return getInstance().newBuilder().setPrettyPrinting().create();
		return getInstance();
	}
	
	/**
	 * Read a JSON file.
	 * @param <T>
	 * @param path
	 * @param type
	 * @return
	 * @throws IOException if the file cannot be read, or does not contain valid JSON for the type
	 */
	public static <T> T readJson(Path path, Type type) throws IOException {
		logger.debug("Reading {}", path);
		try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
			T result = getInstance().fromJson(reader, type);
			if (result == null)
				throw new IOException("No JSON content in " + path);
			return result;
		} catch (JsonParseException e) {
			throw new IOException("Unable to parse " + path + ": " + e.getMessage(), e);
		}
	}
	
	/**
	 * Write an object to a JSON file using pretty printing.
	 * @param path
	 * @param object
	 * @throws IOException
	 */
	public static void writeJson(Path path, Object object) throws IOException {
		logger.debug("Writing {}", path);
		try (var writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
			getInstance(true).toJson(object, writer);
		}
	}
	
	
	static class SkyCoordinateTypeAdapter extends TypeAdapter<SkyCoordinate> {

		@Override
		public void write(JsonWriter out, SkyCoordinate value) throws IOException {
			out.beginObject();
			out.name("ra").value(value.getRA());
			out.name("dec").value(value.getDec());
			out.endObject();
		}

		@Override
		public SkyCoordinate read(JsonReader in) throws IOException {
			double ra = Double.NaN;
			double dec = Double.NaN;
			in.beginObject();
			while (in.hasNext()) {
				String name = in.nextName();
				if ("ra".equals(name))
					ra = in.nextDouble();
				else if ("dec".equals(name))
					dec = in.nextDouble();
				else
					in.skipValue();
			}
			in.endObject();
			try {
				return new SkyCoordinate(ra, dec);
			} catch (IllegalArgumentException e) {
				throw new JsonParseException("Invalid sky coordinate at " + in.getPath(), e);
			}
		}
		
	}
	
}
