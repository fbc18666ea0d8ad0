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

package skyfind.lib.catalog;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.reflect.TypeToken;

import skyfind.lib.geom.SkyBoundingBox;
import skyfind.lib.io.GsonTools;
import skyfind.lib.objects.CatalogObject;
import skyfind.lib.objects.ObjectCatalog;
import skyfind.lib.objects.ObjectKind;

/**
 * A {@link CatalogSource} reading JSON arrays of {@link CatalogObject} from local files.
 * <p>
 * Objects outside the requested bounding box are dropped, and the remaining objects are 
 * reindexed in file order.
 * 
 * @author SkyFind developers
 */
public class FileCatalogSource implements CatalogSource {
	
	private static final Logger logger = LoggerFactory.getLogger(FileCatalogSource.class);
	
	private final Path extendedSourceFile;
	private final Path pointSourceFile;
	
	/**
	 * Create a catalog source reading from the given files.
	 * @param extendedSourceFile JSON file with galaxies, or null if there are none
	 * @param pointSourceFile JSON file with stars, or null if there are none
	 */
	public FileCatalogSource(Path extendedSourceFile, Path pointSourceFile) {
		this.extendedSourceFile = extendedSourceFile;
		this.pointSourceFile = pointSourceFile;
	}

	@Override
	public ObjectCatalog getExtendedSourceCatalog(SkyBoundingBox box) throws IOException {
		if (extendedSourceFile == null)
			return ObjectCatalog.empty(ObjectKind.GALAXY);
		var objects = read(extendedSourceFile);
		var selected = new ArrayList<CatalogObject>();
		for (var object : objects) {
			if (object.getKind() == ObjectKind.GALAXY && box.contains(object.getPosition()))
				selected.add(object);
		}
		logger.info("{} of {} galaxies in {} fall within the bounding box", selected.size(), objects.size(), extendedSourceFile);
		return ObjectCatalog.createInstance(ObjectKind.GALAXY, selected);
	}

	@Override
	public ObjectCatalog getPointSourceCatalog(SkyBoundingBox box, double minPixelScale, List<String> catalogNames) throws IOException {
		if (pointSourceFile == null)
			return ObjectCatalog.empty(ObjectKind.STAR);
		var objects = read(pointSourceFile);
		var selected = new ArrayList<CatalogObject>();
		for (var object : objects) {
			if (object.getKind() != ObjectKind.STAR || !box.contains(object.getPosition()))
				continue;
			if (catalogNames != null && !catalogNames.isEmpty() && !catalogNames.contains(object.getCatalog()))
				continue;
			selected.add(object);
		}
		logger.info("{} of {} stars in {} selected (catalogs {})", selected.size(), objects.size(), pointSourceFile, catalogNames);
		return ObjectCatalog.createInstance(ObjectKind.STAR, selected);
	}
	
	private static List<CatalogObject> read(Path path) throws IOException {
		List<CatalogObject> objects = GsonTools.readJson(path, new TypeToken<List<CatalogObject>>() {}.getType());
		for (var object : objects) {
			if (object == null || object.getPosition() == null || object.getKind() == null)
				throw new IOException("Incomplete catalog entry in " + path);
		}
		return objects;
	}
	
	/**
	 * Write a catalog in the format read by this class.
	 * @param catalog
	 * @param path
	 * @throws IOException
	 */
	public static void write(ObjectCatalog catalog, Path path) throws IOException {
		GsonTools.writeJson(path, catalog.getObjects());
	}

}
