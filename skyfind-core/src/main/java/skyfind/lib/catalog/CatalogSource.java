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
import java.util.List;

import skyfind.lib.geom.SkyBoundingBox;
import skyfind.lib.objects.ObjectCatalog;

/**
 * Provider of catalogs of known objects for a region of the sky.
 * <p>
 * Implementations may query remote services; any failure to obtain a catalog is reported 
 * as an {@link IOException}.
 * 
 * @author SkyFind developers
 */
public interface CatalogSource {
	
	/**
	 * Get the catalog of extended sources (galaxies) within a bounding box.
	 * @param box
	 * @return
	 * @throws IOException if the catalog cannot be obtained
	 */
	ObjectCatalog getExtendedSourceCatalog(SkyBoundingBox box) throws IOException;
	
	/**
	 * Get the catalog of point sources (stars) within a bounding box.
	 * @param box
	 * @param minPixelScale smallest pixel scale of the frames being processed, in arcseconds
	 * @param catalogNames names of the catalogs to include
	 * @return
	 * @throws IOException if the catalog cannot be obtained
	 */
	ObjectCatalog getPointSourceCatalog(SkyBoundingBox box, double minPixelScale, List<String> catalogNames) throws IOException;

}
