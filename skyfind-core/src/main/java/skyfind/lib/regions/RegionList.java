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

package skyfind.lib.regions;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import skyfind.lib.images.Mask;

/**
 * An ordered collection of {@link RegionShape} annotations for one frame.
 * 
 * @author SkyFind developers
 */
public class RegionList implements Iterable<RegionShape>, Serializable {
	
	private static final long serialVersionUID = 1L;

	private final List<RegionShape> shapes = new ArrayList<>();
	
	/**
	 * Add a shape.
	 * @param shape
	 */
	public void add(RegionShape shape) {
		shapes.add(shape);
	}
	
	/**
	 * Add all shapes of another list.
	 * @param other
	 */
	public void addAll(RegionList other) {
		shapes.addAll(other.shapes);
	}
	
	/**
	 * Number of shapes.
	 * @return
	 */
	public int size() {
		return shapes.size();
	}
	
	/**
	 * Query whether the list contains no shapes.
	 * @return
	 */
	public boolean isEmpty() {
		return shapes.isEmpty();
	}
	
	/**
	 * Get an unmodifiable view of the shapes.
	 * @return
	 */
	public List<RegionShape> getShapes() {
		return Collections.unmodifiableList(shapes);
	}
	
	/**
	 * Rasterize the union of all shapes with an area.
	 * @param width
	 * @param height
	 * @return
	 */
	public Mask toMask(int width, int height) {
		var mask = Mask.createEmpty(width, height);
		for (var shape : shapes) {
			var geometry = shape.toGeometry();
			if (geometry.getArea() > 0)
				RegionShape.paint(geometry, mask);
		}
		return mask;
	}

	@Override
	public Iterator<RegionShape> iterator() {
		return getShapes().iterator();
	}

}
