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

package skyfind.lib.objects;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * An ordered list of catalog objects of a single kind.
 * <p>
 * The position of each object in the list matches its {@link CatalogObject#getIndex() index}.
 * 
 * @author SkyFind developers
 */
public final class ObjectCatalog implements Serializable {
	
	private static final long serialVersionUID = 1L;
	
	private final ObjectKind kind;
	private final List<CatalogObject> objects;
	
	private ObjectCatalog(ObjectKind kind, List<CatalogObject> objects) {
		this.kind = kind;
		this.objects = Collections.unmodifiableList(objects);
	}
	
	/**
	 * Create a catalog, reindexing objects so that each index matches its position in the list.
	 * @param kind
	 * @param objects
	 * @return
	 * @throws IllegalArgumentException if any object has a different kind
	 */
	public static ObjectCatalog createInstance(ObjectKind kind, List<CatalogObject> objects) {
		var list = new ArrayList<CatalogObject>(objects.size());
		for (var object : objects) {
			if (object.getKind() != kind)
				throw new IllegalArgumentException("Cannot add " + object + " to a catalog of " + kind);
			int index = list.size();
			list.add(object.getIndex() == index ? object : object.withIndex(index));
		}
		return new ObjectCatalog(kind, list);
	}
	
	/**
	 * Create an empty catalog.
	 * @param kind
	 * @return
	 */
	public static ObjectCatalog empty(ObjectKind kind) {
		return new ObjectCatalog(kind, Collections.emptyList());
	}
	
	@SuppressWarnings("javadoc")
	public ObjectKind getKind() {
		return kind;
	}
	
	/**
	 * Get the objects, ordered by index.
	 * @return
	 */
	public List<CatalogObject> getObjects() {
		return objects;
	}
	
	@SuppressWarnings("javadoc")
	public CatalogObject get(int index) {
		return objects.get(index);
	}
	
	@SuppressWarnings("javadoc")
	public int size() {
		return objects.size();
	}
	
	@SuppressWarnings("javadoc")
	public boolean isEmpty() {
		return objects.isEmpty();
	}
	
	/**
	 * Get the principal galaxy, if the catalog contains one.
	 * @return
	 */
	public Optional<CatalogObject> getPrincipal() {
		return objects.stream().filter(CatalogObject::isPrincipal).findFirst();
	}

}
