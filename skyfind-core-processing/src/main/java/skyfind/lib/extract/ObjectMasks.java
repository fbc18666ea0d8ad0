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

import java.io.Serializable;

import skyfind.lib.geom.Point2;
import skyfind.lib.images.Mask;

/**
 * Optional frame-sized masks that change how catalog objects are treated.
 * <ul>
 * <li>special: objects are processed as usual, but reported in more detail</li>
 * <li>ignore: objects are not detected, fitted or removed</li>
 * <li>bad: objects are outside the usable part of the frame and only get an undetected row</li>
 * </ul>
 * 
 * @author SkyFind developers
 */
public final class ObjectMasks implements Serializable {
	
	private static final long serialVersionUID = 1L;
	
	private static final ObjectMasks NONE = new ObjectMasks(null, null, null);
	
	private final Mask special;
	private final Mask ignore;
	private final Mask bad;
	
	/**
	 * Create masks; each may be null.
	 * @param special
	 * @param ignore
	 * @param bad
	 */
	public ObjectMasks(Mask special, Mask ignore, Mask bad) {
		this.special = special;
		this.ignore = ignore;
		this.bad = bad;
	}
	
	/**
	 * Get an instance without any masks.
	 * @return
	 */
	public static ObjectMasks none() {
		return NONE;
	}
	
	public boolean isSpecial(Point2 p) {
		return special != null && special.masks(p);
	}
	
	public boolean isIgnored(Point2 p) {
		return ignore != null && ignore.masks(p);
	}
	
	public boolean isBad(Point2 p) {
		return bad != null && bad.masks(p);
	}
	
	/**
	 * Bad-pixel mask, or null.
	 * @return
	 */
	public Mask getBad() {
		return bad;
	}

}
