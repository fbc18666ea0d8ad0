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

/**
 * A processing step that failed for one object.
 * 
 * @param objectIndex catalog index (or segment index for uncataloged sources)
 * @param step name of the failed step, e.g. "detection"
 * @param reason error message
 */
public record Failure(int objectIndex, String step, String reason) implements Serializable {
	
	/**
	 * Create a failure from an exception.
	 * @param objectIndex
	 * @param step
	 * @param e
	 * @return
	 */
	public static Failure of(int objectIndex, String step, Exception e) {
		String reason = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
		return new Failure(objectIndex, step, reason);
	}

}
