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

package skyfind.lib.sources;

/**
 * Thrown when the background of a source cannot be estimated, usually because too few 
 * usable pixels remain in its background annulus.
 * 
 * @author SkyFind developers
 */
public class BackgroundEstimationException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	/**
	 * Constructor with a message.
	 * @param message
	 */
	public BackgroundEstimationException(String message) {
		super(message);
	}
	
	/**
	 * Constructor with a message and cause.
	 * @param message
	 * @param cause
	 */
	public BackgroundEstimationException(String message, Throwable cause) {
		super(message, cause);
	}

}
