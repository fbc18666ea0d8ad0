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

import skyfind.lib.analysis.fitting.PsfModel;

/**
 * Mutable per-frame state attached to a catalog object while a frame is being processed.
 * <p>
 * A new state is created for each frame, so nothing found in one frame leaks into another.
 * 
 * @author SkyFind developers
 */
public class DetectionState {
	
	private Source source;
	private PsfModel model;
	private boolean hasSaturation;
	private boolean ignore;
	private boolean special;
	
	/**
	 * The detected source, or null if the object has not been found.
	 * @return
	 */
	public Source getSource() {
		return source;
	}
	
	void setSource(Source source) {
		this.source = source;
	}
	
	/**
	 * The fitted profile, or null.
	 * @return
	 */
	public PsfModel getModel() {
		return model;
	}
	
	void setModel(PsfModel model) {
		this.model = model;
	}
	
	public boolean hasSaturation() {
		return hasSaturation;
	}
	
	void setHasSaturation(boolean hasSaturation) {
		this.hasSaturation = hasSaturation;
	}
	
	/**
	 * Objects under the ignore mask are not detected, fitted or removed.
	 * @return
	 */
	public boolean isIgnored() {
		return ignore;
	}
	
	void setIgnored(boolean ignore) {
		this.ignore = ignore;
	}
	
	/**
	 * Objects under the special mask are reported with extra detail in the log.
	 * @return
	 */
	public boolean isSpecial() {
		return special;
	}
	
	void setSpecial(boolean special) {
		this.special = special;
	}

}
