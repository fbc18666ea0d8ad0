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
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Thread-safe record of everything that went wrong during a run: failed stages, failed frames 
 * and failures for individual objects.
 * 
 * @author SkyFind developers
 */
public class Diagnostics implements Serializable {
	
	private static final long serialVersionUID = 1L;
	
	/**
	 * A single diagnostic message.
	 * 
	 * @param stage name of the stage
	 * @param frameName name of the frame, or null for a failure of the whole stage
	 * @param objectIndex index of the object, or -1 for a failure of a whole frame or stage
	 * @param step failed step, or null
	 * @param message
	 */
	public record Entry(String stage, String frameName, int objectIndex, String step, String message) implements Serializable {
		
		/**
		 * Query whether the entry describes a whole frame that could not be processed.
		 * @return
		 */
		public boolean isFrameFailure() {
			return frameName != null && objectIndex < 0;
		}
		
		/**
		 * Query whether the entry describes a whole stage that could not be run.
		 * @return
		 */
		public boolean isStageFailure() {
			return frameName == null;
		}
		
	}
	
	private final List<Entry> entries = Collections.synchronizedList(new ArrayList<>());
	
	void addStageFailure(String stage, String message) {
		entries.add(new Entry(stage, null, -1, null, message));
	}
	
	void addFrameFailure(String stage, String frameName, String message) {
		entries.add(new Entry(stage, frameName, -1, null, message));
	}
	
	void addObjectFailure(String stage, String frameName, Failure failure) {
		entries.add(new Entry(stage, frameName, failure.objectIndex(), failure.step(), failure.reason()));
	}
	
	/**
	 * Get a snapshot of all entries, in the order they were added.
	 * @return
	 */
	public List<Entry> getEntries() {
		synchronized (entries) {
			return List.copyOf(entries);
		}
	}
	
	/**
	 * Get a snapshot of all entries for one stage.
	 * @param stage
	 * @return
	 */
	public List<Entry> getEntries(String stage) {
		return getEntries().stream().filter(e -> stage.equals(e.stage())).toList();
	}
	
	/**
	 * Get the names of all frames that failed in a stage.
	 * @param stage
	 * @return
	 */
	public Set<String> getFailedFrames(String stage) {
		var set = new LinkedHashSet<String>();
		for (var entry : getEntries(stage)) {
			if (entry.isFrameFailure())
				set.add(entry.frameName());
		}
		return set;
	}
	
	public boolean isEmpty() {
		return entries.isEmpty();
	}
	
	public int size() {
		return entries.size();
	}
	
	@Override
	public String toString() {
		return "Diagnostics [" + size() + " entries]";
	}

}
