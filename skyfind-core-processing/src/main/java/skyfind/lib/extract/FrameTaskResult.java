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
 * Outcome of one per-frame task: either completed with a result, or failed with an error message.
 * 
 * @author SkyFind developers
 */
public final class FrameTaskResult implements Serializable {
	
	private static final long serialVersionUID = 1L;
	
	private final String frameName;
	private final ExtractionResult result;
	private final String error;
	
	private FrameTaskResult(String frameName, ExtractionResult result, String error) {
		this.frameName = frameName;
		this.result = result;
		this.error = error;
	}
	
	/**
	 * Create a completed result.
	 * @param frameName
	 * @param result
	 * @return
	 */
	public static FrameTaskResult completed(String frameName, ExtractionResult result) {
		return new FrameTaskResult(frameName, result, null);
	}
	
	/**
	 * Create a failed result.
	 * @param frameName
	 * @param error
	 * @return
	 */
	public static FrameTaskResult failed(String frameName, String error) {
		return new FrameTaskResult(frameName, null, error);
	}
	
	public String getFrameName() {
		return frameName;
	}
	
	public boolean isCompleted() {
		return result != null;
	}
	
	/**
	 * The extraction result, or null if the task failed.
	 * @return
	 */
	public ExtractionResult getResult() {
		return result;
	}
	
	/**
	 * The error message, or null if the task completed.
	 * @return
	 */
	public String getError() {
		return error;
	}
	
	@Override
	public String toString() {
		return isCompleted() ? "Completed [" + frameName + "]" : "Failed [" + frameName + ": " + error + "]";
	}

}
