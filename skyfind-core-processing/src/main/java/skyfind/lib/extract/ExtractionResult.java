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
import java.util.List;
import java.util.Optional;

import skyfind.lib.images.Frame;
import skyfind.lib.images.SegmentationMap;
import skyfind.lib.regions.RegionList;

/**
 * Everything produced by one extractor for one frame.
 * <p>
 * This is a plain value: it holds no references back to the {@link SourceFinder}, so it can be 
 * returned from a worker and merged later.
 * 
 * @author SkyFind developers
 */
public final class ExtractionResult implements Serializable {
	
	private static final long serialVersionUID = 1L;
	
	private final String frameName;
	private final List<DetectionRow> rows;
	private final RegionList regions;
	private final RegionList saturationRegions;
	private final SegmentationMap segments;
	private final Frame frame;
	private final double fwhm;
	private final List<Failure> failures;
	
	/**
	 * Constructor.
	 * @param frameName
	 * @param rows one row per catalog object, in index order
	 * @param regions
	 * @param saturationRegions
	 * @param segments
	 * @param frame the frame after any removal
	 * @param fwhm frame FWHM in pixels, or NaN if not measured
	 * @param failures
	 */
	public ExtractionResult(String frameName, List<DetectionRow> rows, RegionList regions, RegionList saturationRegions,
			SegmentationMap segments, Frame frame, double fwhm, List<Failure> failures) {
		this.frameName = frameName;
		this.rows = List.copyOf(rows);
		this.regions = regions;
		this.saturationRegions = saturationRegions;
		this.segments = segments;
		this.frame = frame;
		this.fwhm = fwhm;
		this.failures = List.copyOf(failures);
	}
	
	public String getFrameName() {
		return frameName;
	}
	
	public List<DetectionRow> getRows() {
		return rows;
	}
	
	/**
	 * Get the row for a catalog index.
	 * @param index
	 * @return
	 */
	public Optional<DetectionRow> getRow(int index) {
		return rows.stream().filter(r -> r.index() == index).findFirst();
	}
	
	public RegionList getRegions() {
		return regions;
	}
	
	public RegionList getSaturationRegions() {
		return saturationRegions;
	}
	
	public SegmentationMap getSegments() {
		return segments;
	}
	
	/**
	 * The processed frame.
	 * @return
	 */
	public Frame getFrame() {
		return frame;
	}
	
	/**
	 * Frame FWHM in pixels, or NaN.
	 * @return
	 */
	public double getFwhm() {
		return fwhm;
	}
	
	public List<Failure> getFailures() {
		return failures;
	}
	
	/**
	 * Number of rows reporting a detection.
	 * @return
	 */
	public int countDetected() {
		return (int)rows.stream().filter(DetectionRow::detected).count();
	}
	
	@Override
	public String toString() {
		return "ExtractionResult [frame=" + frameName + ", rows=" + rows.size() + ", detected=" + countDetected() 
			+ ", failures=" + failures.size() + "]";
	}

}
