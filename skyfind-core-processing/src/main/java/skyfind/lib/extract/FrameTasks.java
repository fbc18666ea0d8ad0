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
import java.util.concurrent.Callable;

import skyfind.lib.geom.Point2;
import skyfind.lib.images.Frame;
import skyfind.lib.images.SegmentationMap;
import skyfind.lib.objects.ObjectCatalog;

/**
 * Per-frame units of work submitted by a {@link SourceFinder}.
 * <p>
 * Each task owns everything it needs: its own copy of the frame, the catalog, masks and settings. 
 * Nothing is shared with other tasks, and the result is returned as a new value.
 * 
 * @author SkyFind developers
 */
public class FrameTasks {
	
	// Suppress default constructor for non-instantiability
	private FrameTasks() {
		throw new AssertionError();
	}
	
	static void checkFrame(Frame frame) {
		if (frame.countFinite() == 0)
			throw new IllegalArgumentException("Frame " + frame.getName() + " contains no finite pixels");
	}
	
	/**
	 * Find galaxies in one frame.
	 */
	public static class GalaxyTask implements Callable<ExtractionResult>, Serializable {
		
		private static final long serialVersionUID = 1L;
		
		private final Frame frame;
		private final ObjectCatalog catalog;
		private final ObjectMasks masks;
		private final GalaxyConfig config;
		
		/**
		 * Create a task.
		 * @param frame frame to process; this is modified by the task, so should be a copy
		 * @param catalog
		 * @param masks
		 * @param config
		 */
		public GalaxyTask(Frame frame, ObjectCatalog catalog, ObjectMasks masks, GalaxyConfig config) {
			this.frame = frame;
			this.catalog = catalog;
			this.masks = masks;
			this.config = config;
		}

		@Override
		public ExtractionResult call() {
			checkFrame(frame);
			return new ExtendedSourceFinder(config).find(frame, catalog, masks);
		}
		
	}
	
	/**
	 * Find stars in one frame.
	 */
	public static class StarTask implements Callable<ExtractionResult>, Serializable {
		
		private static final long serialVersionUID = 1L;
		
		private final Frame frame;
		private final ObjectCatalog catalog;
		private final ObjectMasks masks;
		private final SegmentationMap galaxySegments;
		private final Point2 principalPosition;
		private final StarConfig config;
		
		/**
		 * Create a task.
		 * @param frame frame to process; this is modified by the task, so should be a copy
		 * @param catalog
		 * @param masks
		 * @param galaxySegments galaxy segments of the frame, or null
		 * @param principalPosition pixel position of the principal galaxy, or null
		 * @param config
		 */
		public StarTask(Frame frame, ObjectCatalog catalog, ObjectMasks masks, SegmentationMap galaxySegments, 
				Point2 principalPosition, StarConfig config) {
			this.frame = frame;
			this.catalog = catalog;
			this.masks = masks;
			this.galaxySegments = galaxySegments;
			this.principalPosition = principalPosition;
			this.config = config;
		}

		@Override
		public ExtractionResult call() {
			checkFrame(frame);
			return new PointSourceFinder(config).find(frame, catalog, masks, galaxySegments, principalPosition);
		}
		
	}
	
	/**
	 * Find uncataloged sources in one frame.
	 */
	public static class OtherSourceTask implements Callable<ExtractionResult>, Serializable {
		
		private static final long serialVersionUID = 1L;
		
		private final Frame frame;
		private final SegmentationMap galaxySegments;
		private final SegmentationMap starSegments;
		private final double fwhm;
		private final ObjectMasks masks;
		private final OtherSourceConfig config;
		
		/**
		 * Create a task.
		 * @param frame frame to process; this is modified by the task, so should be a copy
		 * @param galaxySegments
		 * @param starSegments
		 * @param fwhm
		 * @param masks
		 * @param config
		 */
		public OtherSourceTask(Frame frame, SegmentationMap galaxySegments, SegmentationMap starSegments, double fwhm,
				ObjectMasks masks, OtherSourceConfig config) {
			this.frame = frame;
			this.galaxySegments = galaxySegments;
			this.starSegments = starSegments;
			this.fwhm = fwhm;
			this.masks = masks;
			this.config = config;
		}

		@Override
		public ExtractionResult call() {
			checkFrame(frame);
			return new OtherSourceFinder(config).find(frame, galaxySegments, starSegments, fwhm, masks);
		}
		
	}

}
