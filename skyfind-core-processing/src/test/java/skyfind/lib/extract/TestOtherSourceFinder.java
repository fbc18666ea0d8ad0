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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeout;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.Test;

import skyfind.lib.geom.Point2;
import skyfind.lib.images.Frame;
import skyfind.lib.images.Mask;
import skyfind.lib.images.SegmentationMap;
import skyfind.lib.sources.SyntheticFrames;

@SuppressWarnings("javadoc")
public class TestOtherSourceFinder {
	
	private static Frame createFrame() {
		return new SyntheticFrames(64, 64, 10.0, 0.5, 6L)
				.addGaussian(20, 20, 40, 2.0)
				.addGaussian(45, 45, 40, 2.0)
				.createFrame("H", 1.0, 1.65, null);
	}
	
	private static SegmentationMap knownStar() {
		var segments = SegmentationMap.createEmpty(64, 64);
		segments.paint(Mask.createEllipse(64, 64, new Point2(45, 45), 6, 6, 0), 0, 0, 1);
		return segments;
	}
	
	@Test
	public void test_find() {
		var frame = createFrame();
		var result = new OtherSourceFinder(new OtherSourceConfig()).find(frame, null, knownStar(), 3.0, ObjectMasks.none());
		
		assertEquals(1, result.getRows().size());
		var row = result.getRows().get(0);
		assertEquals(0, row.index());
		assertTrue(row.detected());
		assertTrue(row.flux() > 0);
		assertEquals(20, row.x(), 1.0);
		assertEquals(20, row.y(), 1.0);
		
		assertEquals(1, result.getSegments().get(20, 20));
		assertEquals(0, result.getSegments().get(45, 45));
		assertEquals(1, result.getRegions().size());
		assertEquals("yellow", result.getRegions().getShapes().get(0).getColor());
		assertEquals(3.0, result.getFwhm());
	}
	
	@Test
	public void test_manySources() {
		var synthetic = new SyntheticFrames(1500, 1500, 10.0, 0.5, 9L);
		for (int i = 0; i < 20; i++) {
			for (int j = 0; j < 20; j++)
				synthetic.addGaussian(50 + i * 70, 50 + j * 70, 40, 2.0);
		}
		var frame = synthetic.createFrame("H", 1.0, 1.65, null);
		var finder = new OtherSourceFinder(new OtherSourceConfig());
		
		var result = assertTimeout(Duration.ofSeconds(6), () -> finder.find(frame, null, null, 3.0, ObjectMasks.none()));
		assertEquals(400, result.getRows().size());
		
		// Each row lies on its own segment, close to one of the sources
		var segments = result.getSegments();
		assertEquals(400, segments.getLabels().size());
		for (var row : result.getRows()) {
			assertEquals(row.index() + 1, segments.get((int)Math.round(row.x()), (int)Math.round(row.y())));
			assertEquals(0, (row.x() - 50 + 35) % 70 - 35, 0.5);
			assertEquals(0, (row.y() - 50 + 35) % 70 - 35, 0.5);
		}
		
		// Flux of each source is close to 2 pi sigma^2 A
		double expected = 2 * Math.PI * 4 * 40;
		assertTrue(result.getRows().stream().allMatch(r -> r.flux() > 0.5 * expected && r.flux() < 1.1 * expected));
	}
	
	@Test
	public void test_discardPrincipalGalaxy() {
		var frame = createFrame();
		var galaxies = SegmentationMap.createEmpty(64, 64);
		galaxies.set(20, 20, 1);
		var result = new OtherSourceFinder(new OtherSourceConfig()).find(frame, galaxies, knownStar(), 3.0, ObjectMasks.none());
		assertTrue(result.getRows().isEmpty());
		
		// Other galaxies do not cause a source to be discarded
		galaxies.set(20, 20, 3);
		result = new OtherSourceFinder(new OtherSourceConfig()).find(frame, galaxies, knownStar(), 3.0, ObjectMasks.none());
		assertEquals(1, result.getRows().size());
	}
	
	@Test
	public void test_ignoreMask() {
		var frame = createFrame();
		var ignore = Mask.createEllipse(64, 64, new Point2(20, 20), 1, 1, 0);
		var result = new OtherSourceFinder(new OtherSourceConfig()).find(frame, null, knownStar(), 3.0, new ObjectMasks(null, ignore, null));
		assertTrue(result.getRows().isEmpty());
	}
	
	@Test
	public void test_remove() {
		var frame = createFrame();
		var config = new OtherSourceConfig();
		config.setRemove(true);
		float starBefore = frame.getValue(45, 45);
		var result = new OtherSourceFinder(config).find(frame, null, knownStar(), 3.0, ObjectMasks.none());
		assertEquals(1, result.getRows().size());
		assertTrue(frame.getValue(20, 20) < 13f);
		assertEquals(starBefore, frame.getValue(45, 45));
	}
	
	@Test
	public void test_invalidInput() {
		var frame = createFrame();
		var finder = new OtherSourceFinder(new OtherSourceConfig());
		assertThrows(IllegalArgumentException.class, () -> finder.find(frame, null, null, 0, ObjectMasks.none()));
		
		var bad = Mask.createEmpty(64, 64).inverse();
		var result = finder.find(frame, null, null, 3.0, new ObjectMasks(null, null, bad));
		assertTrue(result.getRows().isEmpty());
	}

}
