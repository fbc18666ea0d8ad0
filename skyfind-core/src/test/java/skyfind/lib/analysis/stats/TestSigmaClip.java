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

package skyfind.lib.analysis.stats;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Random;

import org.junit.jupiter.api.Test;

import skyfind.lib.analysis.images.SimpleImages;
import skyfind.lib.images.Mask;

@SuppressWarnings("javadoc")
public class TestSigmaClip {
	
	@Test
	public void test_rejectOutliers() {
		var random = new Random(42L);
		double[] values = new double[1012];
		for (int i = 0; i < 1000; i++)
			values[i] = 10 + random.nextGaussian();
		for (int i = 1000; i < 1010; i++)
			values[i] = 100;
		values[1010] = Double.NaN;
		values[1011] = Double.POSITIVE_INFINITY;
		
		var stats = SigmaClip.computeStatistics(values, 3.0, 5);
		assertEquals(10.0, stats.getMedian(), 0.15);
		assertEquals(10.0, stats.getMean(), 0.15);
		assertEquals(1.0, stats.getStdDev(), 0.15);
		assertTrue(stats.getNRejected() >= 10);
		assertTrue(stats.getNKept() >= 980);
	}
	
	@Test
	public void test_noValues() {
		var stats = SigmaClip.computeStatistics(new double[] {Double.NaN}, 3.0, 5);
		assertEquals(0, stats.getNKept());
		assertTrue(Double.isNaN(stats.getMedian()));
	}
	
	@Test
	public void test_clipMask() {
		var image = SimpleImages.createFloatImage(10, 10);
		var random = new Random(1L);
		for (int y = 0; y < 10; y++) {
			for (int x = 0; x < 10; x++)
				image.setValue(x, y, (float)(5 + random.nextGaussian() * 0.1));
		}
		image.setValue(3, 3, 1000f);
		image.setValue(4, 4, Float.NaN);
		var excluded = Mask.createEmpty(10, 10);
		excluded.set(0, 0, true);
		
		var mask = SigmaClip.clipMask(image, excluded, 3.0, 5);
		assertTrue(mask.get(0, 0));
		assertTrue(mask.get(3, 3));
		assertTrue(mask.get(4, 4));
		assertFalse(excluded.get(3, 3));
		
		var stats = SigmaClip.computeStatistics(image, excluded, 3.0);
		assertEquals(5.0, stats.getMean(), 0.05);
	}

}
