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

package skyfind.imagej.processing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import skyfind.lib.analysis.images.SimpleImages;
import skyfind.lib.geom.Point2;

@SuppressWarnings("javadoc")
public class TestRegionLabeling {
	
	@Test
	public void test_labelImage() {
		var image = SimpleImages.createFloatImage(10, 10);
		// 3x3 block
		for (int y = 1; y <= 3; y++)
			for (int x = 1; x <= 3; x++)
				image.setValue(x, y, 5f);
		// Diagonal pair, connected with 8-connectivity
		image.setValue(7, 7, 5f);
		image.setValue(8, 8, 5f);
		// Single pixel
		image.setValue(8, 1, 5f);
		image.setValue(5, 5, Float.NaN);
		
		var labels = RegionLabeling.labelImage(image, 1.0, 1);
		assertEquals(Set.of(1, 2, 3), labels.getLabels());
		assertEquals(1, labels.get(2, 2));
		assertEquals(2, labels.get(8, 1));
		assertEquals(3, labels.get(7, 7));
		assertEquals(3, labels.get(8, 8));
		assertEquals(0, labels.get(5, 5));
		assertEquals(9, labels.count(1));
		
		var large = RegionLabeling.labelImage(image, 1.0, 2);
		assertEquals(Set.of(1, 2), large.getLabels());
		assertEquals(1, large.get(1, 1));
		assertEquals(0, large.get(8, 1));
		assertEquals(2, large.get(8, 8));
	}
	
	@Test
	public void test_thresholdIsExclusive() {
		var image = SimpleImages.createFloatImage(new float[] {1, 2, 3, 2, 1}, 5, 1);
		var labels = RegionLabeling.labelImage(image, 2.0, 1);
		assertEquals(1, labels.count(1));
		assertEquals(1, labels.get(2, 0));
	}
	
	@Test
	public void test_findLocalMaxima() {
		var image = SimpleImages.createFloatImage(12, 12);
		image.setValue(2, 2, 10f);
		image.setValue(3, 2, 4f);
		image.setValue(9, 9, 6f);
		image.setValue(5, 10, 0.5f);
		
		var maxima = RegionLabeling.findLocalMaxima(image, 1.0, 5);
		assertEquals(List.of(new Point2(2, 2), new Point2(9, 9)), maxima);
		
		assertThrows(IllegalArgumentException.class, () -> RegionLabeling.findLocalMaxima(image, 1.0, 4));
	}
	
	@Test
	public void test_maximaTies() {
		var image = SimpleImages.createFloatImage(8, 5);
		image.setValue(3, 2, 7f);
		image.setValue(4, 2, 7f);
		var maxima = RegionLabeling.findLocalMaxima(image, 1.0, 3);
		assertEquals(1, maxima.size());
		assertEquals(new Point2(3, 2), maxima.get(0));
		
		// Far enough apart, both count
		image.setValue(4, 2, 0f);
		image.setValue(7, 2, 7f);
		maxima = RegionLabeling.findLocalMaxima(image, 1.0, 3);
		assertEquals(2, maxima.size());
		assertNotEquals(maxima.get(0), maxima.get(1));
		assertTrue(maxima.contains(new Point2(7, 2)));
	}

}
