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

package skyfind.lib.regions;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import skyfind.lib.geom.Point2;
import skyfind.lib.io.RegionIO;

@SuppressWarnings("javadoc")
public class TestRegionShapes {
	
	@Test
	public void test_ds9() {
		var regions = new RegionList();
		regions.add(new PointRegion(new Point2(10, 20), "red", null));
		regions.add(new CircleRegion(new Point2(10, 20), 5, "blue", "star"));
		regions.add(new EllipseRegion(new Point2(0, 0), 4, 2, 30, "white", null));
		
		String text = RegionIO.toDS9String(regions);
		var lines = text.lines().toList();
		assertEquals(6, lines.size());
		assertEquals("image", lines.get(2));
		assertEquals("point(11.000,21.000) # color=red point=x", lines.get(3));
		assertEquals("circle(11.000,21.000,5.000) # color=blue text={star}", lines.get(4));
		assertEquals("ellipse(1.000,1.000,4.000,2.000,30.000) # color=white", lines.get(5));
	}
	
	@Test
	public void test_toMask() {
		var circle = new CircleRegion(new Point2(10, 10), 3, "green", null);
		var mask = circle.toMask(21, 21);
		assertTrue(mask.get(10, 10));
		assertTrue(mask.get(12, 10));
		assertFalse(mask.get(14, 10));
		assertTrue(mask.countTrue() >= 21 && mask.countTrue() <= 29);
		
		var ellipse = new EllipseRegion(new Point2(10, 10), 6, 2, 90, "green", null);
		var ellipseMask = ellipse.toMask(21, 21);
		assertTrue(ellipseMask.get(10, 15));
		assertFalse(ellipseMask.get(15, 10));
		
		// Points have no area
		assertTrue(new PointRegion(new Point2(5, 5), null, null).toMask(10, 10).isEmpty());
		
		var list = new RegionList();
		list.add(circle);
		list.add(ellipse);
		assertEquals(mask.union(ellipseMask), list.toMask(21, 21));
	}

}
