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

package skyfind.lib.images;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import skyfind.lib.geom.SkyCoordinate;

@SuppressWarnings("javadoc")
public class TestCoordinateSystem {
	
	private static final SkyCoordinate CENTER = new SkyCoordinate(150.0, 30.0);
	
	@Test
	public void test_referencePixel() {
		var wcs = CoordinateSystem.createInstance(CENTER, 1.0, 101, 101);
		var p = wcs.toPixel(CENTER);
		assertEquals(50.0, p.getX(), 1e-9);
		assertEquals(50.0, p.getY(), 1e-9);
		assertEquals(1.0, wcs.getPixelScale(), 1e-9);
	}
	
	@Test
	public void test_projection() {
		var wcs = CoordinateSystem.createInstance(CENTER, 2.0, 101, 81);
		var sky = wcs.toSky(10, 70);
		var p = wcs.toPixel(sky);
		assertEquals(10, p.getX(), 1e-6);
		assertEquals(70, p.getY(), 1e-6);
		
		// East is to the left, north is up
		assertTrue(wcs.toSky(40, 40).getRA() > CENTER.getRA());
		assertTrue(wcs.toSky(50, 60).getDec() > CENTER.getDec());
		
		// One pixel corresponds to the pixel scale
		assertEquals(2.0 / 3600.0, wcs.toSky(50, 40).separation(wcs.toSky(51, 40)), 1e-8);
	}
	
	@Test
	public void test_bounds() {
		var wcs = CoordinateSystem.createInstance(CENTER, 1.0, 101, 101);
		assertTrue(wcs.contains(CENTER));
		assertFalse(wcs.contains(new SkyCoordinate(150.0, 31.0)));
		var box = wcs.getBoundingBox();
		assertTrue(box.contains(CENTER));
		assertEquals(101.0 / 3600.0, box.getMaxDec() - box.getMinDec(), 1e-6);
	}

}
