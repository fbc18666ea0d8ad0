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
import static org.junit.jupiter.api.Assertions.assertNull;

import org.junit.jupiter.api.Test;

import skyfind.lib.geom.Point2;
import skyfind.lib.images.Mask;

@SuppressWarnings("javadoc")
public class TestPixelMoments {
	
	@Test
	public void test_empty() {
		var moments = new PixelMoments();
		assertEquals(0, moments.getCount());
		assertNull(moments.getCentroid());
		assertNull(moments.toEllipse(1.0, 1.0, "red", null));
		assertNull(EllipseRegion.fromMask(Mask.createEmpty(5, 5), 0, 0, 1.0, 1.0, "red", null));
	}
	
	@Test
	public void test_ellipseFromMask() {
		var mask = Mask.createEllipse(60, 60, new Point2(30, 30), 12, 6, 30);
		var ellipse = EllipseRegion.fromMask(mask, 100, 200, 1.0, 1.0, "white", "aperture");
		assertEquals(130, ellipse.getCenter().getX(), 0.05);
		assertEquals(230, ellipse.getCenter().getY(), 0.05);
		assertEquals(12, ellipse.getSemiMajor(), 0.5);
		assertEquals(6, ellipse.getSemiMinor(), 0.5);
		assertEquals(30, ellipse.getAngle(), 2.0);
		assertEquals("aperture", ellipse.getText());
		
		// Accumulating the same pixels directly gives the same ellipse
		var moments = new PixelMoments();
		for (int y = 0; y < 60; y++) {
			for (int x = 0; x < 60; x++) {
				if (mask.get(x, y))
					moments.add(x + 100, y + 200);
			}
		}
		assertEquals(mask.countTrue(), moments.getCount());
		var direct = moments.toEllipse(2.0, 1.0, "white", null);
		assertEquals(ellipse.getSemiMajor() * 2, direct.getSemiMajor(), 1e-9);
		assertEquals(ellipse.getAngle(), direct.getAngle(), 1e-9);
	}
	
	@Test
	public void test_minAxis() {
		var moments = new PixelMoments();
		moments.add(3, 4);
		var ellipse = moments.toEllipse(1.0, 1.5, "red", null);
		assertEquals(new Point2(3, 4), ellipse.getCenter());
		assertEquals(1.5, ellipse.getSemiMajor(), 1e-12);
		assertEquals(1.5, ellipse.getSemiMinor(), 1e-12);
	}

}
