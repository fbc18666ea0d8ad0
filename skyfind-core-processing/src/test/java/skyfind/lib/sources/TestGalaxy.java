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

package skyfind.lib.sources;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import skyfind.lib.geom.Point2;
import skyfind.lib.images.Frame;
import skyfind.lib.objects.CatalogObject;
import skyfind.lib.objects.GalaxyAttributes;

@SuppressWarnings("javadoc")
public class TestGalaxy {
	
	private static Frame createGalaxyFrame() {
		return new SyntheticFrames(96, 96, 5.0, 1.0, 3L)
				.addGaussian(40, 48, 80, 4.0)
				.createFrame("R", 1.0, 0.65, null);
	}
	
	private static Galaxy createGalaxy(Frame frame, int index, double x, double y, GalaxyAttributes attributes) {
		var sky = SyntheticFrames.toSky(frame, x, y);
		return new Galaxy(CatalogObject.galaxy(index, sky, attributes).build(), frame.toPixel(sky), frame.getPixelScale());
	}
	
	@Test
	public void test_geometry() {
		var frame = createGalaxyFrame();
		var galaxy = createGalaxy(frame, 0, 40, 48, 
				GalaxyAttributes.builder("NGC 1").principal(true).shape(0.5, 0.3, 30.0).build());
		assertTrue(galaxy.isPrincipal());
		assertEquals(Galaxy.PRINCIPAL_LABEL, galaxy.getSegmentLabel());
		assertEquals(15.0, galaxy.getSemiMajor(), 1e-9);
		assertEquals(9.0, galaxy.getSemiMinor(), 1e-9);
		assertEquals(120.0, galaxy.getPixelAngle(), 1e-9);
		
		var ellipse = galaxy.toEllipse(10);
		assertEquals("green", ellipse.getColor());
		assertEquals("NGC 1 (principal)", ellipse.getText());
		
		var round = createGalaxy(frame, 1, 20, 20, GalaxyAttributes.builder("Round").shape(0.4, null, null).build());
		assertEquals(12.0, round.getSemiMinor(), 1e-9);
		assertEquals(0.0, round.getPixelAngle(), 1e-9);
		assertEquals(Galaxy.OTHER_LABEL, round.getSegmentLabel());
		
		var companion = createGalaxy(frame, 2, 20, 20, GalaxyAttributes.builder("Companion").parent("NGC 1").build());
		assertEquals(Galaxy.COMPANION_LABEL, companion.getSegmentLabel());
		assertFalse(companion.hasExtent());
		assertTrue(Double.isNaN(companion.getSemiMajor()));
		var fallback = companion.toEllipse(7);
		assertEquals("red", fallback.getColor());
		assertEquals(7.0, fallback.getSemiMajor(), 1e-9);
		assertThrows(IllegalStateException.class, () -> companion.sourceFromParameters(frame, 1.5, 1.0));
		
		var star = CatalogObject.star(3, SyntheticFrames.CENTER).build();
		assertThrows(IllegalArgumentException.class, () -> new Galaxy(star, new Point2(1, 1), 1.0));
	}
	
	@Test
	public void test_detectAndRemove() {
		var frame = createGalaxyFrame();
		var galaxy = createGalaxy(frame, 0, 40, 48, 
				GalaxyAttributes.builder("NGC 1").principal(true).shape(0.5, 0.3, 30.0).build());
		var source = galaxy.findSource(frame, new DetectionConfig());
		assertNotNull(source);
		var mask = source.getSegmentationMask();
		assertNotNull(mask);
		assertFalse(mask.touchesEdge());
		// Total flux of the profile is 2 pi sigma^2 A; the segment holds most of it
		double total = 2 * Math.PI * 16 * 80;
		assertTrue(galaxy.getFlux() > 0.7 * total);
		assertTrue(galaxy.getFlux() < 1.1 * total);
		
		int n = galaxy.remove(frame);
		assertEquals(mask.countTrue(), n);
		assertTrue(frame.getValue(40, 48) < 20f);
	}
	
	@Test
	public void test_notDetected() {
		var frame = createGalaxyFrame();
		var galaxy = createGalaxy(frame, 1, 20, 80, GalaxyAttributes.builder("Faint").build());
		assertNull(galaxy.findSource(frame, new DetectionConfig()));
		assertFalse(galaxy.hasSource());
		assertThrows(IllegalStateException.class, () -> galaxy.remove(frame));
		
		var withExtent = createGalaxy(frame, 2, 40, 48, GalaxyAttributes.builder("NGC 1").shape(0.5, 0.3, 30.0).build());
		var source = withExtent.sourceFromParameters(frame, 1.5, 1.2);
		assertEquals(18.0, source.getSemiMajor(), 1e-9);
		assertNull(source.getEstimatedBackground());
	}

}
