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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import skyfind.lib.images.Frame;
import skyfind.lib.objects.CatalogObject;
import skyfind.lib.objects.GalaxyAttributes;
import skyfind.lib.objects.ObjectCatalog;
import skyfind.lib.objects.ObjectKind;
import skyfind.lib.regions.EllipseRegion;
import skyfind.lib.sources.Galaxy;
import skyfind.lib.sources.SyntheticFrames;

@SuppressWarnings("javadoc")
public class TestExtendedSourceFinder {
	
	private static Frame createFrame() {
		return new SyntheticFrames(96, 96, 5.0, 1.0, 3L)
				.addGaussian(40, 48, 80, 4.0)
				.addGaussian(75, 30, 50, 3.0)
				.createFrame("R", 1.0, 0.65, null);
	}
	
	static ObjectCatalog createCatalog(Frame frame) {
		return ObjectCatalog.createInstance(ObjectKind.GALAXY, List.of(
				CatalogObject.galaxy(0, SyntheticFrames.toSky(frame, 40, 48), 
						GalaxyAttributes.builder("NGC 1").principal(true).shape(0.5, 0.3, 30.0).build()).build(),
				CatalogObject.galaxy(1, SyntheticFrames.toSky(frame, 75, 30), 
						GalaxyAttributes.builder("NGC 2").shape(0.3, 0.3, 0.0).build()).build(),
				CatalogObject.galaxy(2, SyntheticFrames.toSky(frame, 20, 80), 
						GalaxyAttributes.builder("Faint").build()).build()
				));
	}
	
	@Test
	public void test_find() {
		var frame = createFrame();
		var before = frame.getValue(75, 30);
		var result = new ExtendedSourceFinder(new GalaxyConfig()).find(frame, createCatalog(frame), ObjectMasks.none());
		
		assertTrue(result.getFailures().isEmpty());
		assertEquals(3, result.getRows().size());
		var principal = result.getRow(0).orElseThrow();
		assertTrue(principal.detected());
		assertTrue(principal.flux() > 0.7 * 2 * Math.PI * 16 * 80);
		assertTrue(result.getRow(1).orElseThrow().detected());
		assertFalse(result.getRow(2).orElseThrow().detected());
		assertTrue(Double.isNaN(result.getRow(2).orElseThrow().flux()));
		assertEquals(2, result.countDetected());
		
		var segments = result.getSegments();
		assertEquals(Galaxy.PRINCIPAL_LABEL, segments.get(40, 48));
		assertEquals(Galaxy.OTHER_LABEL, segments.get(75, 30));
		assertEquals(0, segments.get(20, 80));
		
		// One point and one ellipse per galaxy
		assertEquals(6, result.getRegions().size());
		var ellipse = (EllipseRegion)result.getRegions().getShapes().get(1);
		assertEquals("NGC 1 (principal)", ellipse.getText());
		assertEquals("red", result.getRegions().getShapes().get(4).getColor());
		
		// Galaxies are not removed by default
		assertEquals(before, frame.getValue(75, 30));
	}
	
	@Test
	public void test_removeGalaxies() {
		var frame = createFrame();
		var principalBefore = frame.getValue(40, 48);
		var config = new GalaxyConfig();
		config.setRemoveGalaxies(true);
		var result = new ExtendedSourceFinder(config).find(frame, createCatalog(frame), ObjectMasks.none());
		assertTrue(result.getRow(1).orElseThrow().detected());
		assertTrue(frame.getValue(75, 30) < 20f);
		// Principal galaxy is never removed
		assertEquals(principalBefore, frame.getValue(40, 48));
	}
	
	@Test
	public void test_forcedSourceForPrincipal() {
		// Principal galaxy missing from the frame, but the catalog gives its extent
		var frame = new SyntheticFrames(96, 96, 5.0, 1.0, 5L).createFrame("R", 1.0, 0.65, null);
		var result = new ExtendedSourceFinder(new GalaxyConfig()).find(frame, createCatalog(frame), ObjectMasks.none());
		var principal = result.getRow(0).orElseThrow();
		assertFalse(principal.detected());
		assertTrue(Double.isFinite(principal.flux()));
		assertEquals(Galaxy.PRINCIPAL_LABEL, result.getSegments().get(40, 48));
		// Other galaxies get no forced source
		assertEquals(0, result.getSegments().get(75, 30));
		assertEquals(0, result.countDetected());
	}
	
	@Test
	public void test_useD25() {
		var frame = createFrame();
		var config = new GalaxyConfig();
		config.setUseD25(true);
		var result = new ExtendedSourceFinder(config).find(frame, createCatalog(frame), ObjectMasks.none());
		// Catalog ellipse used directly for galaxies with an extent
		assertTrue(result.getRow(0).orElseThrow().detected());
		// Near the end of the major axis, 120 degrees from the x axis
		assertEquals(Galaxy.PRINCIPAL_LABEL, result.getSegments().get(33, 60));
		assertFalse(result.getRow(2).orElseThrow().detected());
	}

}
