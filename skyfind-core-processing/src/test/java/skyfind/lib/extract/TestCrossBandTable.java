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
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;

import org.junit.jupiter.api.Test;

import skyfind.lib.geom.SkyCoordinate;
import skyfind.lib.objects.CatalogObject;
import skyfind.lib.objects.GalaxyAttributes;
import skyfind.lib.objects.ObjectCatalog;
import skyfind.lib.objects.ObjectKind;
import skyfind.lib.regions.RegionList;

@SuppressWarnings("javadoc")
public class TestCrossBandTable {
	
	private static ObjectCatalog createCatalog() {
		return ObjectCatalog.createInstance(ObjectKind.GALAXY, List.of(
				CatalogObject.galaxy(0, new SkyCoordinate(150.0, 2.0), GalaxyAttributes.builder("NGC 1").principal(true).build()).build(),
				CatalogObject.galaxy(1, new SkyCoordinate(150.01, 2.0), GalaxyAttributes.builder("NGC 2").build()).build(),
				CatalogObject.galaxy(2, new SkyCoordinate(150.02, 2.0), GalaxyAttributes.builder("NGC 3").build()).build()
				));
	}
	
	private static ExtractionResult createResult(String name, DetectionRow... rows) {
		return new ExtractionResult(name, List.of(rows), new RegionList(), new RegionList(), null, null, Double.NaN, List.of());
	}
	
	@Test
	public void test_merge() {
		var results = new LinkedHashMap<String, ExtractionResult>();
		results.put("J", createResult("J", 
				new DetectionRow(0, null, true, false, Double.NaN, 100.0, false, 1, 1),
				new DetectionRow(1, null, true, false, Double.NaN, 20.0, false, 2, 2),
				DetectionRow.undetected(2, null, 3, 3)));
		results.put("K", createResult("K", 
				new DetectionRow(0, null, true, false, Double.NaN, 150.0, false, 1, 1),
				// Forced source: flux measured, but not detected
				new DetectionRow(1, null, false, false, Double.NaN, 5.0, false, 2, 2),
				new DetectionRow(2, null, true, false, Double.NaN, Double.NaN, false, 3, 3)));
		
		var table = CrossBandTable.merge(createCatalog(), results);
		assertEquals(ObjectKind.GALAXY, table.getKind());
		assertEquals(List.of("J", "K"), table.getBands());
		assertEquals(3, table.size());
		
		var row0 = table.getRow(0).orElseThrow();
		assertEquals("NGC 1", row0.name());
		assertEquals(100.0, row0.getFlux("J"));
		assertEquals(150.0, row0.getFlux("K"));
		
		var row1 = table.getRow(1).orElseThrow();
		assertEquals(20.0, row1.getFlux("J"));
		assertFalse(row1.fluxes().containsKey("K"));
		assertTrue(Double.isNaN(row1.getFlux("K")));
		
		assertTrue(table.getRow(2).orElseThrow().fluxes().isEmpty());
		assertTrue(Double.isNaN(table.getRow(2).orElseThrow().getFlux("H")));
		
		assertEquals(List.of("index", "id", "name", "ra", "dec", "J flux", "K flux"), table.getHeader());
		var tableRows = table.toTableRows();
		assertEquals(3, tableRows.size());
		assertEquals(150.0, tableRows.get(0).get(6));
		assertNull(tableRows.get(1).get(6));
	}
	
	@Test
	public void test_missingBandAndFilter() {
		var results = new LinkedHashMap<String, ExtractionResult>();
		results.put("J", createResult("J", new DetectionRow(0, null, true, false, Double.NaN, 100.0, false, 1, 1)));
		var table = CrossBandTable.merge(createCatalog(), results);
		// Every catalog object gets a row, even without results
		assertEquals(3, table.size());
		assertEquals(100.0, table.getRow(0).orElseThrow().getFlux("J"));
		
		var filtered = table.filter(r -> r.index() != 1);
		assertEquals(2, filtered.size());
		assertTrue(filtered.getRow(1).isEmpty());
		assertEquals(table.getBands(), filtered.getBands());
		assertEquals(3, table.size());
		
		var empty = CrossBandTable.merge(ObjectCatalog.empty(ObjectKind.STAR), results);
		assertEquals(0, empty.size());
		assertEquals(ObjectKind.STAR, empty.getKind());
	}

}
