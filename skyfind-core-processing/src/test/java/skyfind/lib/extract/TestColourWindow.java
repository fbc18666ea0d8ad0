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
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestColourWindow {
	
	@Test
	public void test_colour() {
		assertEquals(-2.5, ColourWindow.colour(100, 10), 1e-12);
		assertEquals(0.0, ColourWindow.colour(3, 3), 1e-12);
		assertTrue(Double.isNaN(ColourWindow.colour(0, 10)));
		assertTrue(Double.isNaN(ColourWindow.colour(10, Double.NaN)));
	}
	
	@Test
	public void test_accepts() {
		var window = new ColourWindow("J", "K", -1.0, 1.0);
		window.validate();
		assertTrue(window.accepts(10, 10));
		assertFalse(window.accepts(100, 10));
		assertFalse(window.accepts(10, 100));
		// Colour cannot be evaluated
		assertTrue(window.accepts(Double.NaN, 10));
		assertTrue(window.accepts(-5, 10));
		
		assertThrows(IllegalArgumentException.class, () -> new ColourWindow("J", "K", 1.0, 1.0).validate());
		assertThrows(IllegalArgumentException.class, () -> new ColourWindow("J", null, 0.0, 1.0).validate());
	}
	
	@Test
	public void test_fwhmMeasure() {
		var values = List.of(3.0, 4.0, 8.0);
		assertEquals(8.0, FwhmMeasure.MAX.combine(values), 1e-12);
		assertEquals(5.0, FwhmMeasure.MEAN.combine(values), 1e-12);
		assertEquals(4.0, FwhmMeasure.MEDIAN.combine(values), 1e-12);
		assertTrue(Double.isNaN(FwhmMeasure.MAX.combine(List.of())));
	}

}
