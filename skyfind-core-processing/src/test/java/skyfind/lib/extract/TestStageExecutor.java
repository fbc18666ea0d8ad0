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
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;

import org.junit.jupiter.api.Test;

import skyfind.lib.regions.RegionList;

@SuppressWarnings("javadoc")
public class TestStageExecutor {
	
	private static ExtractionResult createResult(String name) {
		return new ExtractionResult(name, List.of(), new RegionList(), new RegionList(), null, null, 2.5, List.of());
	}
	
	@Test
	public void test_run() {
		Map<String, String> threadNames = new ConcurrentHashMap<>();
		var tasks = new LinkedHashMap<String, Callable<ExtractionResult>>();
		for (var name : List.of("J", "H", "K")) {
			tasks.put(name, () -> {
				threadNames.put(name, Thread.currentThread().getName());
				return createResult(name);
			});
		}
		tasks.put("broken", () -> {
			throw new IllegalArgumentException("Frame broken contains no finite pixels");
		});
		
		var results = new StageExecutor(2).run("test", tasks);
		assertEquals(4, results.size());
		for (var name : List.of("J", "H", "K")) {
			var result = results.get(name);
			assertTrue(result.isCompleted());
			assertEquals(name, result.getResult().getFrameName());
			assertNull(result.getError());
			assertTrue(threadNames.get(name).startsWith("skyfind-test-"));
		}
		var failed = results.get("broken");
		assertFalse(failed.isCompleted());
		assertNull(failed.getResult());
		assertEquals("Frame broken contains no finite pixels", failed.getError());
	}
	
	@Test
	public void test_emptyAndDefaultThreads() {
		assertTrue(new StageExecutor(2).run("empty", Map.of()).isEmpty());
		var results = new StageExecutor(0).run("default", Map.<String, Callable<ExtractionResult>>of("J", () -> createResult("J")));
		assertTrue(results.get("J").isCompleted());
	}

}
