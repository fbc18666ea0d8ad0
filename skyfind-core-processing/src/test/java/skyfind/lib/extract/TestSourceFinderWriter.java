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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import skyfind.lib.images.Frame;
import skyfind.lib.io.FitsIO;
import skyfind.lib.objects.ObjectCatalog;
import skyfind.lib.objects.ObjectKind;
import skyfind.lib.sources.SyntheticFrames;

@SuppressWarnings("javadoc")
public class TestSourceFinderWriter {
	
	@TempDir
	Path tempDir;
	
	@Test
	public void test_write() throws IOException {
		var frames = new LinkedHashMap<String, Frame>();
		frames.put("J", new SyntheticFrames(48, 40, 10.0, 0.5, 1L)
				.addGaussian(20, 20, 50, 2.0)
				.createFrame("J", 1.0, 1.25, null));
		frames.put("K", new SyntheticFrames(48, 40, 10.0, 0.5, 2L)
				.createFrame("K", 1.0, 2.2, null));
		var galaxies = ObjectCatalog.empty(ObjectKind.GALAXY);
		var stars = ObjectCatalog.empty(ObjectKind.STAR);
		var finder = new SourceFinder(frames, new TestSourceFinder.StaticCatalogSource(galaxies, stars), SourceFinderConfig.createDefault());
		var result = finder.run();
		
		var dir = tempDir.resolve("output");
		new SourceFinderWriter(dir).write(result);
		
		for (var name : List.of("galaxies.json", "stars.json", "galaxies.tsv", "stars.tsv", "diagnostics.json"))
			assertTrue(Files.isRegularFile(dir.resolve(name)), name);
		for (var stage : List.of(SourceFinder.STAGE_GALAXIES, SourceFinder.STAGE_STARS, SourceFinder.STAGE_OTHER)) {
			for (var band : List.of("J", "K")) {
				String base = band + "_" + stage;
				assertTrue(Files.isRegularFile(dir.resolve("regions").resolve(base + ".reg")), base);
				assertTrue(Files.isRegularFile(dir.resolve("segments").resolve(base + ".fits")), base);
				assertTrue(Files.isRegularFile(dir.resolve("tables").resolve(base + ".tsv")), base);
			}
		}
		assertFalse(Files.exists(dir.resolve("regions").resolve("J_stars_saturation.reg")));
		
		var frame = FitsIO.readFrame(dir.resolve("frames").resolve("J.fits").toFile());
		assertEquals(48, frame.getWidth());
		assertEquals(40, frame.getHeight());
		assertEquals(finder.getFrame("J").getValue(20, 20), frame.getValue(20, 20));
		
		var segments = FitsIO.readSegmentationMap(dir.resolve("segments").resolve("J_other.fits").toFile());
		assertEquals(1, segments.get(20, 20));
		
		assertEquals("[]", Files.readString(dir.resolve("diagnostics.json")).strip());
		var header = Files.readAllLines(dir.resolve("tables").resolve("J_other.tsv")).get(0);
		assertEquals("index\tid\tdetected\tmodeled\tfwhm\tflux\tsaturation\tx\ty", header);
	}

}
