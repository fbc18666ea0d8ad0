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
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import skyfind.lib.io.FitsIO;
import skyfind.lib.sources.SyntheticFrames;

@SuppressWarnings("javadoc")
public class TestFrameLoader {
	
	@TempDir
	Path tempDir;
	
	@Test
	public void test_loadDirectory() throws IOException {
		var frames = new SyntheticFrames(16, 12, 1.0, 0.1, 1L);
		FitsIO.writeFrame(frames.createFrame("K", 1.0, 2.2, null), tempDir.resolve("b_image.fits").toFile());
		FitsIO.writeFrame(frames.createFrame("J", 1.0, 1.25, 2.0), tempDir.resolve("a_image.FIT").toFile());
		Files.writeString(tempDir.resolve("notes.txt"), "not a frame");
		
		var loaded = FrameLoader.loadDirectory(tempDir);
		assertEquals(List.of("J", "K"), List.copyOf(loaded.keySet()));
		assertEquals(16, loaded.get("K").getWidth());
		assertEquals(2.0, loaded.get("J").getPsfFwhmPixels(), 1e-9);
	}
	
	@Test
	public void test_invalidDirectory() throws IOException {
		var frames = new SyntheticFrames(16, 12, 1.0, 0.1, 1L);
		FitsIO.writeFrame(frames.createFrame("K", 1.0, 2.2, null), tempDir.resolve("first.fits").toFile());
		FitsIO.writeFrame(frames.createFrame("K", 1.0, 2.2, null), tempDir.resolve("second.fits").toFile());
		assertThrows(IOException.class, () -> FrameLoader.loadDirectory(tempDir));
		assertThrows(IOException.class, () -> FrameLoader.loadDirectory(tempDir.resolve("first.fits")));
	}

}
