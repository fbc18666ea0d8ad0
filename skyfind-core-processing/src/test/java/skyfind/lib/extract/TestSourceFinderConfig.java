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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import skyfind.lib.analysis.fitting.ModelFamily;
import skyfind.lib.io.GsonTools;
import skyfind.lib.sources.BackgroundMethod;
import skyfind.lib.sources.DetectionMethod;
import skyfind.lib.sources.FluxCutoff;
import skyfind.lib.sources.SaturationMethod;

@SuppressWarnings("javadoc")
public class TestSourceFinderConfig {
	
	@TempDir
	Path tempDir;
	
	@Test
	public void test_defaults() throws IOException {
		var config = SourceFinderConfig.createDefault();
		config.validate();
		assertEquals(2, config.getProcesses());
		assertEquals(25.0, config.getStarWavelengthCutoff());
		assertTrue(config.getColourWindows().isEmpty());
		
		assertEquals(DetectionMethod.SEGMENTATION, config.getGalaxies().getDetection().getMethod());
		assertFalse(config.getGalaxies().isUseD25());
		
		var stars = config.getStars();
		assertEquals(DetectionMethod.PEAKS, stars.getDetection().getMethod());
		assertEquals(BackgroundMethod.POLYNOMIAL, stars.getDetection().getBackgroundMethod());
		assertEquals(List.of(ModelFamily.GAUSSIAN, ModelFamily.MOFFAT, ModelFamily.AIRY), stars.getFitting().getModels());
		assertEquals(FwhmMeasure.MAX, stars.getFwhmMeasure());
		assertEquals(RegionAnnotation.FLUX, stars.getAnnotation());
		assertEquals(SaturationMethod.BRIGHTEST, stars.getSaturation().getMethod());
		assertEquals(FluxCutoff.PERCENTAGE, stars.getSaturation().getCutoff());
		assertEquals(4.0, stars.getRemoval().getSigmaLevel());
		
		assertTrue(config.getOtherSources().isFind());
	}
	
	@Test
	public void test_partialFileKeepsDefaults() throws IOException {
		var path = tempDir.resolve("config.json");
		Files.writeString(path, "{\"processes\": 4, \"stars\": {\"defaultFwhm\": 2.5, \"fwhmMeasure\": \"median\"}}");
		var config = SourceFinderConfig.read(path);
		config.validate();
		assertEquals(4, config.getProcesses());
		assertEquals(2.5, config.getStars().getDefaultFwhm());
		assertEquals(FwhmMeasure.MEDIAN, config.getStars().getFwhmMeasure());
		// Sections not given in the file keep their defaults
		assertEquals(DetectionMethod.PEAKS, config.getStars().getDetection().getMethod());
		assertEquals(1.6, config.getStars().getRemoval().getOuterFactor());
		assertEquals(DetectionMethod.SEGMENTATION, config.getGalaxies().getDetection().getMethod());
	}
	
	@Test
	public void test_writeAndRead() throws IOException {
		var config = new SourceFinderConfig();
		config.setProcesses(3);
		config.setColourWindows(List.of(new ColourWindow("J", "K", -0.5, 1.5)));
		config.getStars().setAnnotation(RegionAnnotation.HAS_SOURCE);
		var path = tempDir.resolve("written.json");
		config.write(path);
		assertTrue(Files.readString(path).contains("\"has_source\""));
		
		var read = SourceFinderConfig.read(path);
		read.validate();
		assertEquals(3, read.getProcesses());
		assertEquals("K", read.getColourWindows().get(0).getBandB());
		assertEquals(RegionAnnotation.HAS_SOURCE, read.getStars().getAnnotation());
	}
	
	@Test
	public void test_invalidSettings() {
		assertInvalid("{\"stars\": {\"saturation\": {\"method\": \"bogus\"}}}");
		assertInvalid("{\"stars\": {\"fwhmMeasure\": \"mode\"}}");
		assertInvalid("{\"galaxies\": {\"detection\": {\"innerFactor\": 1.5, \"outerFactor\": 1.2}}}");
		assertInvalid("{\"stars\": {\"detection\": {\"method\": \"wavelets\"}}}");
		assertInvalid("{\"stars\": {\"fitting\": {\"models\": [\"gaussian\", \"sersic\"]}}}");
		assertInvalid("{\"processes\": 0}");
		assertInvalid("{\"colourWindows\": [{\"bandA\": \"J\", \"bandB\": \"K\", \"min\": 1.0, \"max\": 0.0}]}");
	}
	
	@Test
	public void test_invalidConfigRejectedBeforeProcessing() {
		var config = GsonTools.getInstance().fromJson("{\"processes\": -1}", SourceFinderConfig.class);
		assertThrows(IllegalArgumentException.class, () -> new SourceFinder(Map.of(), null, config));
	}
	
	private static void assertInvalid(String json) {
		var config = GsonTools.getInstance().fromJson(json, SourceFinderConfig.class);
		assertThrows(IllegalArgumentException.class, () -> config.validate(), json);
	}

}
