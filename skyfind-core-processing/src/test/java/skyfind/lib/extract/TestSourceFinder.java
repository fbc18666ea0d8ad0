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
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

import skyfind.lib.catalog.CatalogSource;
import skyfind.lib.geom.SkyBoundingBox;
import skyfind.lib.images.Frame;
import skyfind.lib.images.Mask;
import skyfind.lib.objects.CatalogObject;
import skyfind.lib.objects.ObjectCatalog;
import skyfind.lib.objects.ObjectKind;
import skyfind.lib.sources.Galaxy;
import skyfind.lib.sources.SyntheticFrames;

@SuppressWarnings("javadoc")
public class TestSourceFinder {
	
	static class StaticCatalogSource implements CatalogSource {
		
		private final ObjectCatalog galaxies;
		private final ObjectCatalog stars;
		
		StaticCatalogSource(ObjectCatalog galaxies, ObjectCatalog stars) {
			this.galaxies = galaxies;
			this.stars = stars;
		}

		@Override
		public ObjectCatalog getExtendedSourceCatalog(SkyBoundingBox box) throws IOException {
			if (galaxies == null)
				throw new IOException("Galaxy catalog service unavailable");
			return galaxies;
		}

		@Override
		public ObjectCatalog getPointSourceCatalog(SkyBoundingBox box, double minPixelScale, List<String> catalogNames) throws IOException {
			if (stars == null)
				throw new IOException("Star catalog service unavailable");
			return stars;
		}
		
	}
	
	private static Map<String, Frame> createGalaxyFrames() {
		var frames = new LinkedHashMap<String, Frame>();
		frames.put("R", new SyntheticFrames(96, 96, 5.0, 1.0, 3L)
				.addGaussian(40, 48, 80, 4.0)
				.addGaussian(75, 30, 50, 3.0)
				.createFrame("R", 1.0, 0.65, null));
		frames.put("K", new SyntheticFrames(96, 96, 5.0, 1.0, 7L)
				.addGaussian(40, 48, 60, 4.0)
				.createFrame("K", 1.0, 2.2, null));
		return frames;
	}
	
	private static SourceFinderConfig createConfig() throws IOException {
		return SourceFinderConfig.createDefault();
	}
	
	@Test
	public void test_run() throws IOException {
		var frames = createGalaxyFrames();
		var galaxies = TestExtendedSourceFinder.createCatalog(frames.get("R"));
		var source = new StaticCatalogSource(galaxies, ObjectCatalog.empty(ObjectKind.STAR));
		var finder = new SourceFinder(frames, source, createConfig());
		var result = finder.run();
		
		assertTrue(result.getDiagnostics().getFailedFrames(SourceFinder.STAGE_GALAXIES).isEmpty());
		assertTrue(result.getDiagnostics().getEntries().stream().noneMatch(e -> e.isStageFailure()));
		
		var table = result.getGalaxyTable();
		assertEquals(List.of("R", "K"), table.getBands());
		assertEquals(galaxies.size(), table.size());
		var principal = table.getRow(0).orElseThrow();
		assertEquals(Set.of("R", "K"), principal.fluxes().keySet());
		assertTrue(principal.getFlux("R") > principal.getFlux("K"));
		assertEquals(Set.of("R"), table.getRow(1).orElseThrow().fluxes().keySet());
		assertTrue(table.getRow(2).orElseThrow().fluxes().isEmpty());
		
		assertEquals(2, result.getGalaxyResults().size());
		var segments = result.getGalaxyResults().get("R").getSegments();
		assertEquals(Galaxy.PRINCIPAL_LABEL, segments.get(40, 48));
		assertEquals(Galaxy.OTHER_LABEL, segments.get(75, 30));
		
		// No stars: default FWHM is used for the search for other sources
		assertEquals(0, result.getStarTable().size());
		assertEquals(2, result.getStarResults().size());
		assertEquals(3.0, result.getStarResults().get("K").getFwhm(), 1e-9);
		assertEquals(3.0, finder.getFwhm("K"), 1e-9);
		assertEquals(2, result.getOtherResults().size());
		assertEquals(List.of("R", "K"), List.copyOf(result.getOtherResults().keySet()));
		
		// Frames of the result are the processed copies
		assertNotSame(frames.get("R"), finder.getFrame("R"));
		assertEquals(frames.get("R").getWidth(), finder.getFrame("R").getWidth());
	}
	
	@Test
	public void test_emptyCatalogs() throws IOException {
		var frames = createGalaxyFrames();
		var source = new StaticCatalogSource(ObjectCatalog.empty(ObjectKind.GALAXY), ObjectCatalog.empty(ObjectKind.STAR));
		var result = new SourceFinder(frames, source, createConfig()).run();
		assertEquals(0, result.getGalaxyTable().size());
		assertEquals(0, result.getStarTable().size());
		assertEquals(2, result.getGalaxyResults().size());
		assertEquals(2, result.getOtherResults().size());
		assertTrue(result.getDiagnostics().isEmpty());
	}
	
	@Test
	public void test_corruptedFrame() throws IOException {
		var frames = createGalaxyFrames();
		frames.put("H", new SyntheticFrames(96, 96, 5.0, 1.0, 8L).fill(Float.NaN).createFrame("H", 1.0, 1.65, null));
		var galaxies = TestExtendedSourceFinder.createCatalog(frames.get("R"));
		var result = new SourceFinder(frames, new StaticCatalogSource(galaxies, ObjectCatalog.empty(ObjectKind.STAR)), createConfig()).run();
		
		var diagnostics = result.getDiagnostics();
		assertEquals(Set.of("H"), diagnostics.getFailedFrames(SourceFinder.STAGE_GALAXIES));
		assertEquals(Set.of("H"), diagnostics.getFailedFrames(SourceFinder.STAGE_STARS));
		assertEquals(Set.of("H"), diagnostics.getFailedFrames(SourceFinder.STAGE_OTHER));
		assertTrue(diagnostics.getEntries(SourceFinder.STAGE_GALAXIES).stream()
				.anyMatch(e -> e.isFrameFailure() && "H".equals(e.frameName()) && e.message().contains("no finite pixels")));
		
		// Other frames are unaffected
		assertEquals(List.of("R", "K"), result.getGalaxyTable().getBands());
		assertEquals(Set.of("R", "K"), result.getGalaxyResults().keySet());
		assertEquals(Set.of("R", "K"), result.getGalaxyTable().getRow(0).orElseThrow().fluxes().keySet());
		assertEquals(3, result.getFrames().size());
	}
	
	@Test
	public void test_catalogFailure() throws IOException {
		var frames = createGalaxyFrames();
		var source = new StaticCatalogSource(null, ObjectCatalog.empty(ObjectKind.STAR));
		var result = new SourceFinder(frames, source, createConfig()).run();
		
		var entries = result.getDiagnostics().getEntries(SourceFinder.STAGE_GALAXIES);
		assertEquals(1, entries.size());
		assertTrue(entries.get(0).isStageFailure());
		assertFalse(entries.get(0).isFrameFailure());
		assertNull(result.getGalaxyTable());
		assertTrue(result.getGalaxyResults().isEmpty());
		
		// Later stages still run
		assertNotNull(result.getStarTable());
		assertEquals(2, result.getStarResults().size());
		assertEquals(2, result.getOtherResults().size());
		
		var finder = new SourceFinder(frames, null, createConfig());
		assertThrows(IOException.class, () -> finder.findGalaxies());
	}
	
	@Test
	public void test_providedCatalogsAndMasks() throws IOException {
		var frames = createGalaxyFrames();
		var finder = new SourceFinder(frames, null, createConfig());
		finder.setGalaxyCatalog(TestExtendedSourceFinder.createCatalog(frames.get("R")));
		finder.setStarCatalog(ObjectCatalog.empty(ObjectKind.STAR));
		assertThrows(IllegalArgumentException.class, () -> finder.setMasks("J", ObjectMasks.none()));
		
		var bad = Mask.createEmpty(96, 96).inverse();
		finder.setMasks("K", new ObjectMasks(null, null, bad));
		var result = finder.run();
		assertTrue(result.getDiagnostics().getEntries().stream().noneMatch(e -> e.isStageFailure()));
		var principal = result.getGalaxyTable().getRow(0).orElseThrow();
		assertEquals(Set.of("R"), principal.fluxes().keySet());
		assertNotNull(finder.getBoundingBox());
	}
	
	@Test
	public void test_starStage() throws IOException {
		var frames = new LinkedHashMap<String, Frame>();
		frames.put("J", new SyntheticFrames(96, 96, 10.0, 0.5, 9L)
				.addGaussian(30.3, 30.6, 100, 1.5)
				.addGaussian(70.4, 69.7, 80, 1.5)
				.createFrame("J", 1.0, 1.25, null));
		frames.put("K", new SyntheticFrames(96, 96, 10.0, 0.5, 10L)
				.addGaussian(30.3, 30.6, 10, 1.5)
				.createFrame("K", 1.0, 2.2, null));
		frames.put("W3", new SyntheticFrames(96, 96, 10.0, 0.5, 11L)
				.createFrame("W3", 1.0, 12.0, null));
		frames.put("W4", new SyntheticFrames(96, 96, 10.0, 0.5, 12L)
				.createFrame("W4", 1.0, 30.0, null));
		var frame = frames.get("J");
		var stars = ObjectCatalog.createInstance(ObjectKind.STAR, List.of(
				CatalogObject.star(0, SyntheticFrames.toSky(frame, 30.3, 30.6)).catalog("2MASS").build(),
				CatalogObject.star(1, SyntheticFrames.toSky(frame, 70.4, 69.7)).catalog("2MASS").build()
				));
		var config = createConfig();
		config.setColourWindows(List.of(new ColourWindow("J", "K", -1.0, 1.0)));
		var source = new StaticCatalogSource(ObjectCatalog.empty(ObjectKind.GALAXY), stars);
		var finder = new SourceFinder(frames, source, config);
		var result = finder.run();
		
		// Frames beyond the wavelength cutoff are skipped
		assertEquals(Set.of("J", "K", "W3"), result.getStarResults().keySet());
		assertEquals(List.of("J", "K", "W3"), result.getStarTable().getBands());
		
		// Star 0 is much brighter in J than in K, giving a colour of about -2.5
		assertEquals(List.of(0), result.getRejectedStars());
		assertEquals(1, result.getStarTable().size());
		assertTrue(result.getStarTable().getRow(1).isPresent());
		
		var j = result.getStarResults().get("J");
		assertTrue(j.getRow(0).orElseThrow().modeled());
		assertEquals(1.5 * 2.3548, j.getFwhm(), 0.2);
		assertEquals(j.getFwhm(), finder.getFwhm("J"), 1e-9);
		// Stars are removed before searching for other sources
		assertTrue(finder.getFrame("J").getValue(30, 31) < 13f);
		assertTrue(result.getOtherResults().get("J").getRows().isEmpty());
	}
	
}
