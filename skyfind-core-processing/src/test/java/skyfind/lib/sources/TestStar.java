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

import skyfind.lib.analysis.fitting.ModelFamily;
import skyfind.lib.geom.Point2;
import skyfind.lib.images.Frame;
import skyfind.lib.objects.CatalogObject;
import skyfind.lib.objects.GalaxyAttributes;

@SuppressWarnings("javadoc")
public class TestStar {
	
	private static final double X = 32.3, Y = 31.7, SIGMA = 2.0, AMPLITUDE = 100.0;
	
	private static Frame createStarFrame() {
		return new SyntheticFrames(64, 64, 10.0, 0.5, 1L)
				.addGaussian(X, Y, AMPLITUDE, SIGMA)
				.createFrame("K", 1.0, 2.2, null);
	}
	
	private static Star createStar(Frame frame, int index, double x, double y) {
		var sky = SyntheticFrames.toSky(frame, x, y);
		return new Star(CatalogObject.star(index, sky).catalog("2MASS").build(), frame.toPixel(sky));
	}
	
	@Test
	public void test_requiresStar() {
		var frame = createStarFrame();
		var galaxy = CatalogObject.galaxy(0, SyntheticFrames.CENTER, GalaxyAttributes.builder("NGC 1").build()).build();
		assertThrows(IllegalArgumentException.class, () -> new Star(galaxy, new Point2(1, 1)));
		assertEquals(3, createStar(frame, 2, X, Y).getSegmentLabel());
	}
	
	@Test
	public void test_detectAndFit() {
		var frame = createStarFrame();
		var star = createStar(frame, 0, X, Y);
		assertEquals(X, star.getPixelPosition().getX(), 1e-6);
		assertEquals(Y, star.getPixelPosition().getY(), 1e-6);
		
		var source = star.findSource(frame, new DetectionConfig(), 10);
		assertNotNull(source);
		assertTrue(star.hasSource());
		double fwhm = SIGMA * ModelFamily.SIGMA_TO_FWHM;
		assertTrue(source.getPeak().distance(X, Y) < fwhm);
		
		var model = star.fitModel(new FittingConfig(), null, 3.0);
		assertNotNull(model);
		assertTrue(star.hasModel());
		assertEquals(ModelFamily.GAUSSIAN, model.getFamily());
		assertEquals(AMPLITUDE, model.getAmplitude(), AMPLITUDE * 0.05);
		assertEquals(fwhm, star.getFwhm(), fwhm * 0.05);
		assertTrue(star.getBestPosition().distance(X, Y) < 0.2);
		assertEquals(2 * Math.PI * SIGMA * SIGMA * AMPLITUDE, star.getFlux(), 0.05 * 2 * Math.PI * SIGMA * SIGMA * AMPLITUDE);
	}
	
	@Test
	public void test_fitRequiresSource() {
		var frame = createStarFrame();
		var star = createStar(frame, 0, X, Y);
		assertThrows(IllegalStateException.class, () -> star.fitModel(new FittingConfig(), null, 3.0));
		var unsubtracted = Source.fromCircle(frame, star.getPixelPosition(), 10, 1.5);
		assertThrows(IllegalStateException.class, () -> star.fitModel(new FittingConfig(), unsubtracted, 3.0));
	}
	
	@Test
	public void test_segmentationDetection() {
		var frame = createStarFrame();
		var star = createStar(frame, 0, X, Y);
		var config = new DetectionConfig();
		config.setMethod(DetectionMethod.SEGMENTATION);
		var source = star.findSource(frame, config, 10);
		assertNotNull(source);
		assertNotNull(source.getSegmentationMask());
		assertNotNull(source.getSubtracted());
	}
	
	@Test
	public void test_removeOnlyChangesRemovalMask() {
		var frame = createStarFrame();
		var star = createStar(frame, 0, X, Y);
		star.findSource(frame, new DetectionConfig(), 10);
		star.fitModel(new FittingConfig(), null, 3.0);
		
		var original = frame.copy();
		var source = star.remove(frame, new RemovalConfig(), 3.0, BackgroundMethod.POLYNOMIAL, true, 3.0);
		assertNotNull(source);
		assertEquals(4 * star.getModel().getSigma(), source.getRadius(), 1e-9);
		
		var cutout = source.getCutout();
		var mask = source.getRemovalMask();
		int nChanged = 0;
		for (int y = 0; y < frame.getHeight(); y++) {
			for (int x = 0; x < frame.getWidth(); x++) {
				if (frame.getValue(x, y) == original.getValue(x, y))
					continue;
				nChanged++;
				int rx = x - cutout.getX0();
				int ry = y - cutout.getY0();
				assertTrue(rx >= 0 && ry >= 0 && rx < cutout.getWidth() && ry < cutout.getHeight());
				assertTrue(mask.get(rx, ry));
			}
		}
		assertTrue(nChanged > 100);
		assertEquals(10.0, frame.getValue(32, 32), 1.5);
	}
	
	@Test
	public void test_undetectedStar() {
		var frame = createStarFrame();
		var star = createStar(frame, 1, 10, 50);
		assertNull(star.findSource(frame, new DetectionConfig(), 10));
		assertFalse(star.hasSource());
		assertTrue(Double.isNaN(star.getFlux()));
		assertTrue(Double.isNaN(star.getFwhm()));
		assertEquals(star.getPixelPosition(), star.getBestPosition());
		
		var config = new RemovalConfig();
		assertNull(star.remove(frame, config, 3.0, BackgroundMethod.POLYNOMIAL, true, 3.0));
		config.setRemoveIfUndetected(true);
		var source = star.remove(frame, config, 3.0, BackgroundMethod.POLYNOMIAL, true, 3.0);
		assertNotNull(source);
		assertEquals(4 * 3.0 / ModelFamily.SIGMA_TO_FWHM, source.getRadius(), 1e-9);
	}
	
	@Test
	public void test_removeClipSigma() {
		var config = new RemovalConfig();
		config.setRemoveIfUndetected(true);

		var clippedFrame = new SyntheticFrames(64, 64, 10.0, 0.5, 4L).createFrame("K", 1.0, 2.2, null);
		var unclippedFrame = clippedFrame.copy();
		// Hot pixel in the background box, outside the excluded inner circle
		clippedFrame.setValue(24, 24, 10000f);
		unclippedFrame.setValue(24, 24, 10000f);

		createStar(clippedFrame, 0, 32, 32).remove(clippedFrame, config, 3.0, BackgroundMethod.LOCAL_MEAN, true, 3.0);
		createStar(unclippedFrame, 0, 32, 32).remove(unclippedFrame, config, 3.0, BackgroundMethod.LOCAL_MEAN, true, 1e6);
		assertEquals(10.0, clippedFrame.getValue(32, 32), 0.3);
		assertTrue(unclippedFrame.getValue(32, 32) > 20f);
	}

	@Test
	public void test_saturation() {
		var frame = createStarFrame();
		var star = createStar(frame, 0, X, Y);
		assertNull(star.findAperture(1.0));
		
		assertTrue(star.removeSaturation(frame, new SaturationConfig(), new DetectionConfig(), 3.0));
		assertTrue(star.hasSaturation());
		assertNotNull(star.getSource().getSegmentationMask());
		assertTrue(frame.getValue(32, 32) < 15f);
		
		var aperture = star.findAperture(1.0);
		assertNotNull(aperture);
		assertTrue(aperture.getCenter().distance(X, Y) < 1.0);
		assertTrue(aperture.getSemiMajor() > 3 && aperture.getSemiMajor() < 10);
		assertEquals(aperture.getSemiMajor() * 1.5, star.findAperture(1.5).getSemiMajor(), 1e-9);
		
		int n = star.removeAperture(frame, aperture, 1.5, BackgroundMethod.LOCAL_MEAN, true, 3.0);
		assertTrue(n > 0);
	}

	@Test
	public void test_saturationAroundCatalogPosition() {
		var frame = new SyntheticFrames(64, 64, 10.0, 0.5, 1L)
				.addGaussian(20, 20, AMPLITUDE, SIGMA)
				.addGaussian(44, 44, AMPLITUDE, SIGMA)
				.createFrame("K", 1.0, 2.2, null);
		var star = createStar(frame, 0, 20, 20);

		// Source with its peak on the neighbouring star
		var source = Source.fromCircle(frame, new Point2(44, 44), 6, 1.5);
		source.estimateBackground(BackgroundMethod.POLYNOMIAL, true, 3.0);
		source.subtractBackground();
		assertEquals(1, source.locatePeaks(5.0).size());
		star.setSource(source);
		assertTrue(star.getBestPosition().distance(44, 44) < 1.0);

		assertTrue(star.removeSaturation(frame, new SaturationConfig(), new DetectionConfig(), 3.0));
		assertTrue(frame.getValue(20, 20) < 15f);
		assertTrue(frame.getValue(44, 44) > 50f);
		assertTrue(star.findAperture(1.0).getCenter().distance(20, 20) < 1.0);
	}

}
