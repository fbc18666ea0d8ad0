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

package skyfind.lib.io;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import nom.tam.util.ArrayFuncs;
import nom.tam.util.BufferedFile;
import skyfind.lib.images.CoordinateSystem;
import skyfind.lib.images.Frame;
import skyfind.lib.images.PhotometricFilter;
import skyfind.lib.images.SegmentationMap;

/**
 * Read and write frames and segmentation maps as FITS files.
 * <p>
 * A frame file contains the pixel values in its first 2D image HDU, with a TAN WCS 
 * (CRPIX, CRVAL and either CD or CDELT keywords) and the keywords FILTER, WAVELEN (micron) 
 * and optionally PSFFWHM (arcsec). A second 2D image HDU, if present, is read as the error map.
 * 
 * @author SkyFind developers
 */
public class FitsIO {
	
	private static final Logger logger = LoggerFactory.getLogger(FitsIO.class);
	
	/**
	 * Header keyword for the filter name.
	 */
	public static final String KEY_FILTER = "FILTER";
	
	/**
	 * Header keyword for the filter wavelength, in micron.
	 */
	public static final String KEY_WAVELENGTH = "WAVELEN";
	
	/**
	 * Header keyword for the PSF FWHM, in arcseconds.
	 */
	public static final String KEY_PSF_FWHM = "PSFFWHM";
	
	/**
	 * Read a frame from a FITS file. The frame name is the file name without extension.
	 * @param file
	 * @return
	 * @throws IOException if the file cannot be read or lacks required keywords
	 */
	public static Frame readFrame(File file) throws IOException {
		String name = file.getName();
		int dot = name.lastIndexOf('.');
		if (dot > 0)
			name = name.substring(0, dot);
		
		try (Fits fits = new Fits(file)) {
			List<BasicHDU<?>> images = new ArrayList<>();
			BasicHDU<?> hdu;
			while ((hdu = fits.readHDU()) != null) {
				int[] axes = hdu.getAxes();
				if (axes != null && axes.length == 2)
					images.add(hdu);
			}
			if (images.isEmpty())
				throw new IOException("No 2D image found in " + file);
			
			var primary = images.get(0);
			float[][] values = toFloatArray(primary.getKernel());
			int height = values.length;
			int width = values[0].length;
			Header header = primary.getHeader();
			
			var wcs = readCoordinateSystem(header, width, height);
			String filterName = header.getStringValue(KEY_FILTER);
			if (filterName == null)
				filterName = name;
			double wavelength = header.getDoubleValue(KEY_WAVELENGTH, Double.NaN);
			if (!(wavelength > 0))
				throw new IOException("Missing or invalid " + KEY_WAVELENGTH + " keyword in " + file);
			Double psf = header.containsKey(KEY_PSF_FWHM) ? header.getDoubleValue(KEY_PSF_FWHM) : null;
			var filter = new PhotometricFilter(filterName, wavelength, psf);
			
			float[] errors = null;
			if (images.size() > 1) {
				float[][] errorValues = toFloatArray(images.get(1).getKernel());
				if (errorValues.length == height && errorValues[0].length == width)
					errors = flatten(errorValues);
				else
					logger.warn("Ignoring error map in {} with mismatched dimensions", file);
			}
			logger.debug("Read {} ({}x{}, filter {})", file, width, height, filter);
			return new Frame(name, flatten(values), width, height, wcs, filter, errors);
		} catch (FitsException e) {
			throw new IOException("Unable to read FITS file " + file + ": " + e.getMessage(), e);
		}
	}
	
	/**
	 * Write a frame (and its error map, if present) to a FITS file, replacing any existing file.
	 * @param frame
	 * @param file
	 * @throws IOException
	 */
	public static void writeFrame(Frame frame, File file) throws IOException {
		int w = frame.getWidth();
		int h = frame.getHeight();
		try (Fits fits = new Fits()) {
			BasicHDU<?> hdu = Fits.makeHDU(unflatten(frame.getArray(false), w, h));
			Header header = hdu.getHeader();
			writeCoordinateSystem(header, frame.getCoordinateSystem());
			var filter = frame.getFilter();
			header.addValue(KEY_FILTER, filter.getName(), "Filter name");
			header.addValue(KEY_WAVELENGTH, filter.getWavelength(), "Filter wavelength [micron]");
			if (filter.getPsfFwhm() != null)
				header.addValue(KEY_PSF_FWHM, filter.getPsfFwhm(), "PSF FWHM [arcsec]");
			fits.addHDU(hdu);
			if (frame.hasErrors())
				fits.addHDU(Fits.makeHDU(unflatten(frame.getErrors(), w, h)));
			write(fits, file);
		} catch (FitsException e) {
			throw new IOException("Unable to write FITS file " + file + ": " + e.getMessage(), e);
		}
	}
	
	/**
	 * Write a segmentation map as a 32-bit integer FITS image, replacing any existing file.
	 * @param map
	 * @param wcs coordinate system to record in the header, or null
	 * @param file
	 * @throws IOException
	 */
	public static void writeSegmentationMap(SegmentationMap map, CoordinateSystem wcs, File file) throws IOException {
		int w = map.getWidth();
		int h = map.getHeight();
		int[] labels = map.toArray();
		int[][] data = new int[h][w];
		for (int y = 0; y < h; y++)
			System.arraycopy(labels, y * w, data[y], 0, w);
		try (Fits fits = new Fits()) {
			BasicHDU<?> hdu = Fits.makeHDU(data);
			if (wcs != null)
				writeCoordinateSystem(hdu.getHeader(), wcs);
			fits.addHDU(hdu);
			write(fits, file);
		} catch (FitsException e) {
			throw new IOException("Unable to write FITS file " + file + ": " + e.getMessage(), e);
		}
	}
	
	/**
	 * Read a segmentation map written by {@link #writeSegmentationMap(SegmentationMap, CoordinateSystem, File)}.
	 * @param file
	 * @return
	 * @throws IOException
	 */
	public static SegmentationMap readSegmentationMap(File file) throws IOException {
		try (Fits fits = new Fits(file)) {
			BasicHDU<?> hdu = fits.getHDU(0);
			if (hdu == null)
				throw new IOException("No image found in " + file);
			int[][] data = (int[][])ArrayFuncs.convertArray(hdu.getKernel(), int.class, true);
			int h = data.length;
			int w = data[0].length;
			int[] labels = new int[w * h];
			for (int y = 0; y < h; y++)
				System.arraycopy(data[y], 0, labels, y * w, w);
			return SegmentationMap.createInstance(labels, w, h);
		} catch (FitsException e) {
			throw new IOException("Unable to read FITS file " + file + ": " + e.getMessage(), e);
		}
	}
	
	private static void write(Fits fits, File file) throws IOException, FitsException {
		Files.deleteIfExists(file.toPath());
		try (var out = new BufferedFile(file, "rw")) {
			fits.write(out);
		}
	}
	
	static CoordinateSystem readCoordinateSystem(Header header, int width, int height) throws IOException {
		if (!header.containsKey("CRVAL1") || !header.containsKey("CRVAL2"))
			throw new IOException("Missing CRVAL keywords");
		double crpix1 = header.getDoubleValue("CRPIX1", (width + 1) / 2.0);
		double crpix2 = header.getDoubleValue("CRPIX2", (height + 1) / 2.0);
		double crval1 = header.getDoubleValue("CRVAL1");
		double crval2 = header.getDoubleValue("CRVAL2");
		double cd11, cd12, cd21, cd22;
		if (header.containsKey("CD1_1")) {
			cd11 = header.getDoubleValue("CD1_1");
			cd12 = header.getDoubleValue("CD1_2", 0);
			cd21 = header.getDoubleValue("CD2_1", 0);
			cd22 = header.getDoubleValue("CD2_2");
		} else if (header.containsKey("CDELT1") && header.containsKey("CDELT2")) {
			double rotation = Math.toRadians(header.getDoubleValue("CROTA2", 0));
			double cdelt1 = header.getDoubleValue("CDELT1");
			double cdelt2 = header.getDoubleValue("CDELT2");
			cd11 = cdelt1 * Math.cos(rotation);
			cd12 = -cdelt2 * Math.sin(rotation);
			cd21 = cdelt1 * Math.sin(rotation);
			cd22 = cdelt2 * Math.cos(rotation);
		} else
			throw new IOException("Missing CD or CDELT keywords");
		try {
			return new CoordinateSystem(width, height, crpix1, crpix2, crval1, crval2, cd11, cd12, cd21, cd22);
		} catch (IllegalArgumentException e) {
			throw new IOException("Invalid coordinate system: " + e.getMessage(), e);
		}
	}
	
	static void writeCoordinateSystem(Header header, CoordinateSystem wcs) throws FitsException {
		header.addValue("CTYPE1", "RA---TAN", "Gnomonic projection");
		header.addValue("CTYPE2", "DEC--TAN", "Gnomonic projection");
		header.addValue("CRPIX1", wcs.getCrpix1(), "Reference pixel x");
		header.addValue("CRPIX2", wcs.getCrpix2(), "Reference pixel y");
		header.addValue("CRVAL1", wcs.getCrval1(), "Reference RA [deg]");
		header.addValue("CRVAL2", wcs.getCrval2(), "Reference Dec [deg]");
		double[] cd = wcs.getCDMatrix();
		header.addValue("CD1_1", cd[0], "");
		header.addValue("CD1_2", cd[1], "");
		header.addValue("CD2_1", cd[2], "");
		header.addValue("CD2_2", cd[3], "");
	}
	
	private static float[][] toFloatArray(Object kernel) throws IOException {
		if (kernel == null)
			throw new IOException("Image HDU contains no data");
		var converted = ArrayFuncs.convertArray(kernel, float.class, true);
		if (!(converted instanceof float[][] values) || values.length == 0 || values[0].length == 0)
			throw new IOException("Expected a non-empty 2D image");
		return values;
	}
	
	private static float[] flatten(float[][] values) {
		int h = values.length;
		int w = values[0].length;
		float[] pixels = new float[w * h];
		for (int y = 0; y < h; y++)
			System.arraycopy(values[y], 0, pixels, y * w, w);
		return pixels;
	}
	
	private static float[][] unflatten(float[] pixels, int w, int h) {
		float[][] values = new float[h][w];
		for (int y = 0; y < h; y++)
			System.arraycopy(pixels, y * w, values[y], 0, w);
		return values;
	}

}
