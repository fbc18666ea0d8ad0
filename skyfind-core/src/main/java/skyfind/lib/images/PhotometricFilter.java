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

package skyfind.lib.images;

import java.io.Serializable;
import java.util.Objects;

/**
 * The band in which a frame was observed.
 * 
 * @author SkyFind developers
 */
public final class PhotometricFilter implements Serializable {
	
	private static final long serialVersionUID = 1L;

	private final String name;
	private final double wavelength;
	private final Double psfFwhm;
	
	/**
	 * Create a filter.
	 * @param name name of the filter, e.g. "2MASS.J"
	 * @param wavelength characteristic wavelength, in micron
	 * @param psfFwhm FWHM of the instrument PSF in arcseconds, or null if unknown
	 */
	public PhotometricFilter(String name, double wavelength, Double psfFwhm) {
		Objects.requireNonNull(name, "Filter name must not be null");
		if (!(wavelength > 0))
			throw new IllegalArgumentException("Filter wavelength must be > 0, but was " + wavelength);
		this.name = name;
		this.wavelength = wavelength;
		this.psfFwhm = psfFwhm;
	}
	
	/**
	 * Create a filter with no known PSF.
	 * @param name
	 * @param wavelength in micron
	 */
	public PhotometricFilter(String name, double wavelength) {
		this(name, wavelength, null);
	}
	
	/**
	 * Filter name.
	 * @return
	 */
	public String getName() {
		return name;
	}
	
	/**
	 * Characteristic wavelength, in micron.
	 * @return
	 */
	public double getWavelength() {
		return wavelength;
	}
	
	/**
	 * PSF FWHM in arcseconds, or null if unknown.
	 * @return
	 */
	public Double getPsfFwhm() {
		return psfFwhm;
	}

	@Override
	public String toString() {
		return name + " (" + wavelength + " micron)";
	}

}
