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

package skyfind.lib.analysis.fitting;

import java.io.Serializable;

import skyfind.lib.geom.Point2;

/**
 * A fitted point-source profile.
 * 
 * @author SkyFind developers
 */
public final class PsfModel implements Serializable {
	
	private static final long serialVersionUID = 1L;

	private final ModelFamily family;
	private final double[] parameters;
	
	/**
	 * Create a model from its family and parameters (in absolute pixel coordinates).
	 * @param family
	 * @param parameters
	 */
	public PsfModel(ModelFamily family, double[] parameters) {
		if (parameters.length != family.getParameterCount())
			throw new IllegalArgumentException(family + " requires " + family.getParameterCount() + " parameters, but " + parameters.length + " provided");
		this.family = family;
		this.parameters = parameters.clone();
	}
	
	/**
	 * Profile family.
	 * @return
	 */
	public ModelFamily getFamily() {
		return family;
	}
	
	/**
	 * Peak amplitude above the background.
	 * @return
	 */
	public double getAmplitude() {
		return parameters[0];
	}
	
	/**
	 * Center, in absolute pixel coordinates.
	 * @return
	 */
	public Point2 getCenter() {
		return new Point2(parameters[1], parameters[2]);
	}
	
	/**
	 * Full width at half maximum, in pixels.
	 * @return
	 */
	public double getFwhm() {
		return family.getFwhm(parameters);
	}
	
	/**
	 * Standard deviation of a Gaussian with the same FWHM, in pixels.
	 * @return
	 */
	public double getSigma() {
		return getFwhm() / ModelFamily.SIGMA_TO_FWHM;
	}
	
	/**
	 * Evaluate the model at an absolute pixel location.
	 * @param x
	 * @param y
	 * @return
	 */
	public double evaluate(double x, double y) {
		return family.value(parameters, x, y);
	}
	
	/**
	 * Get a copy of the parameters.
	 * @return
	 */
	public double[] getParameters() {
		return parameters.clone();
	}

	@Override
	public String toString() {
		return String.format("%s [amplitude=%.4g, center=(%.2f, %.2f), fwhm=%.3f]", family, getAmplitude(), parameters[1], parameters[2], getFwhm());
	}
	
}
