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

import org.apache.commons.math3.special.BesselJ;

import com.google.gson.annotations.SerializedName;

/**
 * Circular analytic profiles that can be fitted to point sources.
 * <p>
 * Parameters always start with amplitude, x center and y center; the remaining parameters 
 * describe the width (and shape) of the profile.
 * 
 * @author SkyFind developers
 */
public enum ModelFamily {
	
	/**
	 * Gaussian profile; parameters {amplitude, x0, y0, sigma}.
	 */
	@SerializedName("gaussian")
	GAUSSIAN(4) {
		@Override
		public double value(double[] p, double x, double y) {
			double r2 = (x - p[1]) * (x - p[1]) + (y - p[2]) * (y - p[2]);
			return p[0] * Math.exp(-r2 / (2 * p[3] * p[3]));
		}

		@Override
		public double getFwhm(double[] p) {
			return Math.abs(p[3]) * SIGMA_TO_FWHM;
		}

		@Override
		double[] initialParameters(double amplitude, double x, double y, double fwhm) {
			return new double[] {amplitude, x, y, fwhm / SIGMA_TO_FWHM};
		}
	},
	
	/**
	 * Moffat profile; parameters {amplitude, x0, y0, gamma, alpha}.
	 */
	@SerializedName("moffat")
	MOFFAT(5) {
		@Override
		public double value(double[] p, double x, double y) {
			double r2 = (x - p[1]) * (x - p[1]) + (y - p[2]) * (y - p[2]);
			return p[0] * Math.pow(1 + r2 / (p[3] * p[3]), -p[4]);
		}

		@Override
		public double getFwhm(double[] p) {
			return 2 * Math.abs(p[3]) * Math.sqrt(Math.pow(2, 1.0 / p[4]) - 1);
		}

		@Override
		double[] initialParameters(double amplitude, double x, double y, double fwhm) {
			double alpha = 2.5;
			return new double[] {amplitude, x, y, fwhm / (2 * Math.sqrt(Math.pow(2, 1.0 / alpha) - 1)), alpha};
		}
		
		@Override
		boolean isValid(double[] p) {
			return super.isValid(p) && p[4] > 0;
		}
	},
	
	/**
	 * Airy disk; parameters {amplitude, x0, y0, radius of the first dark ring}.
	 */
	@SerializedName("airy")
	AIRY(4) {
		@Override
		public double value(double[] p, double x, double y) {
			double r = Math.sqrt((x - p[1]) * (x - p[1]) + (y - p[2]) * (y - p[2]));
			double z = AIRY_FIRST_ZERO * r / p[3];
			if (z < 1e-8)
				return p[0];
			double v = 2 * BesselJ.value(1, z) / z;
			return p[0] * v * v;
		}

		@Override
		public double getFwhm(double[] p) {
			return Math.abs(p[3]) * AIRY_FWHM_TO_RADIUS;
		}

		@Override
		double[] initialParameters(double amplitude, double x, double y, double fwhm) {
			return new double[] {amplitude, x, y, fwhm / AIRY_FWHM_TO_RADIUS};
		}
	};
	
	/**
	 * Ratio between the FWHM and the standard deviation of a Gaussian.
	 */
	public static final double SIGMA_TO_FWHM = 2.0 * Math.sqrt(2.0 * Math.log(2.0));
	
	private static final double AIRY_FIRST_ZERO = 3.8317059702075125;
	private static final double AIRY_FWHM_TO_RADIUS = 0.8436;
	
	private final int nParameters;
	
	ModelFamily(int nParameters) {
		this.nParameters = nParameters;
	}
	
	/**
	 * Number of parameters of the profile.
	 * @return
	 */
	public int getParameterCount() {
		return nParameters;
	}
	
	/**
	 * Evaluate the profile.
	 * @param parameters
	 * @param x
	 * @param y
	 * @return
	 */
	public abstract double value(double[] parameters, double x, double y);
	
	/**
	 * Full width at half maximum of the profile, in pixels.
	 * @param parameters
	 * @return
	 */
	public abstract double getFwhm(double[] parameters);
	
	abstract double[] initialParameters(double amplitude, double x, double y, double fwhm);
	
	boolean isValid(double[] p) {
		for (double v : p) {
			if (!Double.isFinite(v))
				return false;
		}
		return p[0] > 0 && p[3] != 0;
	}

}
