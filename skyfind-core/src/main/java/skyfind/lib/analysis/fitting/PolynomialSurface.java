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

import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;

import skyfind.lib.images.Mask;
import skyfind.lib.regions.ImageBox;

/**
 * A 2D polynomial surface of fixed total order, fitted by ordinary least squares.
 * <p>
 * Coordinates are absolute pixel coordinates, normalized internally around the center of the 
 * box used for fitting to keep the design matrix well-conditioned.
 * 
 * @author SkyFind developers
 */
public class PolynomialSurface implements Serializable {
	
	private static final long serialVersionUID = 1L;

	private final int order;
	private final double[] coefficients;
	private final double xCenter, yCenter, scale;
	
	private PolynomialSurface(int order, double[] coefficients, double xCenter, double yCenter, double scale) {
		this.order = order;
		this.coefficients = coefficients;
		this.xCenter = xCenter;
		this.yCenter = yCenter;
		this.scale = scale;
	}
	
	/**
	 * Number of coefficients of a polynomial surface with the given total order.
	 * @param order
	 * @return
	 */
	public static int nCoefficients(int order) {
		return (order + 1) * (order + 2) / 2;
	}
	
	/**
	 * Fit a polynomial surface to the finite, unmasked pixels of a box.
	 * @param box values to fit
	 * @param excluded box-sized mask of pixels to ignore (true = ignore), or null
	 * @param order total order of the polynomial
	 * @return
	 * @throws IllegalArgumentException if fewer than twice as many usable pixels as coefficients remain, 
	 *                                  or if the design matrix is singular
	 */
	public static PolynomialSurface fit(ImageBox box, Mask excluded, int order) {
		if (order < 0)
			throw new IllegalArgumentException("Polynomial order must be >= 0, but was " + order);
		int w = box.getWidth();
		int h = box.getHeight();
		int nCoeffs = nCoefficients(order);
		double xCenter = box.getX0() + (w - 1) / 2.0;
		double yCenter = box.getY0() + (h - 1) / 2.0;
		double scale = Math.max(1.0, Math.max(w, h) / 2.0);
		
		int n = 0;
		double[] values = new double[w * h];
		double[][] design = new double[w * h][];
		for (int y = 0; y < h; y++) {
			for (int x = 0; x < w; x++) {
				float v = box.getValue(x, y);
				if (!Float.isFinite(v) || (excluded != null && excluded.get(x, y)))
					continue;
				values[n] = v;
				design[n] = terms(order, ((box.getX0() + x) - xCenter) / scale, ((box.getY0() + y) - yCenter) / scale);
				n++;
			}
		}
		if (n < nCoeffs * 2)
			throw new IllegalArgumentException("Only " + n + " usable pixels to fit " + nCoeffs + " coefficients");
		
		double[] y = new double[n];
		double[][] x = new double[n][];
		System.arraycopy(values, 0, y, 0, n);
		System.arraycopy(design, 0, x, 0, n);
		var regression = new OLSMultipleLinearRegression();
		regression.setNoIntercept(true);
		regression.newSampleData(y, x);
		double[] coefficients = regression.estimateRegressionParameters();
		return new PolynomialSurface(order, coefficients, xCenter, yCenter, scale);
	}
	
	static double[] terms(int order, double x, double y) {
		double[] terms = new double[nCoefficients(order)];
		int k = 0;
		for (int degree = 0; degree <= order; degree++) {
			for (int j = 0; j <= degree; j++) {
				int i = degree - j;
				terms[k++] = Math.pow(x, i) * Math.pow(y, j);
			}
		}
		return terms;
	}
	
	/**
	 * Evaluate the surface at an absolute pixel location.
	 * @param x
	 * @param y
	 * @return
	 */
	public double evaluate(double x, double y) {
		double[] t = terms(order, (x - xCenter) / scale, (y - yCenter) / scale);
		double sum = 0;
		for (int i = 0; i < t.length; i++)
			sum += t[i] * coefficients[i];
		return sum;
	}
	
	/**
	 * Evaluate the surface for every pixel of a box, returning a new box with the same geometry.
	 * @param like
	 * @return
	 */
	public ImageBox evaluate(ImageBox like) {
		int w = like.getWidth();
		int h = like.getHeight();
		float[] values = new float[w * h];
		for (int y = 0; y < h; y++) {
			for (int x = 0; x < w; x++)
				values[y * w + x] = (float)evaluate(like.getX0() + x, like.getY0() + y);
		}
		return ImageBox.createInstance(like.getX0(), like.getY0(), w, h, values);
	}
	
	/**
	 * Total order of the polynomial.
	 * @return
	 */
	public int getOrder() {
		return order;
	}
	
	/**
	 * Get a copy of the fitted coefficients (in normalized coordinates).
	 * @return
	 */
	public double[] getCoefficients() {
		return coefficients.clone();
	}

}
