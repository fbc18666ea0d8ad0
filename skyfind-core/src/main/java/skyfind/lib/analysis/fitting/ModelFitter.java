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

import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import skyfind.lib.analysis.images.SimpleImages;
import skyfind.lib.geom.Point2;
import skyfind.lib.regions.ImageBox;

/**
 * Fit {@link ModelFamily} profiles to background-subtracted pixel data using Levenberg-Marquardt.
 * 
 * @author SkyFind developers
 */
public class ModelFitter {
	
	private static final Logger logger = LoggerFactory.getLogger(ModelFitter.class);
	
	private static final int MAX_EVALUATIONS = 2000;
	
	/**
	 * Fit a profile to the finite pixels of a box.
	 * 
	 * @param family the profile to fit
	 * @param data background-subtracted values
	 * @param guessCenter initial center estimate, in absolute pixel coordinates
	 * @param guessFwhm initial FWHM estimate, in pixels
	 * @param maxCenterOffset maximum allowed distance between the fitted center and the initial estimate
	 * @return the fitted model, or null if the fit failed or gave an implausible result
	 */
	public static PsfModel fit(ModelFamily family, ImageBox data, Point2 guessCenter, double guessFwhm, double maxCenterOffset) {
		int w = data.getWidth();
		int h = data.getHeight();
		int n = SimpleImages.countFinite(data);
		if (n <= family.getParameterCount() * 2) {
			logger.debug("Too few pixels ({}) to fit {}", n, family);
			return null;
		}
		double[] xs = new double[n];
		double[] ys = new double[n];
		double[] target = new double[n];
		int k = 0;
		for (int y = 0; y < h; y++) {
			for (int x = 0; x < w; x++) {
				float v = data.getValue(x, y);
				if (!Float.isFinite(v))
					continue;
				xs[k] = data.getX0() + x;
				ys[k] = data.getY0() + y;
				target[k] = v;
				k++;
			}
		}
		
		double amplitude = SimpleImages.getMaxValue(data);
		var rel = data.toRelative(guessCenter);
		if (data.contains(rel.getPixelX(), rel.getPixelY())) {
			float v = data.getValue(rel.getPixelX(), rel.getPixelY());
			if (Float.isFinite(v) && v > 0)
				amplitude = v;
		}
		if (!(amplitude > 0)) {
			logger.debug("No positive signal to fit {}", family);
			return null;
		}
		double[] start = family.initialParameters(amplitude, guessCenter.getX(), guessCenter.getY(), guessFwhm);
		
		MultivariateJacobianFunction function = point -> {
			double[] p = point.toArray();
			double[] values = evaluate(family, p, xs, ys);
			double[][] jacobian = new double[values.length][p.length];
			for (int j = 0; j < p.length; j++) {
				double[] shifted = p.clone();
				double step = 1e-6 * Math.max(1.0, Math.abs(p[j]));
				shifted[j] += step;
				double[] values2 = evaluate(family, shifted, xs, ys);
				for (int i = 0; i < values.length; i++)
					jacobian[i][j] = (values2[i] - values[i]) / step;
			}
			return new Pair<RealVector, RealMatrix>(new ArrayRealVector(values, false), new Array2DRowRealMatrix(jacobian, false));
		};
		
		LeastSquaresProblem problem = new LeastSquaresBuilder()
				.start(start)
				.model(function)
				.target(target)
				.lazyEvaluation(false)
				.maxEvaluations(MAX_EVALUATIONS)
				.maxIterations(MAX_EVALUATIONS)
				.build();
		
		double[] params;
		try {
			var optimum = new LevenbergMarquardtOptimizer().optimize(problem);
			params = optimum.getPoint().toArray();
		} catch (MathIllegalStateException e) {
			logger.debug("{} fit did not converge: {}", family, e.getMessage());
			return null;
		}
		params[3] = Math.abs(params[3]);
		
		if (!family.isValid(params)) {
			logger.debug("Rejecting {} fit with invalid parameters", family);
			return null;
		}
		var model = new PsfModel(family, params);
		double fwhm = model.getFwhm();
		if (fwhm <= 0 || fwhm >= Math.max(w, h)) {
			logger.debug("Rejecting {} fit with FWHM {}", family, fwhm);
			return null;
		}
		if (model.getCenter().distance(guessCenter) > maxCenterOffset) {
			logger.debug("Rejecting {} fit with center {} too far from {}", family, model.getCenter(), guessCenter);
			return null;
		}
		return model;
	}
	
	private static double[] evaluate(ModelFamily family, double[] p, double[] xs, double[] ys) {
		double[] values = new double[xs.length];
		for (int i = 0; i < xs.length; i++)
			values[i] = family.value(p, xs[i], ys[i]);
		return values;
	}

}
