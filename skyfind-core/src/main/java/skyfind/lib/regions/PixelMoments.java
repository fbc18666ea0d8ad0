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

package skyfind.lib.regions;

import skyfind.lib.geom.Point2;

/**
 * Accumulates the zeroth, first and second moments of a set of pixel positions, 
 * so that an ellipse can be derived from them without keeping the pixels.
 * 
 * @author SkyFind developers
 */
public class PixelMoments {
	
	private int n;
	private double sx, sy;
	private double sxx, syy, sxy;
	
	/**
	 * Add one pixel.
	 * @param x
	 * @param y
	 */
	public void add(double x, double y) {
		n++;
		sx += x;
		sy += y;
		sxx += x * x;
		syy += y * y;
		sxy += x * y;
	}
	
	/**
	 * Number of pixels added.
	 * @return
	 */
	public int getCount() {
		return n;
	}
	
	/**
	 * Mean position of the pixels, or null if there are none.
	 * @return
	 */
	public Point2 getCentroid() {
		return n == 0 ? null : new Point2(sx / n, sy / n);
	}
	
	/**
	 * Create the ellipse with the same second moments as the pixels.
	 * <p>
	 * With a factor of 1, the pixels of a uniformly-filled ellipse give back (approximately) its own outline.
	 * 
	 * @param factor scale factor for both axes
	 * @param minAxis lower limit for both semi-axes, in pixels
	 * @param color
	 * @param text
	 * @return the ellipse, or null if no pixels were added
	 */
	public EllipseRegion toEllipse(double factor, double minAxis, String color, String text) {
		if (n == 0)
			return null;
		double cx = sx / n;
		double cy = sy / n;
		double cxx = Math.max(sxx / n - cx * cx, 0);
		double cyy = Math.max(syy / n - cy * cy, 0);
		double cxy = sxy / n - cx * cy;
		// Eigenvalues of the covariance matrix
		double mean = (cxx + cyy) / 2;
		double diff = Math.sqrt((cxx - cyy) * (cxx - cyy) / 4 + cxy * cxy);
		double a = Math.max(2 * Math.sqrt(mean + diff) * factor, minAxis);
		double b = Math.max(2 * Math.sqrt(Math.max(mean - diff, 0)) * factor, minAxis);
		double angle = Math.toDegrees(0.5 * Math.atan2(2 * cxy, cxx - cyy));
		return new EllipseRegion(new Point2(cx, cy), a, b, angle, color, text);
	}

}
