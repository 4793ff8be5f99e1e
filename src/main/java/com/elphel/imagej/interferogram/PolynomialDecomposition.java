package com.elphel.imagej.interferogram;

/**
 **
 ** PolynomialDecomposition - orthogonal polynomial (e.g. Zernike) fitting service
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  PolynomialDecomposition.java is free software: you can redistribute it and/or modify
 **  it under the terms of the GNU General Public License as published by
 **  the Free Software Foundation, either version 3 of the License, or
 **  (at your option) any later version.
 **
 **  This program is distributed in the hope that it will be useful,
 **  but WITHOUT ANY WARRANTY; without even the implied warranty of
 **  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 **  GNU General Public License for more details.
 **
 **  You should have received a copy of the GNU General Public License
 **  along with this program.  If not, see <http://www.gnu.org/licenses/>.
 ** -----------------------------------------------------------------------------**
 **
 */

/**
 * Fits a polynomial set to a phase grid. Implementations must exclude non-finite
 * samples of the grid from the fit.
 */
public interface PolynomialDecomposition {
	/**
	 * @param phase phase grid [rows][cols], may contain non-finite samples
	 * @param setName name of the polynomial set (e.g. "fringe")
	 * @param normalize fit normalized polynomials
	 * @return fitted coefficients
	 */
	double [] fit(double [][] phase, String setName, boolean normalize);
}
