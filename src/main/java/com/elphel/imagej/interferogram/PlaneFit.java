package com.elphel.imagej.interferogram;
import com.elphel.imagej.common.DegenerateDataException;
import com.elphel.imagej.common.PolynomialApproximation;

/**
 **
 ** PlaneFit - least squares plane (piston, tip and tilt) of a phase grid
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  PlaneFit.java is free software: you can redistribute it and/or modify
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

public class PlaneFit {
	public int debugLevel=0;

	public PlaneFit(){}
	public PlaneFit(int debugLevel){
		this.debugLevel=debugLevel;
	}

	/**
	 * Fit z = a*x + b*y + c to the finite samples of z
	 * @param x column coordinates, length = z[0].length
	 * @param y row coordinates, length = z.length
	 * @param z data [rows][cols], non-finite samples are ignored
	 * @return {a, b, c}
	 * @throws DegenerateDataException when the finite samples do not define a plane (less than 3 non-collinear)
	 */
	public double [] fitCoefficients(double [] x, double [] y, double [][] z) {
		checkShape(x, y, z);
		// center and normalize coordinates so the normal equations are well conditioned for any units
		double x0=0.0,y0=0.0;
		int n=0;
		for (int i=0;i<z.length;i++) for (int j=0;j<x.length;j++) if (Double.isFinite(z[i][j])) {
			x0+=x[j];
			y0+=y[i];
			n++;
		}
		if (n==0) {
			throw new DegenerateDataException("Plane fit failed: no finite samples in "+z.length+"x"+x.length+" grid");
		}
		x0/=n;
		y0/=n;
		double sx=0.0,sy=0.0;
		for (int i=0;i<z.length;i++) for (int j=0;j<x.length;j++) if (Double.isFinite(z[i][j])) {
			sx=Math.max(sx, Math.abs(x[j]-x0));
			sy=Math.max(sy, Math.abs(y[i]-y0));
		}
		if (sx==0.0) sx=1.0;
		if (sy==0.0) sy=1.0;
		double [][][] data=new double[n][][];
		int k=0;
		for (int i=0;i<z.length;i++) for (int j=0;j<x.length;j++) if (Double.isFinite(z[i][j])) {
			data[k++]=new double [][] {{(x[j]-x0)/sx, (y[i]-y0)/sy}, {z[i][j]}};
		}
		double [] def=(new PolynomialApproximation(this.debugLevel)).linearApproximation(data);
		double a=def[0]/sx;
		double b=def[1]/sy;
		double c=def[2]-a*x0-b*y0;
		if (this.debugLevel>0) System.out.println("PlaneFit: "+n+" samples, z = "+a+"*x + "+b+"*y + "+c);
		return new double[] {a, b, c};
	}

	/** Plane a*x+b*y+c evaluated over the whole grid */
	public static double [][] evaluate(double [] coefficients, double [] x, double [] y) {
		double [][] plane=new double[y.length][x.length];
		for (int i=0;i<y.length;i++) for (int j=0;j<x.length;j++) {
			plane[i][j]=coefficients[0]*x[j]+coefficients[1]*y[i]+coefficients[2];
		}
		return plane;
	}

	/**
	 * Least squares plane over the finite samples of z, defined everywhere
	 * (including positions where z is invalid)
	 */
	public double [][] fitPlane(double [] x, double [] y, double [][] z) {
		return evaluate(fitCoefficients(x, y, z), x, y);
	}

	static void checkShape(double [] x, double [] y, double [][] z) {
		if (z.length!=y.length) {
			String msg="Grid has "+z.length+" rows, y axis has "+y.length+" samples";
			throw new IllegalArgumentException (msg);
		}
		for (int i=0;i<z.length;i++) if (z[i].length!=x.length) {
			String msg="Grid row "+i+" has "+z[i].length+" samples, x axis has "+x.length;
			throw new IllegalArgumentException (msg);
		}
	}
}
