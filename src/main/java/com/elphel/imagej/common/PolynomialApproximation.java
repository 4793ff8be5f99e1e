package com.elphel.imagej.common;
import Jama.LUDecomposition;
import Jama.Matrix;

/**
 **
 ** PolynomialApproximation - weighted least squares linear approximation of z(x,y)
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  PolynomialApproximation.java is free software: you can redistribute it and/or modify
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

public class PolynomialApproximation {
	public static final double DEFAULT_THRESHOLD_LINEAR = 1.0E-10;
	public int debugLevel=1;

	public PolynomialApproximation(){}
	public PolynomialApproximation(int debugLevel){
		this.debugLevel=debugLevel;
	}

	public double [] linearApproximation(double [][][] data){
		return linearApproximation(data, DEFAULT_THRESHOLD_LINEAR);
	}

	/**
	 * Approximate function z(x,y) as a plane f(x,y)=D*x+E*y+F by minimizing the
	 * weighted sum of squared differences.
	 * data array consists of lines of either 2 or 3 vectors:
	 *  2-element vector x,y
	 *  1-element vector z
	 *  optional 1-element vector w (weight of the sample, 0.0 masks the sample out)
	 *
	 * Normal equations:
	 * (1) 0= D*S20 + E*S11 + F*S10 - SZ10
	 * (2) 0= D*S11 + E*S02 + F*S01 - SZ01
	 * (3) 0= D*S10 + E*S01 + F*S00 - SZ00
	 *
	 * @param data samples
	 * @param thresholdLin threshold ratio of matrix determinant to norm (det too low - fail)
	 * @return {D,E,F}
	 * @throws DegenerateDataException if there are no samples or they do not define a plane
	 */
	public double [] linearApproximation(
			double [][][] data,
			double thresholdLin){
		double S00=0.0,S10=0.0,S01=0.0,S20=0.0,S11=0.0,S02=0.0;
		double SZ00=0.0,SZ10=0.0,SZ01=0.0;
		int n=0;
		for (int i=0;i<data.length;i++){
			double w=(data[i].length>2)? data[i][2][0]:1.0;
			if (w>0) {
				n++;
				double x=data[i][0][0];
				double y=data[i][0][1];
				double wz=w*data[i][1][0];
				S00+=w;
				S10+=w*x;
				S01+=w*y;
				S11+=w*x*y;
				S20+=w*x*x;
				S02+=w*y*y;
				SZ00+=wz;
				SZ10+=wz*x;
				SZ01+=wz*y;
			}
		}
		if (S00==0.0) {
			throw new DegenerateDataException("Linear approximation failed: no samples with positive weight");
		}
		double [][] mAarrayL= {
				{S20,S11,S10},
				{S11,S02,S01},
				{S10,S01,S00}};
		Matrix M=new Matrix (mAarrayL);
		double nmL=normMatrix(mAarrayL);
		double det=M.det();
		if (this.debugLevel>2) System.out.println("linearApproximation(): n="+n+" det_lin="+det+" norm_lin="+nmL);
		if ((nmL==0.0) || (Math.abs(det)/nmL<thresholdLin) || !(new LUDecomposition(M)).isNonsingular()){
			throw new DegenerateDataException("Linear approximation failed: "+n+
					" samples do not define a plane (det="+det+", norm="+nmL+")");
		}
		double [] zAarrayL={SZ10,SZ01,SZ00};
		double [] DEF= M.solve(new Matrix (zAarrayL,3)).getRowPackedCopy();
		if (this.debugLevel>1) System.out.println("linearApproximation(): D="+DEF[0]+" E="+DEF[1]+" F="+DEF[2]);
		return DEF;
	}

//	calculate "volume" made of the matrix row-vectors, placed orthogonally
// to be compared to determinant
	public double normMatrix(double [][] a) {
		double d,norm=1.0;
		for (int i=0;i<a.length;i++) {
			d=0;
			for (int j=0;j<a[i].length;j++) d+=a[i][j]*a[i][j];
			norm*=Math.sqrt(d);
		}
		return norm;
	}
}
