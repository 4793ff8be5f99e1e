package com.elphel.imagej.common;
import org.jtransforms.fft.DoubleFFT_2D;

/**
 **
 ** CenteredFFT - 2-d complex FFT of arbitrary size with zero frequency in the center
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  CenteredFFT.java is free software: you can redistribute it and/or modify
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
 * Complex data is kept interleaved, one array per row: data[row][2*col] is the real part,
 * data[row][2*col+1] the imaginary part (the JTransforms layout).
 * Unlike the power-of-2 Hartley transform, any rows/columns count is accepted. Zero frequency
 * after {@link #fftShift(double[][])} is at index (rows/2, cols/2), so for odd sizes
 * {@link #ifftShift(double[][])} is not the same permutation as fftShift.
 */
public class CenteredFFT {
	private final int rows;
	private final int cols;
	private final DoubleFFT_2D fft;

	public CenteredFFT(int rows, int cols) {
		if ((rows<1) || (cols<1)) {
			String msg="Invalid FFT size "+rows+"x"+cols;
			throw new IllegalArgumentException (msg);
		}
		this.rows=rows;
		this.cols=cols;
		this.fft=new DoubleFFT_2D(rows,cols);
	}


	/**
	 * Spatial frequencies of the bins of a centered transform
	 * @param sampleSpacing distance between samples (physical units), must be positive
	 * @param samples number of samples
	 * @return frequency of bin k, (k - samples/2) / (samples * sampleSpacing), in cycles per unit
	 */
	public static double [] forwardFtUnit(double sampleSpacing, int samples) {
		if (!(sampleSpacing>0.0) || Double.isInfinite(sampleSpacing)) {
			String msg="Sample spacing should be positive and finite, got "+sampleSpacing;
			throw new IllegalArgumentException (msg);
		}
		if (samples<1) {
			String msg="Number of samples should be positive, got "+samples;
			throw new IllegalArgumentException (msg);
		}
		double [] unit=new double[samples];
		double scale=1.0/(samples*sampleSpacing);
		int half=samples/2;
		for (int k=0;k<samples;k++) unit[k]=(k-half)*scale;
		return unit;
	}

	/**
	 * Pack a real grid into interleaved complex rows
	 * @param data real data [rows][cols]
	 * @return complex data [rows][2*cols], imaginary parts are zero
	 */
	public double [][] toComplex(double [][] data) {
		checkReal(data);
		double [][] complex=new double[this.rows][2*this.cols];
		for (int i=0;i<this.rows;i++) for (int j=0;j<this.cols;j++) complex[i][2*j]=data[i][j];
		return complex;
	}

	public double [][] realPart(double [][] complex) {
		checkComplex(complex);
		double [][] re=new double[this.rows][this.cols];
		for (int i=0;i<this.rows;i++) for (int j=0;j<this.cols;j++) re[i][j]=complex[i][2*j];
		return re;
	}

	/** Move zero frequency from (0,0) to (rows/2, cols/2) */
	public double [][] fftShift(double [][] complex) {
		return roll(complex, this.rows/2, this.cols/2);
	}

	/** Inverse of {@link #fftShift(double[][])} */
	public double [][] ifftShift(double [][] complex) {
		return roll(complex, -(this.rows/2), -(this.cols/2));
	}

	/**
	 * Forward transform of the centered data, result has zero frequency in the center
	 * @param complex interleaved complex data, not modified
	 * @return new array with the centered spectrum
	 */
	public double [][] forwardCentered(double [][] complex) {
		double [][] work=ifftShift(complex);
		this.fft.complexForward(work);
		return fftShift(work);
	}

	/**
	 * Inverse transform (scaled by 1/(rows*cols)) of the centered spectrum
	 * @param complex centered spectrum, not modified
	 * @return new array with centered space domain data
	 */
	public double [][] inverseCentered(double [][] complex) {
		double [][] work=ifftShift(complex);
		this.fft.complexInverse(work, true);
		return fftShift(work);
	}

	private double [][] roll(double [][] complex, int dRow, int dCol) {
		checkComplex(complex);
		double [][] rolled=new double[this.rows][2*this.cols];
		for (int i=0;i<this.rows;i++) {
			int iDst=Math.floorMod(i+dRow, this.rows);
			for (int j=0;j<this.cols;j++) {
				int jDst=Math.floorMod(j+dCol, this.cols);
				rolled[iDst][2*jDst]=  complex[i][2*j];
				rolled[iDst][2*jDst+1]=complex[i][2*j+1];
			}
		}
		return rolled;
	}

	private void checkReal(double [][] data) {
		if (data.length!=this.rows) {
			String msg="Expected "+this.rows+" rows, got "+data.length;
			throw new IllegalArgumentException (msg);
		}
		for (int i=0;i<data.length;i++) if (data[i].length!=this.cols) {
			String msg="Row "+i+" has "+data[i].length+" samples, expected "+this.cols;
			throw new IllegalArgumentException (msg);
		}
	}

	private void checkComplex(double [][] complex) {
		if (complex.length!=this.rows) {
			String msg="Expected "+this.rows+" complex rows, got "+complex.length;
			throw new IllegalArgumentException (msg);
		}
		for (int i=0;i<complex.length;i++) if (complex[i].length!=2*this.cols) {
			String msg="Complex row "+i+" has length "+complex[i].length+", expected "+(2*this.cols);
			throw new IllegalArgumentException (msg);
		}
	}
}
