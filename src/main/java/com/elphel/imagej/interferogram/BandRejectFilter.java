package com.elphel.imagej.interferogram;
import com.elphel.imagej.common.CenteredFFT;

/**
 **
 ** BandRejectFilter - frequency domain rejection of spatial wavelengths outside of a band
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  BandRejectFilter.java is free software: you can redistribute it and/or modify
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
 * Keeps spatial wavelengths between wavelengthLow and wavelengthHigh. Frequencies above 1/wavelengthLow
 * on either axis and frequencies below 1/wavelengthHigh on both axes are zeroed, so the pass band is
 * rectangular in the frequency plane, not a radial annulus.
 * <p>
 * Non-finite input samples are replaced by zeros before the transform. This biases the result near
 * dropouts in proportion to the dropout fraction; the filter does not try to recover missing data and
 * does not restore invalid samples in its output (see {@link PhaseMap#bandReject(double, double)}).
 */
public class BandRejectFilter {
	public int debugLevel=0;

	public BandRejectFilter(){}
	public BandRejectFilter(int debugLevel){
		this.debugLevel=debugLevel;
	}

	/**
	 * @param wavelengthLow shortest kept wavelength, 0 keeps all high frequencies
	 * @param wavelengthHigh longest kept wavelength, Double.POSITIVE_INFINITY keeps all low frequencies
	 * @throws IllegalArgumentException for negative, NaN or inverted wavelengths
	 */
	public static void checkWavelengths(double wavelengthLow, double wavelengthHigh) {
		if (!(wavelengthLow>=0.0) || Double.isInfinite(wavelengthLow)) {
			String msg="Low wavelength cutoff should be finite and non-negative, got "+wavelengthLow;
			throw new IllegalArgumentException (msg);
		}
		if (!(wavelengthHigh>wavelengthLow)) {
			String msg="High wavelength cutoff ("+wavelengthHigh+") should be greater than the low one ("+wavelengthLow+")";
			throw new IllegalArgumentException (msg);
		}
	}

	/**
	 * Frequency bins to zero, for a centered spectrum
	 * @param rows number of rows
	 * @param cols number of columns
	 * @param sampleSpacing distance between samples
	 * @param wavelengthLow shortest kept wavelength
	 * @param wavelengthHigh longest kept wavelength
	 * @return mask [rows][cols], true for rejected bins
	 */
	public static boolean [][] createRejectMask(
			int rows,
			int cols,
			double sampleSpacing,
			double wavelengthLow,
			double wavelengthHigh){
		checkWavelengths(wavelengthLow, wavelengthHigh);
		double [] ux=CenteredFFT.forwardFtUnit(sampleSpacing, cols);
		double [] uy=CenteredFFT.forwardFtUnit(sampleSpacing, rows);
		double fHigh=1.0/wavelengthLow;  // +Infinity for wavelengthLow==0
		double fLow= 1.0/wavelengthHigh; // 0.0 for wavelengthHigh==+Infinity
		boolean [][] mask=new boolean[rows][cols];
		for (int i=0;i<rows;i++) {
			boolean yHigh=(uy[i]<-fHigh) || (uy[i]>fHigh);
			boolean yLow= (uy[i]>-fLow) && (uy[i]<fLow);
			for (int j=0;j<cols;j++) {
				boolean highPass=yHigh || (ux[j]<-fHigh) || (ux[j]>fHigh);
				boolean lowPass= yLow && (ux[j]>-fLow) && (ux[j]<fLow);
				mask[i][j]=highPass || lowPass;
			}
		}
		return mask;
	}

	/**
	 * Band-reject filter a real grid
	 * @param data [rows][cols] grid, may contain non-finite samples (treated as 0.0), not modified
	 * @param sampleSpacing distance between samples, same units as the wavelengths
	 * @param wavelengthLow shortest kept wavelength
	 * @param wavelengthHigh longest kept wavelength
	 * @return new filtered grid (real part of the inverse transform), all samples finite
	 */
	public double [][] filter(
			double [][] data,
			double sampleSpacing,
			double wavelengthLow,
			double wavelengthHigh){
		if ((data==null) || (data.length==0) || (data[0].length==0)) {
			String msg="Band-reject filter needs a non-empty grid";
			throw new IllegalArgumentException (msg);
		}
		int rows=data.length;
		int cols=data[0].length;
		boolean [][] mask=createRejectMask(rows, cols, sampleSpacing, wavelengthLow, wavelengthHigh);
		CenteredFFT fft=new CenteredFFT(rows, cols);
		double [][] work=new double[rows][];
		for (int i=0;i<rows;i++) {
			if (data[i].length!=cols) {
				String msg="Ragged grid: row "+i+" has "+data[i].length+" samples, expected "+cols;
				throw new IllegalArgumentException (msg);
			}
			work[i]=data[i].clone();
			for (int j=0;j<cols;j++) if (!Double.isFinite(work[i][j])) work[i][j]=0.0;
		}
		double [][] fourier=fft.forwardCentered(fft.toComplex(work));
		int numRejected=0;
		for (int i=0;i<rows;i++) for (int j=0;j<cols;j++) if (mask[i][j]) {
			fourier[i][2*j]=  0.0;
			fourier[i][2*j+1]=0.0;
			numRejected++;
		}
		if (this.debugLevel>1) System.out.println("BandRejectFilter: "+rows+"x"+cols+", spacing="+sampleSpacing+
				", wavelengths "+wavelengthLow+".."+wavelengthHigh+", rejected "+numRejected+" of "+(rows*cols)+" bins");
		return fft.realPart(fft.inverseCentered(fourier));
	}
}
