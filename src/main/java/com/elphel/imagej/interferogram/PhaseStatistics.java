package com.elphel.imagej.interferogram;
import com.elphel.imagej.common.DegenerateDataException;

/**
 **
 ** PhaseStatistics - scalar statistics of phase grids, ignoring invalid samples
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  PhaseStatistics.java is free software: you can redistribute it and/or modify
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
 * All statistics skip non-finite (NaN, infinite) samples. Statistics of a grid without
 * finite samples are undefined and throw {@link DegenerateDataException}, except
 * {@link #dropoutPercentage(double[][])} and {@link #countFinite(double[][])}.
 */
public final class PhaseStatistics {
	private PhaseStatistics() {}

	public static boolean [][] finiteMask(double [][] data) {
		boolean [][] mask=new boolean[data.length][];
		for (int i=0;i<data.length;i++) {
			mask[i]=new boolean[data[i].length];
			for (int j=0;j<data[i].length;j++) mask[i][j]=Double.isFinite(data[i][j]);
		}
		return mask;
	}

	public static int countFinite(double [][] data) {
		int n=0;
		for (double [] row:data) for (double d:row) if (Double.isFinite(d)) n++;
		return n;
	}

	public static int size(double [][] data) {
		int n=0;
		for (double [] row:data) n+=row.length;
		return n;
	}

	/** Percentage of non-finite samples, 0.0 for an empty grid */
	public static double dropoutPercentage(double [][] data) {
		int total=size(data);
		if (total==0) return 0.0;
		return 100.0*(total-countFinite(data))/total;
	}

	public static double mean(double [][] data) {
		double sum=0.0;
		int n=0;
		for (double [] row:data) for (double d:row) if (Double.isFinite(d)) {
			sum+=d;
			n++;
		}
		checkNotEmpty(n, "mean");
		return sum/n;
	}

	public static double min(double [][] data) {
		double min=Double.POSITIVE_INFINITY;
		int n=0;
		for (double [] row:data) for (double d:row) if (Double.isFinite(d)) {
			if (d<min) min=d;
			n++;
		}
		checkNotEmpty(n, "minimum");
		return min;
	}

	public static double max(double [][] data) {
		double max=Double.NEGATIVE_INFINITY;
		int n=0;
		for (double [] row:data) for (double d:row) if (Double.isFinite(d)) {
			if (d>max) max=d;
			n++;
		}
		checkNotEmpty(n, "maximum");
		return max;
	}

	/** Peak-to-valley: max - min of finite samples */
	public static double pv(double [][] data) {
		return max(data)-min(data);
	}

	/** Root of the mean squared value of finite samples (not mean-subtracted) */
	public static double rms(double [][] data) {
		double s2=0.0;
		int n=0;
		for (double [] row:data) for (double d:row) if (Double.isFinite(d)) {
			s2+=d*d;
			n++;
		}
		checkNotEmpty(n, "RMS");
		return Math.sqrt(s2/n);
	}

	/** Ra: mean absolute deviation of finite samples from their mean */
	public static double ra(double [][] data) {
		double mean=mean(data);
		double sa=0.0;
		int n=0;
		for (double [] row:data) for (double d:row) if (Double.isFinite(d)) {
			sa+=Math.abs(d-mean);
			n++;
		}
		return sa/n;
	}

	private static void checkNotEmpty(int n, String what) {
		if (n==0) {
			throw new DegenerateDataException("Can not calculate "+what+": no finite samples");
		}
	}
}
