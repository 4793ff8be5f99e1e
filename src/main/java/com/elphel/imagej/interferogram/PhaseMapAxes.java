package com.elphel.imagej.interferogram;
import java.util.Arrays;

/**
 **
 ** PhaseMapAxes - x/y coordinates of the phase map samples
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  PhaseMapAxes.java is free software: you can redistribute it and/or modify
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
 * Coordinates of the phase map columns (x) and rows (y). In {@link CoordinateMode#SYNTHETIC} mode the
 * coordinates are pixel indices and there is no physical sample spacing.
 * In {@link CoordinateMode#PHYSICAL} mode the spacing is assumed uniform and is taken from the first
 * two x samples.
 */
public final class PhaseMapAxes {
	public enum CoordinateMode {SYNTHETIC, PHYSICAL}

	private final CoordinateMode mode;
	private final double [] x;
	private final double [] y;

	private PhaseMapAxes(CoordinateMode mode, double [] x, double [] y) {
		this.mode=mode;
		this.x=x;
		this.y=y;
	}

	/** Pixel index axes 0..cols-1, 0..rows-1 */
	public static PhaseMapAxes synthetic(int cols, int rows) {
		if ((cols<1) || (rows<1)) {
			String msg="Axes size should be positive, got "+cols+"x"+rows;
			throw new IllegalArgumentException (msg);
		}
		double [] x=new double[cols];
		double [] y=new double[rows];
		for (int i=0;i<cols;i++) x[i]=i;
		for (int i=0;i<rows;i++) y[i]=i;
		return new PhaseMapAxes(CoordinateMode.SYNTHETIC, x, y);
	}

	public static PhaseMapAxes physical(double [] x, double [] y) {
		if ((x==null) || (y==null) || (x.length<1) || (y.length<1)) {
			String msg="Physical axes should be non-empty";
			throw new IllegalArgumentException (msg);
		}
		for (double v:x) if (!Double.isFinite(v)) {
			String msg="Non-finite x coordinate "+v;
			throw new IllegalArgumentException (msg);
		}
		for (double v:y) if (!Double.isFinite(v)) {
			String msg="Non-finite y coordinate "+v;
			throw new IllegalArgumentException (msg);
		}
		return new PhaseMapAxes(CoordinateMode.PHYSICAL, x.clone(), y.clone());
	}

	/**
	 * Axes for a uniformly sampled grid
	 * @param cols number of columns
	 * @param rows number of rows
	 * @param spacing distance between neighbor samples
	 */
	public static PhaseMapAxes uniform(int cols, int rows, double spacing) {
		if (!(spacing>0.0) || Double.isInfinite(spacing)) {
			String msg="Sample spacing should be positive and finite, got "+spacing;
			throw new IllegalArgumentException (msg);
		}
		if ((cols<1) || (rows<1)) {
			String msg="Axes size should be positive, got "+cols+"x"+rows;
			throw new IllegalArgumentException (msg);
		}
		double [] x=new double[cols];
		double [] y=new double[rows];
		for (int i=0;i<cols;i++) x[i]=i*spacing;
		for (int i=0;i<rows;i++) y[i]=i*spacing;
		return new PhaseMapAxes(CoordinateMode.PHYSICAL, x, y);
	}

	public CoordinateMode getMode() {return this.mode;}
	public boolean isPhysical() {return this.mode==CoordinateMode.PHYSICAL;}
	public int getCols() {return this.x.length;}
	public int getRows() {return this.y.length;}
	public double [] getX() {return this.x.clone();}
	public double [] getY() {return this.y.clone();}

	/**
	 * @return x[1]-x[0]
	 * @throws IllegalStateException for pixel coordinates or a single column
	 */
	public double getSampleSpacing() {
		if (!isPhysical()) {
			throw new IllegalStateException("Sample spacing is undefined for pixel coordinates");
		}
		if (this.x.length<2) {
			throw new IllegalStateException("Sample spacing needs at least 2 columns, have "+this.x.length);
		}
		return this.x[1]-this.x[0];
	}

	/** Keep rows [rowStart, rowEnd) and columns [colStart, colEnd), mode is preserved */
	public PhaseMapAxes crop(int rowStart, int rowEnd, int colStart, int colEnd) {
		if ((rowStart<0) || (colStart<0) || (rowEnd>this.y.length) || (colEnd>this.x.length) ||
				(rowEnd<=rowStart) || (colEnd<=colStart)) {
			String msg="Invalid crop rows ["+rowStart+","+rowEnd+") columns ["+colStart+","+colEnd+
					") for "+this.x.length+"x"+this.y.length+" axes";
			throw new IllegalArgumentException (msg);
		}
		return new PhaseMapAxes(this.mode,
				Arrays.copyOfRange(this.x, colStart, colEnd),
				Arrays.copyOfRange(this.y, rowStart, rowEnd));
	}

	@Override
	public String toString() {
		return this.mode+" axes "+this.x.length+"x"+this.y.length+
				" x=["+this.x[0]+".."+this.x[this.x.length-1]+"] y=["+this.y[0]+".."+this.y[this.y.length-1]+"]";
	}
}
