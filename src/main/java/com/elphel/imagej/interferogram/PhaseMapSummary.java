package com.elphel.imagej.interferogram;
import java.util.Locale;

/**
 **
 ** PhaseMapSummary - scalar quality metrics of a processed phase map
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  PhaseMapSummary.java is free software: you can redistribute it and/or modify
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

public final class PhaseMapSummary {
	private final double pv;
	private final double rms;
	private final double ra;
	private final double dropoutPercentage;
	private final int rows;
	private final int cols;

	public PhaseMapSummary(double pv, double rms, double ra, double dropoutPercentage, int rows, int cols) {
		this.pv=pv;
		this.rms=rms;
		this.ra=ra;
		this.dropoutPercentage=dropoutPercentage;
		this.rows=rows;
		this.cols=cols;
	}

	public static PhaseMapSummary of(PhaseMap map) {
		return new PhaseMapSummary(map.getPv(), map.getRms(), map.getRa(), map.getDropoutPercentage(), map.getRows(), map.getCols());
	}

	public double getPv() {return this.pv;}
	public double getRms() {return this.rms;}
	public double getRa() {return this.ra;}
	public double getDropoutPercentage() {return this.dropoutPercentage;}
	public int getRows() {return this.rows;}
	public int getCols() {return this.cols;}

	@Override
	public String toString() {
		return String.format(Locale.US, "%dx%d: PV=%.4f RMS=%.4f Ra=%.4f dropouts=%.2f%%",
				this.cols, this.rows, this.pv, this.rms, this.ra, this.dropoutPercentage);
	}
}
