package com.elphel.imagej.interferogram;

/**
 **
 ** AxisLabels - axis labels for phase map rendering
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  AxisLabels.java is free software: you can redistribute it and/or modify
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

public final class AxisLabels {
	public static final String HEIGHT_LABEL = "Height [nm]";

	private AxisLabels() {}

	/**
	 * @param physical true when the axes carry physical coordinates
	 * @param scale lateral units, ignored for pixel coordinates
	 * @return {x label, y label}
	 */
	public static String [] forAxes(boolean physical, LengthScale scale) {
		if (!physical) return new String[] {"x [px]", "y [px]"};
		switch (scale) {
		case UM: return new String[] {"x [µm]", "y [µm]"};
		case MM: return new String[] {"x [mm]", "y [mm]"};
		default:
			String msg="Unsupported scale "+scale;
			throw new IllegalArgumentException (msg);
		}
	}

	public static String [] forAxes(PhaseMapAxes axes, LengthScale scale) {
		return forAxes(axes.isPhysical(), scale);
	}
}
