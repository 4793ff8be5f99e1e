package com.elphel.imagej.interferogram;
import java.util.Locale;

/**
 **
 ** LengthScale - lateral units of the physical coordinate axes
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  LengthScale.java is free software: you can redistribute it and/or modify
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

public enum LengthScale {
	UM ("um", 1.0E6),
	MM ("mm", 1.0E3);

	private final String key;
	private final double metersToUnits;

	LengthScale(String key, double metersToUnits) {
		this.key=key;
		this.metersToUnits=metersToUnits;
	}

	/** Configuration key, also the ImageJ calibration unit */
	public String getKey() {return this.key;}

	/** Multiplier converting meters to this unit */
	public double getScaleFactor() {return this.metersToUnits;}

	/**
	 * Case-insensitive lookup
	 * @param name "um" or "mm"
	 * @return matching scale
	 * @throws IllegalArgumentException for any other name
	 */
	public static LengthScale fromString(String name) {
		if (name!=null) {
			String lc=name.trim().toLowerCase(Locale.ROOT);
			for (LengthScale scale:values()) if (scale.key.equals(lc)) return scale;
		}
		String msg="Unknown scale \""+name+"\", expected one of um, mm";
		throw new IllegalArgumentException (msg);
	}

	@Override
	public String toString() {return this.key;}
}
