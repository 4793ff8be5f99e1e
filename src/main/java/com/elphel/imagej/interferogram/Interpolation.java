package com.elphel.imagej.interferogram;
import java.util.Locale;

import ij.process.ImageProcessor;

/**
 **
 ** Interpolation - display interpolation of rendered phase maps
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  Interpolation.java is free software: you can redistribute it and/or modify
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

public enum Interpolation {
	NONE     (ImageProcessor.NONE),
	BILINEAR (ImageProcessor.BILINEAR),
	BICUBIC  (ImageProcessor.BICUBIC);

	private final int method;

	Interpolation(int method) {
		this.method=method;
	}

	/** ImageProcessor interpolation constant */
	public int getMethod() {return this.method;}

	public static Interpolation fromString(String name) {
		if (name!=null) {
			String uc=name.trim().toUpperCase(Locale.ROOT);
			for (Interpolation interpolation:values()) if (interpolation.name().equals(uc)) return interpolation;
		}
		String msg="Unknown interpolation \""+name+"\", expected one of none, bilinear, bicubic";
		throw new IllegalArgumentException (msg);
	}
}
