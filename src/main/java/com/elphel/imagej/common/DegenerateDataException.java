package com.elphel.imagej.common;
/**
 **
 ** DegenerateDataException - not enough valid samples for a numerical operation
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  DegenerateDataException.java is free software: you can redistribute it and/or modify
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
 * Thrown when the data does not support the requested computation: a singular
 * least-squares system, a grid without finite samples, a crop that collapses to
 * zero area.
 */
public class DegenerateDataException extends RuntimeException {
	private static final long serialVersionUID = 3113262713254172447L;

	public DegenerateDataException(String msg) {
		super(msg);
	}
}
