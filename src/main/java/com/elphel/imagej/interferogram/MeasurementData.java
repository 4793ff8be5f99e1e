package com.elphel.imagej.interferogram;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 **
 ** MeasurementData - parsed interferometer measurement: phase, optional intensity and metadata
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  MeasurementData.java is free software: you can redistribute it and/or modify
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

public final class MeasurementData {
	/** Metadata key: lateral distance between samples, meters */
	public static final String LATERAL_RESOLUTION = "lateral_resolution";

	private final double [][] phase;
	private final double [][] intensity; // null if absent
	private final Map<String,Object> meta;

	public MeasurementData(double [][] phase, double [][] intensity, Map<String,Object> meta) {
		if ((phase==null) || (phase.length==0)) {
			String msg="Measurement has no phase data";
			throw new IllegalArgumentException (msg);
		}
		this.phase=phase;
		this.intensity=intensity;
		this.meta=(meta==null)? Collections.<String,Object>emptyMap(): Collections.unmodifiableMap(new LinkedHashMap<String,Object>(meta));
	}

	public double [][] getPhase() {return this.phase;}
	public Optional<double [][]> getIntensity() {return Optional.ofNullable(this.intensity);}
	public Map<String,Object> getMeta() {return this.meta;}

	/**
	 * @return lateral resolution, meters per sample
	 * @throws IllegalArgumentException if it is missing, not a number or not positive
	 */
	public double getLateralResolution() {
		Object value=this.meta.get(LATERAL_RESOLUTION);
		if (!(value instanceof Number)) {
			String msg="Measurement metadata has no numeric \""+LATERAL_RESOLUTION+"\" (got "+value+")";
			throw new IllegalArgumentException (msg);
		}
		double res=((Number) value).doubleValue();
		if (!(res>0.0) || Double.isInfinite(res)) {
			String msg="Lateral resolution should be positive and finite, got "+res;
			throw new IllegalArgumentException (msg);
		}
		return res;
	}
}
