package com.elphel.imagej.interferogram;
import ij.IJ;
import ij.ImagePlus;

/**
 **
 ** InterferogramProcessor - crop, piston/tip/tilt removal and band-reject filtering of phase maps
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  InterferogramProcessor.java is free software: you can redistribute it and/or modify
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

public class InterferogramProcessor {
	private final InterferogramParameters parameters;

	public InterferogramProcessor(InterferogramParameters parameters) {
		parameters.validate();
		this.parameters=parameters;
	}

	/**
	 * Run the enabled steps in order: crop, tip/tilt removal, piston removal, band-reject filter
	 * @param map source phase map, not modified
	 * @return processed phase map
	 */
	public PhaseMap process(PhaseMap map) {
		long startTime=System.nanoTime();
		int debugLevel=this.parameters.debugLevel;
		if (debugLevel>1) System.out.println("Processing "+map);
		if (this.parameters.crop) {
			map=map.crop();
			if (debugLevel>1) System.out.println("Cropped to "+map.getCols()+"x"+map.getRows()+", "+map.getValidSampleCount()+" valid samples : "+IJ.d2s(0.000000001*(System.nanoTime()-startTime),3));
		}
		if (this.parameters.removeTipTilt) {
			if (debugLevel>1) {
				double [] abc=map.getPlaneCoefficients();
				System.out.println("Removing tip/tilt: a="+abc[0]+" b="+abc[1]+" c="+abc[2]);
			}
			map=map.removeTipTilt();
		}
		if (this.parameters.removePiston) {
			if (debugLevel>1) System.out.println("Removing piston "+map.getMean());
			map=map.removePiston();
		}
		if (this.parameters.bandReject) {
			map=map.bandReject(this.parameters.wavelengthLow, this.parameters.wavelengthHigh);
			if (debugLevel>1) System.out.println("Band-reject filter "+this.parameters.wavelengthLow+".."+this.parameters.wavelengthHigh+
					" "+map.getScale()+" : "+IJ.d2s(0.000000001*(System.nanoTime()-startTime),3));
		}
		if (debugLevel>0) System.out.println("Processed phase map "+summarize(map)+" in "+IJ.d2s(0.000000001*(System.nanoTime()-startTime),3)+" sec");
		return map;
	}

	public PhaseMapSummary summarize(PhaseMap map) {
		return PhaseMapSummary.of(map);
	}

	/** Image of the phase map with the configured colormap, limits and interpolation (not shown) */
	public ImagePlus render(PhaseMap map, String title) {
		return (new PhaseMapRenderer()).render(
				map,
				title,
				this.parameters.colormap,
				this.parameters.colorMin,
				this.parameters.colorMax,
				this.parameters.interpolation);
	}
}
