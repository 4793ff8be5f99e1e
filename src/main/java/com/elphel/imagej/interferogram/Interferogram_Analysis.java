package com.elphel.imagej.interferogram;
import com.elphel.imagej.common.DegenerateDataException;

import ij.IJ;
import ij.ImagePlus;
import ij.WindowManager;
import ij.plugin.PlugIn;

/**
 **
 ** Interferogram_Analysis - ImageJ command processing the current phase image
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  Interferogram_Analysis.java is free software: you can redistribute it and/or modify
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

public class Interferogram_Analysis implements PlugIn {
	public static InterferogramParameters PARAMETERS = new InterferogramParameters();

	@Override
	public void run(String arg) {
		ImagePlus imp=WindowManager.getCurrentImage();
		if (imp==null) {
			IJ.showMessage("Error","There are no images open");
			return;
		}
		if (!PARAMETERS.showDialog("Interferogram analysis")) return;
		ImagePlus result;
		PhaseMapSummary summary;
		try {
			PhaseMap map=load(imp, PARAMETERS);
			InterferogramProcessor processor=new InterferogramProcessor(PARAMETERS);
			PhaseMap processed=processor.process(map);
			summary=processor.summarize(processed);
			result=processor.render(processed, imp.getTitle()+"-processed");
		} catch (IllegalArgumentException | IllegalStateException | DegenerateDataException e) {
			IJ.showMessage("Error",e.getMessage());
			return;
		}
		IJ.log(imp.getTitle()+" "+summary);
		if (PARAMETERS.show) result.show();
	}

	/**
	 * Calibrated images get physical axes, others pixel axes (band-reject filter is then unavailable)
	 */
	public static PhaseMap load(ImagePlus imp, InterferogramParameters parameters) {
		ImagePlusMeasurementReader reader=new ImagePlusMeasurementReader(parameters.debugLevel);
		if (ImagePlusMeasurementReader.isCalibrated(imp)) {
			return PhaseMap.fromMeasurement(reader.read(imp), parameters.scale.getKey());
		}
		if (parameters.debugLevel>0) System.out.println("Image "+imp.getTitle()+" is not calibrated, using pixel coordinates");
		return new PhaseMap(reader.readPhase(imp), reader.readIntensity(imp), null, parameters.scale, null);
	}
}
