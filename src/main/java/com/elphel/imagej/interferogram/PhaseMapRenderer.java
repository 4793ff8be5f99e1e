package com.elphel.imagej.interferogram;
import java.awt.image.IndexColorModel;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

import ij.ImagePlus;
import ij.measure.Calibration;
import ij.plugin.LutLoader;
import ij.process.FloatProcessor;

/**
 **
 ** PhaseMapRenderer - phase map to a displayable ImageJ image
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  PhaseMapRenderer.java is free software: you can redistribute it and/or modify
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

public class PhaseMapRenderer {
	public static final String PROPERTY_XLABEL = "xlabel";
	public static final String PROPERTY_YLABEL = "ylabel";
	public static final String PROPERTY_ZLABEL = "zlabel";
	/** LUTs built into ImageJ, usable without the luts directory */
	public static final List<String> COLORMAPS = Arrays.asList(
			"fire", "grays", "ice", "spectrum", "red", "green", "blue", "cyan", "magenta", "yellow");

	public static void checkColormap(String colormap) {
		if ((colormap==null) || !COLORMAPS.contains(colormap.toLowerCase(Locale.ROOT))) {
			String msg="Unknown colormap \""+colormap+"\", expected one of "+COLORMAPS;
			throw new IllegalArgumentException (msg);
		}
	}

	/**
	 * Render with automatic color limits (finite minimum and maximum)
	 */
	public ImagePlus render(PhaseMap map, String title, String colormap, Interpolation interpolation) {
		return render(map, title, colormap, Double.NaN, Double.NaN, interpolation);
	}

	/**
	 * Create an image of the phase map. The image is not shown.
	 * @param map phase map
	 * @param title image title
	 * @param colormap ImageJ LUT name, one of {@link #COLORMAPS}
	 * @param colorMin lower display limit, NaN - minimum of finite samples
	 * @param colorMax upper display limit, NaN - maximum of finite samples
	 * @param interpolation display interpolation
	 * @return 32-bit image, dropouts are NaN. Axis labels are stored as image properties
	 *         {@link #PROPERTY_XLABEL}, {@link #PROPERTY_YLABEL}, {@link #PROPERTY_ZLABEL}
	 */
	public ImagePlus render(
			PhaseMap map,
			String title,
			String colormap,
			double colorMin,
			double colorMax,
			Interpolation interpolation) {
		checkColormap(colormap);
		IndexColorModel cm=LutLoader.getLut(colormap.toLowerCase(Locale.ROOT));
		if (cm==null) {
			String msg="ImageJ does not provide colormap \""+colormap+"\"";
			throw new IllegalArgumentException (msg);
		}
		double [][] phase=map.getPhase();
		int width=map.getCols();
		int height=map.getRows();
		float [] pixels=new float[width*height];
		for (int i=0;i<height;i++) for (int j=0;j<width;j++) pixels[i*width+j]=(float) phase[i][j];
		double min=Double.isNaN(colorMin)? PhaseStatistics.min(phase): colorMin;
		double max=Double.isNaN(colorMax)? PhaseStatistics.max(phase): colorMax;
		if (!(max>=min)) {
			String msg="Color limits should satisfy min <= max, got "+min+", "+max;
			throw new IllegalArgumentException (msg);
		}
		FloatProcessor fp=new FloatProcessor(width, height, pixels, cm);
		fp.setInterpolationMethod(interpolation.getMethod());
		ImagePlus imp=new ImagePlus(title, fp);
		imp.getProcessor().setMinAndMax(min, max);
		imp.setCalibration(calibrationOf(map));
		String [] labels=map.getAxisLabels();
		imp.setProperty(PROPERTY_XLABEL, labels[0]);
		imp.setProperty(PROPERTY_YLABEL, labels[1]);
		imp.setProperty(PROPERTY_ZLABEL, AxisLabels.HEIGHT_LABEL);
		return imp;
	}

	/** Spatial calibration matching the axes: spacing, origin at x=0,y=0 and units */
	public static Calibration calibrationOf(PhaseMap map) {
		Calibration cal=new Calibration();
		double [] x=map.getX();
		double [] y=map.getY();
		double dx=1.0, dy=1.0;
		if (map.hasPhysicalCoordinates()) {
			if (x.length>1) dx=x[1]-x[0];
			dy=(y.length>1)? (y[1]-y[0]): dx;
			if (x.length<2) dx=dy;
			cal.setUnit(map.getScale().getKey());
		}
		cal.pixelWidth=dx;
		cal.pixelHeight=dy;
		cal.xOrigin=-x[0]/dx;
		cal.yOrigin=-y[0]/dy;
		return cal;
	}
}
