package com.elphel.imagej.interferogram;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import ij.ImagePlus;
import ij.ImageStack;
import ij.io.Opener;
import ij.measure.Calibration;
import ij.process.ImageProcessor;

/**
 **
 ** ImagePlusMeasurementReader - measurement data from ImageJ images
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ImagePlusMeasurementReader.java is free software: you can redistribute it and/or modify
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
 * Reads a phase map measurement from an ImageJ image. Slice 1 is the phase, slice 2 (if present) the
 * intensity. The lateral resolution is taken from the spatial calibration of the image.
 */
public class ImagePlusMeasurementReader {
	public static final String META_TITLE = "title";
	public static final String META_UNIT =  "unit";
	public static final String META_PATH =  "path";
	public int debugLevel=0;

	public ImagePlusMeasurementReader(){}
	public ImagePlusMeasurementReader(int debugLevel){
		this.debugLevel=debugLevel;
	}

	/**
	 * Open an image file (any format ImageJ opens) and read it as a measurement
	 * @param path image file path
	 * @throws IOException if ImageJ can not open the file
	 */
	public MeasurementData read(String path) throws IOException {
		ImagePlus imp=(new Opener()).openImage(path);
		if (imp==null) {
			throw new IOException("Failed to open image file "+path);
		}
		if (this.debugLevel>0) System.out.println("Opened "+path+": "+imp.getWidth()+"x"+imp.getHeight()+", "+imp.getStackSize()+" slice(s)");
		MeasurementData data=read(imp);
		Map<String,Object> meta=new LinkedHashMap<String,Object>(data.getMeta());
		meta.put(META_PATH, path);
		return new MeasurementData(data.getPhase(), data.getIntensity().orElse(null), meta);
	}

	/**
	 * @param imp spatially calibrated image
	 * @throws IllegalArgumentException if the image is not calibrated or its unit is not a length
	 */
	public MeasurementData read(ImagePlus imp) {
		Calibration cal=imp.getCalibration();
		if (!isCalibrated(imp)) {
			String msg="Image "+imp.getTitle()+" has no spatial calibration, lateral resolution is unknown";
			throw new IllegalArgumentException (msg);
		}
		double lateralResolution=cal.pixelWidth*metersPerUnit(cal.getUnit());
		Map<String,Object> meta=new LinkedHashMap<String,Object>();
		meta.put(MeasurementData.LATERAL_RESOLUTION, lateralResolution);
		meta.put(META_TITLE, imp.getTitle());
		meta.put(META_UNIT, cal.getUnit());
		if (this.debugLevel>0) System.out.println("Image "+imp.getTitle()+": lateral resolution "+lateralResolution+" m");
		return new MeasurementData(readPhase(imp), readIntensity(imp), meta);
	}

	public static boolean isCalibrated(ImagePlus imp) {
		Calibration cal=imp.getCalibration();
		return (cal!=null) && cal.scaled() && (cal.pixelWidth>0.0);
	}

	/** First slice as a [rows][cols] grid, NaN pixels of float images are dropouts */
	public double [][] readPhase(ImagePlus imp) {
		return toGrid(imp.getStack(), 1);
	}

	/** Second slice as a [rows][cols] grid, or null for single-slice images */
	public double [][] readIntensity(ImagePlus imp) {
		if (imp.getStackSize()<2) return null;
		return toGrid(imp.getStack(), 2);
	}

	/**
	 * @param unit ImageJ calibration unit
	 * @return meters per unit
	 */
	public static double metersPerUnit(String unit) {
		String u=(unit==null)?"":unit.trim().toLowerCase(Locale.ROOT);
		switch (u) {
		case "m":
		case "meter":
		case "meters":
			return 1.0;
		case "mm":
		case "millimeter":
		case "millimeters":
			return 1.0E-3;
		case "um":
		case "µm":
		case "μm":
		case "micron":
		case "microns":
		case "micrometer":
		case "micrometers":
			return 1.0E-6;
		case "nm":
		case "nanometer":
		case "nanometers":
			return 1.0E-9;
		default:
			String msg="Unsupported calibration unit \""+unit+"\"";
			throw new IllegalArgumentException (msg);
		}
	}

	private static double [][] toGrid(ImageStack stack, int slice) {
		ImageProcessor ip=stack.getProcessor(slice).convertToFloat();
		int width=ip.getWidth();
		int height=ip.getHeight();
		float [] pixels=(float []) ip.getPixels();
		double [][] grid=new double[height][width];
		for (int i=0;i<height;i++) for (int j=0;j<width;j++) grid[i][j]=pixels[i*width+j];
		return grid;
	}
}
