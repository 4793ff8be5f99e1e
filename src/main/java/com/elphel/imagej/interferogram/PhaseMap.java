package com.elphel.imagej.interferogram;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.elphel.imagej.common.DegenerateDataException;

/**
 **
 ** PhaseMap - interferometric phase (height/wavefront error) map
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  PhaseMap.java is free software: you can redistribute it and/or modify
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
 * Phase map of a single measurement: phase grid [rows][cols] (non-finite samples are dropouts),
 * optional intensity grid, x/y axes and lateral scale.
 * <p>
 * Instances are immutable. Each normalization operation returns a new map and leaves this one
 * unchanged, so operations can be chained and a failed operation never leaves a half-processed map:
 * <pre>
 * double pv = map.crop().removePistonTipTilt().bandReject(0.1, 10.0).getPv();
 * </pre>
 * Statistics are recalculated on every call.
 */
public final class PhaseMap {
	private final double [][] phase;
	private final double [][] intensity; // null when absent
	private final PhaseMapAxes axes;
	private final LengthScale scale;
	private final Map<String,Object> meta;

	/** Phase map with pixel axes, um scale, no intensity or metadata */
	public PhaseMap(double [][] phase) {
		this(phase, null, null, LengthScale.UM, null);
	}

	/**
	 * @param phase phase grid [rows][cols], copied
	 * @param intensity intensity grid of the same shape or null, copied
	 * @param axes coordinates, null for pixel axes
	 * @param scale lateral units of physical axes
	 * @param meta metadata, passed through unchanged, may be null
	 */
	public PhaseMap(
			double [][] phase,
			double [][] intensity,
			PhaseMapAxes axes,
			LengthScale scale,
			Map<String,Object> meta) {
		int [] shape=shapeOf(phase, "phase");
		if (intensity!=null) {
			int [] iShape=shapeOf(intensity, "intensity");
			if ((iShape[0]!=shape[0]) || (iShape[1]!=shape[1])) {
				String msg="Intensity shape "+iShape[0]+"x"+iShape[1]+" differs from phase shape "+shape[0]+"x"+shape[1];
				throw new IllegalArgumentException (msg);
			}
		}
		if (axes==null) {
			axes=PhaseMapAxes.synthetic(shape[1], shape[0]);
		} else if ((axes.getCols()!=shape[1]) || (axes.getRows()!=shape[0])) {
			String msg="Axes size "+axes.getCols()+"x"+axes.getRows()+" does not match phase "+shape[1]+"x"+shape[0];
			throw new IllegalArgumentException (msg);
		}
		if (scale==null) {
			String msg="Scale should be specified";
			throw new IllegalArgumentException (msg);
		}
		this.phase=copy(phase);
		this.intensity=(intensity==null)?null:copy(intensity);
		this.axes=axes;
		this.scale=scale;
		this.meta=(meta==null)? Collections.<String,Object>emptyMap(): Collections.unmodifiableMap(new LinkedHashMap<String,Object>(meta));
	}

	/** Derived maps share the (already validated and owned) arrays, intensity is not reshaped by crop */
	private PhaseMap(PhaseMap source, double [][] phase, PhaseMapAxes axes) {
		this.phase=phase;
		this.intensity=source.intensity;
		this.axes=axes;
		this.scale=source.scale;
		this.meta=source.meta;
	}

	/**
	 * Phase map with physical axes from a parsed measurement. Coordinates are pixel index times
	 * lateral resolution (meters) times the scale factor of the selected units.
	 * @param data parsed measurement, metadata should contain {@link MeasurementData#LATERAL_RESOLUTION}
	 * @param scaleName "um" or "mm", case-insensitive
	 */
	public static PhaseMap fromMeasurement(MeasurementData data, String scaleName) {
		LengthScale scale=LengthScale.fromString(scaleName);
		double res=data.getLateralResolution()*scale.getScaleFactor();
		double [][] phase=data.getPhase();
		int [] shape=shapeOf(phase, "phase");
		PhaseMapAxes axes=PhaseMapAxes.uniform(shape[1], shape[0], res);
		return new PhaseMap(phase, data.getIntensity().orElse(null), axes, scale, data.getMeta());
	}

	public double [][] getPhase() {return copy(this.phase);}
	public Optional<double [][]> getIntensity() {return Optional.ofNullable((this.intensity==null)?null:copy(this.intensity));}
	public PhaseMapAxes getAxes() {return this.axes;}
	public double [] getX() {return this.axes.getX();}
	public double [] getY() {return this.axes.getY();}
	public LengthScale getScale() {return this.scale;}
	public Map<String,Object> getMeta() {return this.meta;}
	public boolean hasPhysicalCoordinates() {return this.axes.isPhysical();}
	public int getRows() {return this.phase.length;}
	public int getCols() {return this.phase[0].length;}
	/** @throws IllegalStateException for pixel axes */
	public double getSampleSpacing() {return this.axes.getSampleSpacing();}
	public String [] getAxisLabels() {return AxisLabels.forAxes(this.axes, this.scale);}

	public double getPv() {return PhaseStatistics.pv(this.phase);}
	public double getRms() {return PhaseStatistics.rms(this.phase);}
	public double getRa() {return PhaseStatistics.ra(this.phase);}
	public double getMean() {return PhaseStatistics.mean(this.phase);}
	public double getDropoutPercentage() {return PhaseStatistics.dropoutPercentage(this.phase);}
	public int getValidSampleCount() {return PhaseStatistics.countFinite(this.phase);}

	/**
	 * Crop to the smallest rectangle containing all finite samples. Axes are cropped with the phase,
	 * intensity is kept as is.
	 * @throws DegenerateDataException if there are no finite samples
	 */
	public PhaseMap crop() {
		int rows=this.phase.length;
		int cols=this.phase[0].length;
		boolean [] rowValid=new boolean[rows];
		boolean [] colValid=new boolean[cols];
		for (int i=0;i<rows;i++) for (int j=0;j<cols;j++) if (Double.isFinite(this.phase[i][j])) {
			rowValid[i]=true;
			colValid[j]=true;
		}
		int top=firstTrue(rowValid),  bottom=lastTrue(rowValid)+1;
		int left=firstTrue(colValid), right=lastTrue(colValid)+1;
		if ((top<0) || (left<0) || (bottom<=top) || (right<=left)) {
			throw new DegenerateDataException("Crop failed: no finite samples in "+rows+"x"+cols+" phase map");
		}
		if ((top==0) && (left==0) && (bottom==rows) && (right==cols)) return this;
		double [][] cropped=new double[bottom-top][];
		for (int i=top;i<bottom;i++) {
			cropped[i-top]=new double[right-left];
			System.arraycopy(this.phase[i], left, cropped[i-top], 0, right-left);
		}
		return new PhaseMap(this, cropped, this.axes.crop(top, bottom, left, right));
	}

	/** Coefficients {a, b, c} of the least squares plane a*x+b*y+c through the finite samples */
	public double [] getPlaneCoefficients() {
		return (new PlaneFit()).fitCoefficients(this.axes.getX(), this.axes.getY(), this.phase);
	}

	/**
	 * Subtract the least squares plane
	 * @throws DegenerateDataException if finite samples do not define a plane
	 */
	public PhaseMap removeTipTilt() {
		double [][] plane=(new PlaneFit()).fitPlane(this.axes.getX(), this.axes.getY(), this.phase);
		double [][] residual=new double[this.phase.length][];
		for (int i=0;i<this.phase.length;i++) {
			residual[i]=new double[this.phase[i].length];
			for (int j=0;j<residual[i].length;j++) residual[i][j]=this.phase[i][j]-plane[i][j];
		}
		return new PhaseMap(this, residual, this.axes);
	}

	/**
	 * Subtract the mean of the finite samples, non-finite samples stay non-finite
	 * @throws DegenerateDataException if there are no finite samples
	 */
	public PhaseMap removePiston() {
		double mean=PhaseStatistics.mean(this.phase);
		double [][] residual=new double[this.phase.length][];
		for (int i=0;i<this.phase.length;i++) {
			residual[i]=new double[this.phase[i].length];
			for (int j=0;j<residual[i].length;j++) residual[i][j]=this.phase[i][j]-mean;
		}
		return new PhaseMap(this, residual, this.axes);
	}

	/** Tip/tilt removal followed by piston removal */
	public PhaseMap removePistonTipTilt() {
		return removeTipTilt().removePiston();
	}

	/**
	 * Band-reject filter the phase, keeping spatial wavelengths between wavelengthLow and wavelengthHigh
	 * (same units as the axes). Dropouts are zero-filled for the transform and marked invalid (NaN)
	 * again in the result. Axes may be descending, the mask depends only on the spacing magnitude.
	 * @throws IllegalStateException if the map has pixel axes
	 */
	public PhaseMap bandReject(double wavelengthLow, double wavelengthHigh) {
		double spacing=Math.abs(this.axes.getSampleSpacing());
		boolean [][] valid=PhaseStatistics.finiteMask(this.phase);
		double [][] filtered=(new BandRejectFilter()).filter(this.phase, spacing, wavelengthLow, wavelengthHigh);
		for (int i=0;i<filtered.length;i++) for (int j=0;j<filtered[i].length;j++) {
			if (!valid[i][j]) filtered[i][j]=Double.NaN;
		}
		return new PhaseMap(this, filtered, this.axes);
	}

	/**
	 * Fit a polynomial set with an external service
	 * @param decomposition fitting service
	 * @param setName polynomial set name
	 * @param normalize use normalized polynomials
	 * @return coefficients returned by the service
	 */
	public double [] decompose(PolynomialDecomposition decomposition, String setName, boolean normalize) {
		return decomposition.fit(copy(this.phase), setName, normalize);
	}

	@Override
	public String toString() {
		return "PhaseMap "+getCols()+"x"+getRows()+" ("+this.axes.getMode()+", "+this.scale+
				"), dropouts "+String.format("%.2f", getDropoutPercentage())+"%";
	}

	private static int firstTrue(boolean [] b) {
		for (int i=0;i<b.length;i++) if (b[i]) return i;
		return -1;
	}

	private static int lastTrue(boolean [] b) {
		for (int i=b.length-1;i>=0;i--) if (b[i]) return i;
		return -1;
	}

	private static int [] shapeOf(double [][] data, String name) {
		if ((data==null) || (data.length==0) || (data[0]==null) || (data[0].length==0)) {
			String msg="Empty "+name+" grid";
			throw new IllegalArgumentException (msg);
		}
		int cols=data[0].length;
		for (int i=1;i<data.length;i++) if ((data[i]==null) || (data[i].length!=cols)) {
			String msg="Ragged "+name+" grid: row "+i+" differs from "+cols+" columns";
			throw new IllegalArgumentException (msg);
		}
		return new int[] {data.length, cols};
	}

	private static double [][] copy(double [][] data) {
		double [][] result=new double[data.length][];
		for (int i=0;i<data.length;i++) result[i]=data[i].clone();
		return result;
	}
}
