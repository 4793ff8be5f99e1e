package com.elphel.imagej.interferogram;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.HashMap;
import java.util.Map;

import org.junit.Test;

import com.elphel.imagej.common.DegenerateDataException;

public class PhaseMapTest {
	private static final double NAN = Double.NaN;

	/** 5x5 grid, only the interior 3x3 block is valid, value 10*row+col */
	private static double [][] borderedGrid() {
		double [][] data=new double[5][5];
		for (int i=0;i<5;i++) for (int j=0;j<5;j++) {
			data[i][j]=((i==0) || (j==0) || (i==4) || (j==4))? NAN: 10*i+j;
		}
		return data;
	}

	private static double [][] tiltedPlane(int rows, int cols) {
		double [][] data=new double[rows][cols];
		for (int i=0;i<rows;i++) for (int j=0;j<cols;j++) data[i][j]=2.0*j+3.0*i+1.0;
		return data;
	}

	private static double [][] waves(int rows, int cols) {
		double [][] data=new double[rows][cols];
		for (int i=0;i<rows;i++) for (int j=0;j<cols;j++) {
			data[i][j]=Math.sin(2*Math.PI*j/5.0)+0.3*Math.cos(2*Math.PI*i/3.0)+0.01*i*j;
		}
		return data;
	}

	@Test
	public void cropKeepsInteriorValues() {
		PhaseMap cropped=(new PhaseMap(borderedGrid())).crop();
		assertEquals(3, cropped.getRows());
		assertEquals(3, cropped.getCols());
		double [][] phase=cropped.getPhase();
		for (int i=0;i<3;i++) for (int j=0;j<3;j++) assertEquals(10*(i+1)+(j+1), phase[i][j], 0.0);
		assertArrayEquals(new double[] {1.0, 2.0, 3.0}, cropped.getX(), 0.0);
		assertArrayEquals(new double[] {1.0, 2.0, 3.0}, cropped.getY(), 0.0);
		assertEquals(0.0, cropped.getDropoutPercentage(), 0.0);
	}

	@Test
	public void cropOfCroppedMapIsNoOp() {
		PhaseMap cropped=(new PhaseMap(borderedGrid())).crop();
		assertSame(cropped, cropped.crop());
	}

	@Test
	public void cropKeepsInteriorDropouts() {
		double [][] data=borderedGrid();
		data[2][2]=NAN;
		PhaseMap cropped=(new PhaseMap(data)).crop();
		assertEquals(3, cropped.getRows());
		assertEquals(100.0/9.0, cropped.getDropoutPercentage(), 1e-12);
	}

	@Test
	public void cropOfAsymmetricBlock() {
		double [][] data=new double[4][6];
		for (double [] row:data) java.util.Arrays.fill(row, NAN);
		data[1][4]=1.0;
		data[2][5]=2.0;
		PhaseMap cropped=(new PhaseMap(data, null, PhaseMapAxes.uniform(6, 4, 0.5), LengthScale.MM, null)).crop();
		assertEquals(2, cropped.getRows());
		assertEquals(2, cropped.getCols());
		assertArrayEquals(new double[] {2.0, 2.5}, cropped.getX(), 0.0);
		assertArrayEquals(new double[] {0.5, 1.0}, cropped.getY(), 0.0);
		assertEquals(0.5, cropped.getSampleSpacing(), 0.0);
	}

	@Test(expected=DegenerateDataException.class)
	public void cropOfAllInvalidMapFails() {
		(new PhaseMap(new double[][] {{NAN, NAN}, {NAN, NAN}})).crop();
	}

	@Test
	public void removePistonZeroesMean() {
		PhaseMap map=new PhaseMap(waves(6, 10)).removePiston();
		assertEquals(0.0, map.getMean(), 1e-12);
	}

	@Test
	public void removePistonKeepsDropouts() {
		double [][] data= {{1.0, NAN}, {3.0, 5.0}};
		PhaseMap map=new PhaseMap(data).removePiston();
		double [][] phase=map.getPhase();
		assertTrue(Double.isNaN(phase[0][1]));
		assertEquals(-2.0, phase[0][0], 1e-15);
		assertEquals(2.0, phase[1][1], 1e-15);
		assertEquals(25.0, map.getDropoutPercentage(), 0.0);
	}

	@Test
	public void removeTipTiltLeavesZeroResidual() {
		PhaseMap map=new PhaseMap(tiltedPlane(5, 7));
		assertArrayEquals(new double[] {2.0, 3.0, 1.0}, map.getPlaneCoefficients(), 1e-10);
		double [][] residual=map.removeTipTilt().getPhase();
		for (double [] row:residual) for (double d:row) assertEquals(0.0, d, 1e-10);
	}

	@Test
	public void removePistonTipTiltWithDropouts() {
		double [][] data=tiltedPlane(6, 6);
		for (int i=0;i<6;i++) for (int j=0;j<6;j++) data[i][j]+=0.1*Math.sin(i*7.0+j*3.0);
		data[0][0]=NAN;
		data[3][4]=NAN;
		PhaseMap map=new PhaseMap(data).removePistonTipTilt();
		assertEquals(0.0, map.getMean(), 1e-12);
		assertTrue(map.getPv()<0.5);
		assertTrue(Double.isNaN(map.getPhase()[3][4]));
	}

	@Test(expected=DegenerateDataException.class)
	public void removeTipTiltOfAllInvalidMapFails() {
		PhaseMap map=new PhaseMap(new double[][] {{NAN, NAN}, {NAN, NAN}});
		assertEquals(100.0, map.getDropoutPercentage(), 0.0);
		map.removeTipTilt();
	}

	@Test
	public void operationsDoNotModifySource() {
		double [][] data=tiltedPlane(4, 4);
		PhaseMap map=new PhaseMap(data);
		map.removePistonTipTilt();
		data[0][0]=100.0;
		assertEquals(1.0, map.getPhase()[0][0], 0.0);
		map.getPhase()[1][1]=-50.0;
		assertEquals(6.0, map.getPhase()[1][1], 0.0);
	}

	@Test
	public void fullBandRejectKeepsValuesAndDropouts() {
		double [][] data=waves(8, 11);
		data[2][3]=NAN;
		data[7][10]=NAN;
		PhaseMap map=new PhaseMap(data, null, PhaseMapAxes.uniform(11, 8, 0.2), LengthScale.UM, null);
		double [][] filtered=map.bandReject(0.0, Double.POSITIVE_INFINITY).getPhase();
		for (int i=0;i<8;i++) for (int j=0;j<11;j++) {
			if (Double.isFinite(data[i][j])) {
				assertEquals(data[i][j], filtered[i][j], 1e-12);
			} else {
				assertTrue(Double.isNaN(filtered[i][j]));
			}
		}
	}

	@Test
	public void bandRejectIsIdempotent() {
		PhaseMap map=new PhaseMap(waves(16, 20), null, PhaseMapAxes.uniform(20, 16, 1.0), LengthScale.UM, null);
		double [][] once= map.bandReject(3.0, 8.0).getPhase();
		double [][] twice=map.bandReject(3.0, 8.0).bandReject(3.0, 8.0).getPhase();
		for (int i=0;i<16;i++) assertArrayEquals(once[i], twice[i], 1e-10);
	}

	@Test
	public void bandRejectAcceptsDescendingAxes() {
		double [][] data=waves(3, 5);
		data[1][2]=NAN;
		PhaseMapAxes descending=PhaseMapAxes.physical(new double[] {4.0, 3.0, 2.0, 1.0, 0.0}, new double[] {2.0, 1.0, 0.0});
		PhaseMapAxes ascending= PhaseMapAxes.uniform(5, 3, 1.0);
		PhaseMap map=new PhaseMap(data, null, descending, LengthScale.UM, null);
		assertEquals(-1.0, map.getSampleSpacing(), 0.0);
		double [][] full=map.bandReject(0.0, Double.POSITIVE_INFINITY).getPhase();
		for (int i=0;i<3;i++) for (int j=0;j<5;j++) {
			if (Double.isFinite(data[i][j])) {
				assertEquals(data[i][j], full[i][j], 1e-12);
			} else {
				assertTrue(Double.isNaN(full[i][j]));
			}
		}
		double [][] band=     map.bandReject(2.5, 4.0).getPhase();
		double [][] reference=new PhaseMap(data, null, ascending, LengthScale.UM, null).bandReject(2.5, 4.0).getPhase();
		for (int i=0;i<3;i++) assertArrayEquals(reference[i], band[i], 1e-12);
		assertEquals(14, map.getValidSampleCount());
	}

	@Test(expected=IllegalStateException.class)
	public void bandRejectNeedsPhysicalAxes() {
		new PhaseMap(waves(4, 4)).bandReject(1.0, 2.0);
	}

	@Test
	public void measurementAxesUseLateralResolutionAndScale() {
		Map<String,Object> meta=new HashMap<String,Object>();
		meta.put(MeasurementData.LATERAL_RESOLUTION, 0.5);
		meta.put("instrument", "test");
		MeasurementData data=new MeasurementData(waves(3, 4), waves(3, 4), meta);
		PhaseMap map=PhaseMap.fromMeasurement(data, "MM");
		assertEquals(LengthScale.MM, map.getScale());
		assertTrue(map.hasPhysicalCoordinates());
		assertEquals(0.5*1e3, map.getSampleSpacing(), 0.0);
		assertArrayEquals(new double[] {0.0, 500.0, 1000.0, 1500.0}, map.getX(), 0.0);
		assertArrayEquals(new double[] {0.0, 500.0, 1000.0}, map.getY(), 0.0);
		assertEquals("test", map.getMeta().get("instrument"));
		assertTrue(map.getIntensity().isPresent());
		assertArrayEquals(new String[] {"x [mm]", "y [mm]"}, map.getAxisLabels());
	}

	@Test(expected=IllegalArgumentException.class)
	public void unknownScaleIsRejected() {
		Map<String,Object> meta=new HashMap<String,Object>();
		meta.put(MeasurementData.LATERAL_RESOLUTION, 1e-6);
		PhaseMap.fromMeasurement(new MeasurementData(waves(2, 2), null, meta), "nm");
	}

	@Test(expected=IllegalArgumentException.class)
	public void missingLateralResolutionIsRejected() {
		PhaseMap.fromMeasurement(new MeasurementData(waves(2, 2), null, null), "um");
	}

	@Test(expected=IllegalArgumentException.class)
	public void intensityShapeMustMatchPhase() {
		new PhaseMap(waves(3, 3), waves(3, 4), null, LengthScale.UM, null);
	}

	@Test
	public void syntheticAxesArePixelIndices() {
		PhaseMap map=new PhaseMap(waves(2, 3));
		assertFalse(map.hasPhysicalCoordinates());
		assertArrayEquals(new double[] {0.0, 1.0, 2.0}, map.getX(), 0.0);
		assertArrayEquals(new double[] {0.0, 1.0}, map.getY(), 0.0);
		assertArrayEquals(new String[] {"x [px]", "y [px]"}, map.getAxisLabels());
		assertFalse(map.getIntensity().isPresent());
	}

	@Test
	public void decomposePassesPhaseToService() {
		double [][] data= {{1.0, NAN}, {2.0, 3.0}};
		final String [] received=new String[1];
		PolynomialDecomposition service=(phase, setName, normalize) -> {
			received[0]=setName+":"+normalize+":"+PhaseStatistics.countFinite(phase);
			return new double[] {phase[1][1]};
		};
		double [] coefficients=new PhaseMap(data).decompose(service, "fringe", true);
		assertEquals("fringe:true:3", received[0]);
		assertArrayEquals(new double[] {3.0}, coefficients, 0.0);
	}
}
