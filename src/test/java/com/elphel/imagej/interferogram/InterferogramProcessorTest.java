package com.elphel.imagej.interferogram;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import ij.ImagePlus;

public class InterferogramProcessorTest {
	private static final double NAN = Double.NaN;

	/** tilted plane with an invalid border and one invalid interior sample */
	private static double [][] measurement() {
		double [][] data=new double[8][10];
		for (int i=0;i<8;i++) for (int j=0;j<10;j++) {
			data[i][j]=((i==0) || (i==7) || (j<2))? NAN: 0.5*j-0.25*i+3.0;
		}
		data[4][5]=NAN;
		return data;
	}

	private static InterferogramParameters quiet() {
		InterferogramParameters parameters=new InterferogramParameters();
		parameters.debugLevel=0;
		return parameters;
	}

	@Test
	public void defaultPipelineFlattensTiltedPlane() {
		InterferogramProcessor processor=new InterferogramProcessor(quiet());
		PhaseMap processed=processor.process(new PhaseMap(measurement()));
		assertEquals(6, processed.getRows());
		assertEquals(8, processed.getCols());
		PhaseMapSummary summary=processor.summarize(processed);
		assertEquals(0.0, summary.getPv(), 1e-10);
		assertEquals(0.0, summary.getRms(), 1e-10);
		assertEquals(0.0, summary.getRa(), 1e-10);
		assertEquals(100.0/48.0, summary.getDropoutPercentage(), 1e-12);
	}

	@Test
	public void disabledStepsAreSkipped() {
		InterferogramParameters parameters=quiet();
		parameters.crop=false;
		parameters.removeTipTilt=false;
		PhaseMap processed=(new InterferogramProcessor(parameters)).process(new PhaseMap(measurement()));
		assertEquals(8, processed.getRows());
		assertEquals(10, processed.getCols());
		assertEquals(0.0, processed.getMean(), 1e-12);
		assertTrue(processed.getPv()>1.0);
	}

	@Test
	public void bandRejectRunsOnPhysicalMaps() {
		InterferogramParameters parameters=quiet();
		parameters.debugLevel=2;
		parameters.bandReject=true;
		parameters.wavelengthLow=0.0;
		parameters.wavelengthHigh=Double.POSITIVE_INFINITY;
		double [][] data=measurement();
		for (int i=1;i<7;i++) for (int j=2;j<10;j++) if (Double.isFinite(data[i][j])) data[i][j]+=Math.sin(j);
		PhaseMap map=new PhaseMap(data, null, PhaseMapAxes.uniform(10, 8, 0.01), LengthScale.MM, null);
		InterferogramProcessor processor=new InterferogramProcessor(parameters);
		PhaseMap processed=processor.process(map);
		PhaseMap reference=map.crop().removePistonTipTilt();
		assertEquals(reference.getRms(), processed.getRms(), 1e-10);
		assertTrue(Double.isNaN(processed.getPhase()[3][3]));
		ImagePlus imp=processor.render(processed, "processed");
		assertEquals(8, imp.getWidth());
		assertEquals(0.01, imp.getCalibration().pixelWidth, 1e-15);
	}

	@Test(expected=IllegalStateException.class)
	public void bandRejectOfPixelMapFails() {
		InterferogramParameters parameters=quiet();
		parameters.bandReject=true;
		parameters.wavelengthLow=1.0;
		parameters.wavelengthHigh=5.0;
		(new InterferogramProcessor(parameters)).process(new PhaseMap(measurement()));
	}

	@Test(expected=IllegalArgumentException.class)
	public void invalidParametersAreRejected() {
		InterferogramParameters parameters=quiet();
		parameters.colormap="jet";
		new InterferogramProcessor(parameters);
	}
}
