package com.elphel.imagej.interferogram;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.File;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import ij.ImagePlus;
import ij.ImageStack;
import ij.io.FileSaver;
import ij.measure.Calibration;
import ij.process.FloatProcessor;

public class ImagePlusMeasurementReaderTest {
	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private static FloatProcessor ramp(int width, int height, float offset) {
		float [] pixels=new float[width*height];
		for (int i=0;i<pixels.length;i++) pixels[i]=offset+i;
		return new FloatProcessor(width, height, pixels);
	}

	private static void calibrate(ImagePlus imp, double pixelWidth, String unit) {
		Calibration cal=imp.getCalibration();
		cal.pixelWidth=pixelWidth;
		cal.pixelHeight=pixelWidth;
		cal.setUnit(unit);
	}

	@Test
	public void readsPhaseAndCalibration() {
		FloatProcessor fp=ramp(4, 3, 0.0f);
		fp.setf(1, 2, Float.NaN);
		ImagePlus imp=new ImagePlus("zygo", fp);
		calibrate(imp, 0.5, "um");
		MeasurementData data=(new ImagePlusMeasurementReader()).read(imp);
		assertEquals(0.5e-6, data.getLateralResolution(), 1e-18);
		double [][] phase=data.getPhase();
		assertEquals(3, phase.length);
		assertEquals(4, phase[0].length);
		assertEquals(6.0, phase[1][2], 0.0);
		assertTrue(Double.isNaN(phase[2][1]));
		assertFalse(data.getIntensity().isPresent());
		assertEquals("zygo", data.getMeta().get(ImagePlusMeasurementReader.META_TITLE));

		PhaseMap map=PhaseMap.fromMeasurement(data, "um");
		assertEquals(0.5, map.getSampleSpacing(), 1e-12);
		assertEquals(100.0/12.0, map.getDropoutPercentage(), 1e-12);
	}

	@Test
	public void secondSliceIsIntensity() {
		ImageStack stack=new ImageStack(3, 2);
		stack.addSlice("phase", ramp(3, 2, 0.0f));
		stack.addSlice("intensity", ramp(3, 2, 100.0f));
		ImagePlus imp=new ImagePlus("two slices", stack);
		calibrate(imp, 2.0, "mm");
		MeasurementData data=(new ImagePlusMeasurementReader()).read(imp);
		assertEquals(2.0e-3, data.getLateralResolution(), 1e-15);
		assertTrue(data.getIntensity().isPresent());
		assertEquals(105.0, data.getIntensity().get()[1][2], 0.0);
	}

	@Test(expected=IllegalArgumentException.class)
	public void uncalibratedImageFails() {
		(new ImagePlusMeasurementReader()).read(new ImagePlus("raw", ramp(2, 2, 0.0f)));
	}

	@Test
	public void unitsConvertToMeters() {
		assertEquals(1.0, ImagePlusMeasurementReader.metersPerUnit("m"), 0.0);
		assertEquals(1.0e-3, ImagePlusMeasurementReader.metersPerUnit("mm"), 0.0);
		assertEquals(1.0e-6, ImagePlusMeasurementReader.metersPerUnit("micron"), 0.0);
		assertEquals(1.0e-6, ImagePlusMeasurementReader.metersPerUnit("µm"), 0.0);
		assertEquals(1.0e-9, ImagePlusMeasurementReader.metersPerUnit("nm"), 0.0);
	}

	@Test(expected=IllegalArgumentException.class)
	public void unknownUnitFails() {
		ImagePlusMeasurementReader.metersPerUnit("inch");
	}

	@Test
	public void readsTiffFile() throws Exception {
		ImagePlus imp=new ImagePlus("saved", ramp(5, 4, 1.0f));
		calibrate(imp, 0.5, "um");
		File file=new File(folder.getRoot(), "phase.tif");
		assertTrue((new FileSaver(imp)).saveAsTiff(file.getPath()));
		MeasurementData data=(new ImagePlusMeasurementReader()).read(file.getPath());
		assertEquals(0.5e-6, data.getLateralResolution(), 1e-15);
		assertEquals(4, data.getPhase().length);
		assertEquals(20.0, data.getPhase()[3][4], 0.0);
		assertEquals(file.getPath(), data.getMeta().get(ImagePlusMeasurementReader.META_PATH));
	}
}
