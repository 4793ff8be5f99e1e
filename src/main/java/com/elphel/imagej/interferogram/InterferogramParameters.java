package com.elphel.imagej.interferogram;
import java.util.Properties;

import org.apache.commons.configuration.ConfigurationException;
import org.apache.commons.configuration.XMLConfiguration;

import ij.gui.GenericDialog;

/**
 **
 ** InterferogramParameters - phase map processing and display parameters
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  InterferogramParameters.java is free software: you can redistribute it and/or modify
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

public class InterferogramParameters {
	public LengthScale   scale=         LengthScale.UM;
	public boolean       crop=          true;
	public boolean       removeTipTilt= true;
	public boolean       removePiston=  true;
	public boolean       bandReject=    false;
	public double        wavelengthLow= 0.0;                      // shortest kept spatial wavelength, axes units
	public double        wavelengthHigh=Double.POSITIVE_INFINITY; // longest kept spatial wavelength, axes units
	public String        colormap=      "fire";
	public double        colorMin=      Double.NaN;               // NaN - automatic
	public double        colorMax=      Double.NaN;
	public Interpolation interpolation= Interpolation.BICUBIC;
	public boolean       show=          true;
	public int           debugLevel=    1;

	public InterferogramParameters(){}

	public void setProperties(String prefix,Properties properties){
		properties.setProperty(prefix+"scale",          this.scale.getKey());
		properties.setProperty(prefix+"crop",           this.crop+"");
		properties.setProperty(prefix+"removeTipTilt",  this.removeTipTilt+"");
		properties.setProperty(prefix+"removePiston",   this.removePiston+"");
		properties.setProperty(prefix+"bandReject",     this.bandReject+"");
		properties.setProperty(prefix+"wavelengthLow",  this.wavelengthLow+"");
		properties.setProperty(prefix+"wavelengthHigh", this.wavelengthHigh+"");
		properties.setProperty(prefix+"colormap",       this.colormap);
		properties.setProperty(prefix+"colorMin",       this.colorMin+"");
		properties.setProperty(prefix+"colorMax",       this.colorMax+"");
		properties.setProperty(prefix+"interpolation",  this.interpolation.name());
		properties.setProperty(prefix+"show",           this.show+"");
		properties.setProperty(prefix+"debugLevel",     this.debugLevel+"");
	}

	/**
	 * Update parameters from properties, missing keys keep current values
	 * @throws IllegalArgumentException for unknown scale, interpolation or colormap, invalid wavelengths
	 */
	public void getProperties(String prefix,Properties properties){
		if (properties.getProperty(prefix+"scale")!=null)
			this.scale=LengthScale.fromString(properties.getProperty(prefix+"scale"));
		if (properties.getProperty(prefix+"crop")!=null)
			this.crop=Boolean.parseBoolean(properties.getProperty(prefix+"crop"));
		if (properties.getProperty(prefix+"removeTipTilt")!=null)
			this.removeTipTilt=Boolean.parseBoolean(properties.getProperty(prefix+"removeTipTilt"));
		if (properties.getProperty(prefix+"removePiston")!=null)
			this.removePiston=Boolean.parseBoolean(properties.getProperty(prefix+"removePiston"));
		if (properties.getProperty(prefix+"bandReject")!=null)
			this.bandReject=Boolean.parseBoolean(properties.getProperty(prefix+"bandReject"));
		if (properties.getProperty(prefix+"wavelengthLow")!=null)
			this.wavelengthLow=parseWavelength(properties.getProperty(prefix+"wavelengthLow"));
		if (properties.getProperty(prefix+"wavelengthHigh")!=null)
			this.wavelengthHigh=parseWavelength(properties.getProperty(prefix+"wavelengthHigh"));
		if (properties.getProperty(prefix+"colormap")!=null)
			this.colormap=properties.getProperty(prefix+"colormap");
		if (properties.getProperty(prefix+"colorMin")!=null)
			this.colorMin=Double.parseDouble(properties.getProperty(prefix+"colorMin"));
		if (properties.getProperty(prefix+"colorMax")!=null)
			this.colorMax=Double.parseDouble(properties.getProperty(prefix+"colorMax"));
		if (properties.getProperty(prefix+"interpolation")!=null)
			this.interpolation=Interpolation.fromString(properties.getProperty(prefix+"interpolation"));
		if (properties.getProperty(prefix+"show")!=null)
			this.show=Boolean.parseBoolean(properties.getProperty(prefix+"show"));
		if (properties.getProperty(prefix+"debugLevel")!=null)
			this.debugLevel=Integer.parseInt(properties.getProperty(prefix+"debugLevel"));
		validate();
	}

	public void saveToXML(String pathname) throws ConfigurationException {
		XMLConfiguration hConfig=new XMLConfiguration();
		hConfig.setRootElementName("interferogramParameters");
		hConfig.addProperty("scale",          this.scale.getKey());
		hConfig.addProperty("crop",           this.crop);
		hConfig.addProperty("removeTipTilt",  this.removeTipTilt);
		hConfig.addProperty("removePiston",   this.removePiston);
		hConfig.addProperty("bandReject",     this.bandReject);
		hConfig.addProperty("wavelengthLow",  this.wavelengthLow+"");
		hConfig.addProperty("wavelengthHigh", this.wavelengthHigh+"");
		hConfig.addProperty("colormap",       this.colormap);
		hConfig.addProperty("colorMin",       this.colorMin+"");
		hConfig.addProperty("colorMax",       this.colorMax+"");
		hConfig.addProperty("interpolation",  this.interpolation.name());
		hConfig.addProperty("show",           this.show);
		hConfig.addProperty("debugLevel",     this.debugLevel);
		hConfig.save(pathname);
		if (this.debugLevel>0) System.out.println("Interferogram parameters are saved to "+pathname);
	}

	public void setFromXML(String pathname) throws ConfigurationException {
		XMLConfiguration hConfig=new XMLConfiguration(pathname);
		this.scale=         LengthScale.fromString(hConfig.getString("scale", this.scale.getKey()));
		this.crop=          hConfig.getBoolean("crop", this.crop);
		this.removeTipTilt= hConfig.getBoolean("removeTipTilt", this.removeTipTilt);
		this.removePiston=  hConfig.getBoolean("removePiston", this.removePiston);
		this.bandReject=    hConfig.getBoolean("bandReject", this.bandReject);
		this.wavelengthLow= parseWavelength(hConfig.getString("wavelengthLow", this.wavelengthLow+""));
		this.wavelengthHigh=parseWavelength(hConfig.getString("wavelengthHigh", this.wavelengthHigh+""));
		this.colormap=      hConfig.getString("colormap", this.colormap);
		this.colorMin=      Double.parseDouble(hConfig.getString("colorMin", this.colorMin+""));
		this.colorMax=      Double.parseDouble(hConfig.getString("colorMax", this.colorMax+""));
		this.interpolation= Interpolation.fromString(hConfig.getString("interpolation", this.interpolation.name()));
		this.show=          hConfig.getBoolean("show", this.show);
		this.debugLevel=    hConfig.getInt("debugLevel", this.debugLevel);
		validate();
		if (this.debugLevel>0) System.out.println("Interferogram parameters are restored from "+pathname);
	}

	public boolean showDialog(String title) {
		String [] scales=new String[LengthScale.values().length];
		for (int i=0;i<scales.length;i++) scales[i]=LengthScale.values()[i].getKey();
		String [] interpolations=new String[Interpolation.values().length];
		for (int i=0;i<interpolations.length;i++) interpolations[i]=Interpolation.values()[i].name().toLowerCase();
		GenericDialog gd = new GenericDialog(title);
		gd.addChoice     ("Lateral units",                              scales, this.scale.getKey());
		gd.addCheckbox   ("Crop to valid data",                         this.crop);
		gd.addCheckbox   ("Remove tip/tilt",                            this.removeTipTilt);
		gd.addCheckbox   ("Remove piston",                              this.removePiston);
		gd.addCheckbox   ("Band-reject filter",                         this.bandReject);
		gd.addStringField("Shortest kept wavelength (0 - no limit)",    this.wavelengthLow+"", 12);
		gd.addStringField("Longest kept wavelength (Infinity - no limit)", this.wavelengthHigh+"", 12);
		gd.addChoice     ("Colormap",                                   PhaseMapRenderer.COLORMAPS.toArray(new String[0]), this.colormap);
		gd.addStringField("Color minimum (NaN - auto)",                 this.colorMin+"", 12);
		gd.addStringField("Color maximum (NaN - auto)",                 this.colorMax+"", 12);
		gd.addChoice     ("Interpolation",                              interpolations, this.interpolation.name().toLowerCase());
		gd.addCheckbox   ("Show result",                                this.show);
		gd.addNumericField("Debug level",                               this.debugLevel, 0);
		gd.showDialog();
		if (gd.wasCanceled()) return false;
		this.scale=         LengthScale.fromString(gd.getNextChoice());
		this.crop=          gd.getNextBoolean();
		this.removeTipTilt= gd.getNextBoolean();
		this.removePiston=  gd.getNextBoolean();
		this.bandReject=    gd.getNextBoolean();
		this.wavelengthLow= parseWavelength(gd.getNextString());
		this.wavelengthHigh=parseWavelength(gd.getNextString());
		this.colormap=      gd.getNextChoice();
		this.colorMin=      Double.parseDouble(gd.getNextString().trim());
		this.colorMax=      Double.parseDouble(gd.getNextString().trim());
		this.interpolation= Interpolation.fromString(gd.getNextChoice());
		this.show=          gd.getNextBoolean();
		this.debugLevel=    (int) gd.getNextNumber();
		validate();
		return true;
	}

	/** @throws IllegalArgumentException if the wavelengths or the colormap are invalid */
	public void validate() {
		BandRejectFilter.checkWavelengths(this.wavelengthLow, this.wavelengthHigh);
		PhaseMapRenderer.checkColormap(this.colormap);
	}

	/** "inf", "infinity" (any case) and "Infinity" are accepted for no limit */
	public static double parseWavelength(String s) {
		String t=s.trim();
		if (t.equalsIgnoreCase("inf") || t.equalsIgnoreCase("infinity")) return Double.POSITIVE_INFINITY;
		try {
			return Double.parseDouble(t);
		} catch (NumberFormatException e) {
			String msg="Invalid wavelength \""+s+"\"";
			throw new IllegalArgumentException (msg, e);
		}
	}
}
