/*-
 * #%L
 * Library for simulating the readout of an EMCCD detector including
 * shot noise, clock-induced charge, EM gain and read noise.
 * %%
 * Copyright (C) 2019 - 2020 EMCCD Simulation developers.
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 2 of the
 * License, or (at your option) any later version.
 * 
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-2.0.html>.
 * #L%
 */
package net.preibisch.emccd;

import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

import net.preibisch.emccd.gain.EMGain;
import net.preibisch.emccd.gain.EMGainException;

/**
 * Detector settings. Loaded from JSON, where the keys are the field names in
 * lower case with underscores (em_gain, full_well_image, ...). Keys that are
 * not given keep the defaults below.
 */
public class DetectorParameters
{
	public static final String DEFAULT_RESOURCE = "emccd_params.json";

	double emGain = 5000; // e-/photon
	double fullWellImage = 60000; // e-
	double fullWellSerial = 100000; // e-
	double darkCurrent = 0.00028; // e-/pix/s
	double cic = 0.01; // e-/pix/frame
	double readNoise = 100; // e-/pix/frame
	double bias = 0; // e-
	double qe = 0.9;
	double crRate = 0; // hits/cm^2/s
	double pixelPitch = 13e-6; // m
	boolean shotNoiseOn = true;

	// CIC generated inside the gain register, 0 switches it off
	double gainCic = 0; // e-/pix/frame
	int nElements = EMGain.DEFAULT_NUM_ELEMENTS;

	long seed = 42;

	public DetectorParameters() {}

	public static Gson gson()
	{
		return new GsonBuilder()
				.setFieldNamingPolicy( FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES )
				.setPrettyPrinting()
				.create();
	}

	public static DetectorParameters fromJson( final Reader reader )
	{
		final DetectorParameters params;

		try
		{
			params = gson().fromJson( reader, DetectorParameters.class );
		}
		catch ( final JsonParseException e )
		{
			throw new IllegalArgumentException( "Cannot parse detector parameters: " + e.getMessage(), e );
		}

		if ( params == null )
			throw new IllegalArgumentException( "Detector parameters are empty." );

		params.validate();

		return params;
	}

	public static DetectorParameters load( final File file ) throws IOException
	{
		try ( final FileReader fr = new FileReader( file ) )
		{
			return fromJson( fr );
		}
	}

	/**
	 * @return the parameters bundled as {@value #DEFAULT_RESOURCE}
	 */
	public static DetectorParameters loadDefaults() throws IOException
	{
		final InputStream in = DetectorParameters.class.getClassLoader().getResourceAsStream( DEFAULT_RESOURCE );

		if ( in == null )
			throw new IOException( "Resource " + DEFAULT_RESOURCE + " not found on the classpath." );

		try ( final Reader reader = new InputStreamReader( in, StandardCharsets.UTF_8 ) )
		{
			return fromJson( reader );
		}
	}

	public String toJson()
	{
		return gson().toJson( this );
	}

	/**
	 * @throws EMGainException if the EM gain is smaller than 1
	 * @throws IllegalArgumentException if any other value is out of its physical range
	 */
	public void validate()
	{
		EMGainException.validate( emGain );

		if ( !( qe >= 0 && qe <= 1 ) )
			throw new IllegalArgumentException( "Quantum efficiency must be within [0,1]: " + qe );

		if ( !( fullWellImage > 0 ) || !( fullWellSerial > 0 ) )
			throw new IllegalArgumentException( "Full well capacities must be positive: image=" + fullWellImage + ", serial=" + fullWellSerial );

		if ( !( darkCurrent >= 0 ) || !( cic >= 0 ) || !( gainCic >= 0 ) )
			throw new IllegalArgumentException( "Dark current and CIC cannot be negative: dark_current=" + darkCurrent + ", cic=" + cic + ", gain_cic=" + gainCic );

		if ( !( readNoise >= 0 ) || !( crRate >= 0 ) )
			throw new IllegalArgumentException( "Read noise and cosmic ray rate cannot be negative: read_noise=" + readNoise + ", cr_rate=" + crRate );

		if ( !( pixelPitch > 0 ) )
			throw new IllegalArgumentException( "Pixel pitch must be positive: " + pixelPitch );

		if ( nElements < 1 )
			throw new IllegalArgumentException( "Gain register needs at least one element: " + nElements );
	}

	public double getEmGain() { return emGain; }
	public double getFullWellImage() { return fullWellImage; }
	public double getFullWellSerial() { return fullWellSerial; }
	public double getDarkCurrent() { return darkCurrent; }
	public double getCic() { return cic; }
	public double getReadNoise() { return readNoise; }
	public double getBias() { return bias; }
	public double getQe() { return qe; }
	public double getCrRate() { return crRate; }
	public double getPixelPitch() { return pixelPitch; }
	public boolean isShotNoiseOn() { return shotNoiseOn; }
	public double getGainCic() { return gainCic; }
	public int getNumElements() { return nElements; }
	public long getSeed() { return seed; }

	public DetectorParameters setEmGain( final double emGain ) { this.emGain = emGain; return this; }
	public DetectorParameters setFullWellImage( final double fullWellImage ) { this.fullWellImage = fullWellImage; return this; }
	public DetectorParameters setFullWellSerial( final double fullWellSerial ) { this.fullWellSerial = fullWellSerial; return this; }
	public DetectorParameters setDarkCurrent( final double darkCurrent ) { this.darkCurrent = darkCurrent; return this; }
	public DetectorParameters setCic( final double cic ) { this.cic = cic; return this; }
	public DetectorParameters setReadNoise( final double readNoise ) { this.readNoise = readNoise; return this; }
	public DetectorParameters setBias( final double bias ) { this.bias = bias; return this; }
	public DetectorParameters setQe( final double qe ) { this.qe = qe; return this; }
	public DetectorParameters setCrRate( final double crRate ) { this.crRate = crRate; return this; }
	public DetectorParameters setPixelPitch( final double pixelPitch ) { this.pixelPitch = pixelPitch; return this; }
	public DetectorParameters setShotNoiseOn( final boolean shotNoiseOn ) { this.shotNoiseOn = shotNoiseOn; return this; }
	public DetectorParameters setGainCic( final double gainCic ) { this.gainCic = gainCic; return this; }
	public DetectorParameters setNumElements( final int nElements ) { this.nElements = nElements; return this; }
	public DetectorParameters setSeed( final long seed ) { this.seed = seed; return this; }
}
