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
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Date;
import java.util.List;
import java.util.Random;

import ij.IJ;
import ij.ImagePlus;
import ij.io.FileSaver;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.type.numeric.real.FloatType;

/**
 * Simulates EMCCD frames from the command line.
 * 
 * Usage: SimulateEMCCD &lt;dir&gt; [fluxmap.tif] [frametime] [numFrames]
 * 
 * Detector settings are read from &lt;dir&gt;/emccd_params.json if it exists,
 * otherwise the bundled defaults are used. Without a fluxmap a synthetic star
 * field is simulated. Frames are written to &lt;dir&gt;/sim-emccd/.
 */
public class SimulateEMCCD
{
	public static final double DEFAULT_FRAMETIME = 100; // s
	public static final long[] SYNTHETIC_DIM = new long[] { 512, 512 };

	public static void main( String[] args )
	{
		if ( args.length < 1 )
		{
			System.out.println( "Usage: SimulateEMCCD <dir> [fluxmap.tif] [frametime] [numFrames]" );
			return;
		}

		final File paramsFile = new File( args[ 0 ], DetectorParameters.DEFAULT_RESOURCE );
		final DetectorParameters params;

		try
		{
			params = paramsFile.exists() ? DetectorParameters.load( paramsFile ) : DetectorParameters.loadDefaults();
		}
		catch ( IOException e )
		{
			throw new RuntimeException( "Could not load detector parameters: " + e, e );
		}

		log( "Detector parameters:\n" + params.toJson() );

		final Img< FloatType > fluxmap;

		if ( args.length > 1 )
		{
			log( "Loading " + args[ 1 ] );
			final ImagePlus imp = IJ.openImage( args[ 1 ] );

			if ( imp == null )
				throw new RuntimeException( "Could not open fluxmap " + args[ 1 ] );

			fluxmap = FluxMaps.fromImagePlus( imp );
		}
		else
		{
			log( "Creating synthetic fluxmap" );
			fluxmap = FluxMaps.pointSources( SYNTHETIC_DIM, 0.001f, 50, 0.5f, 1.5, new Random( params.getSeed() ) );
		}

		final double frametime = args.length > 2 ? Double.parseDouble( args[ 2 ] ) : DEFAULT_FRAMETIME;
		final int numFrames = args.length > 3 ? Integer.parseInt( args[ 3 ] ) : 1;

		final Path outDir = Paths.get( args[ 0 ], "sim-emccd" );

		try
		{
			if ( !Files.exists( outDir ) )
				Files.createDirectory( outDir );
		}
		catch ( IOException e )
		{
			throw new RuntimeException( "Could not create output directory " + outDir + ": " + e, e );
		}

		final EMCCDDetect emccd = new EMCCDDetect( params );

		log( "Simulating " + numFrames + " frame(s), gain=" + params.getEmGain() + ", read noise=" + params.getReadNoise() + "e-, frametime=" + frametime + "s" );

		final List< Img< DoubleType > > frames = emccd.simulateFrames( fluxmap, frametime, numFrames, Runtime.getRuntime().availableProcessors() );

		for ( int i = 0; i < frames.size(); ++i )
		{
			final String file = outDir.resolve( "sim" + i + ".tif" ).toString();
			final ImagePlus imp = FluxMaps.toImagePlus( frames.get( i ), "sim" + i );

			if ( !new FileSaver( imp ).saveAsTiff( file ) )
				throw new RuntimeException( "Could not save " + file );

			log( "saved frame " + ( i + 1 ) + " (of " + frames.size() + ") to " + file );
		}

		log( "DONE." );
	}

	protected static void log( final String message )
	{
		IJ.log( new Date( System.currentTimeMillis() ) + ": " + message );
	}
}
