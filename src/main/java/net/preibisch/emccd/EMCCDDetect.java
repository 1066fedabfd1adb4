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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;

/**
 * Creates EMCCD-detected images for a given fluxmap.
 * 
 * A frame passes the image area (shot noise, dark current, CIC, cosmic rays,
 * image full well) and then the serial register (EM gain, partial CIC,
 * serial full well, fixed pattern, read noise, bias). Each call works on its
 * own arrays and its own random generator, so frames can be simulated in
 * parallel.
 */
public class EMCCDDetect
{
	final DetectorParameters params;
	final CosmicRayInjector cosmics;

	public EMCCDDetect( final DetectorParameters params )
	{
		this( params, CosmicRayInjector.NONE );
	}

	public EMCCDDetect( final DetectorParameters params, final CosmicRayInjector cosmics )
	{
		params.validate();

		this.params = params;
		this.cosmics = cosmics;
	}

	/**
	 * Simulates one frame using a generator seeded with the seed of the
	 * parameters.
	 * 
	 * @param fluxmap - input fluxmap (photons/pix/s)
	 * @param frametime - frame time (s)
	 * @return detector output (e-)
	 */
	public < T extends RealType< T > > Img< DoubleType > simulate( final RandomAccessibleInterval< T > fluxmap, final double frametime )
	{
		return simulate( fluxmap, frametime, new Well19937c( params.seed ) );
	}

	/**
	 * @param fluxmap - input fluxmap (photons/pix/s), two-dimensional
	 * @param frametime - frame time (s)
	 * @param rnd - the source of randomness, only used by this call
	 * @return detector output (e-), same dimensions as the fluxmap
	 */
	public < T extends RealType< T > > Img< DoubleType > simulate( final RandomAccessibleInterval< T > fluxmap, final double frametime, final RandomGenerator rnd )
	{
		if ( fluxmap.numDimensions() != 2 )
			throw new IllegalArgumentException( "Fluxmap must be two-dimensional, but has " + fluxmap.numDimensions() + " dimensions." );

		final Img< DoubleType > imageFrame = ImageArea.simulate( fluxmap, frametime, params, cosmics, rnd );

		return SerialRegister.readout( imageFrame, params, rnd );
	}

	/**
	 * Simulates independent frames of the same fluxmap. Frame i uses a
	 * generator seeded with seed + i, so the result does not depend on the
	 * number of threads.
	 * 
	 * @param fluxmap - input fluxmap (photons/pix/s)
	 * @param frametime - frame time (s)
	 * @param numFrames - how many frames
	 * @param numThreads - size of the thread pool
	 * @return the frames in order
	 */
	public < T extends RealType< T > > List< Img< DoubleType > > simulateFrames(
			final RandomAccessibleInterval< T > fluxmap,
			final double frametime,
			final int numFrames,
			final int numThreads )
	{
		final ExecutorService service = Executors.newFixedThreadPool( Math.max( 1, numThreads ) );
		final ArrayList< Callable< Img< DoubleType > > > calls = new ArrayList<>();

		for ( int i = 0; i < numFrames; ++i )
		{
			final long frameSeed = params.seed + i;
			calls.add( () -> simulate( fluxmap, frametime, new Well19937c( frameSeed ) ) );
		}

		final ArrayList< Img< DoubleType > > frames = new ArrayList<>();

		try
		{
			for ( final Future< Img< DoubleType > > f : service.invokeAll( calls ) )
				frames.add( f.get() );
		}
		catch ( final InterruptedException e )
		{
			Thread.currentThread().interrupt();
			throw new RuntimeException( "Interrupted while simulating frames: " + e, e );
		}
		catch ( final ExecutionException e )
		{
			if ( e.getCause() instanceof RuntimeException )
				throw (RuntimeException)e.getCause();

			throw new RuntimeException( "Could not simulate frames: " + e.getCause(), e.getCause() );
		}
		finally
		{
			service.shutdown();
		}

		return frames;
	}

	public DetectorParameters getParameters() { return params; }
}
