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

import java.util.Random;

import ij.ImagePlus;
import ij.process.FloatProcessor;
import net.imglib2.Cursor;
import net.imglib2.FinalInterval;
import net.imglib2.Interval;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;

/**
 * static helpers to create fluxmaps and convert frames from and to ImageJ
 */
public class FluxMaps
{
	private FluxMaps() {}

	/**
	 * A flat background with Gaussian point sources (stars) at random positions.
	 * 
	 * @param dim - width and height of the fluxmap
	 * @param background - background flux (photons/pix/s)
	 * @param numSources - number of point sources
	 * @param peakFlux - flux at the center of a source (photons/pix/s)
	 * @param sigma - sigma of a source (pixels)
	 * @param rnd - the source of randomness for the positions
	 * @return the fluxmap
	 */
	public static Img< FloatType > pointSources( final long[] dim, final float background, final int numSources, final float peakFlux, final double sigma, final Random rnd )
	{
		if ( dim.length != 2 )
			throw new IllegalArgumentException( "Fluxmaps are two-dimensional, but " + dim.length + " dimensions were requested." );

		final Img< FloatType > fluxmap = ArrayImgs.floats( dim );

		for ( final FloatType t : fluxmap )
			t.set( background );

		for ( int i = 0; i < numSources; ++i )
			addStar( fluxmap, rnd.nextDouble() * ( dim[ 0 ] - 1 ), rnd.nextDouble() * ( dim[ 1 ] - 1 ), sigma, peakFlux );

		return fluxmap;
	}

	/**
	 * Adds a circular Gaussian, cut off at three sigma, to a 2d fluxmap.
	 * 
	 * @param fluxmap - the fluxmap, modified in place
	 * @param cx - x of the center
	 * @param cy - y of the center
	 * @param sigma - sigma (pixels)
	 * @param peak - value at the center
	 */
	public static void addStar( final RandomAccessibleInterval< FloatType > fluxmap, final double cx, final double cy, final double sigma, final float peak )
	{
		final long r = (long)Math.ceil( 3 * sigma );
		final Interval box = Intervals.intersect( fluxmap, new FinalInterval(
				new long[] { (long)Math.floor( cx ) - r, (long)Math.floor( cy ) - r },
				new long[] { (long)Math.ceil( cx ) + r, (long)Math.ceil( cy ) + r } ) );

		if ( Intervals.isEmpty( box ) )
			return;

		final double twoSqSigma = 2 * sigma * sigma;
		final Cursor< FloatType > cursor = Views.iterable( Views.interval( fluxmap, box ) ).localizingCursor();

		while ( cursor.hasNext() )
		{
			final FloatType t = cursor.next();
			final double dx = cursor.getDoublePosition( 0 ) - cx;
			final double dy = cursor.getDoublePosition( 1 ) - cy;

			t.set( t.get() + peak * (float)Math.exp( -( dx * dx + dy * dy ) / twoSqSigma ) );
		}
	}

	/**
	 * @param imp - a single-plane ImageJ image
	 * @return its pixels as a two-dimensional fluxmap
	 */
	public static Img< FloatType > fromImagePlus( final ImagePlus imp )
	{
		final FloatProcessor fp = imp.getProcessor().convertToFloatProcessor();

		return ArrayImgs.floats( (float[])fp.getPixels(), fp.getWidth(), fp.getHeight() );
	}

	/**
	 * @param frame - a two-dimensional frame
	 * @param title - title of the ImageJ image
	 * @return a 32-bit ImageJ image holding a copy of the frame
	 */
	public static < T extends RealType< T > > ImagePlus toImagePlus( final RandomAccessibleInterval< T > frame, final String title )
	{
		if ( frame.numDimensions() != 2 )
			throw new IllegalArgumentException( "Only two-dimensional frames can be converted, but has " + frame.numDimensions() + " dimensions." );

		final int w = (int)frame.dimension( 0 );
		final int h = (int)frame.dimension( 1 );
		final float[] pixels = new float[ (int)Intervals.numElements( frame ) ];

		int i = 0;
		for ( final T t : Views.flatIterable( frame ) )
			pixels[ i++ ] = t.getRealFloat();

		return new ImagePlus( title, new FloatProcessor( w, h, pixels ) );
	}
}
