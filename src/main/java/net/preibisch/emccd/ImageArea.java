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

import org.apache.commons.math3.random.RandomGenerator;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;
import net.preibisch.emccd.uncommons.PoissonGenerator;

/**
 * Image area of the detector: photo-electrons, dark current and CIC are
 * actualized per pixel, cosmic rays are added and the result is capped at the
 * full well capacity of the image area.
 */
public class ImageArea
{
	private ImageArea() {}

	/**
	 * @param fluxmap - input fluxmap (photons/pix/s)
	 * @param frametime - frame time (s)
	 * @param params - detector settings
	 * @param cosmics - adds cosmic ray hits
	 * @param rnd - the source of randomness
	 * @return image area frame (e-), same dimensions as the fluxmap
	 */
	public static < T extends RealType< T > > Img< DoubleType > simulate(
			final RandomAccessibleInterval< T > fluxmap,
			final double frametime,
			final DetectorParameters params,
			final CosmicRayInjector cosmics,
			final RandomGenerator rnd )
	{
		if ( !( frametime > 0 ) )
			throw new IllegalArgumentException( "Frame time must be positive: " + frametime );

		// mean photo-electrons after integrating over frametime
		final double phePerFlux = frametime * params.qe;

		// mean expected noise after integrating over frametime
		final double meanDark = params.darkCurrent * frametime;
		final double meanNoise = meanDark + params.cic;

		final Img< DoubleType > imageFrame = ArrayImgs.doubles( Intervals.dimensionsAsLongArray( fluxmap ) );

		// actualize electrons at the pixels
		if ( params.shotNoiseOn )
		{
			final NumberGeneratorImage< T > ng = new NumberGeneratorImage< T >( fluxmap, phePerFlux, meanNoise );
			final PoissonGenerator pg = new PoissonGenerator( ng, rnd );

			for ( final DoubleType v : Views.flatIterable( imageFrame ) )
			{
				ng.fwd();
				v.set( pg.nextValue().doubleValue() );
			}
		}
		else
		{
			final PoissonGenerator pg = new PoissonGenerator( meanNoise, rnd );
			final Cursor< T > flux = Views.flatIterable( fluxmap ).cursor();

			for ( final DoubleType v : Views.flatIterable( imageFrame ) )
				v.set( flux.next().getRealDouble() * phePerFlux + pg.nextValue() );
		}

		cosmics.inject( imageFrame, params.crRate, frametime, params.pixelPitch, params.fullWellImage );

		// cap at full well capacity of image area
		for ( final DoubleType v : imageFrame )
			if ( v.get() > params.fullWellImage )
				v.set( params.fullWellImage );

		return imageFrame;
	}
}
