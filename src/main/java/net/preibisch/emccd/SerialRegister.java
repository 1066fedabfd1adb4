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
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;
import net.preibisch.emccd.gain.EMGain;
import net.preibisch.emccd.gain.EMGainException;

/**
 * Serial (gain) register of the detector. The image area is read out row by
 * row, multiplied by the EM gain, capped at the serial full well, and the
 * amplifier adds fixed pattern, read noise and bias.
 * 
 * Read noise is the amplifier read noise, not the effective read noise after
 * the EM gain.
 */
public class SerialRegister
{
	private SerialRegister() {}

	/**
	 * @param imageFrame - image area frame (e-)
	 * @param params - detector settings
	 * @param rnd - the source of randomness
	 * @return serial register frame (e-), same dimensions as the image area frame
	 */
	public static Img< DoubleType > readout( final RandomAccessibleInterval< DoubleType > imageFrame, final DetectorParameters params, final RandomGenerator rnd )
	{
		EMGainException.validate( params.emGain );

		// flatten row by row to simulate readout to serial register
		double[] serialFrame = flatten( imageFrame );

		serialFrame = new EMGain( rnd ).apply( serialFrame, params.emGain, params.fullWellSerial, params.gainCic, params.nElements );

		// cap at full well capacity of gain register
		for ( int i = 0; i < serialFrame.length; ++i )
			if ( serialFrame[ i ] > params.fullWellSerial )
				serialFrame[ i ] = params.fullWellSerial;

		final double[] fixedPattern = makeFixedPattern( serialFrame.length );
		final double[] readNoise = makeReadNoise( serialFrame.length, params.readNoise, rnd );

		for ( int i = 0; i < serialFrame.length; ++i )
			serialFrame[ i ] += fixedPattern[ i ] + readNoise[ i ] + params.bias;

		// reshape for viewing
		return ArrayImgs.doubles( serialFrame, Intervals.dimensionsAsLongArray( imageFrame ) );
	}

	/**
	 * @param frame - the frame
	 * @return the pixel values in flat iteration order, i.e. row by row for a 2d frame
	 */
	public static double[] flatten( final RandomAccessibleInterval< DoubleType > frame )
	{
		final long size = Intervals.numElements( frame );

		if ( size > Integer.MAX_VALUE )
			throw new IllegalArgumentException( "Frame too large for readout: " + size + " pixels." );

		final double[] flat = new double[ (int)size ];
		final Cursor< DoubleType > cursor = Views.flatIterable( frame ).cursor();

		for ( int i = 0; i < flat.length; ++i )
			flat[ i ] = cursor.next().get();

		return flat;
	}

	/**
	 * Fixed pattern of the amplifier, not modeled yet.
	 */
	public static double[] makeFixedPattern( final int size )
	{
		return new double[ size ];
	}

	public static double[] makeReadNoise( final int size, final double readNoise, final RandomGenerator rnd )
	{
		final double[] noise = new double[ size ];

		for ( int i = 0; i < size; ++i )
			noise[ i ] = readNoise * rnd.nextGaussian();

		return noise;
	}
}
