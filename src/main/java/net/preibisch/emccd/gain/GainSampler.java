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
package net.preibisch.emccd.gain;

import org.apache.commons.math3.random.RandomGenerator;

/**
 * Draws output electron counts of the EM register for a single number of
 * input electrons.
 * 
 * For one and two input electrons the CDF of the Basden distribution can be
 * inverted in closed form. For more electrons the sample is looked up in a
 * CDF discretized on integer steps between 0 and the maximum output, so its
 * accuracy is bounded by that resolution.
 */
public class GainSampler
{
	final RandomGenerator rnd;

	public GainSampler( final RandomGenerator rnd )
	{
		this.rnd = rnd;
	}

	/**
	 * @param nIn - number of input electrons
	 * @param emGain - EM gain, at least 1
	 * @param maxOut - maximum allowed output (e-), bounds the CDF lookup
	 * @param size - how many independent samples to draw
	 * @return size output counts, rounded to integers
	 */
	public double[] sample( final long nIn, final double emGain, final double maxOut, final int size )
	{
		EMGainException.validate( emGain );

		if ( size < 0 )
			throw new IllegalArgumentException( "Number of samples cannot be negative: " + size );

		final double[] nOut = new double[ size ];

		if ( nIn <= 0 )
			return nOut;

		final double[] x = new double[ size ];
		for ( int i = 0; i < size; ++i )
			x[ i ] = rnd.nextDouble();

		if ( nIn == 1 )
		{
			for ( int i = 0; i < size; ++i )
				nOut[ i ] = single( emGain, x[ i ] );
		}
		else if ( nIn == 2 )
		{
			for ( int i = 0; i < size; ++i )
				nOut[ i ] = pair( emGain, x[ i ] );
		}
		else
		{
			final double[] xAxis = GainCdf.outputAxis( maxOut );
			final double[] cdf = GainCdf.cdf( nIn, emGain, xAxis );

			final double cdfMin = cdf[ 0 ];
			final double cdfMax = cdf[ cdf.length - 1 ];

			for ( int i = 0; i < size; ++i )
			{
				final double lookup = ( cdfMax - cdfMin ) * x[ i ] + cdfMin;

				if ( Double.isNaN( lookup ) )
					nOut[ i ] = Double.NaN;
				else
					nOut[ i ] = xAxis[ GainCdf.searchSorted( cdf, lookup ) ];
			}
		}

		for ( int i = 0; i < size; ++i )
			nOut[ i ] = Math.rint( nOut[ i ] );

		return nOut;
	}

	/**
	 * Exact inversion for one input electron, where the distribution is
	 * exponential with mean emGain.
	 * 
	 * @param emGain - EM gain
	 * @param u - uniform draw in [0,1)
	 * @return the (unrounded) output count
	 */
	public static double single( final double emGain, final double u )
	{
		return -emGain * Math.log( 1 - u );
	}

	/**
	 * Exact inversion for two input electrons using the lower branch of the
	 * Lambert W function.
	 * 
	 * @param emGain - EM gain
	 * @param u - uniform draw in [0,1)
	 * @return the (unrounded) output count
	 */
	public static double pair( final double emGain, final double u )
	{
		return -emGain * LambertW.wm1( ( u - 1 ) / Math.E ) - emGain;
	}
}
