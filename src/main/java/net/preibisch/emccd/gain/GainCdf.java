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

import org.apache.commons.math3.special.Gamma;

/**
 * Discretized cumulative distribution of the EM register output for a given
 * number of input electrons, following Basden et al. (2003):
 * 
 * pdf(x) = x^(n-1) * exp(-x/g) / (g^n * (n-1)!)
 * 
 * The density is evaluated in log space because x^(n-1) and (n-1)! overflow
 * long before their ratio does.
 */
public class GainCdf
{
	// largest array length most JVMs can allocate
	public static final int MAX_AXIS_LENGTH = Integer.MAX_VALUE - 8;

	private GainCdf() {}

	/**
	 * The output axis 0, 1, ..., ceil(maxOut)-1 on which the distribution is
	 * sampled. The first entry is machine epsilon instead of 0 so that log(x)
	 * stays finite.
	 * 
	 * @param maxOut - maximum allowed output (e-), at least 1
	 * @return the output axis
	 */
	public static double[] outputAxis( final double maxOut )
	{
		if ( !( maxOut >= 1 ) )
			throw new IllegalArgumentException( "Maximum output must be at least 1, but was " + maxOut );

		if ( Math.ceil( maxOut ) > MAX_AXIS_LENGTH )
			throw new IllegalArgumentException( "Maximum output cannot exceed " + MAX_AXIS_LENGTH + ", but was " + maxOut );

		final double[] x = new double[ (int)Math.ceil( maxOut ) ];

		for ( int i = 0; i < x.length; ++i )
			x[ i ] = i;

		x[ 0 ] = Math.ulp( 1.0 );

		return x;
	}

	/**
	 * Computes the normalized CDF over the given output axis. The density is
	 * normalized relative to its largest value on the axis, so it stays finite
	 * even if the whole axis lies far in the tail of the distribution. Only
	 * non-finite log densities (e.g. NaN arguments) yield NaN.
	 * 
	 * @param nIn - number of input electrons
	 * @param emGain - EM gain, at least 1
	 * @param x - the output axis, see {@link #outputAxis(double)}
	 * @return the CDF, non-decreasing and ending at 1
	 */
	public static double[] cdf( final double nIn, final double emGain, final double[] x )
	{
		final double logGain = Math.log( emGain );
		final double logNorm = nIn * logGain + Gamma.logGamma( nIn );

		final double[] logPdf = new double[ x.length ];
		double logPdfMax = Double.NEGATIVE_INFINITY;

		for ( int i = 0; i < x.length; ++i )
		{
			logPdf[ i ] = ( nIn - 1 ) * Math.log( x[ i ] ) - x[ i ] / emGain - logNorm;
			logPdfMax = Math.max( logPdfMax, logPdf[ i ] );
		}

		// shift by the maximum so that at least one term is exp(0) = 1,
		// the constant cancels in the normalization
		final double[] pdf = new double[ x.length ];
		double sum = 0;

		for ( int i = 0; i < x.length; ++i )
		{
			pdf[ i ] = Math.exp( logPdf[ i ] - logPdfMax );
			sum += pdf[ i ];
		}

		final double[] cdf = new double[ x.length ];
		double cumulative = 0;

		for ( int i = 0; i < x.length; ++i )
		{
			cumulative += pdf[ i ] / sum;
			cdf[ i ] = cumulative;
		}

		return cdf;
	}

	/**
	 * @param cdf - a non-decreasing array
	 * @param value - the value to look up
	 * @return the first index whose entry is at or above value, at most cdf.length-1
	 */
	public static int searchSorted( final double[] cdf, final double value )
	{
		int lo = 0;
		int hi = cdf.length;

		while ( lo < hi )
		{
			final int mid = ( lo + hi ) >>> 1;

			if ( cdf[ mid ] < value )
				lo = mid + 1;
			else
				hi = mid;
		}

		return Math.min( lo, cdf.length - 1 );
	}
}
