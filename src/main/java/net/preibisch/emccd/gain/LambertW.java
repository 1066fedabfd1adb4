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

/**
 * Real-valued Lambert W function on the lower branch W<sub>-1</sub>, which
 * solves w * exp(w) = z for w &lt;= -1 and -1/e &lt;= z &lt; 0.
 * 
 * The initial guess is the series around the branch point for z close to
 * -1/e and the asymptotic expansion for z close to 0, refined with Halley's
 * iteration.
 */
public class LambertW
{
	final static double BRANCH_POINT = -Math.exp( -1 );
	final static int MAX_ITERATIONS = 64;
	final static double EPSILON = 1e-15;

	private LambertW() {}

	/**
	 * @param z - argument in [-1/e, 0)
	 * @return W<sub>-1</sub>(z), or NaN if z is outside the domain
	 */
	public static double wm1( final double z )
	{
		if ( Double.isNaN( z ) || z >= 0 )
			return Double.NaN;

		final double p2 = 2 * ( Math.E * z + 1 );

		// rounding may put (u-1)/e just below the branch point
		if ( p2 <= 0 )
			return p2 > -1e-12 ? -1 : Double.NaN;

		double w;

		if ( z < -0.25 )
		{
			final double p = -Math.sqrt( p2 );
			w = -1 + p - p * p / 3 + 11.0 / 72.0 * p * p * p;
		}
		else
		{
			final double l1 = Math.log( -z );
			final double l2 = Math.log( -l1 );
			w = l1 - l2 + l2 / l1;
		}

		for ( int i = 0; i < MAX_ITERATIONS; ++i )
		{
			final double ew = Math.exp( w );
			final double f = w * ew - z;
			final double wp1 = w + 1;

			if ( wp1 == 0 )
				break;

			final double delta = f / ( ew * wp1 - ( w + 2 ) * f / ( 2 * wp1 ) );
			w -= delta;

			if ( Math.abs( delta ) <= EPSILON * ( 1 + Math.abs( w ) ) )
				break;
		}

		return Math.min( w, -1 );
	}
}
