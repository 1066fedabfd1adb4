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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class GainCdfTest
{
	@Test
	public void outputAxisStartsAtEpsilon()
	{
		final double[] x = GainCdf.outputAxis( 10.5 );

		assertEquals( 11, x.length );
		assertEquals( Math.ulp( 1.0 ), x[ 0 ] );
		assertEquals( 1.0, x[ 1 ] );
		assertEquals( 10.0, x[ 10 ] );
	}

	@Test
	public void outputAxisRejectsBoundBelowOne()
	{
		assertThrows( IllegalArgumentException.class, () -> GainCdf.outputAxis( 0.5 ) );
	}

	@Test
	public void cdfIsNonDecreasingAndEndsAtOne()
	{
		final double[] x = GainCdf.outputAxis( 100000 );

		for ( final int n : new int[] { 3, 10, 100 } )
			for ( final double g : new double[] { 1, 50, 5000 } )
			{
				final double[] cdf = GainCdf.cdf( n, g, x );

				assertTrue( cdf[ 0 ] >= 0, "n=" + n + " g=" + g );

				for ( int i = 1; i < cdf.length; ++i )
					assertTrue( cdf[ i ] >= cdf[ i - 1 ], "n=" + n + " g=" + g + " i=" + i );

				assertEquals( 1.0, cdf[ cdf.length - 1 ], 1e-9, "n=" + n + " g=" + g );
			}
	}

	@Test
	public void axisFarInTheTailStaysFinite()
	{
		final double[] x = GainCdf.outputAxis( 1e5 );

		for ( final int n : new int[] { 300, 1000, 60000 } )
		{
			final double[] cdf = GainCdf.cdf( n, 5000, x );

			for ( final double c : cdf )
				assertTrue( Double.isFinite( c ) && c >= 0, "n=" + n );

			assertEquals( 1.0, cdf[ cdf.length - 1 ], 1e-9, "n=" + n );
		}
	}

	@Test
	public void outputAxisRejectsBoundBeyondArrayLength()
	{
		assertThrows( IllegalArgumentException.class, () -> GainCdf.outputAxis( 1e10 ) );
		assertThrows( IllegalArgumentException.class, () -> GainCdf.outputAxis( Double.POSITIVE_INFINITY ) );
	}

	@Test
	public void cdfMeanIsInputTimesGain()
	{
		final double[] x = GainCdf.outputAxis( 5000 );
		final double[] cdf = GainCdf.cdf( 10, 20, x );

		double mean = x[ 0 ] * cdf[ 0 ];
		for ( int i = 1; i < cdf.length; ++i )
			mean += x[ i ] * ( cdf[ i ] - cdf[ i - 1 ] );

		assertEquals( 200, mean, 1.0 );
	}

	@Test
	public void searchSortedFindsFirstIndexAtOrAbove()
	{
		final double[] cdf = new double[] { 0.1, 0.3, 0.3, 0.8, 1.0 };

		assertEquals( 0, GainCdf.searchSorted( cdf, 0.0 ) );
		assertEquals( 0, GainCdf.searchSorted( cdf, 0.1 ) );
		assertEquals( 1, GainCdf.searchSorted( cdf, 0.3 ) );
		assertEquals( 3, GainCdf.searchSorted( cdf, 0.5 ) );
		assertEquals( 4, GainCdf.searchSorted( cdf, 1.0 ) );
		assertEquals( 4, GainCdf.searchSorted( cdf, 2.0 ) );
	}
}
