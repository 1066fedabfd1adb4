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
package net.preibisch.emccd.uncommons;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.Test;

public class PoissonGeneratorTest
{
	private static double[] meanAndVariance( final PoissonGenerator pg, final int n )
	{
		double sum = 0, sumSq = 0;

		for ( int i = 0; i < n; ++i )
		{
			final int v = pg.nextValue();
			sum += v;
			sumSq += (double)v * v;
		}

		final double mean = sum / n;
		return new double[] { mean, sumSq / n - mean * mean };
	}

	@Test
	public void smallMeanIsCounted()
	{
		final double[] mv = meanAndVariance( new PoissonGenerator( 3.5, new Well19937c( 1 ) ), 50000 );

		assertEquals( 3.5, mv[ 0 ], 0.05 );
		assertEquals( 3.5, mv[ 1 ], 0.15 );
	}

	@Test
	public void largeMeanUsesDistribution()
	{
		final double[] mv = meanAndVariance( new PoissonGenerator( 900, new Well19937c( 2 ) ), 20000 );

		assertEquals( 900, mv[ 0 ], 1.5 );
		assertEquals( 900, mv[ 1 ], 60 );
	}

	@Test
	public void zeroMeanGivesZero()
	{
		final PoissonGenerator pg = new PoissonGenerator( 0, new Well19937c( 3 ) );

		for ( int i = 0; i < 100; ++i )
			assertEquals( 0, pg.nextValue().intValue() );
	}

	@Test
	public void meanFollowsGenerator()
	{
		final double[] means = new double[] { 0, 2, 500 };
		final int[] i = new int[ 1 ];
		final PoissonGenerator pg = new PoissonGenerator( () -> means[ i[ 0 ]++ % 3 ], new Well19937c( 4 ) );

		final double[] sums = new double[ 3 ];
		for ( int k = 0; k < 30000; ++k )
			sums[ k % 3 ] += pg.nextValue();

		assertEquals( 0, sums[ 0 ] );
		assertEquals( 2, sums[ 1 ] / 10000, 0.1 );
		assertEquals( 500, sums[ 2 ] / 10000, 2 );
	}

	@Test
	public void negativeMeanIsRejected()
	{
		assertThrows( IllegalArgumentException.class, () -> new PoissonGenerator( -1, new Well19937c( 5 ) ) );
	}
}
