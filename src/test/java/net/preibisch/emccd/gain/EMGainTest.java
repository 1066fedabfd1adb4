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

import java.util.Arrays;

import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.Test;

public class EMGainTest
{
	@Test
	public void gainBelowOneFailsBeforeSampling()
	{
		final EMGain emGain = new EMGain( new Well19937c( 1 ) );

		assertThrows( EMGainException.class, () -> emGain.apply( new double[] { 1, 2, 3 }, 0.9, 1000 ) );
		assertThrows( EMGainException.class, () -> emGain.apply( new double[] { 1, 2, 3 }, 0.9, 1000, 0.1, 604 ) );
	}

	@Test
	public void negativeGainCicIsRejected()
	{
		assertThrows( IllegalArgumentException.class, () -> new EMGain( new Well19937c( 1 ) ).apply( new double[ 2 ], 10, 1000, -0.1, 604 ) );
	}

	@Test
	public void zeroInputGivesZeroOutputWithoutCic()
	{
		final double[] nOut = new EMGain( new Well19937c( 8 ) ).apply( new double[ 1000 ], 5000, 1e5 );

		for ( final double v : nOut )
			assertEquals( 0.0, v );
	}

	@Test
	public void unitGainKeepsLargeCountsNearInput()
	{
		final double[] nIn = new double[ 2000 ];
		Arrays.fill( nIn, 1000 );

		final double[] nOut = new EMGain( new Well19937c( 4 ) ).apply( nIn, 1, 5000 );

		double mean = 0;
		for ( final double v : nOut )
			mean += v;
		mean /= nOut.length;

		double var = 0;
		for ( final double v : nOut )
			var += ( v - mean ) * ( v - mean );
		var /= nOut.length - 1;

		assertEquals( nIn.length, nOut.length );
		assertEquals( 1000, mean, 5 );

		// the register adds variance n * g^2 even at unit gain
		assertTrue( Math.sqrt( var ) > 25 && Math.sqrt( var ) < 40, "std=" + Math.sqrt( var ) );
	}

	@Test
	public void singleElectronExcessNoiseAtHighGain()
	{
		final double g = 1000;
		final double[] nIn = new double[ 20000 ];
		Arrays.fill( nIn, 1 );

		final double[] nOut = new EMGain( new Well19937c( 12 ) ).apply( nIn, g, 1e6 );

		double mean = 0, meanSq = 0;
		for ( final double v : nOut )
		{
			mean += v;
			meanSq += v * v;
		}
		mean /= nOut.length;
		meanSq /= nOut.length;

		// a fixed input of n electrons leaves with variance (F^2 - 1) * n * g^2, F tends to sqrt(2)
		final double enf = Math.sqrt( ( meanSq - mean * mean ) / ( mean * mean ) + 1 );

		assertEquals( g, mean, 0.05 * g );
		assertEquals( Math.sqrt( 2 ), enf, 0.05 );
	}

	@Test
	public void cicOnlyChangesEmptyElements()
	{
		final double[] nIn = new double[ 5000 ];
		for ( int i = 0; i < nIn.length; i += 4 )
			nIn[ i ] = 1 + i % 3;

		final double[] withoutCic = new EMGain( new Well19937c( 31 ) ).apply( nIn, 800, 1e5, 0, 604 );
		final double[] withCic = new EMGain( new Well19937c( 31 ) ).apply( nIn, 800, 1e5, 0.2, 604 );

		int changed = 0;

		for ( int i = 0; i < nIn.length; ++i )
		{
			if ( withoutCic[ i ] != 0 )
				assertEquals( withoutCic[ i ], withCic[ i ], "i=" + i );
			else if ( withCic[ i ] != 0 )
				++changed;
		}

		assertTrue( changed > 0 );
	}
}
