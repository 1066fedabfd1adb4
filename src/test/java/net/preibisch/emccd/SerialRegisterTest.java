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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.Test;

import net.imglib2.Cursor;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.util.Intervals;
import net.preibisch.emccd.gain.EMGainException;

public class SerialRegisterTest
{
	@Test
	public void flattensRowByRow()
	{
		final Img< DoubleType > frame = ArrayImgs.doubles( 3, 2 );
		final Cursor< DoubleType > c = frame.localizingCursor();

		while ( c.hasNext() )
		{
			c.fwd();
			c.get().set( 10 * c.getIntPosition( 1 ) + c.getIntPosition( 0 ) );
		}

		assertArrayEquals( new double[] { 0, 1, 2, 10, 11, 12 }, SerialRegister.flatten( frame ) );
	}

	@Test
	public void emptyFrameReadsBias()
	{
		final DetectorParameters params = new DetectorParameters().setReadNoise( 0 ).setBias( 7 );
		final Img< DoubleType > out = SerialRegister.readout( ArrayImgs.doubles( 6, 4 ), params, new Well19937c( 1 ) );

		assertArrayEquals( new long[] { 6, 4 }, Intervals.dimensionsAsLongArray( out ) );

		for ( final DoubleType t : out )
			assertEquals( 7, t.get() );
	}

	@Test
	public void cappedAtSerialFullWell()
	{
		final Img< DoubleType > frame = ArrayImgs.doubles( 50, 20 );
		for ( final DoubleType t : frame )
			t.set( 1 );

		final DetectorParameters params = new DetectorParameters().setEmGain( 5000 ).setFullWellSerial( 10000 ).setReadNoise( 0 );
		final Img< DoubleType > out = SerialRegister.readout( frame, params, new Well19937c( 2 ) );

		int saturated = 0;
		for ( final DoubleType t : out )
		{
			assertTrue( t.get() >= 0 && t.get() <= 10000 );
			if ( t.get() == 10000 )
				++saturated;
		}

		// a single electron exceeds twice the gain with probability exp(-2)
		assertTrue( saturated > 80 && saturated < 200, "saturated=" + saturated );
	}

	@Test
	public void readNoiseIsGaussian()
	{
		final double[] noise = SerialRegister.makeReadNoise( 40000, 80, new Well19937c( 3 ) );

		double sum = 0, sumSq = 0;
		for ( final double v : noise )
		{
			sum += v;
			sumSq += v * v;
		}

		final double mean = sum / noise.length;

		assertEquals( 0, mean, 2 );
		assertEquals( 80, Math.sqrt( sumSq / noise.length - mean * mean ), 2 );
	}

	@Test
	public void fixedPatternIsEmpty()
	{
		assertArrayEquals( new double[ 5 ], SerialRegister.makeFixedPattern( 5 ) );
	}

	@Test
	public void gainBelowOneIsRejected()
	{
		final DetectorParameters params = new DetectorParameters().setEmGain( 0.5 );

		assertThrows( EMGainException.class, () -> SerialRegister.readout( ArrayImgs.doubles( 2, 2 ), params, new Well19937c( 4 ) ) );
	}
}
