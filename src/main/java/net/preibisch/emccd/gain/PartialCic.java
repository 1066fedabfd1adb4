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

import java.util.ArrayList;
import java.util.List;
import java.util.Map.Entry;
import java.util.TreeMap;

import org.apache.commons.math3.random.RandomGenerator;

import net.preibisch.emccd.uncommons.PoissonGenerator;

/**
 * Clock-induced charge generated inside the gain register.
 * 
 * Such charge was not present at the input of the register, so it only passes
 * the stages behind the one where it was created. For every element that is
 * still empty after the regular gain was applied, CIC electrons are actualized,
 * each element gets a random entry stage and the charge is multiplied with the
 * gain of the remaining stages.
 */
public class PartialCic
{
	final GainApplicator applicator;
	final RandomGenerator rnd;

	public PartialCic( final GainApplicator applicator, final RandomGenerator rnd )
	{
		this.applicator = applicator;
		this.rnd = rnd;
	}

	/**
	 * Updates all elements of nOut that are exactly zero, all others are left
	 * untouched.
	 * 
	 * @param nOut - electron counts after the regular gain (e-), modified in place
	 * @param nElements - number of stages of the gain register
	 * @param maxOut - maximum allowed output (e-)
	 * @param gainCic - mean CIC electrons per element generated in the gain register
	 * @param emGain - EM gain of the full register
	 * @return nOut
	 */
	public double[] apply( final double[] nOut, final int nElements, final double maxOut, final double gainCic, final double emGain )
	{
		EMGainException.validate( emGain );

		if ( nElements < 1 )
			throw new IllegalArgumentException( "Gain register needs at least one element, but has " + nElements );

		if ( gainCic <= 0 )
			return nOut;

		final PoissonGenerator cic = new PoissonGenerator( gainCic, rnd );

		// group by the number of stages the charge still passes
		final TreeMap< Integer, List< Integer > > groups = new TreeMap<>();

		for ( int i = 0; i < nOut.length; ++i )
		{
			if ( nOut[ i ] != 0 )
				continue;

			final int count = cic.nextValue();

			if ( count == 0 )
				continue;

			nOut[ i ] = count;

			final int stage = (int)Math.round( rnd.nextDouble() * ( nElements - 1 ) );
			groups.computeIfAbsent( nElements - stage, k -> new ArrayList<>() ).add( i );
		}

		for ( final Entry< Integer, List< Integer > > group : groups.entrySet() )
		{
			final List< Integer > indices = group.getValue();
			final double[] counts = new double[ indices.size() ];

			for ( int i = 0; i < counts.length; ++i )
				counts[ i ] = nOut[ indices.get( i ) ];

			final double[] multiplied = applicator.apply( counts, partialGain( emGain, nElements, group.getKey() ), maxOut );

			for ( int i = 0; i < multiplied.length; ++i )
				nOut[ indices.get( i ) ] = multiplied[ i ];
		}

		return nOut;
	}

	/**
	 * @param emGain - EM gain of the full register
	 * @param nElements - number of stages of the gain register
	 * @param remainingStages - stages the charge passes, 1..nElements
	 * @return the gain compounded over the remaining stages at the per-stage rate emGain^(1/nElements) - 1
	 */
	public static double partialGain( final double emGain, final int nElements, final int remainingStages )
	{
		final double ratePerElement = Math.pow( emGain, 1.0 / nElements ) - 1;

		return Math.max( 1, Math.pow( 1 + ratePerElement, remainingStages ) );
	}
}
