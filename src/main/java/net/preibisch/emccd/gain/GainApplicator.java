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

/**
 * Applies EM gain to every element of an array of electron counts.
 * 
 * Input counts are rounded to whole electrons. Elements sharing the same count
 * are collected and sampled in one call of the {@link GainSampler}, which
 * builds the CDF only once per distinct count. Zero electrons stay zero.
 */
public class GainApplicator
{
	final GainSampler sampler;

	public GainApplicator( final GainSampler sampler )
	{
		this.sampler = sampler;
	}

	/**
	 * @param nIn - electron counts (e-), not modified
	 * @param emGain - EM gain, at least 1
	 * @param maxOut - maximum allowed output (e-)
	 * @return a new array of the same length holding the multiplied counts, each at most maxOut
	 */
	public double[] apply( final double[] nIn, final double emGain, final double maxOut )
	{
		EMGainException.validate( emGain );

		if ( !( maxOut >= 1 ) )
			throw new IllegalArgumentException( "Maximum output must be at least 1, but was " + maxOut );

		final double[] nOut = new double[ nIn.length ];

		for ( final Entry< Long, List< Integer > > group : groupByCount( nIn ).entrySet() )
		{
			final List< Integer > indices = group.getValue();
			final double[] samples = sampler.sample( group.getKey(), emGain, maxOut, indices.size() );

			for ( int i = 0; i < samples.length; ++i )
				nOut[ indices.get( i ) ] = Math.min( samples[ i ], maxOut );
		}

		return nOut;
	}

	/**
	 * @param nIn - electron counts (e-)
	 * @return for every distinct nonzero rounded count the positions holding it, in increasing order of count
	 */
	public static TreeMap< Long, List< Integer > > groupByCount( final double[] nIn )
	{
		final TreeMap< Long, List< Integer > > groups = new TreeMap<>();

		for ( int i = 0; i < nIn.length; ++i )
		{
			final long n = Math.round( nIn[ i ] );

			if ( n > 0 )
				groups.computeIfAbsent( n, k -> new ArrayList<>() ).add( i );
		}

		return groups;
	}
}
