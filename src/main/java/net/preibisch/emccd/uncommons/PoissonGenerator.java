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

import org.apache.commons.math3.distribution.PoissonDistribution;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Discrete random sequence that follows a Poisson distribution whose mean is
 * taken from a {@link NumberGenerator} for every value, so it can follow a
 * per-pixel mean map.
 * 
 * Small means are sampled by counting exponential inter-arrival times, which
 * costs O(mean) draws. Above {@link #DIRECT_SAMPLING_LIMIT} the sample comes
 * from commons-math's {@link PoissonDistribution} using the same generator.
 */
public class PoissonGenerator implements NumberGenerator< Integer >
{
	public static final double DIRECT_SAMPLING_LIMIT = 40;

	private final RandomGenerator rng;
	private final NumberGenerator< Double > mean;

	/**
	 * @param mean - provides the mean of the distribution used for the next value
	 * @param rng - the source of randomness
	 */
	public PoissonGenerator( final NumberGenerator< Double > mean, final RandomGenerator rng )
	{
		this.mean = mean;
		this.rng = rng;
	}

	/**
	 * @param mean - the mean of the values generated, must not be negative
	 * @param rng - the source of randomness
	 */
	public PoissonGenerator( final double mean, final RandomGenerator rng )
	{
		this( new ConstantGenerator< Double >( mean ), rng );

		if ( !( mean >= 0 ) )
			throw new IllegalArgumentException( "Mean must not be negative: " + mean );
	}

	@Override
	public Integer nextValue()
	{
		final double m = mean.nextValue();

		if ( m <= 0 )
			return 0;

		if ( m >= DIRECT_SAMPLING_LIMIT )
			return new PoissonDistribution(
					rng, m, PoissonDistribution.DEFAULT_EPSILON, PoissonDistribution.DEFAULT_MAX_ITERATIONS ).sample();

		int x = 0;
		double t = 0.0;

		while ( true )
		{
			t -= Math.log( 1.0 - rng.nextDouble() ) / m;

			if ( t > 1.0 )
				break;

			++x;
		}

		return x;
	}
}
