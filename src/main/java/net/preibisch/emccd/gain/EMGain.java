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
 * Multiplies electron counts with a randomly drawn EM gain.
 * 
 * Every element of the input is replaced by a sample of the EM register output
 * distribution for its number of electrons (Basden et al. 2003,
 * https://arxiv.org/pdf/astro-ph/0307305.pdf). If a gain register CIC rate is
 * given, elements that came out empty additionally receive partially
 * multiplied clock-induced charge.
 * 
 * All random numbers come from the generator handed in, so a seeded generator
 * reproduces the same output.
 */
public class EMGain
{
	public static final int DEFAULT_NUM_ELEMENTS = 604;

	final GainSampler sampler;
	final GainApplicator applicator;
	final PartialCic partialCic;

	public EMGain( final RandomGenerator rnd )
	{
		this.sampler = new GainSampler( rnd );
		this.applicator = new GainApplicator( sampler );
		this.partialCic = new PartialCic( applicator, rnd );
	}

	/**
	 * @param nIn - electron counts (e-)
	 * @param emGain - EM gain, at least 1
	 * @param maxOut - maximum allowed output, bounds the distributions (e-)
	 * @return the multiplied counts, rounded and at most maxOut
	 */
	public double[] apply( final double[] nIn, final double emGain, final double maxOut )
	{
		return apply( nIn, emGain, maxOut, 0, DEFAULT_NUM_ELEMENTS );
	}

	/**
	 * @param nIn - electron counts (e-)
	 * @param emGain - EM gain, at least 1
	 * @param maxOut - maximum allowed output, bounds the distributions (e-)
	 * @param gainCic - mean CIC electrons per element generated inside the gain register, 0 disables it
	 * @param nElements - number of stages of the gain register
	 * @return the multiplied counts, rounded and at most maxOut
	 * @throws EMGainException if emGain is smaller than 1
	 */
	public double[] apply( final double[] nIn, final double emGain, final double maxOut, final double gainCic, final int nElements )
	{
		EMGainException.validate( emGain );

		if ( gainCic < 0 )
			throw new IllegalArgumentException( "Gain register CIC cannot be negative: " + gainCic );

		final double[] nOut = applicator.apply( nIn, emGain, maxOut );

		if ( gainCic != 0 )
			partialCic.apply( nOut, nElements, maxOut, gainCic, emGain );

		return nOut;
	}

	public GainSampler getSampler() { return sampler; }
	public GainApplicator getApplicator() { return applicator; }
	public PartialCic getPartialCic() { return partialCic; }
}
