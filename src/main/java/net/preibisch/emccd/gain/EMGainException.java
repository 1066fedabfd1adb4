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
 * Thrown when an EM gain below 1 is requested. A gain register cannot
 * attenuate charge, so such a value is rejected before anything is sampled.
 */
public class EMGainException extends IllegalArgumentException
{
	private static final long serialVersionUID = -2871566393402315672L;

	public EMGainException( final String message )
	{
		super( message );
	}

	/**
	 * @param emGain - the gain to check
	 * @throws EMGainException if the gain is smaller than 1 (or NaN)
	 */
	public static void validate( final double emGain )
	{
		if ( !( emGain >= 1 ) )
			throw new EMGainException( "EM gain cannot be set to less than 1, but was " + emGain );
	}
}
