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

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.real.DoubleType;

/**
 * Adds cosmic ray hits (including their tails) to an image area frame.
 */
public interface CosmicRayInjector
{
	/**
	 * Injects no hits at all.
	 */
	CosmicRayInjector NONE = ( frame, crRate, frametime, pixelPitch, maxValue ) -> {};

	/**
	 * @param frame - image area frame (e-), modified in place
	 * @param crRate - cosmic ray rate (hits/cm^2/s)
	 * @param frametime - frame time (s)
	 * @param pixelPitch - distance between pixel centers (m)
	 * @param maxValue - value a hit pixel saturates at (e-)
	 */
	void inject( RandomAccessibleInterval< DoubleType > frame, double crRate, double frametime, double pixelPitch, double maxValue );
}
