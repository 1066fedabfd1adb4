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

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.RealType;
import net.imglib2.view.Views;
import net.preibisch.emccd.uncommons.NumberGenerator;

/**
 * Walks an image in flat iteration order and hands out
 * value * multiplicativeFactor + offset as the mean for the next pixel.
 */
public class NumberGeneratorImage< T extends RealType< T > > implements NumberGenerator< Double >
{
	final Cursor< T > cursor;
	final double multiplicativeFactor;
	final double offset;

	public NumberGeneratorImage( final RandomAccessibleInterval< T > image, final double multiplicativeFactor, final double offset )
	{
		this.cursor = Views.flatIterable( image ).cursor();
		this.multiplicativeFactor = multiplicativeFactor;
		this.offset = offset;
	}

	/**
	 * Otherwise it gets out of sync with the output cursor
	 */
	public void fwd()
	{
		cursor.fwd();
	}

	public void reset()
	{
		cursor.reset();
	}

	@Override
	public Double nextValue()
	{
		return cursor.get().getRealDouble() * multiplicativeFactor + offset;
	}
}
