/*-
 * #%L
 * Radiometric normalization of multi-date satellite and aerial imagery
 * based on pseudo-invariant features.
 * %%
 * Copyright (C) 2015 - 2025 Radiometric Normalization developers.
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
package net.preibisch.radnorm.data;

import java.util.Arrays;

/**
 * One physical measurement channel of an {@link Image}, unsigned 16 bit.
 */
public class RasterBand extends UnsignedShortGrid
{
	public static final int BIT_DEPTH = 16;

	/**
	 * @param data - samples in row-major order, the array is copied
	 * @param width - number of columns
	 * @param height - number of rows
	 */
	public RasterBand( final short[] data, final int width, final int height )
	{
		this( data, width, height, true );
	}

	private RasterBand( final short[] data, final int width, final int height, final boolean copy )
	{
		super( data, width, height, copy );
	}

	/**
	 * @param rows - rows[ y ][ x ], all values within [0, 65535]
	 * @return a new band
	 */
	public static RasterBand fromRows( final int[][] rows )
	{
		return new RasterBand( toShorts( rows ), rows[ 0 ].length, rows.length, false );
	}

	public static RasterBand fromValues( final int[] values, final int width, final int height )
	{
		final short[] data = new short[ values.length ];

		for ( int i = 0; i < values.length; ++i )
			data[ i ] = toUnsignedShort( values[ i ] );

		return new RasterBand( data, width, height, false );
	}

	public static RasterBand constant( final int value, final int width, final int height )
	{
		final short[] data = new short[ width * height ];
		Arrays.fill( data, toUnsignedShort( value ) );
		return new RasterBand( data, width, height, false );
	}

	@Override
	public String toString()
	{
		return "RasterBand[" + shapeString() + "]";
	}
}
