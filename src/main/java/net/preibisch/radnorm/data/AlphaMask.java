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
import java.util.List;

import net.preibisch.radnorm.exception.ShapeMismatchException;

/**
 * Per-pixel validity of an {@link Image}. A value of 0 marks a pixel as
 * invalid (nodata), any other value as valid. Boolean masks only use 0 and
 * {@link #MAX_VALUE}, weighted masks use the range in between as partial
 * confidence.
 */
public class AlphaMask extends UnsignedShortGrid
{
	/**
	 * @param data - samples in row-major order, the array is copied
	 */
	public AlphaMask( final short[] data, final int width, final int height )
	{
		this( data, width, height, true );
	}

	private AlphaMask( final short[] data, final int width, final int height, final boolean copy )
	{
		super( data, width, height, copy );
	}

	public static AlphaMask full( final int width, final int height )
	{
		final short[] data = new short[ width * height ];
		Arrays.fill( data, (short)MAX_VALUE );
		return new AlphaMask( data, width, height, false );
	}

	public static AlphaMask fromRows( final int[][] rows )
	{
		return new AlphaMask( toShorts( rows ), rows[ 0 ].length, rows.length, false );
	}

	public static AlphaMask fromBooleans( final boolean[] valid, final int width, final int height )
	{
		final short[] data = new short[ valid.length ];

		for ( int i = 0; i < valid.length; ++i )
			if ( valid[ i ] )
				data[ i ] = (short)MAX_VALUE;

		return new AlphaMask( data, width, height, false );
	}

	/**
	 * Derives a mask for rasters that carry no alpha band, a pixel is valid if
	 * none of the bands holds a zero sample.
	 *
	 * @param bands - the bands, all of the same shape
	 * @return a boolean mask
	 */
	public static AlphaMask fromNonZeroBands( final List< RasterBand > bands )
	{
		final RasterBand first = bands.get( 0 );
		final boolean[] valid = new boolean[ first.numPixels() ];
		Arrays.fill( valid, true );

		for ( final RasterBand band : bands )
		{
			if ( !band.sameShape( first ) )
				throw new ShapeMismatchException( "Band of " + band.shapeString() + " does not match " + first.shapeString() );

			for ( int i = 0; i < valid.length; ++i )
				if ( band.get( i ) == 0 )
					valid[ i ] = false;
		}

		return fromBooleans( valid, first.width(), first.height() );
	}

	public boolean isValid( final int index ) { return data[ index ] != 0; }

	public int weight( final int index ) { return get( index ); }

	/**
	 * @param other - mask of the same shape
	 * @return boolean mask that is valid where both masks are valid
	 */
	public AlphaMask and( final AlphaMask other )
	{
		if ( !sameShape( other ) )
			throw new ShapeMismatchException( "Alpha masks differ in shape: " + shapeString() + " vs " + other.shapeString() );

		final boolean[] valid = new boolean[ data.length ];

		for ( int i = 0; i < valid.length; ++i )
			valid[ i ] = isValid( i ) && other.isValid( i );

		return fromBooleans( valid, width, height );
	}

	public long numValid()
	{
		long count = 0;

		for ( final short v : data )
			if ( v != 0 )
				++count;

		return count;
	}

	@Override
	public String toString()
	{
		return "AlphaMask[" + shapeString() + ", valid=" + numValid() + "]";
	}
}
