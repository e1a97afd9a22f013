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

import net.preibisch.radnorm.exception.ShapeMismatchException;

/**
 * Marks the pseudo-invariant pixels of a candidate/reference pair, 0 means not
 * selected, any other value is the weight of the selected pixel.
 */
public class PIFMask extends UnsignedShortGrid
{
	/**
	 * @param data - samples in row-major order, the array is copied
	 */
	public PIFMask( final short[] data, final int width, final int height )
	{
		this( data, width, height, true );
	}

	private PIFMask( final short[] data, final int width, final int height, final boolean copy )
	{
		super( data, width, height, copy );
	}

	/**
	 * Uses the weights of an alpha mask as PIF weights, e.g. when a reference
	 * carries precomputed invariance weights in its alpha band.
	 *
	 * @param alpha - the alpha mask
	 * @return a new PIFMask with the same weights
	 */
	public static PIFMask fromAlpha( final AlphaMask alpha )
	{
		return new PIFMask( alpha.copyData(), alpha.width(), alpha.height(), false );
	}

	public static PIFMask fromBooleans( final boolean[] selected, final int width, final int height )
	{
		final short[] data = new short[ selected.length ];

		for ( int i = 0; i < selected.length; ++i )
			if ( selected[ i ] )
				data[ i ] = (short)MAX_VALUE;

		return new PIFMask( data, width, height, false );
	}

	public static PIFMask all( final int width, final int height )
	{
		final short[] data = new short[ width * height ];
		Arrays.fill( data, (short)MAX_VALUE );
		return new PIFMask( data, width, height, false );
	}

	public boolean isSelected( final int index ) { return data[ index ] != 0; }

	public int weight( final int index ) { return get( index ); }

	/**
	 * Keeps a pixel if it is selected in both masks, the weight is taken from this mask.
	 *
	 * @param other - mask of the same shape
	 * @return the intersection
	 */
	public PIFMask and( final PIFMask other )
	{
		if ( !sameShape( other ) )
			throw new ShapeMismatchException( "PIF masks differ in shape: " + shapeString() + " vs " + other.shapeString() );

		final short[] out = new short[ data.length ];

		for ( int i = 0; i < out.length; ++i )
			if ( other.isSelected( i ) )
				out[ i ] = data[ i ];

		return new PIFMask( out, width, height, false );
	}

	public long numSelected()
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
		return "PIFMask[" + shapeString() + ", selected=" + numSelected() + "]";
	}
}
