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
package net.preibisch.radnorm.process.transformation.mpicbg;

import java.util.Arrays;
import java.util.Random;

/**
 * Selected positions in a {@link FlattenedMatches}, the first {@link #size()}
 * entries of {@link #indices()} are valid.
 */
public class MatchIndices
{
	private final int[] indices;

	private int size;

	public MatchIndices( final int capacity )
	{
		indices = new int[ capacity ];
		size = 0;
	}

	public int capacity() {
		return indices.length;
	}

	public int size()
	{
		return size;
	}

	/**
	 * Get the internal index array.
	 * <p>
	 * Note that the length of the returned array may be larger than the current {@code size()} of this {@code MatchIndices}.
	 *
	 * @return index array
	 */
	public int[] indices()
	{
		return indices;
	}

	public void setSize( final int size )
	{
		if ( size > capacity() )
			throw new IllegalArgumentException( "Given size exceeds the capacity" );
		this.size = size;
	}

	public void set( final MatchIndices indices )
	{
		if ( indices.size() > capacity() )
			throw new IllegalArgumentException( "Given indices exceed the capacity" );
		System.arraycopy( indices.indices, 0, this.indices, 0, indices.size );
		this.size = indices.size;
	}

	/**
	 * Fills all slots with distinct random indices in {@code [0, bound)}, used
	 * for the minimal sample sets of RANSAC.
	 */
	public void sample( final Random rnd, final int bound )
	{
		distinctRandomInts( rnd, bound, indices );
		size = indices.length;
	}

	/**
	 * Fills all slots with a uniform random subset of {@code [0, bound)} by a
	 * partial Fisher-Yates shuffle, for subsets that are large compared to
	 * {@code bound}. The selected indices are sorted ascending.
	 */
	public void sampleSubset( final Random rnd, final int bound )
	{
		if ( indices.length > bound )
			throw new IllegalArgumentException( "not enough candidates" );

		final int[] all = new int[ bound ];
		for ( int i = 0; i < bound; ++i )
			all[ i ] = i;

		for ( int i = 0; i < indices.length; ++i )
		{
			final int j = i + rnd.nextInt( bound - i );
			final int tmp = all[ i ];
			all[ i ] = all[ j ];
			all[ j ] = tmp;
			indices[ i ] = all[ i ];
		}

		Arrays.sort( indices );
		size = indices.length;
	}

	public void copySelected( final double[] src, final double[] dest )
	{
		for ( int i = 0; i < size; i++ )
			dest[ i ] = src[ indices[ i ] ];
	}

	public void copySelected( final FlattenedMatches elements, final FlattenedMatches selectedElements )
	{
		copySelected( elements.p(), selectedElements.p() );
		copySelected( elements.q(), selectedElements.q() );
		copySelected( elements.w(), selectedElements.w() );
	}

	private static void distinctRandomInts( final Random rnd, final int bound, int[] ints )
	{
		if ( ints.length > bound )
		{
			throw new IllegalArgumentException( "not enough candidates" );
		}
		for ( int count = 0; count < ints.length; )
		{
			final int value = rnd.nextInt( bound );
			if ( !contains( ints, count, value ) )
			{
				ints[ count++ ] = value;
			}
		}
	}

	private static boolean contains( final int[] ints, final int bound, final int value )
	{
		for ( int i = 0; i < bound; i++ )
		{
			if ( ints[ i ] == value )
			{
				return true;
			}
		}
		return false;
	}
}
