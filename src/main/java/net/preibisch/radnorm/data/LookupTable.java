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
 * Maps every input intensity {@code 0..maxValue} to its corrected output
 * intensity. The tables applied to {@link RasterBand}s have 65536 entries;
 * equality is bit-exact so tables can be persisted and compared in regression
 * tests.
 */
public class LookupTable
{
	private final int[] entries;
	private final int maxValue;

	private LookupTable( final int[] entries, final int maxValue )
	{
		this.entries = entries;
		this.maxValue = maxValue;
	}

	/**
	 * @param entries - one output value per input value, copied
	 * @param maxValue - largest representable value, {@code entries.length} must be {@code maxValue + 1}
	 * @return a new lookup table
	 */
	public static LookupTable of( final int[] entries, final int maxValue )
	{
		if ( maxValue < 0 || entries.length != maxValue + 1 )
			throw new IllegalArgumentException( "A table for values 0.." + maxValue + " needs " + ( maxValue + 1 ) + " entries, got " + entries.length );

		for ( int i = 0; i < entries.length; ++i )
			if ( entries[ i ] < 0 || entries[ i ] > maxValue )
				throw new IllegalArgumentException( "Entry " + i + " (" + entries[ i ] + ") is outside of [0, " + maxValue + "]" );

		return new LookupTable( entries.clone(), maxValue );
	}

	public int get( final int value ) { return entries[ value ]; }
	public int size() { return entries.length; }
	public int maxValue() { return maxValue; }
	public int[] toArray() { return entries.clone(); }

	@Override
	public boolean equals( final Object obj )
	{
		if ( !( obj instanceof LookupTable ) )
			return false;

		final LookupTable other = (LookupTable)obj;
		return maxValue == other.maxValue && Arrays.equals( entries, other.entries );
	}

	@Override
	public int hashCode()
	{
		return 31 * maxValue + Arrays.hashCode( entries );
	}

	@Override
	public String toString()
	{
		return "LookupTable[0.." + maxValue + ", lut[0]=" + entries[ 0 ] + ", lut[" + maxValue + "]=" + entries[ maxValue ] + "]";
	}
}
