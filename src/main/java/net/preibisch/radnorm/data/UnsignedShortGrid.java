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

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.converter.Converters;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.ShortArray;
import net.imglib2.type.numeric.integer.UnsignedShortType;

/**
 * A 2d grid of unsigned 16 bit samples backed by an {@link ArrayImg}. Samples
 * are addressed either by (x, y) or by the flat index {@code y * width + x},
 * which is also the iteration order of the underlying {@link ArrayImg}.
 * <p>
 * Grids are never written after construction, all processing steps create new
 * instances.
 */
public abstract class UnsignedShortGrid
{
	public static final int MAX_VALUE = 65535;

	final ArrayImg< UnsignedShortType, ShortArray > img;
	final short[] data;
	final int width, height;

	/**
	 * @param data - samples in row-major order
	 * @param width - number of columns
	 * @param height - number of rows
	 * @param copy - whether to copy {@code data}, only pass false for arrays nobody else holds
	 */
	protected UnsignedShortGrid( final short[] data, final int width, final int height, final boolean copy )
	{
		if ( width <= 0 || height <= 0 )
			throw new IllegalArgumentException( "Grid dimensions must be positive: " + width + "x" + height );

		if ( data.length != (long)width * (long)height )
			throw new IllegalArgumentException( "Grid of " + width + "x" + height + " cannot hold " + data.length + " samples." );

		this.data = copy ? data.clone() : data;
		this.width = width;
		this.height = height;
		this.img = ArrayImgs.unsignedShorts( this.data, width, height );
	}

	public int width() { return width; }
	public int height() { return height; }
	public int numPixels() { return data.length; }

	/**
	 * @param index - flat index {@code y * width + x}
	 * @return the unsigned sample value
	 */
	public int get( final int index ) { return data[ index ] & 0xffff; }

	public int get( final int x, final int y ) { return get( y * width + x ); }

	/**
	 * @return a read-only view of the grid as an imglib2 image, values set through it are discarded
	 */
	public RandomAccessibleInterval< UnsignedShortType > img()
	{
		return Converters.convert( (RandomAccessibleInterval< UnsignedShortType >)img, ( in, out ) -> out.set( in ), new UnsignedShortType() );
	}

	public boolean sameShape( final UnsignedShortGrid other )
	{
		return width == other.width && height == other.height;
	}

	public short[] copyData() { return data.clone(); }

	public String shapeString() { return width + "x" + height; }

	protected static short[] toShorts( final int[][] rows )
	{
		final int height = rows.length;
		final int width = rows[ 0 ].length;
		final short[] data = new short[ width * height ];

		for ( int y = 0; y < height; ++y )
		{
			if ( rows[ y ].length != width )
				throw new IllegalArgumentException( "Row " + y + " has " + rows[ y ].length + " columns, expected " + width );

			for ( int x = 0; x < width; ++x )
				data[ y * width + x ] = toUnsignedShort( rows[ y ][ x ] );
		}

		return data;
	}

	protected static short toUnsignedShort( final int value )
	{
		if ( value < 0 || value > MAX_VALUE )
			throw new IllegalArgumentException( "Value " + value + " is outside of [0, " + MAX_VALUE + "]" );

		return (short)value;
	}
}
