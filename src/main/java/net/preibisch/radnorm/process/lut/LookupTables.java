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
package net.preibisch.radnorm.process.lut;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.converter.Converters;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;
import net.preibisch.radnorm.data.Image;
import net.preibisch.radnorm.data.LinearTransformation;
import net.preibisch.radnorm.data.LookupTable;
import net.preibisch.radnorm.data.RasterBand;
import net.preibisch.radnorm.exception.ShapeMismatchException;
import net.preibisch.radnorm.exception.TypeMismatchException;

/**
 * Converts linear transformations into lookup tables and applies them to
 * bands and images.
 */
public class LookupTables
{
	private static final Logger LOG = LoggerFactory.getLogger( LookupTables.class );

	public static final int UINT16_MAX_VALUE = 65535;

	/**
	 * @param t - the transformation
	 * @return a table for all unsigned 16 bit values
	 */
	public static LookupTable build( final LinearTransformation t )
	{
		return build( t, UINT16_MAX_VALUE );
	}

	/**
	 * Entry v is {@code gain * v + offset}, clipped to [0, maxValue] and
	 * truncated towards zero.
	 *
	 * @param t - the transformation
	 * @param maxValue - largest input and output value
	 * @return a table with maxValue + 1 entries
	 */
	public static LookupTable build( final LinearTransformation t, final int maxValue )
	{
		final int[] lut = new int[ maxValue + 1 ];

		for ( int v = 0; v <= maxValue; ++v )
		{
			final double value = Math.min( maxValue, Math.max( 0.0, t.apply( v ) ) );
			lut[ v ] = (int)value;
		}

		LOG.debug( "built LUT for gain={}, offset={}: lut[0]={}, lut[{}]={}", t.getGain(), t.getOffset(), lut[ 0 ], maxValue, lut[ maxValue ] );

		return LookupTable.of( lut, maxValue );
	}

	public static List< LookupTable > build( final List< LinearTransformation > transformations )
	{
		final ArrayList< LookupTable > luts = new ArrayList<>( transformations.size() );

		for ( final LinearTransformation t : transformations )
			luts.add( build( t ) );

		return luts;
	}

	/**
	 * @param band - the band
	 * @param lut - a table for unsigned 16 bit values
	 * @return a new band with every value replaced by its table entry
	 * @throws TypeMismatchException if the table is not made for unsigned 16 bit values
	 */
	public static RasterBand apply( final RasterBand band, final LookupTable lut )
	{
		if ( lut.maxValue() != UINT16_MAX_VALUE || lut.size() != UINT16_MAX_VALUE + 1 )
			throw new TypeMismatchException( "A LUT for values 0.." + lut.maxValue() + " cannot be applied to a " + RasterBand.BIT_DEPTH + " bit band." );

		final short[] out = new short[ band.numPixels() ];

		for ( int i = 0; i < out.length; ++i )
			out[ i ] = (short)lut.get( band.get( i ) );

		return new RasterBand( out, band.width(), band.height() );
	}

	/**
	 * Applies one table per band, alpha and metadata are kept.
	 */
	public static Image apply( final Image image, final List< LookupTable > luts )
	{
		if ( luts.size() != image.numBands() )
			throw new ShapeMismatchException( image.numBands() + " bands but " + luts.size() + " LUTs" );

		final ArrayList< RasterBand > bands = new ArrayList<>( image.numBands() );

		for ( int b = 0; b < image.numBands(); ++b )
			bands.add( apply( image.band( b ), luts.get( b ) ) );

		return image.withBands( bands );
	}

	public static Image applyTransformations( final Image image, final List< LinearTransformation > transformations )
	{
		if ( transformations.size() != image.numBands() )
			throw new ShapeMismatchException( image.numBands() + " bands but " + transformations.size() + " transformations" );

		return apply( image, build( transformations ) );
	}

	/**
	 * The exact transformed values of a band, neither clipped nor rounded.
	 *
	 * @param band - the band
	 * @param t - the transformation
	 * @return a double image of the same size
	 */
	public static ArrayImg< DoubleType, DoubleArray > applyDirect( final RasterBand band, final LinearTransformation t )
	{
		final RandomAccessibleInterval< DoubleType > converted = Converters.convert( band.img(), new LinearIntensityConverter( t ), new DoubleType() );
		final ArrayImg< DoubleType, DoubleArray > out = ArrayImgs.doubles( band.width(), band.height() );

		final Cursor< DoubleType > cIn = Views.flatIterable( converted ).cursor();
		final Cursor< DoubleType > cOut = out.cursor();

		while ( cOut.hasNext() )
			cOut.next().set( cIn.next() );

		return out;
	}
}
