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
package net.preibisch.radnorm.process.validation;

import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.util.RealSum;
import net.preibisch.radnorm.data.Image;
import net.preibisch.radnorm.exception.ShapeMismatchException;

/**
 * Compares two images of the same scene, e.g. a normalized candidate with
 * its reference.
 */
public class Validation
{
	private static final Logger LOG = LoggerFactory.getLogger( Validation.class );

	public static double score( final Image a, final Image b, final ValidationMethod method )
	{
		switch ( method )
		{
		case RMSE:
			return sumOfRmse( a, b );
		default:
			throw new IllegalArgumentException( "Unknown validation method " + method );
		}
	}

	/**
	 * @return the sum over all bands of the root mean square error on the pixels valid in both images, NaN if a band has no such pixel
	 */
	public static double sumOfRmse( final Image a, final Image b )
	{
		if ( a.numBands() != b.numBands() )
			throw new ShapeMismatchException( "Images have a different number of bands: " + a.numBands() + " vs " + b.numBands() );

		Image.requireComparable( a, b );

		final double[] rmses = new double[ a.numBands() ];
		double sum = 0;

		for ( int band = 0; band < a.numBands(); ++band )
		{
			rmses[ band ] = rmse( a, b, band );
			sum += rmses[ band ];
		}

		LOG.info( "Root mean square errors: {}", Arrays.toString( rmses ) );

		return sum;
	}

	/**
	 * @return the root mean square error of one band on the pixels valid in both images, NaN if there is no such pixel
	 */
	public static double rmse( final Image a, final Image b, final int band )
	{
		final RealSum sum = new RealSum();
		long count = 0;

		for ( int i = 0; i < a.numPixels(); ++i )
		{
			if ( a.alpha().isValid( i ) && b.alpha().isValid( i ) )
			{
				final double d = a.band( band ).get( i ) - b.band( band ).get( i );
				sum.add( d * d );
				++count;
			}
		}

		if ( count == 0 )
		{
			LOG.warn( "band {}: no pixel is valid in both images, RMSE is undefined", band );
			return Double.NaN;
		}

		return Math.sqrt( sum.getSum() / count );
	}
}
