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
package net.preibisch.radnorm.process.pif;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.util.RealSum;
import net.preibisch.radnorm.data.AlphaMask;
import net.preibisch.radnorm.data.PIFMask;
import net.preibisch.radnorm.data.RasterBand;
import net.preibisch.radnorm.process.diagnostics.NormalizationObserver;

/**
 * Selects the pixels close to the principal axis of the joint (candidate,
 * reference) distribution. The axis is the major eigenvector of the 2x2
 * covariance matrix through the mean, a pixel is a PIF if its distance to the
 * axis (the absolute projection onto the minor eigenvector) is at most the
 * limit.
 */
public class PCAPIFFilter implements PIFFilter
{
	private static final Logger LOG = LoggerFactory.getLogger( PCAPIFFilter.class );

	final PCAParameters params;

	public PCAPIFFilter( final PCAParameters params )
	{
		this.params = params;
	}

	public PCAPIFFilter()
	{
		this( new PCAParameters() );
	}

	@Override
	public PIFMask filter( final int band, final RasterBand candidate, final RasterBand reference, final AlphaMask combinedAlpha, final NormalizationObserver observer )
	{
		final int n = combinedAlpha.numPixels();
		final boolean[] selected = new boolean[ n ];

		final RealSum sumC = new RealSum(), sumR = new RealSum();
		long count = 0;

		for ( int i = 0; i < n; ++i )
		{
			if ( combinedAlpha.isValid( i ) )
			{
				sumC.add( candidate.get( i ) );
				sumR.add( reference.get( i ) );
				++count;
			}
		}

		if ( count == 0 )
			return PIFMask.fromBooleans( selected, combinedAlpha.width(), combinedAlpha.height() );

		final double meanC = sumC.getSum() / count;
		final double meanR = sumR.getSum() / count;

		final RealSum sCC = new RealSum(), sRR = new RealSum(), sCR = new RealSum();

		for ( int i = 0; i < n; ++i )
		{
			if ( combinedAlpha.isValid( i ) )
			{
				final double dc = candidate.get( i ) - meanC;
				final double dr = reference.get( i ) - meanR;
				sCC.add( dc * dc );
				sRR.add( dr * dr );
				sCR.add( dc * dr );
			}
		}

		final double varC = sCC.getSum() / count;
		final double varR = sRR.getSum() / count;
		final double covCR = sCR.getSum() / count;

		if ( varC == 0 || varR == 0 )
		{
			observer.degenerateFit( PIFMethod.FILTER_PCA.getName(), band, "zero variance (candidate=" + varC + ", reference=" + varR + "), all valid pixels pass" );

			for ( int i = 0; i < n; ++i )
				selected[ i ] = combinedAlpha.isValid( i );

			return PIFMask.fromBooleans( selected, combinedAlpha.width(), combinedAlpha.height() );
		}

		final double[] minor = minorEigenvector( varC, covCR, varR );
		final double limit = params.getLimit();

		LOG.debug( "band {}: mean=({}, {}), minor eigenvector=({}, {})", band, meanC, meanR, minor[ 0 ], minor[ 1 ] );

		for ( int i = 0; i < n; ++i )
		{
			if ( combinedAlpha.isValid( i ) )
			{
				final double distance = Math.abs( ( candidate.get( i ) - meanC ) * minor[ 0 ] + ( reference.get( i ) - meanR ) * minor[ 1 ] );
				selected[ i ] = distance <= limit;
			}
		}

		return PIFMask.fromBooleans( selected, combinedAlpha.width(), combinedAlpha.height() );
	}

	/**
	 * Closed form eigen decomposition of the symmetric matrix [[a, b], [b, c]].
	 *
	 * @return the unit eigenvector of the smaller eigenvalue
	 */
	public static double[] minorEigenvector( final double a, final double b, final double c )
	{
		final double major0, major1;

		if ( b != 0 )
		{
			final double lambda = ( a + c ) / 2 + Math.sqrt( ( a - c ) * ( a - c ) / 4 + b * b );
			major0 = lambda - c;
			major1 = b;
		}
		else if ( a >= c )
		{
			major0 = 1;
			major1 = 0;
		}
		else
		{
			major0 = 0;
			major1 = 1;
		}

		final double norm = Math.sqrt( major0 * major0 + major1 * major1 );

		return new double[] { -major1 / norm, major0 / norm };
	}
}
