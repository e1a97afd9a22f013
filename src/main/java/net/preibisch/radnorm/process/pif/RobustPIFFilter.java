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

import mpicbg.models.NotEnoughDataPointsException;
import net.preibisch.radnorm.data.AlphaMask;
import net.preibisch.radnorm.data.LinearTransformation;
import net.preibisch.radnorm.data.PIFMask;
import net.preibisch.radnorm.data.RasterBand;
import net.preibisch.radnorm.process.diagnostics.NormalizationObserver;
import net.preibisch.radnorm.process.transformation.mpicbg.FastAffineModel1D;
import net.preibisch.radnorm.process.transformation.mpicbg.FlattenedMatches;
import net.preibisch.radnorm.process.transformation.mpicbg.RansacRegressionFilter;

/**
 * Fits a line candidate to reference with RANSAC and keeps the pixels whose
 * perpendicular distance to that line is below the threshold.
 */
public class RobustPIFFilter implements PIFFilter
{
	private static final Logger LOG = LoggerFactory.getLogger( RobustPIFFilter.class );

	final RobustParameters params;

	public RobustPIFFilter( final RobustParameters params )
	{
		this.params = params;
	}

	public RobustPIFFilter()
	{
		this( new RobustParameters() );
	}

	@Override
	public PIFMask filter( final int band, final RasterBand candidate, final RasterBand reference, final AlphaMask combinedAlpha, final NormalizationObserver observer )
	{
		final LinearTransformation line = fitLine( band, candidate, reference, combinedAlpha, observer );

		LOG.debug( "band {}: filtering from line y = {} * x + {}", band, line.getGain(), line.getOffset() );

		final double gain = line.getGain();
		final double offset = line.getOffset();
		final double norm = Math.sqrt( 1 + gain * gain );
		final double threshold = params.getThreshold();

		final boolean[] selected = new boolean[ combinedAlpha.numPixels() ];

		for ( int i = 0; i < selected.length; ++i )
			if ( combinedAlpha.isValid( i ) )
				selected[ i ] = Math.abs( gain * candidate.get( i ) - reference.get( i ) + offset ) / norm < threshold;

		return PIFMask.fromBooleans( selected, combinedAlpha.width(), combinedAlpha.height() );
	}

	/**
	 * @return the robust line, gain 1 and offset 0 if there is no consensus
	 */
	LinearTransformation fitLine( final int band, final RasterBand candidate, final RasterBand reference, final AlphaMask combinedAlpha, final NormalizationObserver observer )
	{
		final FlattenedMatches matches = new FlattenedMatches( (int)combinedAlpha.numValid() );

		for ( int i = 0; i < combinedAlpha.numPixels(); ++i )
			if ( combinedAlpha.isValid( i ) )
				matches.put( candidate.get( i ), reference.get( i ), 1.0 );

		matches.flip();
		matches.setWeighted( false );

		final FastAffineModel1D model;

		try
		{
			model = new RansacRegressionFilter( params.getRansacParameters() ).fit( matches );
		}
		catch ( final NotEnoughDataPointsException e )
		{
			observer.degenerateFit( PIFMethod.FILTER_ROBUST.getName(), band, e.getMessage() + " Using the identity line." );
			return LinearTransformation.IDENTITY;
		}

		if ( model == null )
		{
			observer.degenerateFit( PIFMethod.FILTER_ROBUST.getName(), band, "no consensus among " + matches.size() + " pixels, using the identity line" );
			return LinearTransformation.IDENTITY;
		}

		return LinearTransformation.fromModel( model );
	}
}
