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
package net.preibisch.radnorm.process.transformation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import mpicbg.models.NotEnoughDataPointsException;
import net.preibisch.radnorm.data.LinearTransformation;
import net.preibisch.radnorm.exception.InsufficientPIFsException;
import net.preibisch.radnorm.process.diagnostics.NormalizationObserver;
import net.preibisch.radnorm.process.transformation.mpicbg.FastAffineModel1D;
import net.preibisch.radnorm.process.transformation.mpicbg.FlattenedMatches;
import net.preibisch.radnorm.process.transformation.mpicbg.RANSACParameters;
import net.preibisch.radnorm.process.transformation.mpicbg.RansacRegressionFilter;

/**
 * RANSAC followed by iterative trust filtering, the transformation is the
 * least squares fit on the remaining inliers. Without consensus it falls back
 * to least squares on all PIFs.
 */
public class RobustLinearFitter implements TransformationFitter
{
	private static final Logger LOG = LoggerFactory.getLogger( RobustLinearFitter.class );

	final RansacRegressionFilter filter;

	public RobustLinearFitter( final RANSACParameters params )
	{
		this.filter = new RansacRegressionFilter( params );
	}

	public RobustLinearFitter()
	{
		this( new RANSACParameters() );
	}

	@Override
	public LinearTransformation fit( final int band, final FlattenedMatches pifs, final NormalizationObserver observer ) throws InsufficientPIFsException
	{
		TransformationFitter.requireEnoughPIFs( band, pifs );

		FastAffineModel1D model;

		try
		{
			model = filter.fit( pifs );
		}
		catch ( final NotEnoughDataPointsException e )
		{
			LOG.debug( "band {}: {}", band, e.getMessage() );
			model = null;
		}

		if ( model == null )
		{
			LOG.warn( "band {}: no robust consensus among {} PIFs, falling back to least squares", band, pifs.size() );
			observer.degenerateFit( TransformationMethod.ROBUST_LINEAR.getName(), band, "no consensus, using least squares on all PIFs" );
			return new OLSLinearFitter().fit( band, pifs, observer );
		}

		return LinearTransformation.fromModel( model );
	}
}
