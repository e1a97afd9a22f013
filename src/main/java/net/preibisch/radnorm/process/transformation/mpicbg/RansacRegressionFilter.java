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

import java.util.Random;

import mpicbg.models.NotEnoughDataPointsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fits a {@link FastAffineModel1D} to intensity correspondences with many
 * outliers. Large candidate sets are reduced to a random subset first, the
 * random generator is seeded so repeated runs give identical models.
 */
public class RansacRegressionFilter
{
	private static final Logger LOG = LoggerFactory.getLogger( RansacRegressionFilter.class );

	private final RANSACParameters params;

	public RansacRegressionFilter( final RANSACParameters params )
	{
		this.params = params;
	}

	public RANSACParameters getParameters() { return params; }

	/**
	 * @param candidates - all correspondences including outliers
	 * @return the fitted model, or {@code null} if no consensus was found
	 * @throws NotEnoughDataPointsException if there are fewer candidates than the model needs
	 */
	public FastAffineModel1D fit( final FlattenedMatches candidates ) throws NotEnoughDataPointsException
	{
		final Random random = new Random( params.getSeed() );
		final FlattenedMatches samples = subsample( candidates, params.getMaxSamples(), random );

		final FastAffineModel1D model = new FastAffineModel1D();
		final MatchIndices inliers = model.fastFilterRansac(
				samples,
				random,
				params.getNumIterations(),
				params.getMaxEpsilon(),
				params.getMinInlierRatio(),
				params.getMinNumInliers(),
				params.getMaxTrust() );

		if ( inliers == null )
		{
			LOG.debug( "no consensus among {} candidates", samples.size() );
			return null;
		}

		LOG.debug( "inliers/candidates: {}/{}, gain={}, offset={}", inliers.size(), samples.size(), model.gain(), model.offset() );
		return model;
	}

	static FlattenedMatches subsample( final FlattenedMatches candidates, final int maxSamples, final Random random )
	{
		if ( candidates.size() <= maxSamples )
			return candidates;

		final MatchIndices selected = new MatchIndices( maxSamples );
		selected.sampleSubset( random, candidates.size() );

		final FlattenedMatches subset = new FlattenedMatches( maxSamples );
		selected.copySelected( candidates, subset );
		subset.setWeighted( candidates.weighted() );

		LOG.debug( "subsampled {} of {} candidates", maxSamples, candidates.size() );
		return subset;
	}
}
