package net.preibisch.radnorm.process.transformation.mpicbg;

import java.util.Random;

import mpicbg.models.AffineModel1D;
import mpicbg.models.IllDefinedDataPointsException;
import mpicbg.models.NotEnoughDataPointsException;

/**
 * {@link AffineModel1D} mapping candidate intensities p to reference
 * intensities q that is fitted directly on {@link FlattenedMatches}, without
 * allocating a PointMatch per pixel pair.
 */
public class FastAffineModel1D extends AffineModel1D
{
	// residuals below this are rounding noise of exactly collinear samples
	public static final double MIN_TRUST_DISTANCE = 1e-6;

	public FastAffineModel1D()
	{
		super();
	}

	@Override
	public FastAffineModel1D copy()
	{
		final FastAffineModel1D m = new FastAffineModel1D();
		m.set( this );
		return m;
	}

	public double gain() { return m00; }
	public double offset() { return m01; }

	public double apply( final double l )
	{
		return l * m00 + m01;
	}

	/**
	 * Estimate the model from a set with many outliers by first filtering the
	 * worst outliers with RANSAC and then filtering potential outliers by
	 * robust iterative regression.
	 *
	 * @param candidates candidate data points including (many) outliers
	 * @param random source of the minimal sample sets, seed it for reproducible results
	 * @param iterations number of iterations
	 * @param maxEpsilon maximal allowed transfer error
	 * @param minInlierRatio minimal number of inliers to number of candidates
	 * @param minNumInliers minimally required absolute number of inliers
	 * @param maxTrust reject candidates with a cost larger than maxTrust * median cost
	 *
	 * @return indices of {@code candidates} that are inliers, or {@code null} if the model could not be fitted (this model remains unchanged in that case).
	 * @throws NotEnoughDataPointsException if not enough points available
	 */
	public MatchIndices fastFilterRansac(
			final FlattenedMatches candidates,
			final Random random,
			final int iterations,
			final double maxEpsilon,
			final double minInlierRatio,
			final int minNumInliers,
			final double maxTrust )
			throws NotEnoughDataPointsException
	{
		final MatchIndices inliers = new MatchIndices( candidates.size() );

		if ( ransac( candidates, inliers, random, iterations, maxEpsilon, minInlierRatio, minNumInliers ) &&
				trustFilter( candidates, inliers, maxTrust, minNumInliers ) )
			return inliers;

		return null;
	}

	/**
	 * Least squares fit on all matches (weighted if {@link FlattenedMatches#weighted()}).
	 *
	 * @param matches - the correspondences
	 * @throws NotEnoughDataPointsException if there are less than two matches
	 * @throws IllDefinedDataPointsException if all candidate intensities are equal
	 */
	public void fit( final FlattenedMatches matches ) throws NotEnoughDataPointsException, IllDefinedDataPointsException
	{
		final MatchIndices all = new MatchIndices( matches.size() );
		final int[] indices = all.indices();
		for ( int i = 0; i < indices.length; ++i )
			indices[ i ] = i;
		all.setSize( indices.length );

		fit( matches, all );
	}

	/**
	 * Least squares fit on the selected matches, unweighted matches count 1 each.
	 */
	public void fit( final FlattenedMatches matches, final MatchIndices indices ) throws NotEnoughDataPointsException, IllDefinedDataPointsException
	{
		final int size = indices.size();

		if ( size < MIN_NUM_MATCHES )
			throw new NotEnoughDataPointsException( size + " data points are not enough to estimate a 1d affine model, at least " + MIN_NUM_MATCHES + " data points required." );

		final double[] p = matches.p();
		final double[] q = matches.q();
		final double[] w = matches.w();
		final boolean weighted = matches.weighted();
		final int[] samples = indices.indices();

		double W = 0, S_p = 0, S_q = 0, S_pp = 0, S_pq = 0;

		for ( int i = 0; i < size; ++i )
		{
			final int k = samples[ i ];
			final double w_k = weighted ? w[ k ] : 1.0;

			W += w_k;
			S_p += w_k * p[ k ];
			S_q += w_k * q[ k ];
			S_pp += w_k * p[ k ] * p[ k ];
			S_pq += w_k * p[ k ] * q[ k ];
		}

		final double det = W * S_pp - S_p * S_p;

		if ( det == 0 || W == 0 )
			throw new IllDefinedDataPointsException();

		m00 = ( W * S_pq - S_p * S_q ) / det;
		m01 = ( S_q - m00 * S_p ) / W;

		invert();
	}

	private boolean ransac(
			final FlattenedMatches candidates,
			final MatchIndices inliers,
			final Random random,
			final int iterations,
			final double epsilon,
			final double minInlierRatio,
			final int minNumInliers ) throws NotEnoughDataPointsException
	{
		final int numCandidates = candidates.size();

		if ( numCandidates < getMinNumMatches() )
			throw new NotEnoughDataPointsException( numCandidates + " data points are not enough to solve the Model, at least " + getMinNumMatches() + " data points required." );

		cost = Double.MAX_VALUE;

		final FastAffineModel1D best = copy();
		final FastAffineModel1D hypothesis = copy();

		final MatchIndices minimalSet = new MatchIndices( getMinNumMatches() );
		final MatchIndices consensus = new MatchIndices( numCandidates );
		inliers.setSize( 0 );

		for ( int i = 0; i < iterations; ++i )
		{
			minimalSet.sample( random, numCandidates );

			if ( hypothesis.grow( candidates, minimalSet, consensus, epsilon, minInlierRatio, minNumInliers ) && hypothesis.betterThan( best ) )
			{
				best.set( hypothesis );
				inliers.set( consensus );
			}
		}

		if ( inliers.size() == 0 )
			return false;

		set( best );
		return true;
	}

	/**
	 * Fits the minimal set, then refits on the consensus until it stops
	 * changing.
	 *
	 * @return whether the final consensus is large enough, false if a fit was ill-defined
	 */
	private boolean grow(
			final FlattenedMatches candidates,
			final MatchIndices minimalSet,
			final MatchIndices consensus,
			final double epsilon,
			final double minInlierRatio,
			final int minNumInliers ) throws NotEnoughDataPointsException
	{
		try
		{
			fit( candidates, minimalSet );

			boolean good = collectInliers( candidates, consensus, epsilon, minInlierRatio, minNumInliers );
			int numInliers = 0;

			while ( good && numInliers != consensus.size() )
			{
				numInliers = consensus.size();
				fit( candidates, consensus );
				good = collectInliers( candidates, consensus, epsilon, minInlierRatio, minNumInliers );
			}

			return good;
		}
		catch ( final IllDefinedDataPointsException e )
		{
			return false;
		}
	}

	/**
	 * Repeatedly refits on the inliers and drops every candidate whose residual
	 * exceeds {@code maxTrust} times the median residual, until no candidate is
	 * dropped.
	 */
	private boolean trustFilter(
			final FlattenedMatches candidates,
			final MatchIndices inliers,
			final double maxTrust,
			final int minNumInliers ) throws NotEnoughDataPointsException
	{
		if ( inliers.size() < getMinNumMatches() )
			throw new NotEnoughDataPointsException( inliers.size() + " data points are not enough to solve the Model, at least " + getMinNumMatches() + " data points required." );

		final FastAffineModel1D refined = copy();
		final ResidualStatistic residuals = new ResidualStatistic( candidates.size() );

		final double[] p = candidates.p();
		final double[] q = candidates.q();

		int numBefore;

		do
		{
			numBefore = inliers.size();

			try
			{
				refined.fit( candidates, inliers );
			}
			catch ( final IllDefinedDataPointsException e )
			{
				return false;
			}

			final int[] samples = inliers.indices();

			residuals.clear();
			for ( int i = 0; i < numBefore; ++i )
				residuals.add( Math.abs( refined.apply( p[ samples[ i ] ] ) - q[ samples[ i ] ] ) );

			final double t = Math.max( residuals.getMedian() * maxTrust, MIN_TRUST_DISTANCE );

			// getMedian() sorted the residuals, recompute them in index order
			int kept = 0;
			for ( int i = 0; i < numBefore; ++i )
			{
				final int k = samples[ i ];
				if ( Math.abs( refined.apply( p[ k ] ) - q[ k ] ) <= t )
					samples[ kept++ ] = k;
			}

			inliers.setSize( kept );
			refined.cost = residuals.mean();
		}
		while ( numBefore > inliers.size() );

		if ( numBefore < minNumInliers )
			return false;

		set( refined );
		return true;
	}

	/**
	 * Stores the indices of all candidates with a residual below
	 * {@code epsilon} in {@code inliers} and sets the cost to the outlier
	 * ratio.
	 *
	 * @return whether the model has enough inliers
	 */
	private boolean collectInliers(
			final FlattenedMatches candidates,
			final MatchIndices inliers,
			final double epsilon,
			final double minInlierRatio,
			final int minNumInliers )
	{
		final int numCandidates = candidates.size();
		final double[] p = candidates.p();
		final double[] q = candidates.q();
		final int[] indices = inliers.indices();

		int numInliers = 0;
		for ( int k = 0; k < numCandidates; ++k )
			if ( Math.abs( apply( p[ k ] ) - q[ k ] ) < epsilon )
				indices[ numInliers++ ] = k;

		inliers.setSize( numInliers );

		final double ratio = ( double )numInliers / numCandidates;
		setCost( Math.max( 0.0, Math.min( 1.0, 1.0 - ratio ) ) );

		return numInliers >= minNumInliers && ratio > minInlierRatio;
	}
}
