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

/**
 * Parameters of the RANSAC + trust filter regression of a 1d affine
 * intensity model.
 */
public class RANSACParameters
{
	public static int num_iterations = 1000;
	public static double max_epsilon = 1000;
	public static double min_inlier_ratio = 0.1;
	public static int min_num_inliers = 10;
	public static double max_trust = 3.0;
	public static int max_samples = 100_000;
	public static long random_seed = 344;

	protected int numIterations, minNumInliers, maxSamples;
	protected double maxEpsilon, minInlierRatio, maxTrust;
	protected long seed;

	/**
	 * @param numIterations number of RANSAC iterations
	 * @param maxEpsilon maximal allowed transfer error
	 * @param minInlierRatio minimal number of inliers to number of candidates
	 * @param minNumInliers minimally required absolute number of inliers
	 * @param maxTrust reject candidates with a cost larger than maxTrust * median cost
	 * @param maxSamples at most this many candidates (drawn at random) are used for the regression
	 * @param seed seed of the random number generator
	 */
	public RANSACParameters(
			final int numIterations,
			final double maxEpsilon,
			final double minInlierRatio,
			final int minNumInliers,
			final double maxTrust,
			final int maxSamples,
			final long seed )
	{
		if ( maxSamples < 2 )
			throw new IllegalArgumentException( "maxSamples must be at least 2, got " + maxSamples );

		this.numIterations = numIterations;
		this.maxEpsilon = maxEpsilon;
		this.minInlierRatio = minInlierRatio;
		this.minNumInliers = minNumInliers;
		this.maxTrust = maxTrust;
		this.maxSamples = maxSamples;
		this.seed = seed;
	}

	public RANSACParameters()
	{
		this( num_iterations, max_epsilon, min_inlier_ratio, min_num_inliers, max_trust, max_samples, random_seed );
	}

	public int getNumIterations() { return numIterations; }
	public double getMaxEpsilon() { return maxEpsilon; }
	public double getMinInlierRatio() { return minInlierRatio; }
	public int getMinNumInliers() { return minNumInliers; }
	public double getMaxTrust() { return maxTrust; }
	public int getMaxSamples() { return maxSamples; }
	public long getSeed() { return seed; }

	public RANSACParameters withMaxEpsilon( final double maxEpsilon )
	{
		return new RANSACParameters( numIterations, maxEpsilon, minInlierRatio, minNumInliers, maxTrust, maxSamples, seed );
	}

	@Override
	public String toString()
	{
		return "RANSACParameters[iterations=" + numIterations + ", maxEpsilon=" + maxEpsilon + ", minInlierRatio=" + minInlierRatio +
				", minNumInliers=" + minNumInliers + ", maxTrust=" + maxTrust + ", maxSamples=" + maxSamples + ", seed=" + seed + "]";
	}
}
