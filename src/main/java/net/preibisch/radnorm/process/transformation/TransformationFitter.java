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

import net.preibisch.radnorm.data.LinearTransformation;
import net.preibisch.radnorm.exception.InsufficientPIFsException;
import net.preibisch.radnorm.process.diagnostics.NormalizationObserver;
import net.preibisch.radnorm.process.transformation.mpicbg.FlattenedMatches;

/**
 * Fits the linear transformation of one band that maps candidate intensities
 * (p) to reference intensities (q).
 */
public interface TransformationFitter
{
	public static final int MIN_NUM_PIFS = 2;

	/**
	 * @param band - index of the band, for diagnostics and error messages
	 * @param pifs - the PIF intensities of this band
	 * @param observer - receives degenerate fit events
	 * @return the fitted transformation
	 * @throws InsufficientPIFsException if there are fewer than {@link #MIN_NUM_PIFS} distinct (p, q) pairs
	 */
	LinearTransformation fit( int band, FlattenedMatches pifs, NormalizationObserver observer ) throws InsufficientPIFsException;

	/**
	 * Repeated pixels with the same intensity pair count once, they do not
	 * constrain the gain any further.
	 *
	 * @throws InsufficientPIFsException if there are fewer than {@link #MIN_NUM_PIFS} distinct (p, q) pairs
	 */
	public static void requireEnoughPIFs( final int band, final FlattenedMatches pifs ) throws InsufficientPIFsException
	{
		final int numDistinct = numDistinctPairs( pifs );

		if ( numDistinct < MIN_NUM_PIFS )
			throw new InsufficientPIFsException( band, numDistinct, MIN_NUM_PIFS );
	}

	/**
	 * @param pifs - the PIF intensities
	 * @return 0 if there are no PIFs, 1 if all PIFs share the same (p, q) pair, 2 otherwise
	 */
	public static int numDistinctPairs( final FlattenedMatches pifs )
	{
		final int size = pifs.size();

		if ( size == 0 )
			return 0;

		final double[] p = pifs.p();
		final double[] q = pifs.q();

		for ( int i = 1; i < size; ++i )
			if ( p[ i ] != p[ 0 ] || q[ i ] != q[ 0 ] )
				return 2;

		return 1;
	}
}
