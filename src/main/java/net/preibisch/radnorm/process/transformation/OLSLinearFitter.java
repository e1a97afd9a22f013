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

import mpicbg.models.IllDefinedDataPointsException;
import mpicbg.models.NotEnoughDataPointsException;
import net.preibisch.radnorm.data.LinearTransformation;
import net.preibisch.radnorm.exception.InsufficientPIFsException;
import net.preibisch.radnorm.process.diagnostics.NormalizationObserver;
import net.preibisch.radnorm.process.transformation.mpicbg.FastAffineModel1D;
import net.preibisch.radnorm.process.transformation.mpicbg.FlattenedMatches;

/**
 * (Weighted) least squares fit of {@code r = gain * c + offset}. If all
 * candidate PIFs are equal the gain is 1 and the offset shifts the means.
 */
public class OLSLinearFitter implements TransformationFitter
{
	@Override
	public LinearTransformation fit( final int band, final FlattenedMatches pifs, final NormalizationObserver observer ) throws InsufficientPIFsException
	{
		TransformationFitter.requireEnoughPIFs( band, pifs );

		final FastAffineModel1D model = new FastAffineModel1D();

		try
		{
			model.fit( pifs );
		}
		catch ( final IllDefinedDataPointsException e )
		{
			observer.degenerateFit( TransformationMethod.OLS_LINEAR.getName(), band, "candidate PIFs have zero variance, using gain 1" );
			return meanShift( pifs );
		}
		catch ( final NotEnoughDataPointsException e )
		{
			throw new InsufficientPIFsException( band, pifs.size(), MIN_NUM_PIFS );
		}

		return LinearTransformation.fromModel( model );
	}

	/**
	 * @return gain 1 and the offset between the (weighted) means
	 */
	static LinearTransformation meanShift( final FlattenedMatches pifs )
	{
		final double[] means = pifs.weightedMeans();
		return new LinearTransformation( 1.0, means[ 1 ] - means[ 0 ] );
	}
}
