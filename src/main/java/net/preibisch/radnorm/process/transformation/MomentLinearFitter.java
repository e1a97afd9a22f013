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

import net.imglib2.util.RealSum;
import net.preibisch.radnorm.data.LinearTransformation;
import net.preibisch.radnorm.exception.InsufficientPIFsException;
import net.preibisch.radnorm.process.diagnostics.NormalizationObserver;
import net.preibisch.radnorm.process.transformation.mpicbg.FlattenedMatches;

/**
 * Matches mean and (population) standard deviation of the candidate PIFs to
 * those of the reference PIFs: {@code gain = std(r) / std(c)},
 * {@code offset = mean(r) - gain * mean(c)}. Weighted if the matches are.
 * A constant candidate gets gain 1.
 */
public class MomentLinearFitter implements TransformationFitter
{
	@Override
	public LinearTransformation fit( final int band, final FlattenedMatches pifs, final NormalizationObserver observer ) throws InsufficientPIFsException
	{
		TransformationFitter.requireEnoughPIFs( band, pifs );

		final double[] c = pifs.p();
		final double[] r = pifs.q();
		final double[] w = pifs.w();
		final boolean weighted = pifs.weighted();
		final int n = pifs.size();

		final RealSum sumW = new RealSum(), sumC = new RealSum(), sumR = new RealSum();

		for ( int i = 0; i < n; ++i )
		{
			final double w_i = weighted ? w[ i ] : 1.0;
			sumW.add( w_i );
			sumC.add( w_i * c[ i ] );
			sumR.add( w_i * r[ i ] );
		}

		final double W = sumW.getSum();
		final double meanC = sumC.getSum() / W;
		final double meanR = sumR.getSum() / W;

		final RealSum varC = new RealSum(), varR = new RealSum();

		for ( int i = 0; i < n; ++i )
		{
			final double w_i = weighted ? w[ i ] : 1.0;
			varC.add( w_i * ( c[ i ] - meanC ) * ( c[ i ] - meanC ) );
			varR.add( w_i * ( r[ i ] - meanR ) * ( r[ i ] - meanR ) );
		}

		final double stdC = Math.sqrt( varC.getSum() / W );
		final double stdR = Math.sqrt( varR.getSum() / W );

		final double gain;

		if ( stdC == 0 )
		{
			observer.degenerateFit( TransformationMethod.MOMENT_LINEAR.getName(), band, "candidate PIFs have zero variance, using gain 1" );
			gain = 1.0;
		}
		else
		{
			gain = stdR / stdC;
		}

		return new LinearTransformation( gain, meanR - gain * meanC );
	}
}
