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
package net.preibisch.radnorm.process.diagnostics;

import net.imglib2.util.RealSum;
import net.preibisch.radnorm.data.AlphaMask;
import net.preibisch.radnorm.data.PIFMask;
import net.preibisch.radnorm.data.RasterBand;

/**
 * Pearson correlation of a candidate and a reference band, summed with
 * {@link RealSum} to keep precision on large rasters.
 */
public class BandStatistics
{
	public static double correlation( final RasterBand candidate, final RasterBand reference, final AlphaMask valid )
	{
		final int n = valid.numPixels();
		final boolean[] selected = new boolean[ n ];
		for ( int i = 0; i < n; ++i )
			selected[ i ] = valid.isValid( i );

		return correlation( candidate, reference, selected );
	}

	public static double correlation( final RasterBand candidate, final RasterBand reference, final PIFMask pifs )
	{
		final int n = pifs.numPixels();
		final boolean[] selected = new boolean[ n ];
		for ( int i = 0; i < n; ++i )
			selected[ i ] = pifs.isSelected( i );

		return correlation( candidate, reference, selected );
	}

	/**
	 * @return the correlation coefficient, NaN for fewer than two pixels or zero variance
	 */
	public static double correlation( final RasterBand candidate, final RasterBand reference, final boolean[] selected )
	{
		final RealSum sumC = new RealSum(), sumR = new RealSum();
		long count = 0;

		for ( int i = 0; i < selected.length; ++i )
		{
			if ( !selected[ i ] )
				continue;

			sumC.add( candidate.get( i ) );
			sumR.add( reference.get( i ) );
			++count;
		}

		if ( count < 2 )
			return Double.NaN;

		final double meanC = sumC.getSum() / count;
		final double meanR = sumR.getSum() / count;

		final RealSum cc = new RealSum(), rr = new RealSum(), cr = new RealSum();

		for ( int i = 0; i < selected.length; ++i )
		{
			if ( !selected[ i ] )
				continue;

			final double dc = candidate.get( i ) - meanC;
			final double dr = reference.get( i ) - meanR;
			cc.add( dc * dc );
			rr.add( dr * dr );
			cr.add( dc * dr );
		}

		final double denom = Math.sqrt( cc.getSum() * rr.getSum() );

		if ( denom == 0 )
			return Double.NaN;

		return cr.getSum() / denom;
	}
}
