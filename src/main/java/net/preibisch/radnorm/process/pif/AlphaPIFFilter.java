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

import net.preibisch.radnorm.data.AlphaMask;
import net.preibisch.radnorm.data.PIFMask;
import net.preibisch.radnorm.data.RasterBand;
import net.preibisch.radnorm.process.diagnostics.NormalizationObserver;

/**
 * Every pixel that is valid in candidate and reference is a PIF.
 */
public class AlphaPIFFilter implements PIFFilter
{
	@Override
	public PIFMask filter( final int band, final RasterBand candidate, final RasterBand reference, final AlphaMask combinedAlpha, final NormalizationObserver observer )
	{
		final boolean[] selected = new boolean[ combinedAlpha.numPixels() ];

		for ( int i = 0; i < selected.length; ++i )
			selected[ i ] = combinedAlpha.isValid( i );

		return PIFMask.fromBooleans( selected, combinedAlpha.width(), combinedAlpha.height() );
	}
}
