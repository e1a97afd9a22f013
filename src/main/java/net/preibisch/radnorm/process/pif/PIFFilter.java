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
 * Selects the pseudo-invariant pixels of one band. Implementations are pure
 * functions of their input and never select a pixel that is invalid in the
 * combined alpha.
 */
public interface PIFFilter
{
	/**
	 * @param band - index of the band, only used for diagnostics
	 * @param candidate - the candidate band
	 * @param reference - the reference band
	 * @param combinedAlpha - pixels valid in candidate and reference
	 * @param observer - receives degenerate fit events
	 * @return the mask of selected pixels, same shape as the input
	 */
	PIFMask filter( int band, RasterBand candidate, RasterBand reference, AlphaMask combinedAlpha, NormalizationObserver observer );
}
