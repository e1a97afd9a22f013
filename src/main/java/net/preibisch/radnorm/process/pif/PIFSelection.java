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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.preibisch.radnorm.data.AlphaMask;
import net.preibisch.radnorm.data.Image;
import net.preibisch.radnorm.data.PIFMask;
import net.preibisch.radnorm.process.diagnostics.BandStatistics;
import net.preibisch.radnorm.process.diagnostics.NormalizationObserver;

/**
 * Runs a {@link PIFFilter} on every band of a candidate/reference pair and
 * combines the per-band masks, a pixel is a PIF if it is selected in all bands.
 */
public class PIFSelection
{
	private static final Logger LOG = LoggerFactory.getLogger( PIFSelection.class );

	public static PIFMask generate( final Image reference, final Image candidate, final PIFParameters params, final NormalizationObserver observer )
	{
		Image.requireComparable( reference, candidate );

		if ( params.getMethod() == PIFMethod.SKIP )
		{
			LOG.info( "PIF selection skipped, using the reference alpha as PIF weights" );
			return PIFMask.fromAlpha( reference.alpha() );
		}

		return generate( reference, candidate, params.createFilter(), observer );
	}

	public static PIFMask generate( final Image reference, final Image candidate, final PIFFilter filter, final NormalizationObserver observer )
	{
		Image.requireComparable( reference, candidate );

		final AlphaMask combinedAlpha = candidate.alpha().and( reference.alpha() );
		final long numValid = combinedAlpha.numValid();

		PIFMask mask = PIFMask.all( combinedAlpha.width(), combinedAlpha.height() );

		for ( int b = 0; b < reference.numBands(); ++b )
		{
			final PIFMask bandMask = filter.filter( b, candidate.band( b ), reference.band( b ), combinedAlpha, observer );

			observer.pifsSelected( b, numValid, bandMask.numSelected() );
			observer.correlation( b,
					BandStatistics.correlation( candidate.band( b ), reference.band( b ), combinedAlpha ),
					BandStatistics.correlation( candidate.band( b ), reference.band( b ), bandMask ) );

			mask = mask.and( bandMask );
		}

		final long numPIFs = mask.numSelected();

		LOG.info( "Found {} PIFs out of {} pixels ({}%) for all bands", numPIFs, mask.numPixels(), String.format( "%.2f", 100.0 * numPIFs / mask.numPixels() ) );

		return mask;
	}
}
