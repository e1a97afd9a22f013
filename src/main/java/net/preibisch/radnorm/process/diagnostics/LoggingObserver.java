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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.preibisch.radnorm.data.LinearTransformation;

public class LoggingObserver implements NormalizationObserver
{
	private static final Logger LOG = LoggerFactory.getLogger( LoggingObserver.class );

	@Override
	public void pifsSelected( final int band, final long numValid, final long numPIFs )
	{
		LOG.info( "band {}: {} of {} valid pixels are PIFs", band, numPIFs, numValid );
	}

	@Override
	public void correlation( final int band, final double before, final double after )
	{
		LOG.info( "band {}: correlation {} before, {} after PIF filtering", band, before, after );
	}

	@Override
	public void transformationFitted( final int band, final LinearTransformation transformation )
	{
		LOG.info( "band {}: gain={}, offset={}", band, transformation.getGain(), transformation.getOffset() );
	}

	@Override
	public void degenerateFit( final String stage, final int band, final String reason )
	{
		LOG.warn( "{} band {}: {}", stage, band, reason );
	}

	@Override
	public void imageComposited( final int index, final long numValid )
	{
		LOG.debug( "composited image {} with {} valid pixels", index, numValid );
	}
}
