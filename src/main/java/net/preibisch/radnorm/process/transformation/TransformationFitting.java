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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.preibisch.radnorm.Threads;
import net.preibisch.radnorm.data.LinearTransformation;
import net.preibisch.radnorm.data.PIFSet;
import net.preibisch.radnorm.exception.InsufficientPIFsException;
import net.preibisch.radnorm.process.diagnostics.NormalizationObserver;

/**
 * Fits one {@link LinearTransformation} per band, the bands are independent
 * and fitted in parallel if more than one thread is requested.
 */
public class TransformationFitting
{
	private static final Logger LOG = LoggerFactory.getLogger( TransformationFitting.class );

	public static List< LinearTransformation > generate(
			final PIFSet pifs,
			final TransformationParameters params,
			final int numThreads,
			final NormalizationObserver observer ) throws InsufficientPIFsException
	{
		if ( params.getMethod() == TransformationMethod.SKIP )
		{
			LOG.info( "Transformation fitting skipped, using the identity for {} bands", pifs.numBands() );
			return Collections.nCopies( pifs.numBands(), LinearTransformation.IDENTITY );
		}

		return generate( pifs, params.getMethod().createFitter( params.getRansacParameters() ), numThreads, observer );
	}

	public static List< LinearTransformation > generate(
			final PIFSet pifs,
			final TransformationFitter fitter,
			final int numThreads,
			final NormalizationObserver observer ) throws InsufficientPIFsException
	{
		final int numBands = pifs.numBands();
		final List< LinearTransformation > transformations;

		if ( numThreads <= 1 || numBands == 1 )
		{
			transformations = new ArrayList<>( numBands );

			for ( int b = 0; b < numBands; ++b )
				transformations.add( fit( b, pifs, fitter, observer ) );
		}
		else
		{
			final ArrayList< Callable< LinearTransformation > > tasks = new ArrayList<>();

			for ( int b = 0; b < numBands; ++b )
			{
				final int band = b;
				tasks.add( () -> fit( band, pifs, fitter, observer ) );
			}

			try
			{
				transformations = Threads.execTasks( tasks, numThreads, "fit transformations" );
			}
			catch ( final ExecutionException e )
			{
				final Throwable cause = Threads.rethrowUnchecked( e );

				if ( cause instanceof InsufficientPIFsException )
					throw (InsufficientPIFsException)cause;

				throw new IllegalStateException( "Failed to fit transformations: " + cause, cause );
			}
		}

		return transformations;
	}

	private static LinearTransformation fit( final int band, final PIFSet pifs, final TransformationFitter fitter, final NormalizationObserver observer ) throws InsufficientPIFsException
	{
		final LinearTransformation t = fitter.fit( band, pifs.matches( band ), observer );

		LOG.debug( "band {}: {}", band, t );
		observer.transformationFitted( band, t );

		return t;
	}
}
