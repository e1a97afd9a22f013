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
package net.preibisch.radnorm.process.timestack;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.preibisch.radnorm.Threads;
import net.preibisch.radnorm.data.Image;
import net.preibisch.radnorm.process.diagnostics.NormalizationObserver;

/**
 * Composites a stack of co-registered images of the same scene into a single
 * reference image. Only one image of the stack has to be in memory at a time.
 */
public class TimeStack
{
	private static final Logger LOG = LoggerFactory.getLogger( TimeStack.class );

	/**
	 * @param images - the stack, may load its images lazily
	 * @param params - method, nodata values and metadata policy
	 * @param observer - notified for every composited image
	 * @return the composite
	 */
	public static Image composite( final Iterable< Image > images, final TimeStackParameters params, final NormalizationObserver observer )
	{
		if ( params.getMethod() == TimeStackMethod.SKIP )
			return single( images );

		final TimeStackAccumulator accumulator = new TimeStackAccumulator( params );

		int index = 0;

		for ( final Image image : images )
		{
			final long numValid = accumulator.add( image );
			observer.imageComposited( index++, numValid );
		}

		if ( accumulator.isEmpty() )
			throw new IllegalArgumentException( "The time stack contains no images." );

		LOG.info( "Composited {} images", accumulator.numImages() );

		return accumulator.finish();
	}

	public static Image composite( final Iterable< Image > images, final TimeStackParameters params )
	{
		return composite( images, params, NormalizationObserver.NONE );
	}

	/**
	 * Splits the stack into contiguous partitions that are accumulated in
	 * parallel and merged pairwise afterwards.
	 *
	 * @param images - the stack
	 * @param params - method, nodata values and metadata policy
	 * @param numThreads - number of partitions
	 * @param observer - notified for every composited image
	 * @return the composite, identical to {@link #composite(Iterable, TimeStackParameters, NormalizationObserver)}
	 */
	public static Image compositeParallel( final List< Image > images, final TimeStackParameters params, final int numThreads, final NormalizationObserver observer )
	{
		if ( params.getMethod() == TimeStackMethod.SKIP || numThreads <= 1 || images.size() <= 1 )
			return composite( images, params, observer );

		final int numPartitions = Math.min( numThreads, images.size() );
		final ArrayList< Callable< TimeStackAccumulator > > tasks = new ArrayList<>();

		for ( int p = 0; p < numPartitions; ++p )
		{
			final int from = (int)( (long)images.size() * p / numPartitions );
			final int to = (int)( (long)images.size() * ( p + 1 ) / numPartitions );

			tasks.add( () ->
			{
				final TimeStackAccumulator accumulator = new TimeStackAccumulator( params );

				for ( int i = from; i < to; ++i )
					observer.imageComposited( i, accumulator.add( images.get( i ) ) );

				return accumulator;
			} );
		}

		List< TimeStackAccumulator > accumulators;

		try
		{
			accumulators = Threads.execTasks( tasks, numThreads, "composite time stack" );
		}
		catch ( final ExecutionException e )
		{
			final Throwable cause = Threads.rethrowUnchecked( e );
			throw new IllegalStateException( "Failed to composite time stack: " + cause, cause );
		}

		// merge neighbours until one is left, keeps the first image first
		while ( accumulators.size() > 1 )
		{
			final ArrayList< TimeStackAccumulator > merged = new ArrayList<>();

			for ( int i = 0; i < accumulators.size(); i += 2 )
			{
				if ( i + 1 < accumulators.size() )
					merged.add( accumulators.get( i ).merge( accumulators.get( i + 1 ) ) );
				else
					merged.add( accumulators.get( i ) );
			}

			accumulators = merged;
		}

		LOG.info( "Composited {} images in {} partitions", images.size(), numPartitions );

		return accumulators.get( 0 ).finish();
	}

	private static Image single( final Iterable< Image > images )
	{
		final Iterator< Image > it = images.iterator();

		if ( !it.hasNext() )
			throw new IllegalArgumentException( "The time stack contains no images." );

		final Image reference = it.next();

		if ( it.hasNext() )
			throw new IllegalArgumentException( "Compositing is skipped, the time stack must contain exactly one image." );

		return reference;
	}
}
