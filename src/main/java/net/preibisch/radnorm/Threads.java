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
package net.preibisch.radnorm;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

public class Threads
{
	public static ExecutorService createFixedExecutorService( final int nThreads ) { return Executors.newFixedThreadPool( nThreads ); }

	/**
	 * Runs all tasks and waits until they are complete.
	 *
	 * @param tasks - the tasks
	 * @param taskExecutor - the executor to run them on
	 * @param jobDescription - what the tasks do, used in error messages
	 * @return the results in the order of the tasks
	 * @throws ExecutionException wrapping the first exception thrown by a task
	 */
	public static < T > List< T > execTasks( final List< Callable< T > > tasks, final ExecutorService taskExecutor, final String jobDescription ) throws ExecutionException
	{
		final List< Future< T > > futures;

		try
		{
			// invokeAll() returns when all tasks are complete
			futures = taskExecutor.invokeAll( tasks );
		}
		catch ( final InterruptedException e )
		{
			Thread.currentThread().interrupt();
			throw new IllegalStateException( "Interrupted while trying to " + jobDescription, e );
		}

		final ArrayList< T > results = new ArrayList<>( futures.size() );

		for ( final Future< T > future : futures )
		{
			try
			{
				results.add( future.get() );
			}
			catch ( final InterruptedException e )
			{
				Thread.currentThread().interrupt();
				throw new IllegalStateException( "Interrupted while trying to " + jobDescription, e );
			}
		}

		return results;
	}

	/**
	 * Runs all tasks on a fixed thread pool of the given size that is shut down afterwards.
	 */
	public static < T > List< T > execTasks( final List< Callable< T > > tasks, final int nThreads, final String jobDescription ) throws ExecutionException
	{
		final ExecutorService taskExecutor = createFixedExecutorService( Math.max( 1, Math.min( nThreads, tasks.size() ) ) );

		try
		{
			return execTasks( tasks, taskExecutor, jobDescription );
		}
		finally
		{
			taskExecutor.shutdown();
		}
	}

	/**
	 * Rethrows the cause of an {@link ExecutionException} if it is unchecked.
	 *
	 * @param e - the exception thrown by {@link Future#get()}
	 * @return the checked cause, for the caller to rethrow or wrap
	 */
	public static Throwable rethrowUnchecked( final ExecutionException e )
	{
		final Throwable cause = e.getCause() == null ? e : e.getCause();

		if ( cause instanceof RuntimeException )
			throw (RuntimeException)cause;

		if ( cause instanceof Error )
			throw (Error)cause;

		return cause;
	}
}
