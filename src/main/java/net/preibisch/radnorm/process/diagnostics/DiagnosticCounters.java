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

import java.util.concurrent.atomic.AtomicLong;

import net.preibisch.radnorm.data.LinearTransformation;

/**
 * Counts the events of a normalization run, safe to share between threads.
 */
public class DiagnosticCounters implements NormalizationObserver
{
	final AtomicLong numValid = new AtomicLong();
	final AtomicLong numPIFs = new AtomicLong();
	final AtomicLong numTransformations = new AtomicLong();
	final AtomicLong numDegenerateFits = new AtomicLong();
	final AtomicLong numComposited = new AtomicLong();

	@Override
	public void pifsSelected( final int band, final long numValid, final long numPIFs )
	{
		this.numValid.addAndGet( numValid );
		this.numPIFs.addAndGet( numPIFs );
	}

	@Override
	public void transformationFitted( final int band, final LinearTransformation transformation )
	{
		numTransformations.incrementAndGet();
	}

	@Override
	public void degenerateFit( final String stage, final int band, final String reason )
	{
		numDegenerateFits.incrementAndGet();
	}

	@Override
	public void imageComposited( final int index, final long numValid )
	{
		numComposited.incrementAndGet();
	}

	public long getNumValid() { return numValid.get(); }
	public long getNumPIFs() { return numPIFs.get(); }
	public long getNumTransformations() { return numTransformations.get(); }
	public long getNumDegenerateFits() { return numDegenerateFits.get(); }
	public long getNumComposited() { return numComposited.get(); }

	@Override
	public String toString()
	{
		return "valid=" + getNumValid() + ", pifs=" + getNumPIFs() + ", transformations=" + getNumTransformations() +
				", degenerate=" + getNumDegenerateFits() + ", composited=" + getNumComposited();
	}
}
