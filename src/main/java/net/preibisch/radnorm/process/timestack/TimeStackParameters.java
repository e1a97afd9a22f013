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

import java.util.Arrays;

public class TimeStackParameters
{
	public static TimeStackMethod default_method = TimeStackMethod.MEAN_WITH_UNIFORM_WEIGHT;
	public static boolean require_matching_metadata = false;

	protected TimeStackMethod method;
	protected int[] nodata;
	protected boolean requireMatchingMetadata;

	/**
	 * @param method - how the images are combined
	 * @param nodata - per band a value that marks missing samples, or null if only the alpha counts
	 * @param requireMatchingMetadata - whether all images must have equal metadata
	 */
	public TimeStackParameters( final TimeStackMethod method, final int[] nodata, final boolean requireMatchingMetadata )
	{
		this.method = method;
		this.nodata = nodata == null ? null : nodata.clone();
		this.requireMatchingMetadata = requireMatchingMetadata;
	}

	public TimeStackParameters( final TimeStackMethod method )
	{
		this( method, null, require_matching_metadata );
	}

	public TimeStackParameters()
	{
		this( default_method );
	}

	public TimeStackMethod getMethod() { return method; }
	public boolean requireMatchingMetadata() { return requireMatchingMetadata; }

	public boolean hasNodata() { return nodata != null; }
	public int numNodataBands() { return nodata == null ? 0 : nodata.length; }

	/**
	 * @return the nodata value of the band, -1 if none is set
	 */
	public int getNodata( final int band ) { return nodata == null ? -1 : nodata[ band ]; }

	@Override
	public String toString()
	{
		return "TimeStackParameters[method=" + method.getName() + ", nodata=" + Arrays.toString( nodata ) + ", requireMatchingMetadata=" + requireMatchingMetadata + "]";
	}
}
