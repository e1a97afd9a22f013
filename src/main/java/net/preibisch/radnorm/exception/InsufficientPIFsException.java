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
package net.preibisch.radnorm.exception;

import mpicbg.models.NotEnoughDataPointsException;

/**
 * Thrown when a band has fewer distinct pseudo-invariant intensity pairs than
 * needed to fit a linear transformation (at least two).
 */
public class InsufficientPIFsException extends NotEnoughDataPointsException
{
	private static final long serialVersionUID = -1873395011367294447L;

	private final int band;

	private final int numPIFs;

	public InsufficientPIFsException( final int band, final int numPIFs, final int minNumPIFs )
	{
		super( numPIFs + " distinct pseudo-invariant intensity pairs in band " + band + " are not enough to fit a transformation, at least " + minNumPIFs + " required." );
		this.band = band;
		this.numPIFs = numPIFs;
	}

	public int getBand() { return band; }
	public int getNumPIFs() { return numPIFs; }
}
