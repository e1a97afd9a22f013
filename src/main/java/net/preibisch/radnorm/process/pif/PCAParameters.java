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

public class PCAParameters
{
	public static double default_limit = 30;

	protected double limit;

	/**
	 * @param limit - maximal distance of a PIF from the principal axis
	 */
	public PCAParameters( final double limit )
	{
		if ( limit < 0 )
			throw new IllegalArgumentException( "limit must not be negative: " + limit );

		this.limit = limit;
	}

	public PCAParameters()
	{
		this( default_limit );
	}

	public double getLimit() { return limit; }
}
