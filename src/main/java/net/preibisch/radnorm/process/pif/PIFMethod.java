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

import net.preibisch.radnorm.exception.UnsupportedMethodException;

public enum PIFMethod
{
	SKIP( "skip" ),
	FILTER_NODATA( "filter_nodata", "filter_alpha", "identity" ),
	FILTER_PCA( "filter_pca" ),
	FILTER_ROBUST( "filter_robust" ),
	FILTER_HISTOGRAM( "filter_histogram" );

	private final String name;
	private final String[] aliases;

	private PIFMethod( final String name, final String... aliases )
	{
		this.name = name;
		this.aliases = aliases;
	}

	public String getName() { return name; }

	/**
	 * @param name - e.g. "filter_pca" or "filter_PCA", case is ignored
	 * @return the matching method
	 * @throws UnsupportedMethodException if no method has this name
	 */
	public static PIFMethod parse( final String name )
	{
		for ( final PIFMethod method : values() )
		{
			if ( method.name.equalsIgnoreCase( name ) )
				return method;

			for ( final String alias : method.aliases )
				if ( alias.equalsIgnoreCase( name ) )
					return method;
		}

		throw new UnsupportedMethodException( "PIF", name );
	}
}
