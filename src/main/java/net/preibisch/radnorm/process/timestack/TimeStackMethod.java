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

import net.preibisch.radnorm.exception.UnsupportedMethodException;

public enum TimeStackMethod
{
	SKIP( "skip", "identity" ),
	MEAN_WITH_UNIFORM_WEIGHT( "mean_with_uniform_weight" );

	private final String name;
	private final String[] aliases;

	private TimeStackMethod( final String name, final String... aliases )
	{
		this.name = name;
		this.aliases = aliases;
	}

	public String getName() { return name; }

	public static TimeStackMethod parse( final String name )
	{
		for ( final TimeStackMethod method : values() )
		{
			if ( method.name.equalsIgnoreCase( name ) )
				return method;

			for ( final String alias : method.aliases )
				if ( alias.equalsIgnoreCase( name ) )
					return method;
		}

		throw new UnsupportedMethodException( "time stack", name );
	}
}
