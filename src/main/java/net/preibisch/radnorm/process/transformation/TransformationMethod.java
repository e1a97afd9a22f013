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

import net.preibisch.radnorm.exception.UnsupportedMethodException;
import net.preibisch.radnorm.process.transformation.mpicbg.RANSACParameters;

public enum TransformationMethod
{
	SKIP( "skip" ),
	MOMENT_LINEAR( "moment_linear", "linear_relationship", "linear_transformation" ),
	OLS_LINEAR( "ols_linear" ),
	ROBUST_LINEAR( "robust_linear" );

	private final String name;
	private final String[] aliases;

	private TransformationMethod( final String name, final String... aliases )
	{
		this.name = name;
		this.aliases = aliases;
	}

	public String getName() { return name; }

	/**
	 * @param ransac - only used by {@link #ROBUST_LINEAR}
	 * @return the fitter of this method, null for {@link #SKIP}
	 */
	public TransformationFitter createFitter( final RANSACParameters ransac )
	{
		switch ( this )
		{
		case MOMENT_LINEAR:
			return new MomentLinearFitter();
		case OLS_LINEAR:
			return new OLSLinearFitter();
		case ROBUST_LINEAR:
			return new RobustLinearFitter( ransac );
		default:
			return null;
		}
	}

	public static TransformationMethod parse( final String name )
	{
		for ( final TransformationMethod method : values() )
		{
			if ( method.name.equalsIgnoreCase( name ) )
				return method;

			for ( final String alias : method.aliases )
				if ( alias.equalsIgnoreCase( name ) )
					return method;
		}

		throw new UnsupportedMethodException( "transformation", name );
	}
}
