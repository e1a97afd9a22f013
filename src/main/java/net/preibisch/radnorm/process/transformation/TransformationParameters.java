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

import net.preibisch.radnorm.process.transformation.mpicbg.RANSACParameters;

public class TransformationParameters
{
	public static TransformationMethod default_method = TransformationMethod.MOMENT_LINEAR;

	protected TransformationMethod method;
	protected RANSACParameters ransac;

	public TransformationParameters( final TransformationMethod method, final RANSACParameters ransac )
	{
		this.method = method;
		this.ransac = ransac;
	}

	public TransformationParameters( final TransformationMethod method )
	{
		this( method, new RANSACParameters() );
	}

	public TransformationParameters()
	{
		this( default_method );
	}

	public TransformationMethod getMethod() { return method; }
	public RANSACParameters getRansacParameters() { return ransac; }
}
