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
package net.preibisch.radnorm.process.lut;

import mpicbg.models.AffineModel1D;
import net.imglib2.converter.Converter;
import net.imglib2.type.numeric.integer.UnsignedShortType;
import net.imglib2.type.numeric.real.DoubleType;
import net.preibisch.radnorm.data.LinearTransformation;

/**
 * Applies a linear intensity transformation without clipping or rounding.
 */
public class LinearIntensityConverter implements Converter< UnsignedShortType, DoubleType >
{
	final double m00, m01;

	public LinearIntensityConverter( final AffineModel1D intensityTransform )
	{
		final double[] m = new double[ 2 ];

		intensityTransform.getMatrix( m );
		this.m00 = m[ 0 ];
		this.m01 = m[ 1 ];
	}

	public LinearIntensityConverter( final LinearTransformation transformation )
	{
		this( transformation.toModel() );
	}

	@Override
	public void convert( final UnsignedShortType input, final DoubleType output )
	{
		output.set( apply( input.get() ) );
	}

	final public double apply( final double l )
	{
		return l * m00 + m01;
	}
}
