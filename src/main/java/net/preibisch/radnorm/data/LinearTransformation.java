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
package net.preibisch.radnorm.data;

import mpicbg.models.AffineModel1D;

/**
 * Per-band radiometric correction {@code corrected = candidate * gain + offset}.
 */
public class LinearTransformation
{
	public static final LinearTransformation IDENTITY = new LinearTransformation( 1.0, 0.0 );

	private final double gain;
	private final double offset;

	public LinearTransformation( final double gain, final double offset )
	{
		this.gain = gain;
		this.offset = offset;
	}

	/**
	 * @param model - a fitted 1d affine model mapping candidate to reference intensities
	 * @return the equivalent transformation
	 */
	public static LinearTransformation fromModel( final AffineModel1D model )
	{
		final double[] m = model.getMatrix( null );
		return new LinearTransformation( m[ 0 ], m[ 1 ] );
	}

	public AffineModel1D toModel()
	{
		final AffineModel1D model = new AffineModel1D();
		model.set( gain, offset );
		return model;
	}

	public double getGain() { return gain; }
	public double getOffset() { return offset; }

	public double apply( final double value ) { return value * gain + offset; }

	@Override
	public boolean equals( final Object obj )
	{
		if ( !( obj instanceof LinearTransformation ) )
			return false;

		final LinearTransformation other = (LinearTransformation)obj;
		return Double.compare( gain, other.gain ) == 0 && Double.compare( offset, other.offset ) == 0;
	}

	@Override
	public int hashCode()
	{
		return 31 * Double.hashCode( gain ) + Double.hashCode( offset );
	}

	@Override
	public String toString()
	{
		return "LinearTransformation[gain=" + gain + ", offset=" + offset + "]";
	}
}
