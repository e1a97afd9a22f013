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

import net.preibisch.radnorm.exception.ShapeMismatchException;
import net.preibisch.radnorm.process.transformation.mpicbg.FlattenedMatches;

/**
 * The pseudo-invariant pixels of a candidate/reference pair in columnar form:
 * for every selected pixel i its weight, and per band its reference and
 * candidate intensity. Pixels are stored in flat index order.
 */
public class PIFSet
{
	final double[] weight;
	final double[][] reference;
	final double[][] candidate;

	public PIFSet( final double[] weight, final double[][] reference, final double[][] candidate )
	{
		if ( reference.length != candidate.length )
			throw new ShapeMismatchException( "Reference has " + reference.length + " bands, candidate " + candidate.length );

		for ( int b = 0; b < reference.length; ++b )
			if ( reference[ b ].length != weight.length || candidate[ b ].length != weight.length )
				throw new ShapeMismatchException( "Band " + b + " does not hold " + weight.length + " samples." );

		this.weight = weight;
		this.reference = reference;
		this.candidate = candidate;
	}

	/**
	 * Collects the intensities of all pixels selected by the mask.
	 *
	 * @param mask - the PIF mask, its values are the weights
	 * @param reference - the reference image
	 * @param candidate - the candidate image
	 * @return the columnar PIF set
	 */
	public static PIFSet extract( final PIFMask mask, final Image reference, final Image candidate )
	{
		Image.requireComparable( reference, candidate );

		if ( !mask.sameShape( reference.alpha() ) )
			throw new ShapeMismatchException( "PIF mask is " + mask.shapeString() + ", images are " + reference.alpha().shapeString() );

		final int numBands = reference.numBands();
		final int n = (int)mask.numSelected();

		final double[] weight = new double[ n ];
		final double[][] ref = new double[ numBands ][ n ];
		final double[][] cand = new double[ numBands ][ n ];

		int j = 0;

		for ( int i = 0; i < mask.numPixels(); ++i )
		{
			if ( !mask.isSelected( i ) )
				continue;

			weight[ j ] = mask.weight( i );

			for ( int b = 0; b < numBands; ++b )
			{
				ref[ b ][ j ] = reference.band( b ).get( i );
				cand[ b ][ j ] = candidate.band( b ).get( i );
			}

			++j;
		}

		return new PIFSet( weight, ref, cand );
	}

	public int size() { return weight.length; }
	public int numBands() { return reference.length; }

	public double weight( final int i ) { return weight[ i ]; }
	public double reference( final int band, final int i ) { return reference[ band ][ i ]; }
	public double candidate( final int band, final int i ) { return candidate[ band ][ i ]; }

	/**
	 * @return true if all weights are equal, the fit is then unweighted
	 */
	public boolean uniformWeights()
	{
		for ( int i = 1; i < weight.length; ++i )
			if ( weight[ i ] != weight[ 0 ] )
				return false;

		return true;
	}

	/**
	 * Candidate to reference correspondences of one band, backed by the arrays of this set.
	 *
	 * @param band - the band index
	 * @return p = candidate, q = reference, w = weight
	 */
	public FlattenedMatches matches( final int band )
	{
		return new FlattenedMatches( candidate[ band ], reference[ band ], weight, !uniformWeights() );
	}

	@Override
	public String toString()
	{
		return "PIFSet[" + size() + " pixels, " + numBands() + " bands]";
	}
}
