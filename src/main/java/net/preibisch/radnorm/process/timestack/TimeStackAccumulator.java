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

import java.util.ArrayList;

import net.preibisch.radnorm.data.AlphaMask;
import net.preibisch.radnorm.data.Image;
import net.preibisch.radnorm.data.ImageMetadata;
import net.preibisch.radnorm.data.RasterBand;
import net.preibisch.radnorm.exception.ShapeMismatchException;

/**
 * Per band the sum and the number of valid samples of every pixel. The
 * grids are allocated for the first image, every further image has to match
 * its band count and size. An accumulator can absorb another one and is
 * finished exactly once.
 */
public class TimeStackAccumulator
{
	final TimeStackParameters params;

	double[][] sum;
	int[][] frequency;

	int numBands, width, height;
	ImageMetadata metadata;
	int numImages = 0;
	boolean finished = false;

	public TimeStackAccumulator( final TimeStackParameters params )
	{
		this.params = params;
	}

	public int numImages() { return numImages; }
	public boolean isEmpty() { return numImages == 0; }

	/**
	 * @param image - the next image of the stack
	 * @return the number of pixels of the image that are valid in all bands
	 * @throws ShapeMismatchException if the image does not match the previous ones
	 */
	public long add( final Image image )
	{
		requireNotFinished();

		if ( sum == null )
			init( image );
		else
			requireMatching( image.numBands(), image.width(), image.height(), image.metadata() );

		final AlphaMask alpha = image.alpha();
		final int n = alpha.numPixels();

		for ( int b = 0; b < numBands; ++b )
		{
			final RasterBand band = image.band( b );
			final double[] s = sum[ b ];
			final int[] f = frequency[ b ];
			final int nodata = params.getNodata( b );

			for ( int i = 0; i < n; ++i )
			{
				if ( alpha.isValid( i ) )
				{
					final int v = band.get( i );

					if ( v != nodata )
					{
						s[ i ] += v;
						++f[ i ];
					}
				}
			}
		}

		++numImages;

		long numValid = 0;

		for ( int i = 0; i < n; ++i )
		{
			if ( !alpha.isValid( i ) )
				continue;

			boolean valid = true;
			for ( int b = 0; b < numBands && valid; ++b )
				valid = image.band( b ).get( i ) != params.getNodata( b );

			if ( valid )
				++numValid;
		}

		return numValid;
	}

	/**
	 * Adds the sums and frequencies of another accumulator to this one.
	 *
	 * @param other - an accumulator over other images, it must not be used afterwards
	 * @return this accumulator
	 */
	public TimeStackAccumulator merge( final TimeStackAccumulator other )
	{
		requireNotFinished();

		if ( other.sum == null )
			return this;

		if ( sum == null )
		{
			numBands = other.numBands;
			width = other.width;
			height = other.height;
			metadata = other.metadata;
			sum = other.sum;
			frequency = other.frequency;
			numImages = other.numImages;
			return this;
		}

		requireMatching( other.numBands, other.width, other.height, other.metadata );

		for ( int b = 0; b < numBands; ++b )
		{
			final double[] s = sum[ b ], so = other.sum[ b ];
			final int[] f = frequency[ b ], fo = other.frequency[ b ];

			for ( int i = 0; i < s.length; ++i )
			{
				s[ i ] += so[ i ];
				f[ i ] += fo[ i ];
			}
		}

		numImages += other.numImages;

		return this;
	}

	/**
	 * The mean of every pixel over the images where it is valid, truncated to
	 * an integer, 0 where it was never valid. A pixel of the composite is valid
	 * if it was valid at least once in every band.
	 *
	 * @return the composite image
	 */
	public Image finish()
	{
		requireNotFinished();

		if ( sum == null )
			throw new IllegalStateException( "Cannot composite an empty time stack." );

		finished = true;

		final int n = width * height;
		final ArrayList< RasterBand > bands = new ArrayList<>( numBands );
		final boolean[] valid = new boolean[ n ];

		for ( int i = 0; i < n; ++i )
			valid[ i ] = true;

		for ( int b = 0; b < numBands; ++b )
		{
			final short[] out = new short[ n ];
			final double[] s = sum[ b ];
			final int[] f = frequency[ b ];

			for ( int i = 0; i < n; ++i )
			{
				if ( f[ i ] > 0 )
					out[ i ] = (short)(int)( s[ i ] / f[ i ] );
				else
					valid[ i ] = false;
			}

			bands.add( new RasterBand( out, width, height ) );
		}

		// release the grids
		sum = null;
		frequency = null;

		final ImageMetadata out = params.requireMatchingMetadata() ? metadata : ImageMetadata.EMPTY;

		return new Image( bands, AlphaMask.fromBooleans( valid, width, height ), out );
	}

	private void init( final Image image )
	{
		numBands = image.numBands();
		width = image.width();
		height = image.height();
		metadata = image.metadata();

		if ( params.hasNodata() && params.numNodataBands() != numBands )
			throw new ShapeMismatchException( "Image has " + numBands + " bands, but " + params.numNodataBands() + " nodata values are given" );

		sum = new double[ numBands ][ width * height ];
		frequency = new int[ numBands ][ width * height ];
	}

	private void requireMatching( final int numBands, final int width, final int height, final ImageMetadata metadata )
	{
		if ( numBands != this.numBands )
			throw new ShapeMismatchException( "Image has " + numBands + " bands, the time stack " + this.numBands );

		if ( width != this.width || height != this.height )
			throw new ShapeMismatchException( "Image is " + width + "x" + height + ", the time stack " + this.width + "x" + this.height );

		if ( params.requireMatchingMetadata() && !this.metadata.equals( metadata ) )
			throw new ShapeMismatchException( "Image metadata " + metadata + " differs from the time stack metadata " + this.metadata );
	}

	private void requireNotFinished()
	{
		if ( finished )
			throw new IllegalStateException( "The time stack has already been finished." );
	}
}
