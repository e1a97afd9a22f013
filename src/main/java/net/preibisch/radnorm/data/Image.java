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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import net.preibisch.radnorm.exception.ShapeMismatchException;

/**
 * An in-memory multi-band raster: an ordered list of bands of one shape, one
 * alpha mask shared by all bands and opaque georeferencing metadata. Band
 * order is significant and has to agree between images that are compared.
 */
public class Image
{
	final List< RasterBand > bands;
	final AlphaMask alpha;
	final ImageMetadata metadata;

	public Image( final List< RasterBand > bands, final AlphaMask alpha, final ImageMetadata metadata )
	{
		if ( bands == null || bands.isEmpty() )
			throw new IllegalArgumentException( "An image needs at least one band." );

		final RasterBand first = bands.get( 0 );

		for ( int b = 1; b < bands.size(); ++b )
			if ( !bands.get( b ).sameShape( first ) )
				throw new ShapeMismatchException( "Band " + b + " is " + bands.get( b ).shapeString() + ", band 0 is " + first.shapeString() );

		if ( !alpha.sameShape( first ) )
			throw new ShapeMismatchException( "Alpha is " + alpha.shapeString() + ", bands are " + first.shapeString() );

		this.bands = Collections.unmodifiableList( new ArrayList<>( bands ) );
		this.alpha = alpha;
		this.metadata = metadata == null ? ImageMetadata.EMPTY : metadata;
	}

	public Image( final List< RasterBand > bands, final AlphaMask alpha )
	{
		this( bands, alpha, ImageMetadata.EMPTY );
	}

	public int numBands() { return bands.size(); }
	public RasterBand band( final int b ) { return bands.get( b ); }
	public List< RasterBand > bands() { return bands; }
	public AlphaMask alpha() { return alpha; }
	public ImageMetadata metadata() { return metadata; }

	public int width() { return alpha.width(); }
	public int height() { return alpha.height(); }
	public int numPixels() { return alpha.numPixels(); }

	/**
	 * @param newBands - bands replacing the bands of this image
	 * @return a new image with the given bands, this alpha and metadata
	 */
	public Image withBands( final List< RasterBand > newBands )
	{
		return new Image( newBands, alpha, metadata );
	}

	public Image withAlpha( final AlphaMask newAlpha )
	{
		return new Image( bands, newAlpha, metadata );
	}

	public Image withMetadata( final ImageMetadata newMetadata )
	{
		return new Image( bands, alpha, newMetadata );
	}

	/**
	 * @param other - another image
	 * @return true if both images have the same number of bands of the same shape
	 */
	public boolean isComparable( final Image other )
	{
		return numBands() == other.numBands() && alpha.sameShape( other.alpha );
	}

	/**
	 * Fails fast if two images cannot take part in the same operation.
	 *
	 * @param a - first image
	 * @param b - second image
	 * @param checkMetadata - whether the metadata has to be equal as well
	 * @throws ShapeMismatchException if band count, band shape or (if requested) metadata differ
	 */
	public static void requireComparable( final Image a, final Image b, final boolean checkMetadata )
	{
		if ( a.numBands() != b.numBands() )
			throw new ShapeMismatchException( "Images have a different number of bands: " + a.numBands() + " vs " + b.numBands() );

		if ( !a.alpha.sameShape( b.alpha ) )
			throw new ShapeMismatchException( "Images have a different size: " + a.alpha.shapeString() + " vs " + b.alpha.shapeString() );

		if ( checkMetadata && !a.metadata.equals( b.metadata ) )
			throw new ShapeMismatchException( "Images have different metadata: " + a.metadata + " vs " + b.metadata );
	}

	public static void requireComparable( final Image a, final Image b )
	{
		requireComparable( a, b, false );
	}

	@Override
	public String toString()
	{
		return "Image[" + numBands() + " bands, " + alpha.shapeString() + "]";
	}
}
