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

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Georeferencing information of an {@link Image} (affine geotransform,
 * projection string and RPC tags). The normalization only forwards it, it is
 * written back by the raster store.
 */
public class ImageMetadata
{
	public static final ImageMetadata EMPTY = new ImageMetadata( null, null, null );

	private final double[] geoTransform;
	private final String projection;
	private final Map< String, String > rpc;

	/**
	 * @param geoTransform - six affine coefficients or null if not georeferenced
	 * @param projection - projection string or null
	 * @param rpc - RPC tag block or null
	 */
	public ImageMetadata( final double[] geoTransform, final String projection, final Map< String, String > rpc )
	{
		this.geoTransform = geoTransform == null ? null : geoTransform.clone();
		this.projection = projection;
		this.rpc = rpc == null ? Collections.emptyMap() : Collections.unmodifiableMap( new LinkedHashMap<>( rpc ) );
	}

	public double[] getGeoTransform() { return geoTransform == null ? null : geoTransform.clone(); }
	public String getProjection() { return projection; }
	public Map< String, String > getRpc() { return rpc; }

	public boolean isEmpty()
	{
		return geoTransform == null && projection == null && rpc.isEmpty();
	}

	@Override
	public boolean equals( final Object obj )
	{
		if ( this == obj )
			return true;

		if ( !( obj instanceof ImageMetadata ) )
			return false;

		final ImageMetadata other = (ImageMetadata)obj;

		return Arrays.equals( geoTransform, other.geoTransform ) &&
				Objects.equals( projection, other.projection ) &&
				rpc.equals( other.rpc );
	}

	@Override
	public int hashCode()
	{
		return Objects.hash( Arrays.hashCode( geoTransform ), projection, rpc );
	}

	@Override
	public String toString()
	{
		return "ImageMetadata[geoTransform=" + Arrays.toString( geoTransform ) + ", projection=" + projection + ", rpc=" + rpc.size() + " tags]";
	}
}
