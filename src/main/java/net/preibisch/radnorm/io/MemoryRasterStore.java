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
package net.preibisch.radnorm.io;

import java.nio.file.NoSuchFileException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.preibisch.radnorm.data.Image;

/**
 * Keeps images in memory under their path, images are immutable and are
 * stored without copying.
 */
public class MemoryRasterStore implements RasterStore
{
	private static final Logger LOG = LoggerFactory.getLogger( MemoryRasterStore.class );

	final ConcurrentHashMap< String, Image > images = new ConcurrentHashMap<>();

	@Override
	public Image load( final String path ) throws NoSuchFileException
	{
		final Image image = images.get( path );

		if ( image == null )
			throw new NoSuchFileException( path );

		LOG.debug( "loaded {} from {}", image, path );

		return image;
	}

	@Override
	public void save( final Image image, final String path )
	{
		images.put( path, image );

		LOG.debug( "saved {} to {}", image, path );
	}

	public boolean contains( final String path ) { return images.containsKey( path ); }

	public Set< String > paths() { return images.keySet(); }
}
