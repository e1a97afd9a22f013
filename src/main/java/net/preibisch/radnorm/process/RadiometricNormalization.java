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
package net.preibisch.radnorm.process;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.preibisch.radnorm.data.Image;
import net.preibisch.radnorm.data.LinearTransformation;
import net.preibisch.radnorm.data.LookupTable;
import net.preibisch.radnorm.data.PIFMask;
import net.preibisch.radnorm.data.PIFSet;
import net.preibisch.radnorm.exception.InsufficientPIFsException;
import net.preibisch.radnorm.exception.ShapeMismatchException;
import net.preibisch.radnorm.io.RasterStore;
import net.preibisch.radnorm.process.diagnostics.LoggingObserver;
import net.preibisch.radnorm.process.diagnostics.NormalizationObserver;
import net.preibisch.radnorm.process.lut.LookupTables;
import net.preibisch.radnorm.process.pif.PIFSelection;
import net.preibisch.radnorm.process.timestack.TimeStack;
import net.preibisch.radnorm.process.transformation.TransformationFitting;
import net.preibisch.radnorm.process.validation.Validation;

/**
 * Normalizes a candidate image to a reference: composites the reference from
 * a time stack, selects the pseudo-invariant pixels, fits one linear
 * transformation per band and applies it through lookup tables.
 */
public class RadiometricNormalization
{
	private static final Logger LOG = LoggerFactory.getLogger( RadiometricNormalization.class );

	final NormalizationParameters params;
	final NormalizationObserver observer;

	public RadiometricNormalization( final NormalizationParameters params, final NormalizationObserver observer )
	{
		this.params = params;
		this.observer = observer;
	}

	public RadiometricNormalization( final NormalizationParameters params )
	{
		this( params, new LoggingObserver() );
	}

	public NormalizationParameters getParameters() { return params; }

	/**
	 * Composites the images one after the other, each image is only needed
	 * while it is added.
	 */
	public Image generateReference( final Iterable< Image > images )
	{
		return TimeStack.composite( images, params.getTimeStackParameters(), observer );
	}

	/**
	 * Composites images that are all in memory, in parallel if more than one
	 * thread is requested.
	 */
	public Image generateReference( final List< Image > images )
	{
		if ( params.getNumThreads() > 1 )
			return TimeStack.compositeParallel( images, params.getTimeStackParameters(), params.getNumThreads(), observer );

		return TimeStack.composite( images, params.getTimeStackParameters(), observer );
	}

	public PIFMask generatePIFs( final Image reference, final Image candidate )
	{
		Image.requireComparable( reference, candidate, params.requireMatchingMetadata() );

		return PIFSelection.generate( reference, candidate, params.getPIFParameters(), observer );
	}

	public List< LinearTransformation > generateTransformations( final Image reference, final Image candidate, final PIFMask pifs ) throws InsufficientPIFsException
	{
		Image.requireComparable( reference, candidate, params.requireMatchingMetadata() );

		final PIFSet pifSet = PIFSet.extract( pifs, reference, candidate );

		LOG.info( "Fitting {} bands on {} PIFs", pifSet.numBands(), pifSet.size() );

		return TransformationFitting.generate( pifSet, params.getTransformationParameters(), params.getNumThreads(), observer );
	}

	public List< LookupTable > generateLUTs( final List< LinearTransformation > transformations )
	{
		return LookupTables.build( transformations );
	}

	public Image applyLUTs( final Image image, final List< LookupTable > luts )
	{
		return LookupTables.apply( image, luts );
	}

	public Image applyTransformations( final Image image, final List< LinearTransformation > transformations )
	{
		return LookupTables.applyTransformations( image, transformations );
	}

	public double validate( final Image a, final Image b )
	{
		return Validation.score( a, b, params.getValidationMethod() );
	}

	/**
	 * Normalizes the candidate to the composite of the references.
	 *
	 * @param candidate - the image to correct
	 * @param references - the time stack of references
	 * @return the corrected candidate, with the alpha and metadata of the candidate
	 * @throws InsufficientPIFsException if a band has too few PIFs
	 * @throws ShapeMismatchException if a reference differs from the candidate in band count or size, before it is composited
	 */
	public Image normalize( final Image candidate, final Iterable< Image > references ) throws InsufficientPIFsException
	{
		return normalizeTo( candidate, generateReference( requireComparable( candidate, references ) ) );
	}

	/**
	 * Normalizes the candidate to the composite of the references, all
	 * references are checked against the candidate before compositing starts.
	 *
	 * @param candidate - the image to correct
	 * @param references - the time stack of references
	 * @return the corrected candidate, with the alpha and metadata of the candidate
	 * @throws InsufficientPIFsException if a band has too few PIFs
	 * @throws ShapeMismatchException if a reference differs from the candidate in band count or size
	 */
	public Image normalize( final Image candidate, final List< Image > references ) throws InsufficientPIFsException
	{
		for ( final Image image : references )
			Image.requireComparable( candidate, image );

		return normalizeTo( candidate, generateReference( references ) );
	}

	private Image normalizeTo( final Image candidate, final Image reference ) throws InsufficientPIFsException
	{
		final PIFMask pifs = generatePIFs( reference, candidate );
		final List< LinearTransformation > transformations = generateTransformations( reference, candidate, pifs );

		return applyLUTs( candidate, generateLUTs( transformations ) );
	}

	/**
	 * Loads candidate and references from the store, normalizes the candidate
	 * and saves it under the output path.
	 *
	 * @return the per band transformations
	 * @throws IOException if the store fails to load or save
	 * @throws InsufficientPIFsException if a band has too few PIFs
	 * @throws ShapeMismatchException if a reference differs from the candidate in band count or size, before it is composited
	 */
	public List< LinearTransformation > normalize(
			final RasterStore store,
			final String candidatePath,
			final List< String > referencePaths,
			final String outputPath ) throws IOException, InsufficientPIFsException
	{
		final Image candidate = store.load( candidatePath );

		final Image reference;

		try
		{
			reference = generateReference( requireComparable( candidate, lazy( store, referencePaths ) ) );
		}
		catch ( final UncheckedIOException e )
		{
			throw e.getCause();
		}

		final PIFMask pifs = generatePIFs( reference, candidate );
		final List< LinearTransformation > transformations = generateTransformations( reference, candidate, pifs );
		final Image corrected = applyTransformations( candidate, transformations );

		store.save( corrected, outputPath );

		LOG.info( "Normalized {} to {} references, saved as {}", candidatePath, referencePaths.size(), outputPath );

		return transformations;
	}

	/**
	 * @return the images, each checked against the candidate when it is iterated
	 */
	static Iterable< Image > requireComparable( final Image candidate, final Iterable< Image > images )
	{
		return () -> new Iterator< Image >()
		{
			final Iterator< Image > it = images.iterator();

			@Override
			public boolean hasNext()
			{
				return it.hasNext();
			}

			@Override
			public Image next()
			{
				final Image image = it.next();
				Image.requireComparable( candidate, image );
				return image;
			}
		};
	}

	/**
	 * @return the images of the store, each loaded when it is iterated
	 */
	static Iterable< Image > lazy( final RasterStore store, final List< String > paths )
	{
		return () -> new Iterator< Image >()
		{
			final Iterator< String > it = new ArrayList<>( paths ).iterator();

			@Override
			public boolean hasNext()
			{
				return it.hasNext();
			}

			@Override
			public Image next()
			{
				final String path = it.next();

				try
				{
					return store.load( path );
				}
				catch ( final IOException e )
				{
					throw new UncheckedIOException( e );
				}
			}
		};
	}
}
