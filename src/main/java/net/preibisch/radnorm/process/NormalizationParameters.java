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

import net.preibisch.radnorm.process.pif.PIFParameters;
import net.preibisch.radnorm.process.timestack.TimeStackParameters;
import net.preibisch.radnorm.process.transformation.TransformationParameters;
import net.preibisch.radnorm.process.validation.ValidationMethod;

/**
 * All options of a normalization run.
 */
public class NormalizationParameters
{
	public static int num_threads = 1;
	public static boolean require_matching_metadata = false;
	public static ValidationMethod validation_method = ValidationMethod.RMSE;

	protected TimeStackParameters timeStack;
	protected PIFParameters pif;
	protected TransformationParameters transformation;
	protected ValidationMethod validationMethod;
	protected int numThreads;
	protected boolean requireMatchingMetadata;

	/**
	 * @param timeStack - how the references are composited
	 * @param pif - how the PIFs are selected
	 * @param transformation - how the transformations are fitted
	 * @param validationMethod - how the result is scored
	 * @param numThreads - number of threads for fitting and compositing
	 * @param requireMatchingMetadata - whether candidate and reference must have equal metadata
	 */
	public NormalizationParameters(
			final TimeStackParameters timeStack,
			final PIFParameters pif,
			final TransformationParameters transformation,
			final ValidationMethod validationMethod,
			final int numThreads,
			final boolean requireMatchingMetadata )
	{
		if ( numThreads < 1 )
			throw new IllegalArgumentException( "numThreads must be at least 1, got " + numThreads );

		this.timeStack = timeStack;
		this.pif = pif;
		this.transformation = transformation;
		this.validationMethod = validationMethod;
		this.numThreads = numThreads;
		this.requireMatchingMetadata = requireMatchingMetadata;
	}

	public NormalizationParameters( final TimeStackParameters timeStack, final PIFParameters pif, final TransformationParameters transformation )
	{
		this( timeStack, pif, transformation, validation_method, num_threads, require_matching_metadata );
	}

	public NormalizationParameters()
	{
		this( new TimeStackParameters(), new PIFParameters(), new TransformationParameters() );
	}

	public TimeStackParameters getTimeStackParameters() { return timeStack; }
	public PIFParameters getPIFParameters() { return pif; }
	public TransformationParameters getTransformationParameters() { return transformation; }
	public ValidationMethod getValidationMethod() { return validationMethod; }
	public int getNumThreads() { return numThreads; }
	public boolean requireMatchingMetadata() { return requireMatchingMetadata; }
}
