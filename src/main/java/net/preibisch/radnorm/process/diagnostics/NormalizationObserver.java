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
package net.preibisch.radnorm.process.diagnostics;

import net.preibisch.radnorm.data.LinearTransformation;

/**
 * Receives diagnostic events of the normalization stages. All methods do
 * nothing by default. Implementations must be thread safe, bands are
 * processed in parallel if more than one thread is configured.
 */
public interface NormalizationObserver
{
	public static final NormalizationObserver NONE = new NormalizationObserver() {};

	/**
	 * @param band - band index
	 * @param numValid - pixels valid in candidate and reference
	 * @param numPIFs - pixels selected by the PIF filter
	 */
	default void pifsSelected( final int band, final long numValid, final long numPIFs ) {}

	/**
	 * Pearson correlation between candidate and reference of one band on all
	 * valid pixels and on the selected PIFs (NaN if undefined).
	 */
	default void correlation( final int band, final double before, final double after ) {}

	default void transformationFitted( final int band, final LinearTransformation transformation ) {}

	/**
	 * A fit was not well defined and a fallback was used instead.
	 *
	 * @param stage - e.g. "filter_pca" or "moment_linear"
	 * @param band - band index
	 * @param reason - human readable reason
	 */
	default void degenerateFit( final String stage, final int band, final String reason ) {}

	default void imageComposited( final int index, final long numValid ) {}
}
