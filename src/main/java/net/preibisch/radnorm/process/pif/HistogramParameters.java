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
package net.preibisch.radnorm.process.pif;

public class HistogramParameters {

	public static double default_threshold = 0.1;
	public static int default_bins = 10;

	protected final double threshold;
	protected final int numberOfValidBins;
	protected final boolean roughSearch;
	protected final int bins;

	/**
	 * @param threshold - a bin is selected if its count divided by the largest count is above this value
	 * @param numberOfValidBins - if positive, this many most populous bins are selected instead and threshold is ignored
	 * @param roughSearch - select pixels inside the bounding box of all selected bins instead of the bins themselves
	 * @param bins - number of bins along each axis
	 */
	public HistogramParameters(final double threshold, final int numberOfValidBins, final boolean roughSearch, final int bins) {

		if (bins < 1)
			throw new IllegalArgumentException("at least one bin per axis is required, got " + bins);

		if (numberOfValidBins < 0)
			throw new IllegalArgumentException("numberOfValidBins must not be negative: " + numberOfValidBins);

		this.threshold = threshold;
		this.numberOfValidBins = numberOfValidBins;
		this.roughSearch = roughSearch;
		this.bins = bins;
	}

	public HistogramParameters() {
		this(default_threshold, 0, false, default_bins);
	}

	public static HistogramParameters topBins(final int numberOfValidBins, final boolean roughSearch) {
		return new HistogramParameters(default_threshold, numberOfValidBins, roughSearch, default_bins);
	}

	public double getThreshold() { return threshold; }
	public int getNumberOfValidBins() { return numberOfValidBins; }
	public boolean isRoughSearch() { return roughSearch; }
	public int getBins() { return bins; }
	public boolean selectsTopBins() { return numberOfValidBins > 0; }
}
