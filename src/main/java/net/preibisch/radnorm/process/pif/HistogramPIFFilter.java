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

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.preibisch.radnorm.data.AlphaMask;
import net.preibisch.radnorm.data.PIFMask;
import net.preibisch.radnorm.data.RasterBand;
import net.preibisch.radnorm.process.diagnostics.NormalizationObserver;

/**
 * Selects the pixels that fall into the populous bins of the joint 2d
 * histogram of (candidate, reference). Bins span [min, max] of each axis in
 * equal steps, the maximum falls into the last bin. A pixel on the border of
 * two bins belongs to both.
 */
public class HistogramPIFFilter implements PIFFilter {

	private static final Logger LOG = LoggerFactory.getLogger(HistogramPIFFilter.class);

	final HistogramParameters params;

	public HistogramPIFFilter(final HistogramParameters params) {
		this.params = params;
	}

	public HistogramPIFFilter() {
		this(new HistogramParameters());
	}

	@Override
	public PIFMask filter(final int band, final RasterBand candidate, final RasterBand reference, final AlphaMask combinedAlpha, final NormalizationObserver observer) {

		final int n = combinedAlpha.numPixels();
		final boolean[] selected = new boolean[n];

		int cMin = Integer.MAX_VALUE, cMax = Integer.MIN_VALUE, rMin = Integer.MAX_VALUE, rMax = Integer.MIN_VALUE;
		long numValid = 0;

		for (int i = 0; i < n; ++i) {
			if (combinedAlpha.isValid(i)) {
				final int c = candidate.get(i), r = reference.get(i);
				cMin = Math.min(cMin, c);
				cMax = Math.max(cMax, c);
				rMin = Math.min(rMin, r);
				rMax = Math.max(rMax, r);
				++numValid;
			}
		}

		if (numValid == 0)
			return PIFMask.fromBooleans(selected, combinedAlpha.width(), combinedAlpha.height());

		final int bins = params.getBins();
		final double[] cEdges = edges(cMin, cMax, bins);
		final double[] rEdges = edges(rMin, rMax, bins);

		final long[][] histogram = new long[bins][bins];

		for (int i = 0; i < n; ++i)
			if (combinedAlpha.isValid(i))
				++histogram[binIndex(candidate.get(i), cEdges)][binIndex(reference.get(i), rEdges)];

		final boolean[][] passed = params.selectsTopBins() ? topBins(histogram, params.getNumberOfValidBins()) : thresholdBins(histogram, params.getThreshold());

		LOG.debug("band {}: {} of {} bins passed", band, count(passed), bins * bins);

		if (params.isRoughSearch()) {
			final double[] range = validRange(passed, cEdges, rEdges);

			LOG.debug("band {}: valid range candidate=({}, {}), reference=({}, {})", band, range[0], range[1], range[2], range[3]);

			for (int i = 0; i < n; ++i) {
				if (combinedAlpha.isValid(i)) {
					final int c = candidate.get(i), r = reference.get(i);
					selected[i] = c >= range[0] && c <= range[1] && r >= range[2] && r <= range[3];
				}
			}
		} else {
			for (int i = 0; i < n; ++i)
				if (combinedAlpha.isValid(i))
					selected[i] = inPassedBin(candidate.get(i), reference.get(i), cEdges, rEdges, passed);
		}

		return PIFMask.fromBooleans(selected, combinedAlpha.width(), combinedAlpha.height());
	}

	static double[] edges(final double min, final double max, final int bins) {

		double lo = min, hi = max;

		if (lo == hi) {
			lo -= 0.5;
			hi += 0.5;
		}

		final double[] edges = new double[bins + 1];
		final double step = (hi - lo) / bins;

		for (int k = 0; k <= bins; ++k)
			edges[k] = lo + k * step;

		edges[bins] = hi;

		return edges;
	}

	/**
	 * @return the bin containing value, the last bin includes its upper edge
	 */
	static int binIndex(final double value, final double[] edges) {

		final int bins = edges.length - 1;
		int k = (int) ((value - edges[0]) / (edges[bins] - edges[0]) * bins);

		k = Math.max(0, Math.min(bins - 1, k));

		while (k > 0 && value < edges[k])
			--k;

		while (k < bins - 1 && value >= edges[k + 1])
			++k;

		return k;
	}

	static boolean[][] thresholdBins(final long[][] histogram, final double threshold) {

		long max = 0;
		for (final long[] row : histogram)
			for (final long count : row)
				max = Math.max(max, count);

		final boolean[][] passed = new boolean[histogram.length][histogram.length];

		for (int ci = 0; ci < histogram.length; ++ci)
			for (int ri = 0; ri < histogram.length; ++ri)
				passed[ci][ri] = max > 0 && (double) histogram[ci][ri] / max > threshold;

		return passed;
	}

	/**
	 * Selects the k most populous bins, among bins of equal count the one with
	 * the lower flat index {@code ci * bins + ri} wins.
	 */
	static boolean[][] topBins(final long[][] histogram, final int k) {

		final int bins = histogram.length;
		final List<Integer> order = new ArrayList<>();

		for (int flat = 0; flat < bins * bins; ++flat)
			order.add(flat);

		// stable sort, ties keep ascending flat index
		order.sort((a, b) -> Long.compare(histogram[b / bins][b % bins], histogram[a / bins][a % bins]));

		final boolean[][] passed = new boolean[bins][bins];

		for (int j = 0; j < Math.min(k, order.size()); ++j)
			passed[order.get(j) / bins][order.get(j) % bins] = true;

		return passed;
	}

	static boolean inPassedBin(final double c, final double r, final double[] cEdges, final double[] rEdges, final boolean[][] passed) {

		final int ci = binIndex(c, cEdges);
		final int ri = binIndex(r, rEdges);

		// a value on the lower edge of its bin is also on the upper edge of the previous one
		final int ciLow = ci > 0 && c == cEdges[ci] ? ci - 1 : ci;
		final int riLow = ri > 0 && r == rEdges[ri] ? ri - 1 : ri;

		for (int x = ciLow; x <= ci; ++x)
			for (int y = riLow; y <= ri; ++y)
				if (passed[x][y])
					return true;

		return false;
	}

	/**
	 * @return {cMin, cMax, rMin, rMax}, the bounding box of all passed bins
	 */
	static double[] validRange(final boolean[][] passed, final double[] cEdges, final double[] rEdges) {

		double cLo = Double.POSITIVE_INFINITY, cHi = Double.NEGATIVE_INFINITY;
		double rLo = Double.POSITIVE_INFINITY, rHi = Double.NEGATIVE_INFINITY;

		for (int ci = 0; ci < passed.length; ++ci) {
			for (int ri = 0; ri < passed.length; ++ri) {
				if (passed[ci][ri]) {
					cLo = Math.min(cLo, cEdges[ci]);
					cHi = Math.max(cHi, cEdges[ci + 1]);
					rLo = Math.min(rLo, rEdges[ri]);
					rHi = Math.max(rHi, rEdges[ri + 1]);
				}
			}
		}

		return new double[] { cLo, cHi, rLo, rHi };
	}

	private static int count(final boolean[][] passed) {
		int count = 0;
		for (final boolean[] row : passed)
			for (final boolean p : row)
				if (p)
					++count;
		return count;
	}
}
