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

/**
 * The PIF method and the options of all strategies, only the options of the
 * chosen method are used.
 */
public class PIFParameters
{
	public static PIFMethod default_method = PIFMethod.FILTER_NODATA;

	protected PIFMethod method;
	protected PCAParameters pca;
	protected RobustParameters robust;
	protected HistogramParameters histogram;

	public PIFParameters( final PIFMethod method, final PCAParameters pca, final RobustParameters robust, final HistogramParameters histogram )
	{
		this.method = method;
		this.pca = pca;
		this.robust = robust;
		this.histogram = histogram;
	}

	public PIFParameters( final PIFMethod method )
	{
		this( method, new PCAParameters(), new RobustParameters(), new HistogramParameters() );
	}

	public PIFParameters()
	{
		this( default_method );
	}

	public PIFMethod getMethod() { return method; }
	public PCAParameters getPCAParameters() { return pca; }
	public RobustParameters getRobustParameters() { return robust; }
	public HistogramParameters getHistogramParameters() { return histogram; }

	/**
	 * @return the filter of the chosen method, null for {@link PIFMethod#SKIP}
	 */
	public PIFFilter createFilter()
	{
		switch ( method )
		{
		case FILTER_NODATA:
			return new AlphaPIFFilter();
		case FILTER_PCA:
			return new PCAPIFFilter( pca );
		case FILTER_ROBUST:
			return new RobustPIFFilter( robust );
		case FILTER_HISTOGRAM:
			return new HistogramPIFFilter( histogram );
		default:
			return null;
		}
	}
}
