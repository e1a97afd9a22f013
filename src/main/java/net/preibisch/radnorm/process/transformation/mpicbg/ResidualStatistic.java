package net.preibisch.radnorm.process.transformation.mpicbg;

import java.util.Arrays;

/**
 * Running mean and median of absolute fit residuals.
 */
public class ResidualStatistic
{
	private final double[] values;

	private int size = 0;

	private double mean = 0;

	public ResidualStatistic( final int capacity )
	{
		values = new double[ capacity ];
	}

	/**
	 * Sorts the collected values in place.
	 *
	 * @return the median, NaN if empty
	 */
	public double getMedian()
	{
		if ( size == 0 )
			return Double.NaN;

		Arrays.sort( values, 0, size );
		final int m = size / 2;
		if ( size % 2 == 0 )
			return ( values[ m - 1 ] + values[ m ] ) / 2.0;
		else
			return values[ m ];
	}

	final public void add( final double residual )
	{
		int i = size++;
		values[ i ] = residual;

		final double delta = residual - mean;
		mean += delta / size;
	}

	public int n()
	{
		return size;
	}

	public double mean()
	{
		return mean;
	}

	public void clear()
	{
		size = 0;
		mean = 0;
	}
}
