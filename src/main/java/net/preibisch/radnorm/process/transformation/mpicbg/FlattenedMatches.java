package net.preibisch.radnorm.process.transformation.mpicbg;


/**
 * Columnar storage of 1d intensity correspondences: {@code p} holds the
 * candidate intensity, {@code q} the reference intensity and {@code w} the
 * weight of every pair.
 */
public class FlattenedMatches
{
	private final int capacity;
	private final double[] p;
	private final double[] q;
	private final double[] w;

	private boolean weighted = true;

	private int position;
	private int limit;

	public FlattenedMatches( final int capacity )
	{
		this.capacity = capacity;
		p = new double[ capacity ];
		q = new double[ capacity ];
		w = new double[ capacity ];
		position = 0;
		limit = capacity;
	}

	/**
	 * Wraps existing arrays without copying.
	 *
	 * @param p - candidate intensities
	 * @param q - reference intensities
	 * @param w - weights
	 * @param weighted - whether the weights should be considered for fitting
	 */
	public FlattenedMatches( final double[] p, final double[] q, final double[] w, final boolean weighted )
	{
		if ( p.length != q.length || p.length != w.length )
			throw new IllegalArgumentException( "p, q and w must have the same length: " + p.length + ", " + q.length + ", " + w.length );

		this.capacity = p.length;
		this.p = p;
		this.q = q;
		this.w = w;
		this.weighted = weighted;
		position = 0;
		limit = capacity;
	}

	public int size()
	{
		return limit;
	}

	public int capacity()
	{
		return capacity;
	}

	public double[] p()
	{
		return p;
	}

	public double[] q()
	{
		return q;
	}

	public double[] w()
	{
		return w;
	}

	// --- weighted() ---

	/**
	 * Returns {@code true} if the weights of the matches should be considered
	 * for model fitting. Returns {@code false} if all weights are (or should be
	 * assumed) {@code =1}.
	 *
	 * @return whether weights should be considered for model fitting
	 */
	public boolean weighted()
	{
		return weighted;
	}

	/**
	 * @param weighted
	 * 		whether weights should be considered for model fitting
	 */
	public void setWeighted( final boolean weighted )
	{
		this.weighted = weighted;
	}

	// --- java.nio.Buffer-like API ---

	public void put( final double p, final double q, final double w )
	{
		this.p[ position ] = p;
		this.q[ position ] = q;
		this.w[ position ] = w;
		position++;
	}

	public void flip()
	{
		limit = position;
		position = 0;
	}

	// --- statistics ---

	/**
	 * @return the weighted mean of p and q, {@code [mean_p, mean_q]}
	 */
	public double[] weightedMeans()
	{
		double W = 0, S_p = 0, S_q = 0;

		for ( int i = 0; i < limit; ++i )
		{
			final double w_i = weighted ? w[ i ] : 1.0;
			W += w_i;
			S_p += w_i * p[ i ];
			S_q += w_i * q[ i ];
		}

		return new double[] { S_p / W, S_q / W };
	}
}
