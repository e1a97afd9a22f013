package net.preibisch.radnorm.process.transformation.mpicbg;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;

import java.util.Random;

import org.junit.Test;

import mpicbg.models.IllDefinedDataPointsException;
import mpicbg.models.NotEnoughDataPointsException;

public class FastAffineModel1DTest {

	private static FlattenedMatches line(final int n, final double gain, final double offset) {
		final FlattenedMatches matches = new FlattenedMatches(n);
		for (int i = 0; i < n; ++i)
			matches.put(i, gain * i + offset, 1.0);
		matches.flip();
		matches.setWeighted(false);
		return matches;
	}

	@Test
	public void testExactFit() throws Exception {
		final FastAffineModel1D model = new FastAffineModel1D();
		model.fit(line(50, 2, 5));
		assertEquals(2, model.gain(), 1e-12);
		assertEquals(5, model.offset(), 1e-9);
		assertEquals(25, model.apply(10), 1e-9);
	}

	@Test
	public void testWeightedFit() throws Exception {
		// the heavy points lie on y = x, the light one pulls the unweighted fit away
		final double[] p = { 0, 1, 2, 3 };
		final double[] q = { 0, 1, 2, 30 };
		final double[] w = { 1000, 1000, 1000, 0.001 };

		final FastAffineModel1D weighted = new FastAffineModel1D();
		weighted.fit(new FlattenedMatches(p, q, w, true));
		assertEquals(1, weighted.gain(), 1e-3);

		final FastAffineModel1D unweighted = new FastAffineModel1D();
		unweighted.fit(new FlattenedMatches(p, q, w, false));
		assertEquals(9.1, unweighted.gain(), 1e-9);
	}

	@Test(expected = IllDefinedDataPointsException.class)
	public void testConstantCandidate() throws Exception {
		new FastAffineModel1D().fit(new FlattenedMatches(new double[] { 3, 3, 3 }, new double[] { 1, 2, 3 }, new double[] { 1, 1, 1 }, false));
	}

	@Test(expected = NotEnoughDataPointsException.class)
	public void testSingleMatch() throws Exception {
		new FastAffineModel1D().fit(line(1, 1, 0));
	}

	@Test
	public void testRansacIgnoresOutliers() throws Exception {
		final FlattenedMatches matches = new FlattenedMatches(110);
		for (int i = 0; i < 100; ++i)
			matches.put(i, 3 * i + 7, 1.0);
		for (int i = 0; i < 10; ++i)
			matches.put(i * 10, 2000 + i, 1.0);
		matches.flip();
		matches.setWeighted(false);

		final FastAffineModel1D model = new FastAffineModel1D();
		final MatchIndices inliers = model.fastFilterRansac(matches, new Random(344), 1000, 5, 0.1, 10, 3.0);

		assertNotNull(inliers);
		assertEquals(100, inliers.size());
		assertEquals(3, model.gain(), 1e-9);
		assertEquals(7, model.offset(), 1e-6);
	}

	@Test
	public void testRansacWithoutConsensus() throws Exception {
		final FlattenedMatches matches = new FlattenedMatches(new double[] { 0, 1, 2, 3 }, new double[] { 0, 100, 0, 100 }, new double[] { 1, 1, 1, 1 }, false);
		final FastAffineModel1D model = new FastAffineModel1D();
		assertNull(model.fastFilterRansac(matches, new Random(1), 100, 1, 0.1, 3, 3.0));
		assertEquals(1, model.gain(), 0);
		assertEquals(0, model.offset(), 0);
	}
}
