package net.preibisch.radnorm;

import java.util.ArrayList;
import java.util.List;

import net.preibisch.radnorm.data.AlphaMask;
import net.preibisch.radnorm.data.Image;
import net.preibisch.radnorm.data.ImageMetadata;
import net.preibisch.radnorm.data.RasterBand;

/**
 * Small synthetic images for the unit tests.
 */
public class TestImages {

	/**
	 * @param bands - per band the values of a single row image
	 * @return a fully valid image of size bands[0].length x 1
	 */
	public static Image row(final int[]... bands) {
		return row(AlphaMask.full(bands[0].length, 1), bands);
	}

	public static Image row(final AlphaMask alpha, final int[]... bands) {
		final List<RasterBand> list = new ArrayList<>();
		for (final int[] values : bands)
			list.add(RasterBand.fromValues(values, values.length, 1));
		return new Image(list, alpha);
	}

	public static Image constant(final int numBands, final int value, final int width, final int height) {
		final List<RasterBand> list = new ArrayList<>();
		for (int b = 0; b < numBands; ++b)
			list.add(RasterBand.constant(value, width, height));
		return new Image(list, AlphaMask.full(width, height));
	}

	/**
	 * 1002 pixels, candidate = reference = 100 + i for the first 1000 and two
	 * outliers (500, 800) and (600, 900) at the end.
	 */
	public static Image[] lineWithOutliers() {
		final int n = 1002;
		final int[] c = new int[n], r = new int[n];
		for (int i = 0; i < 1000; ++i) {
			c[i] = 100 + i;
			r[i] = 100 + i;
		}
		c[1000] = 500;
		r[1000] = 800;
		c[1001] = 600;
		r[1001] = 900;
		return new Image[] { row(c), row(r) };
	}

	public static ImageMetadata metadata(final double x0) {
		return new ImageMetadata(new double[] { x0, 3, 0, 100, 0, -3 }, "EPSG:32611", null);
	}

	public static int[] range(final int from, final int count, final int gain, final int offset) {
		final int[] values = new int[count];
		for (int i = 0; i < count; ++i)
			values[i] = gain * (from + i) + offset;
		return values;
	}
}
