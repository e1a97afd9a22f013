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

import net.preibisch.radnorm.process.transformation.mpicbg.RANSACParameters;

public class RobustParameters
{
	public static double default_threshold = 1000;

	protected double threshold;
	protected RANSACParameters ransac;

	/**
	 * @param threshold - maximal perpendicular distance of a PIF from the robust line
	 * @param ransac - parameters of the robust line fit
	 */
	public RobustParameters( final double threshold, final RANSACParameters ransac )
	{
		this.threshold = threshold;
		this.ransac = ransac;
	}

	public RobustParameters()
	{
		this( default_threshold, new RANSACParameters() );
	}

	public double getThreshold() { return threshold; }
	public RANSACParameters getRansacParameters() { return ransac; }
}
