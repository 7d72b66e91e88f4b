// This file is part of the TeXMath Library (texmath).
//
// The TeXMath Library is free software; you can redistribute
// it and/or modify it under the terms of the GNU General Public
// License as published by the Free Software Foundation; either
// version 3 of the License, or (at your option) any later version.
//
// The TeXMath Library is distributed in the hope that it
// will be useful, but WITHOUT ANY WARRANTY; without even the
// implied warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR
// PURPOSE. See the GNU General Public License for more details.
//
// You should have received a copy of the GNU General Public
// License along with the TeXMath Library. If not, see
// <http://www.gnu.org/licenses/>
//
// Copyright 2018, David James Pearce.
package texmath.util;

/**
 * Utilities for proposing corrections to misspelled names.
 *
 * @author David J. Pearce
 */
public class Suggestions {

	/**
	 * Compute the Levenshtein distance between two strings.
	 *
	 * @param a
	 * @param b
	 * @return
	 */
	public static int editDistance(String a, String b) {
		int[] prev = new int[b.length() + 1];
		int[] curr = new int[b.length() + 1];
		for (int j = 0; j <= b.length(); ++j) {
			prev[j] = j;
		}
		for (int i = 1; i <= a.length(); ++i) {
			curr[0] = i;
			for (int j = 1; j <= b.length(); ++j) {
				int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
				curr[j] = Math.min(Math.min(curr[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
			}
			int[] tmp = prev;
			prev = curr;
			curr = tmp;
		}
		return prev[b.length()];
	}

	/**
	 * Find the candidate closest to a given name, provided it lies within a
	 * maximum edit distance. Ties are broken by iteration order.
	 *
	 * @param name
	 * @param candidates
	 * @param maxDistance
	 * @return The closest candidate, or null if none is close enough.
	 */
	public static String closest(String name, Iterable<String> candidates, int maxDistance) {
		String best = null;
		int bestDistance = Integer.MAX_VALUE;
		for (String candidate : candidates) {
			int d = editDistance(name, candidate);
			if (d <= maxDistance && d < bestDistance) {
				best = candidate;
				bestDistance = d;
			}
		}
		return best;
	}
}
