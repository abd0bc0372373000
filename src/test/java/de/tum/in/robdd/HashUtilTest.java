/*
 * This file is part of JROBDD.
 * Copyright (c) 2023 The JROBDD authors.
 *
 * JROBDD is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JROBDD is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JROBDD. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.robdd;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThan;

import java.util.Arrays;
import java.util.Random;
import org.junit.jupiter.api.Test;

public class HashUtilTest {
    @Test
    public void testCollisionRate() {
        Random random = new Random(0);

        int iterations = 128;
        int size = 20_011;
        double[] rate = new double[iterations];
        for (int i = 0; i < iterations; i++) {
            int[] count = new int[size];
            for (int n = 0; n < size; n++) {
                int variable = random.nextInt(64);
                int low = random.nextInt(size);
                int high = random.nextInt(size);
                count[HashUtil.mod(HashUtil.hash(variable, low, high), size)] += 1;
            }
            rate[i] = Arrays.stream(count).filter(c -> c > 1).count() / (double) size;
        }
        // A uniform hash leaves about 26.4% of the buckets with more than one entry
        double average = Arrays.stream(rate).average().orElseThrow();
        assertThat(average, is(lessThan(0.28)));
    }

    @Test
    public void testModIsNonNegative() {
        assertThat(HashUtil.mod(-1, 16), is(15));
        assertThat(HashUtil.mod(Integer.MIN_VALUE, 7), is(lessThan(7)));
        assertThat(HashUtil.mod(Integer.MIN_VALUE, 7) >= 0, is(true));
        assertThat(HashUtil.mod(33, 16), is(1));
    }
}
