package com.useless.script.chaos;

import java.util.Random;

/**
 * Owner of the single random stream a run draws its chaos from.
 *
 * <p>A run is reproducible when its source is built from a known seed; nothing in the
 * runtime reaches for a global generator.</p>
 */
public interface RandomSource {

    Random getRandom();

    /** The seed this source was created with. */
    long getSeed();
}
