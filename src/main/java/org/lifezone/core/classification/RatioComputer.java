package org.lifezone.core.classification;

import org.lifezone.core.model.FloatRaster;

/**
 * PET / осадки. Inf и NaN (нулевые осадки) здесь не маскируются:
 * они совпадают с no-data и разбираются масками.
 */
public final class RatioComputer {

    private RatioComputer() {}

    public static float ratio(float pet, float precip) {
        return pet / precip;
    }

    public static FloatRaster ratio(FloatRaster pet, FloatRaster precip) {
        pet.requireSameShape(precip, "Precipitation");
        FloatRaster out = new FloatRaster(pet.width, pet.height);
        int n = pet.cellCount();
        for (int i = 0; i < n; i++) {
            out.setAt(i, ratio(pet.getAt(i), precip.getAt(i)));
        }
        return out;
    }

    public static float[] ratio(float[] pet, float[] precip) {
        if (pet.length != precip.length) {
            throw new IllegalArgumentException("PET and precipitation buffers differ: " + pet.length + " vs " + precip.length);
        }
        float[] out = new float[pet.length];
        for (int i = 0; i < pet.length; i++) {
            out[i] = ratio(pet[i], precip[i]);
        }
        return out;
    }
}
