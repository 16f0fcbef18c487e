package org.lifezone.core.model;

/**
 * Разложенный код классификации: 1000*vegClass + 100*altBand + 10*latBand + ecotone.
 */
public record LifeZoneCode(int vegClass, int altBand, int latBand, int ecotone) {

    public int toCode() {
        return 1000 * vegClass + 100 * altBand + 10 * latBand + ecotone;
    }

    public static LifeZoneCode fromCode(int code) {
        return new LifeZoneCode(
                code / 1000,
                (code % 1000) / 100,
                (code % 100) / 10,
                code % 10
        );
    }
}
